/**
 * Runner Adapter Layer - control plane runtime.
 *
 * <p>이 패키지는 에이전트 게이트웨이와 주기 Sweep의 구체적인 구현체들을 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fleet.adapter.runner.DefaultAgentGateway} - poll/report 처리, 원자적 claim</li>
 *   <li>{@link com.ryuqq.fleet.adapter.runner.JobDispatcher} - PENDING → QUEUED, 재시도 복귀</li>
 *   <li>{@link com.ryuqq.fleet.adapter.runner.JobReaper} - 응답 없는 인스턴스 만료</li>
 *   <li>{@link com.ryuqq.fleet.adapter.runner.RolloutController} - 배치 릴리스, 중단, 완료</li>
 *   <li>{@link com.ryuqq.fleet.adapter.runner.LivenessMonitor} - 오프라인 노드 감지</li>
 *   <li>{@link com.ryuqq.fleet.adapter.runner.SweepScheduler} - Sweep 주기 실행</li>
 *   <li>{@link com.ryuqq.fleet.adapter.runner.ControlPlane} - 조립 지점</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (DefaultAgentGateway, Sweeps, ControlPlane)
 *   ↓ implements
 * application (AgentGateway, Sweep, services)
 *   ↓ depends on
 * core (model, state machines, Outcome, store SPI)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.fleet.adapter.runner;
