package com.ryuqq.fleet.core.statemachine;

/**
 * 노드별 작업 단위의 생명주기 상태 공통 계약.
 *
 * <p>JobInstance와 DeploymentStatus는 동일한
 * {@code 대기 → 진행 → 종료} 형태를 공유합니다. 이 인터페이스는 두 상태 머신이
 * 공통으로 노출하는 최소 계약(종료 여부, 영속/전송 값)을 정의합니다.</p>
 *
 * <p><strong>wireValue 호환성:</strong> 저장소와 에이전트가 비트 단위로 의존하는 값이므로
 * 절대 변경하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface LifecycleState {

    /**
     * 종료 상태인지 확인.
     *
     * @return 종료 상태이면 true
     */
    boolean isTerminal();

    /**
     * 영속/전송 시 사용하는 소문자 문자열 값.
     *
     * @return wire 값 (예: "pending")
     */
    String wireValue();
}
