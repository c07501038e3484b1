package com.ryuqq.fleet.core.model;

import com.ryuqq.fleet.core.statemachine.DeploymentState;
import com.ryuqq.fleet.core.statemachine.StateTransition;

import java.time.Instant;

/**
 * 단계적 소프트웨어 롤아웃 의도 (Deployment).
 *
 * <p>노드별 진행은 {@link DeploymentStatus}에 있고, 이 레코드는 컨트롤러 상태와
 * 롤아웃 진행 기록(bookkeeping)만 보관합니다.</p>
 *
 * <p><strong>배치 릴리스:</strong> 각 DeploymentStatus는 생성 시점에 batchIndex가 고정되며,
 * releasedBatch 이하의 배치에 속한 행만 ACTIVE 상태에서 에이전트에게 전달됩니다.
 * 배치 릴리스는 이 레코드 하나에 대한 조건부 갱신이므로 두 컨트롤러가 같은 배치를
 * 동시에 진행시킬 수 없습니다.</p>
 *
 * <p><strong>중단 확인:</strong> 관리자가 중단된 배포를 재개하면 해당 배치 번호가
 * acknowledgedHaltBatch에 기록되어 같은 배치 결과로 다시 중단되지 않습니다.</p>
 *
 * @param deploymentId Deployment ID
 * @param name 이름
 * @param packageRef 패키지 참조
 * @param target 대상 선택자
 * @param mode 배포 모드
 * @param strategy 롤아웃 전략
 * @param strategyConfig 전략 설정
 * @param scheduledStart 시작 예정 시각 (null이면 즉시)
 * @param scheduledEnd 종료 시각 (null이면 없음)
 * @param maintenanceWindowOnly 유지보수 창 안에서만 릴리스/전달
 * @param state 컨트롤러 상태
 * @param releasedBatch 릴리스된 마지막 배치 번호 (-1이면 없음)
 * @param batchReleasedAt 마지막 배치 릴리스 시각
 * @param acknowledgedHaltBatch 재개로 확인된 중단 배치 번호 (-1이면 없음)
 * @param haltReason 중단 사유 (PAUSED일 때)
 * @param createdAt 생성 시각
 * @param version 낙관적 잠금 버전
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Deployment(
    DeploymentId deploymentId,
    String name,
    PackageReference packageRef,
    TargetSelector target,
    DeploymentMode mode,
    RolloutStrategy strategy,
    StrategyConfig strategyConfig,
    Instant scheduledStart,
    Instant scheduledEnd,
    boolean maintenanceWindowOnly,
    DeploymentState state,
    int releasedBatch,
    Instant batchReleasedAt,
    int acknowledgedHaltBatch,
    String haltReason,
    Instant createdAt,
    long version
) {

    public static final int NONE = -1;

    public Deployment {
        if (deploymentId == null) {
            throw new IllegalArgumentException("deploymentId cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (packageRef == null) {
            throw new IllegalArgumentException("packageRef cannot be null");
        }
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (mode == null || strategy == null || state == null) {
            throw new IllegalArgumentException("mode, strategy and state cannot be null");
        }
        if (strategyConfig == null) {
            strategyConfig = new StrategyConfig();
        }
        if (scheduledStart != null && scheduledEnd != null && !scheduledEnd.isAfter(scheduledStart)) {
            throw new IllegalArgumentException(
                "scheduledEnd must be after scheduledStart (scheduledStart: " + scheduledStart + ", scheduledEnd: " + scheduledEnd + ")"
            );
        }
        if (releasedBatch < NONE || acknowledgedHaltBatch < NONE) {
            throw new IllegalArgumentException(
                "batch numbers must be >= -1 (releasedBatch: " + releasedBatch + ", acknowledgedHaltBatch: " + acknowledgedHaltBatch + ")"
            );
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
    }

    /**
     * PENDING 상태의 새 Deployment 생성.
     *
     * @param name 이름
     * @param packageRef 패키지
     * @param target 대상
     * @param mode 모드
     * @param strategy 전략
     * @param strategyConfig 전략 설정 (null이면 기본값)
     * @param createdAt 생성 시각
     * @return 새 Deployment
     */
    public static Deployment create(String name, PackageReference packageRef, TargetSelector target,
                                    DeploymentMode mode, RolloutStrategy strategy, StrategyConfig strategyConfig,
                                    Instant createdAt) {
        return new Deployment(DeploymentId.newId(), name, packageRef, target, mode, strategy, strategyConfig,
            null, null, false, DeploymentState.PENDING, NONE, null, NONE, null, createdAt, 0);
    }

    public Deployment withSchedule(Instant start, Instant end) {
        return new Deployment(deploymentId, name, packageRef, target, mode, strategy, strategyConfig,
            start, end, maintenanceWindowOnly, state, releasedBatch, batchReleasedAt, acknowledgedHaltBatch,
            haltReason, createdAt, version);
    }

    public Deployment withMaintenanceWindowOnly(boolean windowOnly) {
        return new Deployment(deploymentId, name, packageRef, target, mode, strategy, strategyConfig,
            scheduledStart, scheduledEnd, windowOnly, state, releasedBatch, batchReleasedAt, acknowledgedHaltBatch,
            haltReason, createdAt, version);
    }

    public Deployment withVersion(long newVersion) {
        return new Deployment(deploymentId, name, packageRef, target, mode, strategy, strategyConfig,
            scheduledStart, scheduledEnd, maintenanceWindowOnly, state, releasedBatch, batchReleasedAt,
            acknowledgedHaltBatch, haltReason, createdAt, newVersion);
    }

    /**
     * 생성 순서상 position번째 대상이 속할 배치 번호.
     *
     * <ul>
     *   <li>IMMEDIATE: 항상 0</li>
     *   <li>STAGED: position / batchSize</li>
     *   <li>CANARY: 앞의 canarySize개는 0, 이후 batchSize 단위로 1부터</li>
     * </ul>
     *
     * @param position 0부터 시작하는 대상 순번
     * @return 배치 번호
     */
    public int batchIndexOf(int position) {
        if (position < 0) {
            throw new IllegalArgumentException("position must be non-negative (current: " + position + ")");
        }
        return switch (strategy) {
            case IMMEDIATE -> 0;
            case STAGED -> position / strategyConfig.batchSize();
            case CANARY -> position < strategyConfig.canarySize()
                ? 0
                : 1 + (position - strategyConfig.canarySize()) / strategyConfig.batchSize();
        };
    }

    /**
     * PENDING → ACTIVE.
     */
    public Deployment activate() {
        return withState(StateTransition.transition(state, DeploymentState.ACTIVE), haltReason, acknowledgedHaltBatch);
    }

    /**
     * 다음 배치 릴리스 (ACTIVE 상태에서만).
     *
     * @param now 릴리스 시각
     * @return releasedBatch가 1 증가한 Deployment
     */
    public Deployment releaseNextBatch(Instant now) {
        if (state != DeploymentState.ACTIVE) {
            throw new IllegalStateException("Cannot release a batch while " + state + ": " + deploymentId);
        }
        return new Deployment(deploymentId, name, packageRef, target, mode, strategy, strategyConfig,
            scheduledStart, scheduledEnd, maintenanceWindowOnly, state, releasedBatch + 1, now,
            acknowledgedHaltBatch, haltReason, createdAt, version);
    }

    /**
     * ACTIVE → PAUSED (롤아웃 중단).
     *
     * @param reason 중단 사유
     */
    public Deployment halt(String reason) {
        return withState(StateTransition.transition(state, DeploymentState.PAUSED), reason, acknowledgedHaltBatch);
    }

    /**
     * PAUSED → ACTIVE. 현재 릴리스된 배치의 중단을 확인 처리합니다.
     */
    public Deployment resume() {
        return withState(StateTransition.transition(state, DeploymentState.ACTIVE), null, releasedBatch);
    }

    /**
     * ACTIVE → COMPLETED.
     */
    public Deployment complete() {
        return withState(StateTransition.transition(state, DeploymentState.COMPLETED), haltReason, acknowledgedHaltBatch);
    }

    /**
     * 비종료 상태 → CANCELLED.
     */
    public Deployment cancel() {
        return withState(StateTransition.transition(state, DeploymentState.CANCELLED), haltReason, acknowledgedHaltBatch);
    }

    /**
     * 시작 예정 시각이 도래했는지 확인.
     */
    public boolean isStartDue(Instant now) {
        return scheduledStart == null || !now.isBefore(scheduledStart);
    }

    /**
     * 배포 기간이 끝났는지 확인.
     */
    public boolean isPastScheduledEnd(Instant now) {
        return scheduledEnd != null && now.isAfter(scheduledEnd);
    }

    /**
     * 해당 배치의 중단이 이미 재개로 확인되었는지.
     */
    public boolean isHaltAcknowledged(int batchIndex) {
        return acknowledgedHaltBatch >= batchIndex;
    }

    /**
     * 노드별 행이 에이전트에게 전달 가능한지 확인.
     *
     * @param status 노드별 행
     * @return ACTIVE이고 행의 배치가 릴리스되었으면 true
     */
    public boolean isEligible(DeploymentStatus status) {
        return state == DeploymentState.ACTIVE && status.batchIndex() <= releasedBatch;
    }

    private Deployment withState(DeploymentState next, String reason, int acknowledged) {
        return new Deployment(deploymentId, name, packageRef, target, mode, strategy, strategyConfig,
            scheduledStart, scheduledEnd, maintenanceWindowOnly, next, releasedBatch, batchReleasedAt,
            acknowledged, reason, createdAt, version);
    }
}
