package com.ryuqq.fleet.core.statemachine;

/**
 * Deployment 전체의 컨트롤러 상태.
 *
 * <p>이 값은 Rollout Controller(및 관리자의 취소/재개 요청)만 변경합니다.
 * 노드별 진행 상황은 DeploymentStatus에 있으며, 집계 상태는 Progress Aggregator가
 * 매번 새로 계산합니다.</p>
 *
 * <pre>
 * PENDING ──► ACTIVE ◄──► PAUSED
 *               │
 *               └──► COMPLETED
 * (비종료 상태) ──► CANCELLED
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum DeploymentState implements LifecycleState {

    PENDING("pending"),
    ACTIVE("active"),
    PAUSED("paused"),
    COMPLETED("completed"),
    CANCELLED("cancelled");

    private final String wireValue;

    DeploymentState(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }

    /**
     * wire 값으로부터 상태 조회.
     *
     * @param value wire 값
     * @return DeploymentState
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static DeploymentState fromWire(String value) {
        for (DeploymentState state : values()) {
            if (state.wireValue.equals(value)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown deployment state: " + value);
    }
}
