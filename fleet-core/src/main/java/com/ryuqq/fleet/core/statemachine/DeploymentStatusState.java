package com.ryuqq.fleet.core.statemachine;

/**
 * DeploymentStatus(배포의 노드별 진행 레코드) 상태.
 *
 * <p>JobInstance 상태 머신과 동형이며, RUNNING 대신 DOWNLOADING / INSTALLING을 사용하고
 * QUEUED 단계는 Rollout Controller의 배치 릴리스(eligibility)로 대체됩니다.</p>
 *
 * <pre>
 * PENDING ──(claim)──► DOWNLOADING ──► INSTALLING ──► SUCCESS | FAILED
 *    │                      └─────────────────────────► SUCCESS | FAILED (uninstall)
 *    └──► SKIPPED (배포 기간 종료 등으로 실행되지 않음)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum DeploymentStatusState implements LifecycleState {

    PENDING("pending"),
    DOWNLOADING("downloading"),
    INSTALLING("installing"),
    SUCCESS("success"),
    FAILED("failed"),
    SKIPPED("skipped");

    private final String wireValue;

    DeploymentStatusState(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED || this == SKIPPED;
    }

    /**
     * 에이전트가 현재 처리 중인 상태인지 확인.
     *
     * @return DOWNLOADING 또는 INSTALLING이면 true
     */
    public boolean isInFlight() {
        return this == DOWNLOADING || this == INSTALLING;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }

    /**
     * wire 값으로부터 상태 조회.
     *
     * @param value wire 값 (예: "installing")
     * @return DeploymentStatusState
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static DeploymentStatusState fromWire(String value) {
        for (DeploymentStatusState state : values()) {
            if (state.wireValue.equals(value)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown deployment status: " + value);
    }
}
