package com.ryuqq.fleet.core.statemachine;

/**
 * JobInstance의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING
 *    │ (Dispatcher: 즉시 / 예약 시각 도달)
 *    ▼
 * QUEUED
 *    │ (에이전트 폴링 시 원자적 claim)
 *    ▼
 * RUNNING
 *    │
 *    ├─► SUCCESS   (exit_code == 0 보고)
 *    ├─► FAILED    (exit_code != 0 보고, 재시도 예약 시 PENDING으로 복귀 가능)
 *    ├─► CANCELLED (관리자 취소)
 *    └─► EXPIRED   (timeout_seconds 내 보고 없음)
 *
 * PENDING / QUEUED 에서도 CANCELLED, EXPIRED(expires_at 경과)로 전이 가능
 * </pre>
 *
 * <p><strong>EXPIRED와 FAILED의 구분:</strong> FAILED는 "알려진 나쁜 결과",
 * EXPIRED는 "응답 없음"을 의미하므로 별도 종료 상태로 유지합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum JobInstanceState implements LifecycleState {

    /**
     * 생성됨, 아직 디스패치 대상 아님.
     */
    PENDING("pending"),

    /**
     * 디스패치 가능 (에이전트 claim 대기).
     */
    QUEUED("queued"),

    /**
     * 에이전트가 claim하여 실행 중.
     */
    RUNNING("running"),

    /**
     * 성공 (종료).
     */
    SUCCESS("success"),

    /**
     * 실패 (종료, 단 재시도가 예약된 경우 PENDING으로 복귀).
     */
    FAILED("failed"),

    /**
     * 관리자 취소 (종료).
     */
    CANCELLED("cancelled"),

    /**
     * 시간 내 응답 없음 (종료).
     */
    EXPIRED("expired");

    private final String wireValue;

    JobInstanceState(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED || this == CANCELLED || this == EXPIRED;
    }

    /**
     * 에이전트가 작업을 점유 중인 상태인지 확인.
     *
     * <p>(job_id, node_id) 당 최대 하나만 이 상태에 있을 수 있습니다.</p>
     *
     * @return QUEUED 또는 RUNNING이면 true
     */
    public boolean isActive() {
        return this == QUEUED || this == RUNNING;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }

    /**
     * wire 값으로부터 상태 조회.
     *
     * @param value wire 값 (예: "running")
     * @return JobInstanceState
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static JobInstanceState fromWire(String value) {
        for (JobInstanceState state : values()) {
            if (state.wireValue.equals(value)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown job instance status: " + value);
    }
}
