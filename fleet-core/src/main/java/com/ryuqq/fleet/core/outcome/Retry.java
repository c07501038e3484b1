package com.ryuqq.fleet.core.outcome;

/**
 * 재시도가 예약된 실패.
 *
 * <p>0이 아닌 종료 코드를 보고했지만 attempt &lt; maxAttempts인 경우입니다.
 * 인스턴스는 FAILED로 기록되고 nextRetryAt 이후 같은 논리적 인스턴스의 새 시도가 시작됩니다.</p>
 *
 * @param reason 재시도 사유
 * @param attemptCount 현재까지 시도 횟수 (1 이상)
 * @param nextRetryAfterMillis 다음 재시도까지 대기 시간 (밀리초, 0 이상)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Retry(
    String reason,
    int attemptCount,
    long nextRetryAfterMillis
) implements Outcome {

    public Retry {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        if (attemptCount < 1) {
            throw new IllegalArgumentException("attemptCount must be positive (current: " + attemptCount + ")");
        }
        if (nextRetryAfterMillis < 0) {
            throw new IllegalArgumentException("nextRetryAfterMillis must be non-negative (current: " + nextRetryAfterMillis + ")");
        }
    }
}
