package com.ryuqq.fleet.adapter.runner;

import java.util.concurrent.ThreadLocalRandom;

/**
 * JobInstance 재시도 간격 계산기 (Exponential Backoff with Jitter).
 *
 * <p>같은 Job이 여러 노드에서 동시에 실패해도 재시도가 한 시점에 몰리지 않도록
 * 노드마다 무작위 jitter를 더합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(baseDelay * 2^(attempt-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (기본값 baseDelay=30s, maxDelay=1h, jitterFactor=0.1):</strong></p>
 * <ul>
 *   <li>attempt=1 실패: 30-33초 후 2번째 시도</li>
 *   <li>attempt=2 실패: 60-66초 후 3번째 시도</li>
 *   <li>attempt=8 실패: 3840초 → 1시간으로 제한</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: baseDelay=30000ms, maxDelay=3600000ms, jitterFactor=0.1</p>
     */
    public BackoffCalculator() {
        this(30000, 3600000, 0.1);
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 첫 재시도 지연 (밀리초, 양수)
     * @param maxDelayMs 최대 지연 (밀리초, baseDelayMs 이상)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
    }

    /**
     * 실패한 시도 이후의 재시도 지연 계산.
     *
     * @param failedAttempt 방금 실패한 시도 번호 (1부터)
     * @return 지연 (밀리초)
     * @throws IllegalArgumentException failedAttempt가 양수가 아닌 경우
     */
    public long calculate(int failedAttempt) {
        if (failedAttempt <= 0) {
            throw new IllegalArgumentException(
                "failedAttempt must be positive (current: " + failedAttempt + ")"
            );
        }
        // 시프트 overflow 방지
        int shift = Math.min(failedAttempt - 1, 30);
        long exponential = Math.min(baseDelayMs * (1L << shift), maxDelayMs);
        long jitter = (long) (exponential * jitterFactor * ThreadLocalRandom.current().nextDouble());
        return Math.min(exponential + jitter, maxDelayMs);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
