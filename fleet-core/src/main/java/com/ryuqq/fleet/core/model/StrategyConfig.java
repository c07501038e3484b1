package com.ryuqq.fleet.core.model;

/**
 * 롤아웃 전략 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>batchSize: 배치 크기 (STAGED / CANARY 이후 배치, 기본 10)</li>
 *   <li>delayMinutes: 이전 배치 릴리스 이후 다음 배치까지 최소 대기 시간 (기본 0)</li>
 *   <li>canarySize: 카나리 배치 크기 (CANARY 전용, 기본 1)</li>
 *   <li>failureThresholdPercent: 배치 실패율이 이 값을 <em>초과</em>하면 배포를 PAUSED로 중단
 *       (기본 0 = 배치 내 하나라도 실패하면 중단)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param batchSize 배치 크기 (1 이상)
 * @param delayMinutes 배치 간 지연 (분, 0 이상)
 * @param canarySize 카나리 배치 크기 (1 이상)
 * @param failureThresholdPercent 중단 임계 실패율 (0~100)
 */
public record StrategyConfig(
    int batchSize,
    long delayMinutes,
    int canarySize,
    int failureThresholdPercent
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: batchSize=10, delayMinutes=0, canarySize=1, failureThresholdPercent=0</p>
     */
    public StrategyConfig() {
        this(10, 0, 1, 0);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public StrategyConfig {
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
        if (delayMinutes < 0) {
            throw new IllegalArgumentException(
                "delayMinutes must be non-negative (current: " + delayMinutes + ")"
            );
        }
        if (canarySize <= 0) {
            throw new IllegalArgumentException(
                "canarySize must be positive (current: " + canarySize + ")"
            );
        }
        if (failureThresholdPercent < 0 || failureThresholdPercent > 100) {
            throw new IllegalArgumentException(
                "failureThresholdPercent must be between 0 and 100 (current: " + failureThresholdPercent + ")"
            );
        }
    }

    /**
     * 배치 크기와 지연만 지정한 STAGED용 설정.
     *
     * @param batchSize 배치 크기
     * @param delayMinutes 배치 간 지연 (분)
     * @return StrategyConfig
     */
    public static StrategyConfig staged(int batchSize, long delayMinutes) {
        return new StrategyConfig(batchSize, delayMinutes, 1, 0);
    }

    public StrategyConfig withBatchSize(int batchSize) {
        return new StrategyConfig(batchSize, delayMinutes, canarySize, failureThresholdPercent);
    }

    public StrategyConfig withDelayMinutes(long delayMinutes) {
        return new StrategyConfig(batchSize, delayMinutes, canarySize, failureThresholdPercent);
    }

    public StrategyConfig withCanarySize(int canarySize) {
        return new StrategyConfig(batchSize, delayMinutes, canarySize, failureThresholdPercent);
    }

    public StrategyConfig withFailureThresholdPercent(int failureThresholdPercent) {
        return new StrategyConfig(batchSize, delayMinutes, canarySize, failureThresholdPercent);
    }
}
