package com.ryuqq.fleet.adapter.runner;

/**
 * RolloutController 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 스캔 주기 (기본 30000ms = 30초)</li>
 *   <li>batchSize: 배포 스캔 한 페이지의 크기 (기본 50)</li>
 * </ul>
 *
 * <p>배치 간 지연(delayMinutes)은 배포별 {@code StrategyConfig}에 있으며, 실제 릴리스 시점은
 * 지연 경과 후 첫 스캔이므로 최대 scanIntervalMs만큼 늦어질 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param scanIntervalMs 스캔 주기 (밀리초, 양수여야 함)
 * @param batchSize 배치 크기 (1 이상이어야 함)
 */
public record RolloutControllerConfig(
    long scanIntervalMs,
    int batchSize
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: scanIntervalMs=30000ms, batchSize=50</p>
     */
    public RolloutControllerConfig() {
        this(30000, 50);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RolloutControllerConfig {
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "scanIntervalMs must be positive (current: " + scanIntervalMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
    }

    public RolloutControllerConfig withScanIntervalMs(long scanIntervalMs) {
        return new RolloutControllerConfig(scanIntervalMs, batchSize);
    }

    public RolloutControllerConfig withBatchSize(int batchSize) {
        return new RolloutControllerConfig(scanIntervalMs, batchSize);
    }
}
