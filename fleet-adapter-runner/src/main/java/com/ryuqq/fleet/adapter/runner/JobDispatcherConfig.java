package com.ryuqq.fleet.adapter.runner;

/**
 * JobDispatcher 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 스캔 주기 (기본 5000ms)</li>
 *   <li>batchSize: 한 번에 처리할 인스턴스 수 (기본 100)</li>
 * </ul>
 *
 * <p>스캔 주기는 예약되지 않은 Job이 큐에 들어가기까지의 최대 지연이기도 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param scanIntervalMs 스캔 주기 (밀리초, 양수여야 함)
 * @param batchSize 배치 크기 (1 이상이어야 함)
 */
public record JobDispatcherConfig(
    long scanIntervalMs,
    int batchSize
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: scanIntervalMs=5000ms, batchSize=100</p>
     */
    public JobDispatcherConfig() {
        this(5000, 100);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public JobDispatcherConfig {
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

    public JobDispatcherConfig withScanIntervalMs(long scanIntervalMs) {
        return new JobDispatcherConfig(scanIntervalMs, batchSize);
    }

    public JobDispatcherConfig withBatchSize(int batchSize) {
        return new JobDispatcherConfig(scanIntervalMs, batchSize);
    }
}
