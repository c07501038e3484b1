package com.ryuqq.fleet.adapter.runner;

/**
 * LivenessMonitor 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 스캔 주기 (기본 60000ms = 1분)</li>
 *   <li>offlineThresholdMs: 마지막 체크인 이후 오프라인으로 판단하기까지의 시간 (기본 300000ms = 5분)</li>
 *   <li>batchSize: 한 번에 검사할 노드 수 (기본 500)</li>
 * </ul>
 *
 * <p>임계값은 연속 미응답 횟수만큼 늘어나므로, 계속 응답하지 않는 노드는 임계값마다
 * 한 번씩만 카운터가 증가합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param scanIntervalMs 스캔 주기 (밀리초, 양수여야 함)
 * @param offlineThresholdMs 오프라인 임계값 (밀리초, 양수여야 함)
 * @param batchSize 배치 크기 (1 이상이어야 함)
 */
public record LivenessMonitorConfig(
    long scanIntervalMs,
    long offlineThresholdMs,
    int batchSize
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: scanIntervalMs=60000ms, offlineThresholdMs=300000ms, batchSize=500</p>
     */
    public LivenessMonitorConfig() {
        this(60000, 300000, 500);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public LivenessMonitorConfig {
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "scanIntervalMs must be positive (current: " + scanIntervalMs + ")"
            );
        }
        if (offlineThresholdMs <= 0) {
            throw new IllegalArgumentException(
                "offlineThresholdMs must be positive (current: " + offlineThresholdMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
    }

    public LivenessMonitorConfig withScanIntervalMs(long scanIntervalMs) {
        return new LivenessMonitorConfig(scanIntervalMs, offlineThresholdMs, batchSize);
    }

    public LivenessMonitorConfig withOfflineThresholdMs(long offlineThresholdMs) {
        return new LivenessMonitorConfig(scanIntervalMs, offlineThresholdMs, batchSize);
    }

    public LivenessMonitorConfig withBatchSize(int batchSize) {
        return new LivenessMonitorConfig(scanIntervalMs, offlineThresholdMs, batchSize);
    }
}
