package com.ryuqq.fleet.adapter.runner;

/**
 * JobReaper 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 스캔 주기 (기본 30000ms = 30초)</li>
 *   <li>batchSize: 상태별로 한 번에 검사할 인스턴스 수 (기본 100)</li>
 *   <li>runningGraceMs: RUNNING 인스턴스에 timeout_seconds 외에 추가로 허용할 여유 시간 (기본 0)</li>
 * </ul>
 *
 * <p><strong>runningGraceMs 설정 가이드:</strong> 에이전트 폴링 주기가 길거나 결과 보고가
 * 네트워크 재시도로 늦게 도착하는 환경에서는 폴링 주기 정도의 여유를 두는 것이 좋습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param scanIntervalMs 스캔 주기 (밀리초, 양수여야 함)
 * @param batchSize 배치 크기 (1 이상이어야 함)
 * @param runningGraceMs 실행 타임아웃 여유 (밀리초, 0 이상이어야 함)
 */
public record JobReaperConfig(
    long scanIntervalMs,
    int batchSize,
    long runningGraceMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: scanIntervalMs=30000ms, batchSize=100, runningGraceMs=0</p>
     */
    public JobReaperConfig() {
        this(30000, 100, 0);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public JobReaperConfig {
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
        if (runningGraceMs < 0) {
            throw new IllegalArgumentException(
                "runningGraceMs must be non-negative (current: " + runningGraceMs + ")"
            );
        }
    }

    public JobReaperConfig withScanIntervalMs(long scanIntervalMs) {
        return new JobReaperConfig(scanIntervalMs, batchSize, runningGraceMs);
    }

    public JobReaperConfig withBatchSize(int batchSize) {
        return new JobReaperConfig(scanIntervalMs, batchSize, runningGraceMs);
    }

    public JobReaperConfig withRunningGraceMs(long runningGraceMs) {
        return new JobReaperConfig(scanIntervalMs, batchSize, runningGraceMs);
    }
}
