package com.ryuqq.fleet.application.progress;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Job 또는 Deployment의 집계 상태 (매번 새로 계산, 저장하지 않음).
 *
 * @param label 전체 상태 라벨
 * @param total 전체 행 수
 * @param counts wire 상태 값별 행 수 (모든 상태 포함, 0 허용, 상태 정의 순서)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Progress(String label, int total, Map<String, Integer> counts) {

    public Progress {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("label cannot be null or blank");
        }
        if (counts == null) {
            throw new IllegalArgumentException("counts cannot be null");
        }
        counts = Collections.unmodifiableMap(new LinkedHashMap<>(counts));
    }

    /**
     * 특정 상태의 행 수.
     *
     * @param wireStatus wire 상태 값 (예: "success")
     * @return 행 수 (알 수 없는 상태면 0)
     */
    public int count(String wireStatus) {
        return counts.getOrDefault(wireStatus, 0);
    }
}
