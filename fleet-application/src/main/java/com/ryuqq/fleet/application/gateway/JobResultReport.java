package com.ryuqq.fleet.application.gateway;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 에이전트가 보고하는 Job 실행 결과.
 *
 * @param instanceId 인스턴스 ID
 * @param exitCode 종료 코드 (0 = 성공, 필수)
 * @param stdout 표준 출력 (null 허용)
 * @param stderr 표준 오류 (null 허용)
 * @param durationMs 실행 시간 (null 허용)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record JobResultReport(
    @JsonProperty("instance_id") String instanceId,
    @JsonProperty("exit_code") Integer exitCode,
    @JsonProperty("stdout") String stdout,
    @JsonProperty("stderr") String stderr,
    @JsonProperty("duration_ms") Long durationMs
) {

    public JobResultReport {
        if (instanceId == null || instanceId.isBlank()) {
            throw new IllegalArgumentException("instanceId cannot be null or blank");
        }
        if (exitCode == null) {
            throw new IllegalArgumentException("exitCode cannot be null");
        }
    }

    public boolean isSuccess() {
        return exitCode.intValue() == 0;
    }
}
