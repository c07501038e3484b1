package com.ryuqq.fleet.application.gateway;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 에이전트에게 전달되는 Job 작업 (poll 응답).
 *
 * @param instanceId 인스턴스 ID (결과 보고 시 사용)
 * @param jobId Job ID
 * @param commandType 명령 유형
 * @param commandPayload 명령 본문 (JSON 텍스트)
 * @param timeoutSeconds 실행 제한 시간 (초)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PendingJob(
    @JsonProperty("instance_id") String instanceId,
    @JsonProperty("job_id") String jobId,
    @JsonProperty("command_type") String commandType,
    @JsonProperty("command_payload") String commandPayload,
    @JsonProperty("timeout_seconds") int timeoutSeconds
) {
}
