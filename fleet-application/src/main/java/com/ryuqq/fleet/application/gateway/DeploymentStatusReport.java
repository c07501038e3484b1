package com.ryuqq.fleet.application.gateway;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 에이전트가 보고하는 배포 진행/결과.
 *
 * @param statusId 행 ID
 * @param status wire 상태 값 (downloading, installing, success, failed)
 * @param exitCode 종료 코드 (null 허용)
 * @param output 출력 (null 허용)
 * @param errorMessage 오류 메시지 (null 허용)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record DeploymentStatusReport(
    @JsonProperty("deployment_status_id") String statusId,
    @JsonProperty("status") String status,
    @JsonProperty("exit_code") Integer exitCode,
    @JsonProperty("output") String output,
    @JsonProperty("error_message") String errorMessage
) {

    public DeploymentStatusReport {
        if (statusId == null || statusId.isBlank()) {
            throw new IllegalArgumentException("statusId cannot be null or blank");
        }
        if (status == null || status.isBlank()) {
            throw new IllegalArgumentException("status cannot be null or blank");
        }
    }
}
