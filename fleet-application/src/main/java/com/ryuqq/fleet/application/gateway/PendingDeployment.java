package com.ryuqq.fleet.application.gateway;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 에이전트에게 전달되는 배포 작업 (poll 응답).
 *
 * <p>command는 모드에 따라 설치 인자 또는 제거 인자입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PendingDeployment(
    @JsonProperty("deployment_status_id") String statusId,
    @JsonProperty("deployment_id") String deploymentId,
    @JsonProperty("mode") String mode,
    @JsonProperty("maintenance_window_only") boolean maintenanceWindowOnly,
    @JsonProperty("package_name") String packageName,
    @JsonProperty("package_version") String packageVersion,
    @JsonProperty("installer_type") String installerType,
    @JsonProperty("installer_url") String installerUrl,
    @JsonProperty("install_args") String installArgs,
    @JsonProperty("uninstall_args") String uninstallArgs,
    @JsonProperty("expected_hash") String expectedHash,
    @JsonProperty("command") String command
) {
}
