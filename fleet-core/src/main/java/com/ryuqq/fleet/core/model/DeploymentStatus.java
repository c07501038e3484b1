package com.ryuqq.fleet.core.model;

import com.ryuqq.fleet.core.statemachine.DeploymentStatusState;
import com.ryuqq.fleet.core.statemachine.StateTransition;

import java.time.Instant;

/**
 * Deployment의 노드별 진행 레코드.
 *
 * <p>(deploymentId, nodeId) 쌍마다 정확히 하나만 존재하며, batchIndex는 생성 시점에 고정됩니다.</p>
 *
 * @param statusId 행 ID (에이전트 wire의 deployment_status_id)
 * @param deploymentId 상위 Deployment ID
 * @param nodeId 대상 노드 ID
 * @param state 현재 상태
 * @param batchIndex 롤아웃 배치 번호
 * @param attempts claim 횟수
 * @param lastAttemptAt 마지막 claim 시각
 * @param startedAt 최초 claim 시각
 * @param completedAt 종료 시각
 * @param exitCode 보고된 종료 코드
 * @param output 보고된 출력
 * @param errorMessage 오류 메시지
 * @param createdAt 생성 시각
 * @param version 낙관적 잠금 버전
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record DeploymentStatus(
    InstanceId statusId,
    DeploymentId deploymentId,
    NodeId nodeId,
    DeploymentStatusState state,
    int batchIndex,
    int attempts,
    Instant lastAttemptAt,
    Instant startedAt,
    Instant completedAt,
    Integer exitCode,
    String output,
    String errorMessage,
    Instant createdAt,
    long version
) {

    public DeploymentStatus {
        if (statusId == null || deploymentId == null || nodeId == null) {
            throw new IllegalArgumentException("statusId, deploymentId and nodeId cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (batchIndex < 0 || attempts < 0) {
            throw new IllegalArgumentException(
                "batchIndex and attempts must be non-negative (batchIndex: " + batchIndex + ", attempts: " + attempts + ")"
            );
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
    }

    /**
     * PENDING 상태의 새 행 생성.
     */
    public static DeploymentStatus create(DeploymentId deploymentId, NodeId nodeId, int batchIndex, Instant now) {
        return new DeploymentStatus(InstanceId.newId(), deploymentId, nodeId, DeploymentStatusState.PENDING,
            batchIndex, 0, null, null, null, null, null, null, now, 0);
    }

    /**
     * PENDING → DOWNLOADING (에이전트 claim).
     */
    public DeploymentStatus claim(Instant now) {
        DeploymentStatusState next = StateTransition.transition(state, DeploymentStatusState.DOWNLOADING);
        return new DeploymentStatus(statusId, deploymentId, nodeId, next, batchIndex, attempts + 1, now,
            startedAt == null ? now : startedAt, null, null, null, null, createdAt, version);
    }

    /**
     * 에이전트 보고 반영.
     *
     * @param reported 보고된 상태
     * @param reportedExitCode 종료 코드 (null 허용)
     * @param reportedOutput 출력 (null이면 기존 값 유지)
     * @param reportedError 오류 메시지 (null이면 기존 값 유지)
     * @param now 보고 시각
     * @return 갱신된 행
     * @throws IllegalStateException 허용되지 않는 전이인 경우
     */
    public DeploymentStatus report(DeploymentStatusState reported, Integer reportedExitCode,
                                   String reportedOutput, String reportedError, Instant now) {
        DeploymentStatusState next = StateTransition.transition(state, reported);
        return new DeploymentStatus(statusId, deploymentId, nodeId, next, batchIndex, attempts, lastAttemptAt,
            startedAt, next.isTerminal() ? now : null,
            reportedExitCode != null ? reportedExitCode : exitCode,
            reportedOutput != null ? reportedOutput : output,
            reportedError != null ? reportedError : errorMessage,
            createdAt, version);
    }

    /**
     * PENDING → SKIPPED.
     *
     * @param reason 건너뛴 사유
     */
    public DeploymentStatus skip(String reason, Instant now) {
        DeploymentStatusState next = StateTransition.transition(state, DeploymentStatusState.SKIPPED);
        return new DeploymentStatus(statusId, deploymentId, nodeId, next, batchIndex, attempts, lastAttemptAt,
            startedAt, now, exitCode, output, reason, createdAt, version);
    }

    public DeploymentStatus withVersion(long newVersion) {
        return new DeploymentStatus(statusId, deploymentId, nodeId, state, batchIndex, attempts, lastAttemptAt,
            startedAt, completedAt, exitCode, output, errorMessage, createdAt, newVersion);
    }
}
