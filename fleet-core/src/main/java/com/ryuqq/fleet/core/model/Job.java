package com.ryuqq.fleet.core.model;

import java.time.Instant;

/**
 * 일회성 명령 의도 (Job).
 *
 * <p>생성 후에는 취소(cancelledAt) 외에 변경되지 않습니다. 노드별 실행 기록은
 * {@link JobInstance}가 담당합니다.</p>
 *
 * <p><strong>기본값:</strong> priority=0, timeoutSeconds=300, maxAttempts=1</p>
 *
 * @param jobId Job ID
 * @param name 이름
 * @param target 대상 선택자
 * @param payload 명령
 * @param priority 우선순위 (클수록 먼저 claim)
 * @param timeoutSeconds RUNNING 상태 최대 유지 시간 (초, 양수)
 * @param maxAttempts 노드별 최대 시도 횟수 (1 이상)
 * @param scheduledAt 디스패치 시작 시각 (null이면 즉시)
 * @param expiresAt 미수행 인스턴스 만료 시각 (null이면 만료 없음)
 * @param createdAt 생성 시각
 * @param cancelledAt 취소 시각 (취소되지 않았으면 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Job(
    JobId jobId,
    String name,
    TargetSelector target,
    CommandPayload payload,
    int priority,
    int timeoutSeconds,
    int maxAttempts,
    Instant scheduledAt,
    Instant expiresAt,
    Instant createdAt,
    Instant cancelledAt
) {

    public static final int DEFAULT_TIMEOUT_SECONDS = 300;

    public Job {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException(
                "timeoutSeconds must be positive (current: " + timeoutSeconds + ")"
            );
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        if (scheduledAt != null && expiresAt != null && !expiresAt.isAfter(scheduledAt)) {
            throw new IllegalArgumentException(
                "expiresAt must be after scheduledAt (scheduledAt: " + scheduledAt + ", expiresAt: " + expiresAt + ")"
            );
        }
    }

    /**
     * 기본값으로 Job 생성.
     *
     * @param name 이름
     * @param target 대상
     * @param payload 명령
     * @param createdAt 생성 시각
     * @return 새 Job (즉시 실행, 만료 없음)
     */
    public static Job create(String name, TargetSelector target, CommandPayload payload, Instant createdAt) {
        return new Job(JobId.newId(), name, target, payload, 0, DEFAULT_TIMEOUT_SECONDS, 1, null, null, createdAt, null);
    }

    public boolean isCancelled() {
        return cancelledAt != null;
    }

    /**
     * 디스패치 시작 시각이 도래했는지 확인.
     *
     * @param now 현재 시각
     * @return scheduledAt이 없거나 지났으면 true
     */
    public boolean isDue(Instant now) {
        return scheduledAt == null || !now.isBefore(scheduledAt);
    }

    /**
     * 만료 여부 확인.
     *
     * @param now 현재 시각
     * @return expiresAt이 지났으면 true
     */
    public boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    /**
     * 취소된 Job 생성.
     *
     * @param now 취소 시각
     * @return 취소된 Job (이미 취소되었으면 자기 자신)
     */
    public Job cancel(Instant now) {
        if (isCancelled()) {
            return this;
        }
        return new Job(jobId, name, target, payload, priority, timeoutSeconds, maxAttempts, scheduledAt, expiresAt, createdAt, now);
    }

    public Job withPriority(int priority) {
        return new Job(jobId, name, target, payload, priority, timeoutSeconds, maxAttempts, scheduledAt, expiresAt, createdAt, cancelledAt);
    }

    public Job withTimeoutSeconds(int timeoutSeconds) {
        return new Job(jobId, name, target, payload, priority, timeoutSeconds, maxAttempts, scheduledAt, expiresAt, createdAt, cancelledAt);
    }

    public Job withMaxAttempts(int maxAttempts) {
        return new Job(jobId, name, target, payload, priority, timeoutSeconds, maxAttempts, scheduledAt, expiresAt, createdAt, cancelledAt);
    }

    public Job withScheduledAt(Instant scheduledAt) {
        return new Job(jobId, name, target, payload, priority, timeoutSeconds, maxAttempts, scheduledAt, expiresAt, createdAt, cancelledAt);
    }

    public Job withExpiresAt(Instant expiresAt) {
        return new Job(jobId, name, target, payload, priority, timeoutSeconds, maxAttempts, scheduledAt, expiresAt, createdAt, cancelledAt);
    }
}
