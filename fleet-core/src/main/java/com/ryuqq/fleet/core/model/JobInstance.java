package com.ryuqq.fleet.core.model;

import com.ryuqq.fleet.core.statemachine.JobInstanceState;
import com.ryuqq.fleet.core.statemachine.StateTransition;

import java.time.Instant;

/**
 * Job의 노드별 실행 기록.
 *
 * <p>(jobId, nodeId) 쌍마다 정확히 하나만 존재합니다. 재시도는 새 행이 아니라
 * 같은 인스턴스의 attempt 증가로 표현됩니다.</p>
 *
 * <p>모든 전이 메서드는 {@link StateTransition}으로 검증한 뒤 새 인스턴스를 반환합니다.
 * 반환된 값은 저장소의 조건부 갱신(expected version 비교)을 통해서만 영속됩니다.</p>
 *
 * @param instanceId 인스턴스 ID
 * @param jobId 상위 Job ID
 * @param nodeId 대상 노드 ID
 * @param state 현재 상태
 * @param attempt 현재 시도 번호 (1부터)
 * @param maxAttempts 최대 시도 횟수
 * @param nextRetryAt 예약된 재시도 시각 (FAILED + 재시도 예약 시에만 non-null)
 * @param createdAt 생성 시각
 * @param queuedAt QUEUED 전이 시각
 * @param startedAt RUNNING 전이(claim) 시각
 * @param completedAt 종료 시각
 * @param exitCode 보고된 종료 코드
 * @param stdout 표준 출력
 * @param stderr 표준 오류
 * @param errorMessage 오류 메시지 (실패/만료 사유)
 * @param durationMs 에이전트가 보고한 실행 시간
 * @param version 낙관적 잠금 버전
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record JobInstance(
    InstanceId instanceId,
    JobId jobId,
    NodeId nodeId,
    JobInstanceState state,
    int attempt,
    int maxAttempts,
    Instant nextRetryAt,
    Instant createdAt,
    Instant queuedAt,
    Instant startedAt,
    Instant completedAt,
    Integer exitCode,
    String stdout,
    String stderr,
    String errorMessage,
    Long durationMs,
    long version
) {

    public JobInstance {
        if (instanceId == null || jobId == null || nodeId == null) {
            throw new IllegalArgumentException("instanceId, jobId and nodeId cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (attempt < 1 || maxAttempts < 1) {
            throw new IllegalArgumentException(
                "attempt and maxAttempts must be positive (attempt: " + attempt + ", maxAttempts: " + maxAttempts + ")"
            );
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
    }

    /**
     * PENDING 상태의 새 인스턴스 생성.
     *
     * @param job 상위 Job
     * @param nodeId 대상 노드
     * @param now 생성 시각
     * @return 새 JobInstance (attempt 1, version 0)
     */
    public static JobInstance create(Job job, NodeId nodeId, Instant now) {
        return new JobInstance(InstanceId.newId(), job.jobId(), nodeId, JobInstanceState.PENDING,
            1, job.maxAttempts(), null, now, null, null, null, null, null, null, null, null, 0);
    }

    /**
     * PENDING → QUEUED.
     */
    public JobInstance enqueue(Instant now) {
        JobInstanceState next = StateTransition.transition(state, JobInstanceState.QUEUED);
        return new JobInstance(instanceId, jobId, nodeId, next, attempt, maxAttempts, null,
            createdAt, now, null, null, exitCode, stdout, stderr, errorMessage, durationMs, version);
    }

    /**
     * QUEUED → RUNNING (에이전트 claim).
     */
    public JobInstance claim(Instant now) {
        JobInstanceState next = StateTransition.transition(state, JobInstanceState.RUNNING);
        return new JobInstance(instanceId, jobId, nodeId, next, attempt, maxAttempts, null,
            createdAt, queuedAt, now, null, null, null, null, null, null, version);
    }

    /**
     * RUNNING → SUCCESS.
     */
    public JobInstance succeed(int exitCode, String stdout, String stderr, Long durationMs, Instant now) {
        JobInstanceState next = StateTransition.transition(state, JobInstanceState.SUCCESS);
        return new JobInstance(instanceId, jobId, nodeId, next, attempt, maxAttempts, null,
            createdAt, queuedAt, startedAt, now, exitCode, stdout, stderr, null, durationMs, version);
    }

    /**
     * RUNNING → FAILED.
     *
     * @param nextRetryAt 재시도 예약 시각 (재시도하지 않으면 null)
     */
    public JobInstance fail(Integer exitCode, String stdout, String stderr, Long durationMs,
                            String errorMessage, Instant nextRetryAt, Instant now) {
        JobInstanceState next = StateTransition.transition(state, JobInstanceState.FAILED);
        return new JobInstance(instanceId, jobId, nodeId, next, attempt, maxAttempts, nextRetryAt,
            createdAt, queuedAt, startedAt, now, exitCode, stdout, stderr, errorMessage, durationMs, version);
    }

    /**
     * 비종료 상태 → CANCELLED. 재시도가 예약된 FAILED는 예약만 해제합니다.
     */
    public JobInstance cancel(Instant now) {
        if (isRetryScheduled()) {
            return new JobInstance(instanceId, jobId, nodeId, state, attempt, maxAttempts, null,
                createdAt, queuedAt, startedAt, completedAt, exitCode, stdout, stderr, errorMessage, durationMs, version);
        }
        JobInstanceState next = StateTransition.transition(state, JobInstanceState.CANCELLED);
        return new JobInstance(instanceId, jobId, nodeId, next, attempt, maxAttempts, null,
            createdAt, queuedAt, startedAt, now, exitCode, stdout, stderr, "cancelled by administrator", durationMs, version);
    }

    /**
     * 비종료 상태 → EXPIRED.
     *
     * @param reason 만료 사유
     */
    public JobInstance expire(String reason, Instant now) {
        JobInstanceState next = StateTransition.transition(state, JobInstanceState.EXPIRED);
        return new JobInstance(instanceId, jobId, nodeId, next, attempt, maxAttempts, null,
            createdAt, queuedAt, startedAt, now, exitCode, stdout, stderr, reason, durationMs, version);
    }

    /**
     * FAILED(재시도 예약) → PENDING, attempt 증가.
     */
    public JobInstance resetForRetry() {
        StateTransition.validateRetry(state);
        if (attempt >= maxAttempts) {
            throw new IllegalStateException(
                "Retry budget exhausted for " + instanceId + " (attempt: " + attempt + ", maxAttempts: " + maxAttempts + ")"
            );
        }
        return new JobInstance(instanceId, jobId, nodeId, JobInstanceState.PENDING, attempt + 1, maxAttempts, null,
            createdAt, null, null, null, null, null, null, null, null, version);
    }

    /**
     * 저장소가 조건부 갱신 성공 시 부여하는 버전으로 교체.
     */
    public JobInstance withVersion(long newVersion) {
        return new JobInstance(instanceId, jobId, nodeId, state, attempt, maxAttempts, nextRetryAt,
            createdAt, queuedAt, startedAt, completedAt, exitCode, stdout, stderr, errorMessage, durationMs, newVersion);
    }

    /**
     * 재시도가 예약된 실패인지 확인.
     */
    public boolean isRetryScheduled() {
        return state == JobInstanceState.FAILED && nextRetryAt != null;
    }

    /**
     * 예약된 재시도 시각이 도래했는지 확인.
     */
    public boolean isRetryDue(Instant now) {
        return isRetryScheduled() && !now.isBefore(nextRetryAt);
    }

    /**
     * 더 이상 변하지 않는 최종 결과인지 확인.
     *
     * <p>FAILED라도 재시도가 예약되어 있으면 최종이 아닙니다.</p>
     */
    public boolean isFinal() {
        return state.isTerminal() && !isRetryScheduled();
    }
}
