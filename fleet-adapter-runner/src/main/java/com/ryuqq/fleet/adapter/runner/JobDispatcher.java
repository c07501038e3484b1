package com.ryuqq.fleet.adapter.runner;

import com.ryuqq.fleet.application.runtime.Sweep;
import com.ryuqq.fleet.core.model.Job;
import com.ryuqq.fleet.core.model.JobId;
import com.ryuqq.fleet.core.model.JobInstance;
import com.ryuqq.fleet.core.spi.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Job Dispatcher 컴포넌트.
 *
 * <p>PENDING 인스턴스를 에이전트가 claim할 수 있는 QUEUED 상태로 옮기고,
 * 재시도 시각이 도래한 FAILED 인스턴스를 다음 시도를 위해 PENDING으로 되돌립니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. scanRetryDue(now, batchSize) → [FAILED + nextRetryAt ≤ now]
 *    - Job 취소됨: 재시도 예약 해제 (최종 FAILED 유지)
 *    - 그 외: resetForRetry() → PENDING, attempt + 1
 * 2. scanDispatchable(now, batchSize) → [PENDING + Job이 due이고 취소/만료되지 않음]
 *    - enqueue() → QUEUED
 *    - 만료된 인스턴스는 JobReaper가 EXPIRED로 처리
 * </pre>
 *
 * <p>Job 조건은 저장소 스캔에 포함되어 있어, 먼 미래로 예약된 Job의 인스턴스가 배치를 채워
 * 지금 due인 인스턴스를 가로막지 않습니다.</p>
 *
 * <p>1단계에서 PENDING으로 돌아간 인스턴스는 같은 스캔의 2단계에서 바로 QUEUED가 될 수 있습니다.</p>
 *
 * <p><strong>멱등성:</strong> 모든 전이는 조건부 갱신이므로 여러 Dispatcher가 동시에 실행되어도
 * 하나의 인스턴스는 한 번만 전이됩니다. 경합에서 진 항목은 건너뜁니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class JobDispatcher implements Sweep {

    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

    private final JobStore jobStore;
    private final JobDispatcherConfig config;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param jobStore Job 저장소
     * @param config 설정
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public JobDispatcher(JobStore jobStore, JobDispatcherConfig config, Clock clock) {
        if (jobStore == null) {
            throw new IllegalArgumentException("jobStore cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.jobStore = jobStore;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "job-dispatcher";
    }

    @Override
    public int sweep() {
        Instant now = clock.instant();
        Map<JobId, Optional<Job>> jobs = new HashMap<>();

        int retried = 0;
        List<JobInstance> retryDue = jobStore.scanRetryDue(now, config.batchSize());
        for (JobInstance instance : retryDue) {
            if (tryResetForRetry(instance, jobs, now)) {
                retried++;
            }
        }

        int queued = 0;
        List<JobInstance> pending = jobStore.scanDispatchable(now, config.batchSize());
        for (JobInstance instance : pending) {
            if (tryEnqueue(instance, jobs, now)) {
                queued++;
            }
        }

        if (retried == 0 && queued == 0) {
            log.debug("JobDispatcher sweep idle ({} dispatchable, {} retry due)", pending.size(), retryDue.size());
        } else {
            log.info("JobDispatcher sweep completed: {} queued out of {} dispatchable, {} reset for retry out of {} due",
                queued, pending.size(), retried, retryDue.size());
        }
        return retried + queued;
    }

    private boolean tryEnqueue(JobInstance instance, Map<JobId, Optional<Job>> jobs, Instant now) {
        try {
            Optional<Job> job = jobs.computeIfAbsent(instance.jobId(), jobStore::findJob);
            if (job.isEmpty()) {
                log.warn("Pending instance {} refers to unknown job {}", instance.instanceId().getValue(),
                    instance.jobId().getValue());
                return false;
            }
            if (!job.get().isDue(now) || job.get().isCancelled() || job.get().isExpired(now)) {
                log.debug("Instance {} no longer dispatchable", instance.instanceId().getValue());
                return false;
            }
            return store(instance.enqueue(now), "queue");
        } catch (Exception e) {
            log.error("Failed to queue instance {} in JobDispatcher sweep", instance.instanceId().getValue(), e);
            return false;
        }
    }

    private boolean tryResetForRetry(JobInstance instance, Map<JobId, Optional<Job>> jobs, Instant now) {
        try {
            Optional<Job> job = jobs.computeIfAbsent(instance.jobId(), jobStore::findJob);
            if (job.isPresent() && job.get().isCancelled()) {
                return store(instance.cancel(now), "drop retry of");
            }
            if (instance.attempt() >= instance.maxAttempts()) {
                log.warn("Instance {} has a retry scheduled but no attempts left ({}/{})",
                    instance.instanceId().getValue(), instance.attempt(), instance.maxAttempts());
                return store(instance.cancel(now), "drop retry of");
            }
            return store(instance.resetForRetry(), "retry");
        } catch (Exception e) {
            log.error("Failed to reset instance {} for retry in JobDispatcher sweep", instance.instanceId().getValue(), e);
            return false;
        }
    }

    private boolean store(JobInstance updated, String action) {
        Optional<JobInstance> stored = jobStore.compareAndSet(updated);
        if (stored.isEmpty()) {
            log.debug("Skipped {} instance {}: changed concurrently", action, updated.instanceId().getValue());
            return false;
        }
        log.debug("Instance {} is now {} (attempt {})", updated.instanceId().getValue(),
            stored.get().state().wireValue(), stored.get().attempt());
        return true;
    }
}
