package com.ryuqq.fleet.adapter.runner;

import com.ryuqq.fleet.application.runtime.Sweep;
import com.ryuqq.fleet.core.model.Job;
import com.ryuqq.fleet.core.model.JobId;
import com.ryuqq.fleet.core.model.JobInstance;
import com.ryuqq.fleet.core.spi.JobStore;
import com.ryuqq.fleet.core.statemachine.JobInstanceState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Job Reaper 컴포넌트.
 *
 * <p>응답이 없는 인스턴스를 EXPIRED로 종료합니다. EXPIRED는 "알려진 나쁜 결과"인 FAILED와 달리
 * "아무 결과도 받지 못함"을 뜻하며 재시도하지 않습니다.</p>
 *
 * <p><strong>만료 조건:</strong></p>
 * <pre>
 * PENDING / QUEUED : now &gt; job.expiresAt                              (시작되지 못함)
 * RUNNING          : now &gt; startedAt + job.timeoutSeconds + grace     (결과 보고 없음)
 * </pre>
 *
 * <p>두 조건 모두 저장소 스캔에서 걸러지므로, 만료 시각이 없는 대기 인스턴스가 아무리 많아도
 * 만료 대상 인스턴스가 배치에서 밀려나지 않습니다.</p>
 *
 * <p><strong>늦은 보고:</strong> 만료 후 도착한 결과 보고는 DUPLICATE_IGNORED로 응답되어
 * 에이전트가 재전송을 멈춥니다.</p>
 *
 * <p><strong>멱등성:</strong> 만료는 조건부 갱신이므로, 만료 직전에 결과가 기록되었다면
 * 버전 불일치로 만료가 건너뛰어지고 결과가 유지됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class JobReaper implements Sweep {

    private static final Logger log = LoggerFactory.getLogger(JobReaper.class);

    private final JobStore jobStore;
    private final JobReaperConfig config;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param jobStore Job 저장소
     * @param config 설정
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public JobReaper(JobStore jobStore, JobReaperConfig config, Clock clock) {
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
        return "job-reaper";
    }

    @Override
    public int sweep() {
        Instant now = clock.instant();
        Map<JobId, Optional<Job>> jobs = new HashMap<>();

        List<JobInstance> notStarted = jobStore.scanExpirable(now, config.batchSize());
        List<JobInstance> timedOut = jobStore.scanRunningTimedOut(now, config.runningGraceMs(), config.batchSize());
        int scanned = notStarted.size() + timedOut.size();

        int expired = 0;
        for (JobInstance instance : notStarted) {
            if (tryExpire(instance, jobs, now)) {
                expired++;
            }
        }
        for (JobInstance instance : timedOut) {
            if (tryExpire(instance, jobs, now)) {
                expired++;
            }
        }

        if (expired == 0) {
            log.debug("JobReaper sweep idle ({} scanned)", scanned);
        } else {
            log.info("JobReaper sweep completed: {} expired out of {} scanned", expired, scanned);
        }
        return expired;
    }

    private boolean tryExpire(JobInstance instance, Map<JobId, Optional<Job>> jobs, Instant now) {
        try {
            Optional<Job> job = jobs.computeIfAbsent(instance.jobId(), jobStore::findJob);
            if (job.isEmpty()) {
                return false;
            }
            String reason = expiryReason(instance, job.get(), now);
            if (reason == null) {
                return false;
            }

            Optional<JobInstance> stored = jobStore.compareAndSet(instance.expire(reason, now));
            if (stored.isEmpty()) {
                log.debug("Skipped expiring instance {}: changed concurrently", instance.instanceId().getValue());
                return false;
            }
            log.info("Expired instance {} (job {}, node {}): {}", instance.instanceId().getValue(),
                instance.jobId().getValue(), instance.nodeId().getValue(), reason);
            return true;
        } catch (Exception e) {
            log.error("Failed to expire instance {} in JobReaper sweep", instance.instanceId().getValue(), e);
            return false;
        }
    }

    /**
     * @return 만료 사유, 아직 만료 대상이 아니면 null
     */
    private String expiryReason(JobInstance instance, Job job, Instant now) {
        if (instance.state() == JobInstanceState.RUNNING) {
            if (instance.startedAt() == null) {
                return null;
            }
            Instant deadline = instance.startedAt()
                .plusSeconds(job.timeoutSeconds())
                .plusMillis(config.runningGraceMs());
            return now.isAfter(deadline)
                ? "no result within " + job.timeoutSeconds() + " seconds"
                : null;
        }
        return job.isExpired(now)
            ? "not started before " + job.expiresAt()
            : null;
    }
}
