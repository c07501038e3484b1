package com.ryuqq.fleet.application.dispatch;

import com.ryuqq.fleet.application.support.OptimisticUpdate;
import com.ryuqq.fleet.core.exception.TargetResolutionException;
import com.ryuqq.fleet.core.model.Job;
import com.ryuqq.fleet.core.model.JobId;
import com.ryuqq.fleet.core.model.JobInstance;
import com.ryuqq.fleet.core.model.NodeId;
import com.ryuqq.fleet.core.spi.JobStore;
import com.ryuqq.fleet.core.statemachine.JobInstanceState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;

/**
 * Job 관리 유스케이스: 생성과 취소.
 *
 * <p><strong>생성:</strong> 대상을 먼저 확장하고, 실패하면 Job도 인스턴스도 남기지 않습니다.</p>
 *
 * <p><strong>취소:</strong> Job에 취소 시각을 기록하고 아직 최종이 아닌 인스턴스를 모두
 * CANCELLED로 전이합니다. 재시도가 예약된 실패 인스턴스는 예약만 해제되어 FAILED로 남습니다.
 * 이후 도착하는 에이전트 보고는 중복으로 무시됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final TargetResolver targetResolver;
    private final WorkItemFactory workItemFactory;
    private final JobStore jobStore;
    private final Clock clock;

    public JobService(TargetResolver targetResolver, WorkItemFactory workItemFactory, JobStore jobStore, Clock clock) {
        if (targetResolver == null) {
            throw new IllegalArgumentException("targetResolver cannot be null");
        }
        if (workItemFactory == null) {
            throw new IllegalArgumentException("workItemFactory cannot be null");
        }
        if (jobStore == null) {
            throw new IllegalArgumentException("jobStore cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.targetResolver = targetResolver;
        this.workItemFactory = workItemFactory;
        this.jobStore = jobStore;
        this.clock = clock;
    }

    /**
     * Job 생성 및 노드별 인스턴스 생성.
     *
     * @param job 새 Job
     * @return 저장된 인스턴스 목록 (노드 ID 순)
     * @throws TargetResolutionException 대상이 비어 있거나 알 수 없는 그룹인 경우
     */
    public List<JobInstance> submit(Job job) {
        if (job == null) {
            throw new IllegalArgumentException("job cannot be null");
        }
        SortedSet<NodeId> targets;
        try {
            targets = targetResolver.resolve(job.target());
        } catch (TargetResolutionException e) {
            log.warn("Job {} rejected: {}", job.jobId().getValue(), e.getMessage());
            throw e;
        }
        jobStore.saveJob(job);
        log.info("Job {} ({}) submitted: target={}, nodes={}",
            job.jobId().getValue(), job.name(), job.target().targetType(), targets.size());
        return workItemFactory.createJobInstances(job, targets);
    }

    /**
     * Job 취소.
     *
     * @param jobId Job ID
     * @return 이번 호출로 취소된 인스턴스 수
     * @throws IllegalStateException Job이 존재하지 않는 경우
     */
    public int cancel(JobId jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        Job job = jobStore.findJob(jobId)
            .orElseThrow(() -> new IllegalStateException("Job not found: " + jobId));
        Instant now = clock.instant();
        if (!job.isCancelled()) {
            jobStore.saveJob(job.cancel(now));
        }

        int cancelled = 0;
        for (JobInstance instance : jobStore.findInstancesByJob(jobId)) {
            if (instance.isFinal()) {
                continue;
            }
            JobInstance stored = OptimisticUpdate.apply(
                "job instance " + instance.instanceId().getValue(),
                () -> jobStore.findInstance(instance.instanceId()),
                current -> current.isFinal() ? current : current.cancel(now),
                jobStore::compareAndSet
            );
            if (stored.state() == JobInstanceState.CANCELLED) {
                cancelled++;
            }
        }
        log.info("Job {} cancelled: {} instance(s) cancelled", jobId.getValue(), cancelled);
        return cancelled;
    }

    public Optional<Job> find(JobId jobId) {
        return jobStore.findJob(jobId);
    }
}
