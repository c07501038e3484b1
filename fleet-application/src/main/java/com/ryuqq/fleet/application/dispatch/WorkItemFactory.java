package com.ryuqq.fleet.application.dispatch;

import com.ryuqq.fleet.core.model.Deployment;
import com.ryuqq.fleet.core.model.DeploymentStatus;
import com.ryuqq.fleet.core.model.Job;
import com.ryuqq.fleet.core.model.JobInstance;
import com.ryuqq.fleet.core.model.NodeId;
import com.ryuqq.fleet.core.spi.DeploymentStore;
import com.ryuqq.fleet.core.spi.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 확장된 노드 집합으로부터 노드별 작업 항목 생성.
 *
 * <p>저장소의 유일 삽입(createIfAbsent)만 사용하므로 같은 입력으로 다시 호출해도
 * 행이 늘어나지 않고 기존 행을 그대로 반환합니다. 새 행은 항상 PENDING입니다.</p>
 *
 * <p><strong>배치 번호:</strong> Deployment 행의 batchIndex는 여기서, 전달된 노드 순서와
 * {@link Deployment#batchIndexOf(int)}로 한 번 정해지고 이후 바뀌지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class WorkItemFactory {

    private static final Logger log = LoggerFactory.getLogger(WorkItemFactory.class);

    private final JobStore jobStore;
    private final DeploymentStore deploymentStore;
    private final Clock clock;

    public WorkItemFactory(JobStore jobStore, DeploymentStore deploymentStore, Clock clock) {
        if (jobStore == null) {
            throw new IllegalArgumentException("jobStore cannot be null");
        }
        if (deploymentStore == null) {
            throw new IllegalArgumentException("deploymentStore cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.jobStore = jobStore;
        this.deploymentStore = deploymentStore;
        this.clock = clock;
    }

    /**
     * 노드마다 JobInstance 하나 생성.
     *
     * @param job 상위 Job
     * @param nodeIds 대상 노드 (순서대로 생성)
     * @return 저장된 인스턴스 목록 (입력 순서)
     */
    public List<JobInstance> createJobInstances(Job job, Collection<NodeId> nodeIds) {
        if (job == null || nodeIds == null) {
            throw new IllegalArgumentException("job and nodeIds cannot be null");
        }
        Instant now = clock.instant();
        List<JobInstance> instances = new ArrayList<>(nodeIds.size());
        int created = 0;
        for (NodeId nodeId : nodeIds) {
            JobInstance candidate = JobInstance.create(job, nodeId, now);
            JobInstance stored = jobStore.createInstanceIfAbsent(candidate);
            if (stored.instanceId().equals(candidate.instanceId())) {
                created++;
            }
            instances.add(stored);
        }
        log.info("Job {} instances ready: total={}, created={}", job.jobId().getValue(), instances.size(), created);
        return instances;
    }

    /**
     * 노드마다 DeploymentStatus 하나 생성.
     *
     * @param deployment 상위 Deployment
     * @param nodeIds 대상 노드 (이 순서가 배치 순서)
     * @return 저장된 행 목록 (입력 순서)
     */
    public List<DeploymentStatus> createDeploymentStatuses(Deployment deployment, List<NodeId> nodeIds) {
        if (deployment == null || nodeIds == null) {
            throw new IllegalArgumentException("deployment and nodeIds cannot be null");
        }
        Instant now = clock.instant();
        List<DeploymentStatus> statuses = new ArrayList<>(nodeIds.size());
        int created = 0;
        for (int position = 0; position < nodeIds.size(); position++) {
            DeploymentStatus candidate = DeploymentStatus.create(
                deployment.deploymentId(), nodeIds.get(position), deployment.batchIndexOf(position), now
            );
            DeploymentStatus stored = deploymentStore.createStatusIfAbsent(candidate);
            if (stored.statusId().equals(candidate.statusId())) {
                created++;
            }
            statuses.add(stored);
        }
        log.info("Deployment {} status rows ready: total={}, created={}",
            deployment.deploymentId().getValue(), statuses.size(), created);
        return statuses;
    }
}
