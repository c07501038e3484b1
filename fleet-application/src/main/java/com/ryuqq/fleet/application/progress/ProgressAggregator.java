package com.ryuqq.fleet.application.progress;

import com.ryuqq.fleet.core.model.Deployment;
import com.ryuqq.fleet.core.model.DeploymentId;
import com.ryuqq.fleet.core.model.DeploymentStatus;
import com.ryuqq.fleet.core.model.Job;
import com.ryuqq.fleet.core.model.JobId;
import com.ryuqq.fleet.core.model.JobInstance;
import com.ryuqq.fleet.core.spi.DeploymentStore;
import com.ryuqq.fleet.core.spi.JobStore;
import com.ryuqq.fleet.core.statemachine.DeploymentState;
import com.ryuqq.fleet.core.statemachine.DeploymentStatusState;
import com.ryuqq.fleet.core.statemachine.JobInstanceState;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Job / Deployment 집계 상태 계산 (읽기 전용).
 *
 * <p><strong>Job 라벨:</strong></p>
 * <ul>
 *   <li>cancelled: Job이 취소됨</li>
 *   <li>pending: 아직 어떤 인스턴스도 claim되지 않음 (모두 pending/queued)</li>
 *   <li>running: 최종이 아닌 인스턴스가 남아 있음 (재시도가 예약된 실패 포함)</li>
 *   <li>completed: 모두 success</li>
 *   <li>failed: 모두 최종이고 success가 없음</li>
 *   <li>partial: 그 외 (일부 성공, 일부 실패/만료)</li>
 * </ul>
 *
 * <p><strong>Deployment 라벨:</strong> paused / cancelled는 컨트롤러 상태를 따르고,
 * 모든 행이 종료되면 completed, 아니면 컨트롤러 상태(pending 또는 active)입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ProgressAggregator {

    public static final String CANCELLED = "cancelled";
    public static final String PENDING = "pending";
    public static final String RUNNING = "running";
    public static final String COMPLETED = "completed";
    public static final String FAILED = "failed";
    public static final String PARTIAL = "partial";

    private final JobStore jobStore;
    private final DeploymentStore deploymentStore;

    public ProgressAggregator(JobStore jobStore, DeploymentStore deploymentStore) {
        if (jobStore == null) {
            throw new IllegalArgumentException("jobStore cannot be null");
        }
        if (deploymentStore == null) {
            throw new IllegalArgumentException("deploymentStore cannot be null");
        }
        this.jobStore = jobStore;
        this.deploymentStore = deploymentStore;
    }

    /**
     * Job 집계.
     *
     * @param jobId Job ID
     * @return 집계 결과
     * @throws IllegalStateException Job이 존재하지 않는 경우
     */
    public Progress jobProgress(JobId jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        Job job = jobStore.findJob(jobId)
            .orElseThrow(() -> new IllegalStateException("Job not found: " + jobId));
        List<JobInstance> instances = jobStore.findInstancesByJob(jobId);

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (JobInstanceState state : JobInstanceState.values()) {
            counts.put(state.wireValue(), 0);
        }
        boolean anyStarted = false;
        boolean anyOpen = false;
        int successes = 0;
        for (JobInstance instance : instances) {
            counts.merge(instance.state().wireValue(), 1, Integer::sum);
            if (instance.state() != JobInstanceState.PENDING && instance.state() != JobInstanceState.QUEUED) {
                anyStarted = true;
            }
            if (!instance.isFinal()) {
                anyOpen = true;
            }
            if (instance.state() == JobInstanceState.SUCCESS) {
                successes++;
            }
        }

        String label;
        if (job.isCancelled()) {
            label = CANCELLED;
        } else if (anyOpen && !anyStarted) {
            label = PENDING;
        } else if (anyOpen) {
            label = RUNNING;
        } else if (successes == instances.size()) {
            label = COMPLETED;
        } else if (successes == 0) {
            label = FAILED;
        } else {
            label = PARTIAL;
        }
        return new Progress(label, instances.size(), counts);
    }

    /**
     * Deployment 집계.
     *
     * @param deploymentId Deployment ID
     * @return 집계 결과
     * @throws IllegalStateException Deployment가 존재하지 않는 경우
     */
    public Progress deploymentProgress(DeploymentId deploymentId) {
        if (deploymentId == null) {
            throw new IllegalArgumentException("deploymentId cannot be null");
        }
        Deployment deployment = deploymentStore.findDeployment(deploymentId)
            .orElseThrow(() -> new IllegalStateException("Deployment not found: " + deploymentId));
        List<DeploymentStatus> rows = deploymentStore.findStatusesByDeployment(deploymentId);

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (DeploymentStatusState state : DeploymentStatusState.values()) {
            counts.put(state.wireValue(), 0);
        }
        boolean allTerminal = true;
        for (DeploymentStatus row : rows) {
            counts.merge(row.state().wireValue(), 1, Integer::sum);
            if (!row.state().isTerminal()) {
                allTerminal = false;
            }
        }

        String label;
        DeploymentState state = deployment.state();
        if (state == DeploymentState.PAUSED || state == DeploymentState.CANCELLED) {
            label = state.wireValue();
        } else if (allTerminal) {
            label = COMPLETED;
        } else {
            label = state.wireValue();
        }
        return new Progress(label, rows.size(), counts);
    }
}
