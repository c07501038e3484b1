package com.ryuqq.fleet.adapter.runner;

import com.ryuqq.fleet.application.gateway.AgentGateway;
import com.ryuqq.fleet.application.gateway.DeploymentStatusReport;
import com.ryuqq.fleet.application.gateway.JobResultReport;
import com.ryuqq.fleet.application.gateway.PendingDeployment;
import com.ryuqq.fleet.application.gateway.PendingJob;
import com.ryuqq.fleet.application.gateway.ReportAck;
import com.ryuqq.fleet.application.registry.NodeRegistry;
import com.ryuqq.fleet.application.schedule.MaintenanceWindowGate;
import com.ryuqq.fleet.application.support.OptimisticUpdate;
import com.ryuqq.fleet.core.exception.ClaimConflictException;
import com.ryuqq.fleet.core.model.Deployment;
import com.ryuqq.fleet.core.model.DeploymentId;
import com.ryuqq.fleet.core.model.DeploymentStatus;
import com.ryuqq.fleet.core.model.InstanceId;
import com.ryuqq.fleet.core.model.Job;
import com.ryuqq.fleet.core.model.JobInstance;
import com.ryuqq.fleet.core.model.Node;
import com.ryuqq.fleet.core.model.NodeId;
import com.ryuqq.fleet.core.model.PackageReference;
import com.ryuqq.fleet.core.outcome.Ok;
import com.ryuqq.fleet.core.outcome.Outcome;
import com.ryuqq.fleet.core.outcome.Retry;
import com.ryuqq.fleet.core.spi.DeploymentStore;
import com.ryuqq.fleet.core.spi.JobStore;
import com.ryuqq.fleet.core.statemachine.DeploymentState;
import com.ryuqq.fleet.core.statemachine.DeploymentStatusState;
import com.ryuqq.fleet.core.statemachine.JobInstanceState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 저장소 기반 {@link AgentGateway} 구현.
 *
 * <p><strong>claim:</strong> 모든 claim은 읽은 버전에 대한 조건부 갱신입니다. 같은 노드의
 * 두 poll이 겹치면 한쪽만 성공하고 다른 쪽은 빈 응답을 받습니다.</p>
 *
 * <p><strong>Job 선택 순서:</strong> 이미 RUNNING인 인스턴스가 있으면 그것을 다시 전달하고,
 * 없으면 QUEUED 인스턴스 중 Job priority가 높은 것, 같으면 먼저 queue된 것을 claim합니다.</p>
 *
 * <p><strong>Deployment 선택 순서:</strong> 진행 중인 행을 다시 전달하고, 없으면 전달 가능한
 * PENDING 행(ACTIVE 배포, 릴리스된 배치, 필요 시 열린 유지보수 창) 중 가장 오래된 것을 claim합니다.
 * 행 claim은 배포가 여전히 ACTIVE이고 배치가 릴리스된 경우에만 저장되므로, 읽은 뒤 취소되거나
 * 중단된 배포의 행은 전달되지 않습니다.</p>
 *
 * <p><strong>보고:</strong> 결과 보고는 RUNNING(또는 진행 중) 상태에만 반영됩니다. 이미 최종 상태이면
 * DUPLICATE_IGNORED, 반영할 수 없는 전이이면 REJECTED를 반환하고 WARN으로 기록합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DefaultAgentGateway implements AgentGateway {

    private static final Logger log = LoggerFactory.getLogger(DefaultAgentGateway.class);

    private final NodeRegistry nodeRegistry;
    private final JobStore jobStore;
    private final DeploymentStore deploymentStore;
    private final MaintenanceWindowGate windowGate;
    private final JobResultHandler resultHandler;
    private final Clock clock;

    public DefaultAgentGateway(NodeRegistry nodeRegistry, JobStore jobStore, DeploymentStore deploymentStore,
                               MaintenanceWindowGate windowGate, JobResultHandler resultHandler, Clock clock) {
        if (nodeRegistry == null) {
            throw new IllegalArgumentException("nodeRegistry cannot be null");
        }
        if (jobStore == null) {
            throw new IllegalArgumentException("jobStore cannot be null");
        }
        if (deploymentStore == null) {
            throw new IllegalArgumentException("deploymentStore cannot be null");
        }
        if (windowGate == null) {
            throw new IllegalArgumentException("windowGate cannot be null");
        }
        if (resultHandler == null) {
            throw new IllegalArgumentException("resultHandler cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.nodeRegistry = nodeRegistry;
        this.jobStore = jobStore;
        this.deploymentStore = deploymentStore;
        this.windowGate = windowGate;
        this.resultHandler = resultHandler;
        this.clock = clock;
    }

    // ========================================
    // Jobs
    // ========================================

    @Override
    public Optional<PendingJob> pendingJob(NodeId nodeId) {
        if (nodeId == null) {
            throw new IllegalArgumentException("nodeId cannot be null");
        }
        if (touch(nodeId).isEmpty()) {
            return Optional.empty();
        }

        List<JobInstance> running = jobStore.findInstancesByNode(nodeId, JobInstanceState.RUNNING);
        for (JobInstance instance : running) {
            Optional<Job> job = jobStore.findJob(instance.jobId());
            if (job.isPresent()) {
                log.debug("Re-delivering running instance {} to {}", instance.instanceId().getValue(), nodeId.getValue());
                return Optional.of(toPendingJob(instance, job.get()));
            }
        }

        Instant now = clock.instant();
        for (Candidate candidate : queuedCandidates(nodeId, now)) {
            try {
                JobInstance claimed = claim(candidate.instance(), now);
                log.info("Node {} claimed job instance {} (job {}, attempt {})", nodeId.getValue(),
                    claimed.instanceId().getValue(), claimed.jobId().getValue(), claimed.attempt());
                return Optional.of(toPendingJob(claimed, candidate.job()));
            } catch (ClaimConflictException e) {
                log.debug("Lost claim on {}: {}", candidate.instance().instanceId().getValue(), e.getMessage());
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    @Override
    public ReportAck reportJobResult(JobResultReport report) {
        if (report == null) {
            throw new IllegalArgumentException("report cannot be null");
        }
        Optional<InstanceId> instanceId = parseId(report.instanceId());
        if (instanceId.isEmpty()) {
            log.warn("Job result for malformed instance id '{}' ignored", report.instanceId());
            return ReportAck.UNKNOWN_INSTANCE;
        }

        for (int attempt = 1; attempt <= OptimisticUpdate.MAX_ATTEMPTS; attempt++) {
            Optional<JobInstance> found = jobStore.findInstance(instanceId.get());
            if (found.isEmpty()) {
                log.warn("Job result for unknown instance {} ignored", report.instanceId());
                return ReportAck.UNKNOWN_INSTANCE;
            }
            JobInstance instance = found.get();
            if (instance.state().isTerminal()) {
                log.warn("Duplicate job result for instance {} ignored (already {})",
                    report.instanceId(), instance.state().wireValue());
                return ReportAck.DUPLICATE_IGNORED;
            }
            if (instance.state() != JobInstanceState.RUNNING) {
                log.warn("Job result for instance {} rejected: not claimed (state {})",
                    report.instanceId(), instance.state().wireValue());
                return ReportAck.REJECTED;
            }

            Instant now = clock.instant();
            Outcome outcome = resultHandler.classify(instance, report);
            Optional<JobInstance> stored = jobStore.compareAndSet(resultHandler.apply(instance, report, outcome, now));
            if (stored.isPresent()) {
                logJobResult(stored.get(), outcome);
                touch(stored.get().nodeId());
                return ReportAck.ACCEPTED;
            }
        }
        throw new ClaimConflictException("Gave up recording job result for " + report.instanceId());
    }

    // ========================================
    // Deployments
    // ========================================

    @Override
    public Optional<PendingDeployment> pendingDeployment(NodeId nodeId) {
        if (nodeId == null) {
            throw new IllegalArgumentException("nodeId cannot be null");
        }
        Optional<Node> node = touch(nodeId);
        if (node.isEmpty()) {
            return Optional.empty();
        }

        Instant now = clock.instant();
        Map<DeploymentId, Optional<Deployment>> deployments = new HashMap<>();
        List<DeploymentStatus> rows = deploymentStore.findStatusesByNode(nodeId);

        for (DeploymentStatus row : rows) {
            if (!row.state().isInFlight()) {
                continue;
            }
            Optional<Deployment> deployment = deployments.computeIfAbsent(row.deploymentId(), deploymentStore::findDeployment);
            if (deployment.isPresent() && deployment.get().state() != DeploymentState.CANCELLED) {
                log.debug("Re-delivering in-flight deployment row {} to {}", row.statusId().getValue(), nodeId.getValue());
                return Optional.of(toPendingDeployment(row, deployment.get()));
            }
        }

        Boolean windowOpen = null;
        for (DeploymentStatus row : rows) {
            if (row.state() != DeploymentStatusState.PENDING) {
                continue;
            }
            Optional<Deployment> found = deployments.computeIfAbsent(row.deploymentId(), deploymentStore::findDeployment);
            if (found.isEmpty() || !found.get().isEligible(row)) {
                continue;
            }
            Deployment deployment = found.get();
            if (deployment.maintenanceWindowOnly()) {
                if (windowOpen == null) {
                    windowOpen = windowGate.isOpenFor(node.get(), now);
                }
                if (!windowOpen) {
                    log.debug("Deployment row {} held for {}: no open maintenance window",
                        row.statusId().getValue(), nodeId.getValue());
                    continue;
                }
            }

            Optional<DeploymentStatus> claimed = deploymentStore.compareAndSetStatusIfEligible(row.claim(now));
            if (claimed.isEmpty()) {
                log.debug("Lost claim on deployment row {}: row or deployment {} changed concurrently",
                    row.statusId().getValue(), deployment.deploymentId().getValue());
                return Optional.empty();
            }
            log.info("Node {} claimed deployment row {} (deployment {}, batch {}, attempt {})",
                nodeId.getValue(), row.statusId().getValue(), deployment.deploymentId().getValue(),
                row.batchIndex(), claimed.get().attempts());
            return Optional.of(toPendingDeployment(claimed.get(), deployment));
        }
        return Optional.empty();
    }

    @Override
    public ReportAck reportDeploymentStatus(DeploymentStatusReport report) {
        if (report == null) {
            throw new IllegalArgumentException("report cannot be null");
        }
        DeploymentStatusState reported;
        try {
            reported = DeploymentStatusState.fromWire(report.status());
        } catch (IllegalArgumentException e) {
            log.warn("Deployment status report for row {} rejected: {}", report.statusId(), e.getMessage());
            return ReportAck.REJECTED;
        }
        Optional<InstanceId> statusId = parseId(report.statusId());
        if (statusId.isEmpty()) {
            log.warn("Deployment status for malformed id '{}' ignored", report.statusId());
            return ReportAck.UNKNOWN_INSTANCE;
        }

        for (int attempt = 1; attempt <= OptimisticUpdate.MAX_ATTEMPTS; attempt++) {
            Optional<DeploymentStatus> found = deploymentStore.findStatus(statusId.get());
            if (found.isEmpty()) {
                log.warn("Deployment status for unknown row {} ignored", report.statusId());
                return ReportAck.UNKNOWN_INSTANCE;
            }
            DeploymentStatus row = found.get();
            if (row.state().isTerminal() || row.state() == reported) {
                log.warn("Duplicate deployment status '{}' for row {} ignored (currently {})",
                    report.status(), report.statusId(), row.state().wireValue());
                return ReportAck.DUPLICATE_IGNORED;
            }

            DeploymentStatus updated;
            try {
                updated = row.report(reported, report.exitCode(), report.output(), report.errorMessage(), clock.instant());
            } catch (IllegalStateException e) {
                log.warn("Deployment status '{}' for row {} rejected: {}", report.status(), report.statusId(), e.getMessage());
                return ReportAck.REJECTED;
            }
            Optional<DeploymentStatus> stored = deploymentStore.compareAndSetStatus(updated);
            if (stored.isPresent()) {
                log.info("Deployment row {} (deployment {}, node {}) is {}", report.statusId(),
                    row.deploymentId().getValue(), row.nodeId().getValue(), reported.wireValue());
                touch(row.nodeId());
                return ReportAck.ACCEPTED;
            }
        }
        throw new ClaimConflictException("Gave up recording deployment status for " + report.statusId());
    }

    // ========================================
    // Check-in
    // ========================================

    @Override
    public Node heartbeat(NodeId nodeId, String hostname, Map<String, String> attributes) {
        return nodeRegistry.checkIn(nodeId, hostname, attributes);
    }

    /**
     * poll/보고를 체크인으로 반영. 등록되지 않은 노드는 hostname 없이 등록할 수 없으므로 건너뜁니다.
     */
    private Optional<Node> touch(NodeId nodeId) {
        Optional<Node> known = nodeRegistry.find(nodeId);
        if (known.isEmpty()) {
            log.debug("Poll from unregistered node {} ignored until heartbeat", nodeId.getValue());
            return Optional.empty();
        }
        try {
            return Optional.of(nodeRegistry.checkIn(nodeId, null, null));
        } catch (ClaimConflictException e) {
            // 동시 체크인이 이미 lastSeen을 갱신함
            log.debug("Check-in of {} lost to a concurrent check-in: {}", nodeId.getValue(), e.getMessage());
            return known;
        }
    }

    private List<Candidate> queuedCandidates(NodeId nodeId, Instant now) {
        List<Candidate> candidates = new ArrayList<>();
        for (JobInstance instance : jobStore.findInstancesByNode(nodeId, JobInstanceState.QUEUED)) {
            Optional<Job> job = jobStore.findJob(instance.jobId());
            if (job.isEmpty() || job.get().isCancelled() || job.get().isExpired(now)) {
                continue;
            }
            candidates.add(new Candidate(instance, job.get()));
        }
        candidates.sort(Comparator
            .comparingInt((Candidate candidate) -> candidate.job().priority()).reversed()
            .thenComparing(candidate -> candidate.instance().queuedAt(), Comparator.nullsLast(Comparator.naturalOrder())));
        return candidates;
    }

    private JobInstance claim(JobInstance instance, Instant now) {
        return jobStore.compareAndSet(instance.claim(now))
            .orElseThrow(() -> new ClaimConflictException(
                "Instance " + instance.instanceId().getValue() + " changed since version " + instance.version()
            ));
    }

    private void logJobResult(JobInstance stored, Outcome outcome) {
        if (outcome instanceof Ok) {
            log.info("Job instance {} succeeded on {}", stored.instanceId().getValue(), stored.nodeId().getValue());
        } else if (outcome instanceof Retry) {
            log.info("Job instance {} failed on {} (attempt {}/{}), retry at {}", stored.instanceId().getValue(),
                stored.nodeId().getValue(), stored.attempt(), stored.maxAttempts(), stored.nextRetryAt());
        } else {
            log.info("Job instance {} failed on {}: {}", stored.instanceId().getValue(),
                stored.nodeId().getValue(), stored.errorMessage());
        }
    }

    private static Optional<InstanceId> parseId(String value) {
        try {
            return Optional.of(InstanceId.of(value));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static PendingJob toPendingJob(JobInstance instance, Job job) {
        return new PendingJob(
            instance.instanceId().getValue(),
            job.jobId().getValue(),
            job.payload().getCommandType(),
            job.payload().getBody(),
            job.timeoutSeconds()
        );
    }

    private static PendingDeployment toPendingDeployment(DeploymentStatus row, Deployment deployment) {
        PackageReference pkg = deployment.packageRef();
        return new PendingDeployment(
            row.statusId().getValue(),
            deployment.deploymentId().getValue(),
            deployment.mode().wireValue(),
            deployment.maintenanceWindowOnly(),
            pkg.packageName(),
            pkg.version(),
            pkg.installerType(),
            pkg.installerUrl(),
            pkg.installArgs(),
            pkg.uninstallArgs(),
            pkg.expectedHash(),
            pkg.commandFor(deployment.mode())
        );
    }

    private record Candidate(JobInstance instance, Job job) {
    }
}
