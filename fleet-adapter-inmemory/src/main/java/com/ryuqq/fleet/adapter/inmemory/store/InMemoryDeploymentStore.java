package com.ryuqq.fleet.adapter.inmemory.store;

import com.ryuqq.fleet.core.model.Deployment;
import com.ryuqq.fleet.core.model.DeploymentId;
import com.ryuqq.fleet.core.model.DeploymentStatus;
import com.ryuqq.fleet.core.model.InstanceId;
import com.ryuqq.fleet.core.model.NodeId;
import com.ryuqq.fleet.core.spi.DeploymentStore;
import com.ryuqq.fleet.core.statemachine.DeploymentState;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link DeploymentStore}.
 *
 * <p>Same structure as {@link InMemoryJobStore}: a per-key atomic unique index on
 * (deployment_id, node_id) and {@code computeIfPresent}-based compare-and-set for both
 * deployments and status rows.</p>
 *
 * <p>A conditional claim writes the row from inside {@code computeIfPresent} on the owning
 * deployment, which serializes it against every deployment update.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryDeploymentStore implements DeploymentStore {

    private static final Comparator<Deployment> PAGE_ORDER =
        Comparator.comparing(Deployment::createdAt).thenComparing(Deployment::deploymentId);

    private final ConcurrentHashMap<DeploymentId, Deployment> deployments = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<InstanceId, DeploymentStatus> statuses = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<UniqueKey, InstanceId> uniqueIndex = new ConcurrentHashMap<>();

    @Override
    public void saveDeployment(Deployment deployment) {
        if (deployment == null) {
            throw new IllegalArgumentException("deployment cannot be null");
        }
        Deployment existing = deployments.putIfAbsent(deployment.deploymentId(), deployment);
        if (existing != null) {
            throw new IllegalStateException("Deployment already exists: " + deployment.deploymentId());
        }
    }

    @Override
    public Optional<Deployment> findDeployment(DeploymentId deploymentId) {
        if (deploymentId == null) {
            throw new IllegalArgumentException("deploymentId cannot be null");
        }
        return Optional.ofNullable(deployments.get(deploymentId));
    }

    @Override
    public List<Deployment> scanByStates(Set<DeploymentState> states, Deployment after, int batchSize) {
        if (states == null || states.isEmpty()) {
            throw new IllegalArgumentException("states cannot be null or empty");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive (current: " + batchSize + ")");
        }
        return deployments.values().stream()
            .filter(deployment -> states.contains(deployment.state()))
            .filter(deployment -> after == null || PAGE_ORDER.compare(deployment, after) > 0)
            .sorted(PAGE_ORDER)
            .limit(batchSize)
            .collect(Collectors.toList());
    }

    @Override
    public Optional<Deployment> compareAndSet(Deployment updated) {
        if (updated == null) {
            throw new IllegalArgumentException("updated cannot be null");
        }
        AtomicReference<Deployment> written = new AtomicReference<>();
        Deployment result = deployments.computeIfPresent(updated.deploymentId(), (id, current) -> {
            if (current.version() != updated.version()) {
                return current;
            }
            Deployment next = updated.withVersion(current.version() + 1);
            written.set(next);
            return next;
        });
        if (result == null) {
            throw new IllegalStateException("Deployment not found: " + updated.deploymentId());
        }
        return Optional.ofNullable(written.get());
    }

    @Override
    public DeploymentStatus createStatusIfAbsent(DeploymentStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        InstanceId storedId = uniqueIndex.computeIfAbsent(
            new UniqueKey(status.deploymentId(), status.nodeId()),
            key -> {
                statuses.put(status.statusId(), status);
                return status.statusId();
            }
        );
        return statuses.get(storedId);
    }

    @Override
    public Optional<DeploymentStatus> findStatus(InstanceId statusId) {
        if (statusId == null) {
            throw new IllegalArgumentException("statusId cannot be null");
        }
        return Optional.ofNullable(statuses.get(statusId));
    }

    @Override
    public List<DeploymentStatus> findStatusesByDeployment(DeploymentId deploymentId) {
        if (deploymentId == null) {
            throw new IllegalArgumentException("deploymentId cannot be null");
        }
        return statuses.values().stream()
            .filter(status -> status.deploymentId().equals(deploymentId))
            .sorted(Comparator.comparingInt(DeploymentStatus::batchIndex).thenComparing(DeploymentStatus::nodeId))
            .collect(Collectors.toList());
    }

    @Override
    public List<DeploymentStatus> findStatusesByNode(NodeId nodeId) {
        if (nodeId == null) {
            throw new IllegalArgumentException("nodeId cannot be null");
        }
        return statuses.values().stream()
            .filter(status -> status.nodeId().equals(nodeId))
            .sorted(Comparator.comparing(DeploymentStatus::createdAt).thenComparing(DeploymentStatus::statusId))
            .collect(Collectors.toList());
    }

    @Override
    public Optional<DeploymentStatus> compareAndSetStatus(DeploymentStatus updated) {
        if (updated == null) {
            throw new IllegalArgumentException("updated cannot be null");
        }
        AtomicReference<DeploymentStatus> written = new AtomicReference<>();
        DeploymentStatus result = statuses.computeIfPresent(updated.statusId(), (id, current) -> {
            if (current.version() != updated.version()) {
                return current;
            }
            DeploymentStatus next = updated.withVersion(current.version() + 1);
            written.set(next);
            return next;
        });
        if (result == null) {
            throw new IllegalStateException("Deployment status not found: " + updated.statusId());
        }
        return Optional.ofNullable(written.get());
    }

    @Override
    public Optional<DeploymentStatus> compareAndSetStatusIfEligible(DeploymentStatus updated) {
        if (updated == null) {
            throw new IllegalArgumentException("updated cannot be null");
        }
        AtomicReference<DeploymentStatus> written = new AtomicReference<>();
        Deployment owner = deployments.computeIfPresent(updated.deploymentId(), (id, deployment) -> {
            if (deployment.isEligible(updated)) {
                compareAndSetStatus(updated).ifPresent(written::set);
            }
            return deployment;
        });
        if (owner == null) {
            throw new IllegalStateException("Deployment not found: " + updated.deploymentId());
        }
        return Optional.ofNullable(written.get());
    }

    private record UniqueKey(DeploymentId deploymentId, NodeId nodeId) {
    }
}
