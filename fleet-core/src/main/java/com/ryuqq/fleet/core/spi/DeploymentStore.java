package com.ryuqq.fleet.core.spi;

import com.ryuqq.fleet.core.model.Deployment;
import com.ryuqq.fleet.core.model.DeploymentId;
import com.ryuqq.fleet.core.model.DeploymentStatus;
import com.ryuqq.fleet.core.model.InstanceId;
import com.ryuqq.fleet.core.model.NodeId;
import com.ryuqq.fleet.core.statemachine.DeploymentState;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistent storage SPI for deployments and their per-node status rows.
 *
 * <p>Same primitives as {@link JobStore}: a unique insert on (deployment_id, node_id) and
 * version-checked compare-and-set updates on both the deployment (controller state and
 * batch release) and the status rows.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface DeploymentStore {

    /**
     * Inserts a new deployment.
     *
     * @param deployment the deployment (version 0)
     * @throws IllegalArgumentException if deployment is null
     * @throws IllegalStateException if a deployment with the same id already exists
     */
    void saveDeployment(Deployment deployment);

    /**
     * @param deploymentId the deployment id
     * @return the deployment, or empty if unknown
     * @throws IllegalArgumentException if deploymentId is null
     */
    Optional<Deployment> findDeployment(DeploymentId deploymentId);

    /**
     * Pages through deployments in any of the given controller states, oldest first.
     *
     * <p>Pages are keyed on (created_at, deployment_id), so a caller that passes the last
     * deployment of one page as {@code after} gets the next page even when deployments of the
     * previous page changed state in the meantime.</p>
     *
     * <pre>
     * SELECT * FROM deployments
     * WHERE status IN (?)
     *   AND (created_at, deployment_id) &gt; (?, ?)
     * ORDER BY created_at ASC, deployment_id ASC
     * LIMIT ?;
     * </pre>
     *
     * @param states controller states to match
     * @param after the last deployment of the previous page, or null for the first page
     * @param batchSize maximum number of deployments to return
     * @return matching deployments (may be empty)
     * @throws IllegalArgumentException if states is null or empty, or batchSize is not positive
     */
    List<Deployment> scanByStates(Set<DeploymentState> states, Deployment after, int batchSize);

    /**
     * Persists {@code updated} if the stored version equals {@code updated.version()}.
     *
     * @param updated the new state carrying the version it was derived from
     * @return the stored deployment with its incremented version, or empty if the version did not match
     * @throws IllegalArgumentException if updated is null
     * @throws IllegalStateException if the deployment does not exist
     */
    Optional<Deployment> compareAndSet(Deployment updated);

    /**
     * Inserts the status row unless one already exists for its (deployment_id, node_id).
     *
     * @param status the new row (version 0)
     * @return the stored row: the inserted one, or the one that already existed
     * @throws IllegalArgumentException if status is null
     */
    DeploymentStatus createStatusIfAbsent(DeploymentStatus status);

    /**
     * @param statusId the row id
     * @return the row, or empty if unknown
     * @throws IllegalArgumentException if statusId is null
     */
    Optional<DeploymentStatus> findStatus(InstanceId statusId);

    /**
     * @param deploymentId the deployment id
     * @return all rows of the deployment ordered by batch index, then node id
     * @throws IllegalArgumentException if deploymentId is null
     */
    List<DeploymentStatus> findStatusesByDeployment(DeploymentId deploymentId);

    /**
     * @param nodeId the node id
     * @return all rows targeting the node, oldest first
     * @throws IllegalArgumentException if nodeId is null
     */
    List<DeploymentStatus> findStatusesByNode(NodeId nodeId);

    /**
     * Persists {@code updated} if the stored version equals {@code updated.version()}.
     *
     * @param updated the new state carrying the version it was derived from
     * @return the stored row with its incremented version, or empty if the version did not match
     * @throws IllegalArgumentException if updated is null
     * @throws IllegalStateException if the row does not exist
     */
    Optional<DeploymentStatus> compareAndSetStatus(DeploymentStatus updated);

    /**
     * Persists {@code updated} like {@link #compareAndSetStatus(DeploymentStatus)}, but only while
     * the owning deployment still makes the row eligible: the deployment is ACTIVE and the row's
     * batch has been released.
     *
     * <p>Used for claims. A cancel or pause committed after the caller read the deployment makes
     * this return empty instead of handing the row to an agent.</p>
     *
     * <pre>
     * UPDATE deployment_statuses s SET ..., version = s.version + 1
     * FROM deployments d
     * WHERE s.deployment_status_id = ? AND s.version = ?
     *   AND d.deployment_id = s.deployment_id
     *   AND d.status = 'active'
     *   AND s.batch_index &lt;= d.released_batch;
     * </pre>
     *
     * @param updated the new state carrying the version it was derived from
     * @return the stored row with its incremented version, or empty if the version did not match or
     *         the deployment no longer makes the row eligible
     * @throws IllegalArgumentException if updated is null
     * @throws IllegalStateException if the row or its deployment does not exist
     */
    Optional<DeploymentStatus> compareAndSetStatusIfEligible(DeploymentStatus updated);
}
