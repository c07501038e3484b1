package com.ryuqq.fleet.application.gateway;

import com.ryuqq.fleet.core.model.Node;
import com.ryuqq.fleet.core.model.NodeId;

import java.util.Map;
import java.util.Optional;

/**
 * Agent poll/report gateway.
 *
 * <p>The only channel between the control plane and an endpoint. Endpoints never accept
 * inbound connections; they poll for work and later report results. Every call is
 * stateless and idempotent with respect to the store.</p>
 *
 * <p><strong>Poll contract:</strong></p>
 * <ul>
 *   <li>A poll also counts as a check-in</li>
 *   <li>A poll claims at most one item with a conditional transition; a caller that loses
 *       the race gets {@link Optional#empty()}, never a second copy of the same work</li>
 *   <li>While a claimed item is still in flight, repeated polls re-deliver that same item</li>
 *   <li>Polls never create rows</li>
 * </ul>
 *
 * <p><strong>Report contract:</strong></p>
 * <ul>
 *   <li>A report for an item that is already final, or that repeats the current state,
 *       is acknowledged with {@link ReportAck#DUPLICATE_IGNORED} so the agent stops retrying</li>
 *   <li>A report for an unknown id is acknowledged with {@link ReportAck#UNKNOWN_INSTANCE}</li>
 *   <li>A report the current state does not allow (never claimed, or moving backwards)
 *       is acknowledged with {@link ReportAck#REJECTED} and leaves the row unchanged</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface AgentGateway {

    /**
     * Claims the next job instance for the node ({@code queued → running}).
     *
     * <p>Highest job priority first, then oldest queued. If an instance is already
     * {@code running} on this node it is returned again instead.</p>
     *
     * @param nodeId the polling node
     * @return the job to execute, or empty if nothing is queued for the node
     * @throws IllegalArgumentException if nodeId is null
     */
    Optional<PendingJob> pendingJob(NodeId nodeId);

    /**
     * Records the result of a job instance.
     *
     * @param report the result
     * @return how the report was handled
     * @throws IllegalArgumentException if report is null
     */
    ReportAck reportJobResult(JobResultReport report);

    /**
     * Claims the next eligible deployment row for the node ({@code pending → downloading}).
     *
     * <p>A row is eligible when its deployment is active and its batch has been released.
     * Rows of maintenance-window-only deployments are handed out only while a window that
     * applies to this node is open. An in-flight row is re-delivered instead of claiming a new one.</p>
     *
     * @param nodeId the polling node
     * @return the deployment to apply, or empty if nothing is eligible
     * @throws IllegalArgumentException if nodeId is null
     */
    Optional<PendingDeployment> pendingDeployment(NodeId nodeId);

    /**
     * Records a progress or result report for a deployment row.
     *
     * @param report the report
     * @return how the report was handled
     * @throws IllegalArgumentException if report is null
     */
    ReportAck reportDeploymentStatus(DeploymentStatusReport report);

    /**
     * Dedicated check-in without polling for work.
     *
     * @param nodeId the node
     * @param hostname the reported hostname
     * @param attributes reported inventory attributes (may be null)
     * @return the stored node
     */
    Node heartbeat(NodeId nodeId, String hostname, Map<String, String> attributes);
}
