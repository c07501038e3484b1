/**
 * Domain model.
 *
 * <h2>Identifiers</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fleet.core.model.NodeId}, {@link com.ryuqq.fleet.core.model.GroupId},
 *       {@link com.ryuqq.fleet.core.model.JobId}, {@link com.ryuqq.fleet.core.model.DeploymentId},
 *       {@link com.ryuqq.fleet.core.model.InstanceId}, {@link com.ryuqq.fleet.core.model.WindowId}</li>
 * </ul>
 *
 * <h2>Intent and work items</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fleet.core.model.Job} → {@link com.ryuqq.fleet.core.model.JobInstance} (one per node)</li>
 *   <li>{@link com.ryuqq.fleet.core.model.Deployment} → {@link com.ryuqq.fleet.core.model.DeploymentStatus} (one per node)</li>
 * </ul>
 *
 * <p>All records are immutable. State-changing methods return a new record that still carries
 * the version it was derived from; the store increments the version on a successful
 * compare-and-set.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.fleet.core.model;
