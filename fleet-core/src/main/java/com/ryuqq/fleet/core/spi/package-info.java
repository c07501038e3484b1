/**
 * Service Provider Interface (SPI) package.
 *
 * <p>Interfaces implemented by infrastructure adapters. The core consumes the durable store
 * only through these ports.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fleet.core.spi.NodeStore} - nodes, liveness scan</li>
 *   <li>{@link com.ryuqq.fleet.core.spi.GroupStore} - static and dynamic groups</li>
 *   <li>{@link com.ryuqq.fleet.core.spi.JobStore} - jobs and job instances</li>
 *   <li>{@link com.ryuqq.fleet.core.spi.DeploymentStore} - deployments and status rows</li>
 *   <li>{@link com.ryuqq.fleet.core.spi.MaintenanceWindowStore} - maintenance windows</li>
 *   <li>{@link com.ryuqq.fleet.core.spi.NodeEventPublisher} - outbound node events</li>
 * </ul>
 *
 * <h2>Implementation Guidelines</h2>
 * <ul>
 *   <li><strong>Unique insert:</strong> {@code createIfAbsent} methods return the existing row on conflict</li>
 *   <li><strong>Compare-and-set:</strong> updates succeed only if the stored version equals the
 *       version carried by the argument; the stored version is then incremented</li>
 *   <li><strong>No locks:</strong> a lost race returns an empty result</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.fleet.core.spi;
