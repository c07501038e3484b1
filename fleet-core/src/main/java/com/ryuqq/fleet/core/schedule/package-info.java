/**
 * Time-based scheduling constraints.
 *
 * <p>{@link com.ryuqq.fleet.core.schedule.MaintenanceWindow} restricts when batches of a
 * {@code maintenanceWindowOnly} deployment are released and when its rows are handed to agents.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.fleet.core.schedule;
