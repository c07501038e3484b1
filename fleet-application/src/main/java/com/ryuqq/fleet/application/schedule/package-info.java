/**
 * Maintenance window gating shared by rollout release and agent claims.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.fleet.application.schedule;
