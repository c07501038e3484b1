/**
 * Domain exceptions.
 *
 * <ul>
 *   <li>{@link com.ryuqq.fleet.core.exception.FleetException} - unchecked base carrying an error code</li>
 *   <li>{@link com.ryuqq.fleet.core.exception.TargetResolutionException} - {@code TARGET-001}</li>
 *   <li>{@link com.ryuqq.fleet.core.exception.ClaimConflictException} - {@code CLAIM-409}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.fleet.core.exception;
