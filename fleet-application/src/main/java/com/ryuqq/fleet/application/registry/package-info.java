/**
 * Node registration and check-in.
 *
 * <p>Offline detection runs separately as a sweep; see the runner module's liveness monitor.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.fleet.application.registry;
