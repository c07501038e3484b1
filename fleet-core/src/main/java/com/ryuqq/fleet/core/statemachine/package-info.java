/**
 * Instance state machine package.
 *
 * <p>This package implements the lifecycle rules shared by every per-node unit of work
 * (JobInstance, DeploymentStatus) and the controller-owned Deployment state.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fleet.core.statemachine.LifecycleState} - common contract (terminal flag, wire value)</li>
 *   <li>{@link com.ryuqq.fleet.core.statemachine.JobInstanceState} - JobInstance lifecycle</li>
 *   <li>{@link com.ryuqq.fleet.core.statemachine.DeploymentStatusState} - per-node deployment lifecycle</li>
 *   <li>{@link com.ryuqq.fleet.core.statemachine.DeploymentState} - controller state of a Deployment</li>
 *   <li>{@link com.ryuqq.fleet.core.statemachine.StateTransition} - transition validation</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * pending → queued → running → success | failed | cancelled | expired
 * failed (retry scheduled) → pending
 *
 * pending → downloading → installing → success | failed
 * pending → skipped
 * </pre>
 *
 * <h2>Wire Compatibility</h2>
 * <p>{@code wireValue()} strings are persisted and exchanged with agents bit-exact;
 * they must never change.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.fleet.core.statemachine;
