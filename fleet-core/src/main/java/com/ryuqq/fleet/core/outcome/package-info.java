/**
 * Execution result classification.
 *
 * <p>A job result reported by an agent is classified into one of three cases
 * before it is applied to the instance:</p>
 * <ul>
 *   <li>{@link com.ryuqq.fleet.core.outcome.Ok} - exit code 0</li>
 *   <li>{@link com.ryuqq.fleet.core.outcome.Retry} - failed, another attempt is scheduled</li>
 *   <li>{@link com.ryuqq.fleet.core.outcome.Fail} - failed, attempts exhausted</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.fleet.core.outcome;
