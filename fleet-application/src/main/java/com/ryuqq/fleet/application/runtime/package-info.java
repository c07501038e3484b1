/**
 * Background sweep runtime contract.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.fleet.application.runtime;
