/**
 * Agent poll/report contract.
 *
 * <p>{@link com.ryuqq.fleet.application.gateway.AgentGateway} and its wire records.
 * Field names on the wire are snake_case and are fixed; they are encoded by
 * {@link com.ryuqq.fleet.application.gateway.AgentJson}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.fleet.application.gateway;
