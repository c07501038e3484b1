/**
 * In-memory node event publisher.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.fleet.adapter.inmemory.event;
