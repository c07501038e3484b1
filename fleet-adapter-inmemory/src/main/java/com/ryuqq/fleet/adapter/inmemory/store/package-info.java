/**
 * In-memory store adapters.
 *
 * <p>Thread-safe reference implementations of every store SPI. They honor the same unique
 * insert and compare-and-set contracts a relational adapter must honor, and are verified by
 * the abstract contract tests in {@code fleet-testkit}.</p>
 *
 * <p><strong>Limitations:</strong> no durability, linear scans. Not for production fleets.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.fleet.adapter.inmemory.store;
