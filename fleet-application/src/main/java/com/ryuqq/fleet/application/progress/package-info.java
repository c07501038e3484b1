/**
 * Read-side roll-up of job and deployment progress.
 *
 * <p>Progress is computed from the per-node rows on every call and is never stored.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.fleet.application.progress;
