package com.ryuqq.fleet.application.runtime;

/**
 * Recurring background sweep.
 *
 * <p>Sweeps drive every time-based transition of the control plane: dispatching due job
 * instances, expiring stale ones, advancing rollouts and detecting offline nodes. They are
 * periodic, not per-request, and must be safe to run concurrently from more than one
 * control-plane process.</p>
 *
 * <p><strong>Sweep contract:</strong></p>
 * <ul>
 *   <li>Each item is claimed with the same compare-and-set pattern used by agent polls;
 *       losing a claim means another process handled the item</li>
 *   <li>A failure on one item is logged and never aborts its siblings</li>
 *   <li>An idle sweep that finds nothing to do is a normal, frequent outcome</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
 * scheduler.scheduleWithFixedDelay(sweep::sweep, 0, 5_000, TimeUnit.MILLISECONDS);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Sweep {

    /**
     * @return a short stable name used in logs and thread names
     */
    String name();

    /**
     * Runs one sweep pass.
     *
     * @return number of items changed by this pass
     * @throws RuntimeException only for infrastructure failures (e.g. store unavailable)
     */
    int sweep();
}
