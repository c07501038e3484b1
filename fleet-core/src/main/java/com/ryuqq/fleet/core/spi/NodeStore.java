package com.ryuqq.fleet.core.spi;

import com.ryuqq.fleet.core.model.Node;
import com.ryuqq.fleet.core.model.NodeId;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistent storage SPI for nodes.
 *
 * <p>Nodes are created on first check-in and are never hard-deleted. Every update is a
 * version-checked compare-and-set: the caller passes the record it read (with the version
 * it read) transformed into the desired state, and the store persists it only if the stored
 * version still matches.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods may be called concurrently from multiple threads and processes</li>
 *   <li>Unique: at most one record per {@link NodeId}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface NodeStore {

    /**
     * Inserts the node unless one with the same id already exists.
     *
     * <pre>
     * INSERT INTO nodes (...) VALUES (...) ON CONFLICT (node_id) DO NOTHING;
     * </pre>
     *
     * @param node the node to insert (version 0)
     * @return the stored node: the inserted one, or the existing one when the insert lost
     * @throws IllegalArgumentException if node is null
     */
    Node createIfAbsent(Node node);

    /**
     * @param nodeId the node id
     * @return the node, or empty if unknown
     * @throws IllegalArgumentException if nodeId is null
     */
    Optional<Node> find(NodeId nodeId);

    /**
     * Returns every known node ordered by node id.
     *
     * @return all nodes (may be empty)
     */
    List<Node> findAll();

    /**
     * Persists {@code updated} if the stored version equals {@code updated.version()}.
     *
     * <pre>
     * UPDATE nodes SET ..., version = version + 1
     * WHERE node_id = ? AND version = ?;
     * </pre>
     *
     * @param updated the new state carrying the version it was derived from
     * @return the stored node with its incremented version, or empty if the version did not match
     * @throws IllegalArgumentException if updated is null
     * @throws IllegalStateException if the node does not exist
     */
    Optional<Node> compareAndSet(Node updated);

    /**
     * Scans nodes whose last check-in is older than the liveness threshold scaled by
     * their missed-check-in count.
     *
     * <pre>
     * SELECT * FROM nodes
     * WHERE last_seen &lt; :now - :threshold * (consecutive_failures + 1)
     * ORDER BY last_seen ASC
     * LIMIT ?;
     * </pre>
     *
     * @param now the current time
     * @param threshold offline threshold
     * @param batchSize maximum number of nodes to return
     * @return stale nodes, oldest check-in first (may be empty)
     * @throws IllegalArgumentException if any argument is null or batchSize is not positive
     */
    List<Node> scanStale(Instant now, Duration threshold, int batchSize);
}
