package com.ryuqq.fleet.adapter.inmemory.store;

import com.ryuqq.fleet.core.model.Node;
import com.ryuqq.fleet.core.model.NodeId;
import com.ryuqq.fleet.core.spi.NodeStore;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link NodeStore}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryNodeStore implements NodeStore {

    private final ConcurrentHashMap<NodeId, Node> nodes = new ConcurrentHashMap<>();

    @Override
    public Node createIfAbsent(Node node) {
        if (node == null) {
            throw new IllegalArgumentException("node cannot be null");
        }
        Node existing = nodes.putIfAbsent(node.nodeId(), node);
        return existing != null ? existing : node;
    }

    @Override
    public Optional<Node> find(NodeId nodeId) {
        if (nodeId == null) {
            throw new IllegalArgumentException("nodeId cannot be null");
        }
        return Optional.ofNullable(nodes.get(nodeId));
    }

    @Override
    public List<Node> findAll() {
        return nodes.values().stream()
            .sorted(Comparator.comparing(Node::nodeId))
            .collect(Collectors.toList());
    }

    @Override
    public Optional<Node> compareAndSet(Node updated) {
        if (updated == null) {
            throw new IllegalArgumentException("updated cannot be null");
        }
        AtomicReference<Node> written = new AtomicReference<>();
        Node result = nodes.computeIfPresent(updated.nodeId(), (id, current) -> {
            if (current.version() != updated.version()) {
                return current;
            }
            Node next = updated.withVersion(current.version() + 1);
            written.set(next);
            return next;
        });
        if (result == null) {
            throw new IllegalStateException("Node not found: " + updated.nodeId());
        }
        return Optional.ofNullable(written.get());
    }

    @Override
    public List<Node> scanStale(Instant now, Duration threshold, int batchSize) {
        if (now == null || threshold == null) {
            throw new IllegalArgumentException("now and threshold cannot be null");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive (current: " + batchSize + ")");
        }
        return nodes.values().stream()
            .filter(node -> node.lastSeen().isBefore(now.minus(threshold.multipliedBy(node.consecutiveFailures() + 1L))))
            .sorted(Comparator.comparing(Node::lastSeen))
            .limit(batchSize)
            .collect(Collectors.toList());
    }
}
