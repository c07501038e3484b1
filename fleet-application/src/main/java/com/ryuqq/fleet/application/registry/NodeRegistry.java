package com.ryuqq.fleet.application.registry;

import com.ryuqq.fleet.application.support.OptimisticUpdate;
import com.ryuqq.fleet.core.exception.ClaimConflictException;
import com.ryuqq.fleet.core.model.Node;
import com.ryuqq.fleet.core.model.NodeEvent;
import com.ryuqq.fleet.core.model.NodeId;
import com.ryuqq.fleet.core.spi.NodeEventPublisher;
import com.ryuqq.fleet.core.spi.NodeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 노드 등록부: 체크인과 태그 관리.
 *
 * <p><strong>체크인:</strong> 처음 보는 노드는 등록하고, 알려진 노드는 lastSeen 갱신,
 * 온라인 전환, 연속 미응답 횟수 초기화를 조건부 갱신으로 반영합니다.
 * 오프라인이던 노드가 돌아오면 ONLINE 이벤트를 발행합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class NodeRegistry {

    private static final Logger log = LoggerFactory.getLogger(NodeRegistry.class);

    private final NodeStore nodeStore;
    private final NodeEventPublisher eventPublisher;
    private final Clock clock;

    public NodeRegistry(NodeStore nodeStore, NodeEventPublisher eventPublisher, Clock clock) {
        if (nodeStore == null) {
            throw new IllegalArgumentException("nodeStore cannot be null");
        }
        if (eventPublisher == null) {
            throw new IllegalArgumentException("eventPublisher cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.nodeStore = nodeStore;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * 체크인 반영.
     *
     * @param nodeId 노드 ID
     * @param hostname 호스트명 (최초 체크인 시 필수, 이후 null이면 기존 값 유지)
     * @param attributes 보고된 인벤토리 속성 (null 허용)
     * @return 저장된 노드
     * @throws IllegalArgumentException nodeId가 null이거나 최초 체크인에 hostname이 없는 경우
     * @throws ClaimConflictException 동시 체크인 경합이 계속된 경우
     */
    public Node checkIn(NodeId nodeId, String hostname, Map<String, String> attributes) {
        if (nodeId == null) {
            throw new IllegalArgumentException("nodeId cannot be null");
        }
        Instant now = clock.instant();

        for (int attempt = 1; attempt <= OptimisticUpdate.MAX_ATTEMPTS; attempt++) {
            Optional<Node> existing = nodeStore.find(nodeId);
            if (existing.isEmpty()) {
                Node candidate = Node.register(nodeId, requireHostname(nodeId, hostname), attributes, now);
                Node stored = nodeStore.createIfAbsent(candidate);
                if (stored.equals(candidate)) {
                    log.info("Node {} registered: hostname={}", nodeId.getValue(), stored.hostname());
                    return stored;
                }
                continue;
            }

            Node current = existing.get();
            Optional<Node> stored = nodeStore.compareAndSet(current.checkIn(hostname, attributes, now));
            if (stored.isPresent()) {
                if (!current.online()) {
                    log.info("Node {} back online after {} missed check-in(s)",
                        nodeId.getValue(), current.consecutiveFailures());
                    eventPublisher.publish(NodeEvent.online(stored.get(), now));
                }
                return stored.get();
            }
        }
        throw new ClaimConflictException("Gave up check-in of node " + nodeId.getValue());
    }

    /**
     * 노드 태그 교체.
     *
     * @param nodeId 노드 ID
     * @param tags 새 태그 집합
     * @return 저장된 노드
     * @throws IllegalStateException 노드가 존재하지 않는 경우
     */
    public Node assignTags(NodeId nodeId, Set<String> tags) {
        if (nodeId == null) {
            throw new IllegalArgumentException("nodeId cannot be null");
        }
        Node stored = OptimisticUpdate.apply(
            "node " + nodeId.getValue(),
            () -> nodeStore.find(nodeId),
            current -> current.withTags(tags),
            nodeStore::compareAndSet
        );
        log.info("Node {} tags set to {}", nodeId.getValue(), stored.tags());
        return stored;
    }

    public Optional<Node> find(NodeId nodeId) {
        return nodeStore.find(nodeId);
    }

    public List<Node> findAll() {
        return nodeStore.findAll();
    }

    private static String requireHostname(NodeId nodeId, String hostname) {
        if (hostname == null || hostname.isBlank()) {
            throw new IllegalArgumentException("hostname is required on first check-in of " + nodeId.getValue());
        }
        return hostname;
    }
}
