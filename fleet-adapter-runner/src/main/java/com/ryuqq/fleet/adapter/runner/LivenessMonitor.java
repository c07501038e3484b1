package com.ryuqq.fleet.adapter.runner;

import com.ryuqq.fleet.application.runtime.Sweep;
import com.ryuqq.fleet.core.model.Node;
import com.ryuqq.fleet.core.model.NodeEvent;
import com.ryuqq.fleet.core.spi.NodeEventPublisher;
import com.ryuqq.fleet.core.spi.NodeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Liveness Monitor 컴포넌트.
 *
 * <p>체크인이 끊긴 노드를 찾아 연속 미응답 횟수를 올리고 오프라인으로 표시합니다.
 * 온라인에서 오프라인으로 바뀌는 순간에만 {@link NodeEvent.Type#OFFLINE} 이벤트를 발행합니다.</p>
 *
 * <p><strong>판정 기준:</strong></p>
 * <pre>
 * lastSeen &lt; now - offlineThreshold × (consecutiveFailures + 1)
 * </pre>
 *
 * <p>미응답이 계속되면 임계값 한 주기마다 consecutiveFailures가 1씩 증가합니다. 이미 세어진
 * 노드는 다음 주기가 될 때까지 스캔 결과에 나타나지 않으므로 배치를 차지하지 않습니다.</p>
 *
 * <p>오프라인 노드도 디스패치 대상으로 남으며, 다음 체크인 때 {@code NodeRegistry}가
 * 온라인으로 되돌리고 ONLINE 이벤트를 발행합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class LivenessMonitor implements Sweep {

    private static final Logger log = LoggerFactory.getLogger(LivenessMonitor.class);

    private final NodeStore nodeStore;
    private final NodeEventPublisher eventPublisher;
    private final LivenessMonitorConfig config;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param nodeStore 노드 저장소
     * @param eventPublisher 노드 이벤트 발행자
     * @param config 설정
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public LivenessMonitor(NodeStore nodeStore, NodeEventPublisher eventPublisher,
                           LivenessMonitorConfig config, Clock clock) {
        if (nodeStore == null) {
            throw new IllegalArgumentException("nodeStore cannot be null");
        }
        if (eventPublisher == null) {
            throw new IllegalArgumentException("eventPublisher cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.nodeStore = nodeStore;
        this.eventPublisher = eventPublisher;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "liveness-monitor";
    }

    @Override
    public int sweep() {
        Instant now = clock.instant();
        List<Node> stale = nodeStore.scanStale(now, Duration.ofMillis(config.offlineThresholdMs()), config.batchSize());

        int marked = 0;
        int wentOffline = 0;
        for (Node node : stale) {
            Optional<Node> stored = tryMarkMissed(node);
            if (stored.isEmpty()) {
                continue;
            }
            marked++;
            if (node.online() && publishOffline(stored.get(), now)) {
                wentOffline++;
            }
        }

        if (marked == 0) {
            log.debug("LivenessMonitor sweep idle");
        } else {
            log.info("LivenessMonitor sweep completed: {} stale nodes, {} went offline", marked, wentOffline);
        }
        return marked;
    }

    private Optional<Node> tryMarkMissed(Node node) {
        try {
            Optional<Node> stored = nodeStore.compareAndSet(node.missedCheckIn());
            if (stored.isEmpty()) {
                log.debug("Skipped node {}: checked in concurrently", node.nodeId().getValue());
            }
            return stored;
        } catch (Exception e) {
            log.error("Failed to mark node {} in LivenessMonitor sweep", node.nodeId().getValue(), e);
            return Optional.empty();
        }
    }

    private boolean publishOffline(Node node, Instant now) {
        try {
            eventPublisher.publish(NodeEvent.offline(node, now));
            log.warn("Node {} ({}) went offline, last seen {}", node.nodeId().getValue(), node.hostname(), node.lastSeen());
            return true;
        } catch (Exception e) {
            log.error("Failed to publish offline event for node {}", node.nodeId().getValue(), e);
            return false;
        }
    }
}
