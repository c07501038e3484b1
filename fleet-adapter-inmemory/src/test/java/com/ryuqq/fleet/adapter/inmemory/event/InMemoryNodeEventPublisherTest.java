package com.ryuqq.fleet.adapter.inmemory.event;

import com.ryuqq.fleet.core.model.Node;
import com.ryuqq.fleet.core.model.NodeEvent;
import com.ryuqq.fleet.core.model.NodeId;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * InMemoryNodeEventPublisher 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryNodeEventPublisherTest {

    private static final Instant NOW = Instant.parse("2025-01-06T10:00:00Z");

    @Test
    void publish_이벤트를_기록하고_유형별로_조회할_수_있음() {
        // given
        InMemoryNodeEventPublisher publisher = new InMemoryNodeEventPublisher();
        Node node = Node.register(NodeId.of("node-1"), "pc-001", null, NOW);

        // when
        publisher.publish(NodeEvent.offline(node.missedCheckIn(), NOW));
        publisher.publish(NodeEvent.online(node, NOW));

        // then
        assertThat(publisher.published()).hasSize(2);
        assertThat(publisher.published(NodeEvent.Type.OFFLINE))
            .singleElement()
            .satisfies(event -> {
                assertThat(event.nodeId()).isEqualTo(node.nodeId());
                assertThat(event.consecutiveFailures()).isEqualTo(1);
            });
    }

    @Test
    void publish_구독자_예외는_다른_구독자를_막지_않음() {
        // given
        InMemoryNodeEventPublisher publisher = new InMemoryNodeEventPublisher();
        List<NodeEvent> received = new ArrayList<>();
        publisher.subscribe(event -> {
            throw new IllegalStateException("alert channel down");
        });
        publisher.subscribe(received::add);
        Node node = Node.register(NodeId.of("node-1"), "pc-001", null, NOW);

        // when
        publisher.publish(NodeEvent.offline(node, NOW));

        // then
        assertThat(received).hasSize(1);
        assertThat(publisher.published()).hasSize(1);
    }
}
