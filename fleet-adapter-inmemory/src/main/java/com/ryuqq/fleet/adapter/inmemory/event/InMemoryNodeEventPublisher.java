package com.ryuqq.fleet.adapter.inmemory.event;

import com.ryuqq.fleet.core.model.NodeEvent;
import com.ryuqq.fleet.core.spi.NodeEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 노드 이벤트를 메모리에 보관하고 등록된 구독자에게 동기 전달하는 발행자.
 *
 * <p>구독자 하나가 예외를 던져도 나머지 구독자 전달과 발행 호출자는 영향을 받지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryNodeEventPublisher implements NodeEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(InMemoryNodeEventPublisher.class);

    private final List<NodeEvent> published = new CopyOnWriteArrayList<>();
    private final List<Consumer<NodeEvent>> subscribers = new CopyOnWriteArrayList<>();

    @Override
    public void publish(NodeEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        published.add(event);
        log.info("Node event {} for {} ({})", event.type(), event.nodeId().getValue(), event.hostname());
        for (Consumer<NodeEvent> subscriber : subscribers) {
            try {
                subscriber.accept(event);
            } catch (RuntimeException e) {
                log.error("Node event subscriber failed for {} {}", event.type(), event.nodeId().getValue(), e);
            }
        }
    }

    /**
     * 구독자 등록.
     *
     * @param subscriber 이벤트 소비자
     */
    public void subscribe(Consumer<NodeEvent> subscriber) {
        if (subscriber == null) {
            throw new IllegalArgumentException("subscriber cannot be null");
        }
        subscribers.add(subscriber);
    }

    /**
     * 지금까지 발행된 이벤트 (발행 순서).
     *
     * @return 불변 스냅샷
     */
    public List<NodeEvent> published() {
        return List.copyOf(published);
    }

    /**
     * 특정 유형의 이벤트만 조회.
     */
    public List<NodeEvent> published(NodeEvent.Type type) {
        return published.stream().filter(event -> event.type() == type).toList();
    }
}
