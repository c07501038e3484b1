package com.ryuqq.fleet.core.spi;

import com.ryuqq.fleet.core.model.NodeEvent;

/**
 * Outbound port for node availability events.
 *
 * <p>The core only emits events; alert delivery (mail, chat, dashboards) belongs to the
 * external collaborator behind this interface. Implementations should return quickly and
 * must not throw for delivery failures they can handle themselves.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface NodeEventPublisher {

    /**
     * Publishes a node event.
     *
     * @param event the event
     * @throws IllegalArgumentException if event is null
     */
    void publish(NodeEvent event);
}
