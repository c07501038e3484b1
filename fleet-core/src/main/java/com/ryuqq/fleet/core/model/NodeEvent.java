package com.ryuqq.fleet.core.model;

import java.time.Instant;

/**
 * 노드 가용성 변화 이벤트.
 *
 * <p>코어는 이벤트를 발행만 하며, 알림 전달은 외부 협력자의 책임입니다.</p>
 *
 * @param type 이벤트 유형
 * @param nodeId 노드 ID
 * @param hostname 호스트명
 * @param lastSeen 마지막 체크인 시각
 * @param consecutiveFailures 연속 미응답 횟수
 * @param occurredAt 발생 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record NodeEvent(
    Type type,
    NodeId nodeId,
    String hostname,
    Instant lastSeen,
    int consecutiveFailures,
    Instant occurredAt
) {

    public NodeEvent {
        if (type == null || nodeId == null || occurredAt == null) {
            throw new IllegalArgumentException("type, nodeId and occurredAt cannot be null");
        }
    }

    public static NodeEvent offline(Node node, Instant now) {
        return new NodeEvent(Type.OFFLINE, node.nodeId(), node.hostname(), node.lastSeen(), node.consecutiveFailures(), now);
    }

    public static NodeEvent online(Node node, Instant now) {
        return new NodeEvent(Type.ONLINE, node.nodeId(), node.hostname(), node.lastSeen(), 0, now);
    }

    /**
     * 이벤트 유형.
     */
    public enum Type {
        /** 오프라인 노드가 다시 체크인함 (오프라인 알림 해소) */
        ONLINE,
        /** 임계 시간 동안 체크인 없음 */
        OFFLINE
    }
}
