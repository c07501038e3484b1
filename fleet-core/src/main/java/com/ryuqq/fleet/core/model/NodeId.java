package com.ryuqq.fleet.core.model;

/**
 * 관리 대상 엔드포인트(Node)의 안정적인 식별자.
 *
 * <p>에이전트가 최초 체크인 시 보고하는 값으로, 호스트명이 바뀌어도 유지됩니다.
 * 모든 JobInstance / DeploymentStatus는 이 값으로 노드를 참조합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 점(.)만 허용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NodeId implements Comparable<NodeId> {

    private final String value;

    private NodeId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("NodeId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("NodeId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_.]+$")) {
            throw new IllegalArgumentException("NodeId contains invalid characters. Only alphanumeric, hyphen, underscore and dot are allowed");
        }
        this.value = value;
    }

    /**
     * NodeId 생성.
     *
     * @param value NodeId 값
     * @return NodeId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static NodeId of(String value) {
        return new NodeId(value);
    }

    /**
     * NodeId 값 조회.
     *
     * @return NodeId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(NodeId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeId that = (NodeId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "NodeId{" + value + '}';
    }
}
