package com.ryuqq.fleet.core.model;

import java.util.UUID;

/**
 * 노드 그룹(정적/동적)의 식별자.
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
public final class GroupId implements Comparable<GroupId> {

    private final String value;

    private GroupId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("GroupId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("GroupId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_.]+$")) {
            throw new IllegalArgumentException("GroupId contains invalid characters. Only alphanumeric, hyphen, underscore and dot are allowed");
        }
        this.value = value;
    }

    /**
     * GroupId 생성.
     *
     * @param value GroupId 값
     * @return GroupId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static GroupId of(String value) {
        return new GroupId(value);
    }

    /**
     * 새로운 무작위 GroupId 생성 (UUID 기반).
     *
     * @return GroupId 인스턴스
     */
    public static GroupId newId() {
        return new GroupId(UUID.randomUUID().toString());
    }

    /**
     * GroupId 값 조회.
     *
     * @return GroupId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(GroupId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GroupId that = (GroupId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "GroupId{" + value + '}';
    }
}
