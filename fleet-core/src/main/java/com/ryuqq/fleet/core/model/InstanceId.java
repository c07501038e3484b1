package com.ryuqq.fleet.core.model;

import java.util.UUID;

/**
 * 노드별 작업 단위(JobInstance 또는 DeploymentStatus)의 식별자.
 *
 * <p>에이전트는 이 값으로 결과를 보고하므로 외부에 노출되는 식별자입니다.</p>
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
public final class InstanceId implements Comparable<InstanceId> {

    private final String value;

    private InstanceId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("InstanceId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("InstanceId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_.]+$")) {
            throw new IllegalArgumentException("InstanceId contains invalid characters. Only alphanumeric, hyphen, underscore and dot are allowed");
        }
        this.value = value;
    }

    /**
     * InstanceId 생성.
     *
     * @param value InstanceId 값
     * @return InstanceId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static InstanceId of(String value) {
        return new InstanceId(value);
    }

    /**
     * 새로운 무작위 InstanceId 생성 (UUID 기반).
     *
     * @return InstanceId 인스턴스
     */
    public static InstanceId newId() {
        return new InstanceId(UUID.randomUUID().toString());
    }

    /**
     * InstanceId 값 조회.
     *
     * @return InstanceId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(InstanceId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        InstanceId that = (InstanceId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "InstanceId{" + value + '}';
    }
}
