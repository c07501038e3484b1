package com.ryuqq.fleet.core.model;

import java.util.UUID;

/**
 * Job(일회성 명령 의도)의 식별자.
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
public final class JobId implements Comparable<JobId> {

    private final String value;

    private JobId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("JobId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("JobId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_.]+$")) {
            throw new IllegalArgumentException("JobId contains invalid characters. Only alphanumeric, hyphen, underscore and dot are allowed");
        }
        this.value = value;
    }

    /**
     * JobId 생성.
     *
     * @param value JobId 값
     * @return JobId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static JobId of(String value) {
        return new JobId(value);
    }

    /**
     * 새로운 무작위 JobId 생성 (UUID 기반).
     *
     * @return JobId 인스턴스
     */
    public static JobId newId() {
        return new JobId(UUID.randomUUID().toString());
    }

    /**
     * JobId 값 조회.
     *
     * @return JobId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(JobId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JobId that = (JobId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "JobId{" + value + '}';
    }
}
