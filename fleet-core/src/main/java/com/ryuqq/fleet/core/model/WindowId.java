package com.ryuqq.fleet.core.model;

import java.util.UUID;

/**
 * 유지보수 윈도우(MaintenanceWindow)의 식별자.
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
public final class WindowId implements Comparable<WindowId> {

    private final String value;

    private WindowId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("WindowId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("WindowId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_.]+$")) {
            throw new IllegalArgumentException("WindowId contains invalid characters. Only alphanumeric, hyphen, underscore and dot are allowed");
        }
        this.value = value;
    }

    /**
     * WindowId 생성.
     *
     * @param value WindowId 값
     * @return WindowId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static WindowId of(String value) {
        return new WindowId(value);
    }

    /**
     * 새로운 무작위 WindowId 생성 (UUID 기반).
     *
     * @return WindowId 인스턴스
     */
    public static WindowId newId() {
        return new WindowId(UUID.randomUUID().toString());
    }

    /**
     * WindowId 값 조회.
     *
     * @return WindowId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(WindowId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WindowId that = (WindowId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "WindowId{" + value + '}';
    }
}
