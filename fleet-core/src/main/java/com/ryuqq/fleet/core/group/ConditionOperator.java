package com.ryuqq.fleet.core.group;

/**
 * 동적 그룹 조건 연산자.
 *
 * <p>wire 값은 저장된 조건식(JSON)의 {@code op} 필드와 일치합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ConditionOperator {

    EQUALS("equals"),
    NOT_EQUALS("not_equals"),
    CONTAINS("contains"),
    NOT_CONTAINS("not_contains"),
    STARTS_WITH("startswith"),
    ENDS_WITH("endswith"),
    GREATER_OR_EQUAL("gte"),
    LESS_OR_EQUAL("lte"),
    REGEX("regex"),
    HAS_TAG("has_tag");

    private final String wireValue;

    ConditionOperator(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /**
     * wire 값으로부터 연산자 조회.
     *
     * @param value wire 값 (예: "startswith")
     * @return ConditionOperator
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static ConditionOperator fromWire(String value) {
        for (ConditionOperator operator : values()) {
            if (operator.wireValue.equalsIgnoreCase(value)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown condition operator: " + value);
    }
}
