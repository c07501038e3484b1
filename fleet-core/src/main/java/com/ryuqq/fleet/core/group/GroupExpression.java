package com.ryuqq.fleet.core.group;

import java.util.List;

/**
 * 동적 그룹 멤버십 조건식 트리.
 *
 * <p>세 가지 노드 형태:</p>
 * <ul>
 *   <li>{@link And}: 모든 하위 식이 참</li>
 *   <li>{@link Or}: 하나 이상의 하위 식이 참</li>
 *   <li>{@link Condition}: 노드 속성 하나에 대한 비교</li>
 * </ul>
 *
 * <p>조건식은 해석 시점마다 {@link GroupExpressionEvaluator}로 평가되며,
 * 평가 결과(멤버십)는 저장되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface GroupExpression
    permits GroupExpression.And, GroupExpression.Or, GroupExpression.Condition {

    /**
     * 모든 하위 식이 참이어야 하는 결합.
     *
     * @param operands 하위 식 목록 (1개 이상)
     */
    record And(List<GroupExpression> operands) implements GroupExpression {
        public And {
            operands = requireOperands(operands);
        }
    }

    /**
     * 하나 이상의 하위 식이 참이면 되는 결합.
     *
     * @param operands 하위 식 목록 (1개 이상)
     */
    record Or(List<GroupExpression> operands) implements GroupExpression {
        public Or {
            operands = requireOperands(operands);
        }
    }

    /**
     * 노드 속성 비교 조건.
     *
     * @param field 속성 이름 (예: "os_name", "tags")
     * @param operator 비교 연산자
     * @param value 비교 값
     */
    record Condition(String field, ConditionOperator operator, String value) implements GroupExpression {
        public Condition {
            if (field == null || field.isBlank()) {
                throw new IllegalArgumentException("field cannot be null or blank");
            }
            if (operator == null) {
                throw new IllegalArgumentException("operator cannot be null");
            }
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null");
            }
        }
    }

    static GroupExpression and(GroupExpression... operands) {
        return new And(List.of(operands));
    }

    static GroupExpression or(GroupExpression... operands) {
        return new Or(List.of(operands));
    }

    static GroupExpression condition(String field, ConditionOperator operator, String value) {
        return new Condition(field, operator, value);
    }

    private static List<GroupExpression> requireOperands(List<GroupExpression> operands) {
        if (operands == null || operands.isEmpty()) {
            throw new IllegalArgumentException("operands cannot be null or empty");
        }
        if (operands.contains(null)) {
            throw new IllegalArgumentException("operands cannot contain null");
        }
        return List.copyOf(operands);
    }
}
