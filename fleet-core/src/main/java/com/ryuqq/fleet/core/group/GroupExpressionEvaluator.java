package com.ryuqq.fleet.core.group;

import com.ryuqq.fleet.core.model.Node;

import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 동적 그룹 조건식 평가기.
 *
 * <p>노드 속성만을 입력으로 하는 순수 함수입니다. 리플렉션이나 동적 타입을 사용하지 않습니다.</p>
 *
 * <p><strong>비교 규칙:</strong></p>
 * <ul>
 *   <li>문자열 비교는 대소문자를 구분하지 않음</li>
 *   <li>gte / lte: 양쪽이 숫자이면 숫자 비교, 아니면 점(.)으로 구분된 버전 비교</li>
 *   <li>field가 "tags"이거나 연산자가 has_tag이면 노드 태그 집합과 비교</li>
 *   <li>속성이 없는 노드는 not_equals / not_contains에서만 참</li>
 *   <li>잘못된 정규식은 거짓으로 평가</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class GroupExpressionEvaluator {

    private static final String TAGS_FIELD = "tags";

    // Utility class - prevent instantiation
    private GroupExpressionEvaluator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 조건식을 노드에 대해 평가.
     *
     * @param expression 조건식
     * @param node 평가 대상 노드
     * @return 노드가 조건을 만족하면 true
     * @throws IllegalArgumentException expression 또는 node가 null인 경우
     */
    public static boolean matches(GroupExpression expression, Node node) {
        if (expression == null) {
            throw new IllegalArgumentException("expression cannot be null");
        }
        if (node == null) {
            throw new IllegalArgumentException("node cannot be null");
        }

        if (expression instanceof GroupExpression.And all) {
            for (GroupExpression operand : all.operands()) {
                if (!matches(operand, node)) {
                    return false;
                }
            }
            return true;
        }
        if (expression instanceof GroupExpression.Or any) {
            for (GroupExpression operand : any.operands()) {
                if (matches(operand, node)) {
                    return true;
                }
            }
            return false;
        }
        return matchesCondition((GroupExpression.Condition) expression, node);
    }

    private static boolean matchesCondition(GroupExpression.Condition condition, Node node) {
        ConditionOperator operator = condition.operator();
        String expected = condition.value();

        if (operator == ConditionOperator.HAS_TAG || TAGS_FIELD.equalsIgnoreCase(condition.field())) {
            boolean tagged = node.hasTag(expected.trim());
            return operator == ConditionOperator.NOT_EQUALS || operator == ConditionOperator.NOT_CONTAINS
                ? !tagged
                : tagged;
        }

        String actual = node.attribute(condition.field());
        if (actual == null) {
            return operator == ConditionOperator.NOT_EQUALS || operator == ConditionOperator.NOT_CONTAINS;
        }

        String left = actual.toLowerCase(Locale.ROOT);
        String right = expected.toLowerCase(Locale.ROOT);

        return switch (operator) {
            case EQUALS -> left.equals(right);
            case NOT_EQUALS -> !left.equals(right);
            case CONTAINS -> left.contains(right);
            case NOT_CONTAINS -> !left.contains(right);
            case STARTS_WITH -> left.startsWith(right);
            case ENDS_WITH -> left.endsWith(right);
            case GREATER_OR_EQUAL -> compare(actual, expected) >= 0;
            case LESS_OR_EQUAL -> compare(actual, expected) <= 0;
            case REGEX -> regex(expected, actual);
            case HAS_TAG -> node.hasTag(expected);
        };
    }

    private static boolean regex(String pattern, String actual) {
        try {
            return Pattern.compile(pattern, Pattern.CASE_INSENSITIVE).matcher(actual).find();
        } catch (PatternSyntaxException e) {
            return false;
        }
    }

    /**
     * 숫자 또는 점 구분 버전 비교.
     */
    static int compare(String left, String right) {
        Double leftNumber = parseNumber(left);
        Double rightNumber = parseNumber(right);
        if (leftNumber != null && rightNumber != null) {
            return Double.compare(leftNumber, rightNumber);
        }

        String[] leftParts = left.trim().split("\\.");
        String[] rightParts = right.trim().split("\\.");
        int length = Math.max(leftParts.length, rightParts.length);
        for (int i = 0; i < length; i++) {
            String l = i < leftParts.length ? leftParts[i] : "0";
            String r = i < rightParts.length ? rightParts[i] : "0";
            Double ln = parseNumber(l);
            Double rn = parseNumber(r);
            int result = ln != null && rn != null
                ? Double.compare(ln, rn)
                : l.compareToIgnoreCase(r);
            if (result != 0) {
                return result;
            }
        }
        return 0;
    }

    private static Double parseNumber(String value) {
        try {
            return Double.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
