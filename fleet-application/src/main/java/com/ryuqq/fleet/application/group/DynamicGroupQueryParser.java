package com.ryuqq.fleet.application.group;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.fleet.core.group.ConditionOperator;
import com.ryuqq.fleet.core.group.GroupExpression;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 저장된 동적 그룹 규칙(JSON)과 조건식 트리 간 변환.
 *
 * <p><strong>형식:</strong></p>
 * <pre>
 * {
 *   "operator": "AND",
 *   "conditions": [
 *     {"field": "os_name", "op": "contains", "value": "Windows"},
 *     {"operator": "OR", "conditions": [ ... ]}
 *   ]
 * }
 * </pre>
 *
 * <p>operator가 없으면 AND로 봅니다. 숫자/불리언 value는 문자열로 읽습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DynamicGroupQueryParser {

    private static final ObjectMapper MAPPER = JsonMapper.builder().build();

    private DynamicGroupQueryParser() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * JSON 규칙 파싱.
     *
     * @param json 규칙 JSON
     * @return 조건식 트리
     * @throws IllegalArgumentException JSON 형식이나 규칙 구조가 잘못된 경우
     */
    public static GroupExpression parse(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("rule json cannot be null or blank");
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed group rule: " + e.getOriginalMessage(), e);
        }
        return toExpression(root, "$");
    }

    /**
     * 조건식 트리를 JSON 규칙으로 변환.
     *
     * @param expression 조건식
     * @return 규칙 JSON
     */
    public static String write(GroupExpression expression) {
        if (expression == null) {
            throw new IllegalArgumentException("expression cannot be null");
        }
        try {
            return MAPPER.writeValueAsString(toJson(expression));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize group rule", e);
        }
    }

    private static GroupExpression toExpression(JsonNode node, String path) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Group rule at " + path + " must be an object");
        }
        if (node.has("conditions")) {
            JsonNode conditions = node.get("conditions");
            if (!conditions.isArray() || conditions.isEmpty()) {
                throw new IllegalArgumentException("'conditions' at " + path + " must be a non-empty array");
            }
            List<GroupExpression> operands = new ArrayList<>();
            for (int i = 0; i < conditions.size(); i++) {
                operands.add(toExpression(conditions.get(i), path + ".conditions[" + i + "]"));
            }
            String operator = node.path("operator").asText("AND").toUpperCase(Locale.ROOT);
            if ("AND".equals(operator)) {
                return new GroupExpression.And(operands);
            }
            if ("OR".equals(operator)) {
                return new GroupExpression.Or(operands);
            }
            throw new IllegalArgumentException("Unknown logical operator at " + path + ": " + operator);
        }

        String field = requiredText(node, "field", path);
        ConditionOperator operator = ConditionOperator.fromWire(requiredText(node, "op", path));
        JsonNode value = node.get("value");
        if (value == null || value.isNull() || value.isContainerNode()) {
            throw new IllegalArgumentException("'value' at " + path + " must be a scalar");
        }
        return new GroupExpression.Condition(field, operator, value.asText());
    }

    private static String requiredText(JsonNode node, String name, String path) {
        JsonNode value = node.get(name);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new IllegalArgumentException("'" + name + "' at " + path + " must be a non-blank string");
        }
        return value.asText();
    }

    private static ObjectNode toJson(GroupExpression expression) {
        ObjectNode node = MAPPER.createObjectNode();
        if (expression instanceof GroupExpression.Condition condition) {
            node.put("field", condition.field());
            node.put("op", condition.operator().wireValue());
            node.put("value", condition.value());
            return node;
        }
        List<GroupExpression> operands;
        if (expression instanceof GroupExpression.And all) {
            node.put("operator", "AND");
            operands = all.operands();
        } else if (expression instanceof GroupExpression.Or any) {
            node.put("operator", "OR");
            operands = any.operands();
        } else {
            throw new IllegalArgumentException("Unsupported expression: " + expression);
        }
        ArrayNode conditions = node.putArray("conditions");
        for (GroupExpression operand : operands) {
            conditions.add(toJson(operand));
        }
        return node;
    }
}
