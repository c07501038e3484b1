package com.ryuqq.fleet.core.group;

import com.ryuqq.fleet.core.model.Node;
import com.ryuqq.fleet.core.model.NodeId;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

import static com.ryuqq.fleet.core.group.GroupExpression.and;
import static com.ryuqq.fleet.core.group.GroupExpression.condition;
import static com.ryuqq.fleet.core.group.GroupExpression.or;
import static org.junit.jupiter.api.Assertions.*;

/**
 * GroupExpressionEvaluator 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class GroupExpressionEvaluatorTest {

    private static final Node NODE = Node.register(
        NodeId.of("node-1"),
        "FIN-PC-001",
        Map.of("os_name", "Windows 11 Pro", "os_version", "10.0.22631", "ram_gb", "16", "domain", "corp.local"),
        Instant.parse("2025-01-06T10:00:00Z")
    ).withTags(Set.of("finance", "kiosk"));

    @Test
    void equals_IgnoresCase() {
        assertTrue(GroupExpressionEvaluator.matches(condition("domain", ConditionOperator.EQUALS, "CORP.LOCAL"), NODE));
        assertFalse(GroupExpressionEvaluator.matches(condition("domain", ConditionOperator.EQUALS, "corp"), NODE));
    }

    @Test
    void stringOperators_MatchAttributeValue() {
        assertTrue(GroupExpressionEvaluator.matches(condition("os_name", ConditionOperator.CONTAINS, "windows 11"), NODE));
        assertTrue(GroupExpressionEvaluator.matches(condition("os_name", ConditionOperator.NOT_CONTAINS, "server"), NODE));
        assertTrue(GroupExpressionEvaluator.matches(condition("hostname", ConditionOperator.STARTS_WITH, "fin-"), NODE));
        assertTrue(GroupExpressionEvaluator.matches(condition("hostname", ConditionOperator.ENDS_WITH, "001"), NODE));
    }

    @Test
    void missingAttribute_OnlyNegativeOperatorsMatch() {
        assertFalse(GroupExpressionEvaluator.matches(condition("location", ConditionOperator.EQUALS, "berlin"), NODE));
        assertTrue(GroupExpressionEvaluator.matches(condition("location", ConditionOperator.NOT_EQUALS, "berlin"), NODE));
        assertTrue(GroupExpressionEvaluator.matches(condition("location", ConditionOperator.NOT_CONTAINS, "berlin"), NODE));
    }

    @Test
    void numericComparison_UsesNumbers() {
        assertTrue(GroupExpressionEvaluator.matches(condition("ram_gb", ConditionOperator.GREATER_OR_EQUAL, "8"), NODE));
        assertFalse(GroupExpressionEvaluator.matches(condition("ram_gb", ConditionOperator.LESS_OR_EQUAL, "9"), NODE));
    }

    @Test
    void versionComparison_ComparesSegments() {
        assertTrue(GroupExpressionEvaluator.matches(condition("os_version", ConditionOperator.GREATER_OR_EQUAL, "10.0.19045"), NODE));
        assertTrue(GroupExpressionEvaluator.matches(condition("os_version", ConditionOperator.LESS_OR_EQUAL, "10.1"), NODE));
        assertEquals(0, GroupExpressionEvaluator.compare("10.0", "10.0.0"));
    }

    @Test
    void regex_InvalidPatternNeverMatches() {
        assertTrue(GroupExpressionEvaluator.matches(condition("hostname", ConditionOperator.REGEX, "^fin-pc-\\d+$"), NODE));
        assertFalse(GroupExpressionEvaluator.matches(condition("hostname", ConditionOperator.REGEX, "(unclosed"), NODE));
    }

    @Test
    void tags_MatchByOperatorOrField() {
        assertTrue(GroupExpressionEvaluator.matches(condition("any", ConditionOperator.HAS_TAG, "Finance"), NODE));
        assertTrue(GroupExpressionEvaluator.matches(condition("tags", ConditionOperator.EQUALS, "kiosk"), NODE));
        assertTrue(GroupExpressionEvaluator.matches(condition("tags", ConditionOperator.NOT_EQUALS, "hr"), NODE));
        assertFalse(GroupExpressionEvaluator.matches(condition("tags", ConditionOperator.CONTAINS, "hr"), NODE));
    }

    @Test
    void nestedExpressions_CombineAndOr() {
        // Given
        GroupExpression expression = and(
            condition("os_name", ConditionOperator.CONTAINS, "windows"),
            or(
                condition("domain", ConditionOperator.EQUALS, "other.local"),
                condition("tags", ConditionOperator.HAS_TAG, "finance")
            )
        );

        // When & Then
        assertTrue(GroupExpressionEvaluator.matches(expression, NODE));
        assertFalse(GroupExpressionEvaluator.matches(
            and(expression, condition("ram_gb", ConditionOperator.GREATER_OR_EQUAL, "32")), NODE));
    }

    @Test
    void emptyOperands_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new GroupExpression.And(java.util.List.of()));
        assertThrows(IllegalArgumentException.class, () -> or());
    }

    @Test
    void nullArguments_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> GroupExpressionEvaluator.matches(null, NODE));
        assertThrows(IllegalArgumentException.class,
            () -> GroupExpressionEvaluator.matches(condition("domain", ConditionOperator.EQUALS, "x"), null));
    }

    @Test
    void operatorFromWire_ResolvesAndRejectsUnknown() {
        assertEquals(ConditionOperator.STARTS_WITH, ConditionOperator.fromWire("StartsWith"));
        assertEquals(ConditionOperator.GREATER_OR_EQUAL, ConditionOperator.fromWire("gte"));
        IllegalArgumentException exception =
            assertThrows(IllegalArgumentException.class, () -> ConditionOperator.fromWire("between"));
        assertTrue(exception.getMessage().contains("between"));
    }
}
