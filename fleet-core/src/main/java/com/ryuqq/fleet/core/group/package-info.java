/**
 * Dynamic group membership expressions.
 *
 * <p>A dynamic group is a boolean condition tree over node attributes, evaluated against
 * the current registry at every target resolution. Membership is never snapshotted.</p>
 *
 * <pre>
 * GroupExpression expr = GroupExpression.and(
 *     GroupExpression.condition("os_name", ConditionOperator.CONTAINS, "Windows"),
 *     GroupExpression.condition("os_build", ConditionOperator.GREATER_OR_EQUAL, "22000"));
 *
 * boolean member = GroupExpressionEvaluator.matches(expr, node);
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.fleet.core.group;
