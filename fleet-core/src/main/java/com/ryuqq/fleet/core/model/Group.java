package com.ryuqq.fleet.core.model;

import com.ryuqq.fleet.core.group.GroupExpression;

import java.util.Set;

/**
 * 노드 그룹.
 *
 * <p>정적 그룹은 명시적 멤버 집합을, 동적 그룹은 조건식을 가집니다.
 * 동적 그룹의 멤버십은 해석 시점마다 재평가되며 저장되지 않습니다.</p>
 *
 * @param groupId 그룹 ID
 * @param name 그룹 이름
 * @param members 정적 멤버 (동적 그룹이면 빈 집합)
 * @param dynamicQuery 동적 조건식 (정적 그룹이면 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Group(GroupId groupId, String name, Set<NodeId> members, GroupExpression dynamicQuery) {

    public Group {
        if (groupId == null) {
            throw new IllegalArgumentException("groupId cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        members = members == null ? Set.of() : Set.copyOf(members);
        if (dynamicQuery != null && !members.isEmpty()) {
            throw new IllegalArgumentException("A dynamic group cannot have static members: " + name);
        }
    }

    /**
     * 정적 그룹 생성.
     *
     * @param groupId 그룹 ID
     * @param name 이름
     * @param members 멤버
     * @return 정적 Group
     */
    public static Group staticGroup(GroupId groupId, String name, Set<NodeId> members) {
        return new Group(groupId, name, members, null);
    }

    /**
     * 동적 그룹 생성.
     *
     * @param groupId 그룹 ID
     * @param name 이름
     * @param query 조건식
     * @return 동적 Group
     */
    public static Group dynamicGroup(GroupId groupId, String name, GroupExpression query) {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null for a dynamic group");
        }
        return new Group(groupId, name, Set.of(), query);
    }

    public boolean isDynamic() {
        return dynamicQuery != null;
    }
}
