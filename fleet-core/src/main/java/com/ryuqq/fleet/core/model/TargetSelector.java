package com.ryuqq.fleet.core.model;

/**
 * Job / Deployment / MaintenanceWindow가 적용될 노드 집합을 지정하는 선택자.
 *
 * <p>네 가지 가능한 형태:</p>
 * <ul>
 *   <li>{@link ForNode}: 단일 노드</li>
 *   <li>{@link ForGroup}: 정적 또는 동적 그룹</li>
 *   <li>{@link ForTag}: 태그가 부여된 모든 노드</li>
 *   <li>{@link ForAll}: 전체 Fleet</li>
 * </ul>
 *
 * <p>선택자는 디스패치 시점에 Target Resolver가 구체적인 노드 집합으로 확장합니다.
 * 선택자 자체는 멤버십을 저장하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface TargetSelector
    permits TargetSelector.ForNode, TargetSelector.ForGroup, TargetSelector.ForTag, TargetSelector.ForAll {

    /**
     * 영속/전송 시 사용하는 target_type 값.
     *
     * @return "node", "group", "tag", "all" 중 하나
     */
    String targetType();

    /**
     * 단일 노드 선택자 생성.
     *
     * @param nodeId 노드 ID
     * @return ForNode
     */
    static TargetSelector node(NodeId nodeId) {
        return new ForNode(nodeId);
    }

    /**
     * 그룹 선택자 생성.
     *
     * @param groupId 그룹 ID
     * @return ForGroup
     */
    static TargetSelector group(GroupId groupId) {
        return new ForGroup(groupId);
    }

    /**
     * 태그 선택자 생성.
     *
     * @param tagName 태그 이름
     * @return ForTag
     */
    static TargetSelector tag(String tagName) {
        return new ForTag(tagName);
    }

    /**
     * 전체 Fleet 선택자.
     *
     * @return ForAll
     */
    static TargetSelector all() {
        return ForAll.INSTANCE;
    }

    /**
     * 단일 노드.
     *
     * @param nodeId 대상 노드 ID
     */
    record ForNode(NodeId nodeId) implements TargetSelector {
        public ForNode {
            if (nodeId == null) {
                throw new IllegalArgumentException("nodeId cannot be null");
            }
        }

        @Override
        public String targetType() {
            return "node";
        }
    }

    /**
     * 그룹 (정적 멤버십 또는 동적 조건식).
     *
     * @param groupId 대상 그룹 ID
     */
    record ForGroup(GroupId groupId) implements TargetSelector {
        public ForGroup {
            if (groupId == null) {
                throw new IllegalArgumentException("groupId cannot be null");
            }
        }

        @Override
        public String targetType() {
            return "group";
        }
    }

    /**
     * 태그.
     *
     * @param tagName 태그 이름 (대소문자 구분 없음)
     */
    record ForTag(String tagName) implements TargetSelector {
        public ForTag {
            if (tagName == null || tagName.isBlank()) {
                throw new IllegalArgumentException("tagName cannot be null or blank");
            }
        }

        @Override
        public String targetType() {
            return "tag";
        }
    }

    /**
     * 전체 Fleet.
     */
    record ForAll() implements TargetSelector {
        static final ForAll INSTANCE = new ForAll();

        @Override
        public String targetType() {
            return "all";
        }
    }
}
