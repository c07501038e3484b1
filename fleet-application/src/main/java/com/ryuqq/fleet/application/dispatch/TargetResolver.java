package com.ryuqq.fleet.application.dispatch;

import com.ryuqq.fleet.core.exception.TargetResolutionException;
import com.ryuqq.fleet.core.group.GroupExpressionEvaluator;
import com.ryuqq.fleet.core.model.Group;
import com.ryuqq.fleet.core.model.Node;
import com.ryuqq.fleet.core.model.NodeId;
import com.ryuqq.fleet.core.model.TargetSelector;
import com.ryuqq.fleet.core.spi.GroupStore;
import com.ryuqq.fleet.core.spi.NodeStore;

import java.util.Collections;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 대상 선택자를 구체적인 노드 집합으로 확장.
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>결과는 중복이 없고 노드 ID 순으로 정렬됩니다 (배치 구성이 결정적이도록)</li>
 *   <li>저장소에 알려진 노드만 포함합니다 (오프라인 노드 포함)</li>
 *   <li>동적 그룹은 호출할 때마다 새로 평가합니다</li>
 *   <li>알 수 없는 그룹이거나 결과가 비어 있으면 {@link TargetResolutionException}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TargetResolver {

    private final NodeStore nodeStore;
    private final GroupStore groupStore;

    public TargetResolver(NodeStore nodeStore, GroupStore groupStore) {
        if (nodeStore == null) {
            throw new IllegalArgumentException("nodeStore cannot be null");
        }
        if (groupStore == null) {
            throw new IllegalArgumentException("groupStore cannot be null");
        }
        this.nodeStore = nodeStore;
        this.groupStore = groupStore;
    }

    /**
     * 선택자 확장.
     *
     * @param selector 대상 선택자
     * @return 정렬된 불변 노드 ID 집합 (비어 있지 않음)
     * @throws IllegalArgumentException selector가 null인 경우
     * @throws TargetResolutionException 알 수 없는 그룹이거나 결과가 비어 있는 경우
     */
    public SortedSet<NodeId> resolve(TargetSelector selector) {
        if (selector == null) {
            throw new IllegalArgumentException("selector cannot be null");
        }

        SortedSet<NodeId> resolved = new TreeSet<>();
        if (selector instanceof TargetSelector.ForNode forNode) {
            nodeStore.find(forNode.nodeId()).ifPresent(node -> resolved.add(node.nodeId()));
        } else if (selector instanceof TargetSelector.ForGroup forGroup) {
            Group group = groupStore.find(forGroup.groupId())
                .orElseThrow(() -> new TargetResolutionException(selector, "Unknown group: " + forGroup.groupId()));
            for (Node node : nodeStore.findAll()) {
                if (isMember(group, node)) {
                    resolved.add(node.nodeId());
                }
            }
        } else {
            for (Node node : nodeStore.findAll()) {
                if (matches(selector, node)) {
                    resolved.add(node.nodeId());
                }
            }
        }

        if (resolved.isEmpty()) {
            throw new TargetResolutionException(selector, "Target resolved to no known nodes: " + selector);
        }
        return Collections.unmodifiableSortedSet(resolved);
    }

    /**
     * 단일 노드가 선택자에 포함되는지 확인.
     *
     * <p>알 수 없는 그룹은 어떤 노드도 포함하지 않습니다.</p>
     *
     * @param selector 대상 선택자 (null이면 전체로 간주)
     * @param node 노드
     * @return 포함되면 true
     */
    public boolean matches(TargetSelector selector, Node node) {
        if (node == null) {
            throw new IllegalArgumentException("node cannot be null");
        }
        if (selector == null || selector instanceof TargetSelector.ForAll) {
            return true;
        }
        if (selector instanceof TargetSelector.ForNode forNode) {
            return forNode.nodeId().equals(node.nodeId());
        }
        if (selector instanceof TargetSelector.ForTag forTag) {
            return node.hasTag(forTag.tagName());
        }
        if (selector instanceof TargetSelector.ForGroup forGroup) {
            Optional<Group> group = groupStore.find(forGroup.groupId());
            return group.isPresent() && isMember(group.get(), node);
        }
        throw new IllegalArgumentException("Unsupported selector: " + selector);
    }

    private static boolean isMember(Group group, Node node) {
        if (group.isDynamic()) {
            return GroupExpressionEvaluator.matches(group.dynamicQuery(), node);
        }
        return group.members().contains(node.nodeId());
    }
}
