package com.ryuqq.fleet.application.schedule;

import com.ryuqq.fleet.application.dispatch.TargetResolver;
import com.ryuqq.fleet.core.model.Node;
import com.ryuqq.fleet.core.model.NodeId;
import com.ryuqq.fleet.core.schedule.MaintenanceWindow;
import com.ryuqq.fleet.core.spi.MaintenanceWindowStore;
import com.ryuqq.fleet.core.spi.NodeStore;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 유지보수 창 판정.
 *
 * <p>노드에 적용되는(scope가 노드를 포함하는) 활성 창 중 하나라도 지금 열려 있으면
 * 통과입니다. 적용되는 창이 하나도 없으면 닫힌 것으로 봅니다.</p>
 *
 * <p>Rollout Controller는 배치 릴리스 시점에, Agent Gateway는 노드가 claim하는 시점에
 * 이 판정을 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class MaintenanceWindowGate {

    private final MaintenanceWindowStore windowStore;
    private final NodeStore nodeStore;
    private final TargetResolver targetResolver;

    public MaintenanceWindowGate(MaintenanceWindowStore windowStore, NodeStore nodeStore, TargetResolver targetResolver) {
        if (windowStore == null) {
            throw new IllegalArgumentException("windowStore cannot be null");
        }
        if (nodeStore == null) {
            throw new IllegalArgumentException("nodeStore cannot be null");
        }
        if (targetResolver == null) {
            throw new IllegalArgumentException("targetResolver cannot be null");
        }
        this.windowStore = windowStore;
        this.nodeStore = nodeStore;
        this.targetResolver = targetResolver;
    }

    /**
     * 노드에 적용되는 창이 지금 열려 있는지 확인.
     *
     * @param node 노드
     * @param now 현재 시각
     * @return 열려 있으면 true
     */
    public boolean isOpenFor(Node node, Instant now) {
        return isOpenFor(node, now, windowStore.findActive());
    }

    /**
     * 주어진 노드 중 하나라도 열린 창 안에 있는지 확인.
     *
     * @param nodeIds 노드 ID 목록 (알 수 없는 노드는 무시)
     * @param now 현재 시각
     * @return 하나라도 열려 있으면 true
     */
    public boolean isOpenForAny(Collection<NodeId> nodeIds, Instant now) {
        List<MaintenanceWindow> windows = windowStore.findActive();
        if (windows.isEmpty()) {
            return false;
        }
        for (NodeId nodeId : nodeIds) {
            Optional<Node> node = nodeStore.find(nodeId);
            if (node.isPresent() && isOpenFor(node.get(), now, windows)) {
                return true;
            }
        }
        return false;
    }

    private boolean isOpenFor(Node node, Instant now, List<MaintenanceWindow> windows) {
        for (MaintenanceWindow window : windows) {
            if (window.isOpen(now) && targetResolver.matches(window.scope(), node)) {
                return true;
            }
        }
        return false;
    }
}
