package com.ryuqq.fleet.application.dispatch;

import com.ryuqq.fleet.application.support.OptimisticUpdate;
import com.ryuqq.fleet.core.exception.TargetResolutionException;
import com.ryuqq.fleet.core.model.Deployment;
import com.ryuqq.fleet.core.model.DeploymentId;
import com.ryuqq.fleet.core.model.DeploymentStatus;
import com.ryuqq.fleet.core.model.NodeId;
import com.ryuqq.fleet.core.spi.DeploymentStore;
import com.ryuqq.fleet.core.statemachine.DeploymentState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Deployment 관리 유스케이스: 생성, 취소, 수동 중단, 재개.
 *
 * <p>컨트롤러 상태는 Rollout Controller와 이 서비스의 관리자 요청으로만 바뀌며,
 * 모든 변경은 Deployment 레코드에 대한 조건부 갱신입니다.</p>
 *
 * <p><strong>취소:</strong> Deployment만 CANCELLED로 바뀝니다. PENDING 행은 그대로 남지만
 * 다시는 전달 대상이 되지 않고, 이미 에이전트가 처리 중인 행은 계속 보고를 기록합니다.</p>
 *
 * <p><strong>재개:</strong> PAUSED → ACTIVE. 현재 릴리스된 배치의 중단은 확인된 것으로
 * 기록되어 같은 배치 결과로 다시 중단되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DeploymentService {

    private static final Logger log = LoggerFactory.getLogger(DeploymentService.class);

    static final String MANUAL_PAUSE_REASON = "paused by administrator";

    private final TargetResolver targetResolver;
    private final WorkItemFactory workItemFactory;
    private final DeploymentStore deploymentStore;

    public DeploymentService(TargetResolver targetResolver, WorkItemFactory workItemFactory,
                             DeploymentStore deploymentStore) {
        if (targetResolver == null) {
            throw new IllegalArgumentException("targetResolver cannot be null");
        }
        if (workItemFactory == null) {
            throw new IllegalArgumentException("workItemFactory cannot be null");
        }
        if (deploymentStore == null) {
            throw new IllegalArgumentException("deploymentStore cannot be null");
        }
        this.targetResolver = targetResolver;
        this.workItemFactory = workItemFactory;
        this.deploymentStore = deploymentStore;
    }

    /**
     * Deployment 생성 및 노드별 행 생성.
     *
     * <p>노드 ID 순서가 배치 순서입니다. 활성화와 첫 배치 릴리스는 Rollout Controller가 수행합니다.</p>
     *
     * @param deployment PENDING 상태의 새 Deployment
     * @return 저장된 행 목록 (배치 순)
     * @throws IllegalArgumentException PENDING이 아닌 Deployment인 경우
     * @throws TargetResolutionException 대상이 비어 있거나 알 수 없는 그룹인 경우
     */
    public List<DeploymentStatus> create(Deployment deployment) {
        if (deployment == null) {
            throw new IllegalArgumentException("deployment cannot be null");
        }
        if (deployment.state() != DeploymentState.PENDING) {
            throw new IllegalArgumentException("New deployment must be PENDING (current: " + deployment.state() + ")");
        }
        List<NodeId> targets;
        try {
            targets = new ArrayList<>(targetResolver.resolve(deployment.target()));
        } catch (TargetResolutionException e) {
            log.warn("Deployment {} rejected: {}", deployment.deploymentId().getValue(), e.getMessage());
            throw e;
        }
        deploymentStore.saveDeployment(deployment);
        log.info("Deployment {} ({}) created: package={}@{}, mode={}, strategy={}, nodes={}",
            deployment.deploymentId().getValue(), deployment.name(),
            deployment.packageRef().packageName(), deployment.packageRef().version(),
            deployment.mode().wireValue(), deployment.strategy().wireValue(), targets.size());
        return workItemFactory.createDeploymentStatuses(deployment, targets);
    }

    /**
     * Deployment 취소 (이미 종료된 경우 그대로 반환).
     *
     * @param deploymentId Deployment ID
     * @return 저장된 Deployment
     * @throws IllegalStateException Deployment가 존재하지 않는 경우
     */
    public Deployment cancel(DeploymentId deploymentId) {
        Deployment stored = update(deploymentId,
            current -> current.state().isTerminal() ? current : current.cancel());
        log.info("Deployment {} is {}", deploymentId.getValue(), stored.state().wireValue());
        return stored;
    }

    /**
     * 관리자 수동 중단 (ACTIVE → PAUSED).
     *
     * @param deploymentId Deployment ID
     * @return 저장된 Deployment
     * @throws IllegalStateException Deployment가 없거나 ACTIVE가 아닌 경우
     */
    public Deployment pause(DeploymentId deploymentId) {
        Deployment stored = update(deploymentId, current -> current.halt(MANUAL_PAUSE_REASON));
        log.info("Deployment {} paused by administrator at batch {}", deploymentId.getValue(), stored.releasedBatch());
        return stored;
    }

    /**
     * 재개 (PAUSED → ACTIVE).
     *
     * @param deploymentId Deployment ID
     * @return 저장된 Deployment
     * @throws IllegalStateException Deployment가 없거나 PAUSED가 아닌 경우
     */
    public Deployment resume(DeploymentId deploymentId) {
        Deployment stored = update(deploymentId, Deployment::resume);
        log.info("Deployment {} resumed, halt of batch {} acknowledged",
            deploymentId.getValue(), stored.acknowledgedHaltBatch());
        return stored;
    }

    public Optional<Deployment> find(DeploymentId deploymentId) {
        return deploymentStore.findDeployment(deploymentId);
    }

    private Deployment update(DeploymentId deploymentId, UnaryOperator<Deployment> change) {
        if (deploymentId == null) {
            throw new IllegalArgumentException("deploymentId cannot be null");
        }
        return OptimisticUpdate.apply(
            "deployment " + deploymentId.getValue(),
            () -> deploymentStore.findDeployment(deploymentId),
            change,
            deploymentStore::compareAndSet
        );
    }
}
