package com.ryuqq.fleet.application.dispatch;

import com.ryuqq.fleet.adapter.inmemory.store.InMemoryDeploymentStore;
import com.ryuqq.fleet.adapter.inmemory.store.InMemoryGroupStore;
import com.ryuqq.fleet.adapter.inmemory.store.InMemoryJobStore;
import com.ryuqq.fleet.adapter.inmemory.store.InMemoryNodeStore;
import com.ryuqq.fleet.core.model.Deployment;
import com.ryuqq.fleet.core.model.DeploymentStatus;
import com.ryuqq.fleet.core.model.RolloutStrategy;
import com.ryuqq.fleet.core.model.StrategyConfig;
import com.ryuqq.fleet.core.model.TargetSelector;
import com.ryuqq.fleet.core.statemachine.DeploymentState;
import com.ryuqq.fleet.testkit.Fixtures;
import com.ryuqq.fleet.testkit.TestClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DeploymentService 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class DeploymentServiceTest {

    private TestClock clock;
    private InMemoryDeploymentStore deploymentStore;
    private DeploymentService deploymentService;

    @BeforeEach
    void setUp() {
        clock = new TestClock();
        InMemoryNodeStore nodeStore = new InMemoryNodeStore();
        deploymentStore = new InMemoryDeploymentStore();
        deploymentService = new DeploymentService(
            new TargetResolver(nodeStore, new InMemoryGroupStore()),
            new WorkItemFactory(new InMemoryJobStore(), deploymentStore, clock),
            deploymentStore
        );

        for (int i = 1; i <= 5; i++) {
            nodeStore.createIfAbsent(Fixtures.node("pc-00" + i, clock.instant()));
        }
    }

    // ============================================================
    // 1. 생성
    // ============================================================

    @Test
    void create_정렬된_노드_순서대로_배치를_배정함() {
        // given
        Deployment deployment = Fixtures.deployment(TargetSelector.all(), RolloutStrategy.STAGED,
            StrategyConfig.staged(2, 30), clock.instant());

        // when
        List<DeploymentStatus> rows = deploymentService.create(deployment);

        // then
        assertThat(rows).extracting(row -> row.nodeId().getValue())
            .containsExactly("pc-001", "pc-002", "pc-003", "pc-004", "pc-005");
        assertThat(rows).extracting(DeploymentStatus::batchIndex).containsExactly(0, 0, 1, 1, 2);
        assertThat(deploymentService.find(deployment.deploymentId())).isPresent();
    }

    @Test
    void create_CANARY_첫_배치는_canarySize() {
        // given
        Deployment deployment = Fixtures.deployment(TargetSelector.all(), RolloutStrategy.CANARY,
            new StrategyConfig(3, 0, 1, 20), clock.instant());

        // when
        List<DeploymentStatus> rows = deploymentService.create(deployment);

        // then
        assertThat(rows).extracting(DeploymentStatus::batchIndex).containsExactly(0, 1, 1, 1, 2);
    }

    @Test
    void create_PENDING이_아니면_예외() {
        Deployment active = Fixtures.immediateDeployment(TargetSelector.all(), clock.instant()).activate();

        assertThatThrownBy(() -> deploymentService.create(active))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must be PENDING");
    }

    // ============================================================
    // 2. 관리 작업
    // ============================================================

    @Test
    void pause_후_resume하면_현재_배치_중단을_확인함() {
        // given
        Deployment deployment = Fixtures.immediateDeployment(TargetSelector.all(), clock.instant());
        deploymentService.create(deployment);
        Deployment active = deploymentStore.compareAndSet(deployment.activate()).orElseThrow();
        deploymentStore.compareAndSet(active.releaseNextBatch(clock.instant()));

        // when
        Deployment paused = deploymentService.pause(deployment.deploymentId());
        Deployment resumed = deploymentService.resume(deployment.deploymentId());

        // then
        assertThat(paused.state()).isEqualTo(DeploymentState.PAUSED);
        assertThat(paused.haltReason()).isEqualTo(DeploymentService.MANUAL_PAUSE_REASON);
        assertThat(resumed.state()).isEqualTo(DeploymentState.ACTIVE);
        assertThat(resumed.isHaltAcknowledged(0)).isTrue();
        assertThat(resumed.version()).isEqualTo(4);
    }

    @Test
    void cancel_두_번_호출해도_같은_결과() {
        // given
        Deployment deployment = Fixtures.immediateDeployment(TargetSelector.all(), clock.instant());
        deploymentService.create(deployment);

        // when
        Deployment first = deploymentService.cancel(deployment.deploymentId());
        Deployment second = deploymentService.cancel(deployment.deploymentId());

        // then
        assertThat(first.state()).isEqualTo(DeploymentState.CANCELLED);
        assertThat(second).isEqualTo(first);
    }

    @Test
    void pause_PENDING_배포는_전이_불가() {
        Deployment deployment = Fixtures.immediateDeployment(TargetSelector.all(), clock.instant());
        deploymentService.create(deployment);

        assertThatThrownBy(() -> deploymentService.pause(deployment.deploymentId()))
            .isInstanceOf(IllegalStateException.class);
    }
}
