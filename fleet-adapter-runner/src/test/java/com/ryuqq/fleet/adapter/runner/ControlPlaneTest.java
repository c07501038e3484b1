package com.ryuqq.fleet.adapter.runner;

import com.ryuqq.fleet.adapter.inmemory.event.InMemoryNodeEventPublisher;
import com.ryuqq.fleet.adapter.inmemory.store.InMemoryDeploymentStore;
import com.ryuqq.fleet.adapter.inmemory.store.InMemoryGroupStore;
import com.ryuqq.fleet.adapter.inmemory.store.InMemoryJobStore;
import com.ryuqq.fleet.adapter.inmemory.store.InMemoryMaintenanceWindowStore;
import com.ryuqq.fleet.adapter.inmemory.store.InMemoryNodeStore;
import com.ryuqq.fleet.application.runtime.Sweep;
import com.ryuqq.fleet.core.model.Job;
import com.ryuqq.fleet.core.model.TargetSelector;
import com.ryuqq.fleet.testkit.Fixtures;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ControlPlane 조립 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ControlPlaneTest {

    @Test
    void 필수_의존성이_없으면_예외() {
        assertThatThrownBy(() -> ControlPlane.builder().build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("nodeStore cannot be null");

        assertThatThrownBy(() -> completeBuilder().nodeEventPublisher(null).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("nodeEventPublisher cannot be null");

        assertThatThrownBy(() -> completeBuilder().clock(null).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("clock cannot be null");
    }

    @Test
    void 기본_설정으로_조립() {
        // when
        ControlPlane controlPlane = completeBuilder().build();

        // then
        assertThat(controlPlane.sweeps())
            .extracting(Sweep::name)
            .containsExactly("job-dispatcher", "job-reaper", "rollout-controller", "liveness-monitor");
        assertThat(controlPlane.agentGateway()).isInstanceOf(DefaultAgentGateway.class);
    }

    @Test
    void sweepOnce는_모든_Sweep의_변경_수를_합산() {
        // given
        ControlPlaneFixture fx = new ControlPlaneFixture();
        fx.registerNodes(2);
        Job job = Fixtures.job(TargetSelector.all(), fx.clock.instant());
        fx.controlPlane.jobService().submit(job);
        fx.controlPlane.deploymentService().create(Fixtures.immediateDeployment(TargetSelector.all(), fx.clock.instant()));

        // when & then
        assertThat(fx.controlPlane.sweepOnce()).isEqualTo(3);
        assertThat(fx.controlPlane.sweepOnce()).isZero();

        fx.clock.advance(Duration.ofMinutes(6));
        assertThat(fx.controlPlane.sweepOnce()).isEqualTo(2);
    }

    @Test
    void start와_shutdown() throws InterruptedException {
        // given
        ControlPlane controlPlane = completeBuilder().build();

        // when
        controlPlane.start();

        // then
        assertThat(controlPlane.sweeps()).hasSize(4);
        controlPlane.shutdown();
    }

    private static ControlPlane.Builder completeBuilder() {
        return ControlPlane.builder()
            .nodeStore(new InMemoryNodeStore())
            .groupStore(new InMemoryGroupStore())
            .maintenanceWindowStore(new InMemoryMaintenanceWindowStore())
            .jobStore(new InMemoryJobStore())
            .deploymentStore(new InMemoryDeploymentStore())
            .nodeEventPublisher(new InMemoryNodeEventPublisher());
    }
}
