package com.ryuqq.fleet.adapter.runner;

import com.ryuqq.fleet.application.gateway.AgentGateway;
import com.ryuqq.fleet.application.gateway.DeploymentStatusReport;
import com.ryuqq.fleet.application.gateway.JobResultReport;
import com.ryuqq.fleet.application.gateway.PendingDeployment;
import com.ryuqq.fleet.application.gateway.PendingJob;
import com.ryuqq.fleet.application.gateway.ReportAck;
import com.ryuqq.fleet.application.progress.Progress;
import com.ryuqq.fleet.core.model.Deployment;
import com.ryuqq.fleet.core.model.DeploymentId;
import com.ryuqq.fleet.core.model.DeploymentStatus;
import com.ryuqq.fleet.core.model.Group;
import com.ryuqq.fleet.core.model.GroupId;
import com.ryuqq.fleet.core.model.Job;
import com.ryuqq.fleet.core.model.JobInstance;
import com.ryuqq.fleet.core.model.NodeId;
import com.ryuqq.fleet.core.model.RolloutStrategy;
import com.ryuqq.fleet.core.model.StrategyConfig;
import com.ryuqq.fleet.core.model.TargetSelector;
import com.ryuqq.fleet.core.statemachine.DeploymentStatusState;
import com.ryuqq.fleet.core.statemachine.JobInstanceState;
import com.ryuqq.fleet.testkit.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end 시나리오 테스트.
 *
 * <p>관리자 API(서비스) → Sweep → 에이전트 poll/보고 → 집계 흐름을 in-memory 저장소로 검증합니다.
 * Sweep은 {@link ControlPlane#sweepOnce()}로 결정적으로 실행합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ControlPlaneScenarioTest {

    private ControlPlaneFixture fx;
    private AgentGateway gateway;

    @BeforeEach
    void setUp() {
        fx = new ControlPlaneFixture();
        gateway = fx.gateway();
    }

    // ========================================
    // Job
    // ========================================

    @Test
    void 생성_직후_상태별_인스턴스_수의_합은_대상_노드_수와_같음() {
        // given
        fx.registerNodes(7);
        Job job = Fixtures.job(TargetSelector.all(), fx.clock.instant());

        // when
        fx.controlPlane.jobService().submit(job);

        // then
        Progress progress = fx.controlPlane.progressAggregator().jobProgress(job.jobId());
        assertThat(progress.total()).isEqualTo(7);
        assertThat(progress.counts().values().stream().mapToInt(Integer::intValue).sum()).isEqualTo(7);
        assertThat(progress.count("pending")).isEqualTo(7);
        assertThat(progress.label()).isEqualTo("pending");
    }

    @Test
    void 같은_Job과_노드에_대해_활성_인스턴스는_최대_하나() {
        // given
        List<NodeId> nodes = fx.registerNodes(3);
        Job job = Fixtures.job(TargetSelector.all(), fx.clock.instant());
        fx.controlPlane.jobService().submit(job);
        fx.controlPlane.jobService().submit(job);
        fx.controlPlane.sweepOnce();

        // when
        for (NodeId node : nodes) {
            gateway.pendingJob(node);
            gateway.pendingJob(node);
        }
        fx.controlPlane.sweepOnce();

        // then
        List<JobInstance> instances = fx.jobStore.findInstancesByJob(job.jobId());
        assertThat(instances).hasSize(3);
        assertThat(instances).extracting(JobInstance::nodeId).doesNotHaveDuplicates();
        assertThat(instances).allMatch(instance -> instance.state() == JobInstanceState.RUNNING);
    }

    @Test
    void claim_없이_두_번_poll하면_같은_작업을_받고_행이_늘지_않음() {
        // given
        NodeId node = fx.registerNodes(1).get(0);
        Job job = Fixtures.job(TargetSelector.node(node), fx.clock.instant());
        fx.controlPlane.jobService().submit(job);
        fx.controlPlane.sweepOnce();

        // when
        PendingJob first = gateway.pendingJob(node).orElseThrow();
        PendingJob second = gateway.pendingJob(node).orElseThrow();

        // then
        assertThat(second).isEqualTo(first);
        assertThat(fx.jobStore.findInstancesByJob(job.jobId())).hasSize(1);
    }

    @Test
    void 만료_시각이_지난_QUEUED_인스턴스는_EXPIRED() {
        // given
        NodeId node = fx.registerNodes(1).get(0);
        Job job = Fixtures.job(TargetSelector.node(node), fx.clock.instant())
            .withExpiresAt(fx.clock.instant().plus(Duration.ofMinutes(30)));
        fx.controlPlane.jobService().submit(job);
        fx.controlPlane.sweepOnce();

        // when
        fx.clock.advance(Duration.ofMinutes(31));
        fx.controlPlane.sweepOnce();

        // then
        JobInstance instance = fx.jobStore.findInstancesByJob(job.jobId()).get(0);
        assertThat(instance.state()).isEqualTo(JobInstanceState.EXPIRED);
        assertThat(gateway.pendingJob(node)).isEmpty();
    }

    @Test
    void 그룹_3대_중_2대_성공_1대_무응답이면_부분_완료() {
        // given
        List<NodeId> nodes = fx.registerNodes(3);
        fx.groupStore.save(Group.staticGroup(GroupId.of("lab"), "Lab PCs", new HashSet<>(nodes)));
        Job job = Fixtures.job(TargetSelector.group(GroupId.of("lab")), fx.clock.instant())
            .withExpiresAt(fx.clock.instant().plus(Duration.ofHours(1)));
        List<JobInstance> created = fx.controlPlane.jobService().submit(job);
        assertThat(created).extracting(JobInstance::state).containsOnly(JobInstanceState.PENDING);
        fx.controlPlane.sweepOnce();

        // when
        for (NodeId node : nodes.subList(0, 2)) {
            PendingJob pending = gateway.pendingJob(node).orElseThrow();
            gateway.reportJobResult(new JobResultReport(pending.instanceId(), 0, "ok", "", 200L));
        }
        fx.clock.advance(Duration.ofHours(2));
        fx.controlPlane.sweepOnce();

        // then
        Progress progress = fx.controlPlane.progressAggregator().jobProgress(job.jobId());
        assertThat(progress.total()).isEqualTo(3);
        assertThat(progress.count("success")).isEqualTo(2);
        assertThat(progress.count("expired")).isEqualTo(1);
        assertThat(progress.label()).isEqualTo("partial");
    }

    // ========================================
    // Deployment
    // ========================================

    @Test
    void 배치_크기_2_대상_5대이면_앞_배치가_끝나기_전에_다음_배치를_전달하지_않음() {
        // given
        List<NodeId> nodes = fx.registerNodes(5);
        DeploymentId id = create(Fixtures.deployment(TargetSelector.all(), RolloutStrategy.STAGED,
            StrategyConfig.staged(2, 0), fx.clock.instant()));
        fx.controlPlane.sweepOnce();

        // when
        String first = claim(nodes.get(0));
        String second = claim(nodes.get(1));
        report(first, "success");
        fx.controlPlane.sweepOnce();

        // then
        assertThat(gateway.pendingDeployment(nodes.get(2))).isEmpty();
        assertThat(gateway.pendingDeployment(nodes.get(3))).isEmpty();

        // when
        report(second, "success");
        fx.controlPlane.sweepOnce();

        // then
        assertThat(gateway.pendingDeployment(nodes.get(2))).isPresent();
        assertThat(gateway.pendingDeployment(nodes.get(3))).isPresent();
        assertThat(gateway.pendingDeployment(nodes.get(4))).isEmpty();
        assertThat(rows(id)).extracting(DeploymentStatus::batchIndex).containsExactly(0, 0, 1, 1, 2);
    }

    @Test
    void 배치_크기_1_지연_30분이면_순서가_고정되고_앞_배치_종료와_30분_경과_후에만_다음_배치() {
        // given
        List<NodeId> nodes = fx.registerNodes(3);
        DeploymentId id = create(Fixtures.deployment(TargetSelector.all(), RolloutStrategy.STAGED,
            StrategyConfig.staged(1, 30), fx.clock.instant()));
        fx.controlPlane.sweepOnce();
        assertThat(rows(id)).extracting(DeploymentStatus::nodeId).containsExactlyElementsOf(nodes);

        // when: 배치 0은 40분 동안 진행 중
        String first = claim(nodes.get(0));
        fx.clock.advance(Duration.ofMinutes(40));
        heartbeat(nodes);
        fx.controlPlane.sweepOnce();

        // then
        assertThat(gateway.pendingDeployment(nodes.get(1))).isEmpty();

        // when: 배치 0 종료 (릴리스 후 40분 경과)
        report(first, "success");
        fx.controlPlane.sweepOnce();

        // then
        assertThat(claimOptional(nodes.get(1))).isPresent();
        assertThat(gateway.pendingDeployment(nodes.get(2))).isEmpty();

        // when: 배치 1은 즉시 종료, 릴리스 후 30분 전
        report(rows(id).get(1).statusId().getValue(), "success");
        fx.clock.advance(Duration.ofMinutes(29));
        heartbeat(nodes);
        fx.controlPlane.sweepOnce();

        // then
        assertThat(gateway.pendingDeployment(nodes.get(2))).isEmpty();

        // when
        fx.clock.advance(Duration.ofMinutes(1));
        fx.controlPlane.sweepOnce();

        // then
        assertThat(gateway.pendingDeployment(nodes.get(2))).isPresent();
    }

    @Test
    void 다섯_대_중_두_대_다운로드_중에_취소하면_남은_행은_전달되지_않고_진행_보고는_기록됨() {
        // given
        List<NodeId> nodes = fx.registerNodes(5);
        DeploymentId id = create(Fixtures.deployment(TargetSelector.all(), RolloutStrategy.STAGED,
            StrategyConfig.staged(2, 0), fx.clock.instant()));
        fx.controlPlane.sweepOnce();
        String first = claim(nodes.get(0));
        String second = claim(nodes.get(1));

        // when
        fx.controlPlane.deploymentService().cancel(id);
        report(first, "success");
        report(second, "failed");
        fx.controlPlane.sweepOnce();

        // then
        for (NodeId node : nodes) {
            assertThat(gateway.pendingDeployment(node)).isEmpty();
        }
        List<DeploymentStatus> rows = rows(id);
        assertThat(rows).extracting(DeploymentStatus::state).containsExactly(
            DeploymentStatusState.SUCCESS, DeploymentStatusState.FAILED,
            DeploymentStatusState.PENDING, DeploymentStatusState.PENDING, DeploymentStatusState.PENDING);

        Progress progress = fx.controlPlane.progressAggregator().deploymentProgress(id);
        assertThat(progress.label()).isEqualTo("cancelled");
        assertThat(progress.count("success")).isEqualTo(1);
        assertThat(progress.count("failed")).isEqualTo(1);
        assertThat(progress.count("pending")).isEqualTo(3);
    }

    private DeploymentId create(Deployment deployment) {
        fx.controlPlane.deploymentService().create(deployment);
        return deployment.deploymentId();
    }

    private List<DeploymentStatus> rows(DeploymentId id) {
        return fx.deploymentStore.findStatusesByDeployment(id);
    }

    private String claim(NodeId node) {
        return claimOptional(node).orElseThrow().statusId();
    }

    private Optional<PendingDeployment> claimOptional(NodeId node) {
        return gateway.pendingDeployment(node);
    }

    private void report(String statusId, String status) {
        Integer exitCode = "success".equals(status) ? 0 : 1;
        ReportAck ack = gateway.reportDeploymentStatus(new DeploymentStatusReport(statusId, status, exitCode, null, null));
        assertThat(ack).isEqualTo(ReportAck.ACCEPTED);
    }

    private void heartbeat(List<NodeId> nodes) {
        for (NodeId node : nodes) {
            gateway.heartbeat(node, null, null);
        }
    }
}
