package com.ryuqq.fleet.adapter.runner;

import com.ryuqq.fleet.application.gateway.DeploymentStatusReport;
import com.ryuqq.fleet.application.gateway.JobResultReport;
import com.ryuqq.fleet.application.gateway.PendingDeployment;
import com.ryuqq.fleet.application.gateway.PendingJob;
import com.ryuqq.fleet.application.gateway.ReportAck;
import com.ryuqq.fleet.core.model.Deployment;
import com.ryuqq.fleet.core.model.DeploymentStatus;
import com.ryuqq.fleet.core.model.InstanceId;
import com.ryuqq.fleet.core.model.Job;
import com.ryuqq.fleet.core.model.JobInstance;
import com.ryuqq.fleet.core.model.NodeEvent;
import com.ryuqq.fleet.core.model.NodeId;
import com.ryuqq.fleet.core.model.RolloutStrategy;
import com.ryuqq.fleet.core.model.StrategyConfig;
import com.ryuqq.fleet.core.model.TargetSelector;
import com.ryuqq.fleet.core.statemachine.DeploymentState;
import com.ryuqq.fleet.core.statemachine.DeploymentStatusState;
import com.ryuqq.fleet.core.statemachine.JobInstanceState;
import com.ryuqq.fleet.testkit.Fixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 동시성 통합 테스트.
 *
 * <p>조건부 갱신으로 보장되는 속성을 여러 스레드에서 검증합니다:</p>
 * <ul>
 *   <li>같은 노드의 동시 poll: 인스턴스는 한 번만 claim됨</li>
 *   <li>같은 배포 행의 동시 poll: 행은 한 번만 claim됨</li>
 *   <li>같은 결과의 동시 보고: 한 번만 ACCEPTED</li>
 *   <li>여러 Dispatcher 동시 실행: 인스턴스는 한 번만 QUEUED로 전이됨</li>
 *   <li>여러 RolloutController 동시 실행: 배치 릴리스와 중단은 한 번만 일어남</li>
 *   <li>여러 LivenessMonitor 동시 실행: 노드당 실패 카운터는 한 번만 증가하고 OFFLINE 이벤트도 한 번</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ConcurrencyTest {

    private static final int THREADS = 8;

    private ControlPlaneFixture fx;
    private ExecutorService executorService;

    @BeforeEach
    void setUp() {
        fx = new ControlPlaneFixture();
        executorService = Executors.newFixedThreadPool(THREADS);
    }

    @AfterEach
    void tearDown() {
        executorService.shutdownNow();
    }

    // ============================================================
    // 1. 동시 poll
    // ============================================================

    @Test
    void 같은_노드의_동시_poll은_인스턴스를_한_번만_claim() throws Exception {
        // given
        NodeId node = fx.registerNodes(1).get(0);
        Job job = Fixtures.job(TargetSelector.node(node), fx.clock.instant());
        fx.controlPlane.jobService().submit(job);
        fx.controlPlane.jobDispatcher().sweep();

        // when
        List<Optional<PendingJob>> results = runConcurrently(() -> fx.gateway().pendingJob(node));

        // then
        List<String> delivered = new ArrayList<>();
        results.forEach(result -> result.ifPresent(pending -> delivered.add(pending.instanceId())));
        assertThat(delivered).isNotEmpty();
        assertThat(delivered).containsOnly(delivered.get(0));

        JobInstance stored = fx.jobStore.findInstance(InstanceId.of(delivered.get(0))).orElseThrow();
        assertThat(stored.state()).isEqualTo(JobInstanceState.RUNNING);
        assertThat(stored.version()).isEqualTo(2);
    }

    @Test
    void 같은_배포_행의_동시_poll은_행을_한_번만_claim() throws Exception {
        // given
        NodeId node = fx.registerNodes(1).get(0);
        fx.controlPlane.deploymentService().create(
            Fixtures.immediateDeployment(TargetSelector.node(node), fx.clock.instant()));
        fx.controlPlane.rolloutController().sweep();

        // when
        List<Optional<PendingDeployment>> results = runConcurrently(() -> fx.gateway().pendingDeployment(node));

        // then
        List<String> delivered = new ArrayList<>();
        results.forEach(result -> result.ifPresent(pending -> delivered.add(pending.statusId())));
        assertThat(delivered).isNotEmpty();
        assertThat(delivered).containsOnly(delivered.get(0));

        DeploymentStatus row = fx.deploymentStore.findStatus(InstanceId.of(delivered.get(0))).orElseThrow();
        assertThat(row.state()).isEqualTo(DeploymentStatusState.DOWNLOADING);
        assertThat(row.attempts()).isEqualTo(1);
    }

    // ============================================================
    // 2. 동시 보고
    // ============================================================

    @Test
    void 같은_결과의_동시_보고는_한_번만_반영() throws Exception {
        // given
        NodeId node = fx.registerNodes(1).get(0);
        fx.controlPlane.jobService().submit(Fixtures.job(TargetSelector.node(node), fx.clock.instant()));
        fx.controlPlane.jobDispatcher().sweep();
        PendingJob pending = fx.gateway().pendingJob(node).orElseThrow();
        JobResultReport report = new JobResultReport(pending.instanceId(), 0, "ok", "", 100L);

        // when
        List<ReportAck> acks = runConcurrently(() -> fx.gateway().reportJobResult(report));

        // then
        assertThat(acks).filteredOn(ack -> ack == ReportAck.ACCEPTED).hasSize(1);
        assertThat(acks).filteredOn(ack -> ack == ReportAck.DUPLICATE_IGNORED).hasSize(THREADS - 1);
        assertThat(fx.jobStore.findInstance(InstanceId.of(pending.instanceId())).orElseThrow().state())
            .isEqualTo(JobInstanceState.SUCCESS);
    }

    // ============================================================
    // 3. 여러 Dispatcher 동시 실행
    // ============================================================

    @Test
    void 여러_Dispatcher가_동시에_실행되어도_인스턴스는_한_번만_전이() throws Exception {
        // given
        fx.registerNodes(20);
        Job job = Fixtures.job(TargetSelector.all(), fx.clock.instant());
        fx.controlPlane.jobService().submit(job);
        JobDispatcher dispatcher = fx.controlPlane.jobDispatcher();

        // when
        List<Integer> queued = runConcurrently(dispatcher::sweep);

        // then
        assertThat(queued.stream().mapToInt(Integer::intValue).sum()).isEqualTo(20);
        assertThat(fx.jobStore.findInstancesByJob(job.jobId()))
            .allMatch(instance -> instance.state() == JobInstanceState.QUEUED && instance.version() == 1);
    }

    // ============================================================
    // 4. 여러 RolloutController 동시 실행
    // ============================================================

    @Test
    void 여러_RolloutController가_동시에_실행되어도_다음_배치는_한_번만_릴리스() throws Exception {
        // given
        List<NodeId> nodes = fx.registerNodes(4);
        Deployment deployment = Fixtures.deployment(TargetSelector.all(), RolloutStrategy.STAGED,
            StrategyConfig.staged(2, 0), fx.clock.instant());
        fx.controlPlane.deploymentService().create(deployment);
        fx.controlPlane.rolloutController().sweep();
        reportDeployment(nodes.get(0), "success");
        reportDeployment(nodes.get(1), "success");

        // when
        List<Integer> advanced = runConcurrently(() -> newRolloutController().sweep());

        // then
        assertThat(advanced.stream().mapToInt(Integer::intValue).sum()).isEqualTo(1);
        Deployment stored = fx.deploymentStore.findDeployment(deployment.deploymentId()).orElseThrow();
        assertThat(stored.state()).isEqualTo(DeploymentState.ACTIVE);
        assertThat(stored.releasedBatch()).isEqualTo(1);
    }

    @Test
    void 여러_RolloutController가_동시에_실행되어도_중단은_한_번만() throws Exception {
        // given
        List<NodeId> nodes = fx.registerNodes(4);
        Deployment deployment = Fixtures.deployment(TargetSelector.all(), RolloutStrategy.STAGED,
            StrategyConfig.staged(2, 0), fx.clock.instant());
        fx.controlPlane.deploymentService().create(deployment);
        fx.controlPlane.rolloutController().sweep();
        reportDeployment(nodes.get(0), "success");
        reportDeployment(nodes.get(1), "failed");
        long versionBefore = fx.deploymentStore.findDeployment(deployment.deploymentId()).orElseThrow().version();

        // when
        List<Integer> advanced = runConcurrently(() -> newRolloutController().sweep());

        // then
        assertThat(advanced.stream().mapToInt(Integer::intValue).sum()).isEqualTo(1);
        Deployment stored = fx.deploymentStore.findDeployment(deployment.deploymentId()).orElseThrow();
        assertThat(stored.state()).isEqualTo(DeploymentState.PAUSED);
        assertThat(stored.releasedBatch()).isZero();
        assertThat(stored.version()).isEqualTo(versionBefore + 1);
    }

    // ============================================================
    // 5. 여러 LivenessMonitor 동시 실행
    // ============================================================

    @Test
    void 여러_LivenessMonitor가_동시에_실행되어도_노드당_한_번만_오프라인_처리() throws Exception {
        // given
        fx.registerNodes(5);
        fx.clock.advance(Duration.ofMinutes(6));

        // when
        List<Integer> marked = runConcurrently(() -> new LivenessMonitor(
            fx.nodeStore, fx.eventPublisher, new LivenessMonitorConfig(), fx.clock).sweep());

        // then
        assertThat(marked.stream().mapToInt(Integer::intValue).sum()).isEqualTo(5);
        assertThat(fx.nodeStore.findAll())
            .allMatch(node -> !node.online() && node.consecutiveFailures() == 1);
        assertThat(fx.eventPublisher.published(NodeEvent.Type.OFFLINE))
            .extracting(NodeEvent::nodeId)
            .doesNotHaveDuplicates()
            .hasSize(5);
    }

    private RolloutController newRolloutController() {
        return new RolloutController(fx.deploymentStore, fx.controlPlane.maintenanceWindowGate(),
            new RolloutControllerConfig(), fx.clock);
    }

    private void reportDeployment(NodeId node, String status) {
        PendingDeployment pending = fx.gateway().pendingDeployment(node).orElseThrow();
        Integer exitCode = "success".equals(status) ? 0 : 1603;
        ReportAck ack = fx.gateway().reportDeploymentStatus(
            new DeploymentStatusReport(pending.statusId(), status, exitCode, null, null));
        assertThat(ack).isEqualTo(ReportAck.ACCEPTED);
    }

    private <T> List<T> runConcurrently(Callable<T> task) throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<T>> futures = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            futures.add(executorService.submit(() -> {
                start.await();
                return task.call();
            }));
        }
        start.countDown();

        List<T> results = new ArrayList<>();
        for (Future<T> future : futures) {
            results.add(future.get(5, TimeUnit.SECONDS));
        }
        return results;
    }
}
