package com.ryuqq.fleet.adapter.runner;

import com.ryuqq.fleet.application.dispatch.DeploymentService;
import com.ryuqq.fleet.application.dispatch.JobService;
import com.ryuqq.fleet.application.dispatch.TargetResolver;
import com.ryuqq.fleet.application.dispatch.WorkItemFactory;
import com.ryuqq.fleet.application.gateway.AgentGateway;
import com.ryuqq.fleet.application.progress.ProgressAggregator;
import com.ryuqq.fleet.application.registry.NodeRegistry;
import com.ryuqq.fleet.application.runtime.Sweep;
import com.ryuqq.fleet.application.schedule.MaintenanceWindowGate;
import com.ryuqq.fleet.core.spi.DeploymentStore;
import com.ryuqq.fleet.core.spi.GroupStore;
import com.ryuqq.fleet.core.spi.JobStore;
import com.ryuqq.fleet.core.spi.MaintenanceWindowStore;
import com.ryuqq.fleet.core.spi.NodeEventPublisher;
import com.ryuqq.fleet.core.spi.NodeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Control plane 조립 지점 (composition root).
 *
 * <p>저장소 SPI 구현체와 시계를 받아 서비스, Agent Gateway, Sweep 및 스케줄러를 연결합니다.
 * 프레임워크 없이 생성자 주입만 사용합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ControlPlane controlPlane = ControlPlane.builder()
 *     .nodeStore(new InMemoryNodeStore())
 *     .groupStore(new InMemoryGroupStore())
 *     .maintenanceWindowStore(new InMemoryMaintenanceWindowStore())
 *     .jobStore(new InMemoryJobStore())
 *     .deploymentStore(new InMemoryDeploymentStore())
 *     .nodeEventPublisher(new InMemoryNodeEventPublisher())
 *     .build();
 *
 * controlPlane.start();
 * controlPlane.agentGateway().pendingJob(nodeId);
 * controlPlane.shutdown();
 * </pre>
 *
 * <p>테스트에서는 {@link #start()} 대신 {@link #sweepOnce()}로 모든 Sweep을 한 번씩 결정적으로 실행합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ControlPlane {

    private static final Logger log = LoggerFactory.getLogger(ControlPlane.class);

    private final TargetResolver targetResolver;
    private final NodeRegistry nodeRegistry;
    private final JobService jobService;
    private final DeploymentService deploymentService;
    private final ProgressAggregator progressAggregator;
    private final MaintenanceWindowGate maintenanceWindowGate;
    private final AgentGateway agentGateway;
    private final JobDispatcher jobDispatcher;
    private final JobReaper jobReaper;
    private final RolloutController rolloutController;
    private final LivenessMonitor livenessMonitor;
    private final SweepScheduler scheduler;

    private ControlPlane(Builder builder) {
        Clock clock = builder.clock;
        this.targetResolver = new TargetResolver(builder.nodeStore, builder.groupStore);
        WorkItemFactory workItemFactory = new WorkItemFactory(builder.jobStore, builder.deploymentStore, clock);
        this.nodeRegistry = new NodeRegistry(builder.nodeStore, builder.nodeEventPublisher, clock);
        this.jobService = new JobService(targetResolver, workItemFactory, builder.jobStore, clock);
        this.deploymentService = new DeploymentService(targetResolver, workItemFactory, builder.deploymentStore);
        this.progressAggregator = new ProgressAggregator(builder.jobStore, builder.deploymentStore);
        this.maintenanceWindowGate = new MaintenanceWindowGate(builder.maintenanceWindowStore, builder.nodeStore, targetResolver);
        this.agentGateway = new DefaultAgentGateway(nodeRegistry, builder.jobStore, builder.deploymentStore,
            maintenanceWindowGate, new JobResultHandler(builder.backoffCalculator), clock);

        this.jobDispatcher = new JobDispatcher(builder.jobStore, builder.dispatcherConfig, clock);
        this.jobReaper = new JobReaper(builder.jobStore, builder.reaperConfig, clock);
        this.rolloutController = new RolloutController(builder.deploymentStore, maintenanceWindowGate,
            builder.rolloutConfig, clock);
        this.livenessMonitor = new LivenessMonitor(builder.nodeStore, builder.nodeEventPublisher,
            builder.livenessConfig, clock);

        this.scheduler = new SweepScheduler()
            .register(jobDispatcher, builder.dispatcherConfig.scanIntervalMs())
            .register(jobReaper, builder.reaperConfig.scanIntervalMs())
            .register(rolloutController, builder.rolloutConfig.scanIntervalMs())
            .register(livenessMonitor, builder.livenessConfig.scanIntervalMs());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 모든 Sweep의 주기 실행 시작.
     */
    public void start() {
        scheduler.start();
        log.info("Control plane started with {} sweeps", sweeps().size());
    }

    /**
     * 주기 실행 중지.
     *
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        scheduler.shutdown();
    }

    /**
     * 모든 Sweep을 순서대로 한 번씩 실행 (dispatcher → reaper → rollout → liveness).
     *
     * @return 변경된 항목 수 합계
     */
    public int sweepOnce() {
        int changed = 0;
        for (Sweep sweep : sweeps()) {
            changed += sweep.sweep();
        }
        return changed;
    }

    public List<Sweep> sweeps() {
        return List.of(jobDispatcher, jobReaper, rolloutController, livenessMonitor);
    }

    public TargetResolver targetResolver() {
        return targetResolver;
    }

    public NodeRegistry nodeRegistry() {
        return nodeRegistry;
    }

    public JobService jobService() {
        return jobService;
    }

    public DeploymentService deploymentService() {
        return deploymentService;
    }

    public ProgressAggregator progressAggregator() {
        return progressAggregator;
    }

    public MaintenanceWindowGate maintenanceWindowGate() {
        return maintenanceWindowGate;
    }

    public AgentGateway agentGateway() {
        return agentGateway;
    }

    public JobDispatcher jobDispatcher() {
        return jobDispatcher;
    }

    public JobReaper jobReaper() {
        return jobReaper;
    }

    public RolloutController rolloutController() {
        return rolloutController;
    }

    public LivenessMonitor livenessMonitor() {
        return livenessMonitor;
    }

    /**
     * ControlPlane 빌더.
     *
     * <p>저장소 5종과 이벤트 발행자는 필수이며, 시계와 설정은 기본값을 사용합니다.</p>
     */
    public static final class Builder {

        private NodeStore nodeStore;
        private GroupStore groupStore;
        private MaintenanceWindowStore maintenanceWindowStore;
        private JobStore jobStore;
        private DeploymentStore deploymentStore;
        private NodeEventPublisher nodeEventPublisher;
        private Clock clock = Clock.systemUTC();
        private BackoffCalculator backoffCalculator = new BackoffCalculator();
        private JobDispatcherConfig dispatcherConfig = new JobDispatcherConfig();
        private JobReaperConfig reaperConfig = new JobReaperConfig();
        private RolloutControllerConfig rolloutConfig = new RolloutControllerConfig();
        private LivenessMonitorConfig livenessConfig = new LivenessMonitorConfig();

        private Builder() {
        }

        public Builder nodeStore(NodeStore nodeStore) {
            this.nodeStore = nodeStore;
            return this;
        }

        public Builder groupStore(GroupStore groupStore) {
            this.groupStore = groupStore;
            return this;
        }

        public Builder maintenanceWindowStore(MaintenanceWindowStore maintenanceWindowStore) {
            this.maintenanceWindowStore = maintenanceWindowStore;
            return this;
        }

        public Builder jobStore(JobStore jobStore) {
            this.jobStore = jobStore;
            return this;
        }

        public Builder deploymentStore(DeploymentStore deploymentStore) {
            this.deploymentStore = deploymentStore;
            return this;
        }

        public Builder nodeEventPublisher(NodeEventPublisher nodeEventPublisher) {
            this.nodeEventPublisher = nodeEventPublisher;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder backoffCalculator(BackoffCalculator backoffCalculator) {
            this.backoffCalculator = backoffCalculator;
            return this;
        }

        public Builder dispatcherConfig(JobDispatcherConfig dispatcherConfig) {
            this.dispatcherConfig = dispatcherConfig;
            return this;
        }

        public Builder reaperConfig(JobReaperConfig reaperConfig) {
            this.reaperConfig = reaperConfig;
            return this;
        }

        public Builder rolloutConfig(RolloutControllerConfig rolloutConfig) {
            this.rolloutConfig = rolloutConfig;
            return this;
        }

        public Builder livenessConfig(LivenessMonitorConfig livenessConfig) {
            this.livenessConfig = livenessConfig;
            return this;
        }

        /**
         * @return 조립된 ControlPlane
         * @throws IllegalArgumentException 필수 의존성이 누락된 경우
         */
        public ControlPlane build() {
            requireNonNull(nodeStore, "nodeStore");
            requireNonNull(groupStore, "groupStore");
            requireNonNull(maintenanceWindowStore, "maintenanceWindowStore");
            requireNonNull(jobStore, "jobStore");
            requireNonNull(deploymentStore, "deploymentStore");
            requireNonNull(nodeEventPublisher, "nodeEventPublisher");
            requireNonNull(clock, "clock");
            requireNonNull(backoffCalculator, "backoffCalculator");
            requireNonNull(dispatcherConfig, "dispatcherConfig");
            requireNonNull(reaperConfig, "reaperConfig");
            requireNonNull(rolloutConfig, "rolloutConfig");
            requireNonNull(livenessConfig, "livenessConfig");
            return new ControlPlane(this);
        }

        private static void requireNonNull(Object value, String name) {
            if (value == null) {
                throw new IllegalArgumentException(name + " cannot be null");
            }
        }
    }
}
