package com.ryuqq.fleet.adapter.runner;

import com.ryuqq.fleet.application.runtime.Sweep;
import com.ryuqq.fleet.application.schedule.MaintenanceWindowGate;
import com.ryuqq.fleet.core.model.Deployment;
import com.ryuqq.fleet.core.model.DeploymentStatus;
import com.ryuqq.fleet.core.model.NodeId;
import com.ryuqq.fleet.core.model.RolloutStrategy;
import com.ryuqq.fleet.core.spi.DeploymentStore;
import com.ryuqq.fleet.core.statemachine.DeploymentState;
import com.ryuqq.fleet.core.statemachine.DeploymentStatusState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Rollout Controller 컴포넌트.
 *
 * <p>PENDING / ACTIVE 배포를 주기적으로 검사하여 활성화, 배치 릴리스, 중단, 완료를 결정합니다.
 * 에이전트는 릴리스된 배치의 행만 claim할 수 있으므로, 이 컴포넌트가 롤아웃 속도를 결정합니다.</p>
 *
 * <p><strong>배포별 처리 순서:</strong></p>
 * <pre>
 * 1. PENDING + scheduledStart 도래        → ACTIVE
 * 2. ACTIVE + scheduledEnd 경과           → 남은 PENDING 행 SKIPPED (더 이상 릴리스하지 않음)
 * 3. 모든 행이 종료 상태                    → COMPLETED
 * 4. 현재 배치 k의 모든 행이 종료 상태
 *    - CANARY 배치(0)에 SUCCESS가 아닌 행 존재 → PAUSED
 *    - 실패율 &gt; failureThresholdPercent     → PAUSED
 *    (재개로 확인된 배치는 다시 중단하지 않음)
 * 5. 다음 배치 릴리스 조건 충족             → releasedBatch = k + 1
 *    - 첫 배치: 활성화 즉시
 *    - 이후 배치: 배치 k 종료 + delayMinutes 경과
 *    - maintenanceWindowOnly: 다음 배치 노드 중 하나라도 열린 창 안에 있어야 함
 * </pre>
 *
 * <p><strong>실패율:</strong> 배치 내 FAILED 행 수 / (SUCCESS + FAILED 행 수). SKIPPED 행은 제외합니다.
 * 기본 임계값 0은 배치에서 하나라도 실패하면 중단함을 뜻합니다.</p>
 *
 * <p><strong>스캔:</strong> 한 번의 sweep에서 PENDING / ACTIVE 배포 전체를 batchSize 단위 페이지로
 * 순회합니다. 아직 진행할 수 없는 오래된 배포가 첫 페이지를 채워도 뒤의 배포가 처리됩니다.</p>
 *
 * <p><strong>동시성:</strong> 모든 배포 상태 변경은 Deployment 한 행에 대한 조건부 갱신입니다.
 * 두 컨트롤러가 같은 배치를 동시에 릴리스하려 하면 한쪽만 성공합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RolloutController implements Sweep {

    private static final Logger log = LoggerFactory.getLogger(RolloutController.class);

    static final String SCHEDULE_ENDED_REASON = "deployment window ended before this node was reached";

    private static final Set<DeploymentState> SCANNED_STATES = EnumSet.of(DeploymentState.PENDING, DeploymentState.ACTIVE);

    private final DeploymentStore deploymentStore;
    private final MaintenanceWindowGate windowGate;
    private final RolloutControllerConfig config;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param deploymentStore Deployment 저장소
     * @param windowGate 유지보수 창 판정
     * @param config 설정
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RolloutController(DeploymentStore deploymentStore, MaintenanceWindowGate windowGate,
                             RolloutControllerConfig config, Clock clock) {
        if (deploymentStore == null) {
            throw new IllegalArgumentException("deploymentStore cannot be null");
        }
        if (windowGate == null) {
            throw new IllegalArgumentException("windowGate cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.deploymentStore = deploymentStore;
        this.windowGate = windowGate;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "rollout-controller";
    }

    @Override
    public int sweep() {
        int checked = 0;
        int advanced = 0;
        Deployment after = null;
        while (true) {
            List<Deployment> page = deploymentStore.scanByStates(SCANNED_STATES, after, config.batchSize());
            for (Deployment deployment : page) {
                if (tryAdvance(deployment)) {
                    advanced++;
                }
            }
            checked += page.size();
            if (page.size() < config.batchSize()) {
                break;
            }
            after = page.get(page.size() - 1);
        }

        if (advanced == 0) {
            log.debug("RolloutController sweep idle ({} deployments checked)", checked);
        } else {
            log.info("RolloutController sweep completed: {} advanced out of {}", advanced, checked);
        }
        return advanced;
    }

    private boolean tryAdvance(Deployment deployment) {
        try {
            return advance(deployment, clock.instant());
        } catch (Exception e) {
            log.error("Failed to advance deployment {} in RolloutController sweep",
                deployment.deploymentId().getValue(), e);
            return false;
        }
    }

    private boolean advance(Deployment deployment, Instant now) {
        boolean changed = false;
        Deployment current = deployment;

        if (current.state() == DeploymentState.PENDING) {
            if (!current.isStartDue(now)) {
                return false;
            }
            Optional<Deployment> activated = store(current.activate(), "activate");
            if (activated.isEmpty()) {
                return false;
            }
            log.info("Deployment {} activated ({} rollout)", current.deploymentId().getValue(),
                current.strategy().wireValue());
            current = activated.get();
            changed = true;
        }

        List<DeploymentStatus> rows = deploymentStore.findStatusesByDeployment(current.deploymentId());
        if (rows.isEmpty()) {
            return changed;
        }

        if (current.isPastScheduledEnd(now) && skipRemaining(rows, now) > 0) {
            changed = true;
            rows = deploymentStore.findStatusesByDeployment(current.deploymentId());
        }

        if (allTerminal(rows)) {
            Optional<Deployment> completed = store(current.complete(), "complete");
            if (completed.isPresent()) {
                log.info("Deployment {} completed: {} nodes", current.deploymentId().getValue(), rows.size());
                return true;
            }
            return changed;
        }

        int batch = current.releasedBatch();
        List<DeploymentStatus> releasedRows = rowsOfBatch(rows, batch);
        boolean batchDone = batch == Deployment.NONE || allTerminal(releasedRows);

        if (batch != Deployment.NONE && batchDone && !current.isHaltAcknowledged(batch)) {
            String haltReason = haltReason(current, batch, releasedRows);
            if (haltReason != null) {
                Optional<Deployment> halted = store(current.halt(haltReason), "halt");
                if (halted.isPresent()) {
                    log.warn("Deployment {} halted at batch {}: {}", current.deploymentId().getValue(), batch, haltReason);
                    return true;
                }
                return changed;
            }
        }

        if (batchDone && !current.isPastScheduledEnd(now) && releaseNext(current, rows, now)) {
            return true;
        }
        return changed;
    }

    private boolean releaseNext(Deployment deployment, List<DeploymentStatus> rows, Instant now) {
        int next = deployment.releasedBatch() + 1;
        List<DeploymentStatus> nextRows = rowsOfBatch(rows, next);
        if (nextRows.isEmpty()) {
            return false;
        }

        if (deployment.releasedBatch() != Deployment.NONE && deployment.batchReleasedAt() != null) {
            Instant earliest = deployment.batchReleasedAt()
                .plus(Duration.ofMinutes(deployment.strategyConfig().delayMinutes()));
            if (now.isBefore(earliest)) {
                return false;
            }
        }

        if (deployment.maintenanceWindowOnly()) {
            List<NodeId> nodeIds = new ArrayList<>();
            for (DeploymentStatus row : nextRows) {
                nodeIds.add(row.nodeId());
            }
            if (!windowGate.isOpenForAny(nodeIds, now)) {
                log.info("Deployment {} batch {} held: no open maintenance window for its nodes",
                    deployment.deploymentId().getValue(), next);
                return false;
            }
        }

        Optional<Deployment> released = store(deployment.releaseNextBatch(now), "release batch of");
        if (released.isEmpty()) {
            return false;
        }
        log.info("Deployment {} released batch {} ({} nodes)", deployment.deploymentId().getValue(), next, nextRows.size());
        return true;
    }

    private int skipRemaining(List<DeploymentStatus> rows, Instant now) {
        int skipped = 0;
        for (DeploymentStatus row : rows) {
            if (row.state() != DeploymentStatusState.PENDING) {
                continue;
            }
            Optional<DeploymentStatus> stored = deploymentStore.compareAndSetStatus(row.skip(SCHEDULE_ENDED_REASON, now));
            if (stored.isPresent()) {
                skipped++;
            } else {
                log.debug("Skipped marking row {} as skipped: changed concurrently", row.statusId().getValue());
            }
        }
        if (skipped > 0) {
            log.info("Deployment {} past its scheduled end: {} pending nodes skipped",
                rows.get(0).deploymentId().getValue(), skipped);
        }
        return skipped;
    }

    /**
     * @return 중단 사유, 중단하지 않으면 null
     */
    private static String haltReason(Deployment deployment, int batch, List<DeploymentStatus> batchRows) {
        int succeeded = 0;
        int failed = 0;
        for (DeploymentStatus row : batchRows) {
            if (row.state() == DeploymentStatusState.SUCCESS) {
                succeeded++;
            } else if (row.state() == DeploymentStatusState.FAILED) {
                failed++;
            }
        }

        if (deployment.strategy() == RolloutStrategy.CANARY && batch == 0 && succeeded < batchRows.size()) {
            return "canary batch not fully successful (" + succeeded + "/" + batchRows.size() + " succeeded)";
        }
        int evaluated = succeeded + failed;
        if (evaluated == 0) {
            return null;
        }
        int threshold = deployment.strategyConfig().failureThresholdPercent();
        if (failed * 100L > (long) threshold * evaluated) {
            return "batch " + batch + " failure rate " + (failed * 100 / evaluated) + "% exceeds " + threshold + "%"
                + " (" + failed + "/" + evaluated + " failed)";
        }
        return null;
    }

    private Optional<Deployment> store(Deployment updated, String action) {
        Optional<Deployment> stored = deploymentStore.compareAndSet(updated);
        if (stored.isEmpty()) {
            log.debug("Skipped {} deployment {}: changed concurrently", action, updated.deploymentId().getValue());
        }
        return stored;
    }

    private static List<DeploymentStatus> rowsOfBatch(List<DeploymentStatus> rows, int batch) {
        List<DeploymentStatus> result = new ArrayList<>();
        for (DeploymentStatus row : rows) {
            if (row.batchIndex() == batch) {
                result.add(row);
            }
        }
        return result;
    }

    private static boolean allTerminal(List<DeploymentStatus> rows) {
        for (DeploymentStatus row : rows) {
            if (!row.state().isTerminal()) {
                return false;
            }
        }
        return true;
    }
}
