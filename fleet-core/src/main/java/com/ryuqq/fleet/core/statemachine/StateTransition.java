package com.ryuqq.fleet.core.statemachine;

/**
 * 상태 전이 검증 및 실행.
 *
 * <p>JobInstance, DeploymentStatus, Deployment 세 상태 머신의 허용된 전이를 한 곳에서
 * 검증합니다. 저장소의 조건부 갱신(compare-and-set) 직전에 호출되어
 * 허용되지 않은 전이가 영속되지 않도록 보장합니다.</p>
 *
 * <p><strong>JobInstance 허용 전이:</strong></p>
 * <ul>
 *   <li>PENDING → QUEUED | CANCELLED | EXPIRED</li>
 *   <li>QUEUED → RUNNING | CANCELLED | EXPIRED</li>
 *   <li>RUNNING → SUCCESS | FAILED | CANCELLED | EXPIRED</li>
 *   <li>FAILED → PENDING ({@link #validateRetry(JobInstanceState)} 전용 재시도 경로)</li>
 * </ul>
 *
 * <p><strong>DeploymentStatus 허용 전이:</strong></p>
 * <ul>
 *   <li>PENDING → DOWNLOADING | SKIPPED</li>
 *   <li>DOWNLOADING → INSTALLING | SUCCESS | FAILED</li>
 *   <li>INSTALLING → SUCCESS | FAILED</li>
 * </ul>
 *
 * <p><strong>Deployment 허용 전이:</strong></p>
 * <ul>
 *   <li>PENDING → ACTIVE | CANCELLED</li>
 *   <li>ACTIVE → PAUSED | COMPLETED | CANCELLED</li>
 *   <li>PAUSED → ACTIVE | CANCELLED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> 종료 상태에서는 어떤 상태로도 전이 불가 (재시도 경로 제외)</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * JobInstance 상태 전이 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(JobInstanceState from, JobInstanceState to) {
        requireTerminalGuard(from, to);

        boolean valid = switch (from) {
            case PENDING -> to == JobInstanceState.QUEUED
                || to == JobInstanceState.CANCELLED
                || to == JobInstanceState.EXPIRED;
            case QUEUED -> to == JobInstanceState.RUNNING
                || to == JobInstanceState.CANCELLED
                || to == JobInstanceState.EXPIRED;
            case RUNNING -> to == JobInstanceState.SUCCESS
                || to == JobInstanceState.FAILED
                || to == JobInstanceState.CANCELLED
                || to == JobInstanceState.EXPIRED;
            case SUCCESS, FAILED, CANCELLED, EXPIRED -> false;
        };

        if (!valid) {
            throw invalid(from, to);
        }
    }

    /**
     * 재시도 경로(FAILED → PENDING) 검증.
     *
     * <p>재시도는 새 행이 아니라 동일한 논리적 인스턴스의 새 시도입니다.</p>
     *
     * @param from 현재 상태
     * @throws IllegalArgumentException from이 null인 경우
     * @throws IllegalStateException from이 FAILED가 아닌 경우
     */
    public static void validateRetry(JobInstanceState from) {
        if (from == null) {
            throw new IllegalArgumentException("State cannot be null");
        }
        if (from != JobInstanceState.FAILED) {
            throw invalid(from, JobInstanceState.PENDING);
        }
    }

    /**
     * DeploymentStatus 상태 전이 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(DeploymentStatusState from, DeploymentStatusState to) {
        requireTerminalGuard(from, to);

        boolean valid = switch (from) {
            case PENDING -> to == DeploymentStatusState.DOWNLOADING || to == DeploymentStatusState.SKIPPED;
            case DOWNLOADING -> to == DeploymentStatusState.INSTALLING
                || to == DeploymentStatusState.SUCCESS
                || to == DeploymentStatusState.FAILED;
            case INSTALLING -> to == DeploymentStatusState.SUCCESS || to == DeploymentStatusState.FAILED;
            case SUCCESS, FAILED, SKIPPED -> false;
        };

        if (!valid) {
            throw invalid(from, to);
        }
    }

    /**
     * Deployment 컨트롤러 상태 전이 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(DeploymentState from, DeploymentState to) {
        requireTerminalGuard(from, to);

        boolean valid = switch (from) {
            case PENDING -> to == DeploymentState.ACTIVE || to == DeploymentState.CANCELLED;
            case ACTIVE -> to == DeploymentState.PAUSED
                || to == DeploymentState.COMPLETED
                || to == DeploymentState.CANCELLED;
            case PAUSED -> to == DeploymentState.ACTIVE || to == DeploymentState.CANCELLED;
            case COMPLETED, CANCELLED -> false;
        };

        if (!valid) {
            throw invalid(from, to);
        }
    }

    /**
     * JobInstance 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     */
    public static JobInstanceState transition(JobInstanceState current, JobInstanceState next) {
        validate(current, next);
        return next;
    }

    /**
     * DeploymentStatus 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     */
    public static DeploymentStatusState transition(DeploymentStatusState current, DeploymentStatusState next) {
        validate(current, next);
        return next;
    }

    /**
     * Deployment 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     */
    public static DeploymentState transition(DeploymentState current, DeploymentState next) {
        validate(current, next);
        return next;
    }

    private static void requireTerminalGuard(LifecycleState from, LifecycleState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }
    }

    private static IllegalStateException invalid(LifecycleState from, LifecycleState to) {
        return new IllegalStateException(
            String.format("Invalid state transition: %s → %s", from, to)
        );
    }
}
