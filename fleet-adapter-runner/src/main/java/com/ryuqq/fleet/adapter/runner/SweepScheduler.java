package com.ryuqq.fleet.adapter.runner;

import com.ryuqq.fleet.application.runtime.Sweep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sweep 주기 실행기.
 *
 * <p>등록된 각 {@link Sweep}을 자신의 주기로 fixed-delay 실행합니다. 한 번의 실행이 끝난 뒤에
 * 다음 대기가 시작되므로 같은 Sweep이 한 프로세스 안에서 겹쳐 실행되지 않습니다.</p>
 *
 * <p><strong>예외 처리:</strong> {@code ScheduledExecutorService}는 작업이 예외를 던지면 이후
 * 실행을 조용히 중단합니다. 이를 막기 위해 각 실행을 감싸 예외를 ERROR로 기록하고 다음 주기를
 * 그대로 진행합니다.</p>
 *
 * <p><strong>생명주기:</strong></p>
 * <pre>
 * SweepScheduler scheduler = new SweepScheduler();
 * scheduler.register(dispatcher, 5_000);
 * scheduler.register(reaper, 30_000);
 * scheduler.start();
 * ...
 * scheduler.shutdown();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SweepScheduler {

    private static final Logger log = LoggerFactory.getLogger(SweepScheduler.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final Map<Sweep, Long> registrations = new LinkedHashMap<>();
    private final List<ScheduledFuture<?>> futures = new ArrayList<>();
    private ScheduledExecutorService executor;

    /**
     * Sweep 등록 (start 전에만 가능).
     *
     * @param sweep 실행할 Sweep
     * @param intervalMs 실행 간 지연 (밀리초, 양수)
     * @return this
     * @throws IllegalArgumentException sweep이 null이거나 intervalMs가 양수가 아닌 경우
     * @throws IllegalStateException 이미 시작된 경우
     */
    public synchronized SweepScheduler register(Sweep sweep, long intervalMs) {
        if (sweep == null) {
            throw new IllegalArgumentException("sweep cannot be null");
        }
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be positive (current: " + intervalMs + ")");
        }
        if (executor != null) {
            throw new IllegalStateException("Cannot register " + sweep.name() + " after start");
        }
        registrations.put(sweep, intervalMs);
        return this;
    }

    /**
     * 등록된 Sweep 실행 시작.
     *
     * @throws IllegalStateException 이미 시작되었거나 등록된 Sweep이 없는 경우
     */
    public synchronized void start() {
        if (executor != null) {
            throw new IllegalStateException("SweepScheduler already started");
        }
        if (registrations.isEmpty()) {
            throw new IllegalStateException("No sweeps registered");
        }
        executor = Executors.newScheduledThreadPool(registrations.size(), new SweepThreadFactory());
        registrations.forEach((sweep, intervalMs) -> {
            futures.add(executor.scheduleWithFixedDelay(() -> runOnce(sweep), 0, intervalMs, TimeUnit.MILLISECONDS));
            log.info("Scheduled sweep {} every {}ms", sweep.name(), intervalMs);
        });
    }

    /**
     * 실행 중지 및 진행 중인 실행 완료 대기.
     *
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public synchronized void shutdown() throws InterruptedException {
        if (executor == null) {
            return;
        }
        futures.forEach(future -> future.cancel(false));
        futures.clear();
        executor.shutdown();
        if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
            executor.shutdownNow();
        }
        log.info("SweepScheduler stopped");
    }

    public synchronized boolean isRunning() {
        return executor != null && !executor.isShutdown();
    }

    /**
     * Sweep 1회 실행. 예외를 전파하지 않습니다.
     *
     * @param sweep 실행할 Sweep
     */
    static void runOnce(Sweep sweep) {
        try {
            sweep.sweep();
        } catch (Exception e) {
            log.error("Sweep {} failed, will run again on next tick", sweep.name(), e);
        }
    }

    private static final class SweepThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "fleet-sweep-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
