package com.ryuqq.fleet.adapter.runner;

import com.ryuqq.fleet.adapter.inmemory.store.InMemoryJobStore;
import com.ryuqq.fleet.core.model.Job;
import com.ryuqq.fleet.core.model.JobInstance;
import com.ryuqq.fleet.core.model.NodeId;
import com.ryuqq.fleet.core.model.TargetSelector;
import com.ryuqq.fleet.core.statemachine.JobInstanceState;
import com.ryuqq.fleet.testkit.Fixtures;
import com.ryuqq.fleet.testkit.TestClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * JobDispatcher 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class JobDispatcherTest {

    private TestClock clock;
    private InMemoryJobStore jobStore;
    private JobDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        clock = new TestClock();
        jobStore = new InMemoryJobStore();
        dispatcher = new JobDispatcher(jobStore, new JobDispatcherConfig(), clock);
    }

    // ========================================
    // PENDING → QUEUED
    // ========================================

    @Test
    void PENDING_인스턴스를_QUEUED로_전이() {
        // given
        Job job = Fixtures.job(TargetSelector.all(), clock.instant());
        JobInstance first = pending(job, "pc-001");
        JobInstance second = pending(job, "pc-002");

        // when
        int changed = dispatcher.sweep();

        // then
        assertThat(changed).isEqualTo(2);
        assertThat(reload(first).state()).isEqualTo(JobInstanceState.QUEUED);
        assertThat(reload(first).queuedAt()).isEqualTo(clock.instant());
        assertThat(reload(second).state()).isEqualTo(JobInstanceState.QUEUED);
    }

    @Test
    void 예약_시각_전에는_PENDING_유지() {
        // given
        Job job = Fixtures.job(TargetSelector.all(), clock.instant())
            .withScheduledAt(clock.instant().plus(Duration.ofHours(1)));
        JobInstance instance = pending(job, "pc-001");

        // when & then
        assertThat(dispatcher.sweep()).isZero();
        assertThat(reload(instance).state()).isEqualTo(JobInstanceState.PENDING);

        clock.advance(Duration.ofHours(1));
        assertThat(dispatcher.sweep()).isEqualTo(1);
        assertThat(reload(instance).state()).isEqualTo(JobInstanceState.QUEUED);
    }

    @Test
    void 취소되거나_만료된_Job의_인스턴스는_queue하지_않음() {
        // given
        Job cancelled = Fixtures.job(TargetSelector.all(), clock.instant());
        JobInstance ofCancelled = pending(cancelled, "pc-001");
        jobStore.saveJob(cancelled.cancel(clock.instant()));

        Job expiring = Fixtures.job(TargetSelector.all(), clock.instant())
            .withScheduledAt(clock.instant().plus(Duration.ofMinutes(5)))
            .withExpiresAt(clock.instant().plus(Duration.ofMinutes(10)));
        JobInstance ofExpired = pending(expiring, "pc-002");
        clock.advance(Duration.ofMinutes(30));

        // when
        int changed = dispatcher.sweep();

        // then
        assertThat(changed).isZero();
        assertThat(reload(ofCancelled).state()).isEqualTo(JobInstanceState.PENDING);
        assertThat(reload(ofExpired).state()).isEqualTo(JobInstanceState.PENDING);
    }

    @Test
    void 예약된_Job의_인스턴스가_배치를_채워도_지금_due인_인스턴스는_queue됨() {
        // given
        Job nextWeek = Fixtures.job(TargetSelector.all(), clock.instant())
            .withScheduledAt(clock.instant().plus(Duration.ofDays(7)));
        for (int i = 1; i <= 150; i++) {
            pending(nextWeek, String.format("pc-%03d", i));
        }
        clock.advance(Duration.ofSeconds(1));
        JobInstance urgent = pending(Fixtures.job(TargetSelector.all(), clock.instant()), "pc-001");

        // when
        int changed = dispatcher.sweep();

        // then
        assertThat(changed).isEqualTo(1);
        assertThat(reload(urgent).state()).isEqualTo(JobInstanceState.QUEUED);
    }

    // ========================================
    // 재시도
    // ========================================

    @Test
    void 재시도_시각이_도래하면_attempt를_올리고_같은_스캔에서_다시_queue() {
        // given
        Job job = Fixtures.job(TargetSelector.all(), clock.instant()).withMaxAttempts(3);
        JobInstance failed = failedWithRetry(job, "pc-001", Duration.ofSeconds(60));

        // when & then
        clock.advance(Duration.ofSeconds(30));
        assertThat(dispatcher.sweep()).isZero();
        assertThat(reload(failed).isRetryScheduled()).isTrue();

        clock.advance(Duration.ofSeconds(30));
        assertThat(dispatcher.sweep()).isEqualTo(2);

        JobInstance retried = reload(failed);
        assertThat(retried.state()).isEqualTo(JobInstanceState.QUEUED);
        assertThat(retried.attempt()).isEqualTo(2);
        assertThat(retried.nextRetryAt()).isNull();
        assertThat(retried.exitCode()).isNull();
    }

    @Test
    void 취소된_Job의_예약된_재시도는_해제되고_FAILED로_끝남() {
        // given
        Job job = Fixtures.job(TargetSelector.all(), clock.instant()).withMaxAttempts(3);
        JobInstance failed = failedWithRetry(job, "pc-001", Duration.ofSeconds(60));
        jobStore.saveJob(job.cancel(clock.instant()));
        clock.advance(Duration.ofMinutes(5));

        // when
        int changed = dispatcher.sweep();

        // then
        assertThat(changed).isEqualTo(1);
        JobInstance stored = reload(failed);
        assertThat(stored.state()).isEqualTo(JobInstanceState.FAILED);
        assertThat(stored.isFinal()).isTrue();
        assertThat(stored.attempt()).isEqualTo(1);
    }

    @Test
    void 이미_전이된_인스턴스는_건너뜀() {
        // given
        Job job = Fixtures.job(TargetSelector.all(), clock.instant());
        pending(job, "pc-001");
        dispatcher.sweep();

        // when
        int changed = dispatcher.sweep();

        // then
        assertThat(changed).isZero();
    }

    private JobInstance pending(Job job, String nodeId) {
        jobStore.saveJob(job);
        return jobStore.createInstanceIfAbsent(JobInstance.create(job, NodeId.of(nodeId), clock.instant()));
    }

    private JobInstance failedWithRetry(Job job, String nodeId, Duration backoff) {
        Instant now = clock.instant();
        JobInstance instance = pending(job, nodeId);
        instance = jobStore.compareAndSet(instance.enqueue(now)).orElseThrow();
        instance = jobStore.compareAndSet(instance.claim(now)).orElseThrow();
        return jobStore.compareAndSet(
            instance.fail(1, "", "access denied", 800L, "exit code 1", now.plus(backoff), now)
        ).orElseThrow();
    }

    private JobInstance reload(JobInstance instance) {
        return jobStore.findInstance(instance.instanceId()).orElseThrow();
    }
}
