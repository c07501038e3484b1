package com.ryuqq.fleet.adapter.runner;

import com.ryuqq.fleet.application.runtime.Sweep;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * SweepScheduler 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class SweepSchedulerTest {

    private final SweepScheduler scheduler = new SweepScheduler();

    @AfterEach
    void tearDown() throws InterruptedException {
        scheduler.shutdown();
    }

    @Test
    void 등록된_Sweep을_주기적으로_실행() throws InterruptedException {
        // given
        Sweep sweep = sweep("job-dispatcher");
        scheduler.register(sweep, 10);

        // when
        scheduler.start();

        // then
        verify(sweep, timeout(2000).atLeast(3)).sweep();
        assertThat(scheduler.isRunning()).isTrue();

        scheduler.shutdown();
        assertThat(scheduler.isRunning()).isFalse();
    }

    @Test
    void 예외가_발생해도_다음_주기에_계속_실행() {
        // given
        Sweep sweep = sweep("job-reaper");
        when(sweep.sweep())
            .thenThrow(new IllegalStateException("store unavailable"))
            .thenReturn(0);
        scheduler.register(sweep, 10);

        // when
        scheduler.start();

        // then
        verify(sweep, timeout(2000).atLeast(2)).sweep();
    }

    @Test
    void runOnce는_예외를_전파하지_않음() {
        // given
        Sweep sweep = sweep("rollout-controller");
        when(sweep.sweep()).thenThrow(new IllegalStateException("store unavailable"));

        // when & then
        assertThatCode(() -> SweepScheduler.runOnce(sweep)).doesNotThrowAnyException();
        verify(sweep, atLeast(1)).sweep();
    }

    @Test
    void 생명주기_위반은_예외() {
        assertThatThrownBy(scheduler::start)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("No sweeps registered");
        assertThatThrownBy(() -> scheduler.register(null, 10))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> scheduler.register(sweep("liveness-monitor"), 0))
            .isInstanceOf(IllegalArgumentException.class);

        scheduler.register(sweep("liveness-monitor"), 1000);
        scheduler.start();

        assertThatThrownBy(scheduler::start)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already started");
        assertThatThrownBy(() -> scheduler.register(sweep("late"), 1000))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("after start");
    }

    @Test
    void 시작_전_shutdown은_무시() {
        assertThatCode(scheduler::shutdown).doesNotThrowAnyException();
        assertThat(scheduler.isRunning()).isFalse();
    }

    private static Sweep sweep(String name) {
        Sweep sweep = mock(Sweep.class);
        when(sweep.name()).thenReturn(name);
        return sweep;
    }
}
