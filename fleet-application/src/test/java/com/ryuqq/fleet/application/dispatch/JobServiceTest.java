package com.ryuqq.fleet.application.dispatch;

import com.ryuqq.fleet.adapter.inmemory.store.InMemoryDeploymentStore;
import com.ryuqq.fleet.adapter.inmemory.store.InMemoryGroupStore;
import com.ryuqq.fleet.adapter.inmemory.store.InMemoryJobStore;
import com.ryuqq.fleet.adapter.inmemory.store.InMemoryNodeStore;
import com.ryuqq.fleet.core.exception.TargetResolutionException;
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
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

/**
 * JobService 유닛 테스트.
 *
 * <ul>
 *   <li>제출 시 대상 노드별 인스턴스 생성</li>
 *   <li>(job, node) 당 인스턴스 하나</li>
 *   <li>취소 시 미완료 인스턴스만 취소</li>
 *   <li>재취소는 취소 시각을 바꾸지 않음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class JobServiceTest {

    private TestClock clock;
    private InMemoryNodeStore nodeStore;
    private InMemoryJobStore jobStore;
    private WorkItemFactory workItemFactory;
    private JobService jobService;

    @BeforeEach
    void setUp() {
        clock = new TestClock();
        nodeStore = new InMemoryNodeStore();
        jobStore = spy(new InMemoryJobStore());
        workItemFactory = new WorkItemFactory(jobStore, new InMemoryDeploymentStore(), clock);
        jobService = new JobService(new TargetResolver(nodeStore, new InMemoryGroupStore()), workItemFactory, jobStore, clock);

        for (int i = 1; i <= 3; i++) {
            nodeStore.createIfAbsent(Fixtures.node("pc-00" + i, clock.instant()));
        }
    }

    @Test
    void submit_대상_노드마다_PENDING_인스턴스를_생성함() {
        // given
        Job job = Fixtures.job(TargetSelector.all(), clock.instant());

        // when
        List<JobInstance> instances = jobService.submit(job);

        // then
        assertThat(instances).hasSize(3);
        assertThat(instances).extracting(JobInstance::state).containsOnly(JobInstanceState.PENDING);
        assertThat(instances).extracting(JobInstance::jobId).containsOnly(job.jobId());
        assertThat(jobService.find(job.jobId())).contains(job);
        assertThat(jobStore.findInstancesByJob(job.jobId())).hasSize(3);
    }

    @Test
    void 같은_노드에_인스턴스를_다시_만들면_기존_인스턴스를_반환함() {
        // given
        Job job = Fixtures.job(TargetSelector.all(), clock.instant());
        List<JobInstance> first = jobService.submit(job);

        // when
        List<JobInstance> second = workItemFactory.createJobInstances(job, List.of(NodeId.of("pc-001"), NodeId.of("pc-002")));

        // then
        assertThat(second).extracting(JobInstance::instanceId)
            .containsExactly(first.get(0).instanceId(), first.get(1).instanceId());
        assertThat(jobStore.findInstancesByJob(job.jobId())).hasSize(3);
    }

    @Test
    void submit_대상이_없으면_저장하지_않고_예외() {
        // given
        Job job = Fixtures.job(TargetSelector.tag("nobody"), clock.instant());

        // when & then
        assertThatThrownBy(() -> jobService.submit(job))
            .isInstanceOf(TargetResolutionException.class);
        assertThat(jobService.find(job.jobId())).isEmpty();
    }

    @Test
    void cancel_완료되지_않은_인스턴스만_취소함() {
        // given
        Job job = Fixtures.job(TargetSelector.all(), clock.instant());
        List<JobInstance> instances = jobService.submit(job);
        JobInstance done = jobStore.compareAndSet(instances.get(0).enqueue(clock.instant())).orElseThrow();
        done = jobStore.compareAndSet(done.claim(clock.instant())).orElseThrow();
        jobStore.compareAndSet(done.succeed(0, "ok", "", 10L, clock.instant()));
        clock.advance(Duration.ofMinutes(1));

        // when
        int cancelled = jobService.cancel(job.jobId());

        // then
        assertThat(cancelled).isEqualTo(2);
        assertThat(jobService.find(job.jobId()).orElseThrow().cancelledAt()).isEqualTo(clock.instant());
        assertThat(jobStore.findInstancesByJob(job.jobId()))
            .extracting(JobInstance::state)
            .containsExactlyInAnyOrder(JobInstanceState.SUCCESS, JobInstanceState.CANCELLED, JobInstanceState.CANCELLED);
    }

    @Test
    void cancel_이미_취소된_작업은_다시_저장하지_않고_취소_시각을_유지함() {
        // given
        Job job = Fixtures.job(TargetSelector.all(), clock.instant());
        jobService.submit(job);
        jobService.cancel(job.jobId());
        Instant firstCancel = clock.instant();
        clock.advance(Duration.ofHours(1));
        clearInvocations(jobStore);

        // when
        int cancelled = jobService.cancel(job.jobId());

        // then
        assertThat(cancelled).isZero();
        assertThat(jobService.find(job.jobId()).orElseThrow().cancelledAt()).isEqualTo(firstCancel);
        verify(jobStore, never()).saveJob(any());
    }

    @Test
    void cancel_모르는_작업이면_예외() {
        Job job = Fixtures.job(TargetSelector.all(), clock.instant());

        assertThatThrownBy(() -> jobService.cancel(job.jobId()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Job not found");
    }
}
