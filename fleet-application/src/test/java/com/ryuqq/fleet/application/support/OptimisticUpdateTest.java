package com.ryuqq.fleet.application.support;

import com.ryuqq.fleet.core.exception.ClaimConflictException;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * OptimisticUpdate 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class OptimisticUpdateTest {

    @Test
    void apply_충돌하면_다시_읽어서_재시도함() {
        // given
        AtomicInteger loads = new AtomicInteger();
        RecordingCompareAndSet cas = new RecordingCompareAndSet(List.of(Optional.empty(), Optional.of("v2")));

        // when
        String stored = OptimisticUpdate.apply("row", () -> Optional.of("v" + loads.incrementAndGet()),
            current -> current + "-changed", cas);

        // then
        assertThat(stored).isEqualTo("v2");
        assertThat(loads.get()).isEqualTo(2);
        assertThat(cas.attempted).containsExactly("v1-changed", "v2-changed");
    }

    @Test
    void apply_변경이_없으면_저장하지_않음() {
        RecordingCompareAndSet cas = new RecordingCompareAndSet();

        String stored = OptimisticUpdate.apply("row", () -> Optional.of("same"), current -> current, cas);

        assertThat(stored).isEqualTo("same");
        assertThat(cas.attempted).isEmpty();
    }

    @Test
    void apply_계속_충돌하면_ClaimConflictException() {
        RecordingCompareAndSet cas = new RecordingCompareAndSet();

        assertThatThrownBy(() -> OptimisticUpdate.apply("row", () -> Optional.of("v"), current -> current + "!", cas))
            .isInstanceOf(ClaimConflictException.class)
            .hasMessageContaining("after " + OptimisticUpdate.MAX_ATTEMPTS);
        assertThat(cas.attempted).hasSize(OptimisticUpdate.MAX_ATTEMPTS);
    }

    @Test
    void apply_대상이_없으면_IllegalStateException() {
        assertThatThrownBy(() -> OptimisticUpdate.apply("job instance x", Optional::<String>empty,
            current -> current, Optional::of))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("job instance x not found");
    }

    /**
     * 정해진 결과를 순서대로 돌려주고 시도한 값을 기록하는 compare-and-set. 결과가 바닥나면 계속 충돌합니다.
     */
    private static final class RecordingCompareAndSet implements Function<String, Optional<String>> {

        private final Deque<Optional<String>> results = new ArrayDeque<>();
        private final List<String> attempted = new ArrayList<>();

        RecordingCompareAndSet() {
            this(List.of());
        }

        RecordingCompareAndSet(List<Optional<String>> results) {
            this.results.addAll(results);
        }

        @Override
        public Optional<String> apply(String updated) {
            attempted.add(updated);
            return results.isEmpty() ? Optional.empty() : results.poll();
        }
    }
}
