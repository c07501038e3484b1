package com.ryuqq.fleet.application.support;

import com.ryuqq.fleet.core.exception.ClaimConflictException;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * 읽기 → 변경 → 조건부 갱신(compare-and-set) 반복 도우미.
 *
 * <p>관리자 요청(취소, 재개, 태그 지정)처럼 경합에서 져도 포기하면 안 되는 갱신에 사용합니다.
 * 경합에서 지면 최신 값을 다시 읽어 변경을 재적용하며, {@value #MAX_ATTEMPTS}회 연속으로
 * 지면 {@link ClaimConflictException}을 던집니다.</p>
 *
 * <p>스윕과 에이전트 claim은 이 도우미를 쓰지 않습니다. 그쪽은 경합 패배가 곧 "다른 쪽이
 * 처리함"을 의미하므로 한 번 시도하고 넘어갑니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OptimisticUpdate {

    public static final int MAX_ATTEMPTS = 5;

    private OptimisticUpdate() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 조건부 갱신 반복 실행.
     *
     * @param description 대상 설명 (예외 메시지용)
     * @param loader 최신 값 조회
     * @param change 변경 함수 (같은 인스턴스를 반환하면 갱신 없이 종료)
     * @param compareAndSet 저장소의 조건부 갱신
     * @param <T> 레코드 타입
     * @return 저장된 최신 값
     * @throws IllegalStateException 대상이 존재하지 않는 경우
     * @throws ClaimConflictException 모든 시도가 경합에서 진 경우
     */
    public static <T> T apply(String description,
                              Supplier<Optional<T>> loader,
                              UnaryOperator<T> change,
                              Function<T, Optional<T>> compareAndSet) {
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            T current = loader.get()
                .orElseThrow(() -> new IllegalStateException(description + " not found"));
            T updated = change.apply(current);
            if (updated == current) {
                return current;
            }
            Optional<T> stored = compareAndSet.apply(updated);
            if (stored.isPresent()) {
                return stored.get();
            }
        }
        throw new ClaimConflictException(
            "Gave up updating " + description + " after " + MAX_ATTEMPTS + " conflicting attempts"
        );
    }
}
