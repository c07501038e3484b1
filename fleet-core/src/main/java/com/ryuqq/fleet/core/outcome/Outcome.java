package com.ryuqq.fleet.core.outcome;

/**
 * 에이전트가 보고한 실행 결과의 분류.
 *
 * <p>Outcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 성공적으로 완료됨</li>
 *   <li>{@link Retry}: 실패했지만 시도 횟수가 남아 재시도가 예약됨</li>
 *   <li>{@link Fail}: 영구적 실패, 재시도 불가</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 허용된 구현이 컴파일 타임에 고정됩니다. 분기는 구현 타입에 대한
 * instanceof 체인으로 하며, 각 구현이 보고 처리에 필요한 필드를 직접 가집니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * if (outcome instanceof Retry retry) {
 *     scheduleRetry(retry.nextRetryAfterMillis());
 * } else if (outcome instanceof Fail fail) {
 *     recordFailure(fail.errorCode());
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Ok, Retry, Fail {
}
