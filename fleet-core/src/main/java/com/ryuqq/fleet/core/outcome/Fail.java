package com.ryuqq.fleet.core.outcome;

/**
 * 영구적 실패 (재시도 불가).
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>0이 아닌 종료 코드, 시도 횟수 소진 ({@value #EXEC_FAILED})</li>
 * </ul>
 *
 * @param errorCode 오류 코드
 * @param message 오류 메시지
 * @param cause 원인 (선택, null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Fail(
    String errorCode,
    String message,
    String cause
) implements Outcome {

    /** 실행은 끝났지만 0이 아닌 종료 코드를 보고함 */
    public static final String EXEC_FAILED = "EXEC-FAILED";

    public Fail {
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    public static Fail of(String errorCode, String message, String cause) {
        return new Fail(errorCode, message, cause);
    }

    public static Fail of(String errorCode, String message) {
        return new Fail(errorCode, message, null);
    }
}
