package com.ryuqq.fleet.core.exception;

/**
 * 오케스트레이션 도메인 예외의 공통 상위 타입.
 *
 * <p>모든 도메인 예외는 unchecked이며, 로그와 집계에서 분류할 수 있도록 오류 코드를 가집니다.
 * 인자 검증 실패는 {@link IllegalArgumentException}, 허용되지 않은 상태 전이는
 * {@link IllegalStateException}을 그대로 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FleetException extends RuntimeException {

    private final String errorCode;

    public FleetException(String errorCode, String message) {
        super(message);
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        this.errorCode = errorCode;
    }

    public FleetException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
