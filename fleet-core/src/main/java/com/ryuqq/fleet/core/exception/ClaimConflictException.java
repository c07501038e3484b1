package com.ryuqq.fleet.core.exception;

/**
 * 조건부 갱신(compare-and-set) 경합에서 패배함.
 *
 * <p>내부에서만 사용되며, 외부에는 "대기 중인 작업 없음" 또는 "건너뜀"으로 드러납니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ClaimConflictException extends FleetException {

    public static final String ERROR_CODE = "CLAIM-409";

    public ClaimConflictException(String message) {
        super(ERROR_CODE, message);
    }
}
