package com.ryuqq.fleet.core.exception;

import com.ryuqq.fleet.core.model.TargetSelector;

/**
 * 대상 선택자를 노드 집합으로 확장할 수 없음.
 *
 * <p>알 수 없는 그룹이거나 결과가 빈 집합인 경우 발생하며, 상위 Job/Deployment는
 * 인스턴스를 하나도 만들지 않고 즉시 실패합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TargetResolutionException extends FleetException {

    public static final String ERROR_CODE = "TARGET-001";

    private final TargetSelector selector;

    public TargetResolutionException(TargetSelector selector, String message) {
        super(ERROR_CODE, message);
        this.selector = selector;
    }

    public TargetSelector getSelector() {
        return selector;
    }
}
