package com.ryuqq.fleet.application.gateway;

/**
 * 에이전트 보고 처리 결과.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ReportAck {

    /** 보고가 상태에 반영됨 */
    ACCEPTED,

    /** 이미 최종 상태이거나 같은 상태의 반복 보고 (재전송 중단 신호) */
    DUPLICATE_IGNORED,

    /** 알 수 없는 인스턴스 ID */
    UNKNOWN_INSTANCE,

    /** 현재 상태에서 허용되지 않는 보고 (예: claim되지 않은 인스턴스, 역방향 진행) */
    REJECTED
}
