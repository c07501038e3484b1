package com.ryuqq.fleet.core.outcome;

import com.ryuqq.fleet.core.model.InstanceId;

/**
 * 성공 결과.
 *
 * @param instanceId 실행 인스턴스 ID
 * @param message 성공 메시지 (선택, null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Ok(
    InstanceId instanceId,
    String message
) implements Outcome {

    public Ok {
        if (instanceId == null) {
            throw new IllegalArgumentException("instanceId cannot be null");
        }
    }

    /**
     * 메시지 없이 성공 결과 생성.
     *
     * @param instanceId 인스턴스 ID
     * @return Ok 인스턴스
     */
    public static Ok of(InstanceId instanceId) {
        return new Ok(instanceId, null);
    }
}
