package com.ryuqq.fleet.core.model;

/**
 * 다중 노드 Deployment의 롤아웃 전략.
 *
 * <ul>
 *   <li>IMMEDIATE: 모든 대상이 한 번에 디스패치 가능</li>
 *   <li>STAGED: batchSize 단위 배치, 이전 배치 종료 + delayMinutes 경과 후 다음 배치</li>
 *   <li>CANARY: 첫 배치(canarySize)가 모두 성공해야 이후 배치가 STAGED 규칙으로 진행</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum RolloutStrategy {

    IMMEDIATE("immediate"),
    STAGED("staged"),
    CANARY("canary");

    private final String wireValue;

    RolloutStrategy(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static RolloutStrategy fromWire(String value) {
        for (RolloutStrategy strategy : values()) {
            if (strategy.wireValue.equals(value)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown rollout strategy: " + value);
    }
}
