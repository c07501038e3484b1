package com.ryuqq.fleet.core.model;

/**
 * Deployment 모드.
 *
 * <p>wire 값은 저장소/에이전트와의 호환성을 위해 고정입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum DeploymentMode {

    /**
     * 필수 설치.
     */
    REQUIRED("required"),

    /**
     * 설치 가능 (셀프서비스).
     */
    AVAILABLE("available"),

    /**
     * 제거.
     */
    UNINSTALL("uninstall");

    private final String wireValue;

    DeploymentMode(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /**
     * wire 값으로부터 모드 조회.
     *
     * @param value wire 값
     * @return DeploymentMode
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static DeploymentMode fromWire(String value) {
        for (DeploymentMode mode : values()) {
            if (mode.wireValue.equals(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown deployment mode: " + value);
    }
}
