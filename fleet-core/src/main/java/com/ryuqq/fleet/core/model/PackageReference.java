package com.ryuqq.fleet.core.model;

/**
 * Deployment가 설치/제거할 패키지 버전 참조.
 *
 * <p>에이전트가 다운로드와 설치를 수행하는 데 필요한 정보만 담습니다.
 * 패키지 카탈로그 자체는 외부 협력자입니다.</p>
 *
 * @param packageName 패키지 이름
 * @param version 버전 문자열
 * @param installerType 설치 관리자 유형 (예: "msi", "exe", null이면 "exe")
 * @param installerUrl 설치 파일 다운로드 URL (null 허용)
 * @param installArgs 설치 인자 (null 허용)
 * @param uninstallArgs 제거 인자 (null 허용)
 * @param expectedHash 기대 SHA-256 해시 (null 허용)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PackageReference(
    String packageName,
    String version,
    String installerType,
    String installerUrl,
    String installArgs,
    String uninstallArgs,
    String expectedHash
) {

    public PackageReference {
        if (packageName == null || packageName.isBlank()) {
            throw new IllegalArgumentException("packageName cannot be null or blank");
        }
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("version cannot be null or blank");
        }
        if (installerType == null || installerType.isBlank()) {
            installerType = "exe";
        }
    }

    /**
     * 이름과 버전만으로 참조 생성.
     *
     * @param packageName 패키지 이름
     * @param version 버전
     * @return PackageReference
     */
    public static PackageReference of(String packageName, String version) {
        return new PackageReference(packageName, version, null, null, null, null, null);
    }

    /**
     * 모드에 맞는 에이전트 실행 인자 선택.
     *
     * @param mode 배포 모드
     * @return UNINSTALL이면 uninstallArgs, 그 외에는 installArgs
     */
    public String commandFor(DeploymentMode mode) {
        return mode == DeploymentMode.UNINSTALL ? uninstallArgs : installArgs;
    }
}
