package fr.imt.distroforge.distroforge.business.stage;

import lombok.Getter;

/**
 * Pipeline stages in execution order.
 */
@Getter
public enum StageType {
    PACKAGE_RESOLUTION("package-resolution"),
    ROOTFS_BOOTSTRAP("rootfs-bootstrap"),
    SYSTEM_CONFIGURATION("system-configuration"),
    DISPLAY_CONFIGURATION("display-configuration"),
    ISO_GENERATION("iso-generation"),
    CONTAINER_IMAGE("container-image"),
    ARTIFACT_FINALIZATION("artifact-finalization");

    private final String stageName;

    StageType(String stageName) {
        this.stageName = stageName;
    }
}
