package fr.imt.distroforge.distroforge.business.model;

import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

@Getter
public enum ArtifactType {
    ISO("iso", "iso"),
    DOCKER_IMAGE("docker-image", "docker"),
    DOCKER_IMAGE_REF("docker-image-ref", "docker"),
    CHECKSUMS("checksums", "checksums");

    private final String wireName;
    private final String downloadType;

    ArtifactType(String wireName, String downloadType) {
        this.wireName = wireName;
        this.downloadType = downloadType;
    }

    public boolean isContainerImage() {
        return this == DOCKER_IMAGE || this == DOCKER_IMAGE_REF;
    }

    public static Optional<ArtifactType> fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(wireName))
                .findFirst();
    }
}
