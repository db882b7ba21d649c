package fr.imt.distroforge.distroforge.business.model;

import java.nio.file.Path;

/**
 * Result of a container image build: either a saved archive or a pushed registry tag.
 */
public record ContainerImage(String imageName, Path archive, String registryReference) {

    public static ContainerImage archived(String imageName, Path archive) {
        return new ContainerImage(imageName, archive, null);
    }

    public static ContainerImage pushed(String imageName, String registryReference) {
        return new ContainerImage(imageName, null, registryReference);
    }

    public boolean isPushed() {
        return registryReference != null;
    }
}
