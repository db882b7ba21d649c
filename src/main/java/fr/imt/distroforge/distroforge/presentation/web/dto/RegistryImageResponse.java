package fr.imt.distroforge.distroforge.presentation.web.dto;

/**
 * Returned instead of a file when the container image lives in a registry.
 */
public record RegistryImageResponse(String type, String pullCommand, String image) {

    public static final String DOCKER_HUB_REFERENCE = "docker-hub-reference";

    public static RegistryImageResponse of(String image) {
        return new RegistryImageResponse(DOCKER_HUB_REFERENCE, "docker pull " + image, image);
    }
}
