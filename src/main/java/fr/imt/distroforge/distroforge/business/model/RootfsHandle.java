package fr.imt.distroforge.distroforge.business.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Bootstrapped root filesystem.
 *
 * @param buildId        owning build
 * @param imageReference container image holding the base root filesystem
 * @param base           distribution it was bootstrapped from
 * @param architecture   target architecture
 * @param packages       installed distribution packages
 * @param workspace      build workspace on the engine host
 */
public record RootfsHandle(
        String buildId,
        String imageReference,
        DistroBase base,
        Architecture architecture,
        List<String> packages,
        Path workspace) {

    public static final String OVERLAY_DIRECTORY = "overlay";

    /**
     * Files layered on top of the root filesystem by the configuration stages.
     */
    public Path overlayDir() {
        return workspace.resolve(OVERLAY_DIRECTORY);
    }
}
