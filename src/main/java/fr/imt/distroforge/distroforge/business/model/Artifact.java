package fr.imt.distroforge.distroforge.business.model;

import java.nio.file.Path;

/**
 * A registered build output.
 *
 * @param fileType kind of artifact
 * @param fileName display name of the artifact
 * @param url      download path for stored files, image reference for registry images
 * @param location file on the engine host, null for registry references
 */
public record Artifact(ArtifactType fileType, String fileName, String url, Path location) {

    public boolean isStoredFile() {
        return location != null;
    }
}
