package fr.imt.distroforge.distroforge.business.model;

import java.nio.file.Path;

/**
 * Artifact produced by a running stage, not yet visible to clients.
 * Exactly one of {@code file} and {@code reference} is set.
 */
public record StagedArtifact(ArtifactType type, String fileName, Path file, String reference) {

    public static StagedArtifact file(ArtifactType type, Path file) {
        return new StagedArtifact(type, file.getFileName().toString(), file, null);
    }

    public static StagedArtifact reference(ArtifactType type, String fileName, String reference) {
        return new StagedArtifact(type, fileName, null, reference);
    }
}
