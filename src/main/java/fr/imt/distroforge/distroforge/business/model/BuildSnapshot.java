package fr.imt.distroforge.distroforge.business.model;

import java.time.Instant;
import java.util.List;

/**
 * Immutable point-in-time copy of a build record.
 */
public record BuildSnapshot(
        String buildId,
        BuildSpecification spec,
        BuildStatus status,
        String currentStage,
        List<LogEntry> logs,
        List<Artifact> artifacts,
        Instant createdAt,
        Instant completedAt) {

    public boolean hasArtifact(ArtifactType type) {
        return artifacts.stream().anyMatch(artifact -> artifact.fileType() == type);
    }
}
