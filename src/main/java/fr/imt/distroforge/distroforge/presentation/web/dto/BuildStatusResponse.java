package fr.imt.distroforge.distroforge.presentation.web.dto;

import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
public class BuildStatusResponse {
    private String buildId;
    private String status;
    private String currentStage;
    private List<LogEntryResponse> logs;
    private List<ArtifactResponse> artifacts;
    private Instant createdAt;
    private Instant completedAt;
}
