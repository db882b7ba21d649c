package fr.imt.distroforge.distroforge.business.service;

import fr.imt.distroforge.distroforge.business.model.Artifact;
import fr.imt.distroforge.distroforge.business.model.ArtifactType;
import fr.imt.distroforge.distroforge.business.model.StagedArtifact;
import fr.imt.distroforge.distroforge.business.port.BuildRecordStore;
import fr.imt.distroforge.distroforge.business.utils.Constants;
import fr.imt.distroforge.distroforge.business.utils.FileNameSanitizer;
import fr.imt.distroforge.distroforge.exception.ArtifactNotFoundException;
import fr.imt.distroforge.distroforge.exception.StageFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Typed build outputs. Files are moved out of the build workspace into a per-build
 * directory under the artifact root so that they outlive the workspace.
 */
@Service
@Slf4j
public class ArtifactRegistry {

    public static final Set<String> DOWNLOAD_TYPES = Arrays.stream(ArtifactType.values())
            .map(ArtifactType::getDownloadType)
            .collect(Collectors.toUnmodifiableSet());

    private final BuildRecordStore buildRecordStore;
    private final Path artifactRoot;

    public ArtifactRegistry(BuildRecordStore buildRecordStore,
                            @Value("${distroforge.artifacts.path:./artifacts}") String artifactsPath) {
        this.buildRecordStore = buildRecordStore;
        this.artifactRoot = Path.of(artifactsPath).toAbsolutePath().normalize();
    }

    /**
     * Make a staged artifact visible on the build record.
     */
    public Artifact register(String buildId, StagedArtifact staged) {
        return registerAll(buildId, List.of(staged)).get(0);
    }

    /**
     * Store every staged file, then record all artifacts on the build. Nothing becomes visible
     * on the record unless every file could be stored; files already moved are removed again.
     *
     * @throws StageFailureException if a file cannot be stored
     */
    public List<Artifact> registerAll(String buildId, List<StagedArtifact> staged) {
        List<Artifact> artifacts = new ArrayList<>();
        try {
            for (StagedArtifact candidate : staged) {
                artifacts.add(candidate.file() != null
                        ? store(buildId, candidate)
                        : new Artifact(candidate.type(), candidate.fileName(), candidate.reference(), null));
            }
        } catch (RuntimeException e) {
            artifacts.forEach(this::discard);
            throw e;
        }

        for (Artifact artifact : artifacts) {
            buildRecordStore.addArtifact(buildId, artifact);
            log.info("Registered {} artifact {} for build {}", artifact.fileType().getWireName(), artifact.fileName(), buildId);
        }
        return artifacts;
    }

    public List<Artifact> list(String buildId) {
        return buildRecordStore.get(buildId).artifacts();
    }

    public Artifact first(String buildId) {
        return list(buildId).stream()
                .findFirst()
                .orElseThrow(() -> new ArtifactNotFoundException("No artifacts available for build " + buildId));
    }

    /**
     * Find the artifact served under a download type and check that its file is still in place.
     *
     * @throws IllegalArgumentException  if the download type is unknown
     * @throws ArtifactNotFoundException if the build has no such artifact
     */
    public Artifact resolveDownload(String buildId, String downloadType) {
        if (!DOWNLOAD_TYPES.contains(downloadType)) {
            throw new IllegalArgumentException("Invalid artifact type: " + downloadType
                    + ". Expected one of " + DOWNLOAD_TYPES.stream().sorted().toList());
        }
        Artifact artifact = list(buildId).stream()
                .filter(candidate -> candidate.fileType().getDownloadType().equals(downloadType))
                .findFirst()
                .orElseThrow(() -> new ArtifactNotFoundException(
                        "No " + downloadType + " artifact available for build " + buildId));

        if (artifact.isStoredFile()) {
            Path location = artifact.location().toAbsolutePath().normalize();
            if (!location.startsWith(buildDirectory(buildId)) || !Files.isRegularFile(location)) {
                throw new ArtifactNotFoundException("Artifact file is no longer available: " + artifact.fileName());
            }
        }
        return artifact;
    }

    public void deleteArtifacts(String buildId) {
        try {
            if (FileSystemUtils.deleteRecursively(buildDirectory(buildId))) {
                log.info("Deleted artifacts of build {}", buildId);
            }
        } catch (IOException e) {
            log.warn("Failed to delete artifacts of build {}", buildId, e);
        }
    }

    public Path buildDirectory(String buildId) {
        return artifactRoot.resolve(FileNameSanitizer.sanitize(buildId));
    }

    private Artifact store(String buildId, StagedArtifact staged) {
        String fileName = FileNameSanitizer.sanitize(staged.fileName());
        try {
            Path directory = Files.createDirectories(buildDirectory(buildId));
            Path target = directory.resolve(fileName);
            Files.move(staged.file(), target);
            String url = String.join("/", Constants.DOWNLOAD_PATH, buildId, staged.type().getDownloadType());
            return new Artifact(staged.type(), fileName, url, target);
        } catch (FileAlreadyExistsException e) {
            throw new StageFailureException("Artifact " + fileName + " is already registered for build " + buildId, e);
        } catch (IOException e) {
            throw new StageFailureException("Failed to store artifact " + fileName + ": " + e.getMessage(), e);
        }
    }

    private void discard(Artifact artifact) {
        if (!artifact.isStoredFile()) {
            return;
        }
        try {
            Files.deleteIfExists(artifact.location());
        } catch (IOException e) {
            log.warn("Failed to discard artifact file {}", artifact.location(), e);
        }
    }
}
