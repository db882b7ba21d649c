package fr.imt.distroforge.distroforge.business.service;

import fr.imt.distroforge.distroforge.business.model.Artifact;
import fr.imt.distroforge.distroforge.business.model.ArtifactType;
import fr.imt.distroforge.distroforge.business.model.BuildSnapshot;
import fr.imt.distroforge.distroforge.business.model.BuildStatus;
import fr.imt.distroforge.distroforge.business.port.BuildEventPublisherPort;
import fr.imt.distroforge.distroforge.business.port.BuildRecordStore;
import fr.imt.distroforge.distroforge.business.stage.PipelineStage;
import fr.imt.distroforge.distroforge.business.stage.PipelineStageFactory;
import fr.imt.distroforge.distroforge.business.stage.StageContext;
import fr.imt.distroforge.distroforge.business.stage.StageResult;
import fr.imt.distroforge.distroforge.business.utils.FileNameSanitizer;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Runs the stage chain of one build on the calling thread.
 * The build record is moved to IN_PROGRESS before the first stage and to a terminal status
 * after the last log line has been written, whichever way the stages end.
 */
@Service
@Slf4j
public class PipelineExecutor {

    private final BuildRecordStore buildRecordStore;
    private final BuildLogAggregator logAggregator;
    private final ArtifactRegistry artifactRegistry;
    private final PipelineStageFactory stageFactory;
    private final BuildEventPublisherPort eventPublisher;
    private final BuildMetrics buildMetrics;
    private final Path workspaceRoot;

    public PipelineExecutor(BuildRecordStore buildRecordStore,
                            BuildLogAggregator logAggregator,
                            ArtifactRegistry artifactRegistry,
                            PipelineStageFactory stageFactory,
                            BuildEventPublisherPort eventPublisher,
                            BuildMetrics buildMetrics,
                            @Value("${distroforge.workspace.path:./workspaces}") String workspacePath) {
        this.buildRecordStore = buildRecordStore;
        this.logAggregator = logAggregator;
        this.artifactRegistry = artifactRegistry;
        this.stageFactory = stageFactory;
        this.eventPublisher = eventPublisher;
        this.buildMetrics = buildMetrics;
        this.workspaceRoot = Path.of(workspacePath).toAbsolutePath().normalize();
    }

    public BuildStatus execute(String buildId) {
        BuildSnapshot build = buildRecordStore.get(buildId);

        buildRecordStore.setStatus(buildId, BuildStatus.IN_PROGRESS);
        eventPublisher.publishStatus(buildId, BuildStatus.IN_PROGRESS, null);
        log.info("Build {} started", buildId);
        logAggregator.append(buildId, "Build started: " + build.spec().base().getValue()
                + " (" + build.spec().architecture().getValue() + ", " + build.spec().init().getValue() + ")");
        Timer.Sample sample = buildMetrics.buildStarted();

        BuildStatus outcome = BuildStatus.FAILURE;
        Path workspace = workspaceRoot.resolve(FileNameSanitizer.sanitize(buildId));
        StageContext context = new StageContext(buildId, build.spec(), workspace, logAggregator.sink(buildId));
        try {
            Files.createDirectories(workspace);
            outcome = runStages(context);
        } catch (IOException e) {
            log.error("Build {} could not prepare its workspace", buildId, e);
            logAggregator.append(buildId, "Failed to prepare build workspace: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Build {} failed unexpectedly", buildId, e);
            logAggregator.append(buildId, "Build failed unexpectedly: " + describe(e));
        } finally {
            releaseStages(context);
            deleteWorkspace(buildId, workspace);
            finish(buildId, outcome, sample);
        }
        return outcome;
    }

    private void finish(String buildId, BuildStatus outcome, Timer.Sample sample) {
        if (outcome == BuildStatus.SUCCESS) {
            log.info("Build {} succeeded", buildId);
            logAggregator.append(buildId, "Build completed successfully");
        } else {
            log.warn("Build {} failed", buildId);
            logAggregator.append(buildId, "Build failed");
        }
        buildRecordStore.setStatus(buildId, outcome);
        eventPublisher.publishStatus(buildId, outcome, null);
        buildMetrics.buildFinished(sample, outcome);
    }

    private BuildStatus runStages(StageContext context) {
        String buildId = context.getBuildId();

        for (PipelineStage stage : stageFactory.pipeline()) {
            String stageName = stage.type().getStageName();

            if (Thread.currentThread().isInterrupted()) {
                logAggregator.append(buildId, "Stage [" + stageName + "] failed: build thread was interrupted");
                return BuildStatus.FAILURE;
            }

            buildRecordStore.setCurrentStage(buildId, stageName);
            eventPublisher.publishStatus(buildId, BuildStatus.IN_PROGRESS, stageName);
            logAggregator.append(buildId, String.format("--- Stage [%s] Starting ---", stageName));

            StageResult result;
            try {
                result = stage.run(context);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                context.discardStaged();
                logAggregator.append(buildId, "Stage [" + stageName + "] failed: interrupted");
                return BuildStatus.FAILURE;
            } catch (Exception e) {
                log.error("Stage {} of build {} threw", stageName, buildId, e);
                context.discardStaged();
                logAggregator.append(buildId, "Stage [" + stageName + "] failed: " + describe(e));
                return BuildStatus.FAILURE;
            } catch (Error e) {
                // the build is still failed by execute before the error propagates
                log.error("Stage {} of build {} aborted", stageName, buildId, e);
                context.discardStaged();
                logAggregator.append(buildId, "Stage [" + stageName + "] failed: " + describe(e));
                throw e;
            }

            result.logLines().forEach(line -> logAggregator.append(buildId, line));

            if (!result.ok()) {
                log.warn("Stage {} of build {} failed: {}", stageName, buildId, result.failureReason());
                context.discardStaged();
                logAggregator.append(buildId, "Stage [" + stageName + "] failed: " + result.failureReason());
                return BuildStatus.FAILURE;
            }

            try {
                for (Artifact artifact : artifactRegistry.registerAll(buildId, context.drainStaged())) {
                    context.recordCommitted(artifact);
                    logAggregator.append(buildId, "Artifact registered: " + artifact.fileType().getWireName()
                            + " " + artifact.fileName());
                }
            } catch (RuntimeException e) {
                log.error("Artifacts of stage {} could not be registered for build {}", stageName, buildId, e);
                logAggregator.append(buildId, "Stage [" + stageName + "] failed: " + describe(e));
                return BuildStatus.FAILURE;
            }

            logAggregator.append(buildId, String.format("--- Stage [%s] Finished ---", stageName));
        }

        buildRecordStore.setCurrentStage(buildId, null);
        return checkCompleteness(buildId);
    }

    /**
     * A successful build carries a bootable image and a container image.
     */
    private BuildStatus checkCompleteness(String buildId) {
        BuildSnapshot snapshot = buildRecordStore.get(buildId);
        if (!snapshot.hasArtifact(ArtifactType.ISO)) {
            logAggregator.append(buildId, "Integrity check failed: no artifact of type 'iso' was produced");
            return BuildStatus.FAILURE;
        }
        if (!snapshot.hasArtifact(ArtifactType.DOCKER_IMAGE) && !snapshot.hasArtifact(ArtifactType.DOCKER_IMAGE_REF)) {
            logAggregator.append(buildId,
                    "Integrity check failed: no artifact of type 'docker-image' or 'docker-image-ref' was produced");
            return BuildStatus.FAILURE;
        }
        return BuildStatus.SUCCESS;
    }

    private void releaseStages(StageContext context) {
        for (PipelineStage stage : stageFactory.pipeline()) {
            try {
                stage.release(context);
            } catch (RuntimeException e) {
                log.warn("Failed to release resources of stage {} for build {}",
                        stage.type().getStageName(), context.getBuildId(), e);
            }
        }
    }

    private void deleteWorkspace(String buildId, Path workspace) {
        try {
            FileSystemUtils.deleteRecursively(workspace);
        } catch (IOException e) {
            log.warn("Failed to delete workspace of build {}", buildId, e);
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
