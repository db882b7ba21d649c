package fr.imt.distroforge.distroforge.business.service;

import fr.imt.distroforge.distroforge.business.model.Architecture;
import fr.imt.distroforge.distroforge.business.model.Artifact;
import fr.imt.distroforge.distroforge.business.model.ArtifactType;
import fr.imt.distroforge.distroforge.business.model.BuildSnapshot;
import fr.imt.distroforge.distroforge.business.model.BuildSpecification;
import fr.imt.distroforge.distroforge.business.model.BuildStatus;
import fr.imt.distroforge.distroforge.business.model.DistroBase;
import fr.imt.distroforge.distroforge.business.model.InitSystem;
import fr.imt.distroforge.distroforge.business.model.StagedArtifact;
import fr.imt.distroforge.distroforge.business.model.SystemDefaults;
import fr.imt.distroforge.distroforge.business.stage.PipelineStage;
import fr.imt.distroforge.distroforge.business.stage.StageContext;
import fr.imt.distroforge.distroforge.business.stage.StageResult;
import fr.imt.distroforge.distroforge.business.stage.StageType;
import fr.imt.distroforge.distroforge.support.BuildSpecifications;
import fr.imt.distroforge.distroforge.support.PipelineFixture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.*;

class PipelineExecutorTest {

    @TempDir
    Path tempDir;

    @Test
    void successfulBuildRegistersIsoContainerImageAndChecksums() throws Exception {
        PipelineFixture fixture = new PipelineFixture(tempDir);
        String buildId = fixture.store.create(BuildSpecifications.archHyprland());

        BuildStatus status = fixture.executor.execute(buildId);

        assertEquals(BuildStatus.SUCCESS, status);
        BuildSnapshot snapshot = fixture.store.get(buildId);
        assertEquals(BuildStatus.SUCCESS, snapshot.status());
        assertNull(snapshot.currentStage());
        assertNotNull(snapshot.completedAt());

        List<ArtifactType> types = snapshot.artifacts().stream().map(Artifact::fileType).toList();
        assertEquals(List.of(ArtifactType.ISO, ArtifactType.DOCKER_IMAGE, ArtifactType.CHECKSUMS), types);
        for (Artifact artifact : snapshot.artifacts()) {
            assertTrue(Files.isRegularFile(artifact.location()), artifact.fileName());
        }

        String checksums = Files.readString(snapshot.artifacts().get(2).location());
        assertTrue(checksums.contains("distroforge-" + buildId + ".iso"));
        assertTrue(checksums.contains("distroforge-" + buildId + ".tar"));

        List<String> messages = fixture.messages(buildId);
        assertEquals("Build completed successfully", messages.get(messages.size() - 1));
        for (StageType type : StageType.values()) {
            assertTrue(messages.contains("--- Stage [" + type.getStageName() + "] Starting ---"), type.getStageName());
            assertTrue(messages.contains("--- Stage [" + type.getStageName() + "] Finished ---"), type.getStageName());
        }
        assertEquals(List.of("resolve", "bootstrap", "masterIso", "buildImage", "release"), fixture.toolchain.calls);
    }

    @Test
    void workspaceIsRemovedAfterTheBuild() {
        PipelineFixture fixture = new PipelineFixture(tempDir);
        String buildId = fixture.store.create(BuildSpecifications.archHyprland());

        fixture.executor.execute(buildId);

        assertFalse(Files.exists(fixture.workspaceRoot.resolve(buildId)));
    }

    @Test
    void pushedContainerImageIsRecordedAsReference() {
        PipelineFixture fixture = new PipelineFixture(tempDir);
        fixture.toolchain.pushImages = true;
        String buildId = fixture.store.create(BuildSpecifications.headlessAlpine());

        assertEquals(BuildStatus.SUCCESS, fixture.executor.execute(buildId));

        Artifact reference = fixture.store.get(buildId).artifacts().stream()
                .filter(artifact -> artifact.fileType() == ArtifactType.DOCKER_IMAGE_REF)
                .findFirst()
                .orElseThrow();
        assertEquals("registry.example/distroforge:" + buildId, reference.url());
        assertTrue(fixture.messages(buildId).contains("Registry artifact registry.example/distroforge:" + buildId
                + " not checksummed"));
    }

    @Test
    void isoFailureStopsThePipelineAndNamesTheStage() {
        PipelineFixture fixture = new PipelineFixture(tempDir);
        fixture.toolchain.isoFailure = "mkarchiso exited with code 1";
        String buildId = fixture.store.create(BuildSpecifications.archHyprland());

        assertEquals(BuildStatus.FAILURE, fixture.executor.execute(buildId));

        BuildSnapshot snapshot = fixture.store.get(buildId);
        assertEquals(BuildStatus.FAILURE, snapshot.status());
        assertFalse(snapshot.hasArtifact(ArtifactType.ISO));
        assertTrue(snapshot.artifacts().isEmpty());

        List<String> messages = fixture.messages(buildId);
        assertTrue(messages.contains("mkarchiso: error"));
        assertTrue(messages.contains("Stage [iso-generation] failed: mkarchiso exited with code 1"));
        assertFalse(messages.contains("--- Stage [container-image] Starting ---"));
        assertEquals("Build failed", messages.get(messages.size() - 1));
        assertFalse(fixture.toolchain.calls.contains("buildImage"));
    }

    @Test
    void throwingStageFailsTheBuild() {
        PipelineFixture fixture = new PipelineFixture(tempDir);
        fixture.toolchain.bootstrapException = new IllegalStateException("docker daemon unreachable");
        String buildId = fixture.store.create(BuildSpecifications.archHyprland());

        assertEquals(BuildStatus.FAILURE, fixture.executor.execute(buildId));

        assertTrue(fixture.messages(buildId).contains("Stage [rootfs-bootstrap] failed: docker daemon unreachable"));
    }

    @Test
    void buildWithoutContainerImageFailsTheIntegrityCheck() {
        PipelineFixture fixture = new PipelineFixture(tempDir,
                replacing(StageType.CONTAINER_IMAGE, context -> StageResult.success("nothing built")));
        String buildId = fixture.store.create(BuildSpecifications.archHyprland());

        assertEquals(BuildStatus.FAILURE, fixture.executor.execute(buildId));

        List<String> messages = fixture.messages(buildId);
        assertTrue(messages.contains(
                "Integrity check failed: no artifact of type 'docker-image' or 'docker-image-ref' was produced"));
        assertEquals("Build failed", messages.get(messages.size() - 1));
        assertTrue(fixture.store.get(buildId).hasArtifact(ArtifactType.ISO));
    }

    @Test
    void artifactsOfAFailedStageAreNotRegistered() {
        PipelineFixture fixture = new PipelineFixture(tempDir,
                replacing(StageType.ISO_GENERATION, context -> {
                    Path half = Files.writeString(context.getWorkspace().resolve("half.iso"), "partial");
                    context.stage(StagedArtifact.file(ArtifactType.ISO, half));
                    return StageResult.failure("disk full");
                }));
        String buildId = fixture.store.create(BuildSpecifications.archHyprland());

        assertEquals(BuildStatus.FAILURE, fixture.executor.execute(buildId));

        assertTrue(fixture.store.get(buildId).artifacts().isEmpty());
        assertTrue(fixture.messages(buildId).contains("Stage [iso-generation] failed: disk full"));
    }

    @Test
    void stageThrowingAnErrorStillEndsTheBuildInFailure() {
        PipelineFixture fixture = new PipelineFixture(tempDir,
                replacing(StageType.SYSTEM_CONFIGURATION, context -> {
                    throw new NoClassDefFoundError("org/example/MissingRenderer");
                }));
        String buildId = fixture.store.create(BuildSpecifications.archHyprland());

        assertThrows(NoClassDefFoundError.class, () -> fixture.executor.execute(buildId));

        BuildSnapshot snapshot = fixture.store.get(buildId);
        assertEquals(BuildStatus.FAILURE, snapshot.status());
        assertNotNull(snapshot.completedAt());
        List<String> messages = fixture.messages(buildId);
        assertTrue(messages.contains("Stage [system-configuration] failed: org/example/MissingRenderer"));
        assertEquals("Build failed", messages.get(messages.size() - 1));
        assertTrue(fixture.toolchain.calls.contains("release"));
        assertFalse(Files.exists(fixture.workspaceRoot.resolve(buildId)));
    }

    @Test
    void minimalSpecificationWithEmptyCategoriesProducesOneIsoAndOneContainerImage() {
        PipelineFixture fixture = new PipelineFixture(tempDir);
        String buildId = fixture.store.create(new BuildSpecification(DistroBase.ARCH, "linux", InitSystem.SYSTEMD,
                Architecture.X86_64, null, Map.of(), List.of(), new SystemDefaults(60, true, null, false, false)));

        assertEquals(BuildStatus.SUCCESS, fixture.executor.execute(buildId));

        List<Artifact> artifacts = fixture.store.get(buildId).artifacts();
        assertEquals(1, artifacts.stream().filter(artifact -> artifact.fileType() == ArtifactType.ISO).count());
        assertEquals(1, artifacts.stream().filter(artifact -> artifact.fileType() == ArtifactType.DOCKER_IMAGE).count());
    }

    @Test
    void rootfsIsReleasedWhenALaterStageFails() {
        PipelineFixture fixture = new PipelineFixture(tempDir);
        fixture.toolchain.isoFailure = "mkarchiso exited with code 1";
        String buildId = fixture.store.create(BuildSpecifications.archHyprland());

        fixture.executor.execute(buildId);

        assertEquals(List.of("resolve", "bootstrap", "masterIso", "release"), fixture.toolchain.calls);
    }

    @Test
    void rootfsIsNotReleasedWhenBootstrapFailed() {
        PipelineFixture fixture = new PipelineFixture(tempDir);
        fixture.toolchain.bootstrapException = new IllegalStateException("docker daemon unreachable");
        String buildId = fixture.store.create(BuildSpecifications.archHyprland());

        fixture.executor.execute(buildId);

        assertFalse(fixture.toolchain.calls.contains("release"));
    }

    @Test
    void stageArtifactsAreCommittedAllOrNothing() {
        PipelineFixture fixture = new PipelineFixture(tempDir,
                replacing(StageType.ISO_GENERATION, context -> {
                    Path iso = Files.writeString(context.getWorkspace().resolve("distroforge.iso"), "iso");
                    context.stage(StagedArtifact.file(ArtifactType.ISO, iso));
                    context.stage(StagedArtifact.file(ArtifactType.ISO, context.getWorkspace().resolve("vanished.iso")));
                    return StageResult.success("two images");
                }));
        String buildId = fixture.store.create(BuildSpecifications.archHyprland());

        assertEquals(BuildStatus.FAILURE, fixture.executor.execute(buildId));

        assertTrue(fixture.store.get(buildId).artifacts().isEmpty());
        assertFalse(Files.exists(fixture.artifactRegistry.buildDirectory(buildId).resolve("distroforge.iso")));
        assertTrue(fixture.messages(buildId).stream()
                .anyMatch(line -> line.startsWith("Stage [iso-generation] failed: Failed to store artifact vanished.iso")));
    }

    @Test
    void buildMetricsAreRecorded() {
        PipelineFixture fixture = new PipelineFixture(tempDir);
        String succeeded = fixture.store.create(BuildSpecifications.archHyprland());
        fixture.executor.execute(succeeded);
        fixture.toolchain.isoFailure = "mkarchiso exited with code 1";
        String failed = fixture.store.create(BuildSpecifications.archHyprland());
        fixture.executor.execute(failed);

        assertEquals(1.0, fixture.meterRegistry.get(BuildMetrics.BUILDS).tag("status", "success").counter().count());
        assertEquals(1.0, fixture.meterRegistry.get(BuildMetrics.BUILDS).tag("status", "failure").counter().count());
        assertEquals(0.0, fixture.meterRegistry.get(BuildMetrics.BUILDS_IN_PROGRESS).gauge().value());
        assertEquals(2, fixture.meterRegistry.get(BuildMetrics.BUILD_DURATION).timer().count());
    }

    @Test
    void logsObservedDuringTheBuildArePrefixesOfTheFinalLog() throws Exception {
        PipelineFixture fixture = new PipelineFixture(tempDir);
        String buildId = fixture.store.create(BuildSpecifications.archHyprland());
        List<List<String>> observed = new CopyOnWriteArrayList<>();

        Thread reader = new Thread(() -> {
            for (int i = 0; i < 200; i++) {
                observed.add(fixture.messages(buildId));
            }
        });
        reader.start();
        fixture.executor.execute(buildId);
        reader.join();

        List<String> finalLog = fixture.messages(buildId);
        for (List<String> snapshot : observed) {
            assertEquals(finalLog.subList(0, snapshot.size()), snapshot);
        }
    }

    private static UnaryOperator<List<PipelineStage>> replacing(StageType type, StageBody body) {
        return stages -> {
            stages.removeIf(stage -> stage.type() == type);
            stages.add(new PipelineStage() {
                @Override
                public StageType type() {
                    return type;
                }

                @Override
                public StageResult run(StageContext context) throws Exception {
                    return body.run(context);
                }
            });
            return stages;
        };
    }

    @FunctionalInterface
    private interface StageBody {
        StageResult run(StageContext context) throws Exception;
    }
}
