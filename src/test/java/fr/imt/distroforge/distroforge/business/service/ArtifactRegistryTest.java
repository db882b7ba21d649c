package fr.imt.distroforge.distroforge.business.service;

import fr.imt.distroforge.distroforge.business.model.Artifact;
import fr.imt.distroforge.distroforge.business.model.ArtifactType;
import fr.imt.distroforge.distroforge.business.model.StagedArtifact;
import fr.imt.distroforge.distroforge.exception.ArtifactNotFoundException;
import fr.imt.distroforge.distroforge.exception.StageFailureException;
import fr.imt.distroforge.distroforge.infrastructure.persistence.InMemoryBuildRecordStore;
import fr.imt.distroforge.distroforge.support.BuildSpecifications;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactRegistryTest {

    @TempDir
    Path tempDir;

    private InMemoryBuildRecordStore store;
    private ArtifactRegistry registry;
    private String buildId;

    @BeforeEach
    void setUp() {
        store = new InMemoryBuildRecordStore(Clock.systemUTC());
        registry = new ArtifactRegistry(store, tempDir.resolve("artifacts").toString());
        buildId = store.create(BuildSpecifications.archHyprland());
    }

    @Test
    void fileArtifactIsMovedUnderBuildDirectory() throws Exception {
        Path iso = Files.writeString(tempDir.resolve("distroforge.iso"), "iso");

        Artifact artifact = registry.register(buildId, StagedArtifact.file(ArtifactType.ISO, iso));

        assertEquals("/api/build/download/" + buildId + "/iso", artifact.url());
        assertEquals(registry.buildDirectory(buildId).resolve("distroforge.iso"), artifact.location());
        assertTrue(Files.isRegularFile(artifact.location()));
        assertFalse(Files.exists(iso));
        assertEquals(artifact, store.get(buildId).artifacts().get(0));
    }

    @Test
    void registryReferenceIsKeptAsUrl() {
        Artifact artifact = registry.register(buildId,
                StagedArtifact.reference(ArtifactType.DOCKER_IMAGE_REF, "image", "user/distroforge:abc"));

        assertEquals("user/distroforge:abc", artifact.url());
        assertFalse(artifact.isStoredFile());
        assertEquals(artifact, registry.resolveDownload(buildId, "docker"));
    }

    @Test
    void firstArtifactFollowsRegistrationOrder() throws Exception {
        registry.register(buildId, StagedArtifact.file(ArtifactType.ISO, Files.writeString(tempDir.resolve("a.iso"), "a")));
        registry.register(buildId, StagedArtifact.file(ArtifactType.DOCKER_IMAGE, Files.writeString(tempDir.resolve("b.tar"), "b")));

        assertEquals("a.iso", registry.first(buildId).fileName());
        assertEquals("b.tar", registry.resolveDownload(buildId, "docker").fileName());
    }

    @Test
    void buildWithoutArtifactsHasNoFirst() {
        assertThrows(ArtifactNotFoundException.class, () -> registry.first(buildId));
    }

    @Test
    void unknownDownloadTypeIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> registry.resolveDownload(buildId, "exe"));

        assertTrue(e.getMessage().contains("Invalid artifact type"));
    }

    @Test
    void missingTypeOrVanishedFileIsNotFound() throws Exception {
        Artifact artifact = registry.register(buildId,
                StagedArtifact.file(ArtifactType.ISO, Files.writeString(tempDir.resolve("x.iso"), "x")));

        assertThrows(ArtifactNotFoundException.class, () -> registry.resolveDownload(buildId, "docker"));

        Files.delete(artifact.location());
        assertThrows(ArtifactNotFoundException.class, () -> registry.resolveDownload(buildId, "iso"));
    }

    @Test
    void deleteArtifactsRemovesBuildDirectory() throws Exception {
        registry.register(buildId, StagedArtifact.file(ArtifactType.ISO, Files.writeString(tempDir.resolve("y.iso"), "y")));

        registry.deleteArtifacts(buildId);

        assertFalse(Files.exists(registry.buildDirectory(buildId)));
    }

    @Test
    void registerAllRecordsNothingWhenOneFileCannotBeStored() throws Exception {
        Path iso = Files.writeString(tempDir.resolve("image.iso"), "iso");
        Path missing = tempDir.resolve("missing.tar");

        assertThrows(StageFailureException.class, () -> registry.registerAll(buildId, List.of(
                StagedArtifact.file(ArtifactType.ISO, iso),
                StagedArtifact.file(ArtifactType.DOCKER_IMAGE, missing))));

        assertTrue(store.get(buildId).artifacts().isEmpty());
        assertFalse(Files.exists(registry.buildDirectory(buildId).resolve("image.iso")));
    }

    @Test
    void namesCollidingAfterSanitizingAreRejected() throws Exception {
        Files.createDirectories(tempDir.resolve("a"));
        Files.createDirectories(tempDir.resolve("b"));
        Artifact first = registry.register(buildId,
                StagedArtifact.file(ArtifactType.ISO, Files.writeString(tempDir.resolve("a/release notes.iso"), "first")));

        StageFailureException e = assertThrows(StageFailureException.class, () -> registry.register(buildId,
                StagedArtifact.file(ArtifactType.ISO, Files.writeString(tempDir.resolve("b/release_notes.iso"), "second"))));

        assertTrue(e.getMessage().contains("release_notes.iso is already registered"));
        assertEquals("first", Files.readString(first.location()));
        assertEquals(List.of(first), store.get(buildId).artifacts());
    }
}
