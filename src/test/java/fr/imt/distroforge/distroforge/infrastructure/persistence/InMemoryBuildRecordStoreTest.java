package fr.imt.distroforge.distroforge.infrastructure.persistence;

import fr.imt.distroforge.distroforge.business.model.Artifact;
import fr.imt.distroforge.distroforge.business.model.ArtifactType;
import fr.imt.distroforge.distroforge.business.model.BuildSnapshot;
import fr.imt.distroforge.distroforge.business.model.BuildStatus;
import fr.imt.distroforge.distroforge.exception.BuildNotFoundException;
import fr.imt.distroforge.distroforge.support.BuildSpecifications;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryBuildRecordStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");

    private InMemoryBuildRecordStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryBuildRecordStore(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void newRecordIsPendingAndEmpty() {
        String buildId = store.create(BuildSpecifications.archHyprland());

        BuildSnapshot snapshot = store.get(buildId);
        assertEquals(BuildStatus.PENDING, snapshot.status());
        assertNull(snapshot.currentStage());
        assertTrue(snapshot.logs().isEmpty());
        assertTrue(snapshot.artifacts().isEmpty());
        assertEquals(NOW, snapshot.createdAt());
        assertNull(snapshot.completedAt());
    }

    @Test
    void concurrentCreatesYieldDistinctIdentifiers() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<String>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                futures.add(pool.submit(() -> store.create(BuildSpecifications.headlessAlpine())));
            }
            Set<String> ids = new HashSet<>();
            for (Future<String> future : futures) {
                ids.add(future.get());
            }
            assertEquals(200, ids.size());
            assertEquals(200, store.findAll().size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void logsKeepInsertionOrder() {
        String buildId = store.create(BuildSpecifications.archHyprland());
        store.appendLog(buildId, "first");
        store.appendLog(buildId, "second");

        List<String> messages = store.get(buildId).logs().stream().map(entry -> entry.message()).toList();
        assertEquals(List.of("first", "second"), messages);
    }

    @Test
    void snapshotsDoNotSeeLaterWrites() {
        String buildId = store.create(BuildSpecifications.archHyprland());
        BuildSnapshot before = store.get(buildId);

        store.appendLog(buildId, "later");
        store.addArtifact(buildId, new Artifact(ArtifactType.DOCKER_IMAGE_REF, "image", "registry/image:1", null));

        assertTrue(before.logs().isEmpty());
        assertTrue(before.artifacts().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> before.logs().add(null));
    }

    @Test
    void terminalStatusSetsCompletionAndClearsStage() {
        String buildId = store.create(BuildSpecifications.archHyprland());
        store.setStatus(buildId, BuildStatus.IN_PROGRESS);
        store.setCurrentStage(buildId, "iso-generation");
        store.setStatus(buildId, BuildStatus.SUCCESS);

        BuildSnapshot snapshot = store.get(buildId);
        assertEquals(BuildStatus.SUCCESS, snapshot.status());
        assertEquals(NOW, snapshot.completedAt());
        assertNull(snapshot.currentStage());
    }

    @Test
    void statusNeverMovesBackwards() {
        String buildId = store.create(BuildSpecifications.archHyprland());
        store.setStatus(buildId, BuildStatus.IN_PROGRESS);
        store.setStatus(buildId, BuildStatus.FAILURE);

        assertThrows(IllegalStateException.class, () -> store.setStatus(buildId, BuildStatus.IN_PROGRESS));
        assertThrows(IllegalStateException.class, () -> store.setStatus(buildId, BuildStatus.SUCCESS));
        assertEquals(BuildStatus.FAILURE, store.get(buildId).status());
    }

    @Test
    void pendingBuildCannotSkipToSuccess() {
        String buildId = store.create(BuildSpecifications.archHyprland());

        assertThrows(IllegalStateException.class, () -> store.setStatus(buildId, BuildStatus.SUCCESS));
    }

    @Test
    void unknownBuildIsReported() {
        assertTrue(store.find("missing").isEmpty());
        assertThrows(BuildNotFoundException.class, () -> store.get("missing"));
        assertThrows(BuildNotFoundException.class, () -> store.appendLog("missing", "line"));
    }

    @Test
    void removedBuildIsGone() {
        String buildId = store.create(BuildSpecifications.archHyprland());

        assertTrue(store.remove(buildId));
        assertFalse(store.remove(buildId));
        assertTrue(store.find(buildId).isEmpty());
    }
}
