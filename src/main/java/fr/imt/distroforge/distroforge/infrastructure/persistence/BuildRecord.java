package fr.imt.distroforge.distroforge.infrastructure.persistence;

import fr.imt.distroforge.distroforge.business.model.Artifact;
import fr.imt.distroforge.distroforge.business.model.BuildSnapshot;
import fr.imt.distroforge.distroforge.business.model.BuildSpecification;
import fr.imt.distroforge.distroforge.business.model.BuildStatus;
import fr.imt.distroforge.distroforge.business.model.LogEntry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Mutable state of one build. Guarded by its own lock so that builds never contend with each other.
 */
class BuildRecord {

    private final String buildId;
    private final BuildSpecification spec;
    private final Instant createdAt;

    private final List<LogEntry> logs = new ArrayList<>();
    private final List<Artifact> artifacts = new ArrayList<>();
    private BuildStatus status = BuildStatus.PENDING;
    private String currentStage;
    private Instant completedAt;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    BuildRecord(String buildId, BuildSpecification spec, Instant createdAt) {
        this.buildId = buildId;
        this.spec = spec;
        this.createdAt = createdAt;
    }

    void appendLog(LogEntry entry) {
        lock.writeLock().lock();
        try {
            logs.add(entry);
        } finally {
            lock.writeLock().unlock();
        }
    }

    void addArtifact(Artifact artifact) {
        lock.writeLock().lock();
        try {
            artifacts.add(artifact);
        } finally {
            lock.writeLock().unlock();
        }
    }

    void transitionTo(BuildStatus next, Instant now) {
        lock.writeLock().lock();
        try {
            if (!status.canTransitionTo(next)) {
                throw new IllegalStateException(
                        "Build " + buildId + " cannot move from " + status + " to " + next);
            }
            status = next;
            if (next.isTerminal()) {
                completedAt = now;
                currentStage = null;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    void setCurrentStage(String stageName) {
        lock.writeLock().lock();
        try {
            currentStage = stageName;
        } finally {
            lock.writeLock().unlock();
        }
    }

    BuildSnapshot snapshot() {
        lock.readLock().lock();
        try {
            return new BuildSnapshot(
                    buildId,
                    spec,
                    status,
                    currentStage,
                    List.copyOf(logs),
                    List.copyOf(artifacts),
                    createdAt,
                    completedAt);
        } finally {
            lock.readLock().unlock();
        }
    }
}
