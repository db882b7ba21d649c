package fr.imt.distroforge.distroforge.infrastructure.persistence;

import fr.imt.distroforge.distroforge.business.model.Artifact;
import fr.imt.distroforge.distroforge.business.model.BuildSnapshot;
import fr.imt.distroforge.distroforge.business.model.BuildSpecification;
import fr.imt.distroforge.distroforge.business.model.BuildStatus;
import fr.imt.distroforge.distroforge.business.model.LogEntry;
import fr.imt.distroforge.distroforge.business.port.BuildRecordStore;
import fr.imt.distroforge.distroforge.exception.BuildNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

@Component
@Slf4j
public class InMemoryBuildRecordStore implements BuildRecordStore {

    private final ConcurrentMap<String, BuildRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryBuildRecordStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String create(BuildSpecification spec) {
        while (true) {
            String buildId = UUID.randomUUID().toString();
            if (records.putIfAbsent(buildId, new BuildRecord(buildId, spec, clock.instant())) == null) {
                log.debug("Created build record {}", buildId);
                return buildId;
            }
        }
    }

    @Override
    public Optional<BuildSnapshot> find(String buildId) {
        return Optional.ofNullable(records.get(buildId)).map(BuildRecord::snapshot);
    }

    @Override
    public List<BuildSnapshot> findAll() {
        return records.values().stream()
                .map(BuildRecord::snapshot)
                .sorted(Comparator.comparing(BuildSnapshot::createdAt))
                .toList();
    }

    @Override
    public void appendLog(String buildId, String message) {
        recordOf(buildId).appendLog(new LogEntry(clock.instant(), message));
    }

    @Override
    public void addArtifact(String buildId, Artifact artifact) {
        recordOf(buildId).addArtifact(artifact);
    }

    @Override
    public void setStatus(String buildId, BuildStatus status) {
        recordOf(buildId).transitionTo(status, clock.instant());
    }

    @Override
    public void setCurrentStage(String buildId, String stageName) {
        recordOf(buildId).setCurrentStage(stageName);
    }

    @Override
    public boolean remove(String buildId) {
        return records.remove(buildId) != null;
    }

    private BuildRecord recordOf(String buildId) {
        BuildRecord record = records.get(buildId);
        if (record == null) {
            throw new BuildNotFoundException(buildId);
        }
        return record;
    }
}
