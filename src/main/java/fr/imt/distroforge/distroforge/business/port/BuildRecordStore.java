package fr.imt.distroforge.distroforge.business.port;

import fr.imt.distroforge.distroforge.business.model.Artifact;
import fr.imt.distroforge.distroforge.business.model.BuildSnapshot;
import fr.imt.distroforge.distroforge.business.model.BuildSpecification;
import fr.imt.distroforge.distroforge.business.model.BuildStatus;
import fr.imt.distroforge.distroforge.exception.BuildNotFoundException;

import java.util.List;
import java.util.Optional;

/**
 * Authoritative table of build state.
 * Mutations on one build never block reads or writes on another build.
 */
public interface BuildRecordStore {

    /**
     * Inserts a PENDING record under a freshly generated identifier.
     */
    String create(BuildSpecification spec);

    Optional<BuildSnapshot> find(String buildId);

    default BuildSnapshot get(String buildId) {
        return find(buildId).orElseThrow(() -> new BuildNotFoundException(buildId));
    }

    List<BuildSnapshot> findAll();

    void appendLog(String buildId, String message);

    void addArtifact(String buildId, Artifact artifact);

    /**
     * @throws IllegalStateException if the transition would move the status backwards
     */
    void setStatus(String buildId, BuildStatus status);

    void setCurrentStage(String buildId, String stageName);

    boolean remove(String buildId);
}
