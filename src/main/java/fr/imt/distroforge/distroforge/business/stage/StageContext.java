package fr.imt.distroforge.distroforge.business.stage;

import fr.imt.distroforge.distroforge.business.model.Artifact;
import fr.imt.distroforge.distroforge.business.model.BuildSpecification;
import fr.imt.distroforge.distroforge.business.model.ResolvedPackages;
import fr.imt.distroforge.distroforge.business.model.RootfsHandle;
import fr.imt.distroforge.distroforge.business.model.StagedArtifact;
import fr.imt.distroforge.distroforge.business.port.BuildLogSink;
import fr.imt.distroforge.distroforge.exception.StageFailureException;
import lombok.Getter;
import lombok.Setter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * State shared by the stages of one build. Only touched by the thread running that build.
 */
@Getter
public class StageContext {

    private final String buildId;
    private final BuildSpecification spec;
    private final Path workspace;
    private final BuildLogSink logSink;

    @Setter
    private ResolvedPackages resolvedPackages;

    @Setter
    private RootfsHandle rootfs;

    private final List<StagedArtifact> stagedArtifacts = new ArrayList<>();
    private final List<Artifact> committedArtifacts = new ArrayList<>();

    public StageContext(String buildId, BuildSpecification spec, Path workspace, BuildLogSink logSink) {
        this.buildId = buildId;
        this.spec = spec;
        this.workspace = workspace;
        this.logSink = logSink;
    }

    public void log(String message) {
        logSink.log(message);
    }

    public void stage(StagedArtifact artifact) {
        stagedArtifacts.add(artifact);
    }

    public List<StagedArtifact> drainStaged() {
        List<StagedArtifact> drained = List.copyOf(stagedArtifacts);
        stagedArtifacts.clear();
        return drained;
    }

    public void discardStaged() {
        stagedArtifacts.clear();
    }

    public void recordCommitted(Artifact artifact) {
        committedArtifacts.add(artifact);
    }

    public ResolvedPackages requireResolvedPackages() {
        if (resolvedPackages == null) {
            throw new StageFailureException("Packages have not been resolved");
        }
        return resolvedPackages;
    }

    public RootfsHandle requireRootfs() {
        if (rootfs == null) {
            throw new StageFailureException("Root filesystem has not been bootstrapped");
        }
        return rootfs;
    }

    public Path overlayDir() {
        return requireRootfs().overlayDir();
    }
}
