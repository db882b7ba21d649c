package fr.imt.distroforge.distroforge.business.stage;

import fr.imt.distroforge.distroforge.business.model.Artifact;
import fr.imt.distroforge.distroforge.business.model.ArtifactType;
import fr.imt.distroforge.distroforge.business.model.StagedArtifact;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Verifies the stored artifacts and publishes their SHA-256 digests as a SHA256SUMS file.
 */
@Component
public class ArtifactFinalizationStage implements PipelineStage {

    static final String CHECKSUMS_FILE = "SHA256SUMS";

    @Override
    public StageType type() {
        return StageType.ARTIFACT_FINALIZATION;
    }

    @Override
    public StageResult run(StageContext context) throws IOException, NoSuchAlgorithmException {
        List<String> lines = new ArrayList<>();
        StringBuilder sums = new StringBuilder();

        for (Artifact artifact : context.getCommittedArtifacts()) {
            if (!artifact.isStoredFile()) {
                lines.add("Registry artifact " + artifact.url() + " not checksummed");
                continue;
            }
            if (!Files.isRegularFile(artifact.location())) {
                return StageResult.failure("Artifact file missing: " + artifact.fileName());
            }
            String digest = sha256(artifact.location());
            sums.append(digest).append("  ").append(artifact.fileName()).append('\n');
            lines.add("sha256 " + digest + "  " + artifact.fileName());
        }

        Path checksums = Files.writeString(context.getWorkspace().resolve(CHECKSUMS_FILE), sums.toString());
        context.stage(StagedArtifact.file(ArtifactType.CHECKSUMS, checksums));
        lines.add("Artifacts verified");
        return StageResult.success(lines);
    }

    static String sha256(Path file) throws IOException, NoSuchAlgorithmException {
        MessageDigest digest = MessageDigest.getInstance("SHA-256");
        try (InputStream in = new DigestInputStream(Files.newInputStream(file), digest)) {
            in.transferTo(OutputStream.nullOutputStream());
        }
        return HexFormat.of().formatHex(digest.digest());
    }
}
