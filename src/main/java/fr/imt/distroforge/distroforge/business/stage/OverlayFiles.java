package fr.imt.distroforge.distroforge.business.stage;

import fr.imt.distroforge.distroforge.exception.StageFailureException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes files below an overlay directory. Paths never leave the overlay.
 */
final class OverlayFiles {

    private OverlayFiles() {
    }

    static Path write(Path overlay, String relativePath, String content) throws IOException {
        Path root = overlay.toAbsolutePath().normalize();
        Path target = root.resolve(relativePath).normalize();
        if (!target.startsWith(root) || target.equals(root)) {
            throw new StageFailureException("Refusing to write outside of the overlay: " + relativePath);
        }
        Files.createDirectories(target.getParent());
        return Files.writeString(target, content, StandardCharsets.UTF_8);
    }
}
