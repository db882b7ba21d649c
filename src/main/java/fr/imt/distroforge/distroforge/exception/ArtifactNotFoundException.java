package fr.imt.distroforge.distroforge.exception;

/**
 * Exception thrown when a build has no artifact of the requested kind.
 */
public class ArtifactNotFoundException extends DistroForgeException {

    private static final String ERROR_CODE = "NOT_FOUND";

    public ArtifactNotFoundException(String message) {
        super(ERROR_CODE, message);
    }
}
