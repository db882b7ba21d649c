package fr.imt.distroforge.distroforge.exception;

/**
 * Exception thrown when a requested build is unknown.
 */
public class BuildNotFoundException extends DistroForgeException {

    private static final String ERROR_CODE = "NOT_FOUND";

    public BuildNotFoundException(String buildId) {
        super(ERROR_CODE, "Build not found: " + buildId);
    }
}
