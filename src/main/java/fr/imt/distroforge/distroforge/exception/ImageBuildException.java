package fr.imt.distroforge.distroforge.exception;

/**
 * Exception thrown when Docker image build, push or save operations fail.
 */
public class ImageBuildException extends DistroForgeException {

    private static final String ERROR_CODE = "BUILD_ERR";

    public ImageBuildException(String imageName, String operation, Throwable cause) {
        super(ERROR_CODE, "Failed to " + operation + " image: " + imageName, cause);
    }

    public ImageBuildException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
