package fr.imt.distroforge.distroforge.exception;

/**
 * Exception thrown by a pipeline stage that cannot complete its unit of work.
 */
public class StageFailureException extends DistroForgeException {

    private static final String ERROR_CODE = "STAGE_ERR";

    public StageFailureException(String message) {
        super(ERROR_CODE, message);
    }

    public StageFailureException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
