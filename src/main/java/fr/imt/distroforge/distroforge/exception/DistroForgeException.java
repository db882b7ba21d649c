package fr.imt.distroforge.distroforge.exception;

/**
 * Base exception class for all DistroForge domain exceptions.
 * Carries an error code used in API error responses.
 */
public class DistroForgeException extends RuntimeException {

    private final String errorCode;

    public DistroForgeException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public DistroForgeException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
