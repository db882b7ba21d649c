package fr.imt.distroforge.distroforge.exception;

import java.util.List;

/**
 * Exception thrown when a submitted specification is malformed or incomplete.
 * No build record exists for a rejected specification.
 */
public class InvalidBuildSpecificationException extends DistroForgeException {

    private static final String ERROR_CODE = "VALIDATION_ERR";

    private final List<String> violations;

    public InvalidBuildSpecificationException(List<String> violations) {
        super(ERROR_CODE, "Invalid build specification: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
