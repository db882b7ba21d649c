package fr.imt.distroforge.distroforge.business.model;

/**
 * Build lifecycle. Transitions only move forward and never leave a terminal status.
 */
public enum BuildStatus {
    PENDING,
    IN_PROGRESS,
    SUCCESS,
    FAILURE;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILURE;
    }

    public boolean canTransitionTo(BuildStatus next) {
        return switch (this) {
            // a build that could not be dispatched fails without ever running
            case PENDING -> next == IN_PROGRESS || next == FAILURE;
            case IN_PROGRESS -> next.isTerminal();
            case SUCCESS, FAILURE -> false;
        };
    }
}
