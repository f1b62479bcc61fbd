package com.gattlink.config;

/**
 * Represents the lifecycle state of a {@link Component}.
 */
public enum ComponentState {

    /**
     * Initial state before initialization.
     * Component has been created but not yet checked against its environment.
     */
    UNINITIALIZED,

    /**
     * Component has been initialized.
     * Collaborators validated, ready to start.
     */
    INITIALIZED,

    /**
     * Component is active and accepting requests.
     */
    ACTIVE,

    /**
     * Component has been stopped.
     * All sessions released, no longer operational.
     */
    STOPPED;

    /**
     * Check if this state accepts requests.
     *
     * @return true if active
     */
    public boolean isOperational() {
        return this == ACTIVE;
    }

    /**
     * Check if transition to the target state is valid from this state.
     *
     * @param target the target state
     * @return true if the transition is valid
     */
    public boolean canTransitionTo(ComponentState target) {
        return switch (this) {
            case UNINITIALIZED -> target == INITIALIZED || target == STOPPED;
            case INITIALIZED -> target == ACTIVE || target == STOPPED;
            case ACTIVE -> target == STOPPED;
            case STOPPED -> false;
        };
    }
}
