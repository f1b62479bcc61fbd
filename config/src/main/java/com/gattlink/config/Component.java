package com.gattlink.config;

/**
 * Lifecycle contract shared by the long-lived parts of the client.
 *
 * <p>Lifecycle transitions:</p>
 * <pre>
 * UNINITIALIZED ──► INITIALIZED ──► ACTIVE
 *        │               │             │
 *        └───────────────┴─────────────┴──► STOPPED
 * </pre>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Component client = ...;
 * client.initialize();   // Validate adapter and collaborators
 * client.start();        // Begin accepting requests
 * client.stop();         // Release every session
 * }</pre>
 */
public interface Component {

    /**
     * Initialize the component.
     * Validate collaborators and configuration.
     * Transitions from UNINITIALIZED to INITIALIZED.
     *
     * @throws Exception if initialization fails
     */
    void initialize() throws Exception;

    /**
     * Start accepting requests.
     * Transitions from INITIALIZED to ACTIVE.
     *
     * @throws Exception if start fails
     */
    void start() throws Exception;

    /**
     * Stop the component and release all resources.
     * Transitions to STOPPED from any state.
     */
    void stop();

    /**
     * Get the component name.
     *
     * @return the component name
     */
    String getName();

    /**
     * Get the current component state.
     *
     * @return the current state
     */
    ComponentState getState();

    /**
     * Check if the component is accepting requests.
     *
     * @return true if active
     */
    default boolean isActive() {
        return getState() == ComponentState.ACTIVE;
    }

    /**
     * Check if the component has passed initialization and is not stopped.
     *
     * @return true if initialized or active
     */
    default boolean isInitialized() {
        ComponentState state = getState();
        return state == ComponentState.INITIALIZED || state == ComponentState.ACTIVE;
    }
}
