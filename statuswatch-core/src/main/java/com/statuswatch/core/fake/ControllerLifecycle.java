package com.statuswatch.core.fake;

/**
 * Lifecycle state of a simulated controller.
 */
public enum ControllerLifecycle {
    NOT_BOOTSTRAPPED("not-bootstrapped"),
    CREATED("created"),
    BOOTSTRAPPED("bootstrapped"),
    REGISTERED("registered"),
    MODEL_DESTROYED("model-destroyed"),
    CONTROLLER_DESTROYED("controller-destroyed"),
    CONTROLLER_KILLED("controller-killed");

    private final String label;

    ControllerLifecycle(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Returns whether {@code destroy-controller} may run from this state.
     */
    public boolean isDestroyable() {
        return this == BOOTSTRAPPED || this == CREATED;
    }
}
