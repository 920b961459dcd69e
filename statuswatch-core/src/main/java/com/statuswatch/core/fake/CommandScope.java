package com.statuswatch.core.fake;

/**
 * Whether a simulator command runs against a model or against the controller.
 */
public enum CommandScope {
    /** Needs a model; fails when none is given. */
    MODEL,
    /** Runs on the controller; a given model is ignored. */
    CONTROLLER
}
