package com.phasegate.core.model;

/**
 * Thrown when a closed cycle is asked to start, advance or close again.
 */
public class CycleClosedException extends PhasegateException {
    public CycleClosedException(String taskId) {
        super("Work cycle for task " + taskId + " is closed");
    }
}
