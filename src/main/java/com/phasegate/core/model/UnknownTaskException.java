package com.phasegate.core.model;

/**
 * Thrown when an operation names a task whose cycle was never started.
 */
public class UnknownTaskException extends PhasegateException {

    private final String taskId;

    public UnknownTaskException(String taskId) {
        super("Task " + taskId + " is not in a work cycle");
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}
