package com.phasegate.core.logging;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Utility for managing phase enforcement MDC keys for structured logging.
 * <p>
 * Entry points take a {@link #snapshot()} before setting keys and {@link #restore(Map)} it when
 * they return, so a caller's own MDC survives a nested call.
 */
public final class MdcContext {

    public static final String TASK_ID = "taskId";
    public static final String PHASE = "phase";

    private MdcContext() {}

    public static void setTask(String taskId) {
        MDC.put(TASK_ID, taskId);
    }

    public static void setPhase(String taskId, String phase) {
        MDC.put(TASK_ID, taskId);
        MDC.put(PHASE, phase);
    }

    /** Copy of the calling thread's MDC, never null. */
    public static Map<String, String> snapshot() {
        Map<String, String> copy = MDC.getCopyOfContextMap();
        return copy != null ? copy : Map.of();
    }

    public static void restore(Map<String, String> previous) {
        if (previous == null || previous.isEmpty()) {
            MDC.clear();
        } else {
            MDC.setContextMap(previous);
        }
    }

    /**
     * Wraps a task so it runs with the submitting thread's MDC, leaving the worker's own
     * MDC as it found it.
     */
    public static <T> Callable<T> propagate(Callable<T> task) {
        Map<String, String> submitter = snapshot();
        return () -> {
            Map<String, String> worker = snapshot();
            restore(submitter);
            try {
                return task.call();
            } finally {
                restore(worker);
            }
        };
    }
}
