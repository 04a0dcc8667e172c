package com.phasegate.core.attestation;

/**
 * Supplies the instructions currently in effect for a task's agent.
 */
@FunctionalInterface
public interface InstructionSource {

    /**
     * @return the effective instruction text; empty when the task has none
     * @throws Exception when the instructions cannot be read
     */
    String effectiveInstructions(String taskId) throws Exception;
}
