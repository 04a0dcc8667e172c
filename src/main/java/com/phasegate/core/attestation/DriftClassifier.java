package com.phasegate.core.attestation;

/**
 * Decides the severity of a difference between baseline and current instructions.
 * Only called when the two texts hash differently.
 */
@FunctionalInterface
public interface DriftClassifier {

    Classification classify(String baseline, String current);

    record Classification(DriftSeverity severity, String details) {}
}
