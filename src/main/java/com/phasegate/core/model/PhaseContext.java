package com.phasegate.core.model;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * The facts a phase validator sees. Built by the enforcer and checked against the
 * validator's required fields before the validator runs.
 */
public record PhaseContext(
    String taskId,
    Phase phase,
    Map<String, String> fields
) {

    public PhaseContext {
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }

    public static PhaseContext of(String taskId, Phase phase) {
        return new PhaseContext(taskId, phase, Map.of());
    }

    public Optional<String> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    /**
     * Names from {@code required} that are absent or blank in this context.
     */
    public Set<String> missing(Set<String> required) {
        var missing = new TreeSet<String>();
        for (String name : required) {
            String value = fields.get(name);
            if (value == null || value.isBlank()) {
                missing.add(name);
            }
        }
        return missing;
    }

    public PhaseContext forPhase(Phase other) {
        return new PhaseContext(taskId, other, fields);
    }
}
