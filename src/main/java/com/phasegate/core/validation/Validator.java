package com.phasegate.core.validation;

import com.phasegate.core.model.PhaseContext;

import java.util.Set;

/**
 * A pass/fail check for one phase.
 * <p>
 * Implementations must be deterministic: repeated calls with unchanged external state
 * return equal results. Overridden skips re-run validators retroactively and rely on this.
 */
@FunctionalInterface
public interface Validator {

    ValidationResult validate(PhaseContext context);

    /**
     * Context fields that must be present before {@link #validate} is invoked.
     */
    default Set<String> requiredContext() {
        return Set.of();
    }

    /**
     * Wraps a validator lambda with a set of required context fields.
     */
    static Validator requiring(Set<String> fields, Validator delegate) {
        Set<String> required = Set.copyOf(fields);
        return new Validator() {
            @Override
            public ValidationResult validate(PhaseContext context) {
                return delegate.validate(context);
            }

            @Override
            public Set<String> requiredContext() {
                return required;
            }
        };
    }
}
