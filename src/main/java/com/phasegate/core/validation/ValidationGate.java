package com.phasegate.core.validation;

import com.phasegate.core.model.InvalidPhaseContextException;
import com.phasegate.core.model.InvalidPhaseException;
import com.phasegate.core.model.Phase;
import com.phasegate.core.model.PhaseContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of per-phase validators.
 * <p>
 * A phase with no registered validator fails closed, so every phase must be
 * explicitly wired before a task can leave it.
 */
public class ValidationGate implements ValidationStrategy {

    private static final Logger log = LoggerFactory.getLogger(ValidationGate.class);

    private static final Validator FAIL_CLOSED = context ->
            ValidationResult.fail("no validator registered for " + context.phase());

    private final Map<Phase, Validator> validators = new ConcurrentHashMap<>();

    @Override
    public void registerValidator(Phase phase, Validator validator) {
        Objects.requireNonNull(validator, "validator");
        if (phase == null || phase.isTerminal()) {
            throw new InvalidPhaseException("Cannot register a validator for " + phase);
        }
        Validator previous = validators.put(phase, validator);
        if (previous != null) {
            log.info("Replaced validator for {}", phase);
        } else {
            log.debug("Registered validator for {}", phase);
        }
    }

    public boolean hasValidator(Phase phase) {
        return validators.containsKey(phase);
    }

    @Override
    public void requireContext(PhaseContext context) {
        var missing = context.missing(validatorFor(context.phase()).requiredContext());
        if (!missing.isEmpty()) {
            throw new InvalidPhaseContextException(context.phase(), missing);
        }
    }

    @Override
    public ValidationResult validate(PhaseContext context) {
        Validator validator = validatorFor(context.phase());
        ValidationResult result = validator.validate(context);
        if (result == null) {
            return ValidationResult.fail("validator for " + context.phase() + " returned no result");
        }
        if (result.passed()) {
            log.debug("Validation passed for task {} at {}", context.taskId(), context.phase());
        } else {
            log.info("Validation failed for task {} at {}: {}", context.taskId(), context.phase(), result.errors());
        }
        return result;
    }

    private Validator validatorFor(Phase phase) {
        return validators.getOrDefault(phase, FAIL_CLOSED);
    }
}
