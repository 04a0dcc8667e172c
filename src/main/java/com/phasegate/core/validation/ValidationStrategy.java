package com.phasegate.core.validation;

import com.phasegate.core.model.Phase;
import com.phasegate.core.model.PhaseContext;

/**
 * Seam through which the enforcer validates a phase.
 */
public interface ValidationStrategy {

    ValidationResult validate(PhaseContext context);

    /**
     * Checks the context against the phase validator's required fields.
     *
     * @throws com.phasegate.core.model.InvalidPhaseContextException when a field is missing
     */
    void requireContext(PhaseContext context);

    void registerValidator(Phase phase, Validator validator);
}
