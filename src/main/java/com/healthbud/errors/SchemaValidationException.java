package com.healthbud.errors;

import java.util.List;

/**
 * A normalized assessment broke the output contract.
 */
public class SchemaValidationException extends RecoverableAssessmentException {

    private final List<String> violations;

    public SchemaValidationException(List<String> violations) {
        super("Assessment failed validation: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
