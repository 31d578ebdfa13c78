package com.flowledger.exception;

import java.util.List;

/**
 * Thrown when a workflow definition is rejected at save time.
 * Carries every violation found, not only the first one.
 */
public class DefinitionValidationException extends RuntimeException {

    private final List<String> violations;

    public DefinitionValidationException(List<String> violations) {
        super("Invalid workflow definition: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
