package com.mapobserver.core.rule;

import java.util.List;

/**
 * Thrown when a rule configuration fails validation.
 *
 * <p>
 * Carries every violation message found, not just the first.
 * </p>
 */
public class InvalidRuleConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<String> validationErrors;

    /**
     * @param validationErrors the violation messages; must not be {@code null}
     */
    public InvalidRuleConfigurationException(List<String> validationErrors) {
        super("Rule configuration validation failed:\n  - " + String.join("\n  - ", validationErrors));
        this.validationErrors = List.copyOf(validationErrors);
    }

    /**
     * @return unmodifiable list of violation messages
     */
    public List<String> getValidationErrors() {
        return validationErrors;
    }
}
