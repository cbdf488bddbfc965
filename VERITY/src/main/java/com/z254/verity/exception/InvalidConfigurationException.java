package com.z254.verity.exception;

import java.util.List;

/**
 * Effective settings are unusable; the request is rejected before any fetch.
 */
public class InvalidConfigurationException extends VerityException {

    private final List<String> violations;

    public InvalidConfigurationException(List<String> violations) {
        super("Invalid analysis configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
