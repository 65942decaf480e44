package com.memeinsight.common.exception;

import java.util.List;

/**
 * Configuration rejected before it reaches the engine. Lists every violated
 * field so an operator can fix them in one pass.
 */
public class ConfigValidationException extends InsightException {
    private final List<String> violations;

    public ConfigValidationException(List<String> violations) {
        super("config", "invalid configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
