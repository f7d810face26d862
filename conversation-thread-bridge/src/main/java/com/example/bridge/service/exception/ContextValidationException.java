package com.example.bridge.service.exception;

import java.util.List;
import org.springframework.http.HttpStatus;

/**
 * The inbound activity cannot be turned into a complete conversation identity. Raised before any
 * mapping strategy runs.
 */
public class ContextValidationException extends ServiceException {

    private final List<String> violations;

    public ContextValidationException(List<String> violations) {
        super(HttpStatus.BAD_REQUEST, "Invalid conversation context: " + String.join("; ", violations), "invalid_context");
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
