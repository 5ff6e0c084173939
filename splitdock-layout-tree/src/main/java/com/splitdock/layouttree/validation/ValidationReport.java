package com.splitdock.layouttree.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of validating a layout tree. Errors make the tree invalid; warnings are advisory.
 */
public final class ValidationReport {

    private final List<String> errors;
    private final List<String> warnings;

    ValidationReport(List<String> errors, List<String> warnings) {
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    @Override
    public String toString() {
        return "ValidationReport{valid=" + isValid() + ", errors=" + errors + ", warnings=" + warnings + "}";
    }
}
