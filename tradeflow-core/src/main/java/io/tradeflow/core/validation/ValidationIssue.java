package io.tradeflow.core.validation;

import java.util.Objects;

/// One finding of {@link ProgramValidator}.
///
/// @param severity how serious the finding is, not null
/// @param message human-readable description, not null
public record ValidationIssue(Severity severity, String message) {

    public ValidationIssue {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static ValidationIssue warning(String message) {
        return new ValidationIssue(Severity.WARNING, message);
    }

    public static ValidationIssue info(String message) {
        return new ValidationIssue(Severity.INFO, message);
    }

    /// Severity levels. Neither level stops a program from running.
    public enum Severity {
        INFO,
        WARNING
    }

    @Override
    public String toString() {
        return severity + ": " + message;
    }
}
