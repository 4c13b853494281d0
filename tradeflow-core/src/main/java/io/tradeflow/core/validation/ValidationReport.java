package io.tradeflow.core.validation;

import java.util.List;

/// Findings of a {@link ProgramValidator} run, in discovery order.
///
/// @param issues all findings, immutable
public record ValidationReport(List<ValidationIssue> issues) {

    public ValidationReport {
        issues = issues != null ? List.copyOf(issues) : List.of();
    }

    /// Returns only the warnings.
    public List<ValidationIssue> warnings() {
        return issues.stream()
                .filter(issue -> issue.severity() == ValidationIssue.Severity.WARNING)
                .toList();
    }

    public boolean hasWarnings() {
        return !warnings().isEmpty();
    }

    public boolean isClean() {
        return issues.isEmpty();
    }
}
