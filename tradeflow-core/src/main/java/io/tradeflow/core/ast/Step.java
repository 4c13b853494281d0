package io.tradeflow.core.ast;

import java.util.Objects;

/// A numbered unit of work inside a workflow or branch.
///
/// Ids are declared in source and share one program-wide namespace at run time;
/// nothing prevents two steps from declaring the same id.
///
/// @param id declared step id, non-negative
/// @param content command or conditional, not null
public record Step(int id, StepContent content) {

    public Step {
        Objects.requireNonNull(content, "content must not be null");
        if (id < 0) {
            throw new IllegalArgumentException("step id must not be negative: " + id);
        }
    }
}
