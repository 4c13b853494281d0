package io.tradeflow.core.ast;

import java.util.List;
import java.util.Objects;

/// Named, ordered sequence of steps.
///
/// @param name workflow name as written between quotes, not null
/// @param steps steps in declaration order, copied to an immutable list
public record Workflow(String name, List<Step> steps) {

    public Workflow {
        Objects.requireNonNull(name, "name must not be null");
        steps = steps != null ? List.copyOf(steps) : List.of();
    }
}
