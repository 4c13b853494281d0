package io.tradeflow.core.execution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Step id to {@link StepResult} table for one program run.
///
/// Ids share one namespace across all workflows and branches. Recording a
/// result for an id that already has one replaces it.
///
/// @implNote **Not thread-safe**. Owned by a single {@link ProgramExecutor}.
public final class StepResultTable {

    private final Map<Integer, StepResult> results = new LinkedHashMap<>();

    /// Stores `result` under `stepId`, overwriting any earlier result.
    ///
    /// @return the replaced result, or empty if the id was new
    public Optional<StepResult> record(int stepId, StepResult result) {
        return Optional.ofNullable(results.put(stepId, Objects.requireNonNull(result)));
    }

    public Optional<StepResult> get(int stepId) {
        return Optional.ofNullable(results.get(stepId));
    }

    public boolean contains(int stepId) {
        return results.containsKey(stepId);
    }

    public int size() {
        return results.size();
    }

    /// Returns an unmodifiable copy in first-recorded order.
    public Map<Integer, StepResult> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }
}
