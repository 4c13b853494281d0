package io.tradeflow.core.execution;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Outcome of a completed program run.
///
/// @param trace events in emission order, immutable
/// @param stepResults step id to last recorded result, in first-recorded order
/// @param variables final variable bindings, in first-bound order
public record ExecutionResult(
        List<TraceEvent> trace,
        Map<Integer, StepResult> stepResults,
        Map<String, String> variables) {

    public ExecutionResult {
        trace = List.copyOf(trace);
        stepResults = stepResults != null ? stepResults : Map.of();
        variables = variables != null ? variables : Map.of();
    }

    /// Returns the trace rendered as lines.
    public List<String> traceLines() {
        return trace.stream().map(TraceEvent::describe).toList();
    }

    public Optional<StepResult> stepResult(int stepId) {
        return Optional.ofNullable(stepResults.get(stepId));
    }
}
