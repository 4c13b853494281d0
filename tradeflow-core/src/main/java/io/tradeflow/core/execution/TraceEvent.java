package io.tradeflow.core.execution;

import io.tradeflow.core.ast.DeclarationKind;
import java.util.List;
import java.util.stream.Collectors;

/// Events emitted while a program runs.
///
/// Every event renders itself as one human-readable trace line through
/// {@link #describe()}. Events inside steps carry a `depth` (0 for a
/// workflow's own steps, +1 per enclosing conditional) so presentation layers
/// can indent nested branches.
///
/// ### Event Flow
/// ```
/// VariableBound* → (WorkflowEntered → (StepEntered →
///     CommandDispatched → CommandOutput? → CommandCompleted
///   | BranchEvaluated → nested steps ...)*)*
/// ```
///
/// @see ExecutionListener for consumers
/// @see ExecutionTrace for the collecting listener
public sealed interface TraceEvent {

    /// Returns the trace line for this event, never null.
    String describe();

    /// A top-level declaration bound a value.
    record VariableBound(DeclarationKind kind, String name, String value)
            implements TraceEvent {
        @Override
        public String describe() {
            return "Variable '" + name + "' = '" + value + "'";
        }
    }

    /// Execution moved into a workflow.
    record WorkflowEntered(String name) implements TraceEvent {
        @Override
        public String describe() {
            return "Executing workflow: " + name;
        }
    }

    /// A step is about to run.
    record StepEntered(int stepId, int depth) implements TraceEvent {
        @Override
        public String describe() {
            return "Step " + stepId + ":";
        }
    }

    /// A command's arguments were evaluated and it is being dispatched.
    record CommandDispatched(int stepId, String command, List<String> arguments, int depth)
            implements TraceEvent {

        public CommandDispatched {
            arguments = List.copyOf(arguments);
        }

        @Override
        public String describe() {
            return "Dispatch "
                    + command
                    + arguments.stream()
                            .map(arg -> "\"" + arg + "\"")
                            .collect(Collectors.joining(", ", "(", ")"));
        }
    }

    /// A line written by a command handler.
    record CommandOutput(int stepId, String command, String line, int depth)
            implements TraceEvent {
        @Override
        public String describe() {
            return line;
        }
    }

    /// A command finished and its result was recorded.
    record CommandCompleted(int stepId, String command, StepResult result, int depth)
            implements TraceEvent {
        @Override
        public String describe() {
            return (result.success() ? "OK " : "FAILED ")
                    + result.status()
                    + " "
                    + result.message();
        }
    }

    /// A conditional was evaluated.
    ///
    /// @param branch which block runs as a result
    record BranchEvaluated(int stepId, boolean condition, Branch branch, int depth)
            implements TraceEvent {
        @Override
        public String describe() {
            return switch (branch) {
                case IF -> "Condition is true, executing if block";
                case ELSE -> "Condition is false, executing else block";
                case NONE -> "Condition is false, no else block";
            };
        }
    }

    /// Block chosen by a conditional.
    enum Branch {
        IF,
        ELSE,
        NONE
    }
}
