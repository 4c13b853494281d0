package io.tradeflow.cli.execution;

import io.tradeflow.cli.ui.AnsiStyles;
import io.tradeflow.core.execution.ExecutionListener;
import io.tradeflow.core.execution.TraceEvent;
import java.io.PrintStream;
import java.util.Objects;

/// Execution listener that prints the trace of a run to the terminal as it happens.
///
/// Each event is printed on its own line, indented two spaces per nesting level
/// of the step that produced it. Completed commands are colored by outcome and
/// branch decisions are dimmed.
///
/// ### Output Format
/// ```
/// Variable 'a' = 'x'
/// Executing workflow: W
///   Step 1:
///     → Dispatch print("xy")
///     Print: xy
///     OK 200 Print executed successfully
/// ```
///
/// @implNote **Not thread-safe**. One printer per run.
/// @see io.tradeflow.core.execution.ExecutionListener
public class TracePrinter implements ExecutionListener {

    private final PrintStream out;
    private final AnsiStyles styles;

    /// @param out output stream for printing (typically System.out), not null
    /// @param useColor whether to apply ANSI color codes
    public TracePrinter(PrintStream out, boolean useColor) {
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.styles = AnsiStyles.of(useColor);
    }

    @Override
    public void onEvent(TraceEvent event) {
        if (event instanceof TraceEvent.VariableBound) {
            out.println(styles.gray(event.describe()));
        } else if (event instanceof TraceEvent.WorkflowEntered) {
            out.println(styles.bold(event.describe()));
        } else if (event instanceof TraceEvent.StepEntered step) {
            out.println(indent(step.depth() + 1) + styles.accent(event.describe()));
        } else if (event instanceof TraceEvent.CommandDispatched dispatched) {
            out.println(indent(dispatched.depth() + 2) + styles.arrow() + " " + event.describe());
        } else if (event instanceof TraceEvent.CommandOutput output) {
            out.println(indent(output.depth() + 2) + event.describe());
        } else if (event instanceof TraceEvent.CommandCompleted completed) {
            out.println(
                    indent(completed.depth() + 2)
                            + styles.successOrError(event.describe(), completed.result().success()));
        } else if (event instanceof TraceEvent.BranchEvaluated branch) {
            out.println(indent(branch.depth() + 2) + styles.gray(event.describe()));
        }
    }

    private static String indent(int level) {
        return "  ".repeat(level);
    }
}
