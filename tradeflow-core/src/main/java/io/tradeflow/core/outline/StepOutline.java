package io.tradeflow.core.outline;

import io.tradeflow.core.ast.Program;
import io.tradeflow.core.ast.Step;
import io.tradeflow.core.ast.StepContent;
import io.tradeflow.core.ast.Workflow;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Renders a program as plain-language step descriptions.
///
/// One line per step in document order, e.g. `Step 3: Generate AI content`.
/// Steps inside a conditional are indented two spaces per nesting level and
/// else-branch steps are preceded by an `Otherwise:` line. Each workflow is
/// introduced by a `Workflow "<name>"` line.
public final class StepOutline {

    private static final Map<String, String> DESCRIPTIONS =
            Map.ofEntries(
                    Map.entry("input", "Collect user input"),
                    Map.entry("generate", "Generate AI content"),
                    Map.entry("output", "Export results"),
                    Map.entry("fetch", "Fetch data from URL"),
                    Map.entry("transform", "Transform data"),
                    Map.entry("validate", "Validate input"),
                    Map.entry("print", "Print a message"),
                    Map.entry("log", "Write a log entry"),
                    Map.entry("notify", "Send a notification"),
                    Map.entry("send_email", "Send an email"));

    private StepOutline() {}

    /// Describes every step of every workflow.
    ///
    /// @param program the program, not null
    /// @return outline lines, never null
    public static List<String> describe(Program program) {
        List<String> lines = new ArrayList<>();
        for (Workflow workflow : program.workflows()) {
            lines.add("Workflow \"" + workflow.name() + "\"");
            describeSteps(workflow.steps(), 1, lines);
        }
        return List.copyOf(lines);
    }

    /// Describes a single step without its nested steps.
    ///
    /// @param step the step, not null
    /// @return description such as `Step 2: Conditional logic`, never null
    public static String describe(Step step) {
        if (step.content() instanceof StepContent.Command command) {
            String description = DESCRIPTIONS.get(command.name());
            return description != null
                    ? "Step " + step.id() + ": " + description
                    : "Step " + step.id() + ": Execute " + command.name();
        }
        return "Step " + step.id() + ": Conditional logic";
    }

    private static void describeSteps(List<Step> steps, int depth, List<String> lines) {
        String indent = "  ".repeat(depth);
        for (Step step : steps) {
            lines.add(indent + describe(step));
            if (step.content() instanceof StepContent.Conditional conditional) {
                describeSteps(conditional.ifSteps(), depth + 1, lines);
                if (conditional.elseBranch().isPresent()) {
                    lines.add(indent + "Otherwise:");
                    describeSteps(conditional.elseBranch().get(), depth + 1, lines);
                }
            }
        }
    }
}
