package io.tradeflow.core.ast;

import java.util.List;

/// Root of a parsed TradeFlow source.
///
/// Declaration order is execution order: all variables first, then every
/// workflow.
///
/// @param variables top-level declarations in source order, copied to an immutable list
/// @param workflows workflows in source order, copied to an immutable list
public record Program(List<VariableDeclaration> variables, List<Workflow> workflows) {

    public Program {
        variables = variables != null ? List.copyOf(variables) : List.of();
        workflows = workflows != null ? List.copyOf(workflows) : List.of();
    }

    /// Returns the number of steps across all workflows, nested branches included.
    public int stepCount() {
        int count = 0;
        for (Workflow workflow : workflows) {
            count += countSteps(workflow.steps());
        }
        return count;
    }

    private static int countSteps(List<Step> steps) {
        int count = 0;
        for (Step step : steps) {
            count++;
            if (step.content() instanceof StepContent.Conditional conditional) {
                count += countSteps(conditional.ifSteps());
                count += conditional.elseBranch().map(Program::countSteps).orElse(0);
            }
        }
        return count;
    }
}
