package io.tradeflow.core.validation;

import io.tradeflow.core.ast.Expression;
import io.tradeflow.core.ast.Program;
import io.tradeflow.core.ast.Step;
import io.tradeflow.core.ast.StepContent;
import io.tradeflow.core.ast.VariableDeclaration;
import io.tradeflow.core.ast.Workflow;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/// Static checks over a parsed program.
///
/// Reports constructs that parse but are likely to misbehave at run time.
/// Findings are advisory: the executor's behavior is the same whether or not
/// the validator ran, and step id collisions in particular are still allowed
/// to overwrite each other.
///
/// ### Checks
/// - workflow without steps (WARNING)
/// - step id declared more than once anywhere in the program (WARNING)
/// - command name not known to the registry (WARNING)
/// - `step N` reference where no command step with id N appears earlier in
///   document order (WARNING)
/// - identifier not bound by a top-level declaration; inside a declaration,
///   not bound by an earlier one (WARNING)
/// - variable declared more than once (INFO)
///
/// "Earlier in document order" ignores which branch of a conditional runs, so a
/// reference from an else-branch to an if-branch step is not flagged.
///
/// @implNote Thread-safe. Holds only the immutable set of known command names.
public final class ProgramValidator {

    private final Set<String> knownCommands;

    /// @param knownCommands command names that are registered, not null
    public ProgramValidator(Set<String> knownCommands) {
        this.knownCommands = Set.copyOf(Objects.requireNonNull(knownCommands));
    }

    /// Validates a program.
    ///
    /// @param program the program, not null
    /// @return the findings, never null
    public ValidationReport validate(Program program) {
        return new Pass(program).run();
    }

    /// State of a single validation run.
    private final class Pass {
        private final Program program;
        private final List<ValidationIssue> issues = new ArrayList<>();
        private final Set<String> boundVariables = new HashSet<>();
        private final Set<Integer> declaredStepIds = new HashSet<>();
        private final Set<Integer> commandStepIds = new HashSet<>();

        private Pass(Program program) {
            this.program = Objects.requireNonNull(program, "program must not be null");
        }

        private ValidationReport run() {
            for (VariableDeclaration declaration : program.variables()) {
                checkExpression(declaration.value(), "declaration of '" + declaration.name() + "'");
                if (!boundVariables.add(declaration.name())) {
                    issues.add(
                            ValidationIssue.info(
                                    "Variable '"
                                            + declaration.name()
                                            + "' is declared more than once; the last value wins"));
                }
            }
            for (Workflow workflow : program.workflows()) {
                if (workflow.steps().isEmpty()) {
                    issues.add(
                            ValidationIssue.warning(
                                    "Workflow \"" + workflow.name() + "\" has no steps"));
                }
                checkSteps(workflow, workflow.steps());
            }
            return new ValidationReport(issues);
        }

        private void checkSteps(Workflow workflow, List<Step> steps) {
            for (Step step : steps) {
                checkStep(workflow, step);
            }
        }

        private void checkStep(Workflow workflow, Step step) {
            String location = "step " + step.id() + " of workflow \"" + workflow.name() + "\"";
            if (!declaredStepIds.add(step.id())) {
                issues.add(
                        ValidationIssue.warning(
                                "Step id "
                                        + step.id()
                                        + " is declared more than once ("
                                        + location
                                        + "); later results overwrite earlier ones"));
            }

            if (step.content() instanceof StepContent.Command command) {
                for (Expression argument : command.arguments()) {
                    checkExpression(argument, location);
                }
                if (!knownCommands.contains(command.name())) {
                    issues.add(
                            ValidationIssue.warning(
                                    "Unknown command \"" + command.name() + "\" in " + location));
                }
                commandStepIds.add(step.id());
            } else if (step.content() instanceof StepContent.Conditional conditional) {
                checkExpression(conditional.condition(), location);
                checkSteps(workflow, conditional.ifSteps());
                conditional.elseBranch().ifPresent(elseSteps -> checkSteps(workflow, elseSteps));
            }
        }

        private void checkExpression(Expression expression, String location) {
            expression.accept(
                    new Expression.Visitor<Void>() {
                        @Override
                        public Void visitString(Expression.StringLiteral literal) {
                            return null;
                        }

                        @Override
                        public Void visitNumber(Expression.NumberLiteral literal) {
                            return null;
                        }

                        @Override
                        public Void visitIdentifier(Expression.Identifier identifier) {
                            if (!isBound(identifier.name())) {
                                issues.add(
                                        ValidationIssue.warning(
                                                "Undefined variable '"
                                                        + identifier.name()
                                                        + "' in "
                                                        + location));
                            }
                            return null;
                        }

                        @Override
                        public Void visitBinary(Expression.BinaryExpression binary) {
                            binary.left().accept(this);
                            binary.right().accept(this);
                            return null;
                        }

                        @Override
                        public Void visitPropertyAccess(Expression.PropertyAccess access) {
                            access.object().accept(this);
                            return null;
                        }

                        @Override
                        public Void visitStepReference(Expression.StepReference reference) {
                            if (!commandStepIds.contains(reference.stepId())) {
                                issues.add(
                                        ValidationIssue.warning(
                                                "Reference to step "
                                                        + reference.stepId()
                                                        + " in "
                                                        + location
                                                        + " has no earlier command step to read"));
                            }
                            return null;
                        }
                    });
        }

        private boolean isBound(String name) {
            return boundVariables.contains(name);
        }
    }
}
