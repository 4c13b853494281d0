package io.tradeflow.core.execution;

import io.tradeflow.core.ast.Expression;
import io.tradeflow.core.ast.Program;
import io.tradeflow.core.ast.Step;
import io.tradeflow.core.ast.StepContent;
import io.tradeflow.core.ast.VariableDeclaration;
import io.tradeflow.core.ast.Workflow;
import io.tradeflow.core.command.CommandRegistry;
import io.tradeflow.core.execution.TraceEvent.Branch;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Tree-walking executor for one parsed {@link Program}.
///
/// Runs all top-level declarations in order, then every workflow in order,
/// then every step of a workflow in order, descending depth-first into the
/// branch a conditional selects before moving on to the next sibling.
///
/// ### Contracts
/// - **Precondition**: {@link #execute(Program)} is called at most once per instance
/// - **Postcondition**: every executed command step has exactly one entry in the
///   result table (the latest, when ids collide)
/// - **Invariant**: the environment and result table belong to this instance
///   alone and are never shared with another run
///
/// ### Failure
/// Undefined variables, references to steps without a result and operators
/// that cannot be evaluated throw {@link WorkflowRuntimeException} and stop the
/// run. Everything recorded up to that point stays available through
/// {@link #getStepResults()}, {@link #getVariables()} and {@link #getTrace()}.
/// Unknown commands are not failures of the run: the registry answers them with
/// a status 400 result and execution continues.
///
/// @implNote **Not thread-safe**. Create one executor per run; independent
/// executors may run concurrently as long as their {@link CommandRegistry} is
/// no longer being modified.
///
/// @see io.tradeflow.core.TradeFlowEnvironment#newExecutor(ExecutionListener)
public final class ProgramExecutor {

    private static final Logger logger = Logger.getLogger(ProgramExecutor.class.getName());

    private final CommandRegistry commandRegistry;
    private final ExecutionListener listener;
    private final boolean logTrace;

    private final Environment environment = new Environment();
    private final StepResultTable stepResults = new StepResultTable();
    private final ExecutionTrace trace = new ExecutionTrace();
    private final ExpressionEvaluator evaluator = new ExpressionEvaluator(environment, stepResults);

    private boolean executed;

    /// @param commandRegistry command handlers to dispatch to, not null
    /// @param listener receives every trace event as it happens, not null
    ///        (use {@link ExecutionListener#NOOP} when not needed)
    /// @param logTrace whether to also write each trace line to the logger at `FINE`
    public ProgramExecutor(
            CommandRegistry commandRegistry, ExecutionListener listener, boolean logTrace) {
        this.commandRegistry =
                Objects.requireNonNull(commandRegistry, "commandRegistry must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        this.logTrace = logTrace;
    }

    /// Runs the program.
    ///
    /// @param program the program to run, not null
    /// @return trace, step results and variables of the completed run, never null
    /// @throws WorkflowRuntimeException on the first fatal evaluation error
    /// @throws IllegalStateException if this executor already ran a program
    public ExecutionResult execute(Program program) {
        Objects.requireNonNull(program, "program must not be null");
        if (executed) {
            throw new IllegalStateException("ProgramExecutor instances run a single program");
        }
        executed = true;

        logger.info(
                "Executing program: "
                        + program.variables().size()
                        + " variable(s), "
                        + program.workflows().size()
                        + " workflow(s)");
        try {
            for (VariableDeclaration declaration : program.variables()) {
                declare(declaration);
            }
            for (Workflow workflow : program.workflows()) {
                runWorkflow(workflow);
            }
        } catch (WorkflowRuntimeException e) {
            logger.warning(
                    "Execution aborted after "
                            + stepResults.size()
                            + " recorded step result(s): "
                            + e.getMessage());
            throw e;
        }

        logger.info("Execution completed: " + stepResults.size() + " step result(s)");
        return new ExecutionResult(trace.events(), getStepResults(), getVariables());
    }

    /// Evaluates a single expression against this run's current state.
    ///
    /// @param expression the expression, not null
    /// @return its string value, never null
    /// @throws WorkflowRuntimeException if the expression cannot be evaluated
    public String evaluate(Expression expression) {
        return evaluator.evaluate(expression);
    }

    /// Returns recorded step results; partial if the run failed.
    public Map<Integer, StepResult> getStepResults() {
        return stepResults.snapshot();
    }

    /// Returns current variable bindings; partial if the run failed.
    public Map<String, String> getVariables() {
        return environment.snapshot();
    }

    /// Returns the events emitted so far.
    public List<TraceEvent> getTrace() {
        return trace.events();
    }

    private void declare(VariableDeclaration declaration) {
        String value = evaluator.evaluate(declaration.value());
        environment.define(declaration.name(), value);
        publish(new TraceEvent.VariableBound(declaration.kind(), declaration.name(), value));
    }

    private void runWorkflow(Workflow workflow) {
        logger.fine("Entering workflow: " + workflow.name());
        publish(new TraceEvent.WorkflowEntered(workflow.name()));
        runSteps(workflow.steps(), 0);
    }

    private void runSteps(List<Step> steps, int depth) {
        for (Step step : steps) {
            runStep(step, depth);
        }
    }

    private void runStep(Step step, int depth) {
        publish(new TraceEvent.StepEntered(step.id(), depth));
        step.content()
                .accept(
                        new StepContent.Visitor<Void>() {
                            @Override
                            public Void visitCommand(StepContent.Command command) {
                                runCommand(step.id(), command, depth);
                                return null;
                            }

                            @Override
                            public Void visitConditional(StepContent.Conditional conditional) {
                                runConditional(step.id(), conditional, depth);
                                return null;
                            }
                        });
    }

    private void runCommand(int stepId, StepContent.Command command, int depth) {
        List<String> arguments = new ArrayList<>(command.arguments().size());
        for (Expression argument : command.arguments()) {
            arguments.add(evaluator.evaluate(argument));
        }

        publish(new TraceEvent.CommandDispatched(stepId, command.name(), arguments, depth));
        StepResult result =
                commandRegistry.dispatch(
                        command.name(),
                        List.copyOf(arguments),
                        line ->
                                publish(
                                        new TraceEvent.CommandOutput(
                                                stepId, command.name(), line, depth)));
        stepResults
                .record(stepId, result)
                .ifPresent(
                        previous ->
                                logger.fine(
                                        "Step "
                                                + stepId
                                                + " result overwritten by command "
                                                + command.name()));
        publish(new TraceEvent.CommandCompleted(stepId, command.name(), result, depth));
    }

    private void runConditional(int stepId, StepContent.Conditional conditional, int depth) {
        boolean holds = evaluator.test(conditional.condition());
        if (holds) {
            publish(new TraceEvent.BranchEvaluated(stepId, true, Branch.IF, depth));
            runSteps(conditional.ifSteps(), depth + 1);
        } else if (conditional.elseBranch().isPresent()) {
            publish(new TraceEvent.BranchEvaluated(stepId, false, Branch.ELSE, depth));
            runSteps(conditional.elseBranch().get(), depth + 1);
        } else {
            publish(new TraceEvent.BranchEvaluated(stepId, false, Branch.NONE, depth));
        }
    }

    private void publish(TraceEvent event) {
        trace.onEvent(event);
        if (logTrace && logger.isLoggable(Level.FINE)) {
            logger.fine(event.describe());
        }
        listener.onEvent(event);
    }
}
