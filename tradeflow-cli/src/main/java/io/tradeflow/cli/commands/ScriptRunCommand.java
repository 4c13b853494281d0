package io.tradeflow.cli.commands;

import io.tradeflow.cli.exception.ScriptNotFoundException;
import io.tradeflow.cli.execution.TracePrinter;
import io.tradeflow.cli.ui.AnsiStyles;
import io.tradeflow.core.TradeFlowEnvironment;
import io.tradeflow.core.ast.Program;
import io.tradeflow.core.exception.TradeFlowException;
import io.tradeflow.core.execution.ExecutionListener;
import io.tradeflow.core.execution.ExecutionResult;
import io.tradeflow.core.execution.ProgramExecutor;
import io.tradeflow.core.execution.StepResult;
import io.tradeflow.core.execution.WorkflowRuntimeException;
import io.tradeflow.serialization.ExecutionReportSerializer;
import jakarta.inject.Inject;
import java.util.Map;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// CLI command for executing a script.
///
/// Parses the script, runs it on a fresh executor and prints the execution
/// trace live, followed by the table of recorded step results. When the run
/// aborts on a runtime error, the results recorded before the failure are
/// still printed.
///
/// ### Usage
/// ```bash
/// tradeflow run [-d <working-dir>] [--json] [--no-color] <script>
/// ```
///
/// ### Options
/// - `--json` - Print a JSON execution report instead of the trace (no banner)
/// - `--no-color` - Disable ANSI color output (also `tradeflow.color=false`)
///
/// @see io.tradeflow.core.execution.ProgramExecutor
@Command(name = "run", description = "Run a TradeFlow script")
class ScriptRunCommand extends ScriptCommand {

    @Parameters(index = "0", description = "Script name or path (.flow optional)")
    private String scriptName;

    @Option(
            names = {"--json"},
            description = "Print the execution report as JSON")
    private boolean json = false;

    @Option(
            names = {"--no-color"},
            description = "Disable colored output",
            negatable = true)
    private boolean color = true;

    @Inject
    @ConfigProperty(name = "tradeflow.color", defaultValue = "true")
    Boolean configuredColor;

    @Inject private TradeFlowEnvironment environment;

    @Override
    protected boolean showBanner() {
        return !json;
    }

    @Override
    protected void execute() {
        AnsiStyles styles = AnsiStyles.of(useColor());
        ProgramExecutor executor = null;
        try {
            Program program = loadProgram(scriptName);
            if (!json) {
                System.out.printf(
                        "%n%s %s%n",
                        styles.checkmark(),
                        styles.bold(
                                "Script loaded: "
                                        + program.workflows().size()
                                        + " workflow(s) "
                                        + styles.bullet()
                                        + " "
                                        + program.stepCount()
                                        + " step(s)"));
                System.out.println();
            }

            ExecutionListener listener =
                    json ? ExecutionListener.NOOP : new TracePrinter(System.out, useColor());
            executor = environment.newExecutor(listener);
            ExecutionResult result = executor.execute(program);

            if (json) {
                System.out.println(ExecutionReportSerializer.toJson(result));
            } else {
                System.out.printf(
                        "%n%s %s%n", styles.checkmark(), styles.bold("Execution completed"));
                printStepResults(result.stepResults(), styles);
            }
        } catch (WorkflowRuntimeException e) {
            System.err.printf(
                    "%s %s %s%n",
                    styles.crossmark(), styles.bold("Execution failed:"), e.getMessage());
            ExecutionResult partial =
                    new ExecutionResult(
                            executor.getTrace(), executor.getStepResults(), executor.getVariables());
            if (json) {
                System.out.println(ExecutionReportSerializer.toJson(partial, e));
            } else {
                printStepResults(partial.stepResults(), styles);
            }
        } catch (TradeFlowException e) {
            System.err.printf(
                    "%s %s %s%n", styles.crossmark(), styles.bold("Script error:"), e.getMessage());
        } catch (ScriptNotFoundException e) {
            System.err.println(" [FAIL] " + e.getMessage());
        }
    }

    private void printStepResults(Map<Integer, StepResult> results, AnsiStyles styles) {
        System.out.printf("  Step results: %d%n", results.size());
        results.forEach(
                (stepId, result) ->
                        System.out.printf(
                                "    Step %d: %s %s %s %s%n",
                                stepId,
                                styles.successOrError(
                                        result.success() ? "OK" : "FAILED", result.success()),
                                result.status(),
                                styles.bullet(),
                                result.data().isEmpty() ? result.message() : result.data()));
    }

    private boolean useColor() {
        return color && (configuredColor == null || configuredColor);
    }
}
