package io.tradeflow.cli.commands;

import io.tradeflow.cli.exception.ScriptNotFoundException;
import io.tradeflow.core.TradeFlowEnvironment;
import io.tradeflow.core.ast.Program;
import io.tradeflow.core.exception.TradeFlowException;
import io.tradeflow.core.validation.ValidationIssue;
import io.tradeflow.core.validation.ValidationReport;
import jakarta.inject.Inject;
import picocli.CommandLine;

/// CLI command for validating script syntax and structure.
///
/// Parses the script and runs the static checks of
/// {@link io.tradeflow.core.validation.ProgramValidator} against the commands
/// registered in the environment:
/// - Lexing and parsing errors
/// - Unknown commands, undefined variables, dangling step references
/// - Duplicate step ids and empty workflows
///
/// ### Usage
/// ```bash
/// tradeflow validate [-d <working-dir>] <script>
/// ```
///
/// @see ScriptCommand
@CommandLine.Command(name = "validate", description = "Validate script syntax")
class ScriptValidateCommand extends ScriptCommand {

    @CommandLine.Parameters(index = "0", description = "Script name or path (.flow optional)")
    private String scriptName;

    @Inject private TradeFlowEnvironment environment;

    @Override
    protected void execute() {
        try {
            Program program = loadProgram(scriptName);
            ValidationReport report = environment.newValidator().validate(program);

            if (report.hasWarnings()) {
                System.out.println(" [WARN] Script parsed with warnings");
            } else {
                System.out.println(" [OK] Script is valid!");
            }
            System.out.println("   Variables: " + program.variables().size());
            System.out.println("   Workflows: " + program.workflows().size());
            System.out.println("   Steps: " + program.stepCount());

            for (ValidationIssue issue : report.issues()) {
                System.out.println(" [" + issue.severity() + "] " + issue.message());
            }
        } catch (TradeFlowException | ScriptNotFoundException e) {
            System.err.println(" [FAIL] Validation failed: " + e.getMessage());
        }
    }
}
