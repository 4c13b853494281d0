package io.tradeflow.cli.commands;

import io.tradeflow.cli.exception.ScriptNotFoundException;
import io.tradeflow.core.exception.TradeFlowException;
import io.tradeflow.core.outline.StepOutline;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/// Prints a plain-language description of every step in a script.
///
/// ### Usage
/// ```
/// tradeflow outline my-script
/// ```
///
/// @see StepOutline
@Command(name = "outline", description = "Describe the steps of a script")
class ScriptOutlineCommand extends ScriptCommand {

    @Parameters(index = "0", description = "Script name or path (.flow optional)")
    private String scriptName;

    @Override
    protected void execute() {
        try {
            StepOutline.describe(loadProgram(scriptName)).forEach(System.out::println);
        } catch (TradeFlowException | ScriptNotFoundException e) {
            System.err.println(" [FAIL] " + e.getMessage());
        }
    }
}
