package io.tradeflow.cli.commands;

import io.tradeflow.cli.exception.ScriptNotFoundException;
import io.tradeflow.core.TradeFlow;
import io.tradeflow.core.ast.Program;
import io.tradeflow.core.exception.TradeFlowException;
import io.tradeflow.serialization.ProgramSerializer;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/// Compiles a script to its JSON syntax tree and writes it to the build directory.
///
/// The compiled JSON is stored in `{working-dir}/build/{script-name}.json` and
/// can be restored with {@link ProgramSerializer#fromJson(String)}.
///
/// ### Usage
/// ```
/// tradeflow build my-script.flow
/// tradeflow build my-script -d /path/to/working-dir
/// ```
@Command(name = "build", description = "Compile a TradeFlow script to JSON")
public class ScriptBuildCommand extends ScriptCommand {

    static final String BUILD_DIR = "build";

    @Parameters(index = "0", description = "Script name or path (.flow optional)")
    private String scriptName;

    @Override
    protected void execute() {
        try {
            Path script = resolveScript(scriptName);
            Program program = TradeFlow.parse(readScript(script));
            String json = ProgramSerializer.toJson(program);

            Path buildDir = getWorkingDirectory().resolve(BUILD_DIR);
            Files.createDirectories(buildDir);

            String name = baseName(script);
            Path outputFile = buildDir.resolve(name + ".json");
            Files.writeString(outputFile, json);

            System.out.println(
                    "Compiled: "
                            + name
                            + " ("
                            + program.workflows().size()
                            + " workflow(s), "
                            + program.stepCount()
                            + " step(s))");
            System.out.println("Output:   " + outputFile);
        } catch (TradeFlowException | ScriptNotFoundException e) {
            System.err.println("Build failed: " + e.getMessage());
        } catch (IOException e) {
            System.err.println("I/O error: " + e.getMessage());
        }
    }
}
