package io.tradeflow.cli.commands;

import io.tradeflow.cli.exception.ScriptNotFoundException;
import io.tradeflow.core.TradeFlow;
import io.tradeflow.core.ast.Program;
import jakarta.inject.Inject;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import picocli.CommandLine.Option;

/// Base class for all script-related CLI commands.
///
/// Provides common functionality for script loading, working directory resolution,
/// and banner display. Subclasses implement specific command behavior in {@link #execute()}.
///
/// ### Working Directory Resolution
/// Priority order for determining the working directory:
/// 1. CLI option `-d` / `--working-dir`
/// 2. Config property `tradeflow.working.dir`
/// 3. Current directory (`.`)
///
/// ### Script Resolution
/// The script argument is tried, relative to the working directory, as given,
/// with a `.flow` extension appended, and both forms again under `workflows/`.
/// The first regular file wins.
///
/// @implNote Subclasses must be package-private and annotated with `@Command`.
/// @see ScriptRunCommand
/// @see ScriptValidateCommand
public abstract class ScriptCommand implements Runnable {

    static final String SCRIPT_EXTENSION = ".flow";
    static final String WORKFLOWS_DIR = "workflows";

    private static final String[] BANNER = {
        "",
        "  _____              _       _____ _",
        " |_   _| __ __ _  __| | ___ |  ___| | _____      __",
        "   | || '__/ _` |/ _` |/ _ \\| |_  | |/ _ \\ \\ /\\ / /",
        "   | || | | (_| | (_| |  __/|  _| | | (_) \\ V  V /",
        "   |_||_|  \\__,_|\\__,_|\\___||_|   |_|\\___/ \\_/\\_/",
        "",
        " Workflow scripting for trading desks",
        ""
    };

    @Option(
            names = {"-d", "--working-dir"},
            description = "Working directory containing scripts and the workflows/ folder")
    protected Path workingDirPath;

    @Inject
    @ConfigProperty(name = "tradeflow.working.dir", defaultValue = ".")
    String defaultWorkingDir;

    @Override
    public final void run() {
        if (showBanner()) {
            for (String line : BANNER) {
                System.out.println(line);
            }
        }
        execute();
    }

    protected abstract void execute();

    /// Returns whether the banner and progress lines are printed.
    ///
    /// Commands whose standard output is machine-readable override this.
    protected boolean showBanner() {
        return true;
    }

    /// Prints a progress line unless standard output is machine-readable.
    protected void status(String line) {
        if (showBanner()) {
            System.out.println(line);
        }
    }

    /// Loads and parses a script.
    ///
    /// @param scriptName script name or path, with or without `.flow`, not null
    /// @return parsed program, never null
    /// @throws ScriptNotFoundException if no matching file exists or it cannot be read
    /// @throws io.tradeflow.core.exception.TradeFlowException if the script does not lex or parse
    protected Program loadProgram(String scriptName) throws ScriptNotFoundException {
        return TradeFlow.parse(readScript(resolveScript(scriptName)));
    }

    /// Reads a resolved script as UTF-8 text.
    ///
    /// @param script path of an existing script, not null
    /// @return file contents, never null
    /// @throws ScriptNotFoundException if the file cannot be read
    protected String readScript(Path script) throws ScriptNotFoundException {
        try {
            return Files.readString(script);
        } catch (IOException e) {
            throw new ScriptNotFoundException(
                    "Cannot read script " + script + ": " + e.getMessage(), e);
        }
    }

    /// Locates a script file below the working directory.
    ///
    /// @param scriptName script name or path, not null
    /// @return absolute path of the first existing candidate, never null
    /// @throws ScriptNotFoundException if no candidate exists
    protected Path resolveScript(String scriptName) throws ScriptNotFoundException {
        if (scriptName == null || scriptName.isBlank()) {
            throw new ScriptNotFoundException(
                    "No script specified. Usage: tradeflow <command> <script> [-d <working-dir>]");
        }
        Path root = getWorkingDirectory();
        status("Using working directory: " + root);

        List<Path> candidates = new ArrayList<>();
        for (Path base : List.of(root, root.resolve(WORKFLOWS_DIR))) {
            candidates.add(base.resolve(scriptName));
            if (!scriptName.endsWith(SCRIPT_EXTENSION)) {
                candidates.add(base.resolve(scriptName + SCRIPT_EXTENSION));
            }
        }
        for (Path candidate : candidates) {
            if (Files.isRegularFile(candidate)) {
                status("Loading script: " + candidate);
                return candidate;
            }
        }
        throw new ScriptNotFoundException(
                "Script not found: " + scriptName + " (in " + root + ")");
    }

    /// Returns the effective working directory for script resolution.
    ///
    /// Resolution priority: CLI option `-d` > config property `tradeflow.working.dir` >
    /// current directory.
    ///
    /// @return absolute working directory, never null
    protected Path getWorkingDirectory() {
        Path effectivePath;
        if (workingDirPath != null) {
            effectivePath = workingDirPath;
        } else if (defaultWorkingDir != null && !defaultWorkingDir.isBlank()) {
            effectivePath = Path.of(defaultWorkingDir);
        } else {
            effectivePath = Path.of(".");
        }
        return effectivePath.toAbsolutePath().normalize();
    }

    /// Returns the script's base name without directories or `.flow` extension.
    static String baseName(Path script) {
        String fileName = script.getFileName().toString();
        return fileName.endsWith(SCRIPT_EXTENSION)
                ? fileName.substring(0, fileName.length() - SCRIPT_EXTENSION.length())
                : fileName;
    }
}
