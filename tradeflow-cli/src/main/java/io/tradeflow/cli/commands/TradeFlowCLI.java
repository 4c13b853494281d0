package io.tradeflow.cli.commands;

import io.quarkus.picocli.runtime.annotations.TopCommand;
import picocli.CommandLine.Command;

/// Main entry point for the TradeFlow CLI application.
///
/// Registers all available subcommands for working with `.flow` scripts:
/// - `run` - Execute a script and print its trace and step results
/// - `validate` - Parse a script and report likely mistakes
/// - `tokens` - Dump the token stream of a script
/// - `build` - Compile a script to JSON (`{working-dir}/build/`)
/// - `outline` - Describe every step in plain language
///
/// @see ScriptRunCommand
/// @see ScriptValidateCommand
/// @see ScriptTokensCommand
/// @see ScriptBuildCommand
/// @see ScriptOutlineCommand
@TopCommand
@Command(
        name = "tradeflow",
        mixinStandardHelpOptions = true,
        description = "TradeFlow workflow scripting language",
        subcommands = {
            ScriptRunCommand.class,
            ScriptValidateCommand.class,
            ScriptTokensCommand.class,
            ScriptBuildCommand.class,
            ScriptOutlineCommand.class
        })
public class TradeFlowCLI {}
