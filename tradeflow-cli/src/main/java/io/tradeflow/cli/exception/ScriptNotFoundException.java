package io.tradeflow.cli.exception;

import java.io.Serial;

/// Thrown when a script cannot be located or read.
///
/// Common causes:
/// - Script file not found in the working directory or its `workflows/` folder
/// - Script file not readable
///
/// @see io.tradeflow.cli.commands.ScriptCommand
public class ScriptNotFoundException extends Exception {

    @Serial private static final long serialVersionUID = 4470861285735126601L;

    /// Creates an exception with the specified detail message.
    ///
    /// @param message description of why the script could not be loaded, not null
    public ScriptNotFoundException(String message) {
        super(message);
    }

    /// Creates an exception with the specified detail message and cause.
    ///
    /// @param message description of why the script could not be loaded, not null
    /// @param cause underlying I/O failure, may be null
    public ScriptNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
