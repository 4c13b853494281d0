package io.tradeflow.core.execution;

import java.util.Objects;

/// Recorded outcome of one command step.
///
/// Produced once per executed command and stored under the step id, where any
/// later `step N.property` reference can read it.
///
/// ### Contracts
/// - **Postcondition**: `data` and `message` are never null
///
/// @param success whether the command succeeded
/// @param data string payload returned by the command
/// @param status HTTP-style status code (200 on success, 400 for an unknown command)
/// @param message human-readable summary
public record StepResult(boolean success, String data, int status, String message) {

    public static final int STATUS_OK = 200;
    public static final int STATUS_BAD_REQUEST = 400;

    public StepResult {
        data = data != null ? data : "";
        message = message != null ? message : "";
    }

    /// Creates a successful result with status 200.
    ///
    /// @param data command payload, may be null (stored as empty)
    /// @param message summary, not null
    /// @return successful result, never null
    public static StepResult success(String data, String message) {
        return new StepResult(true, data, STATUS_OK, Objects.requireNonNull(message));
    }

    /// Creates a failed result with empty data.
    ///
    /// @param status failure status code
    /// @param message failure description, not null
    /// @return failed result, never null
    public static StepResult failure(int status, String message) {
        return new StepResult(false, "", status, Objects.requireNonNull(message));
    }

    /// Returns the value a step reference yields for `property`.
    ///
    /// `status` and `success` are rendered as strings; `message` and `data`
    /// are returned as stored. A missing or unrecognized property yields `data`.
    ///
    /// @param property property name, may be null
    /// @return property value, never null
    public String property(String property) {
        if (property == null) {
            return data;
        }
        return switch (property) {
            case "status" -> Integer.toString(status);
            case "message" -> message;
            case "success" -> Boolean.toString(success);
            default -> data;
        };
    }

    /// Returns whether the command failed.
    public boolean isFailure() {
        return !success;
    }
}
