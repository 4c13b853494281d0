package io.tradeflow.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tradeflow.core.execution.ExecutionResult;
import java.util.Objects;
import java.util.logging.Logger;

/// Writes execution outcomes as JSON reports.
///
/// A report has the sections `stepResults` (step id to result), `variables`
/// and `trace`. A report for an aborted run additionally carries an `error`
/// object with the exception type and message; its other sections hold what
/// was recorded before the failure.
///
/// {@snippet :
/// {
///   "stepResults" : { "1" : { "success" : true, "data" : "ok", "status" : 200, "message" : "..." } },
///   "variables" : { "a" : "x" },
///   "trace" : [ { "event" : "workflow_entered", "name" : "W", "text" : "Executing workflow: W" } ]
/// }
/// }
///
/// @implNote Thread-safe; reports are written with a mapper from
/// {@link ProgramSerializer#createMapper()}.
public final class ExecutionReportSerializer {

    private static final Logger logger =
            Logger.getLogger(ExecutionReportSerializer.class.getName());

    private ExecutionReportSerializer() {}

    /// Serializes the result of a completed run.
    ///
    /// @param result the run result, not null
    /// @return pretty-printed JSON, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(ExecutionResult result) {
        Objects.requireNonNull(result, "result must not be null");
        try {
            return ProgramSerializer.createMapper().writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize execution report: " + e.getMessage(), e);
        }
    }

    /// Serializes the partial state of a run that ended with an exception.
    ///
    /// @param partial results recorded before the failure, not null
    /// @param error the exception that stopped the run, not null
    /// @return pretty-printed JSON with an `error` section, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(ExecutionResult partial, RuntimeException error) {
        Objects.requireNonNull(partial, "partial must not be null");
        Objects.requireNonNull(error, "error must not be null");

        ObjectMapper mapper = ProgramSerializer.createMapper();
        ObjectNode report = mapper.valueToTree(partial);
        ObjectNode errorNode = report.putObject("error");
        errorNode.put("type", error.getClass().getSimpleName());
        errorNode.put("message", error.getMessage());
        logger.fine("Writing report for aborted run: " + error.getMessage());
        try {
            return mapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize execution report: " + e.getMessage(), e);
        }
    }
}
