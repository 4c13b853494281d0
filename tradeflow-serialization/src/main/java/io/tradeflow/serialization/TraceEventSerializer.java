package io.tradeflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.tradeflow.core.execution.TraceEvent;
import java.io.IOException;
import java.io.Serial;
import java.util.Locale;

/// Serializes the `TraceEvent` sealed hierarchy with an `"event"` discriminator field.
///
/// Every event also carries its rendered trace line under `"text"`, so a report
/// reader does not need to know the event types to print the trace.
///
/// Emitted fields per subtype (besides `event` and `text`):
/// - **`VariableBound`**: `kind`, `name`, `value`
/// - **`WorkflowEntered`**: `name`
/// - **`StepEntered`**: `stepId`, `depth`
/// - **`CommandDispatched`**: `stepId`, `command`, `arguments`, `depth`
/// - **`CommandOutput`**: `stepId`, `command`, `line`, `depth`
/// - **`CommandCompleted`**: `stepId`, `command`, `result`, `depth`
/// - **`BranchEvaluated`**: `stepId`, `condition`, `branch`, `depth`
///
/// @implNote Package-private, serialize-only. Trace events are an output of a
/// run and are never read back.
class TraceEventSerializer extends StdSerializer<TraceEvent> {

    @Serial private static final long serialVersionUID = -6240153893318866921L;

    TraceEventSerializer() {
        super(TraceEvent.class);
    }

    @Override
    public void serialize(TraceEvent event, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();

        if (event instanceof TraceEvent.VariableBound e) {
            gen.writeStringField("event", "variable_bound");
            gen.writeStringField("kind", e.kind().keyword());
            gen.writeStringField("name", e.name());
            gen.writeStringField("value", e.value());
        } else if (event instanceof TraceEvent.WorkflowEntered e) {
            gen.writeStringField("event", "workflow_entered");
            gen.writeStringField("name", e.name());
        } else if (event instanceof TraceEvent.StepEntered e) {
            gen.writeStringField("event", "step_entered");
            gen.writeNumberField("stepId", e.stepId());
            gen.writeNumberField("depth", e.depth());
        } else if (event instanceof TraceEvent.CommandDispatched e) {
            gen.writeStringField("event", "command_dispatched");
            gen.writeNumberField("stepId", e.stepId());
            gen.writeStringField("command", e.command());
            gen.writeArrayFieldStart("arguments");
            for (String argument : e.arguments()) {
                gen.writeString(argument);
            }
            gen.writeEndArray();
            gen.writeNumberField("depth", e.depth());
        } else if (event instanceof TraceEvent.CommandOutput e) {
            gen.writeStringField("event", "command_output");
            gen.writeNumberField("stepId", e.stepId());
            gen.writeStringField("command", e.command());
            gen.writeStringField("line", e.line());
            gen.writeNumberField("depth", e.depth());
        } else if (event instanceof TraceEvent.CommandCompleted e) {
            gen.writeStringField("event", "command_completed");
            gen.writeNumberField("stepId", e.stepId());
            gen.writeStringField("command", e.command());
            gen.writeFieldName("result");
            provider.defaultSerializeValue(e.result(), gen);
            gen.writeNumberField("depth", e.depth());
        } else if (event instanceof TraceEvent.BranchEvaluated e) {
            gen.writeStringField("event", "branch_evaluated");
            gen.writeNumberField("stepId", e.stepId());
            gen.writeBooleanField("condition", e.condition());
            gen.writeStringField("branch", e.branch().name().toLowerCase(Locale.ROOT));
            gen.writeNumberField("depth", e.depth());
        } else {
            throw new IllegalStateException(
                    "Unsupported trace event type: " + event.getClass().getName());
        }
        gen.writeStringField("text", event.describe());

        gen.writeEndObject();
    }
}
