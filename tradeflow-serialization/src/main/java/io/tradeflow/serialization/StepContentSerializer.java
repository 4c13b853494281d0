package io.tradeflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.tradeflow.core.ast.Expression;
import io.tradeflow.core.ast.Step;
import io.tradeflow.core.ast.StepContent;
import java.io.IOException;
import java.io.Serial;
import java.util.List;

/// Serializes the `StepContent` sealed hierarchy with a `"type"` discriminator field.
///
/// Emitted JSON shape per subtype:
/// - **`Command`**: `{"type":"command","name":"...","arguments":[...]}`
/// - **`Conditional`**: `{"type":"conditional","condition":{...},"if":[...],"else":[...]}`,
///   `else` omitted when the source has no else block (an empty else block is
///   written as `[]`)
///
/// Nested steps are written as `{"id":N,"content":{...}}`, the same shape the
/// `Step` record gets at the top level of a workflow.
///
/// @implNote Package-private. Registered by {@link TradeFlowJacksonModule}.
/// @see StepContentDeserializer for the inverse operation
class StepContentSerializer extends StdSerializer<StepContent> {

    @Serial private static final long serialVersionUID = 8826037414425139215L;

    private final ExpressionSerializer expressions = new ExpressionSerializer();

    StepContentSerializer() {
        super(StepContent.class);
    }

    @Override
    public void serialize(StepContent content, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();

        if (content instanceof StepContent.Command command) {
            gen.writeStringField("type", "command");
            gen.writeStringField("name", command.name());
            gen.writeArrayFieldStart("arguments");
            for (Expression argument : command.arguments()) {
                expressions.serialize(argument, gen, provider);
            }
            gen.writeEndArray();
        } else if (content instanceof StepContent.Conditional conditional) {
            gen.writeStringField("type", "conditional");
            gen.writeFieldName("condition");
            expressions.serialize(conditional.condition(), gen, provider);
            writeSteps("if", conditional.ifSteps(), gen, provider);
            if (conditional.elseSteps() != null) {
                writeSteps("else", conditional.elseSteps(), gen, provider);
            }
        } else {
            throw new IllegalStateException(
                    "Unsupported step content type: " + content.getClass().getName());
        }

        gen.writeEndObject();
    }

    private void writeSteps(
            String field, List<Step> steps, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeArrayFieldStart(field);
        for (Step step : steps) {
            gen.writeStartObject();
            gen.writeNumberField("id", step.id());
            gen.writeFieldName("content");
            serialize(step.content(), gen, provider);
            gen.writeEndObject();
        }
        gen.writeEndArray();
    }
}
