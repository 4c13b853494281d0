package io.tradeflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.tradeflow.core.ast.Expression;
import java.io.IOException;
import java.io.Serial;

/// Serializes the `Expression` sealed hierarchy with a `"type"` discriminator field.
///
/// Emitted JSON shape per subtype:
/// - **`StringLiteral`**: `{"type":"string","value":"..."}`
/// - **`NumberLiteral`**: `{"type":"number","value":N}`
/// - **`Identifier`**: `{"type":"identifier","name":"..."}`
/// - **`BinaryExpression`**: `{"type":"binary","left":{...},"operator":"+","right":{...}}`
/// - **`PropertyAccess`**: `{"type":"property","object":{...},"property":"..."}`
/// - **`StepReference`**: `{"type":"step_ref","step":N,"property":"..."}`, `property`
///   omitted when the reference reads the whole result
///
/// @implNote Package-private. Registered by {@link TradeFlowJacksonModule}.
/// @see ExpressionDeserializer for the inverse operation
class ExpressionSerializer extends StdSerializer<Expression> {

    @Serial private static final long serialVersionUID = 3172598870412337611L;

    ExpressionSerializer() {
        super(Expression.class);
    }

    @Override
    public void serialize(Expression expression, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();

        if (expression instanceof Expression.StringLiteral literal) {
            gen.writeStringField("type", "string");
            gen.writeStringField("value", literal.value());
        } else if (expression instanceof Expression.NumberLiteral literal) {
            gen.writeStringField("type", "number");
            gen.writeNumberField("value", literal.value());
        } else if (expression instanceof Expression.Identifier identifier) {
            gen.writeStringField("type", "identifier");
            gen.writeStringField("name", identifier.name());
        } else if (expression instanceof Expression.BinaryExpression binary) {
            gen.writeStringField("type", "binary");
            gen.writeFieldName("left");
            serialize(binary.left(), gen, provider);
            gen.writeStringField("operator", binary.operator());
            gen.writeFieldName("right");
            serialize(binary.right(), gen, provider);
        } else if (expression instanceof Expression.PropertyAccess access) {
            gen.writeStringField("type", "property");
            gen.writeFieldName("object");
            serialize(access.object(), gen, provider);
            gen.writeStringField("property", access.property());
        } else if (expression instanceof Expression.StepReference reference) {
            gen.writeStringField("type", "step_ref");
            gen.writeNumberField("step", reference.stepId());
            if (reference.property() != null) {
                gen.writeStringField("property", reference.property());
            }
        } else {
            throw new IllegalStateException(
                    "Unsupported expression type: " + expression.getClass().getName());
        }

        gen.writeEndObject();
    }
}
