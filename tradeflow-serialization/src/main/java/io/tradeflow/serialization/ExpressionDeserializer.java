package io.tradeflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.tradeflow.core.ast.Expression;
import java.io.IOException;
import java.io.Serial;

/// Deserializes `Expression` variants based on the `type` discriminator field.
///
/// Nested operands are rebuilt recursively from the `JsonNode` tree; no POJO
/// reflection is involved.
///
/// @see ExpressionSerializer for the inverse operation
class ExpressionDeserializer extends StdDeserializer<Expression> {

    @Serial private static final long serialVersionUID = -4420960364035573174L;

    ExpressionDeserializer() {
        super(Expression.class);
    }

    @Override
    public Expression deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        return fromNode(root);
    }

    /// Rebuilds an expression from its tree form.
    ///
    /// @param node object node carrying a `type` field, not null
    /// @return the expression, never null
    /// @throws IOException if the discriminator is missing or unknown
    static Expression fromNode(JsonNode node) throws IOException {
        String type = required(node, "type").asText();

        return switch (type) {
            case "string" -> new Expression.StringLiteral(required(node, "value").asText());
            case "number" -> new Expression.NumberLiteral(required(node, "value").doubleValue());
            case "identifier" -> new Expression.Identifier(required(node, "name").asText());
            case "binary" ->
                    new Expression.BinaryExpression(
                            fromNode(required(node, "left")),
                            required(node, "operator").asText(),
                            fromNode(required(node, "right")));
            case "property" ->
                    new Expression.PropertyAccess(
                            fromNode(required(node, "object")),
                            required(node, "property").asText());
            case "step_ref" ->
                    new Expression.StepReference(
                            required(node, "step").asInt(),
                            node.hasNonNull("property") ? node.get("property").asText() : null);
            default -> throw new IOException("Unknown Expression type: " + type);
        };
    }

    static JsonNode required(JsonNode node, String field) throws IOException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IOException("Missing field '" + field + "' in " + node);
        }
        return value;
    }
}
