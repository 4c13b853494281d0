package io.tradeflow.serialization;

import static io.tradeflow.serialization.ExpressionDeserializer.required;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.tradeflow.core.ast.Expression;
import io.tradeflow.core.ast.Step;
import io.tradeflow.core.ast.StepContent;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;

/// Deserializes `StepContent` variants based on the `type` discriminator field.
///
/// Distinguishes a missing `else` field (no else block) from an empty array
/// (an empty else block), so a round trip keeps the branch structure intact.
///
/// @see StepContentSerializer for the inverse operation
class StepContentDeserializer extends StdDeserializer<StepContent> {

    @Serial private static final long serialVersionUID = 1907342750617214880L;

    StepContentDeserializer() {
        super(StepContent.class);
    }

    @Override
    public StepContent deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        return fromNode(root);
    }

    private static StepContent fromNode(JsonNode node) throws IOException {
        String type = required(node, "type").asText();

        return switch (type) {
            case "command" -> {
                List<Expression> arguments = new ArrayList<>();
                JsonNode args = node.get("arguments");
                if (args != null) {
                    for (JsonNode arg : args) {
                        arguments.add(ExpressionDeserializer.fromNode(arg));
                    }
                }
                yield new StepContent.Command(required(node, "name").asText(), arguments);
            }
            case "conditional" ->
                    new StepContent.Conditional(
                            ExpressionDeserializer.fromNode(required(node, "condition")),
                            steps(node.get("if")),
                            node.hasNonNull("else") ? steps(node.get("else")) : null);
            default -> throw new IOException("Unknown StepContent type: " + type);
        };
    }

    private static List<Step> steps(JsonNode array) throws IOException {
        List<Step> steps = new ArrayList<>();
        if (array == null) {
            return steps;
        }
        for (JsonNode step : array) {
            steps.add(new Step(required(step, "id").asInt(), fromNode(required(step, "content"))));
        }
        return steps;
    }
}
