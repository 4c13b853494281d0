package io.tradeflow.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.tradeflow.core.ast.Expression;
import io.tradeflow.core.ast.StepContent;
import io.tradeflow.core.execution.ExecutionResult;
import io.tradeflow.core.execution.StepResult;
import io.tradeflow.core.execution.TraceEvent;
import io.tradeflow.serialization.mixin.ExecutionResultMixin;
import io.tradeflow.serialization.mixin.StepResultMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all TradeFlow serialization configuration in one place.
///
/// Covers two registration strategies:
///
/// **Custom serializer/deserializer pairs** (sealed hierarchies, discriminator field drives
/// subtype selection at runtime):
/// - `Expression`: `ExpressionSerializer` / `ExpressionDeserializer`, discriminator `"type"`
/// - `StepContent`: `StepContentSerializer` / `StepContentDeserializer`, discriminator `"type"`
/// - `TraceEvent`: `TraceEventSerializer` only, discriminator `"event"`
///
/// **Mixins** (records bound by their canonical constructor):
/// - `StepResult`: property order, derived accessor hidden
/// - `ExecutionResult`: section order
///
/// `Program`, `Workflow`, `Step` and `VariableDeclaration` need no registration:
/// Jackson binds records through their components.
///
/// @see ProgramSerializer for the convenience factory API
public class TradeFlowJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 5504318257095512470L;

    public TradeFlowJacksonModule() {
        super("TradeFlowJacksonModule");

        addSerializer(Expression.class, new ExpressionSerializer());
        addDeserializer(Expression.class, new ExpressionDeserializer());

        addSerializer(StepContent.class, new StepContentSerializer());
        addDeserializer(StepContent.class, new StepContentDeserializer());

        addSerializer(TraceEvent.class, new TraceEventSerializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(StepResult.class, StepResultMixin.class);
        context.setMixInAnnotations(ExecutionResult.class, ExecutionResultMixin.class);
    }
}
