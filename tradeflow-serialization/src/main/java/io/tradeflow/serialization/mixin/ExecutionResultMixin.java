package io.tradeflow.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/// Jackson mixin ordering the sections of a serialized `ExecutionResult`.
///
/// Step results and variables come first so a reader scanning the report
/// sees the outcome before the (possibly long) trace.
///
/// @see io.tradeflow.serialization.ExecutionReportSerializer
@JsonPropertyOrder({"stepResults", "variables", "trace"})
public abstract class ExecutionResultMixin {}
