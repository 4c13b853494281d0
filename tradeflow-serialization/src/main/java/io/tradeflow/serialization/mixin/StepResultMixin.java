package io.tradeflow.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/// Jackson mixin pinning the JSON shape of `StepResult`.
///
/// The record's four components are written in declaration order. The derived
/// `isFailure()` accessor would otherwise surface as a redundant `failure`
/// property, so it is ignored on write and tolerated on read.
///
/// @see io.tradeflow.serialization.TradeFlowJacksonModule
@JsonPropertyOrder({"success", "data", "status", "message"})
@JsonIgnoreProperties(value = {"failure"}, ignoreUnknown = true)
public abstract class StepResultMixin {}
