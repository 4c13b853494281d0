package io.tradeflow.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.tradeflow.core.ast.Program;

/// Utility class for serializing and deserializing parsed TradeFlow programs to/from JSON.
///
/// The JSON form is the compiled artifact of a `.flow` script: it carries the
/// full syntax tree, so a program restored from it executes exactly like the
/// program parsed from source.
///
/// ### Usage
/// {@snippet :
/// String json = ProgramSerializer.toJson(TradeFlow.parse(source));
/// Program restored = ProgramSerializer.fromJson(json);
/// }
///
/// @implNote Thread-safe. The internal ObjectMapper is created per call via
/// `createMapper()`. For high-throughput scenarios, cache the mapper.
///
/// @see TradeFlowJacksonModule for the registered type handlers
public final class ProgramSerializer {

    private ProgramSerializer() {}

    /// Serializes a program to pretty-printed JSON.
    ///
    /// @param program the program to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(Program program) {
        try {
            return createMapper().writeValueAsString(program);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize program: " + e.getMessage(), e);
        }
    }

    /// Deserializes a program from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized program, never null
    /// @throws IllegalArgumentException if deserialization fails
    public static Program fromJson(String json) {
        try {
            return createMapper().readValue(json, Program.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize program: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for TradeFlow serialization.
    ///
    /// Registers:
    /// - `TradeFlowJacksonModule` for the syntax tree and execution types
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - indented output
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new TradeFlowJacksonModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
