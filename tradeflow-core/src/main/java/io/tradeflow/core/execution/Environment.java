package io.tradeflow.core.execution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Flat variable store for one program run.
///
/// No scoping and no shadowing: a binding made anywhere is visible everywhere
/// afterwards, and rebinding a name replaces its value whatever keyword
/// declared it.
///
/// @implNote **Not thread-safe**. Owned by a single {@link ProgramExecutor}.
public final class Environment {

    private final Map<String, String> values = new LinkedHashMap<>();

    /// Binds `name` to `value`, replacing any earlier binding.
    public void define(String name, String value) {
        values.put(Objects.requireNonNull(name), Objects.requireNonNull(value));
    }

    /// Returns the current value of `name`, if bound.
    public Optional<String> lookup(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public boolean isDefined(String name) {
        return values.containsKey(name);
    }

    /// Returns an immutable copy of all bindings in first-bound order.
    public Map<String, String> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
