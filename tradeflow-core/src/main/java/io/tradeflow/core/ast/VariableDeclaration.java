package io.tradeflow.core.ast;

import java.util.Objects;

/// Top-level `let` / `var` / `const` binding.
///
/// @param kind declaration keyword, not null
/// @param name variable name, not null
/// @param value expression evaluated once when the declaration runs, not null
public record VariableDeclaration(DeclarationKind kind, String name, Expression value) {

    public VariableDeclaration {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }
}
