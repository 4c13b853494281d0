package io.tradeflow.core.ast;

import java.util.Locale;

/// Keyword a variable was declared with.
///
/// Recorded for tooling only. Every binding is mutable regardless of kind.
public enum DeclarationKind {
    LET,
    VAR,
    CONST;

    /// Returns the source keyword (`let`, `var` or `const`).
    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    /// Resolves a source keyword.
    ///
    /// @throws IllegalArgumentException if `keyword` is not `let`, `var` or `const`
    public static DeclarationKind fromKeyword(String keyword) {
        for (DeclarationKind kind : values()) {
            if (kind.keyword().equals(keyword)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown declaration keyword: " + keyword);
    }
}
