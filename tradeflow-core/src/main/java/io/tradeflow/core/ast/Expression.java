package io.tradeflow.core.ast;

import java.util.Objects;
import java.util.Optional;

/// Closed set of expression forms the parser can build.
///
/// ### Permitted Subtypes
/// - {@link StringLiteral} - quoted text
/// - {@link NumberLiteral} - decimal number
/// - {@link Identifier} - variable reference
/// - {@link BinaryExpression} - `left op right`, single precedence level
/// - {@link PropertyAccess} - `identifier.property`
/// - {@link StepReference} - `step N` or `step N.property`
///
/// Consumers dispatch through {@link #accept(Visitor)}; adding a subtype breaks
/// every visitor at compile time, which keeps evaluation exhaustive.
///
/// @implNote Thread-safe. All permitted subtypes are immutable records.
public sealed interface Expression
        permits Expression.StringLiteral,
                Expression.NumberLiteral,
                Expression.Identifier,
                Expression.BinaryExpression,
                Expression.PropertyAccess,
                Expression.StepReference {

    /// Dispatches to the visitor method for this expression's concrete type.
    ///
    /// @param <R> visitor result type
    /// @param visitor the visitor, not null
    /// @return whatever the visitor returns
    <R> R accept(Visitor<R> visitor);

    /// Exhaustive callback set over every {@link Expression} subtype.
    ///
    /// @param <R> result type
    interface Visitor<R> {
        R visitString(StringLiteral literal);

        R visitNumber(NumberLiteral literal);

        R visitIdentifier(Identifier identifier);

        R visitBinary(BinaryExpression binary);

        R visitPropertyAccess(PropertyAccess access);

        R visitStepReference(StepReference reference);
    }

    /// Quoted text; `value` is the body without the quotes.
    record StringLiteral(String value) implements Expression {

        public StringLiteral {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitString(this);
        }
    }

    /// Numeric literal, stored as a double.
    record NumberLiteral(double value) implements Expression {

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNumber(this);
        }
    }

    /// Reference to a variable bound in the environment.
    record Identifier(String name) implements Expression {

        public Identifier {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIdentifier(this);
        }
    }

    /// Binary operation. `operator` holds the operator lexeme (`+`, `==`, `>=`, ...).
    record BinaryExpression(Expression left, String operator, Expression right)
            implements Expression {

        public BinaryExpression {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        /// Returns whether the operator is one of `== != > < >= <=`.
        public boolean isComparison() {
            return BinaryOperator.fromSymbol(operator)
                    .map(BinaryOperator::isComparison)
                    .orElse(false);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinary(this);
        }
    }

    /// `object.property` projection.
    record PropertyAccess(Expression object, String property) implements Expression {

        public PropertyAccess {
            Objects.requireNonNull(object, "object must not be null");
            Objects.requireNonNull(property, "property must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPropertyAccess(this);
        }
    }

    /// Reads a field of an earlier step's result.
    ///
    /// @param stepId referenced step id
    /// @param property `status`, `data`, `message`, `success` or any other name
    ///        (falls back to `data`); null when omitted
    record StepReference(int stepId, String property) implements Expression {

        /// Returns the property name, if one was written.
        public Optional<String> propertyName() {
            return Optional.ofNullable(property);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStepReference(this);
        }
    }
}
