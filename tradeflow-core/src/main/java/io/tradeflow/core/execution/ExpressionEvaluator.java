package io.tradeflow.core.execution;

import io.tradeflow.core.ast.BinaryOperator;
import io.tradeflow.core.ast.Expression;
import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Evaluates expressions to strings and conditions to booleans.
///
/// Reads the {@link Environment} and {@link StepResultTable} of the current run
/// but never writes to either.
///
/// ### String evaluation
/// - string literal: its text
/// - number literal: canonical decimal form (`200`, `0.5`)
/// - identifier: bound value, else {@link UndefinedVariableException}
/// - `a + b`: concatenation; any other operator: {@link UnknownOperatorException}
/// - `x.prop`: the simulated projection `"<x>.prop"`
/// - `step N.prop`: property of step N's result, else {@link StepNotFoundException}
///
/// ### Condition evaluation
/// A top-level comparison is evaluated structurally: `==` / `!=` compare the
/// operand strings, `>` `<` `>=` `<=` compare them as doubles with unparsable
/// operands read as `0.0`. An operand is a number only when it is plain
/// decimal notation with an optional exponent (`7`, `-1.5`, `.5`, `2e3`) or
/// `inf`, `infinity` or `nan` in any case, optionally signed. Surrounding
/// whitespace, type suffixes (`10d`) and hex forms make it unparsable. Anything else is evaluated as a string and is true
/// unless it is `""`, `"0"` or `"false"`.
///
/// @implNote **Not thread-safe**. Shares the run's mutable state.
public final class ExpressionEvaluator implements Expression.Visitor<String> {

    private static final Pattern DECIMAL =
            Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern SPECIAL =
            Pattern.compile("([+-]?)(inf|infinity|nan)", Pattern.CASE_INSENSITIVE);

    private final Environment environment;
    private final StepResultTable stepResults;

    public ExpressionEvaluator(Environment environment, StepResultTable stepResults) {
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
        this.stepResults = Objects.requireNonNull(stepResults, "stepResults must not be null");
    }

    /// Evaluates an expression to its string value.
    ///
    /// @param expression expression to evaluate, not null
    /// @return the value, never null
    /// @throws WorkflowRuntimeException on an undefined variable, a missing step
    ///         result or an operator that cannot produce a string
    public String evaluate(Expression expression) {
        return expression.accept(this);
    }

    /// Evaluates an expression as a branch condition.
    ///
    /// @param condition condition expression, not null
    /// @return whether the if-branch should run
    /// @throws WorkflowRuntimeException as for {@link #evaluate(Expression)}
    public boolean test(Expression condition) {
        if (condition instanceof Expression.BinaryExpression binary) {
            Optional<BinaryOperator> operator = BinaryOperator.fromSymbol(binary.operator());
            if (operator.isPresent() && operator.get().isComparison()) {
                return compare(
                        operator.get(), evaluate(binary.left()), evaluate(binary.right()));
            }
        }
        return isTruthy(evaluate(condition));
    }

    /// Returns whether a string value counts as true.
    public static boolean isTruthy(String value) {
        return !value.isEmpty() && !"0".equals(value) && !"false".equals(value);
    }

    /// Renders a number the way number literals evaluate: integral values
    /// without a fraction, others in shortest decimal form.
    public static String formatNumber(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /// Parses a comparison operand; anything that is not a number reads as `0.0`.
    public static double toNumber(String value) {
        if (DECIMAL.matcher(value).matches()) {
            return Double.parseDouble(value);
        }
        Matcher special = SPECIAL.matcher(value);
        if (!special.matches()) {
            return 0.0;
        }
        if (special.group(2).equalsIgnoreCase("nan")) {
            return Double.NaN;
        }
        return "-".equals(special.group(1)) ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
    }

    private static boolean compare(BinaryOperator operator, String left, String right) {
        return switch (operator) {
            case EQUAL -> left.equals(right);
            case NOT_EQUAL -> !left.equals(right);
            case GREATER -> toNumber(left) > toNumber(right);
            case LESS -> toNumber(left) < toNumber(right);
            case GREATER_EQUAL -> toNumber(left) >= toNumber(right);
            case LESS_EQUAL -> toNumber(left) <= toNumber(right);
            case CONCAT -> throw new UnknownOperatorException(operator.symbol());
        };
    }

    @Override
    public String visitString(Expression.StringLiteral literal) {
        return literal.value();
    }

    @Override
    public String visitNumber(Expression.NumberLiteral literal) {
        return formatNumber(literal.value());
    }

    @Override
    public String visitIdentifier(Expression.Identifier identifier) {
        return environment
                .lookup(identifier.name())
                .orElseThrow(() -> new UndefinedVariableException(identifier.name()));
    }

    @Override
    public String visitBinary(Expression.BinaryExpression binary) {
        String left = evaluate(binary.left());
        String right = evaluate(binary.right());
        if (BinaryOperator.CONCAT.symbol().equals(binary.operator())) {
            return left + right;
        }
        throw new UnknownOperatorException(binary.operator());
    }

    @Override
    public String visitPropertyAccess(Expression.PropertyAccess access) {
        return evaluate(access.object()) + "." + access.property();
    }

    @Override
    public String visitStepReference(Expression.StepReference reference) {
        return stepResults
                .get(reference.stepId())
                .map(result -> result.property(reference.property()))
                .orElseThrow(() -> new StepNotFoundException(reference.stepId()));
    }
}
