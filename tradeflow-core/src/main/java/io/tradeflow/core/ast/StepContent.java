package io.tradeflow.core.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// What a {@link Step} does: run a command or branch on a condition.
///
/// ### Permitted Subtypes
/// - {@link Command} - named operation with argument expressions
/// - {@link Conditional} - `if (...) { ... } else { ... }`
///
/// @implNote Thread-safe. All permitted subtypes are immutable records.
public sealed interface StepContent permits StepContent.Command, StepContent.Conditional {

    <R> R accept(Visitor<R> visitor);

    /// Exhaustive callback set over every {@link StepContent} subtype.
    ///
    /// @param <R> result type
    interface Visitor<R> {
        R visitCommand(Command command);

        R visitConditional(Conditional conditional);
    }

    /// Named command; `arguments` are evaluated left to right before dispatch.
    ///
    /// @param name command name, not null
    /// @param arguments argument expressions, copied to an immutable list
    record Command(String name, List<Expression> arguments) implements StepContent {

        public Command {
            Objects.requireNonNull(name, "name must not be null");
            arguments = arguments != null ? List.copyOf(arguments) : List.of();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCommand(this);
        }
    }

    /// Two-way branch.
    ///
    /// @param condition branch condition, not null
    /// @param ifSteps steps run when the condition holds, copied to an immutable list
    /// @param elseSteps steps run otherwise; null when the source has no `else` block
    record Conditional(Expression condition, List<Step> ifSteps, List<Step> elseSteps)
            implements StepContent {

        public Conditional {
            Objects.requireNonNull(condition, "condition must not be null");
            ifSteps = ifSteps != null ? List.copyOf(ifSteps) : List.of();
            elseSteps = elseSteps != null ? List.copyOf(elseSteps) : null;
        }

        /// Returns the else-branch, empty when no `else` block was written.
        public Optional<List<Step>> elseBranch() {
            return Optional.ofNullable(elseSteps);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConditional(this);
        }
    }
}
