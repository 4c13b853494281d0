package io.tradeflow.core.ast;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProgramTest {

    private static Step log(int id) {
        return new Step(id, new StepContent.Command("log", List.of()));
    }

    @Test
    void shouldCountNestedSteps() {
        Step conditional =
                new Step(
                        2,
                        new StepContent.Conditional(
                                new Expression.Identifier("a"), List.of(log(3)), List.of(log(4))));
        Program program =
                new Program(List.of(), List.of(new Workflow("W", List.of(log(1), conditional))));

        assertThat(program.stepCount()).isEqualTo(4);
    }

    @Test
    void shouldCopyStepListsDefensively() {
        List<Step> steps = new ArrayList<>(List.of(log(1)));
        Workflow workflow = new Workflow("W", steps);

        steps.add(log(2));

        assertThat(workflow.steps()).hasSize(1);
    }

    @Test
    void shouldRejectNegativeStepId() {
        assertThatThrownBy(() -> log(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldExposeMissingElseAsEmptyOptional() {
        StepContent.Conditional conditional =
                new StepContent.Conditional(new Expression.Identifier("a"), List.of(), null);

        assertThat(conditional.elseBranch()).isEmpty();
        assertThat(conditional.elseSteps()).isNull();
    }

    @Test
    void shouldMapOperatorSymbols() {
        assertThat(BinaryOperator.fromSymbol(">=")).contains(BinaryOperator.GREATER_EQUAL);
        assertThat(BinaryOperator.fromSymbol("+")).hasValueSatisfying(
                op -> assertThat(op.isComparison()).isFalse());
        assertThat(BinaryOperator.fromSymbol("*")).isEmpty();
    }

    @Test
    void shouldMapDeclarationKeywords() {
        assertThat(DeclarationKind.fromKeyword("const")).isEqualTo(DeclarationKind.CONST);
        assertThat(DeclarationKind.VAR.keyword()).isEqualTo("var");
    }
}
