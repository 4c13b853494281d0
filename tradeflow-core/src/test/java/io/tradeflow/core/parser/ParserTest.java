package io.tradeflow.core.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tradeflow.core.ast.DeclarationKind;
import io.tradeflow.core.ast.Expression;
import io.tradeflow.core.ast.Program;
import io.tradeflow.core.ast.Step;
import io.tradeflow.core.ast.StepContent;
import io.tradeflow.core.ast.VariableDeclaration;
import io.tradeflow.core.lexer.Lexer;
import io.tradeflow.core.lexer.Token;
import io.tradeflow.core.lexer.TokenType;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ParserTest {

    private static Program parse(String source) {
        return new Parser(new Lexer(source).tokenize()).parse();
    }

    private static StepContent.Command onlyCommand(Program program) {
        return (StepContent.Command) program.workflows().get(0).steps().get(0).content();
    }

    @Nested
    class ProgramStructure {

        @Test
        void shouldParseEmptySource() {
            Program program = parse("");

            assertThat(program.variables()).isEmpty();
            assertThat(program.workflows()).isEmpty();
        }

        @Test
        void shouldParseEmptyWorkflow() {
            Program program = parse("workflow \"W\" {}");

            assertThat(program.workflows()).hasSize(1);
            assertThat(program.workflows().get(0).name()).isEqualTo("W");
            assertThat(program.workflows().get(0).steps()).isEmpty();
        }

        @Test
        void shouldKeepDeclarationsAndWorkflowsInSourceOrder() {
            Program program =
                    parse(
                            """
                            let a = "1"
                            workflow "First" { step 1: print(a) }
                            var b = 2
                            workflow "Second" { step 2: log(b) }
                            const c = 'three'
                            """);

            assertThat(program.variables())
                    .extracting(VariableDeclaration::name)
                    .containsExactly("a", "b", "c");
            assertThat(program.variables())
                    .extracting(VariableDeclaration::kind)
                    .containsExactly(DeclarationKind.LET, DeclarationKind.VAR, DeclarationKind.CONST);
            assertThat(program.workflows()).extracting(w -> w.name()).containsExactly("First", "Second");
        }

        @Test
        void shouldIgnoreLayout() {
            Program compact = parse("workflow \"W\"{step 1:print(\"x\")step 2:log}");
            Program spread =
                    parse(
                            """
                            workflow "W" {
                                step 1: print("x")
                                step 2: log
                            }
                            """);

            assertThat(compact).isEqualTo(spread);
        }

        @Test
        void shouldProduceEqualTreesForIdenticalSource() {
            String source =
                    "let a = 'x' workflow \"W\" { step 1: fetch(a + \"/y\") step 2: if (step 1.status == 200) { step 3: print(step 1) } }";

            assertThat(parse(source)).isEqualTo(parse(source));
        }
    }

    @Nested
    class Commands {

        @Test
        void shouldAcceptBuiltInCommandKeywordsAsNames() {
            Program program =
                    parse(
                            "workflow \"W\" { step 1: print(\"a\") step 2: log(\"b\") step 3: fetch(\"u\")"
                                    + " step 4: send_email(\"t\", \"s\") step 5: notify(\"n\") }");

            assertThat(program.workflows().get(0).steps())
                    .extracting(s -> ((StepContent.Command) s.content()).name())
                    .containsExactly("print", "log", "fetch", "send_email", "notify");
        }

        @Test
        void shouldAcceptIdentifierCommandWithoutParentheses() {
            StepContent.Command command = onlyCommand(parse("workflow \"W\" { step 1: bogus }"));

            assertThat(command.name()).isEqualTo("bogus");
            assertThat(command.arguments()).isEmpty();
        }

        @Test
        void shouldParseEmptyArgumentList() {
            StepContent.Command command = onlyCommand(parse("workflow \"W\" { step 1: bogus() }"));

            assertThat(command.arguments()).isEmpty();
        }

        @Test
        void shouldParseMultipleArguments() {
            StepContent.Command command =
                    onlyCommand(parse("workflow \"W\" { step 7: generate(\"p\", model, 0.7) }"));

            assertThat(command.arguments())
                    .containsExactly(
                            new Expression.StringLiteral("p"),
                            new Expression.Identifier("model"),
                            new Expression.NumberLiteral(0.7));
        }

        @Test
        void shouldRecordDeclaredStepId() {
            Step step = parse("workflow \"W\" { step 42: log }").workflows().get(0).steps().get(0);

            assertThat(step.id()).isEqualTo(42);
        }

        @Test
        void shouldRejectFractionalStepId() {
            assertThatThrownBy(() -> parse("workflow \"W\" { step 1.5: log }"))
                    .isInstanceOf(ParseException.class)
                    .hasMessageContaining("whole number");
        }

        @Test
        void shouldRejectTrailingComma() {
            assertThatThrownBy(() -> parse("workflow \"W\" { step 1: print(\"a\",) }"))
                    .isInstanceOf(ParseException.class)
                    .hasMessageContaining("Expected expression");
        }
    }

    @Nested
    class Expressions {

        @Test
        void shouldChainOperatorsLeftToRightAtOnePrecedence() {
            StepContent.Command command =
                    onlyCommand(parse("workflow \"W\" { step 1: print(a + \"b\" == c) }"));

            Expression expected =
                    new Expression.BinaryExpression(
                            new Expression.BinaryExpression(
                                    new Expression.Identifier("a"),
                                    "+",
                                    new Expression.StringLiteral("b")),
                            "==",
                            new Expression.Identifier("c"));
            assertThat(command.arguments()).containsExactly(expected);
        }

        @Test
        void shouldParseChainedComparisonStructurally() {
            VariableDeclaration declaration = parse("let x = a == b == c").variables().get(0);

            Expression.BinaryExpression outer = (Expression.BinaryExpression) declaration.value();
            assertThat(outer.operator()).isEqualTo("==");
            assertThat(outer.left()).isInstanceOf(Expression.BinaryExpression.class);
            assertThat(outer.right()).isEqualTo(new Expression.Identifier("c"));
        }

        @Test
        void shouldParsePropertyAccess() {
            VariableDeclaration declaration = parse("let x = user.name").variables().get(0);

            assertThat(declaration.value())
                    .isEqualTo(
                            new Expression.PropertyAccess(new Expression.Identifier("user"), "name"));
        }

        @Test
        void shouldParseStepReferenceWithAndWithoutProperty() {
            StepContent.Command command =
                    onlyCommand(parse("workflow \"W\" { step 2: print(step 1, step 1.status) }"));

            assertThat(command.arguments())
                    .containsExactly(
                            new Expression.StepReference(1, null),
                            new Expression.StepReference(1, "status"));
        }

        @Test
        void shouldRejectKeywordAsPropertyName() {
            assertThatThrownBy(() -> parse("let x = step 1.if"))
                    .isInstanceOf(ParseException.class)
                    .hasMessageContaining("Expected property name");
        }

        @Test
        void shouldRejectDanglingOperator() {
            assertThatThrownBy(() -> parse("let x = \"a\" +"))
                    .isInstanceOfSatisfying(
                            ParseException.class,
                            e -> {
                                assertThat(e.getMessage()).contains("Expected expression");
                                assertThat(e.getToken().type()).isEqualTo(TokenType.EOF);
                            });
        }
    }

    @Nested
    class Conditionals {

        @Test
        void shouldParseIfWithoutElse() {
            Program program =
                    parse("workflow \"W\" { step 1: if (a) { step 2: print(\"yes\") } }");

            StepContent.Conditional conditional =
                    (StepContent.Conditional) program.workflows().get(0).steps().get(0).content();
            assertThat(conditional.condition()).isEqualTo(new Expression.Identifier("a"));
            assertThat(conditional.ifSteps()).extracting(Step::id).containsExactly(2);
            assertThat(conditional.elseBranch()).isEmpty();
        }

        @Test
        void shouldParseIfElseWithNestedConditional() {
            Program program =
                    parse(
                            """
                            workflow "W" {
                              step 1: fetch("u")
                              step 2: if (step 1.status == 200) {
                                step 3: if (step 1.success) { step 4: print("deep") }
                              } else {
                                step 5: print("bad")
                              }
                            }
                            """);

            StepContent.Conditional outer =
                    (StepContent.Conditional) program.workflows().get(0).steps().get(1).content();
            assertThat(outer.ifSteps().get(0).content())
                    .isInstanceOf(StepContent.Conditional.class);
            assertThat(outer.elseBranch()).hasValueSatisfying(
                    steps -> assertThat(steps).extracting(Step::id).containsExactly(5));
            assertThat(program.stepCount()).isEqualTo(5);
        }

        @Test
        void shouldDistinguishEmptyElseFromMissingElse() {
            Program program = parse("workflow \"W\" { step 1: if (a) { } else { } }");

            StepContent.Conditional conditional =
                    (StepContent.Conditional) program.workflows().get(0).steps().get(0).content();
            assertThat(conditional.elseBranch()).contains(List.of());
        }
    }

    @Nested
    class Errors {

        @Test
        void shouldRejectTopLevelStep() {
            assertThatThrownBy(() -> parse("step 1: print(\"x\")"))
                    .isInstanceOf(ParseException.class)
                    .hasMessageContaining("Expected workflow or variable declaration");
        }

        @Test
        void shouldRequireQuotedWorkflowName() {
            assertThatThrownBy(() -> parse("workflow W {}"))
                    .isInstanceOf(ParseException.class)
                    .hasMessageContaining("Expected workflow name")
                    .hasMessageContaining("'W'");
        }

        @Test
        void shouldReportMissingClosingBrace() {
            assertThatThrownBy(() -> parse("workflow \"W\" { step 1: log"))
                    .isInstanceOf(ParseException.class)
                    .hasMessageContaining("Expected '}' after workflow body")
                    .hasMessageContaining("end of input");
        }

        @Test
        void shouldReportMissingColon() {
            assertThatThrownBy(() -> parse("workflow \"W\" {\n step 1 print(\"x\") }"))
                    .isInstanceOfSatisfying(
                            ParseException.class,
                            e -> {
                                assertThat(e.getMessage()).contains("Expected ':'");
                                assertThat(e.getLine()).isEqualTo(2);
                            });
        }

        @Test
        void shouldRejectSemicolonBecauseGrammarNeverUsesIt() {
            assertThatThrownBy(() -> parse("let a = 1;"))
                    .isInstanceOf(ParseException.class);
        }

        @Test
        void shouldRejectKeywordAsVariableName() {
            assertThatThrownBy(() -> parse("let print = 1"))
                    .isInstanceOf(ParseException.class)
                    .hasMessageContaining("Expected variable name");
        }

        @Test
        void shouldStopAtFirstError() {
            assertThatThrownBy(() -> parse("workflow {} workflow W {}"))
                    .isInstanceOfSatisfying(
                            ParseException.class,
                            e -> assertThat(e.getToken().type()).isEqualTo(TokenType.LEFT_BRACE));
        }

        @Test
        void shouldTerminateStreamWithoutEof() {
            List<Token> tokens =
                    List.of(
                            Token.of(TokenType.LET, "let", 1),
                            Token.of(TokenType.IDENTIFIER, "a", 1),
                            Token.of(TokenType.EQUAL, "=", 1),
                            new Token(TokenType.NUMBER, "1", "1", 1));

            Program program = new Parser(tokens).parse();

            assertThat(program.variables()).hasSize(1);
        }
    }
}
