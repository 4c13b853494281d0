package io.tradeflow.core.lexer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class LexerTest {

    private static List<TokenType> types(String source) {
        return new Lexer(source).tokenize().stream().map(Token::type).toList();
    }

    @Nested
    class Keywords {

        @Test
        void shouldRecognizeEveryKeyword() {
            List<TokenType> types =
                    types("workflow step let var const if else print log fetch send_email notify");

            assertThat(types)
                    .containsExactly(
                            TokenType.WORKFLOW,
                            TokenType.STEP,
                            TokenType.LET,
                            TokenType.VAR,
                            TokenType.CONST,
                            TokenType.IF,
                            TokenType.ELSE,
                            TokenType.PRINT,
                            TokenType.LOG,
                            TokenType.FETCH,
                            TokenType.SEND_EMAIL,
                            TokenType.NOTIFY,
                            TokenType.EOF);
        }

        @Test
        void shouldTreatKeywordsCaseSensitively() {
            List<Token> tokens = new Lexer("Workflow STEP").tokenize();

            assertThat(tokens.get(0).type()).isEqualTo(TokenType.IDENTIFIER);
            assertThat(tokens.get(0).lexeme()).isEqualTo("Workflow");
            assertThat(tokens.get(1).type()).isEqualTo(TokenType.IDENTIFIER);
        }

        @Test
        void shouldLexIdentifiersWithUnderscoresAndDigits() {
            List<Token> tokens = new Lexer("_user_2 stepper").tokenize();

            assertThat(tokens.get(0).type()).isEqualTo(TokenType.IDENTIFIER);
            assertThat(tokens.get(0).lexeme()).isEqualTo("_user_2");
            assertThat(tokens.get(1).type()).isEqualTo(TokenType.IDENTIFIER);
            assertThat(tokens.get(1).lexeme()).isEqualTo("stepper");
        }
    }

    @Nested
    class Strings {

        @Test
        void shouldStripQuotesIntoLiteral() {
            Token token = new Lexer("\"hello world\"").tokenize().get(0);

            assertThat(token.type()).isEqualTo(TokenType.STRING);
            assertThat(token.lexeme()).isEqualTo("\"hello world\"");
            assertThat(token.literal()).isEqualTo("hello world");
        }

        @Test
        void shouldAcceptSingleQuotes() {
            Token token = new Lexer("'it works'").tokenize().get(0);

            assertThat(token.literal()).isEqualTo("it works");
        }

        @Test
        void shouldKeepOtherQuoteKindInsideString() {
            Token token = new Lexer("\"it's\" 'say \"hi\"'").tokenize().get(0);
            Token second = new Lexer("\"it's\" 'say \"hi\"'").tokenize().get(1);

            assertThat(token.literal()).isEqualTo("it's");
            assertThat(second.literal()).isEqualTo("say \"hi\"");
        }

        @Test
        void shouldCountNewlinesInsideStrings() {
            List<Token> tokens = new Lexer("\"a\nb\" x").tokenize();

            assertThat(tokens.get(0).literal()).isEqualTo("a\nb");
            assertThat(tokens.get(1).line()).isEqualTo(2);
        }

        @Test
        void shouldReportOpeningLineForMultiLineString() {
            List<Token> tokens = new Lexer("let s = \"one\ntwo\nthree\"").tokenize();

            assertThat(tokens.get(3).type()).isEqualTo(TokenType.STRING);
            assertThat(tokens.get(3).line()).isEqualTo(1);
            assertThat(tokens.get(4).line()).isEqualTo(3);
        }

        @Test
        void shouldFailOnUnterminatedString() {
            assertThatThrownBy(() -> new Lexer("print(\"x }").tokenize())
                    .isInstanceOf(LexException.class)
                    .hasMessageContaining("Unterminated string");
        }

        @Test
        void shouldFailWhenClosingQuoteDoesNotMatch() {
            assertThatThrownBy(() -> new Lexer("\"abc'").tokenize())
                    .isInstanceOf(LexException.class)
                    .hasMessageContaining("Unterminated string");
        }

        @Test
        void shouldReportLineWhereStringStarted() {
            assertThatThrownBy(() -> new Lexer("\n\n'open\nstill open").tokenize())
                    .isInstanceOfSatisfying(
                            LexException.class, e -> assertThat(e.getLine()).isEqualTo(3));
        }
    }

    @Nested
    class Numbers {

        @Test
        void shouldLexIntegerAndDecimal() {
            List<Token> tokens = new Lexer("42 3.14").tokenize();

            assertThat(tokens.get(0).type()).isEqualTo(TokenType.NUMBER);
            assertThat(tokens.get(0).literal()).isEqualTo("42");
            assertThat(tokens.get(1).literal()).isEqualTo("3.14");
        }

        @Test
        void shouldNotConsumeTrailingDot() {
            List<TokenType> types = types("1.status");

            assertThat(types)
                    .containsExactly(
                            TokenType.NUMBER, TokenType.DOT, TokenType.IDENTIFIER, TokenType.EOF);
        }
    }

    @Nested
    class Operators {

        @Test
        void shouldLexOneAndTwoCharacterOperators() {
            List<TokenType> types = types("+ = == != > < >= <= .");

            assertThat(types)
                    .containsExactly(
                            TokenType.PLUS,
                            TokenType.EQUAL,
                            TokenType.EQUAL_EQUAL,
                            TokenType.NOT_EQUAL,
                            TokenType.GREATER,
                            TokenType.LESS,
                            TokenType.GREATER_EQUAL,
                            TokenType.LESS_EQUAL,
                            TokenType.DOT,
                            TokenType.EOF);
        }

        @Test
        void shouldLexPunctuationIncludingSemicolon() {
            List<TokenType> types = types("( ) { } : ; ,");

            assertThat(types)
                    .containsExactly(
                            TokenType.LEFT_PAREN,
                            TokenType.RIGHT_PAREN,
                            TokenType.LEFT_BRACE,
                            TokenType.RIGHT_BRACE,
                            TokenType.COLON,
                            TokenType.SEMICOLON,
                            TokenType.COMMA,
                            TokenType.EOF);
        }

        @Test
        void shouldRejectLoneBang() {
            assertThatThrownBy(() -> new Lexer("a ! b").tokenize())
                    .isInstanceOf(LexException.class)
                    .hasMessageContaining("'!'");
        }

        @Test
        void shouldRejectUnknownCharacter() {
            assertThatThrownBy(() -> new Lexer("step 1: print(\"a\")\n  # comment").tokenize())
                    .isInstanceOfSatisfying(
                            LexException.class,
                            e -> {
                                assertThat(e.getMessage()).contains("'#'");
                                assertThat(e.getLine()).isEqualTo(2);
                            });
        }
    }

    @Nested
    class Layout {

        @Test
        void shouldEndEmptySourceWithEof() {
            List<Token> tokens = new Lexer("").tokenize();

            assertThat(tokens).hasSize(1);
            assertThat(tokens.get(0).type()).isEqualTo(TokenType.EOF);
            assertThat(tokens.get(0).line()).isEqualTo(1);
        }

        @Test
        void shouldSkipWhitespaceAndTrackLines() {
            List<Token> tokens = new Lexer("workflow\r\n\t\"W\"\n{\n}").tokenize();

            assertThat(tokens).extracting(Token::line).containsExactly(1, 2, 3, 4, 4);
        }

        @ParameterizedTest
        @ValueSource(strings = {"\u00A0", "\u2007", "\u202F", "\u2003"})
        void shouldSkipUnicodeSpaces(String space) {
            List<Token> tokens = new Lexer("let" + space + "a = 1").tokenize();

            assertThat(tokens)
                    .extracting(Token::type)
                    .containsExactly(
                            TokenType.LET,
                            TokenType.IDENTIFIER,
                            TokenType.EQUAL,
                            TokenType.NUMBER,
                            TokenType.EOF);
        }

        @Test
        void shouldReturnImmutableList() {
            List<Token> tokens = new Lexer("let a = 1").tokenize();

            assertThatThrownBy(() -> tokens.add(Token.of(TokenType.EOF, "", 1)))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }
}
