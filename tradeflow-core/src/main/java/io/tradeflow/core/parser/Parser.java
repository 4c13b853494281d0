package io.tradeflow.core.parser;

import io.tradeflow.core.ast.DeclarationKind;
import io.tradeflow.core.ast.Expression;
import io.tradeflow.core.ast.Program;
import io.tradeflow.core.ast.Step;
import io.tradeflow.core.ast.StepContent;
import io.tradeflow.core.ast.VariableDeclaration;
import io.tradeflow.core.ast.Workflow;
import io.tradeflow.core.lexer.Token;
import io.tradeflow.core.lexer.TokenType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Recursive-descent parser for TradeFlow.
///
/// One token of lookahead, no backtracking, no error recovery.
///
/// ### Grammar
/// ```
/// Program      := (VariableDecl | Workflow)*
/// Workflow     := "workflow" STRING "{" Step* "}"
/// Step         := "step" NUMBER ":" (Conditional | Command)
/// Command      := IDENT [ "(" (Expr ("," Expr)*)? ")" ]
/// Conditional  := "if" "(" Expr ")" "{" Step* "}" [ "else" "{" Step* "}" ]
/// VariableDecl := ("let"|"var"|"const") IDENT "=" Expr
/// Expr         := Primary (BINOP Primary)*
/// Primary      := STRING | NUMBER | IDENT [ "." IDENT ] | "step" NUMBER [ "." IDENT ]
/// ```
///
/// The reserved command words (`print`, `log`, `fetch`, `send_email`,
/// `notify`) are accepted as command names. All binary operators share one
/// precedence level, so `a + b == c` groups as `(a + b) == c` and
/// `a == b == c` as `(a == b) == c`.
///
/// @implNote **Not thread-safe**. Holds a cursor into its token list; parse once.
public final class Parser {

    private final List<Token> tokens;
    private int current;

    /// @param tokens token stream ending with `EOF`, as produced by
    ///        {@link io.tradeflow.core.lexer.Lexer#tokenize()}, not null
    public Parser(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            List<Token> terminated = new ArrayList<>(tokens);
            int line = tokens.isEmpty() ? 1 : tokens.get(tokens.size() - 1).line();
            terminated.add(Token.of(TokenType.EOF, "", line));
            this.tokens = List.copyOf(terminated);
        } else {
            this.tokens = List.copyOf(tokens);
        }
    }

    /// Parses the full token stream.
    ///
    /// @return the program, never null
    /// @throws ParseException on the first token that does not fit the grammar
    public Program parse() {
        List<VariableDeclaration> variables = new ArrayList<>();
        List<Workflow> workflows = new ArrayList<>();

        while (!isAtEnd()) {
            TokenType type = peek().type();
            if (type == TokenType.WORKFLOW) {
                workflows.add(workflow());
            } else if (isDeclarationKeyword(type)) {
                variables.add(variableDeclaration());
            } else {
                throw error("Expected workflow or variable declaration");
            }
        }
        return new Program(variables, workflows);
    }

    private Workflow workflow() {
        consume(TokenType.WORKFLOW, "Expected 'workflow'");
        String name = consume(TokenType.STRING, "Expected workflow name").literal();
        consume(TokenType.LEFT_BRACE, "Expected '{' after workflow name");
        List<Step> steps = block("Expected '}' after workflow body");
        return new Workflow(name, steps);
    }

    private List<Step> block(String closingMessage) {
        List<Step> steps = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            steps.add(step());
        }
        consume(TokenType.RIGHT_BRACE, closingMessage);
        return steps;
    }

    private Step step() {
        consume(TokenType.STEP, "Expected 'step'");
        int id = stepId("Expected step number");
        consume(TokenType.COLON, "Expected ':' after step number");

        StepContent content = check(TokenType.IF) ? conditional() : command();
        return new Step(id, content);
    }

    private StepContent.Command command() {
        Token name = peek();
        if (name.type() != TokenType.IDENTIFIER && !name.type().isCommandKeyword()) {
            throw error("Expected command name");
        }
        advance();

        List<Expression> arguments = new ArrayList<>();
        if (match(TokenType.LEFT_PAREN)) {
            if (!check(TokenType.RIGHT_PAREN)) {
                do {
                    arguments.add(expression());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_PAREN, "Expected ')' after command arguments");
        }
        return new StepContent.Command(name.lexeme(), arguments);
    }

    private StepContent.Conditional conditional() {
        consume(TokenType.IF, "Expected 'if'");
        consume(TokenType.LEFT_PAREN, "Expected '(' after 'if'");
        Expression condition = expression();
        consume(TokenType.RIGHT_PAREN, "Expected ')' after condition");

        consume(TokenType.LEFT_BRACE, "Expected '{' after condition");
        List<Step> ifSteps = block("Expected '}' after if block");

        List<Step> elseSteps = null;
        if (match(TokenType.ELSE)) {
            consume(TokenType.LEFT_BRACE, "Expected '{' after 'else'");
            elseSteps = block("Expected '}' after else block");
        }
        return new StepContent.Conditional(condition, ifSteps, elseSteps);
    }

    private VariableDeclaration variableDeclaration() {
        DeclarationKind kind = DeclarationKind.fromKeyword(advance().lexeme());
        String name = consume(TokenType.IDENTIFIER, "Expected variable name").lexeme();
        consume(TokenType.EQUAL, "Expected '=' after variable name");
        return new VariableDeclaration(kind, name, expression());
    }

    private Expression expression() {
        Expression left = primary();
        while (peek().type().isBinaryOperator()) {
            String operator = advance().lexeme();
            Expression right = primary();
            left = new Expression.BinaryExpression(left, operator, right);
        }
        return left;
    }

    private Expression primary() {
        Token token = peek();
        switch (token.type()) {
            case STRING -> {
                advance();
                return new Expression.StringLiteral(token.literal());
            }
            case NUMBER -> {
                advance();
                return new Expression.NumberLiteral(Double.parseDouble(token.lexeme()));
            }
            case IDENTIFIER -> {
                advance();
                Expression identifier = new Expression.Identifier(token.lexeme());
                if (match(TokenType.DOT)) {
                    String property =
                            consume(TokenType.IDENTIFIER, "Expected property name after '.'")
                                    .lexeme();
                    return new Expression.PropertyAccess(identifier, property);
                }
                return identifier;
            }
            case STEP -> {
                advance();
                int stepId = stepId("Expected step number after 'step'");
                String property = null;
                if (match(TokenType.DOT)) {
                    property =
                            consume(TokenType.IDENTIFIER, "Expected property name after '.'")
                                    .lexeme();
                }
                return new Expression.StepReference(stepId, property);
            }
            default -> throw error("Expected expression");
        }
    }

    private int stepId(String message) {
        Token token = consume(TokenType.NUMBER, message);
        String lexeme = token.lexeme();
        if (lexeme.contains(".")) {
            throw new ParseException("Step number must be a whole number", token);
        }
        try {
            return Integer.parseInt(lexeme);
        } catch (NumberFormatException e) {
            throw new ParseException("Step number out of range", token);
        }
    }

    // --- Token helpers ---

    private static boolean isDeclarationKeyword(TokenType type) {
        return type == TokenType.LET || type == TokenType.VAR || type == TokenType.CONST;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(message);
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return !isAtEnd() && peek().type() == type;
    }

    private Token advance() {
        Token token = peek();
        if (!isAtEnd()) {
            current++;
        }
        return token;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private ParseException error(String message) {
        return new ParseException(message, peek());
    }
}
