package io.tradeflow.core;

import io.tradeflow.core.ast.Program;
import io.tradeflow.core.execution.ExecutionResult;
import io.tradeflow.core.lexer.LexException;
import io.tradeflow.core.lexer.Lexer;
import io.tradeflow.core.lexer.Token;
import io.tradeflow.core.parser.ParseException;
import io.tradeflow.core.parser.Parser;
import java.util.List;

/// Entry points for the three phases of running TradeFlow source.
///
/// {@snippet :
/// List<Token> tokens = TradeFlow.tokenize(source);
/// Program program = TradeFlow.parse(tokens);
/// ExecutionResult result = TradeFlowFactory.createEnvironment().newExecutor().execute(program);
/// }
///
/// Each call works on fresh state; the methods are safe to call concurrently.
public final class TradeFlow {

    private TradeFlow() {}

    /// Tokenizes source text.
    ///
    /// @param source program text, not null
    /// @return tokens ending with `EOF`, never null
    /// @throws LexException on the first lexical error
    public static List<Token> tokenize(String source) {
        return new Lexer(source).tokenize();
    }

    /// Parses a token stream.
    ///
    /// @param tokens tokens from {@link #tokenize(String)}, not null
    /// @return the program, never null
    /// @throws ParseException on the first grammar error
    public static Program parse(List<Token> tokens) {
        return new Parser(tokens).parse();
    }

    /// Tokenizes and parses source text. Lexing completes before parsing starts.
    ///
    /// @param source program text, not null
    /// @return the program, never null
    /// @throws LexException on the first lexical error
    /// @throws ParseException on the first grammar error
    public static Program parse(String source) {
        return parse(tokenize(source));
    }

    /// Parses and runs source text with the default environment.
    ///
    /// @param source program text, not null
    /// @return the completed run, never null
    /// @throws io.tradeflow.core.exception.TradeFlowException on any fatal error
    public static ExecutionResult run(String source) {
        return TradeFlowFactory.createEnvironment().newExecutor().execute(parse(source));
    }
}
