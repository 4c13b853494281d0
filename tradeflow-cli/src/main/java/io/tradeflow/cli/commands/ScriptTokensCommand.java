package io.tradeflow.cli.commands;

import io.tradeflow.cli.exception.ScriptNotFoundException;
import io.tradeflow.core.TradeFlow;
import io.tradeflow.core.lexer.LexException;
import io.tradeflow.core.lexer.Token;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/// Dumps the token stream of a script, one token per line.
///
/// ### Usage
/// ```
/// tradeflow tokens my-script
/// ```
///
/// ### Output Format
/// ```
///    1  WORKFLOW        workflow
///    1  STRING          "W"  W
/// ```
/// Columns are the source line, the token type, the lexeme and, for strings
/// and numbers, the literal value.
@Command(name = "tokens", description = "Print the token stream of a script")
class ScriptTokensCommand extends ScriptCommand {

    @Parameters(index = "0", description = "Script name or path (.flow optional)")
    private String scriptName;

    @Override
    protected void execute() {
        try {
            List<Token> tokens = TradeFlow.tokenize(readScript(resolveScript(scriptName)));
            for (Token token : tokens) {
                String line =
                        String.format("%4d  %-15s %s", token.line(), token.type(), token.lexeme());
                System.out.println(token.literal() != null ? line + "  " + token.literal() : line);
            }
            System.out.println("Tokens: " + tokens.size());
        } catch (LexException e) {
            System.err.println(" [FAIL] Lexing failed: " + e.getMessage());
        } catch (ScriptNotFoundException e) {
            System.err.println(" [FAIL] " + e.getMessage());
        }
    }
}
