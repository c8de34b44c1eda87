package com.fitch.checker.parser;

import com.fitch.checker.parser.grammar.FormulaLexer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;
import org.antlr.v4.runtime.Token;

public final class DebugFlags {
    private static final Logger LOGGER = Logger.getLogger(DebugFlags.class.getName());
    private static final String TOKENS_PROPERTY = "fitch.checker.debugTokens";
    /** Environment fallback kept for convenience; prefer using system properties. */
    private static final String TOKENS_ENV = "FITCH_CHECKER_DEBUG_TOKENS";
    private static final ThreadLocal<List<String>> CAPTURED_TOKENS =
            ThreadLocal.withInitial(ArrayList::new);

    private DebugFlags() {}

    public static boolean isTokenDebugEnabled() {
        String value = System.getProperty(TOKENS_PROPERTY);
        if (value != null) {
            return Boolean.parseBoolean(value);
        }
        return Boolean.parseBoolean(System.getenv(TOKENS_ENV));
    }

    static void logTokens(List<? extends Token> tokens, FormulaLexer lexer, int startColumn) {
        StringBuilder dump = new StringBuilder("Token dump for debugging:");
        for (Token token : tokens) {
            String symbolic =
                    token.getType() == Token.EOF
                            ? "EOF"
                            : lexer.getVocabulary().getSymbolicName(token.getType());
            if (symbolic == null) {
                symbolic = String.format(Locale.ROOT, "#%d", token.getType());
            }
            String line =
                    String.format(
                            Locale.ROOT,
                            "%-10s @ %-3d -> %s",
                            symbolic,
                            startColumn + token.getCharPositionInLine(),
                            token.getText());
            dump.append(System.lineSeparator()).append("  ").append(line);
            CAPTURED_TOKENS.get().add(line);
        }
        LOGGER.info(dump.toString());
    }

    public static List<String> drainCapturedTokens() {
        List<String> captured = new ArrayList<>(CAPTURED_TOKENS.get());
        CAPTURED_TOKENS.get().clear();
        return captured;
    }
}
