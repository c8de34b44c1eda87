package com.fitch.checker.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/** Aborts lexing on the first unrecognized character instead of skipping it. */
final class ThrowingErrorListener extends BaseErrorListener {
    static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

    private ThrowingErrorListener() {}

    @Override
    public void syntaxError(
            Recognizer<?, ?> recognizer,
            Object offendingSymbol,
            int line,
            int charPositionInLine,
            String msg,
            RecognitionException e) {
        throw new PositionedCancellation(
                "line " + line + ":" + (charPositionInLine + 1) + " " + msg, charPositionInLine, e);
    }

    static final class PositionedCancellation extends ParseCancellationException {
        private static final long serialVersionUID = 1L;

        private final int charPositionInLine;

        PositionedCancellation(String message, int charPositionInLine, Throwable cause) {
            super(message, cause);
            this.charPositionInLine = charPositionInLine;
        }

        /** Zero-based offset of the offending character. */
        int getCharPositionInLine() {
            return charPositionInLine;
        }
    }
}
