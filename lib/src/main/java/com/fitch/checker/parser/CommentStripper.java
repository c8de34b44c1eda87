package com.fitch.checker.parser;

import com.fitch.checker.DiagnosticKind;

/**
 * Removes {@code (* ... *)} comments. Comments do not nest and may span lines. Every removed
 * character except line breaks is replaced by a space, so the line and column of everything
 * left behind are the same as in the original text.
 */
public final class CommentStripper {
    static final String OPEN = "(*";
    static final String CLOSE = "*)";

    private CommentStripper() {}

    /**
     * @throws UnterminatedCommentException if a comment is still open at the end of the input
     */
    public static String strip(String text) throws UnterminatedCommentException {
        int open = text.indexOf(OPEN);
        if (open < 0) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length());
        int position = 0;
        while (open >= 0) {
            out.append(text, position, open);
            int close = text.indexOf(CLOSE, open + OPEN.length());
            if (close < 0) {
                throw new UnterminatedCommentException(lineOf(text, open), columnOf(text, open));
            }
            int end = close + CLOSE.length();
            for (int i = open; i < end; i++) {
                char c = text.charAt(i);
                out.append(c == '\n' || c == '\r' ? c : ' ');
            }
            position = end;
            open = text.indexOf(OPEN, position);
        }
        out.append(text, position, text.length());
        return out.toString();
    }

    private static int lineOf(String text, int offset) {
        int line = 1;
        for (int i = 0; i < offset; i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    private static int columnOf(String text, int offset) {
        int lineStart = text.lastIndexOf('\n', offset - 1) + 1;
        return offset - lineStart + 1;
    }

    /** Raised when an opening {@code (*} has no matching {@code *)}. */
    public static final class UnterminatedCommentException extends Exception {
        private static final long serialVersionUID = 1L;

        private final int line;
        private final int column;

        UnterminatedCommentException(int line, int column) {
            super("Comment opened at line " + line + ", column " + column + " is never closed");
            this.line = line;
            this.column = column;
        }

        public DiagnosticKind getKind() {
            return DiagnosticKind.UNTERMINATED_COMMENT;
        }

        public int getLine() {
            return line;
        }

        public int getColumn() {
            return column;
        }
    }
}
