package com.fitch.checker.parser;

import com.fitch.checker.CheckerOptions;
import com.fitch.checker.DiagnosticKind;
import com.fitch.checker.ast.Formula;
import com.fitch.checker.parser.grammar.FormulaLexer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;

/**
 * Recursive-descent parser for propositional formulas, fed by the ANTLR-generated
 * {@link FormulaLexer}.
 *
 * <pre>
 * iff         ::= implication ( "&lt;=&gt;" implication )*        left-associative
 * implication ::= disjunction ( ("=&gt;" | "&lt;=") implication )?  right-associative
 * disjunction ::= conjunction ( "v" conjunction )*            left-associative
 * conjunction ::= negation ( "^" negation )*                  left-associative
 * negation    ::= "-" negation | atom
 * atom        ::= variable | "T" | "_" | "(" iff ")"
 * </pre>
 *
 * <p>Two limits share {@link CheckerOptions#getMaxNestingDepth()}: the number of negations and
 * parenthesized groups open at any point of the text, and the {@link Formula#getDepth() depth}
 * of the tree built, so a long flat chain such as {@code a ^ a ^ ... ^ a} is bounded too. Going
 * past either fails with {@link DiagnosticKind#DEPTH_EXCEEDED}.
 * Instances hold no per-call state and may be shared between threads.</p>
 */
public final class FormulaParser {

    private final int maxNestingDepth;

    public FormulaParser() {
        this(CheckerOptions.defaults());
    }

    public FormulaParser(CheckerOptions options) {
        this.maxNestingDepth = Objects.requireNonNull(options, "options").getMaxNestingDepth();
    }

    public Formula parse(String text) throws ProofParseException {
        return parse(text, 1);
    }

    /**
     * Parses formula text taken from a proof line.
     *
     * @param text the formula text, on a single line
     * @param startColumn 1-based column of {@code text}'s first character in its line, used to
     *     report positions relative to the whole line
     */
    public Formula parse(String text, int startColumn) throws ProofParseException {
        Objects.requireNonNull(text, "text");
        Cursor cursor = new Cursor(tokenize(text, startColumn), startColumn);
        if (cursor.peek() == Token.EOF) {
            throw cursor.error("expected a formula but found nothing");
        }
        Formula formula = cursor.iff();
        if (cursor.peek() != Token.EOF) {
            if (cursor.peek() == FormulaLexer.RPAREN) {
                throw cursor.error("unmatched ')'");
            }
            throw cursor.error("expected an operator or end of formula but found " + cursor.describe());
        }
        return formula;
    }

    private static List<Token> tokenize(String text, int startColumn) throws ProofParseException {
        FormulaLexer lexer = new FormulaLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);
        CommonTokenStream tokens = new CommonTokenStream(lexer);
        try {
            tokens.fill();
        } catch (ThrowingErrorListener.PositionedCancellation ex) {
            int offset = ex.getCharPositionInLine();
            String character = offset < text.length() ? String.valueOf(text.charAt(offset)) : "";
            throw new ProofParseException(
                    DiagnosticKind.SYNTAX_ERROR,
                    startColumn + offset,
                    "unexpected character '" + character + "'",
                    ex);
        }
        if (DebugFlags.isTokenDebugEnabled()) {
            DebugFlags.logTokens(tokens.getTokens(), lexer, startColumn);
        }
        return new ArrayList<>(tokens.getTokens());
    }

    private final class Cursor {
        private final List<Token> tokens;
        private final int startColumn;
        private int position;
        private int depth;

        Cursor(List<Token> tokens, int startColumn) {
            this.tokens = tokens;
            this.startColumn = startColumn;
        }

        Formula iff() throws ProofParseException {
            Formula left = implication();
            while (peek() == FormulaLexer.IFF) {
                Token operator = advance();
                left = bounded(Formula.iff(left, implication()), operator);
            }
            return left;
        }

        Formula implication() throws ProofParseException {
            // Collected then folded from the right, so long chains do not recurse.
            List<Formula> operands = new ArrayList<>();
            List<Token> operators = new ArrayList<>();
            operands.add(disjunction());
            while (peek() == FormulaLexer.IMPLIES || peek() == FormulaLexer.CONVERSE) {
                operators.add(advance());
                operands.add(disjunction());
            }
            Formula result = operands.get(operands.size() - 1);
            for (int i = operators.size() - 1; i >= 0; i--) {
                Formula left = operands.get(i);
                Token operator = operators.get(i);
                result =
                        bounded(
                                operator.getType() == FormulaLexer.IMPLIES
                                        ? Formula.implies(left, result)
                                        : Formula.converseImplies(left, result),
                                operator);
            }
            return result;
        }

        Formula disjunction() throws ProofParseException {
            Formula left = conjunction();
            while (peek() == FormulaLexer.OR) {
                Token operator = advance();
                left = bounded(Formula.or(left, conjunction()), operator);
            }
            return left;
        }

        Formula conjunction() throws ProofParseException {
            Formula left = negation();
            while (peek() == FormulaLexer.AND) {
                Token operator = advance();
                left = bounded(Formula.and(left, negation()), operator);
            }
            return left;
        }

        Formula negation() throws ProofParseException {
            Token first = current();
            int negations = 0;
            while (peek() == FormulaLexer.NOT) {
                advance();
                enter();
                negations++;
            }
            Formula formula = atom();
            for (int i = 0; i < negations; i++) {
                formula = Formula.not(formula);
            }
            depth -= negations;
            return negations == 0 ? formula : bounded(formula, first);
        }

        Formula atom() throws ProofParseException {
            Token token = current();
            switch (token.getType()) {
                case FormulaLexer.VARIABLE:
                    advance();
                    return Formula.variable(token.getText().charAt(0));
                case FormulaLexer.TOP:
                    advance();
                    return Formula.top();
                case FormulaLexer.BOTTOM:
                    advance();
                    return Formula.bottom();
                case FormulaLexer.LPAREN:
                    advance();
                    if (peek() == FormulaLexer.RPAREN) {
                        throw error("empty parentheses");
                    }
                    enter();
                    Formula inner = iff();
                    if (peek() != FormulaLexer.RPAREN) {
                        throw error("expected ')' to close '(' at column " + columnOf(token)
                                + " but found " + describe());
                    }
                    advance();
                    depth--;
                    return inner;
                case FormulaLexer.OR:
                    throw error("letter 'v' is reserved for disjunction and cannot name a variable");
                case Token.EOF:
                    throw danglingOperatorOr("expected a formula but reached the end");
                default:
                    throw danglingOperatorOr("expected a variable, 'T', '_', '-' or '(' but found " + describe());
            }
        }

        private ProofParseException danglingOperatorOr(String fallback) {
            if (position > 0) {
                Token previous = tokens.get(position - 1);
                int type = previous.getType();
                if (type != FormulaLexer.LPAREN && type != FormulaLexer.NOT) {
                    return error("operator '" + previous.getText() + "' at column " + columnOf(previous)
                            + " has no right-hand side");
                }
            }
            return error(fallback);
        }

        private void enter() throws ProofParseException {
            depth++;
            if (depth > maxNestingDepth) {
                throw tooDeep(tokens.get(position - 1));
            }
        }

        private Formula bounded(Formula formula, Token operator) throws ProofParseException {
            if (formula.getDepth() > maxNestingDepth) {
                throw tooDeep(operator);
            }
            return formula;
        }

        private ProofParseException tooDeep(Token token) {
            return new ProofParseException(
                    DiagnosticKind.DEPTH_EXCEEDED,
                    columnOf(token),
                    "formula nests deeper than " + maxNestingDepth + " levels");
        }

        int peek() {
            return current().getType();
        }

        private Token current() {
            return tokens.get(Math.min(position, tokens.size() - 1));
        }

        private Token advance() {
            Token token = current();
            if (position < tokens.size() - 1) {
                position++;
            }
            return token;
        }

        String describe() {
            Token token = current();
            return token.getType() == Token.EOF ? "end of formula" : "'" + token.getText() + "'";
        }

        private int columnOf(Token token) {
            return startColumn + token.getCharPositionInLine();
        }

        ProofParseException error(String message) {
            return new ProofParseException(DiagnosticKind.SYNTAX_ERROR, columnOf(current()), message);
        }
    }
}
