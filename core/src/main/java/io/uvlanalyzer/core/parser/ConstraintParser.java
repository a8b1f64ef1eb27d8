package io.uvlanalyzer.core.parser;

import io.uvlanalyzer.core.error.ConstraintSyntaxException;
import io.uvlanalyzer.core.model.Expression;
import io.uvlanalyzer.core.parser.ConstraintLexer.Kind;
import io.uvlanalyzer.core.parser.ConstraintLexer.Token;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for UVL propositional constraints.
 *
 * <p>
 * Precedence, loosest first: {@code <=>}, then {@code =>} / {@code requires} /
 * {@code excludes} (right-associative), then {@code |}, then {@code &}, then prefix {@code !}.
 * {@code A excludes B} reads as {@code A => !B}. Feature names are not resolved here; the
 * caller checks them against the tree.
 */
public final class ConstraintParser {

    private final List<Token> tokens;
    private final int line;
    private int position;

    private ConstraintParser(List<Token> tokens, int line) {
        this.tokens = tokens;
        this.line = line;
    }

    /**
     * Parses one constraint.
     *
     * @param text constraint text
     * @param line 1-based source line, used in error messages
     * @return the expression
     * @throws ConstraintSyntaxException if the text is not a well-formed constraint
     */
    public static Expression parse(String text, int line) {
        ConstraintParser parser = new ConstraintParser(ConstraintLexer.tokenize(text, line), line);
        if (parser.peek().kind() == Kind.EOF) {
            throw new ConstraintSyntaxException("Empty constraint", line, 1);
        }
        Expression expression = parser.equivalence();
        Token trailing = parser.peek();
        if (trailing.kind() != Kind.EOF) {
            throw parser.unexpected(trailing, "end of constraint");
        }
        return expression;
    }

    private Expression equivalence() {
        Expression left = implication();
        while (peek().kind() == Kind.EQUIVALENT) {
            position++;
            left = new Expression.Equivalent(left, implication());
        }
        return left;
    }

    private Expression implication() {
        Expression left = disjunction();
        Kind kind = peek().kind();
        if (kind == Kind.IMPLIES || kind == Kind.REQUIRES) {
            position++;
            return new Expression.Implies(left, implication());
        }
        if (kind == Kind.EXCLUDES) {
            position++;
            return new Expression.Implies(left, new Expression.Not(implication()));
        }
        return left;
    }

    private Expression disjunction() {
        List<Expression> operands = new ArrayList<>();
        operands.add(conjunction());
        while (peek().kind() == Kind.OR) {
            position++;
            operands.add(conjunction());
        }
        return operands.size() == 1 ? operands.get(0) : new Expression.Or(operands);
    }

    private Expression conjunction() {
        List<Expression> operands = new ArrayList<>();
        operands.add(unary());
        while (peek().kind() == Kind.AND) {
            position++;
            operands.add(unary());
        }
        return operands.size() == 1 ? operands.get(0) : new Expression.And(operands);
    }

    private Expression unary() {
        if (peek().kind() == Kind.NOT) {
            position++;
            return new Expression.Not(unary());
        }
        return primary();
    }

    private Expression primary() {
        Token token = peek();
        switch (token.kind()) {
            case NAME -> {
                position++;
                return new Expression.Literal(token.text());
            }
            case TRUE -> {
                position++;
                return Expression.Constant.TRUE;
            }
            case FALSE -> {
                position++;
                return Expression.Constant.FALSE;
            }
            case LPAREN -> {
                position++;
                Expression inner = equivalence();
                Token closing = peek();
                if (closing.kind() != Kind.RPAREN) {
                    throw unexpected(closing, "')'");
                }
                position++;
                return inner;
            }
            default -> throw unexpected(token, "a feature name, 'true', 'false', '!' or '('");
        }
    }

    private Token peek() {
        return tokens.get(position);
    }

    private ConstraintSyntaxException unexpected(Token token, String expected) {
        String found = token.kind() == Kind.EOF ? "end of constraint" : "'" + token.text() + "'";
        return new ConstraintSyntaxException("Expected " + expected + " but found " + found, line, token.column());
    }
}
