package io.uvlanalyzer.core.parser;

import io.uvlanalyzer.core.error.ConstraintSyntaxException;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits one constraint line into tokens. Feature references are identifiers or double-quoted
 * names; quoted names keep their quotes so that they match the verbatim tree names.
 */
final class ConstraintLexer {

    enum Kind {
        NAME,
        TRUE,
        FALSE,
        NOT,
        AND,
        OR,
        IMPLIES,
        EQUIVALENT,
        REQUIRES,
        EXCLUDES,
        LPAREN,
        RPAREN,
        EOF
    }

    /**
     * @param kind   token kind
     * @param text   token text as written
     * @param column 1-based column within the constraint text
     */
    record Token(Kind kind, String text, int column) {}

    private ConstraintLexer() {
        // utility class
    }

    /**
     * Tokenizes a constraint.
     *
     * @param text constraint text
     * @param line source line, for error reporting
     * @return tokens, terminated by an {@link Kind#EOF} token
     * @throws ConstraintSyntaxException on a character that starts no token
     */
    static List<Token> tokenize(String text, int line) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int length = text.length();
        while (i < length) {
            char c = text.charAt(i);
            int column = i + 1;
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(') {
                tokens.add(new Token(Kind.LPAREN, "(", column));
                i++;
            } else if (c == ')') {
                tokens.add(new Token(Kind.RPAREN, ")", column));
                i++;
            } else if (c == '!') {
                tokens.add(new Token(Kind.NOT, "!", column));
                i++;
            } else if (c == '&') {
                tokens.add(new Token(Kind.AND, "&", column));
                i++;
            } else if (c == '|') {
                tokens.add(new Token(Kind.OR, "|", column));
                i++;
            } else if (text.startsWith("=>", i)) {
                tokens.add(new Token(Kind.IMPLIES, "=>", column));
                i += 2;
            } else if (text.startsWith("<=>", i)) {
                tokens.add(new Token(Kind.EQUIVALENT, "<=>", column));
                i += 3;
            } else if (c == '"') {
                int end = text.indexOf('"', i + 1);
                if (end < 0) {
                    throw new ConstraintSyntaxException("Unterminated quoted feature name", line, column);
                }
                tokens.add(new Token(Kind.NAME, text.substring(i, end + 1), column));
                i = end + 1;
            } else if (isIdentifierChar(c)) {
                int start = i;
                while (i < length && isIdentifierChar(text.charAt(i))) {
                    i++;
                }
                String word = text.substring(start, i);
                tokens.add(new Token(keywordKind(word), word, column));
            } else {
                throw new ConstraintSyntaxException(
                        "Unexpected character '" + c + "' in constraint (only propositional operators are supported)",
                        line,
                        column);
            }
        }
        tokens.add(new Token(Kind.EOF, "", length + 1));
        return tokens;
    }

    /** Characters allowed in an unquoted feature name, here and in the feature tree. */
    static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '-' || c == '$';
    }

    private static Kind keywordKind(String word) {
        return switch (word) {
            case "true" -> Kind.TRUE;
            case "false" -> Kind.FALSE;
            case "requires" -> Kind.REQUIRES;
            case "excludes" -> Kind.EXCLUDES;
            default -> Kind.NAME;
        };
    }
}
