package moonfmt.lang;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Turns {@link Lexeme}s into {@link Token}s: keywords, word operators and
 * constants are told apart from names, string, comment and number variants
 * collapse into one type each, and operators are checked against the
 * language version.
 */
@RequiredArgsConstructor
final class Reducer {

    private static final Logger logger = LoggerFactory.getLogger(Reducer.class);

    enum Trim {
        /** Keep every token; whitespace and comments are hidden. */
        NONE,
        /** Drop whitespace, keep comments hidden, fold negative numbers. */
        WHITESPACE,
        /** Drop whitespace and comments, fold negative numbers. */
        ALL
    }

    private final int version;
    private final @NonNull Trim trim;

    /**
     * @return the reduced tokens, terminated by an {@link Token.Type#EOF} token
     */
    List<Token> reduce(List<Lexeme> lexemes) {
        var tokens = new ArrayList<Token>(lexemes.size() + 1);
        for (var lexeme : lexemes) {
            var token = classify(lexeme);
            if (trim == Trim.NONE) {
                tokens.add(token);
                continue;
            }
            if (token.type() == Token.Type.WHITESPACE
                    || (trim == Trim.ALL && token.type() == Token.Type.COMMENT)) {
                continue;
            }
            if (token.type() == Token.Type.NUMBER && isNegation(tokens)) {
                var minus = tokens.remove(tokens.size() - 1);
                token = new Token(Token.Type.NUMBER, "-" + token.lexeme(), minus.line(), minus.column(), false);
            }
            tokens.add(token);
        }

        var last = lexemes.isEmpty() ? null : lexemes.get(lexemes.size() - 1);
        tokens.add(eof(last));

        logger.debug("reduced {} lexemes to {} tokens ({} trim)", lexemes.size(), tokens.size(), trim);
        return tokens;
    }

    private Token classify(Lexeme lexeme) {
        var text = lexeme.text();
        var type = lexeme.lexicalClass().getReducedType();
        if (type == null) {
            throw new FormatException(FormatException.Kind.LEXICAL, lexeme.line(), lexeme.column(),
                "invalid characters");
        }

        if (type == Token.Type.NAME) {
            if (Operators.KEYWORDS.contains(text)) {
                type = Token.Type.KEYWORD;
            } else if (Operators.WORD_OPERATORS.contains(text)) {
                type = Token.Type.OPERATOR;
            } else if (Operators.CONSTANTS.contains(text)) {
                type = Token.Type.CONSTANT;
            }
        } else if (type == Token.Type.OPERATOR) {
            if (Operators.ELLIPSIS.equals(text)) {
                type = Token.Type.CONSTANT;
            } else if (!isEnabled(text)) {
                throw new FormatException(FormatException.Kind.OPERATOR, lexeme.line(), lexeme.column(),
                    "invalid operator '" + text + "'");
            }
        }

        var hidden = type == Token.Type.COMMENT || type == Token.Type.WHITESPACE;
        return new Token(type, text, lexeme.line(), lexeme.column(), hidden);
    }

    private boolean isEnabled(String operator) {
        return Operators.OPERATORS.contains(operator)
            || (version >= Operators.BITWISE_VERSION && Operators.BITWISE_OPERATORS.contains(operator));
    }

    /**
     * Whether the last kept token is a {@code -} that can only be a unary
     * minus: the visible token before it is an operator other than a closing
     * bracket, a keyword other than {@code end}, or there is none.
     */
    private static boolean isNegation(List<Token> tokens) {
        if (tokens.isEmpty()) {
            return false;
        }
        var minus = tokens.get(tokens.size() - 1);
        if (minus.type() != Token.Type.OPERATOR || !minus.is("-")) {
            return false;
        }

        Token before = null;
        for (var i = tokens.size() - 2; i >= 0 && before == null; i--) {
            if (!tokens.get(i).hidden()) {
                before = tokens.get(i);
            }
        }
        if (before == null) {
            return true;
        }
        if (before.type() == Token.Type.OPERATOR) {
            return !before.is(")") && !before.is("]") && !before.is("}");
        }
        return before.type() == Token.Type.KEYWORD && !before.is("end");
    }

    private static Token eof(Lexeme last) {
        if (last == null) {
            return new Token(Token.Type.EOF, "", 1, 1, false);
        }
        var text = last.text();
        var lastNewline = text.lastIndexOf('\n');
        if (lastNewline < 0) {
            return new Token(Token.Type.EOF, "", last.line(), last.column() + text.length(), false);
        }
        var newlines = (int) text.chars().filter(c -> c == '\n').count();
        return new Token(Token.Type.EOF, "", last.line() + newlines, text.length() - lastNewline, false);
    }
}
