package moonfmt.lang;

import java.util.regex.Pattern;

import lombok.Getter;

/**
 * Lexical classes in the order the {@link Scanner} tries them. Earlier
 * classes win: a keyword is first a {@link #NAME}, {@code -1} is an
 * {@link #OPERATOR} followed by a {@link #NUMBER}, {@code --[[x]]} is a
 * {@link #BLOCK_COMMENT} rather than a {@link #LINE_COMMENT}.
 */
@Getter
enum LexicalClass {
    NAME(Token.Type.NAME, "[A-Za-z_][A-Za-z0-9_]*"),
    SCI_HEX_NUMBER(Token.Type.NUMBER, "0[xX][0-9a-fA-F]+\\.?[0-9a-fA-F]*[pP][+-]?[0-9]+"),
    HEX_NUMBER(Token.Type.NUMBER, "0[xX][0-9a-fA-F]+\\.?[0-9a-fA-F]*"),
    SCI_NUMBER(Token.Type.NUMBER, "(?:[0-9]+\\.?[0-9]*|\\.[0-9]+)[eE][+-]?[0-9]+"),
    NUMBER(Token.Type.NUMBER, "[0-9]+\\.?[0-9]*|\\.[0-9]+"),

    EMPTY_BLOCK_COMMENT(Token.Type.COMMENT, null) {
        @Override
        int match(String source, int start) {
            return emptyLongBracket(source, start, 2);
        }
    },
    BLOCK_COMMENT(Token.Type.COMMENT, null) {
        @Override
        int match(String source, int start) {
            return longBracket(source, start, 2);
        }
    },
    LINE_COMMENT(Token.Type.COMMENT, "--[^\n]*"),

    EMPTY_BLOCK_QUOTE(Token.Type.STRING, null) {
        @Override
        int match(String source, int start) {
            return emptyLongBracket(source, start, 0);
        }
    },
    BLOCK_QUOTE(Token.Type.STRING, null) {
        @Override
        int match(String source, int start) {
            return longBracket(source, start, 0);
        }
    },

    OPERATOR(Token.Type.OPERATOR, "[;:=.,\\[\\](){}+\\-*/^%<>~#&|]{1,3}") {
        @Override
        int match(String source, int start) {
            var end = super.match(source, start);
            while (end - start > 1 && !Operators.isKnown(source.substring(start, end))) {
                end--;
            }
            return end;
        }
    },

    DOUBLE_QUOTE(Token.Type.STRING, null) {
        @Override
        int match(String source, int start) {
            return quoted(source, start, '"');
        }
    },
    SINGLE_QUOTE(Token.Type.STRING, null) {
        @Override
        int match(String source, int start) {
            return quoted(source, start, '\'');
        }
    },

    WHITESPACE(Token.Type.WHITESPACE, "\\s+"),

    // rejected by the Reducer, so the error carries the reduced position
    INVALID(null, "[^A-Za-z0-9_\\s;:=.,\\[\\](){}+\\-*/^%<>~#&|\"']+");

    /** The class does not apply at this position. */
    static final int NO_MATCH = -1;

    /** The class applies at this position but its closing delimiter is missing. */
    static final int UNFINISHED = -2;

    /** Final token type, {@code null} when the class is an error. */
    private final Token.Type reducedType;

    private final Pattern pattern;

    LexicalClass(Token.Type reducedType, String regex) {
        this.reducedType = reducedType;
        this.pattern = regex != null ? Pattern.compile(regex) : null;
    }

    /**
     * @return the end offset (exclusive) of the lexeme starting at
     *         {@code start}, {@link #NO_MATCH} or {@link #UNFINISHED}
     */
    int match(String source, int start) {
        var matcher = pattern.matcher(source).region(start, source.length());
        return matcher.lookingAt() ? matcher.end() : NO_MATCH;
    }

    boolean isLongBracket() {
        return this == BLOCK_COMMENT || this == BLOCK_QUOTE;
    }

    private static int quoted(String source, int start, char quote) {
        if (source.charAt(start) != quote) {
            return NO_MATCH;
        }
        var i = start + 1;
        while (i < source.length()) {
            var c = source.charAt(i);
            if (c == quote) {
                return i + 1;
            }
            if (c == '\n') {
                return UNFINISHED;
            }
            i += c == '\\' ? escape(source, i + 1) : 1;
        }
        return UNFINISHED;
    }

    /**
     * Length of the escape sequence whose backslash sits just before
     * {@code start}, backslash included. {@code \r\n} and {@code \n\r} are one
     * escaped newline, and {@code \z} takes the whitespace after it along.
     */
    private static int escape(String source, int start) {
        if (start >= source.length()) {
            return 1;
        }
        var c = source.charAt(start);
        var i = start + 1;
        if (c == '\r' || c == '\n') {
            if (i < source.length() && source.charAt(i) == (c == '\r' ? '\n' : '\r')) {
                i++;
            }
        } else if (c == 'z') {
            while (i < source.length() && Character.isWhitespace(source.charAt(i))) {
                i++;
            }
        }
        return i - start + 1;
    }

    /**
     * Level of the long bracket opening at {@code start}, i.e. the number of
     * {@code =} between the two {@code [}, or {@code -1} if there is none.
     */
    private static int level(String source, int start) {
        if (!source.startsWith("[", start)) {
            return -1;
        }
        var i = start + 1;
        while (i < source.length() && source.charAt(i) == '=') {
            i++;
        }
        return source.startsWith("[", i) ? i - start - 1 : -1;
    }

    private static boolean hasPrefix(String source, int start, int prefix) {
        return prefix == 0 || source.startsWith("--", start);
    }

    private static int emptyLongBracket(String source, int start, int prefix) {
        if (!hasPrefix(source, start, prefix)) {
            return NO_MATCH;
        }
        var level = level(source, start + prefix);
        if (level < 0) {
            return NO_MATCH;
        }
        var contentStart = start + prefix + level + 2;
        var close = closing(level);
        return source.startsWith(close, contentStart) ? contentStart + close.length() : NO_MATCH;
    }

    private static int longBracket(String source, int start, int prefix) {
        if (!hasPrefix(source, start, prefix)) {
            return NO_MATCH;
        }
        var level = level(source, start + prefix);
        if (level < 0) {
            return NO_MATCH;
        }
        var contentStart = start + prefix + level + 2;
        var close = closing(level);
        var end = source.indexOf(close, contentStart);
        return end < 0 ? UNFINISHED : end + close.length();
    }

    private static String closing(int level) {
        return "]" + "=".repeat(level) + "]";
    }
}
