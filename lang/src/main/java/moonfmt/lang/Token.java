package moonfmt.lang;

import lombok.NonNull;

record Token(
    @NonNull Type type,
    @NonNull String lexeme,
    int line,
    int column,
    boolean hidden) {

    boolean is(String text) {
        return lexeme.equals(text);
    }

    @Override
    public String toString() {
        var hiddenTag = hidden ? " HIDDEN" : "";
        return "(Token " + type + " \"" + lexeme + "\" " + line + ":" + column + hiddenTag + ")";
    }

    enum Type {
        OPERATOR,
        KEYWORD,
        CONSTANT,
        STRING,
        NUMBER,
        NAME,

        // never reach the formatter as visible tokens
        COMMENT,
        WHITESPACE,

        // end-of-file
        EOF;
    }
}
