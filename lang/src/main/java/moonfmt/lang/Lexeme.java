package moonfmt.lang;

import lombok.NonNull;

/**
 * A positioned slice of source text as classified by the {@link Scanner},
 * before the {@link Reducer} assigns its final {@link Token.Type}.
 */
record Lexeme(
    @NonNull LexicalClass lexicalClass,
    @NonNull String text,
    int line,
    int column) {

    @Override
    public String toString() {
        return "(Lexeme " + lexicalClass + " \"" + text + "\" " + line + ":" + column + ")";
    }
}
