package moonfmt.lang;

import lombok.Getter;

/**
 * Raised when source text cannot be formatted. No output is produced for
 * the failed call.
 */
@Getter
public class FormatException extends RuntimeException {

    public enum Kind {
        /** Unfinished string or comment, or characters of no lexical class. */
        LEXICAL,
        /** Operator not enabled for the requested language version. */
        OPERATOR,
        /** Token sequence that fits no production of the grammar. */
        GRAMMAR
    }

    private final Kind kind;
    private final int line;
    private final int column;
    private final String reason;

    FormatException(Kind kind, int line, int column, String reason) {
        super(reason + " [line " + line + ", col " + column + "]");
        this.kind = kind;
        this.line = line;
        this.column = column;
        this.reason = reason;
    }

    FormatException(Kind kind, Token token, String reason) {
        this(kind, token.line(), token.column(), reason);
    }
}
