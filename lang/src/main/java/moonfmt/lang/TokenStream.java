package moonfmt.lang;

import static moonfmt.lang.Token.Type.EOF;

import java.util.ArrayList;
import java.util.List;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Cursor over reduced tokens. Hidden tokens (comments, whitespace) are
 * stepped over by the visible-token methods and handed out by
 * {@link #skipHidden()}.
 */
@RequiredArgsConstructor
final class TokenStream {

    private final @NonNull List<Token> tokens;

    private int current = 0;

    boolean isAtEnd() {
        return peek().type() == EOF;
    }

    Token peek() {
        return tokens.get(nextVisible(current));
    }

    /** The visible token after {@link #peek()}. */
    Token peekNext() {
        var index = nextVisible(current);
        if (tokens.get(index).type() == EOF) {
            return tokens.get(index);
        }
        return tokens.get(nextVisible(index + 1));
    }

    /**
     * Consumes the next visible token. Hidden tokens before it are dropped;
     * use {@link #skipHidden()} first to keep them.
     */
    Token advance() {
        current = nextVisible(current);
        var token = tokens.get(current);
        if (token.type() != EOF) {
            current++;
        }
        return token;
    }

    /**
     * Consumes the hidden tokens at the cursor.
     *
     * @return the consumed tokens in source order, possibly empty
     */
    List<Token> skipHidden() {
        var skipped = new ArrayList<Token>();
        while (tokens.get(current).hidden()) {
            skipped.add(tokens.get(current++));
        }
        return skipped;
    }

    private int nextVisible(int index) {
        var token = tokens.get(index);
        while (token.hidden() && EOF != token.type()) {
            index++;
            token = tokens.get(index);
        }
        return index;
    }
}
