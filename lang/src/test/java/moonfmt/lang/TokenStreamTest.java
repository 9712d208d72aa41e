package moonfmt.lang;

import static moonfmt.lang.Token.Type.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TokenStreamTest {

    TokenStream stream;

    boolean expectAtEnd;

    private void assertNextToken(Token expect) {
        assertEquals(expectAtEnd, stream.isAtEnd());
        assertEquals(expect, stream.peek());
        assertEquals(expect, stream.advance());
    }

    private void assertHidden(Token... expect) {
        assertEquals(List.of(expect), stream.skipHidden());
    }

    @BeforeEach
    void setUp() {
        var source = "-- head\nhello()\n--[[ mid ]] world = 42 -- tail\n";
        var lexemes = new Scanner(source).getLexemes();
        stream = new TokenStream(new Reducer(1, Reducer.Trim.WHITESPACE).reduce(lexemes));
        expectAtEnd = false;
    }

    @Test
    void hidden() {
        assertHidden(new Token(COMMENT, "-- head", 1, 1, true));
        assertNextToken(new Token(NAME, "hello", 2, 1, false));
        assertHidden();
        assertNextToken(new Token(OPERATOR, "(", 2, 6, false));
        assertNextToken(new Token(OPERATOR, ")", 2, 7, false));
        assertHidden(new Token(COMMENT, "--[[ mid ]]", 3, 1, true));
        assertNextToken(new Token(NAME, "world", 3, 13, false));
        assertNextToken(new Token(OPERATOR, "=", 3, 19, false));
        assertNextToken(new Token(NUMBER, "42", 3, 21, false));
        expectAtEnd = true;
        assertHidden(new Token(COMMENT, "-- tail", 3, 24, true));
        assertHidden();
        assertNextToken(new Token(EOF, "", 4, 1, false));
        assertNextToken(new Token(EOF, "", 4, 1, false));
    }

    @Test
    void visible() {
        assertNextToken(new Token(NAME, "hello", 2, 1, false));
        assertNextToken(new Token(OPERATOR, "(", 2, 6, false));
        assertNextToken(new Token(OPERATOR, ")", 2, 7, false));
        assertNextToken(new Token(NAME, "world", 3, 13, false));
        assertNextToken(new Token(OPERATOR, "=", 3, 19, false));
        assertNextToken(new Token(NUMBER, "42", 3, 21, false));
        expectAtEnd = true;
        assertNextToken(new Token(EOF, "", 4, 1, false));
    }

    @Test
    void peekNextSkipsHidden() {
        stream.advance();
        stream.advance();
        assertEquals(")", stream.peek().lexeme());
        assertEquals("world", stream.peekNext().lexeme());

        stream.advance();
        stream.advance();
        stream.advance();
        assertEquals("42", stream.peek().lexeme());
        assertEquals(EOF, stream.peekNext().type());
    }

    @Test
    void skipHidden() {
        assertEquals(List.of(new Token(COMMENT, "-- head", 1, 1, true)), stream.skipHidden());
        assertTrue(stream.skipHidden().isEmpty());

        stream.advance(); // hello
        stream.advance(); // (
        stream.advance(); // )
        assertEquals(List.of("--[[ mid ]]"), stream.skipHidden().stream().map(Token::lexeme).toList());
        assertTrue(stream.skipHidden().isEmpty());
        assertEquals("world", stream.advance().lexeme());
    }
}
