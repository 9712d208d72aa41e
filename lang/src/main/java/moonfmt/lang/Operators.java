package moonfmt.lang;

import static java.util.Map.entry;

import java.util.Map;
import java.util.Set;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Static word and operator tables of the language.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
final class Operators {

    /** Left and right binding power of a binary operator. */
    static record Precedence(int left, int right) {}

    /** Version flag from which the bitwise operators are accepted. */
    static final int BITWISE_VERSION = 3;

    /** Binding power of the operand of a unary operator. */
    static final int UNARY_PRIORITY = 12;

    static final String ELLIPSIS = "...";

    static final Set<String> KEYWORDS = Set.of(
        "break", "do", "else", "elseif", "end", "for", "function", "if",
        "in", "local", "repeat", "return", "then", "until", "while");

    /** Operators spelled as words; lexically they are names. */
    static final Set<String> WORD_OPERATORS = Set.of("and", "not", "or");

    static final Set<String> CONSTANTS = Set.of("true", "false", "nil", ELLIPSIS);

    static final Set<String> OPERATORS = Set.of(
        "and", "not", "or",
        "+", "-", "*", "/", "%", "^", "#",
        "==", "~=", "<=", ">=", "<", ">", "=",
        "(", ")", "{", "}", "[", "]",
        "::", ";", ":", ",", ".", "..");

    static final Set<String> BITWISE_OPERATORS = Set.of("&", "~", "|", "<<", ">>", "//");

    static final Set<String> UNARY_OPERATORS = Set.of("-", "#", "not", "~");

    static final Map<String, Precedence> BINARY_OPERATORS = Map.ofEntries(
        entry("or", new Precedence(1, 1)),
        entry("and", new Precedence(2, 2)),
        entry("<", new Precedence(3, 3)),
        entry(">", new Precedence(3, 3)),
        entry("<=", new Precedence(3, 3)),
        entry(">=", new Precedence(3, 3)),
        entry("~=", new Precedence(3, 3)),
        entry("==", new Precedence(3, 3)),
        entry("|", new Precedence(4, 4)),
        entry("~", new Precedence(5, 5)),
        entry("&", new Precedence(6, 6)),
        entry("<<", new Precedence(7, 7)),
        entry(">>", new Precedence(7, 7)),
        entry("..", new Precedence(9, 8)),
        entry("+", new Precedence(10, 10)),
        entry("-", new Precedence(10, 10)),
        entry("*", new Precedence(11, 11)),
        entry("/", new Precedence(11, 11)),
        entry("//", new Precedence(11, 11)),
        entry("%", new Precedence(11, 11)),
        entry("^", new Precedence(14, 13)));

    /** Whether the scanner may end an operator lexeme on this text. */
    static boolean isKnown(String text) {
        return OPERATORS.contains(text) || BITWISE_OPERATORS.contains(text) || ELLIPSIS.equals(text);
    }

    static boolean isBlockEnd(String text) {
        return "end".equals(text) || "else".equals(text) || "elseif".equals(text) || "until".equals(text);
    }
}
