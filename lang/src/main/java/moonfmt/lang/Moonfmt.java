package moonfmt.lang;

import static lombok.AccessLevel.PRIVATE;

import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Entry points of the formatter. Every call works on its own scanner,
 * reducer and output, so the methods may be called concurrently.
 */
@RequiredArgsConstructor(access = PRIVATE)
public final class Moonfmt {

    private static final Logger logger = LoggerFactory.getLogger(Moonfmt.class);

    /**
     * Formats {@code source} with {@link Options#defaults()}.
     *
     * @throws FormatException if the source cannot be tokenized or parsed
     */
    public static String format(@NonNull String source) {
        return format(source, Options.defaults());
    }

    /**
     * Formats {@code source}: four-space indentation, one statement per line,
     * one table field per line, canonical spacing around operators, comments
     * moved to the next line boundary.
     *
     * @throws FormatException if the source cannot be tokenized or parsed
     */
    public static String format(@NonNull String source, @NonNull Options options) {
        var tokens = tokenize(source, options);
        var formatted = new Formatter(new TokenStream(tokens)).format();
        logger.debug("formatted {} chars into {} chars", source.length(), formatted.length());
        return formatted;
    }

    /**
     * @return the texts of the visible tokens the formatter would see, i.e.
     *         without whitespace and comments and with negative number
     *         literals folded
     * @throws FormatException if the source cannot be tokenized
     */
    public static List<String> lex(@NonNull String source, @NonNull Options options) {
        return tokenize(source, options.withStripComments(true)).stream()
            .filter(token -> token.type() != Token.Type.EOF)
            .map(Token::lexeme)
            .collect(Collectors.toList());
    }

    private static List<Token> tokenize(String source, Options options) {
        var lexemes = new Scanner(source).getLexemes();
        var trim = options.stripComments() ? Reducer.Trim.ALL : Reducer.Trim.WHITESPACE;
        var tokens = new Reducer(options.version(), trim).reduce(lexemes);

        if (options.traceTokens() && logger.isDebugEnabled()) {
            tokens.forEach(token -> logger.debug("{}", token));
        }
        return tokens;
    }
}
