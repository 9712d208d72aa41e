package moonfmt.lang;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Splits source text into {@link Lexeme}s. At every position the
 * {@link LexicalClass}es are tried in declaration order and the first one
 * that matches consumes its text.
 */
@RequiredArgsConstructor
final class Scanner {

    private static final Logger logger = LoggerFactory.getLogger(Scanner.class);

    private static final LexicalClass[] CLASSES = LexicalClass.values();

    private final @NonNull String source;
    private final List<Lexeme> lexemes = new ArrayList<>();

    private int current = 0;
    private int line = 1;
    private int column = 1;

    List<Lexeme> getLexemes() {
        if (!lexemes.isEmpty() || isAtEnd()) {
            return lexemes;
        }

        while (!isAtEnd()) {
            scanLexeme();
        }

        logger.debug("scanned {} lexemes over {} lines", lexemes.size(), line);
        return lexemes;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private void scanLexeme() {
        for (var lexicalClass : CLASSES) {
            var end = lexicalClass.match(source, current);
            if (end == LexicalClass.UNFINISHED) {
                throw unfinished(lexicalClass);
            }
            if (end > current) {
                addLexeme(lexicalClass, source.substring(current, end));
                return;
            }
        }
        // INVALID takes every character the other classes refuse
        throw new IllegalStateException("no lexical class at offset " + current);
    }

    private void addLexeme(LexicalClass lexicalClass, String text) {
        lexemes.add(new Lexeme(lexicalClass, text, line, column));
        current += text.length();

        var lastNewline = text.lastIndexOf('\n');
        if (lastNewline < 0) {
            column += text.length();
        } else {
            line += (int) text.chars().filter(c -> c == '\n').count();
            column = text.length() - lastNewline;
        }
    }

    private FormatException unfinished(LexicalClass lexicalClass) {
        String what;
        if (lexicalClass == LexicalClass.BLOCK_COMMENT) {
            what = "unfinished long comment";
        } else if (lexicalClass.isLongBracket()) {
            what = "unfinished long string";
        } else {
            what = "unfinished string";
        }
        return new FormatException(FormatException.Kind.LEXICAL, line, column, what);
    }
}
