package moonfmt.lang;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class OutputTest {

    Output output;

    @BeforeEach
    void setUp() {
        output = new Output();
    }

    @Test
    void newlineFlushesPendingCommentsAtItsIndent() {
        output.write("x = 1");
        output.defer("-- a");
        output.defer("--[[ b ]]");
        output.newline(4);
        output.write("y = 2");
        assertEquals("x = 1\n    -- a\n    --[[ b ]]\n    y = 2\n", output.finish());
    }

    @Test
    void commentsAreFlushedOnce() {
        output.write("a");
        output.defer("-- c");
        output.newline(0);
        output.write("b");
        output.newline(0);
        output.write("c");
        assertEquals("a\n-- c\nb\nc\n", output.finish());
    }

    @Test
    void closeBlockReplacesTrailingLayout() {
        output.write("do");
        output.newline(4);
        output.write("f()");
        output.newline(4);
        output.closeBlock(0, "end");
        assertEquals("do\n    f()\nend\n", output.finish());
    }

    @Test
    void closeBlockOfEmptyBlock() {
        output.write("do");
        output.newline(4);
        output.closeBlock(0, "end");
        assertEquals("do\nend\n", output.finish());
    }

    @Test
    void closeBlockKeepsPendingCommentsInside() {
        output.write("{");
        output.newline(8);
        output.write("1");
        output.defer("-- last");
        output.closeBlock(4, "}");
        assertEquals("{\n        1\n        -- last\n    }\n", output.finish());
    }

    @Test
    void closeBlockDropsBlankLine() {
        output.write("end");
        output.blankLine();
        output.newline(4);
        output.closeBlock(0, "end");
        assertEquals("end\nend\n", output.finish());
    }

    @Test
    void commentTextIsVerbatim() {
        output.defer("-- trailing spaces   ");
        output.flush(0);
        assertEquals("-- trailing spaces   \n", output.finish());
    }

    @Test
    void finishFlushesLeftoverComments() {
        output.write("x()");
        output.defer("-- tail");
        assertEquals("x()\n-- tail\n", output.finish());
    }

    @Test
    void emptyOutput() {
        assertEquals("", output.finish());
    }
}
