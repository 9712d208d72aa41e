package moonfmt.lang;

import java.util.ArrayList;
import java.util.List;

/**
 * Formatted text under construction, plus the comments waiting for the next
 * line boundary.
 *
 * <p>Line breaks and indentation are layout: {@link #closeBlock} may take
 * back the layout written after the last content.
 */
final class Output {

    private final StringBuilder text = new StringBuilder();
    private final List<String> pending = new ArrayList<>();

    /** End of the last content written, i.e. excluding trailing layout. */
    private int contentEnd = 0;

    void write(String content) {
        text.append(content);
        contentEnd = text.length();
    }

    /** Queues a comment for the next line boundary. */
    void defer(String comment) {
        pending.add(comment);
    }

    /**
     * Starts a new line at {@code indent}, emitting the pending comments
     * first, each on its own line at the same indent.
     */
    void newline(int indent) {
        layout(indent);
        flush(indent);
    }

    /** Leaves one empty line before the next one. */
    void blankLine() {
        text.append('\n');
    }

    /** Emits the pending comments, each followed by a new line at {@code indent}. */
    void flush(int indent) {
        for (var comment : pending) {
            write(comment);
            layout(indent);
        }
        pending.clear();
    }

    /**
     * Closes a block with {@code keyword} on its own line at {@code indent}.
     * Layout after the block's last content is discarded, and comments still
     * pending are kept inside the block at {@code indent + 4}.
     */
    void closeBlock(int indent, String keyword) {
        appendPending(indent + Formatter.INDENT);
        text.setLength(contentEnd);
        layout(indent);
        write(keyword);
    }

    /**
     * @return the text without trailing layout, ending in a single newline
     *         unless empty
     */
    String finish() {
        appendPending(0);
        text.setLength(contentEnd);
        if (text.length() > 0) {
            text.append('\n');
        }
        return text.toString();
    }

    /** Puts each pending comment on its own line right after the last content. */
    private void appendPending(int indent) {
        for (var comment : pending) {
            text.setLength(contentEnd);
            if (contentEnd > 0) {
                layout(indent);
            }
            write(comment);
        }
        pending.clear();
    }

    private void layout(int indent) {
        text.append('\n').append(" ".repeat(indent));
    }
}
