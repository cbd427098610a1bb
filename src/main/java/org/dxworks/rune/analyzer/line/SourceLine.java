package org.dxworks.rune.analyzer.line;

import org.dxworks.rune.model.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * One physical line of a document with its inline comment stripped.
 * {@link #text} is the content after the leading spaces.
 */
public final class SourceLine {

    public final int number;
    public final String raw;
    public final int indent;
    public final String text;
    public final boolean commentOnly;

    private SourceLine(int number, String raw, int indent, String text, boolean commentOnly) {
        this.number = number;
        this.raw = raw;
        this.indent = indent;
        this.text = text;
        this.commentOnly = commentOnly;
    }

    public static SourceLine of(int number, String raw) {
        int indent = 0;
        while (indent < raw.length() && raw.charAt(indent) == ' ') {
            indent++;
        }
        String rest = raw.substring(indent);
        if (rest.startsWith("//")) {
            return new SourceLine(number, raw, indent, "", true);
        }
        return new SourceLine(number, raw, indent, stripTrailing(stripComment(rest)), false);
    }

    /** Splits text into lines, dropping a leading byte order mark and carriage returns. */
    public static List<SourceLine> split(String source) {
        String text = source.startsWith("\uFEFF") ? source.substring(1) : source;
        String[] parts = text.split("\n", -1);
        int count = parts.length;
        // a trailing newline does not start another line
        if (count > 1 && parts[count - 1].isEmpty()) {
            count--;
        }
        List<SourceLine> lines = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String part = parts[i];
            if (part.endsWith("\r")) {
                part = part.substring(0, part.length() - 1);
            }
            lines.add(of(i, part));
        }
        return lines;
    }

    public boolean isBlank() {
        return !commentOnly && text.isEmpty();
    }

    /** Visible width of the raw line, comments included. */
    public int width() {
        return raw.codePointCount(0, raw.length());
    }

    public int endColumn() {
        return indent + text.length();
    }

    /** Span of the content, from the first non-space character to the end of the text. */
    public SourceSpan span() {
        return SourceSpan.onLine(number, indent, endColumn());
    }

    // "//" opens a comment at the start of the content or after a space, so URLs survive
    private static String stripComment(String content) {
        int from = 0;
        while (true) {
            int index = content.indexOf("//", from);
            if (index < 0) {
                return content;
            }
            if (index == 0 || Character.isWhitespace(content.charAt(index - 1))) {
                return content.substring(0, index);
            }
            from = index + 2;
        }
    }

    private static String stripTrailing(String content) {
        int end = content.length();
        while (end > 0 && Character.isWhitespace(content.charAt(end - 1))) {
            end--;
        }
        return content.substring(0, end);
    }

    @Override
    public String toString() {
        return (number + 1) + ": " + raw;
    }
}
