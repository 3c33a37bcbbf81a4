package jdent;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import jdent.JsonException.SyntaxException;
import jdent.JsonException.WriteException;
import lombok.Builder;
import org.jspecify.annotations.Nullable;

/**
 * Re-emits JSON as indented text while it is being parsed.
 *
 * <p> Every container is printed from inside the push parser's consumer, so the document is never
 * held in memory. Given {@code {"x":[1,2]}} and an indent width of 2 the output is:
 * <pre>
 * {
 *   "x": [
 *     1,
 *     2
 *   ]
 * }
 * </pre>
 *
 * <p> Empty containers print as {@code []} and {@code {}}. Strings are re-escaped, so the output
 * only ever contains printable ASCII.
 *
 * @since 0.1.0
 */
public final class PrettyPrinter {

    public static final int DEFAULT_INDENT_WIDTH = 4;

    private final int indentWidth;
    private final NumberMode numberMode;
    private final List<String> indents = new ArrayList<>();

    @Builder(toBuilder = true)
    private PrettyPrinter(@Nullable Integer indentWidth, @Nullable NumberMode numberMode) {
        this.indentWidth = indentWidth != null ? indentWidth : DEFAULT_INDENT_WIDTH;
        this.numberMode = numberMode != null ? numberMode : NumberMode.DECIMAL;
        if (this.indentWidth < 0) throw new IllegalArgumentException("indentWidth must be >= 0: " + indentWidth);
        indents.add("");
    }

    public int getIndentWidth() {
        return indentWidth;
    }

    public NumberMode getNumberMode() {
        return numberMode;
    }

    /**
     * Pretty-print {@code json}, which must hold exactly one value.
     *
     * @throws SyntaxException if it does not
     */
    public String print(String json) {
        var cursor = Cursor.of(json);
        var sb = new StringBuilder();
        if (!print(cursor, sb)) throw cursor.unexpected(Cursor.EOF, "a JSON value");
        cursor.expectEndOfInput();
        return sb.toString();
    }

    /**
     * Pretty-print the next value at {@code cursor}.
     *
     * @return {@code false}, printing nothing, if only whitespace was left
     * @throws UncheckedIOException if {@code out} fails
     */
    public boolean print(Cursor cursor, Appendable out) {
        try {
            if (cursor.classify() == JsonType.END_OF_INPUT) return false;
            value(cursor, out, 0);
            return true;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void value(Cursor cursor, Appendable out, int depth) throws IOException {
        switch (cursor.classify()) {
            case ARRAY -> array(cursor, out, depth);
            case OBJECT -> object(cursor, out, depth);
            case STRING -> string(out, PushParser.parseString(cursor));
            case NUMBER -> out.append(number(PushParser.parseNumber(cursor)));
            case BOOLEAN -> out.append(PushParser.parseBoolean(cursor) ? "true" : "false");
            case NULL -> {
                PushParser.parseNull(cursor);
                out.append("null");
            }
            case END_OF_INPUT -> throw cursor.unexpected(Cursor.EOF, "a JSON value");
        }
    }

    private void array(Cursor cursor, Appendable out, int depth) throws IOException {
        out.append('[');
        int[] count = {0};
        PushParser.parseArray(cursor, c -> {
            try {
                separator(out, count[0]++, depth + 1);
                value(c, out, depth + 1);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
        close(out, count[0], depth, ']');
    }

    private void object(Cursor cursor, Appendable out, int depth) throws IOException {
        out.append('{');
        int[] count = {0};
        PushParser.parseObject(cursor, (c, name) -> {
            try {
                separator(out, count[0]++, depth + 1);
                string(out, name);
                out.append(": ");
                value(c, out, depth + 1);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
        close(out, count[0], depth, '}');
    }

    private void separator(Appendable out, int index, int depth) throws IOException {
        if (index > 0) out.append(',');
        out.append('\n').append(indent(depth));
    }

    private void close(Appendable out, int count, int depth, char bracket) throws IOException {
        if (count > 0) out.append('\n').append(indent(depth));
        out.append(bracket);
    }

    private static void string(Appendable out, String s) throws IOException {
        out.append('"');
        Utf8.escapeTo(out, s);
        out.append('"');
    }

    private String number(Decimal d) {
        if (numberMode == NumberMode.DECIMAL) return d.toString();
        double v = d.toDouble();
        if (Double.isInfinite(v)) throw new WriteException("Number " + d + " is out of double range");
        return Double.toString(v);
    }

    // depth x width spaces
    private String indent(int depth) {
        synchronized (indents) {
            while (indents.size() <= depth) indents.add(" ".repeat(indentWidth * indents.size()));
            return indents.get(depth);
        }
    }
}
