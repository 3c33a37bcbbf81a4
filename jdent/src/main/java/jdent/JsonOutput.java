package jdent;

import java.io.IOException;
import java.io.UncheckedIOException;
import org.jspecify.annotations.Nullable;

/**
 * Where a {@link Json.Writer} prints to, and what a {@link JsonPrintable} or {@link Json.Printer}
 * prints through.
 *
 * <p> Output goes straight to the underlying {@link Appendable}; nothing is buffered here. An
 * {@link IOException} from the appendable is rethrown as {@link UncheckedIOException}.
 *
 * <p> The output carries the context of the value being printed. {@link #value(Object)} passes it
 * on to nested values, {@link #value(Object, Object)} replaces it for one subtree.
 *
 * @since 0.1.0
 */
public final class JsonOutput {

    private final Appendable out;
    private final Json.Writer writer;
    private @Nullable Object context;

    JsonOutput(Appendable out, Json.Writer writer, @Nullable Object context) {
        this.out = out;
        this.writer = writer;
        this.context = context;
    }

    /**
     * @return the context of the value currently being printed
     */
    public @Nullable Object context() {
        return context;
    }

    /** Print any value with the current context. */
    public JsonOutput value(@Nullable Object value) {
        return value(value, context);
    }

    /** Print any value with {@code context} for it and everything below it. */
    public JsonOutput value(@Nullable Object value, @Nullable Object context) {
        Object outer = this.context;
        this.context = context;
        try {
            writer.print(this, value, context);
        } finally {
            this.context = outer;
        }
        return this;
    }

    /** Print a quoted, escaped string. */
    public JsonOutput string(CharSequence s) {
        try {
            out.append('"');
            Utf8.escapeTo(out, s);
            out.append('"');
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    public JsonOutput nullValue() {
        return raw("null");
    }

    /** Append text verbatim; the caller is responsible for it being valid JSON. */
    public JsonOutput raw(CharSequence text) {
        try {
            out.append(text);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    /** Open an object; closing the returned writer closes the object. */
    public ObjectWriter object() {
        raw("{");
        return new ObjectWriter(this);
    }

    /** Open an array; closing the returned writer closes the array. */
    public ArrayWriter array() {
        raw("[");
        return new ArrayWriter(this);
    }
}
