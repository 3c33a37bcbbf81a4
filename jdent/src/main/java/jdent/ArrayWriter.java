package jdent;

import org.jspecify.annotations.Nullable;

/**
 * Writes the elements of one JSON array, adding separators as it goes.
 *
 * @see JsonOutput#array()
 */
public final class ArrayWriter implements AutoCloseable {

    private final JsonOutput out;
    private boolean first = true;
    private boolean closed;

    ArrayWriter(JsonOutput out) {
        this.out = out;
    }

    public ArrayWriter element(@Nullable Object value) {
        return element(value, out.context());
    }

    public ArrayWriter element(@Nullable Object value, @Nullable Object context) {
        if (closed) throw new IllegalStateException("Array already closed");
        if (!first) out.raw(",");
        first = false;
        out.value(value, context);
        return this;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        out.raw("]");
    }
}
