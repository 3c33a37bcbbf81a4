package jdent;

import org.jspecify.annotations.Nullable;

/**
 * Writes the members of one JSON object, adding separators as it goes.
 *
 * <p> Use with try-with-resources so the closing brace is written exactly once:
 * <pre>{@code
 * try (var o = out.object()) {
 *     o.field("name", name).field("tags", tags);
 * }
 * }</pre>
 *
 * @see JsonOutput#object()
 */
public final class ObjectWriter implements AutoCloseable {

    private final JsonOutput out;
    private boolean first = true;
    private boolean closed;

    ObjectWriter(JsonOutput out) {
        this.out = out;
    }

    /** Write a member, passing the current context on to its value. */
    public ObjectWriter field(String name, @Nullable Object value) {
        return field(name, value, out.context());
    }

    /** Write a member whose value is printed with {@code context}. */
    public ObjectWriter field(String name, @Nullable Object value, @Nullable Object context) {
        if (closed) throw new IllegalStateException("Object already closed");
        if (!first) out.raw(",");
        first = false;
        out.string(name).raw(":").value(value, context);
        return this;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        out.raw("}");
    }
}
