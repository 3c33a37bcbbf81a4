package jdent;

import org.jspecify.annotations.Nullable;

/**
 * Implemented by types that print themselves as JSON.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * record Point(int x, int y) implements JsonPrintable<Object> {
 *     public void printJson(JsonOutput out, Object context) {
 *         try (var o = out.object()) {
 *             o.field("x", x).field("y", y);
 *         }
 *     }
 * }
 * Json.stringify(new Point(1, 2)); // -> {"x":1,"y":2}
 * }</pre>
 *
 * @param <C> the context type this printer understands; the value comes from the caller of
 *     {@link Json#stringify(Object, Object)} or from an enclosing {@link Binding}
 * @since 0.1.0
 */
@FunctionalInterface
public interface JsonPrintable<C> {
    void printJson(JsonOutput out, @Nullable C context);
}
