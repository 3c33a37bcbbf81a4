package jdent;

/**
 * Receives the elements of a JSON array, one call per element, in input order.
 *
 * <p> Each call finds the cursor at the start of the element and must consume exactly that one
 * value, typically by calling back into {@link PushParser} or {@link Json.Reader}.
 *
 * @see PushParser#parseArray(Cursor, ElementConsumer)
 */
@FunctionalInterface
public interface ElementConsumer {
    void accept(Cursor cursor);
}
