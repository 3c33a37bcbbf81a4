package jdent;

/**
 * Receives the members of a JSON object, one call per member, in input order.
 *
 * <p> Duplicate names are delivered once per occurrence. Each call finds the cursor just after
 * the member's {@code :} and must consume exactly the member's value.
 *
 * @see PushParser#parseObject(Cursor, FieldConsumer)
 */
@FunctionalInterface
public interface FieldConsumer {
    void accept(Cursor cursor, String name);
}
