package jdent;

import org.jspecify.annotations.Nullable;

/**
 * One object member, printed as {@code "name":value}.
 *
 * <p> The name is printed through its string form, so any key type is accepted. A field is a
 * fragment, not a JSON value on its own; it is meant to be written inside an object.
 */
public record Field<K, V>(@Nullable K name, @Nullable V value) {

    public static <K, V> Field<K, V> of(@Nullable K name, @Nullable V value) {
        return new Field<>(name, value);
    }
}
