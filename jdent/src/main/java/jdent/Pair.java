package jdent;

import org.jspecify.annotations.Nullable;

/**
 * Two values printed as {@code {"first":..,"second":..}}.
 */
public record Pair<F, S>(@Nullable F first, @Nullable S second) implements JsonPrintable<Object> {

    public static <F, S> Pair<F, S> of(@Nullable F first, @Nullable S second) {
        return new Pair<>(first, second);
    }

    @Override
    public void printJson(JsonOutput out, @Nullable Object context) {
        try (var o = out.object()) {
            o.field("first", first).field("second", second);
        }
    }
}
