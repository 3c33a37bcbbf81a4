package jdent;

import org.jspecify.annotations.Nullable;

/**
 * A value paired with the context it should be printed with.
 *
 * <p> Printing a binding prints {@code value} with {@code context} in place of the inherited
 * context, for the whole subtree below it. A binding only observes its value and is meant to live
 * no longer than the print call it is passed to.
 *
 * <pre>{@code
 * o.field("price", Binding.of(price, Currency.getInstance("EUR")));
 * }</pre>
 */
public record Binding<T, C>(@Nullable T value, @Nullable C context) {

    public static <T, C> Binding<T, C> of(@Nullable T value, @Nullable C context) {
        return new Binding<>(value, context);
    }
}
