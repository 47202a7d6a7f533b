package dev.blanke.ilpatcher.interceptor;

import org.jetbrains.annotations.Nullable;

/**
 * A mutable cell standing in for a by-reference parameter: the callee may replace the referenced value, and the
 * caller observes the replacement after the call returns.
 * <p>
 * Parameters declared as {@code Ref} (or a subtype) are forwarded unchanged by an interception wrapper, while the
 * argument snapshot handed to the hooks contains the value referenced at the time of the call.
 *
 * @param <T> The type of the referenced value.
 */
public class Ref<T> {

    private @Nullable T value;

    public Ref(final @Nullable T value) {
        this.value = value;
    }

    public static <T> Ref<T> of(final @Nullable T value) {
        return new Ref<>(value);
    }

    public @Nullable T get() {
        return value;
    }

    public void set(final @Nullable T value) {
        this.value = value;
    }

    @Override
    public String toString() {
        return "Ref[" + value + ']';
    }
}
