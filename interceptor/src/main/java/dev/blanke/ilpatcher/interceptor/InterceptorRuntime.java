package dev.blanke.ilpatcher.interceptor;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.jetbrains.annotations.Nullable;

/**
 * The entry points called from generated interception wrappers.
 * <p>
 * Keeping the hook dispatch here confines the generated bytecode to argument boxing and a single static call per
 * hook.
 */
final class InterceptorRuntime {

    private InterceptorRuntime() {
        // Prevent instantiation of utility class.
    }

    static void onEnter(final InterceptorState state, final @Nullable Object instance, final Object[] arguments) {
        final var hook = state.hooks().onEnter();
        if (hook != null)
            hook.onEnter(state, instance, snapshot(arguments));
    }

    static void onExit(final InterceptorState state, final @Nullable Object instance,
                       final @Nullable Object returnValue, final Object[] arguments) {
        final var hook = state.hooks().onExit();
        if (hook != null)
            hook.onExit(state, instance, returnValue, snapshot(arguments));
    }

    static void onException(final InterceptorState state, final @Nullable Object instance, final Throwable fault,
                            final Object[] arguments) {
        final var hook = state.hooks().onException();
        if (hook != null)
            hook.onException(state, instance, fault, snapshot(arguments));
    }

    /**
     * Returns the value referenced by a by-reference argument at the time of the call.
     */
    static @Nullable Object dereference(final @Nullable Object argument) {
        return (argument instanceof Ref<?> ref) ? ref.get() : argument;
    }

    private static List<Object> snapshot(final Object[] arguments) {
        return Collections.unmodifiableList(Arrays.asList(arguments));
    }
}
