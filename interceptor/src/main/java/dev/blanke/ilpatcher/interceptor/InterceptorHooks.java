package dev.blanke.ilpatcher.interceptor;

import java.util.List;

import org.jetbrains.annotations.Nullable;

/**
 * The callbacks invoked by an interception wrapper around each call of the wrapped method. Each hook is optional.
 * <p>
 * The {@code arguments} passed to every hook are an unmodifiable snapshot taken on entry: primitive values boxed,
 * {@link Ref} arguments replaced by the value they referenced at that time. The {@code instance} is the receiver of
 * the call, or {@code null} for static methods.
 *
 * @param onEnter Invoked before the wrapped method.
 *
 * @param onExit Invoked after the wrapped method returned normally.
 *
 * @param onException Invoked after the wrapped method, or one of the other hooks, threw. The throwable is rethrown
 *                    once the hook returns.
 */
public record InterceptorHooks(@Nullable OnEnter onEnter, @Nullable OnExit onExit,
                               @Nullable OnException onException) {

    public static final InterceptorHooks NONE = new InterceptorHooks(null, null, null);

    public InterceptorHooks withOnEnter(final @Nullable OnEnter onEnter) {
        return new InterceptorHooks(onEnter, onExit, onException);
    }

    public InterceptorHooks withOnExit(final @Nullable OnExit onExit) {
        return new InterceptorHooks(onEnter, onExit, onException);
    }

    public InterceptorHooks withOnException(final @Nullable OnException onException) {
        return new InterceptorHooks(onEnter, onExit, onException);
    }

    @FunctionalInterface
    public interface OnEnter {

        void onEnter(InterceptorState state, @Nullable Object instance, List<Object> arguments);
    }

    @FunctionalInterface
    public interface OnExit {

        /**
         * @param returnValue The boxed return value, {@code null} for {@code void} methods.
         */
        void onExit(InterceptorState state, @Nullable Object instance, @Nullable Object returnValue,
                    List<Object> arguments);
    }

    @FunctionalInterface
    public interface OnException {

        void onException(InterceptorState state, @Nullable Object instance, Throwable fault, List<Object> arguments);
    }
}
