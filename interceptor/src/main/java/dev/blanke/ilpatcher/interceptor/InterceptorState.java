package dev.blanke.ilpatcher.interceptor;

import java.lang.reflect.Method;
import java.util.Objects;

import org.jetbrains.annotations.Nullable;

/**
 * The immutable state owned by an interception wrapper and passed to each of its hooks.
 *
 * @param method The wrapped method.
 *
 * @param tag An arbitrary value supplied by the caller of {@link MethodInterceptor#wrap}, e.g. to correlate
 *            hook invocations of several wrappers.
 *
 * @param hooks The hooks invoked by the wrapper.
 */
public record InterceptorState(Method method, @Nullable Object tag, InterceptorHooks hooks) {

    public InterceptorState {
        Objects.requireNonNull(method);
        Objects.requireNonNull(hooks);
    }

    public InterceptorState withHooks(final InterceptorHooks hooks) {
        return new InterceptorState(method, tag, hooks);
    }
}
