package dev.blanke.ilpatcher.interceptor;

import java.io.PrintWriter;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandleProxies;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Objects;
import java.util.Set;

import org.jetbrains.annotations.Nullable;

import org.objectweb.asm.ClassReader;
import org.objectweb.asm.util.CheckClassAdapter;

import dev.blanke.ilpatcher.interceptor.InterceptionException.Reason;

/**
 * The {@code MethodInterceptor} creates substitutes for live methods which invoke user-supplied hooks around every
 * call while forwarding the call to the original method unchanged.
 * <p>
 * For each wrapped method, a wrapper class is generated using ASM and defined as a hidden class, see
 * {@link InterceptorClassGenerator}. The returned {@link MethodHandle} has the type of the original method: for
 * static methods its parameter types, for instance methods the declaring class followed by its parameter types.
 * Invoking it
 * <ol>
 *     <li>takes a snapshot of the arguments,</li>
 *     <li>invokes {@link InterceptorHooks#onEnter()},</li>
 *     <li>invokes the original method, virtually dispatched for instance methods,</li>
 *     <li>invokes {@link InterceptorHooks#onExit()} with the boxed return value and returns that value.</li>
 * </ol>
 * If the original method or one of the two hooks throws, {@link InterceptorHooks#onException()} is invoked and the
 * very same throwable is rethrown afterwards.
 * <p>
 * Wrappers hold no mutable state and can be invoked concurrently as long as the original method and the hooks
 * allow it.
 */
public final class MethodInterceptor {

    private static final Logger LOGGER = System.getLogger(MethodInterceptor.class.getName());

    /**
     * The largest number of parameters, counting the receiver of instance methods and one more for non-void return
     * types, of methods that can be wrapped.
     */
    public static final int MAX_ARITY = 16;

    private static final Set<Class<?>> PRIMITIVE_WRAPPERS = Set.of(Boolean.class, Byte.class, Character.class,
        Short.class, Integer.class, Long.class, Float.class, Double.class);

    // region Verification
    /**
     * Whether the generated wrapper classes should be verified using ASM's {@link CheckClassAdapter}.
     */
    private final boolean verify;

    /**
     * A writer to which the verification results and encountered errors will be written.
     */
    private final PrintWriter verificationResultsPrintWriter;
    // endregion

    public MethodInterceptor() {
        this(false);
    }

    /**
     * Instantiates a new {@code MethodInterceptor} object.
     *
     * @param verify Whether the generated wrapper classes should be verified using ASM's {@link CheckClassAdapter}.
     */
    public MethodInterceptor(final boolean verify) {
        //noinspection AssignmentUsedAsCondition
        verificationResultsPrintWriter = (this.verify = verify) ? new PrintWriter(System.err) : null;
    }

    /**
     * Wraps the provided {@code method} with a fresh {@link InterceptorState} without tag.
     *
     * @see #wrap(Method, InterceptorHooks, InterceptorState)
     */
    public MethodHandle wrap(final Method method, final InterceptorHooks hooks) {
        return wrap(method, hooks, null);
    }

    /**
     * Generates an interception wrapper for the provided {@code method}.
     *
     * @param method The method to wrap.
     *
     * @param hooks The hooks to invoke around each call.
     *
     * @param state The state to pass to the hooks, whose {@link InterceptorState#hooks()} are replaced by
     *              {@code hooks}. If {@code null}, a new state without tag is created.
     *
     * @return A method handle of the same type as the unreflected {@code method}.
     *
     * @throws NullPointerException If {@code method} or {@code hooks} is {@code null}.
     *
     * @throws IllegalArgumentException If {@code state} belongs to a different method.
     *
     * @throws InterceptionException If the method declares type variables, is an instance method of a value-based
     *                               class, exceeds {@link #MAX_ARITY}, or cannot be made accessible.
     */
    public MethodHandle wrap(final Method method, final InterceptorHooks hooks,
                             final @Nullable InterceptorState state) {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(hooks, "hooks");
        checkSupported(method);

        final InterceptorState effectiveState;
        if (state == null) {
            effectiveState = new InterceptorState(method, null, hooks);
        } else if (state.method().equals(method)) {
            effectiveState = state.withHooks(hooks);
        } else {
            throw new IllegalArgumentException("State of %s cannot be used for %s".formatted(state.method(), method));
        }

        final boolean hasReceiver = !Modifier.isStatic(method.getModifiers());
        final var openType  = openType(method);
        final var invokeType = openType.erase();

        final var target = unreflect(method, invokeType);
        final var bytes  = InterceptorClassGenerator.generate(invokeType, hasReceiver, byReference(openType), verify);
        if (verify) {
            CheckClassAdapter.verify(new ClassReader(bytes), MethodInterceptor.class.getClassLoader(), false,
                verificationResultsPrintWriter);
        }

        try {
            final var lookup  = MethodHandles.lookup().defineHiddenClass(bytes, true);
            final var wrapper = lookup.findConstructor(lookup.lookupClass(), InterceptorClassGenerator.CONSTRUCTOR_TYPE)
                .invoke(effectiveState, target);

            LOGGER.log(Level.DEBUG, "Generated interception wrapper {0} for {1}.", lookup.lookupClass().getName(),
                method);
            return lookup.findVirtual(lookup.lookupClass(), InterceptorClassGenerator.INVOKE_METHOD_NAME, invokeType)
                .bindTo(wrapper)
                .asType(openType);
        } catch (final RuntimeException | Error exception) {
            throw exception;
        } catch (final Throwable throwable) {
            throw new IllegalStateException("Unable to instantiate interception wrapper for " + method, throwable);
        }
    }

    /**
     * Wraps the provided {@code method} and adapts the resulting handle to an instance of a functional interface,
     * e.g. to substitute it for a method reference.
     *
     * @param functionalInterface A public interface with a single abstract method whose type the wrapper can be
     *                            adapted to via {@link MethodHandle#asType(MethodType)}. Interfaces that are not
     *                            public cannot be implemented by {@link MethodHandleProxies}.
     *
     * @throws IllegalArgumentException If {@code functionalInterface} is not a public interface.
     *
     * @see #wrap(Method, InterceptorHooks, InterceptorState)
     * @see MethodHandleProxies#asInterfaceInstance(Class, MethodHandle)
     */
    public <T> T wrap(final Method method, final InterceptorHooks hooks, final @Nullable InterceptorState state,
                      final Class<T> functionalInterface) {
        Objects.requireNonNull(functionalInterface, "functionalInterface");
        if (!functionalInterface.isInterface() || !Modifier.isPublic(functionalInterface.getModifiers()))
            throw new IllegalArgumentException("Not a public interface: " + functionalInterface.getName());
        return MethodHandleProxies.asInterfaceInstance(functionalInterface, wrap(method, hooks, state));
    }

    private static void checkSupported(final Method method) {
        if (method.getTypeParameters().length > 0) {
            LOGGER.log(Level.WARNING, "Refusing to wrap generic method {0}.", method);
            throw new InterceptionException(Reason.UNSUPPORTED_METHOD,
                "Generic method %s cannot be wrapped".formatted(method));
        }

        final var declaringClass = method.getDeclaringClass();
        if (!Modifier.isStatic(method.getModifiers())
                && (declaringClass.isRecord() || PRIMITIVE_WRAPPERS.contains(declaringClass))) {
            LOGGER.log(Level.WARNING, "Refusing to wrap instance method {0} of a value type.", method);
            throw new InterceptionException(Reason.UNSUPPORTED_METHOD,
                "Instance method %s of value type %s cannot be wrapped".formatted(method, declaringClass.getName()));
        }

        final int arity = (Modifier.isStatic(method.getModifiers()) ? 0 : 1) + method.getParameterCount()
            + ((method.getReturnType() == void.class) ? 0 : 1);
        if (arity > MAX_ARITY) {
            LOGGER.log(Level.WARNING, "Refusing to wrap method {0} of arity {1}.", method, arity);
            throw new InterceptionException(Reason.TOO_MANY_PARAMETERS,
                "Method %s has %d parameters and return values, at most %d are supported"
                    .formatted(method, arity, MAX_ARITY));
        }
    }

    /**
     * Returns the type of the handle obtained by unreflecting the provided {@code method}.
     */
    private static MethodType openType(final Method method) {
        final var type = MethodType.methodType(method.getReturnType(), method.getParameterTypes());
        return Modifier.isStatic(method.getModifiers())
            ? type
            : type.insertParameterTypes(0, method.getDeclaringClass());
    }

    private static boolean[] byReference(final MethodType openType) {
        final var byReference = new boolean[openType.parameterCount()];
        for (int index = 0; index < byReference.length; index++)
            byReference[index] = Ref.class.isAssignableFrom(openType.parameterType(index));
        return byReference;
    }

    private static MethodHandle unreflect(final Method method, final MethodType invokeType) {
        if (!method.trySetAccessible())
            LOGGER.log(Level.DEBUG, "Unable to suppress access checks for {0}.", method);
        try {
            return MethodHandles.lookup().unreflect(method).asType(invokeType);
        } catch (final IllegalAccessException exception) {
            throw new InterceptionException(Reason.INACCESSIBLE_METHOD,
                "Method %s is not accessible".formatted(method), exception);
        }
    }
}
