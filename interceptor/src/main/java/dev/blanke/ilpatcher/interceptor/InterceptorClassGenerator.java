package dev.blanke.ilpatcher.interceptor;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodType;

import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Label;
import org.objectweb.asm.Type;
import org.objectweb.asm.commons.GeneratorAdapter;
import org.objectweb.asm.commons.Method;
import org.objectweb.asm.util.CheckClassAdapter;

import static org.objectweb.asm.Opcodes.*;

/**
 * Generates the class file of an interception wrapper for a single method type.
 * <p>
 * The generated class holds the {@link InterceptorState} and the target {@link MethodHandle} in final fields and
 * declares one instance method, {@code invoke}, whose type is the erased type of the intercepted method. Given an
 * instance method {@code int Calculator.add(int, Ref)}, the generated code is equivalent to:
 * <pre>{@code
 * final class InterceptorWrapper {
 *
 *     private final InterceptorState state;
 *     private final MethodHandle target;
 *
 *     InterceptorWrapper(InterceptorState state, MethodHandle target) {
 *         this.state  = state;
 *         this.target = target;
 *     }
 *
 *     public int invoke(Object instance, int a, Object b) {
 *         Object[] arguments = { Integer.valueOf(a), InterceptorRuntime.dereference(b) };
 *         try {
 *             InterceptorRuntime.onEnter(state, instance, arguments);
 *             int result = (int) target.invokeExact(instance, a, b);
 *             InterceptorRuntime.onExit(state, instance, Integer.valueOf(result), arguments);
 *             return result;
 *         } catch (Throwable fault) {
 *             InterceptorRuntime.onException(state, instance, fault, arguments);
 *             throw fault;
 *         }
 *     }
 * }
 * }</pre>
 */
final class InterceptorClassGenerator {

    /**
     * The internal name of generated classes. As they are defined as hidden classes, the JVM appends a unique suffix
     * upon definition.
     */
    static final String INTERNAL_NAME = "dev/blanke/ilpatcher/interceptor/InterceptorWrapper";

    static final String INVOKE_METHOD_NAME = "invoke";

    private static final Type OWNER_TYPE         = Type.getObjectType(INTERNAL_NAME);
    private static final Type OBJECT_TYPE        = Type.getType(Object.class);
    private static final Type OBJECT_ARRAY_TYPE  = Type.getType(Object[].class);
    private static final Type THROWABLE_TYPE     = Type.getType(Throwable.class);
    private static final Type STATE_TYPE         = Type.getType(InterceptorState.class);
    private static final Type METHOD_HANDLE_TYPE = Type.getType(MethodHandle.class);
    private static final Type RUNTIME_TYPE       = Type.getType(InterceptorRuntime.class);

    private static final String STATE_FIELD  = "state";
    private static final String TARGET_FIELD = "target";

    // region InterceptorRuntime methods
    private static final Method ON_ENTER = new Method("onEnter", Type.VOID_TYPE,
        new Type[] { STATE_TYPE, OBJECT_TYPE, OBJECT_ARRAY_TYPE });

    private static final Method ON_EXIT = new Method("onExit", Type.VOID_TYPE,
        new Type[] { STATE_TYPE, OBJECT_TYPE, OBJECT_TYPE, OBJECT_ARRAY_TYPE });

    private static final Method ON_EXCEPTION = new Method("onException", Type.VOID_TYPE,
        new Type[] { STATE_TYPE, OBJECT_TYPE, THROWABLE_TYPE, OBJECT_ARRAY_TYPE });

    private static final Method DEREFERENCE = new Method("dereference", OBJECT_TYPE, new Type[] { OBJECT_TYPE });
    // endregion

    static final MethodType CONSTRUCTOR_TYPE =
        MethodType.methodType(void.class, InterceptorState.class, MethodHandle.class);

    private InterceptorClassGenerator() {
        // Prevent instantiation of utility class.
    }

    /**
     * Generates a wrapper class for methods of the provided erased type.
     *
     * @param invokeType The erased type of the intercepted method, with the receiver prepended as first parameter
     *                   for instance methods.
     *
     * @param hasReceiver Whether the first parameter of {@code invokeType} is the receiver of an instance method,
     *                    which is reported to the hooks as instance instead of being part of the argument snapshot.
     *
     * @param byReference For each parameter of {@code invokeType}, whether it is a {@link Ref} to be dereferenced
     *                    for the argument snapshot.
     *
     * @param verify Whether the generated code should be checked by ASM's {@link CheckClassAdapter} while being
     *               written.
     *
     * @return The class file bytes.
     */
    static byte[] generate(final MethodType invokeType, final boolean hasReceiver, final boolean[] byReference,
                           final boolean verify) {
        final var writer = new ClassWriter(ClassWriter.COMPUTE_FRAMES);
        final ClassVisitor visitor = verify ? new CheckClassAdapter(writer, false) : writer;

        visitor.visit(V17, (ACC_FINAL | ACC_SUPER | ACC_SYNTHETIC), INTERNAL_NAME, null,
            OBJECT_TYPE.getInternalName(), null);
        visitor.visitField((ACC_PRIVATE | ACC_FINAL), STATE_FIELD, STATE_TYPE.getDescriptor(), null, null)
            .visitEnd();
        visitor.visitField((ACC_PRIVATE | ACC_FINAL), TARGET_FIELD, METHOD_HANDLE_TYPE.getDescriptor(), null, null)
            .visitEnd();

        generateConstructor(visitor);
        generateInvoke(visitor, Type.getMethodType(invokeType.toMethodDescriptorString()), hasReceiver, byReference);

        visitor.visitEnd();
        return writer.toByteArray();
    }

    private static void generateConstructor(final ClassVisitor visitor) {
        final var constructor = new GeneratorAdapter(0,
            new Method("<init>", CONSTRUCTOR_TYPE.toMethodDescriptorString()), null, null, visitor);
        constructor.visitCode();
        constructor.loadThis();
        constructor.invokeConstructor(OBJECT_TYPE, Method.getMethod("void <init> ()"));
        constructor.loadThis();
        constructor.loadArg(0);
        constructor.putField(OWNER_TYPE, STATE_FIELD, STATE_TYPE);
        constructor.loadThis();
        constructor.loadArg(1);
        constructor.putField(OWNER_TYPE, TARGET_FIELD, METHOD_HANDLE_TYPE);
        constructor.returnValue();
        constructor.endMethod();
    }

    private static void generateInvoke(final ClassVisitor visitor, final Type invokeType, final boolean hasReceiver,
                                       final boolean[] byReference) {
        final var invokeMethod = new Method(INVOKE_METHOD_NAME, invokeType.getDescriptor());
        final var generator    = new GeneratorAdapter(ACC_PUBLIC, invokeMethod, null, null, visitor);

        final Type[] argumentTypes = invokeType.getArgumentTypes();
        final Type   returnType    = invokeType.getReturnType();
        final int    firstArgument = hasReceiver ? 1 : 0;

        generator.visitCode();

        final var tryStart = new Label();
        final var tryEnd   = new Label();
        final var handler  = new Label();
        // The block has to be visited before any of its labels.
        generator.visitTryCatchBlock(tryStart, tryEnd, handler, THROWABLE_TYPE.getInternalName());

        // region Argument snapshot
        generator.push(argumentTypes.length - firstArgument);
        generator.newArray(OBJECT_TYPE);
        for (int index = firstArgument; index < argumentTypes.length; index++) {
            generator.dup();
            generator.push(index - firstArgument);
            generator.loadArg(index);
            generator.valueOf(argumentTypes[index]);
            if (byReference[index])
                generator.invokeStatic(RUNTIME_TYPE, DEREFERENCE);
            generator.arrayStore(OBJECT_TYPE);
        }
        final int arguments = generator.newLocal(OBJECT_ARRAY_TYPE);
        generator.storeLocal(arguments);

        final int instance = generator.newLocal(OBJECT_TYPE);
        if (hasReceiver)
            generator.loadArg(0);
        else
            generator.visitInsn(ACONST_NULL);
        generator.storeLocal(instance);
        // endregion

        generator.mark(tryStart);

        loadHookArguments(generator, instance);
        generator.loadLocal(arguments);
        generator.invokeStatic(RUNTIME_TYPE, ON_ENTER);

        generator.loadThis();
        generator.getField(OWNER_TYPE, TARGET_FIELD, METHOD_HANDLE_TYPE);
        generator.loadArgs();
        // MethodHandle.invokeExact is signature polymorphic: the descriptor at the call site is the erased type.
        generator.invokeVirtual(METHOD_HANDLE_TYPE, new Method("invokeExact", invokeType.getDescriptor()));

        final boolean isVoid = returnType.getSort() == Type.VOID;
        final int result = isVoid ? -1 : generator.newLocal(returnType);
        if (!isVoid)
            generator.storeLocal(result);

        loadHookArguments(generator, instance);
        if (isVoid) {
            generator.visitInsn(ACONST_NULL);
        } else {
            generator.loadLocal(result);
            generator.valueOf(returnType);
        }
        generator.loadLocal(arguments);
        generator.invokeStatic(RUNTIME_TYPE, ON_EXIT);

        generator.mark(tryEnd);

        if (!isVoid)
            generator.loadLocal(result);
        generator.returnValue();

        // region Exception handler
        generator.mark(handler);
        final int fault = generator.newLocal(THROWABLE_TYPE);
        generator.storeLocal(fault);

        loadHookArguments(generator, instance);
        generator.loadLocal(fault);
        generator.loadLocal(arguments);
        generator.invokeStatic(RUNTIME_TYPE, ON_EXCEPTION);

        generator.loadLocal(fault);
        generator.throwException();
        // endregion

        generator.endMethod();
    }

    /**
     * Pushes the state and the instance, the leading arguments of every {@link InterceptorRuntime} hook method.
     */
    private static void loadHookArguments(final GeneratorAdapter generator, final int instance) {
        generator.loadThis();
        generator.getField(OWNER_TYPE, STATE_FIELD, STATE_TYPE);
        generator.loadLocal(instance);
    }
}
