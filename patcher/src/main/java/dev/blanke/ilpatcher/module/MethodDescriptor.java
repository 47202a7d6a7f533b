package dev.blanke.ilpatcher.module;

import java.util.Objects;

import org.jetbrains.annotations.Nullable;

import dev.blanke.ilpatcher.cil.ElementType;
import dev.blanke.ilpatcher.cil.ReturnCategory;

/**
 * Identifies a method definition of a module along with everything the patching pipeline needs to know about it.
 *
 * @param typeName The qualified name of the declaring type, see {@link TypeEntry#fullName()}.
 *
 * @param name The simple name of the method.
 *
 * @param row The 1-based row number within the {@code MethodDef} table.
 *
 * @param rva The relative virtual address of the method body, {@code 0} for abstract, runtime-implemented and
 *            P/Invoke methods.
 *
 * @param flags The {@code MethodAttributes} of the method.
 *
 * @param implFlags The {@code MethodImplAttributes} of the method.
 *
 * @param genericParameterCount The number of generic parameters declared by the method itself.
 *
 * @param parameterCount The number of parameters, not counting {@code this}.
 *
 * @param returnElementType The element type leading the return type of the method signature, see
 *                          {@link ElementType}.
 *
 * @param returnCategory The category of the return type, or {@code null} if no default-returning body can be
 *                       synthesized for it.
 */
public record MethodDescriptor(String typeName, String name, int row, int rva, int flags, int implFlags,
                               int genericParameterCount, int parameterCount, int returnElementType,
                               @Nullable ReturnCategory returnCategory) {

    /**
     * {@code MethodAttributes.Static}.
     */
    public static final int STATIC = 0x0010;

    /**
     * {@code MethodAttributes.Abstract}.
     */
    public static final int ABSTRACT = 0x0400;

    public MethodDescriptor {
        Objects.requireNonNull(typeName);
        Objects.requireNonNull(name);
    }

    public boolean isStatic() {
        return (flags & STATIC) != 0;
    }

    public boolean isAbstract() {
        return (flags & ABSTRACT) != 0;
    }

    public int token() {
        return 0x06000000 | row;
    }

    @Override
    public String toString() {
        return typeName + "::" + name;
    }
}
