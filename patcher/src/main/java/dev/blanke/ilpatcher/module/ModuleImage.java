package dev.blanke.ilpatcher.module;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The in-memory, read-only image of a CLI module: its raw bytes, its PE section table, and the type and method
 * definitions of its metadata.
 * <p>
 * Instances are created by a {@link ModuleReader} and are safe to share between threads, as neither the exposed
 * bytes nor the tables are ever modified after construction.
 */
public final class ModuleImage {

    private final Path path;

    private final byte[] bytes;

    private final List<SectionHeader> sections;

    private final List<TypeEntry> types;

    /**
     * All method definitions of the module in declaration order, i.e. grouped by declaring type in {@code TypeDef}
     * table order.
     */
    private final List<MethodDescriptor> methods;

    ModuleImage(final Path path, final byte[] bytes, final List<SectionHeader> sections, final List<TypeEntry> types,
                final List<MethodDescriptor> methods) {
        this.path     = Objects.requireNonNull(path);
        this.bytes    = Objects.requireNonNull(bytes);
        this.sections = List.copyOf(sections);
        this.types    = List.copyOf(types);
        this.methods  = List.copyOf(methods);
    }

    public Path path() {
        return path;
    }

    public int length() {
        return bytes.length;
    }

    /**
     * Returns a copy of the module's bytes which may be freely modified by the caller.
     *
     * @return A new array containing the complete file content.
     */
    public byte[] bytes() {
        return bytes.clone();
    }

    /**
     * Returns a read-only, little-endian view of the module's bytes.
     *
     * @return A new {@link ByteBuffer} positioned at the start of the file.
     */
    public ByteBuffer contents() {
        return ByteBuffer.wrap(bytes).asReadOnlyBuffer().order(ByteOrder.LITTLE_ENDIAN);
    }

    public List<SectionHeader> sections() {
        return sections;
    }

    public List<TypeEntry> types() {
        return types;
    }

    public List<MethodDescriptor> methods() {
        return methods;
    }

    public List<MethodDescriptor> methods(final TypeEntry type) {
        return methods.subList(type.firstMethod(), type.firstMethod() + type.methodCount());
    }

    /**
     * Looks up a type by its qualified name.
     *
     * @param fullName The name in the form returned by {@link TypeEntry#fullName()}, e.g. {@code Demo.Sample}.
     *
     * @return The first type in {@code TypeDef} table order with a matching name.
     */
    public Optional<TypeEntry> findType(final String fullName) {
        Objects.requireNonNull(fullName);
        return types.stream().filter(type -> type.fullName().equals(fullName)).findFirst();
    }

    /**
     * Looks up a method declared by the provided {@code type} by its simple name.
     * <p>
     * Overloads are not disambiguated: the first method in declaration order whose name matches is returned.
     *
     * @param type The declaring type.
     *
     * @param name The simple name of the method, e.g. {@code Compute} or {@code .ctor}.
     *
     * @return The first matching method definition.
     */
    public Optional<MethodDescriptor> findMethod(final TypeEntry type, final String name) {
        Objects.requireNonNull(name);
        return methods(type).stream().filter(method -> method.name().equals(name)).findFirst();
    }
}
