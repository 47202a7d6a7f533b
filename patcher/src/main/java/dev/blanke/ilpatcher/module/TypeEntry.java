package dev.blanke.ilpatcher.module;

import java.util.Objects;

/**
 * A row of the {@code TypeDef} metadata table.
 *
 * @param row The 1-based row number within the {@code TypeDef} table.
 *
 * @param flags The {@code TypeAttributes} of the type.
 *
 * @param namespace The namespace of the type, empty for types without namespace and for nested types.
 *
 * @param name The simple name of the type.
 *
 * @param firstMethod Index of the type's first method within {@link ModuleImage#methods()}.
 *
 * @param methodCount The number of methods declared by the type.
 */
public record TypeEntry(int row, int flags, String namespace, String name, int firstMethod, int methodCount) {

    public TypeEntry {
        Objects.requireNonNull(namespace);
        Objects.requireNonNull(name);
    }

    /**
     * Returns the qualified name used for lookups via {@link ModuleImage#findType(String)}.
     *
     * @return {@code Namespace.Name}, or just {@code Name} if the namespace is empty.
     */
    public String fullName() {
        return namespace.isEmpty() ? name : namespace + '.' + name;
    }

    public int token() {
        return 0x02000000 | row;
    }
}
