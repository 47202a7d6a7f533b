package dev.blanke.ilpatcher.template;

import java.util.List;
import java.util.Objects;

import dev.blanke.ilpatcher.cil.ElementType;
import dev.blanke.ilpatcher.module.MethodDescriptor;
import dev.blanke.ilpatcher.module.ModuleImage;
import dev.blanke.ilpatcher.patch.MethodBodyLocator;
import dev.blanke.ilpatcher.patch.PatchException;

/**
 * The data model encapsulates fields that are available in the context of the module listing template.
 *
 * @param module The file name of the listed module.
 *
 * @param types The type definitions of the module in {@code TypeDef} table order, including the {@code <Module>}
 *              pseudo-type holding global methods.
 */
public record DataModel(String module, List<TypeListing> types) {

    public DataModel {
        Objects.requireNonNull(module);
        types = List.copyOf(types);
    }

    /**
     * @param name The qualified name of the type.
     */
    public record TypeListing(String name, List<MethodListing> methods) {

        public TypeListing {
            methods = List.copyOf(methods);
        }
    }

    /**
     * @param returnCategory The name of the {@link dev.blanke.ilpatcher.cil.ReturnCategory}, or a description of the
     *                       return element type if the return type is unsupported.
     *
     * @param rva The RVA of the method body in hexadecimal notation.
     *
     * @param body A description of the body header, or of the reason why the body cannot be located.
     */
    public record MethodListing(String name, boolean isStatic, int parameterCount, String returnCategory, String rva,
                                String body) {}

    /**
     * Creates the data model describing the provided module.
     *
     * @param module The module to list.
     *
     * @param locator The locator used to describe the body of each method.
     *
     * @return The populated data model.
     */
    public static DataModel of(final ModuleImage module, final MethodBodyLocator locator) {
        final var types = module.types().stream()
            .map(type -> new TypeListing(type.fullName(), module.methods(type).stream()
                .map(method -> toListing(module, method, locator))
                .toList()))
            .toList();
        return new DataModel(module.path().getFileName().toString(), types);
    }

    private static MethodListing toListing(final ModuleImage module, final MethodDescriptor method,
                                           final MethodBodyLocator locator) {
        final var returnCategory = (method.returnCategory() != null)
            ? method.returnCategory().name()
            : "unsupported " + ElementType.describe(method.returnElementType());

        String body;
        try {
            final var location = locator.locate(module, method);
            final var header = location.header();
            body = "%s header, %d code bytes%s".formatted(header.encoding().name().toLowerCase(), header.codeSize(),
                header.hasExtraSections() ? ", exception handlers" : "");
        } catch (final PatchException exception) {
            body = exception.getFailure().name();
        }
        return new MethodListing(method.name(), method.isStatic(), method.parameterCount(), returnCategory,
            "0x%08X".formatted(method.rva()), body);
    }
}
