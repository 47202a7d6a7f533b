package dev.blanke.ilpatcher.patch;

import java.util.Objects;

import dev.blanke.ilpatcher.cil.ReturnCategory;
import dev.blanke.ilpatcher.module.MethodDescriptor;

/**
 * Describes a successfully applied patch.
 *
 * @param method The patched method.
 *
 * @param location Where the original body was found and how it was encoded.
 *
 * @param bodyLength The length of the written replacement body, header included. The remainder of the original span
 *                   is zero-filled.
 *
 * @param returnCategory The category whose default value the replacement body returns.
 */
public record PatchResult(MethodDescriptor method, BodyLocation location, int bodyLength,
                          ReturnCategory returnCategory) {

    public PatchResult {
        Objects.requireNonNull(method);
        Objects.requireNonNull(location);
        Objects.requireNonNull(returnCategory);
    }
}
