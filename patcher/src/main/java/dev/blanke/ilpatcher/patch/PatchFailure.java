package dev.blanke.ilpatcher.patch;

/**
 * The reasons for which a method cannot be patched. Each failure is detected before any output is written.
 */
public enum PatchFailure {

    TYPE_NOT_FOUND,

    METHOD_NOT_FOUND,

    /**
     * The method has no body, as it is abstract, implemented by the runtime, or a P/Invoke stub.
     */
    NO_BODY,

    /**
     * The RVA of the method body does not lie inside any section of the module.
     */
    OFFSET_MAPPING,

    UNSUPPORTED_BODY,

    HAS_EXCEPTION_HANDLERS,

    UNSUPPORTED_RETURN,

    /**
     * The replacement body does not fit into the span of the original one.
     */
    BODY_TOO_LARGE
}
