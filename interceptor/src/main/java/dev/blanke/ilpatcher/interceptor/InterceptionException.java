package dev.blanke.ilpatcher.interceptor;

import java.util.Objects;

/**
 * Signals that no interception wrapper can be generated for a method.
 */
public final class InterceptionException extends RuntimeException {

    public enum Reason {

        /**
         * The method declares type variables, or is an instance method whose receiver is a value (a record or a
         * primitive wrapper).
         */
        UNSUPPORTED_METHOD,

        /**
         * The number of parameters, counting the receiver and the return value, exceeds
         * {@link MethodInterceptor#MAX_ARITY}.
         */
        TOO_MANY_PARAMETERS,

        INACCESSIBLE_METHOD
    }

    private final Reason reason;

    public InterceptionException(final Reason reason, final String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason);
    }

    public InterceptionException(final Reason reason, final String message, final Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason);
    }

    public Reason getReason() {
        return reason;
    }
}
