package io.schedula.core.error;

/**
 * Base type for failures that are reported back to the caller of a coordinator operation.
 * The {@link #code()} is the machine-readable error code surfaced by the HTTP gateway.
 */
public abstract class SchedulaException extends RuntimeException {
    private final String code;

    protected SchedulaException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected SchedulaException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }

    public abstract int httpStatus();
}
