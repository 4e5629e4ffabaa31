package com.library.circulation.exception;

/**
 * Base type for rejected circulation requests. Every rejection is scoped to the single
 * request that caused it and carries a stable {@link ErrorCode}.
 */
public abstract class CirculationException extends RuntimeException {

    private final ErrorCode code;

    protected CirculationException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected CirculationException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
