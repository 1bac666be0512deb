package com.cascade.query;

/**
 * Thrown when the subtree at a path exists but cannot be decoded into the requested shape.
 */
public final class DecodeMismatchException extends QueryException {

    private final String targetType;

    public DecodeMismatchException(String path, String targetType, Throwable cause) {
        super(path, String.format("Cannot decode %s as %s: %s", path, targetType,
                cause != null ? cause.getMessage() : "incompatible shape"), cause);
        this.targetType = targetType;
    }

    /** Requested Java type, as written by the caller. */
    public String getTargetType() {
        return targetType;
    }
}
