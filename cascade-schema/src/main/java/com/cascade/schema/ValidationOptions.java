package com.cascade.schema;

/**
 * @param strict report undeclared object keys as UNEXPECTED_FIELD errors; off by default
 */
public record ValidationOptions(boolean strict) {

    public static final ValidationOptions DEFAULT = new ValidationOptions(false);
    public static final ValidationOptions STRICT = new ValidationOptions(true);
}
