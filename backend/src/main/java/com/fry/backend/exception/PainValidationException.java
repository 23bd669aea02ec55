package com.fry.backend.exception;

/**
 * A loss event or query argument violated a constraint. Raised before any state is touched.
 */
public class PainValidationException extends RuntimeException {

    private final String field;
    private final String constraint;

    public PainValidationException(String field, String constraint) {
        super(field + " " + constraint);
        this.field = field;
        this.constraint = constraint;
    }

    public String getField() {
        return field;
    }

    public String getConstraint() {
        return constraint;
    }
}
