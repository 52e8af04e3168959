package com.example.autoschedule.exception;

/**
 * A scheduling policy value that breaks one of the policy invariants.
 */
public class ConstraintViolationException extends RuntimeException {

    private final String constraintType;
    private final Object constraintValue;

    public ConstraintViolationException(String message, String constraintType, Object constraintValue) {
        super(message);
        this.constraintType = constraintType;
        this.constraintValue = constraintValue;
    }

    public String getConstraintType() {
        return constraintType;
    }

    public Object getConstraintValue() {
        return constraintValue;
    }
}
