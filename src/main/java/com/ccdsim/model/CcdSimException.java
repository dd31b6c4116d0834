package com.ccdsim.model;

/**
 * Fatal fault raised by the transformation engine and its loaders.
 * <p>
 * A step that throws never hands back a partially transformed converter, so the
 * caller's input value stays valid.
 */
public class CcdSimException extends RuntimeException {

    private final Fault fault;

    public CcdSimException(Fault fault, String message) {
        super(message);
        this.fault = fault;
    }

    public CcdSimException(Fault fault, String message, Throwable cause) {
        super(message, cause);
        this.fault = fault;
    }

    public Fault getFault() {
        return fault;
    }

    @Override
    public String getMessage() {
        return fault + ": " + super.getMessage();
    }
}
