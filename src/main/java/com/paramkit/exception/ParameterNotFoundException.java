package com.paramkit.exception;

import com.paramkit.model.ParamAddress;

/**
 * Raised when a parameter is read, written or decorated before it was declared.
 */
public class ParameterNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final transient ParamAddress address;

    public ParameterNotFoundException(ParamAddress address) {
        super("Parameter not declared: " + address);
        this.address = address;
    }

    public ParamAddress getAddress() {
        return address;
    }
}
