package com.vidnyan.vbuilder.domain.error;

/**
 * A name supplied by the caller is blank or not a legal Verilog identifier.
 */
public class InvalidNameException extends DesignException {

    public InvalidNameException(String what, String name) {
        super(ErrorKind.INVALID_NAME, "Invalid " + what + " name: '" + name + "'");
    }
}
