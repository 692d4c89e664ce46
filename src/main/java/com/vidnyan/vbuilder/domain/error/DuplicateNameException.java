package com.vidnyan.vbuilder.domain.error;

public class DuplicateNameException extends DesignException {

    public DuplicateNameException(String what, String name) {
        super(ErrorKind.DUPLICATE_NAME, what + " '" + name + "' already exists");
    }

    public DuplicateNameException(String message) {
        super(ErrorKind.DUPLICATE_NAME, message);
    }
}
