package com.vidnyan.vbuilder.domain.error;

public class UnknownInstanceException extends DesignException {

    public UnknownInstanceException(String instanceName) {
        super(ErrorKind.UNKNOWN_INSTANCE, "Unknown instance '" + instanceName + "'");
    }
}
