package com.vidnyan.vbuilder.domain.error;

public class UnknownPortException extends DesignException {

    public UnknownPortException(String moduleName, String portName) {
        super(ErrorKind.UNKNOWN_PORT,
                "Module '" + moduleName + "' has no port '" + portName + "'");
    }
}
