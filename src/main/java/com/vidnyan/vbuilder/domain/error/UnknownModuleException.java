package com.vidnyan.vbuilder.domain.error;

public class UnknownModuleException extends DesignException {

    public UnknownModuleException(String moduleName) {
        super(ErrorKind.UNKNOWN_MODULE, "Unknown module '" + moduleName + "'");
    }

    public UnknownModuleException(String moduleName, String detail) {
        super(ErrorKind.UNKNOWN_MODULE, "Unknown module '" + moduleName + "': " + detail);
    }
}
