package com.vidnyan.vbuilder.domain.error;

public class UnknownParameterException extends DesignException {

    public UnknownParameterException(String moduleName, String parameterName) {
        super(ErrorKind.UNKNOWN_PARAMETER,
                "Module '" + moduleName + "' has no overridable parameter '" + parameterName + "'");
    }
}
