package com.vidnyan.vbuilder.domain.error;

import java.io.IOException;

public class ProjectIoException extends DesignException {

    public ProjectIoException(String message, IOException cause) {
        super(ErrorKind.IO, message + ": " + cause.getMessage(), cause);
    }
}
