package com.vidnyan.vbuilder.domain.error;

import com.vidnyan.vbuilder.domain.model.ConnectionKind;
import com.vidnyan.vbuilder.domain.model.PortDirection;

/**
 * A connection kind is not legal for the direction the port was declared with.
 */
public class DirectionMismatchException extends DesignException {

    public DirectionMismatchException(String instanceName, String portName,
                                      PortDirection direction, ConnectionKind kind) {
        super(ErrorKind.DIRECTION_MISMATCH, String.format(
                "Port '%s.%s' is declared %s and cannot take a '%s' connection",
                instanceName, portName, direction.keyword(), kind.keyword()));
    }
}
