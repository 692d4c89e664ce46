package com.vidnyan.vbuilder.domain.error;

import com.vidnyan.vbuilder.domain.model.Location;

/**
 * A module header was scanned but its declarations are malformed.
 */
public class ParseException extends DesignException {

    private final Location location;

    public ParseException(String message, Location location) {
        super(ErrorKind.PARSE, location.format() + ": " + message);
        this.location = location;
    }

    public Location location() {
        return location;
    }
}
