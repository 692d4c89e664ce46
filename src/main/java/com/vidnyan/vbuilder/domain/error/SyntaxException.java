package com.vidnyan.vbuilder.domain.error;

import com.vidnyan.vbuilder.domain.model.Location;

/**
 * Source text could not be scanned: no module keyword, an unterminated
 * comment, or a header whose nesting never balances.
 */
public class SyntaxException extends DesignException {

    private final Location location;

    public SyntaxException(String message, Location location) {
        super(ErrorKind.SYNTAX, location.format() + ": " + message);
        this.location = location;
    }

    public Location location() {
        return location;
    }
}
