package com.vidnyan.vbuilder.domain.error;

/**
 * An embedded project snapshot is corrupt, foreign, or inconsistent.
 */
public class SnapshotDecodeException extends DesignException {

    public SnapshotDecodeException(String message) {
        super(ErrorKind.DECODE, message);
    }

    public SnapshotDecodeException(String message, Throwable cause) {
        super(ErrorKind.DECODE, message, cause);
    }
}
