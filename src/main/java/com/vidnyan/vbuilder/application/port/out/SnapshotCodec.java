package com.vidnyan.vbuilder.application.port.out;

/**
 * Opaque byte/text codec for the embedded project snapshot.
 * Encoded text must fit on a single line.
 */
public interface SnapshotCodec {

    String encode(byte[] data);

    /**
     * @throws com.vidnyan.vbuilder.domain.error.SnapshotDecodeException if the text is not valid codec output
     */
    byte[] decode(String text);
}
