package com.vidnyan.vbuilder.adapter.out.codec;

import com.vidnyan.vbuilder.application.port.out.SnapshotCodec;
import com.vidnyan.vbuilder.domain.error.SnapshotDecodeException;
import org.springframework.stereotype.Component;

import java.util.Base64;

/**
 * Standard (RFC 4648) Base64 without line breaks.
 */
@Component
public class Base64SnapshotCodec implements SnapshotCodec {

    @Override
    public String encode(byte[] data) {
        return Base64.getEncoder().encodeToString(data);
    }

    @Override
    public byte[] decode(String text) {
        try {
            return Base64.getDecoder().decode(text.strip());
        } catch (IllegalArgumentException e) {
            throw new SnapshotDecodeException("Project data is not valid Base64: " + e.getMessage(), e);
        }
    }
}
