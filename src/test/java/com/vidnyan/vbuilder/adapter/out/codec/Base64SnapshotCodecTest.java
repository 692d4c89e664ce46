package com.vidnyan.vbuilder.adapter.out.codec;

import com.vidnyan.vbuilder.domain.error.SnapshotDecodeException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class Base64SnapshotCodecTest {

    private final Base64SnapshotCodec codec = new Base64SnapshotCodec();

    @Test
    void encode_ShouldProduceSingleLine() {
        byte[] data = "{\"a\":1}\n".repeat(200).getBytes(StandardCharsets.UTF_8);

        String encoded = codec.encode(data);

        assertFalse(encoded.contains("\n"));
        assertArrayEquals(data, codec.decode(encoded + "  "));
    }

    @Test
    void decode_ShouldRejectForeignText() {
        SnapshotDecodeException e = assertThrows(SnapshotDecodeException.class, () -> codec.decode("not*base64!"));

        assertTrue(e.getMessage().contains("Base64"));
    }
}
