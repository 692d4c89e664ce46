package com.vidnyan.vbuilder.adapter.out.file;

import com.vidnyan.vbuilder.adapter.out.parser.VerilogModuleParser;
import com.vidnyan.vbuilder.domain.error.ProjectIoException;
import com.vidnyan.vbuilder.domain.model.VerilogModule;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LocalTextFileStoreTest {

    @TempDir
    Path tempDir;

    private final LocalTextFileStore store = new LocalTextFileStore();

    @Test
    void read_ShouldReplaceBytesThatAreNotUtf8() throws IOException {
        // Arrange: a GBK-encoded comment above an ASCII module
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        bytes.write("// ".getBytes(StandardCharsets.US_ASCII));
        bytes.write(new byte[] {(byte) 0xC4, (byte) 0xA3, (byte) 0xBF, (byte) 0xE9});
        bytes.write("\nmodule legacy(input a, output b);\nendmodule\n".getBytes(StandardCharsets.US_ASCII));
        Path file = tempDir.resolve("legacy.v");
        Files.write(file, bytes.toByteArray());

        // Act
        String text = store.read(file);
        VerilogModule module = new VerilogModuleParser().parse(text, file.toString());

        // Assert
        assertTrue(text.contains("\uFFFD"));
        assertEquals("legacy", module.name());
        assertEquals(List.of("a", "b"), module.portNames());
    }

    @Test
    void write_ShouldRoundTripUtf8Text() {
        Path file = tempDir.resolve("top.v");

        store.write(file, "// größe\nmodule top; endmodule\n");

        assertEquals("// größe\nmodule top; endmodule\n", store.read(file));
        assertTrue(store.isReadable(file));
    }

    @Test
    void read_ShouldWrapMissingFileAsProjectIoError() {
        Path missing = tempDir.resolve("missing.v");

        assertThrows(ProjectIoException.class, () -> store.read(missing));
        assertFalse(store.isReadable(missing));
        assertFalse(store.isReadable(tempDir));
    }
}
