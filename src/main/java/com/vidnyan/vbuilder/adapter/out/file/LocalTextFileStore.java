package com.vidnyan.vbuilder.adapter.out.file;

import com.vidnyan.vbuilder.application.port.out.TextFileStore;
import com.vidnyan.vbuilder.domain.error.ProjectIoException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Local filesystem text store. Files are UTF-8; writes create or truncate.
 * Reads replace undecodable bytes (legacy encodings in comments) with U+FFFD.
 */
@Slf4j
@Component
public class LocalTextFileStore implements TextFileStore {

    @Override
    public String read(Path path) {
        try {
            String text = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
            log.debug("Read {} chars from {}", text.length(), path);
            return text;
        } catch (IOException e) {
            throw new ProjectIoException("Cannot read " + path, e);
        }
    }

    @Override
    public void write(Path path, String text) {
        try {
            Files.writeString(path, text, StandardCharsets.UTF_8);
            log.debug("Wrote {} chars to {}", text.length(), path);
        } catch (IOException e) {
            throw new ProjectIoException("Cannot write " + path, e);
        }
    }

    @Override
    public boolean isReadable(Path path) {
        return Files.isRegularFile(path) && Files.isReadable(path);
    }
}
