package com.vidnyan.vbuilder.application.port.out;

import java.nio.file.Path;

/**
 * Port for whole-file text access.
 * Failures surface as {@link com.vidnyan.vbuilder.domain.error.ProjectIoException}.
 */
public interface TextFileStore {

    /**
     * Read the file fully as UTF-8.
     */
    String read(Path path);

    /**
     * Create or truncate the file and write all of the text.
     */
    void write(Path path, String text);

    boolean isReadable(Path path);
}
