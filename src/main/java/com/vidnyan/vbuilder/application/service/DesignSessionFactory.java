package com.vidnyan.vbuilder.application.service;

import com.vidnyan.vbuilder.VbuilderProperties;
import com.vidnyan.vbuilder.application.port.out.ModuleSourceParser;
import com.vidnyan.vbuilder.application.port.out.ProjectSnapshotSerializer;
import com.vidnyan.vbuilder.application.port.out.TextFileStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Opens independent design sessions over the shared, stateless adapters.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DesignSessionFactory {

    private final ModuleSourceParser moduleSourceParser;
    private final TextFileStore textFileStore;
    private final ProjectSnapshotSerializer snapshotSerializer;
    private final VbuilderProperties properties;

    public DesignSession newSession() {
        log.debug("Opening design session (top '{}')", properties.getDefaultTopName());
        return new DesignSession(moduleSourceParser, textFileStore, snapshotSerializer, properties);
    }
}
