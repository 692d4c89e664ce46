package com.vidnyan.vbuilder.application.port.out;

import com.vidnyan.vbuilder.domain.snapshot.ProjectSnapshot;

import java.util.Optional;

/**
 * Port for embedding a project snapshot in generated text and finding it again.
 */
public interface ProjectSnapshotSerializer {

    /**
     * The single marker line carrying the snapshot, without a line terminator.
     */
    String markerLine(ProjectSnapshot snapshot);

    /**
     * Locate and decode the marker line of a saved project.
     * @return empty when the text has no marker line
     * @throws com.vidnyan.vbuilder.domain.error.SnapshotDecodeException on a corrupt
     *         or foreign payload, or when more than one marker line exists
     */
    Optional<ProjectSnapshot> extract(String text);
}
