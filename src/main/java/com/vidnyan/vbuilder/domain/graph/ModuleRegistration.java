package com.vidnyan.vbuilder.domain.graph;

import com.vidnyan.vbuilder.domain.model.VerilogModule;

import java.util.List;

/**
 * Outcome of adding a module to the library.
 * On refresh, {@code droppedConnections} lists the {@code instance.port}
 * connections that no longer fit the new port list.
 */
public record ModuleRegistration(
    Outcome outcome,
    VerilogModule module,
    List<String> droppedConnections
) {

    public enum Outcome {
        ADDED,
        REFRESHED
    }

    public static ModuleRegistration added(VerilogModule module) {
        return new ModuleRegistration(Outcome.ADDED, module, List.of());
    }

    public static ModuleRegistration refreshed(VerilogModule module, List<String> dropped) {
        return new ModuleRegistration(Outcome.REFRESHED, module, List.copyOf(dropped));
    }

    public boolean isRefresh() {
        return outcome == Outcome.REFRESHED;
    }
}
