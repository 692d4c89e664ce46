package com.vidnyan.vbuilder.domain.snapshot;

import com.vidnyan.vbuilder.domain.error.DesignException;
import com.vidnyan.vbuilder.domain.error.SnapshotDecodeException;
import com.vidnyan.vbuilder.domain.graph.DesignGraph;
import com.vidnyan.vbuilder.domain.model.Instance;
import com.vidnyan.vbuilder.domain.model.VerilogModule;

import java.util.List;

/**
 * Canonical, ordered picture of a design graph as embedded in a saved project.
 * <p>
 * Modules are carried with their full descriptors so that a project loads
 * even when the module sources are gone.
 */
public record ProjectSnapshot(
    String topModuleName,
    List<VerilogModule> modules,
    List<Instance> instances
) {

    /**
     * Prefix of the one line in a saved project that carries the snapshot.
     */
    public static final String MARKER = "// VERILOG_TOOL_DATA:";

    public ProjectSnapshot {
        modules = modules == null ? List.of() : List.copyOf(modules);
        instances = instances == null ? List.of() : List.copyOf(instances);
    }

    public static ProjectSnapshot of(DesignGraph graph) {
        return new ProjectSnapshot(graph.topModuleName(), graph.modules(), graph.instances());
    }

    public ProjectSnapshot withModules(List<VerilogModule> replacement) {
        return new ProjectSnapshot(topModuleName, replacement, instances);
    }

    /**
     * Rebuild a graph in snapshot order.
     * @throws SnapshotDecodeException if the snapshot violates any graph invariant
     */
    public DesignGraph toGraph() {
        try {
            DesignGraph graph = new DesignGraph(topModuleName);
            for (VerilogModule module : modules) {
                if (graph.findModule(module.name()).isPresent()) {
                    throw new SnapshotDecodeException("Snapshot lists module '" + module.name() + "' twice");
                }
                graph.addModule(module);
            }
            for (Instance instance : instances) {
                graph.restoreInstance(instance);
            }
            return graph;
        } catch (SnapshotDecodeException e) {
            throw e;
        } catch (DesignException | IllegalArgumentException e) {
            throw new SnapshotDecodeException("Inconsistent snapshot: " + e.getMessage(), e);
        }
    }
}
