package com.vidnyan.vbuilder.domain.codegen;

import com.vidnyan.vbuilder.domain.error.ConflictingSignalKindException;
import com.vidnyan.vbuilder.domain.graph.DesignGraph;
import com.vidnyan.vbuilder.domain.model.Connection;
import com.vidnyan.vbuilder.domain.model.ConnectionKind;
import com.vidnyan.vbuilder.domain.model.Instance;
import com.vidnyan.vbuilder.domain.model.Parameter;
import com.vidnyan.vbuilder.domain.model.Port;
import com.vidnyan.vbuilder.domain.model.VerilogIdentifiers;
import com.vidnyan.vbuilder.domain.model.VerilogModule;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a design graph as a top-level Verilog module.
 * <p>
 * Output depends only on the graph: signals appear in discovery order
 * (instance order, then port declaration order) and instances in insertion
 * order, so an unchanged graph always yields identical text. Direction rules
 * are enforced by {@link DesignGraph} and not re-checked here.
 */
public final class TopModuleGenerator {

    static final String INDENT = "  ";

    private TopModuleGenerator() {
    }

    /**
     * A top-level signal and the first port that used it, which fixes its width.
     */
    record Signal(String name, ConnectionKind kind, Port shape, String firstUse) {
    }

    public static String generate(DesignGraph graph) {
        Map<String, Signal> signals = collectSignals(graph);
        String top = graph.topModuleName();

        List<String> lines = new ArrayList<>();
        lines.add("// Auto-generated top module: " + top);
        lines.add("module " + top + " (");

        List<String> ports = new ArrayList<>();
        for (Signal signal : signals.values()) {
            if (signal.kind() != ConnectionKind.WIRE) {
                ports.add(INDENT + signal.kind().keyword() + " wire "
                        + BitWidthNormalizer.declaration(signal.name(), signal.shape()));
            }
        }
        if (!ports.isEmpty()) {
            lines.add(String.join(",\n", ports));
        }
        lines.add(");");
        lines.add("");

        boolean anyWire = false;
        for (Signal signal : signals.values()) {
            if (signal.kind() == ConnectionKind.WIRE) {
                lines.add(INDENT + "wire " + BitWidthNormalizer.declaration(signal.name(), signal.shape()) + ";");
                anyWire = true;
            }
        }
        if (anyWire) {
            lines.add("");
        }

        for (Instance instance : graph.instances()) {
            renderInstance(graph.moduleOf(instance), instance, lines);
            lines.add("");
        }

        lines.add("endmodule");
        return String.join("\n", lines) + "\n";
    }

    /**
     * Deduplicated top-level signals in discovery order.
     * @throws ConflictingSignalKindException when a signal is used with two kinds
     */
    static Map<String, Signal> collectSignals(DesignGraph graph) {
        Map<String, Signal> signals = new LinkedHashMap<>();
        for (Instance instance : graph.instances()) {
            VerilogModule module = graph.moduleOf(instance);
            for (Port port : module.ports()) {
                Connection connection = instance.connection(port.name());
                if (!connection.isSet()) {
                    continue;
                }
                String use = instance.name() + "." + port.name();
                Signal seen = signals.get(connection.signal());
                if (seen == null) {
                    signals.put(connection.signal(),
                            new Signal(connection.signal(), connection.kind(), port, use));
                } else if (seen.kind() != connection.kind()) {
                    throw new ConflictingSignalKindException(
                            connection.signal(), seen.kind(), seen.firstUse(), connection.kind(), use);
                }
            }
        }
        return signals;
    }

    private static void renderInstance(VerilogModule module, Instance instance, List<String> lines) {
        lines.add(INDENT + "// Source: " + (module.sourcePath() != null ? module.sourcePath() : "<unknown>"));

        String head = INDENT + VerilogIdentifiers.emit(module.name()).strip();
        List<Parameter> parameters = module.overridableParameters();
        if (!parameters.isEmpty()) {
            lines.add(head + " #(");
            List<String> assignments = new ArrayList<>();
            for (Parameter parameter : parameters) {
                assignments.add(INDENT + INDENT + "." + VerilogIdentifiers.emit(parameter.name())
                        + "(" + instance.effectiveValue(parameter) + ")");
            }
            lines.add(String.join(",\n", assignments));
            head = INDENT + ")";
        }

        List<String> portMap = new ArrayList<>();
        for (Port port : module.ports()) {
            Connection connection = instance.connection(port.name());
            if (connection.isSet()) {
                portMap.add(INDENT + INDENT + "." + VerilogIdentifiers.emit(port.name())
                        + "(" + connection.signal() + ")");
            }
        }

        String instanceName = VerilogIdentifiers.emit(instance.name()).strip();
        if (portMap.isEmpty()) {
            lines.add(head + " " + instanceName + " ();");
            return;
        }
        lines.add(head + " " + instanceName + " (");
        lines.add(String.join(",\n", portMap));
        lines.add(INDENT + ");");
    }
}
