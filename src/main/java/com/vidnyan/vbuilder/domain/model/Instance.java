package com.vidnyan.vbuilder.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A named usage of a module in the top-level design.
 * <p>
 * The module is referenced by name only. The connection map is keyed by the
 * module's port names in declaration order; overrides hold only parameters
 * the user changed. Immutable: every change yields a new instance.
 */
public record Instance(
    String name,
    String moduleName,
    Map<String, Connection> connections,
    Map<String, String> parameterOverrides
) {

    public Instance {
        connections = Collections.unmodifiableMap(new LinkedHashMap<>(connections));
        parameterOverrides = Collections.unmodifiableMap(new LinkedHashMap<>(parameterOverrides));
    }

    /**
     * Fresh instance with every port unset and no overrides.
     */
    public static Instance of(String name, VerilogModule module) {
        Map<String, Connection> connections = new LinkedHashMap<>();
        for (Port port : module.ports()) {
            connections.put(port.name(), Connection.UNSET);
        }
        return new Instance(name, module.name(), connections, Map.of());
    }

    public Connection connection(String portName) {
        return connections.getOrDefault(portName, Connection.UNSET);
    }

    /**
     * Override if one is set, otherwise the parameter's default.
     */
    public String effectiveValue(Parameter parameter) {
        return parameterOverrides.getOrDefault(parameter.name(), parameter.defaultValue());
    }

    public Instance withName(String newName) {
        return new Instance(newName, moduleName, connections, parameterOverrides);
    }

    public Instance withConnection(String portName, Connection connection) {
        Map<String, Connection> updated = new LinkedHashMap<>(connections);
        updated.put(portName, connection);
        return new Instance(name, moduleName, updated, parameterOverrides);
    }

    public Instance withConnections(Map<String, Connection> updated) {
        return new Instance(name, moduleName, updated, parameterOverrides);
    }

    public Instance withOverride(String parameterName, String value) {
        Map<String, String> updated = new LinkedHashMap<>(parameterOverrides);
        updated.put(parameterName, value);
        return new Instance(name, moduleName, connections, updated);
    }

    public Instance withoutOverride(String parameterName) {
        Map<String, String> updated = new LinkedHashMap<>(parameterOverrides);
        updated.remove(parameterName);
        return new Instance(name, moduleName, connections, updated);
    }

    public Instance withOverrides(Map<String, String> updated) {
        return new Instance(name, moduleName, connections, updated);
    }

    public long connectedPortCount() {
        return connections.values().stream().filter(Connection::isSet).count();
    }
}
