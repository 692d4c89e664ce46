package com.vidnyan.vbuilder.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A parsed module descriptor. Immutable value object.
 * <p>
 * A stale module was restored from a project snapshot because its source
 * file could not be read. {@code extensions} holds attributes the core does
 * not interpret.
 */
public record VerilogModule(
    String name,
    String sourcePath,
    List<Port> ports,
    List<Parameter> parameters,
    Map<String, String> macros,
    boolean stale,
    Map<String, String> extensions
) {

    public VerilogModule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Module name is required");
        }
        ports = ports == null ? List.of() : List.copyOf(ports);
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        macros = ordered(macros);
        extensions = ordered(extensions);
    }

    public Optional<Port> findPort(String portName) {
        return ports.stream()
                .filter(p -> p.name().equals(portName))
                .findFirst();
    }

    public Optional<Parameter> findParameter(String parameterName) {
        return parameters.stream()
                .filter(p -> p.name().equals(parameterName))
                .findFirst();
    }

    /**
     * Parameters that an instance may override, in declaration order.
     */
    public List<Parameter> overridableParameters() {
        return parameters.stream()
                .filter(Parameter::isOverridable)
                .toList();
    }

    public List<String> portNames() {
        return ports.stream().map(Port::name).toList();
    }

    public VerilogModule withStale(boolean stale) {
        return new VerilogModule(name, sourcePath, ports, parameters, macros, stale, extensions);
    }

    public VerilogModule withSourcePath(String path) {
        return new VerilogModule(name, path, ports, parameters, macros, stale, extensions);
    }

    /**
     * Builder for VerilogModule.
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    private static Map<String, String> ordered(Map<String, String> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    public static class Builder {
        private final String name;
        private String sourcePath;
        private List<Port> ports = List.of();
        private List<Parameter> parameters = List.of();
        private Map<String, String> macros = Map.of();
        private boolean stale;
        private Map<String, String> extensions = Map.of();

        private Builder(String name) { this.name = name; }

        public Builder sourcePath(String path) { this.sourcePath = path; return this; }
        public Builder ports(List<Port> ports) { this.ports = ports; return this; }
        public Builder parameters(List<Parameter> params) { this.parameters = params; return this; }
        public Builder macros(Map<String, String> macros) { this.macros = macros; return this; }
        public Builder stale(boolean stale) { this.stale = stale; return this; }
        public Builder extensions(Map<String, String> ext) { this.extensions = ext; return this; }

        public VerilogModule build() {
            return new VerilogModule(name, sourcePath, ports, parameters, macros, stale, extensions);
        }
    }
}
