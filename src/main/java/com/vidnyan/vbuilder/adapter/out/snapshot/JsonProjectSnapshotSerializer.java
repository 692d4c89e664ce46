package com.vidnyan.vbuilder.adapter.out.snapshot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.vbuilder.application.port.out.ProjectSnapshotSerializer;
import com.vidnyan.vbuilder.application.port.out.SnapshotCodec;
import com.vidnyan.vbuilder.domain.error.SnapshotDecodeException;
import com.vidnyan.vbuilder.domain.model.Connection;
import com.vidnyan.vbuilder.domain.model.ConnectionKind;
import com.vidnyan.vbuilder.domain.model.Instance;
import com.vidnyan.vbuilder.domain.model.Parameter;
import com.vidnyan.vbuilder.domain.model.Port;
import com.vidnyan.vbuilder.domain.model.PortDirection;
import com.vidnyan.vbuilder.domain.model.VerilogModule;
import com.vidnyan.vbuilder.domain.model.WidthSpec;
import com.vidnyan.vbuilder.domain.snapshot.ProjectSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot as compact JSON, wrapped by the {@link SnapshotCodec} into one marker line.
 * <p>
 * Collections are written as JSON arrays so that module, instance, port and
 * override order survive the round trip.
 */
@Component
@RequiredArgsConstructor
public class JsonProjectSnapshotSerializer implements ProjectSnapshotSerializer {

    static final int FORMAT_VERSION = 1;

    private final ObjectMapper objectMapper;
    private final SnapshotCodec codec;

    @Override
    public String markerLine(ProjectSnapshot snapshot) {
        try {
            byte[] json = objectMapper.writer()
                    .without(SerializationFeature.INDENT_OUTPUT)
                    .writeValueAsBytes(toDto(snapshot));
            return ProjectSnapshot.MARKER + " " + codec.encode(json);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot serialize project snapshot", e);
        }
    }

    @Override
    public Optional<ProjectSnapshot> extract(String text) {
        List<String> payloads = text.lines()
                .map(String::strip)
                .filter(line -> line.startsWith(ProjectSnapshot.MARKER))
                .map(line -> line.substring(ProjectSnapshot.MARKER.length()).strip())
                .toList();
        if (payloads.isEmpty()) {
            return Optional.empty();
        }
        if (payloads.size() > 1) {
            throw new SnapshotDecodeException(String.format(
                    "Found %d project data lines, expected exactly one", payloads.size()));
        }
        if (payloads.get(0).isEmpty()) {
            throw new SnapshotDecodeException("Project data line is empty");
        }

        byte[] json = codec.decode(payloads.get(0));
        SnapshotDto dto;
        try {
            dto = objectMapper.readValue(json, SnapshotDto.class);
        } catch (IOException e) {
            throw new SnapshotDecodeException("Project data is not a valid snapshot: " + e.getMessage(), e);
        }
        if (dto == null) {
            throw new SnapshotDecodeException("Project data is empty");
        }
        if (dto.formatVersion != FORMAT_VERSION) {
            throw new SnapshotDecodeException("Unsupported project data version " + dto.formatVersion);
        }
        try {
            return Optional.of(snapshot(dto));
        } catch (IllegalArgumentException e) {
            throw new SnapshotDecodeException("Malformed project data: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------- write

    private SnapshotDto toDto(ProjectSnapshot snapshot) {
        SnapshotDto dto = new SnapshotDto();
        dto.formatVersion = FORMAT_VERSION;
        dto.topModuleName = snapshot.topModuleName();
        dto.modules = snapshot.modules().stream().map(this::moduleDto).toList();
        dto.instances = snapshot.instances().stream().map(this::instanceDto).toList();
        return dto;
    }

    private ModuleDto moduleDto(VerilogModule module) {
        ModuleDto dto = new ModuleDto();
        dto.name = module.name();
        dto.sourcePath = module.sourcePath();
        dto.ports = module.ports().stream().map(this::portDto).toList();
        dto.parameters = module.parameters().stream().map(this::parameterDto).toList();
        dto.macros = new LinkedHashMap<>(module.macros());
        dto.extensions = new LinkedHashMap<>(module.extensions());
        return dto;
    }

    private PortDto portDto(Port port) {
        PortDto dto = new PortDto();
        dto.name = port.name();
        dto.direction = port.direction().keyword();
        dto.dataType = port.dataType();
        dto.width = widthDto(port.width());
        dto.packedDimensions = port.packedDimensions().stream().map(this::widthDto).toList();
        dto.dimensions = port.dimensions().stream().map(this::widthDto).toList();
        return dto;
    }

    private ParameterDto parameterDto(Parameter parameter) {
        ParameterDto dto = new ParameterDto();
        dto.name = parameter.name();
        dto.type = parameter.type();
        dto.defaultValue = parameter.defaultValue();
        dto.dimensions = parameter.dimensions().stream().map(this::widthDto).toList();
        dto.local = parameter.local();
        return dto;
    }

    private WidthDto widthDto(WidthSpec width) {
        WidthDto dto = new WidthDto();
        dto.kind = width.kind().name();
        dto.text = width.text();
        return dto;
    }

    private InstanceDto instanceDto(Instance instance) {
        InstanceDto dto = new InstanceDto();
        dto.name = instance.name();
        dto.module = instance.moduleName();
        dto.connections = new ArrayList<>();
        instance.connections().forEach((port, connection) -> {
            ConnectionDto c = new ConnectionDto();
            c.port = port;
            c.kind = connection.isSet() ? connection.kind().keyword() : null;
            c.signal = connection.signal();
            dto.connections.add(c);
        });
        dto.overrides = new ArrayList<>();
        instance.parameterOverrides().forEach((name, value) -> {
            OverrideDto o = new OverrideDto();
            o.name = name;
            o.value = value;
            dto.overrides.add(o);
        });
        return dto;
    }

    // ----------------------------------------------------------------- read

    private ProjectSnapshot snapshot(SnapshotDto dto) {
        List<VerilogModule> modules = new ArrayList<>();
        for (ModuleDto module : orEmpty(dto.modules)) {
            modules.add(module(required(module, "module entry")));
        }
        List<Instance> instances = new ArrayList<>();
        for (InstanceDto instance : orEmpty(dto.instances)) {
            instances.add(instance(required(instance, "instance entry")));
        }
        return new ProjectSnapshot(required(dto.topModuleName, "topModuleName"), modules, instances);
    }

    private VerilogModule module(ModuleDto dto) {
        List<Port> ports = new ArrayList<>();
        for (PortDto port : orEmpty(dto.ports)) {
            required(port, "port entry");
            PortDirection direction = PortDirection.fromKeyword(required(port.direction, "port direction"));
            if (direction == null) {
                throw new IllegalArgumentException("Unknown port direction '" + port.direction + "'");
            }
            ports.add(new Port(required(port.name, "port name"), direction, port.dataType,
                    width(port.width), widths(port.packedDimensions), widths(port.dimensions)));
        }
        List<Parameter> parameters = new ArrayList<>();
        for (ParameterDto parameter : orEmpty(dto.parameters)) {
            required(parameter, "parameter entry");
            parameters.add(new Parameter(required(parameter.name, "parameter name"), parameter.type,
                    parameter.defaultValue, widths(parameter.dimensions), parameter.local));
        }
        return VerilogModule.builder(required(dto.name, "module name"))
                .sourcePath(dto.sourcePath)
                .ports(ports)
                .parameters(parameters)
                .macros(dto.macros)
                .extensions(dto.extensions)
                .build();
    }

    private Instance instance(InstanceDto dto) {
        Map<String, Connection> connections = new LinkedHashMap<>();
        for (ConnectionDto connection : orEmpty(dto.connections)) {
            required(connection, "connection entry");
            Connection value = connection.kind == null
                    ? Connection.UNSET
                    : Connection.of(ConnectionKind.fromKeyword(connection.kind), connection.signal);
            if (connections.put(required(connection.port, "connection port"), value) != null) {
                throw new IllegalArgumentException("Port '" + connection.port + "' connected twice");
            }
        }
        Map<String, String> overrides = new LinkedHashMap<>();
        for (OverrideDto override : orEmpty(dto.overrides)) {
            required(override, "override entry");
            overrides.put(required(override.name, "override name"), required(override.value, "override value"));
        }
        return new Instance(required(dto.name, "instance name"), required(dto.module, "instance module"),
                connections, overrides);
    }

    private static WidthSpec width(WidthDto dto) {
        if (dto == null) {
            return WidthSpec.absent();
        }
        return new WidthSpec(WidthSpec.Kind.valueOf(required(dto.kind, "width kind")), dto.text);
    }

    private static List<WidthSpec> widths(List<WidthDto> dtos) {
        return orEmpty(dtos).stream().map(JsonProjectSnapshotSerializer::width).toList();
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list != null ? list : List.of();
    }

    private static <T> T required(T value, String field) {
        if (value == null) {
            throw new IllegalArgumentException("Missing " + field);
        }
        return value;
    }

    // DTO classes for JSON (de)serialization
    static class SnapshotDto {
        public int formatVersion;
        public String topModuleName;
        public List<ModuleDto> modules;
        public List<InstanceDto> instances;
    }

    static class ModuleDto {
        public String name;
        public String sourcePath;
        public List<PortDto> ports;
        public List<ParameterDto> parameters;
        public Map<String, String> macros;
        public Map<String, String> extensions;
    }

    static class PortDto {
        public String name;
        public String direction;
        public String dataType;
        public WidthDto width;
        public List<WidthDto> packedDimensions;
        public List<WidthDto> dimensions;
    }

    static class ParameterDto {
        public String name;
        public String type;
        public String defaultValue;
        public List<WidthDto> dimensions;
        public boolean local;
    }

    static class WidthDto {
        public String kind;
        public String text;
    }

    static class InstanceDto {
        public String name;
        public String module;
        public List<ConnectionDto> connections;
        public List<OverrideDto> overrides;
    }

    static class ConnectionDto {
        public String port;
        public String kind;
        public String signal;
    }

    static class OverrideDto {
        public String name;
        public String value;
    }
}
