package com.vidnyan.vbuilder.domain.graph;

import com.vidnyan.vbuilder.domain.error.DirectionMismatchException;
import com.vidnyan.vbuilder.domain.error.DuplicateNameException;
import com.vidnyan.vbuilder.domain.error.InUseException;
import com.vidnyan.vbuilder.domain.error.UnknownInstanceException;
import com.vidnyan.vbuilder.domain.error.UnknownModuleException;
import com.vidnyan.vbuilder.domain.error.UnknownParameterException;
import com.vidnyan.vbuilder.domain.error.UnknownPortException;
import com.vidnyan.vbuilder.domain.model.Connection;
import com.vidnyan.vbuilder.domain.model.ConnectionKind;
import com.vidnyan.vbuilder.domain.model.Instance;
import com.vidnyan.vbuilder.domain.model.Parameter;
import com.vidnyan.vbuilder.domain.model.Port;
import com.vidnyan.vbuilder.domain.model.VerilogIdentifiers;
import com.vidnyan.vbuilder.domain.model.VerilogModule;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory model of the module library, the instances and their connections.
 * <p>
 * This is the only place the design is mutated. Every operation validates
 * first and applies afterwards, so a rejected call leaves the graph untouched.
 * Insertion order of modules and instances is kept and drives generation order.
 * <p>
 * Not thread-safe: callers serialize access.
 */
public final class DesignGraph {

    private final Map<String, VerilogModule> modules = new LinkedHashMap<>();
    private final Map<String, Instance> instances = new LinkedHashMap<>();
    private String topModuleName;

    public DesignGraph(String topModuleName) {
        this.topModuleName = VerilogIdentifiers.require("top module", topModuleName);
    }

    /**
     * Independent copy sharing only immutable values.
     */
    public DesignGraph copy() {
        DesignGraph copy = new DesignGraph(topModuleName);
        copy.modules.putAll(modules);
        copy.instances.putAll(instances);
        return copy;
    }

    // ---------------------------------------------------------------- queries

    public String topModuleName() {
        return topModuleName;
    }

    public List<VerilogModule> modules() {
        return List.copyOf(modules.values());
    }

    public List<Instance> instances() {
        return List.copyOf(instances.values());
    }

    public Optional<VerilogModule> findModule(String name) {
        return Optional.ofNullable(modules.get(name));
    }

    public Optional<Instance> findInstance(String name) {
        return Optional.ofNullable(instances.get(name));
    }

    public VerilogModule module(String name) {
        VerilogModule module = modules.get(name);
        if (module == null) {
            throw new UnknownModuleException(name);
        }
        return module;
    }

    public Instance instance(String name) {
        Instance instance = instances.get(name);
        if (instance == null) {
            throw new UnknownInstanceException(name);
        }
        return instance;
    }

    /**
     * Module an instance currently refers to.
     */
    public VerilogModule moduleOf(Instance instance) {
        return module(instance.moduleName());
    }

    /**
     * Names of the instances referencing a module, in insertion order.
     */
    public List<String> instancesOf(String moduleName) {
        return instances.values().stream()
                .filter(i -> i.moduleName().equals(moduleName))
                .map(Instance::name)
                .toList();
    }

    // -------------------------------------------------------------- mutations

    public void setTopModuleName(String name) {
        this.topModuleName = VerilogIdentifiers.require("top module", name);
    }

    /**
     * Add a module to the library. A module with the same name and the same
     * source path is refreshed in place; any other name clash is rejected.
     */
    public ModuleRegistration addModule(VerilogModule module) {
        VerilogModule existing = modules.get(module.name());
        if (existing == null) {
            modules.put(module.name(), module);
            return ModuleRegistration.added(module);
        }
        if (!Objects.equals(existing.sourcePath(), module.sourcePath())) {
            throw new DuplicateNameException(String.format(
                    "Module '%s' already exists (from %s)", module.name(), existing.sourcePath()));
        }
        return refreshModule(module);
    }

    /**
     * Replace a module's attributes, keeping its identity and its instances.
     * Connections of removed ports are dropped, new ports start unset, and a
     * connection whose kind the port's new direction no longer accepts is reset.
     */
    public ModuleRegistration refreshModule(VerilogModule module) {
        VerilogModule existing = modules.get(module.name());
        if (existing == null) {
            throw new UnknownModuleException(module.name());
        }
        if (!Objects.equals(existing.sourcePath(), module.sourcePath())) {
            throw new DuplicateNameException(String.format(
                    "Module '%s' already exists (from %s)", module.name(), existing.sourcePath()));
        }

        List<String> dropped = new ArrayList<>();
        Map<String, Instance> updated = new LinkedHashMap<>();
        for (Instance instance : instances.values()) {
            if (instance.moduleName().equals(module.name())) {
                updated.put(instance.name(), resync(instance, module, dropped));
            }
        }

        modules.put(module.name(), module);
        instances.replaceAll((name, instance) -> updated.getOrDefault(name, instance));
        return ModuleRegistration.refreshed(module, dropped);
    }

    public VerilogModule removeModule(String name) {
        module(name);
        List<String> users = instancesOf(name);
        if (!users.isEmpty()) {
            throw new InUseException(name, users);
        }
        return modules.remove(name);
    }

    public Instance instantiate(String moduleName, String instanceName) {
        VerilogModule module = module(moduleName);
        VerilogIdentifiers.require("instance", instanceName);
        if (instances.containsKey(instanceName)) {
            throw new DuplicateNameException("Instance", instanceName);
        }
        Instance instance = Instance.of(instanceName, module);
        instances.put(instanceName, instance);
        return instance;
    }

    /**
     * Remove an instance together with all connections it owns.
     */
    public Instance removeInstance(String name) {
        instance(name);
        return instances.remove(name);
    }

    /**
     * Rename an instance in place; position, connections and overrides are kept.
     */
    public Instance renameInstance(String oldName, String newName) {
        Instance instance = instance(oldName);
        VerilogIdentifiers.require("instance", newName);
        if (oldName.equals(newName)) {
            return instance;
        }
        if (instances.containsKey(newName)) {
            throw new DuplicateNameException("Instance", newName);
        }

        Instance renamed = instance.withName(newName);
        Map<String, Instance> reordered = new LinkedHashMap<>();
        for (Map.Entry<String, Instance> entry : instances.entrySet()) {
            if (entry.getKey().equals(oldName)) {
                reordered.put(newName, renamed);
            } else {
                reordered.put(entry.getKey(), entry.getValue());
            }
        }
        instances.clear();
        instances.putAll(reordered);
        return renamed;
    }

    /**
     * Bind a port to a top-level signal, enforcing the directionality rule.
     */
    public Instance setConnection(String instanceName, String portName, ConnectionKind kind, String signal) {
        Instance instance = instance(instanceName);
        Port port = port(instance, portName);
        if (kind == null) {
            throw new IllegalArgumentException("Connection kind is required");
        }
        if (!port.direction().accepts(kind)) {
            throw new DirectionMismatchException(instanceName, portName, port.direction(), kind);
        }
        VerilogIdentifiers.require("signal", signal);

        Instance updated = instance.withConnection(portName, Connection.of(kind, signal));
        instances.put(instanceName, updated);
        return updated;
    }

    /**
     * Return a port to the unset state; it is then left out of the port map.
     */
    public Instance clearConnection(String instanceName, String portName) {
        Instance instance = instance(instanceName);
        port(instance, portName);
        Instance updated = instance.withConnection(portName, Connection.UNSET);
        instances.put(instanceName, updated);
        return updated;
    }

    /**
     * Override a parameter for one instance. Blank text clears the override.
     */
    public Instance setParameterOverride(String instanceName, String parameterName, String value) {
        Instance instance = instance(instanceName);
        parameter(instance, parameterName);

        Instance updated = value == null || value.isBlank()
                ? instance.withoutOverride(parameterName)
                : instance.withOverride(parameterName, value.strip());
        instances.put(instanceName, updated);
        return updated;
    }

    public Instance clearParameterOverride(String instanceName, String parameterName) {
        return setParameterOverride(instanceName, parameterName, null);
    }

    /**
     * Re-insert an instance exactly as given, e.g. from a snapshot.
     * The instance must agree with its module's current ports and parameters.
     */
    public Instance restoreInstance(Instance instance) {
        VerilogModule module = module(instance.moduleName());
        VerilogIdentifiers.require("instance", instance.name());
        if (instances.containsKey(instance.name())) {
            throw new DuplicateNameException("Instance", instance.name());
        }
        if (!instance.connections().keySet().equals(new LinkedHashSet<>(module.portNames()))) {
            throw new IllegalArgumentException(String.format(
                    "Instance '%s' connects ports %s but module '%s' declares %s",
                    instance.name(), instance.connections().keySet(), module.name(), module.portNames()));
        }
        for (Port port : module.ports()) {
            Connection connection = instance.connection(port.name());
            if (connection.isSet()) {
                if (!port.direction().accepts(connection.kind())) {
                    throw new DirectionMismatchException(
                            instance.name(), port.name(), port.direction(), connection.kind());
                }
                VerilogIdentifiers.require("signal", connection.signal());
            }
        }
        for (String parameterName : instance.parameterOverrides().keySet()) {
            parameter(instance, parameterName);
        }

        Map<String, Connection> ordered = new LinkedHashMap<>();
        for (Port port : module.ports()) {
            ordered.put(port.name(), instance.connection(port.name()));
        }
        Instance restored = instance.withConnections(ordered);
        instances.put(restored.name(), restored);
        return restored;
    }

    // ---------------------------------------------------------------- helpers

    private Port port(Instance instance, String portName) {
        VerilogModule module = moduleOf(instance);
        return module.findPort(portName)
                .orElseThrow(() -> new UnknownPortException(module.name(), portName));
    }

    private Parameter parameter(Instance instance, String parameterName) {
        VerilogModule module = moduleOf(instance);
        return module.findParameter(parameterName)
                .filter(Parameter::isOverridable)
                .orElseThrow(() -> new UnknownParameterException(module.name(), parameterName));
    }

    private static Instance resync(Instance instance, VerilogModule module, List<String> dropped) {
        Map<String, Connection> connections = new LinkedHashMap<>();
        for (Port port : module.ports()) {
            Connection current = instance.connection(port.name());
            if (current.isSet() && !port.direction().accepts(current.kind())) {
                dropped.add(instance.name() + "." + port.name());
                current = Connection.UNSET;
            }
            connections.put(port.name(), current);
        }
        for (Map.Entry<String, Connection> entry : instance.connections().entrySet()) {
            if (!connections.containsKey(entry.getKey()) && entry.getValue().isSet()) {
                dropped.add(instance.name() + "." + entry.getKey());
            }
        }

        Map<String, String> overrides = new LinkedHashMap<>();
        instance.parameterOverrides().forEach((name, value) -> {
            if (module.findParameter(name).filter(Parameter::isOverridable).isPresent()) {
                overrides.put(name, value);
            }
        });
        return instance.withConnections(connections).withOverrides(overrides);
    }
}
