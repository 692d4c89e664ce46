package com.vidnyan.vbuilder.application.service;

import com.vidnyan.vbuilder.VbuilderProperties;
import com.vidnyan.vbuilder.application.port.in.DesignSessionUseCase;
import com.vidnyan.vbuilder.application.port.out.ModuleSourceParser;
import com.vidnyan.vbuilder.application.port.out.ProjectSnapshotSerializer;
import com.vidnyan.vbuilder.application.port.out.TextFileStore;
import com.vidnyan.vbuilder.domain.codegen.TopModuleGenerator;
import com.vidnyan.vbuilder.domain.error.ParseException;
import com.vidnyan.vbuilder.domain.error.ProjectIoException;
import com.vidnyan.vbuilder.domain.error.SyntaxException;
import com.vidnyan.vbuilder.domain.error.UnknownModuleException;
import com.vidnyan.vbuilder.domain.graph.DesignGraph;
import com.vidnyan.vbuilder.domain.graph.ModuleRegistration;
import com.vidnyan.vbuilder.domain.model.ConnectionKind;
import com.vidnyan.vbuilder.domain.model.Instance;
import com.vidnyan.vbuilder.domain.model.Parameter;
import com.vidnyan.vbuilder.domain.model.VerilogIdentifiers;
import com.vidnyan.vbuilder.domain.model.VerilogModule;
import com.vidnyan.vbuilder.domain.snapshot.ProjectSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One open project. Owns its design graph; nothing is shared between sessions.
 * <p>
 * Created through {@link DesignSessionFactory}. Not thread-safe.
 */
@Slf4j
public class DesignSession implements DesignSessionUseCase {

    private final ModuleSourceParser parser;
    private final TextFileStore files;
    private final ProjectSnapshotSerializer serializer;
    private final VbuilderProperties properties;

    private DesignGraph graph;

    public DesignSession(ModuleSourceParser parser, TextFileStore files,
                         ProjectSnapshotSerializer serializer, VbuilderProperties properties) {
        this.parser = parser;
        this.files = files;
        this.serializer = serializer;
        this.properties = properties;
        this.graph = new DesignGraph(properties.getDefaultTopName());
    }

    // ---------------------------------------------------------------- modules

    @Override
    public ModuleRegistration parseModule(Path path) {
        Path source = absolute(path);
        VerilogModule parsed = parser.parse(files.read(source), source.toString());
        ModuleRegistration registration = graph.addModule(parsed);

        log.info("{} module '{}' from {}: ports {}, parameters {}",
                registration.isRefresh() ? "Refreshed" : "Added",
                parsed.name(), source, parsed.portNames(),
                parsed.parameters().stream().map(Parameter::name).toList());
        warnDropped(registration);
        return registration;
    }

    @Override
    public ModuleRegistration refreshModule(String moduleName) {
        VerilogModule existing = graph.module(moduleName);
        if (existing.sourcePath() == null) {
            throw new UnknownModuleException(moduleName, "it has no source file to refresh from");
        }
        Path source = Path.of(existing.sourcePath());
        VerilogModule parsed = parser.parse(files.read(source), existing.sourcePath());
        if (!parsed.name().equals(moduleName)) {
            throw new UnknownModuleException(moduleName,
                    source + " now declares module '" + parsed.name() + "'");
        }
        ModuleRegistration registration = graph.refreshModule(parsed);
        log.info("Refreshed module '{}' from {}", moduleName, source);
        warnDropped(registration);
        return registration;
    }

    @Override
    public VerilogModule deleteModule(String moduleName) {
        VerilogModule removed = graph.removeModule(moduleName);
        log.info("Deleted module '{}'", moduleName);
        return removed;
    }

    // -------------------------------------------------------------- instances

    @Override
    public Instance instantiate(String moduleName, String instanceName) {
        Instance instance = graph.instantiate(moduleName, instanceName);
        log.info("Created instance '{}' of module '{}'", instanceName, moduleName);
        return instance;
    }

    @Override
    public Instance renameInstance(String oldName, String newName) {
        Instance renamed = graph.renameInstance(oldName, newName);
        log.info("Renamed instance '{}' to '{}'", oldName, newName);
        return renamed;
    }

    @Override
    public Instance deleteInstance(String instanceName) {
        Instance removed = graph.removeInstance(instanceName);
        log.info("Deleted instance '{}' ({} connected ports)", instanceName, removed.connectedPortCount());
        return removed;
    }

    @Override
    public Instance setConnection(String instanceName, String portName, ConnectionKind kind, String signal) {
        Instance updated = graph.setConnection(instanceName, portName, kind, signal);
        log.debug("Connected {}.{} as {} '{}'", instanceName, portName, kind.keyword(), signal);
        return updated;
    }

    @Override
    public Instance clearConnection(String instanceName, String portName) {
        Instance updated = graph.clearConnection(instanceName, portName);
        log.debug("Cleared connection {}.{}", instanceName, portName);
        return updated;
    }

    @Override
    public Instance setParameterOverride(String instanceName, String parameterName, String value) {
        Instance updated = graph.setParameterOverride(instanceName, parameterName, value);
        log.debug("Parameter {}.{} = {}", instanceName, parameterName,
                updated.parameterOverrides().getOrDefault(parameterName, "<default>"));
        return updated;
    }

    @Override
    public Instance clearParameterOverride(String instanceName, String parameterName) {
        return setParameterOverride(instanceName, parameterName, null);
    }

    // ------------------------------------------------------------------ views

    @Override
    public void setTopModuleName(String name) {
        graph.setTopModuleName(name);
        log.info("Top module renamed to '{}'", name);
    }

    @Override
    public String topModuleName() {
        return graph.topModuleName();
    }

    @Override
    public List<VerilogModule> modules() {
        return graph.modules();
    }

    @Override
    public List<Instance> instances() {
        return graph.instances();
    }

    @Override
    public VerilogModule module(String moduleName) {
        return graph.module(moduleName);
    }

    @Override
    public Instance instance(String instanceName) {
        return graph.instance(instanceName);
    }

    @Override
    public String generateText() {
        return TopModuleGenerator.generate(graph);
    }

    // ------------------------------------------------------------ persistence

    @Override
    public SaveResult saveProject(Path path) {
        Path target = absolute(path);
        DesignGraph staged = graph.copy();
        String derived = derivedTopName(target);
        if (derived != null) {
            staged.setTopModuleName(derived);
        }

        String text = TopModuleGenerator.generate(staged)
                + "\n"
                + serializer.markerLine(ProjectSnapshot.of(staged))
                + "\n";
        files.write(target, text);
        graph = staged;

        log.info("Saved project '{}' to {}: {} modules, {} instances",
                staged.topModuleName(), target, staged.modules().size(), staged.instances().size());
        return new SaveResult(target, staged.topModuleName(), staged.modules().size(), staged.instances().size());
    }

    @Override
    public LoadResult loadProject(Path path) {
        Path target = absolute(path);
        Optional<ProjectSnapshot> found = serializer.extract(files.read(target));
        if (found.isEmpty()) {
            log.warn("No project data in {}; current project kept", target);
            return LoadResult.notRestored(target);
        }
        ProjectSnapshot snapshot = found.get();

        List<VerilogModule> modules = new ArrayList<>();
        List<VerilogModule> reparsed = new ArrayList<>();
        List<String> stale = new ArrayList<>();
        for (VerilogModule module : snapshot.modules()) {
            Path source = sourceOf(module);
            if (source == null || !files.isReadable(source)) {
                modules.add(module.withStale(true));
                stale.add(module.name());
                continue;
            }
            modules.add(module);
            if (properties.isReparseSourcesOnLoad()) {
                VerilogModule parsed = reparse(module, source);
                if (parsed != null) {
                    reparsed.add(parsed);
                } else {
                    modules.set(modules.size() - 1, module.withStale(true));
                    stale.add(module.name());
                }
            }
        }

        DesignGraph loaded = snapshot.withModules(modules).toGraph();
        for (VerilogModule parsed : reparsed) {
            warnDropped(loaded.refreshModule(parsed));
        }
        graph = loaded;

        if (!stale.isEmpty()) {
            log.warn("Module sources unavailable, using saved descriptors for: {}", stale);
        }
        log.info("Loaded project '{}' from {}: {} modules, {} instances",
                loaded.topModuleName(), target, loaded.modules().size(), loaded.instances().size());
        return new LoadResult(target, true, loaded.topModuleName(),
                loaded.modules().size(), loaded.instances().size(), List.copyOf(stale));
    }

    /**
     * Fresh descriptor for a module, or null if its source no longer yields it.
     */
    private VerilogModule reparse(VerilogModule module, Path source) {
        try {
            VerilogModule parsed = parser.parse(files.read(source), module.sourcePath());
            if (parsed.name().equals(module.name())) {
                return parsed;
            }
            log.warn("{} now declares module '{}' instead of '{}'", source, parsed.name(), module.name());
        } catch (SyntaxException | ParseException | ProjectIoException e) {
            log.warn("Cannot re-parse module '{}': {}", module.name(), e.getMessage());
        }
        return null;
    }

    private String derivedTopName(Path target) {
        if (!properties.isDeriveTopNameFromFile() || target.getFileName() == null) {
            return null;
        }
        String fileName = target.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        return VerilogIdentifiers.isIdentifier(base) ? base : null;
    }

    private static Path sourceOf(VerilogModule module) {
        if (module.sourcePath() == null) {
            return null;
        }
        try {
            return Path.of(module.sourcePath());
        } catch (InvalidPathException e) {
            log.debug("Unusable source path '{}' for module '{}'", module.sourcePath(), module.name());
            return null;
        }
    }

    private static Path absolute(Path path) {
        return path.toAbsolutePath().normalize();
    }

    private static void warnDropped(ModuleRegistration registration) {
        if (!registration.droppedConnections().isEmpty()) {
            log.warn("Module '{}' changed; dropped connections: {}",
                    registration.module().name(), registration.droppedConnections());
        }
    }
}
