package com.vidnyan.vbuilder.application.port.in;

import com.vidnyan.vbuilder.domain.graph.ModuleRegistration;
import com.vidnyan.vbuilder.domain.model.ConnectionKind;
import com.vidnyan.vbuilder.domain.model.Instance;
import com.vidnyan.vbuilder.domain.model.VerilogModule;

import java.nio.file.Path;
import java.util.List;

/**
 * Operations a front end performs on one open project.
 * <p>
 * Each call either applies fully or throws a
 * {@link com.vidnyan.vbuilder.domain.error.DesignException} and leaves the
 * project unchanged. Calls must be serialized by the caller.
 */
public interface DesignSessionUseCase {

    /**
     * Parse a module file and add it to the library. Re-parsing the same
     * file refreshes the module in place.
     */
    ModuleRegistration parseModule(Path path);

    /**
     * Re-read a module's source file and refresh its descriptor and instances.
     */
    ModuleRegistration refreshModule(String moduleName);

    VerilogModule deleteModule(String moduleName);

    Instance instantiate(String moduleName, String instanceName);

    Instance renameInstance(String oldName, String newName);

    Instance deleteInstance(String instanceName);

    Instance setConnection(String instanceName, String portName, ConnectionKind kind, String signal);

    Instance clearConnection(String instanceName, String portName);

    /**
     * Blank text clears the override.
     */
    Instance setParameterOverride(String instanceName, String parameterName, String value);

    Instance clearParameterOverride(String instanceName, String parameterName);

    void setTopModuleName(String name);

    String topModuleName();

    List<VerilogModule> modules();

    List<Instance> instances();

    VerilogModule module(String moduleName);

    Instance instance(String instanceName);

    /**
     * Top module text for the current design, without project data.
     */
    String generateText();

    SaveResult saveProject(Path path);

    /**
     * Replace the current project with the one saved in the file.
     * A file without project data leaves the session untouched.
     */
    LoadResult loadProject(Path path);

    /**
     * Save result.
     */
    record SaveResult(
        Path path,
        String topModuleName,
        int moduleCount,
        int instanceCount
    ) {}

    /**
     * Load result. {@code restored} is false when the file held no project data.
     */
    record LoadResult(
        Path path,
        boolean restored,
        String topModuleName,
        int moduleCount,
        int instanceCount,
        List<String> staleModules
    ) {
        public static LoadResult notRestored(Path path) {
            return new LoadResult(path, false, null, 0, 0, List.of());
        }
    }
}
