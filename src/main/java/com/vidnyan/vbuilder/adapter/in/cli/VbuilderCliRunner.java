package com.vidnyan.vbuilder.adapter.in.cli;

import com.vidnyan.vbuilder.application.port.in.DesignSessionUseCase.LoadResult;
import com.vidnyan.vbuilder.application.port.in.DesignSessionUseCase.SaveResult;
import com.vidnyan.vbuilder.application.service.DesignSession;
import com.vidnyan.vbuilder.application.service.DesignSessionFactory;
import com.vidnyan.vbuilder.domain.error.DesignException;
import com.vidnyan.vbuilder.domain.graph.ModuleRegistration;
import com.vidnyan.vbuilder.domain.model.Parameter;
import com.vidnyan.vbuilder.domain.model.Port;
import com.vidnyan.vbuilder.domain.model.VerilogModule;
import com.vidnyan.vbuilder.domain.model.WidthSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * CLI runner for one-shot use without a front end.
 * Runs when vbuilder.inspect.path or vbuilder.regenerate.path is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VbuilderCliRunner implements CommandLineRunner {

    private final DesignSessionFactory sessionFactory;
    private final ConfigurableApplicationContext context;

    @Value("${vbuilder.inspect.path:}")
    private String inspectPath;

    @Value("${vbuilder.regenerate.path:}")
    private String regeneratePath;

    @Override
    public void run(String... args) {
        boolean inspect = inspectPath != null && !inspectPath.isBlank();
        boolean regenerate = regeneratePath != null && !regeneratePath.isBlank();
        if (!inspect && !regenerate) {
            log.info("No input specified. Set vbuilder.inspect.path or vbuilder.regenerate.path.");
            return;
        }

        int exitCode = 0;
        try {
            if (inspect) {
                inspect(Path.of(inspectPath));
            }
            if (regenerate) {
                regenerate(Path.of(regeneratePath));
            }
        } catch (DesignException e) {
            log.error("{} error: {}", e.kind(), e.getMessage());
            exitCode = 1;
        } finally {
            int code = exitCode;
            SpringApplication.exit(context, () -> code);
        }
    }

    private void inspect(Path path) {
        DesignSession session = sessionFactory.newSession();
        ModuleRegistration registration = session.parseModule(path);
        VerilogModule module = registration.module();

        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" MODULE {}", module.name());
        log.info(" Source: {}", module.sourcePath());
        log.info("───────────────────────────────────────────────────────────────");
        log.info(" PORTS ({}):", module.ports().size());
        for (Port port : module.ports()) {
            log.info("   {} {} {}{}", port.direction().keyword(), port.dataType(), port.name(), shape(port));
        }
        log.info(" PARAMETERS ({}):", module.parameters().size());
        for (Parameter parameter : module.parameters()) {
            log.info("   {}{} : {} = {}", parameter.local() ? "localparam " : "", parameter.name(),
                    parameter.typeOrInferred(), parameter.defaultValue());
        }
        if (!module.macros().isEmpty()) {
            log.info(" MACROS ({}):", module.macros().size());
            module.macros().forEach((name, body) -> log.info("   `{} {}", name, body));
        }
        log.info("═══════════════════════════════════════════════════════════════");
    }

    private void regenerate(Path path) {
        DesignSession session = sessionFactory.newSession();
        LoadResult loaded = session.loadProject(path);
        if (!loaded.restored()) {
            log.warn("{} holds no project data; nothing to regenerate", path);
            return;
        }
        SaveResult saved = session.saveProject(path);
        log.info("Regenerated '{}' ({} modules, {} instances, {} stale)",
                saved.topModuleName(), saved.moduleCount(), saved.instanceCount(), loaded.staleModules().size());
    }

    private static String shape(Port port) {
        String packed = port.width().isAbsent() ? "" : " width " + port.width().describe();
        String extra = port.isMultiDimensional()
                ? " dims " + Stream.concat(port.packedDimensions().stream(), port.dimensions().stream())
                        .map(WidthSpec::describe)
                        .collect(Collectors.joining(" x "))
                : "";
        return packed + extra;
    }
}
