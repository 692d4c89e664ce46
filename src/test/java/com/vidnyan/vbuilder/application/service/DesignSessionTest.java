package com.vidnyan.vbuilder.application.service;

import com.vidnyan.vbuilder.VbuilderProperties;
import com.vidnyan.vbuilder.adapter.out.codec.Base64SnapshotCodec;
import com.vidnyan.vbuilder.adapter.out.file.LocalTextFileStore;
import com.vidnyan.vbuilder.adapter.out.parser.VerilogModuleParser;
import com.vidnyan.vbuilder.adapter.out.snapshot.JsonProjectSnapshotSerializer;
import com.vidnyan.vbuilder.application.port.in.DesignSessionUseCase.LoadResult;
import com.vidnyan.vbuilder.application.port.in.DesignSessionUseCase.SaveResult;
import com.vidnyan.vbuilder.config.VbuilderConfiguration;
import com.vidnyan.vbuilder.domain.error.ConflictingSignalKindException;
import com.vidnyan.vbuilder.domain.error.ParseException;
import com.vidnyan.vbuilder.domain.error.ProjectIoException;
import com.vidnyan.vbuilder.domain.error.SnapshotDecodeException;
import com.vidnyan.vbuilder.domain.graph.ModuleRegistration;
import com.vidnyan.vbuilder.domain.model.ConnectionKind;
import com.vidnyan.vbuilder.domain.model.PortDirection;
import com.vidnyan.vbuilder.domain.model.VerilogModule;
import com.vidnyan.vbuilder.domain.model.WidthSpec;
import com.vidnyan.vbuilder.domain.snapshot.ProjectSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DesignSessionTest {

    @TempDir
    Path tempDir;

    private VbuilderProperties properties;
    private Path counterFile;
    private Path adderFile;

    private DesignSession newSession() {
        LocalTextFileStore files = new LocalTextFileStore();
        JsonProjectSnapshotSerializer serializer = new JsonProjectSnapshotSerializer(
                new VbuilderConfiguration().objectMapper(), new Base64SnapshotCodec());
        return new DesignSession(new VerilogModuleParser(), files, serializer, properties);
    }

    @BeforeEach
    void setUp() throws IOException {
        properties = new VbuilderProperties();
        counterFile = tempDir.resolve("counter.v");
        Files.writeString(counterFile, """
                module counter #(parameter WIDTH = 8) (
                  input clk,
                  input rst,
                  output [WIDTH-1:0] count
                );
                endmodule
                """);
        adderFile = tempDir.resolve("adder.sv");
        Files.writeString(adderFile, "module adder(input [7:0] a, input [7:0] b, output [8:0] sum); endmodule\n");
    }

    private DesignSession buildDesign() {
        DesignSession session = newSession();
        session.parseModule(counterFile);
        session.parseModule(adderFile);
        session.instantiate("counter", "u_cnt");
        session.instantiate("adder", "u_add");
        session.setConnection("u_cnt", "clk", ConnectionKind.INPUT, "clk");
        session.setConnection("u_cnt", "rst", ConnectionKind.INPUT, "rst_n");
        session.setConnection("u_cnt", "count", ConnectionKind.WIRE, "cnt");
        session.setConnection("u_add", "a", ConnectionKind.WIRE, "cnt");
        session.setConnection("u_add", "sum", ConnectionKind.OUTPUT, "total");
        session.setParameterOverride("u_cnt", "WIDTH", "8");
        return session;
    }

    @Test
    void parseModule_ShouldAddModuleWithAbsoluteSourcePath() {
        DesignSession session = newSession();

        ModuleRegistration registration = session.parseModule(counterFile);

        VerilogModule counter = registration.module();
        assertFalse(registration.isRefresh());
        assertEquals(counterFile.toAbsolutePath().normalize().toString(), counter.sourcePath());
        assertEquals(List.of("clk", "rst", "count"), counter.portNames());
        assertEquals(WidthSpec.expression("WIDTH"), counter.findPort("count").orElseThrow().width());
    }

    @Test
    void parseModule_ShouldLeaveLibraryUnchangedOnParseError() throws IOException {
        Path broken = tempDir.resolve("broken.v");
        Files.writeString(broken, "module broken(inptu a); endmodule");
        DesignSession session = newSession();

        assertThrows(ParseException.class, () -> session.parseModule(broken));
        assertThrows(ProjectIoException.class, () -> session.parseModule(tempDir.resolve("missing.v")));
        assertTrue(session.modules().isEmpty());
    }

    @Test
    void refreshModule_ShouldPickUpEditedSource() throws IOException {
        DesignSession session = buildDesign();
        Files.writeString(counterFile, """
                module counter #(parameter WIDTH = 8) (
                  input clk,
                  output [WIDTH-1:0] count,
                  output wrap
                );
                endmodule
                """);

        ModuleRegistration registration = session.refreshModule("counter");

        assertTrue(registration.isRefresh());
        assertEquals(List.of("u_cnt.rst"), registration.droppedConnections());
        assertEquals(List.of("clk", "count", "wrap"), session.module("counter").portNames());
        assertTrue(session.instance("u_cnt").connection("count").isSet());
    }

    @Test
    void saveProject_ShouldWriteGeneratedTextFollowedByMarkerLine() throws IOException {
        DesignSession session = buildDesign();
        Path project = tempDir.resolve("soc_top.v");

        SaveResult result = session.saveProject(project);

        String text = Files.readString(project);
        assertEquals("soc_top", result.topModuleName());
        assertEquals("soc_top", session.topModuleName());
        assertTrue(text.startsWith("// Auto-generated top module: soc_top\nmodule soc_top ("));
        assertTrue(text.contains("endmodule\n\n" + ProjectSnapshot.MARKER + " "));
        assertTrue(text.endsWith("\n"));
        assertEquals(1, text.lines().filter(l -> l.startsWith(ProjectSnapshot.MARKER)).count());
        assertEquals(session.generateText(), text.substring(0, text.indexOf("\n" + ProjectSnapshot.MARKER)));
    }

    @Test
    void saveProject_ShouldKeepTopNameWhenFileNameIsNotAnIdentifier() {
        DesignSession session = buildDesign();

        session.saveProject(tempDir.resolve("my-design.v"));

        assertEquals("top", session.topModuleName());
    }

    @Test
    void saveProject_ShouldNotWriteWhenGenerationFails() {
        DesignSession session = buildDesign();
        session.setConnection("u_add", "b", ConnectionKind.INPUT, "cnt");
        Path project = tempDir.resolve("conflict.v");

        assertThrows(ConflictingSignalKindException.class, () -> session.saveProject(project));
        assertFalse(Files.exists(project));
        assertEquals("top", session.topModuleName());
    }

    @Test
    void loadProject_ShouldRoundTripToIdenticalText() throws IOException {
        // Arrange
        Path project = tempDir.resolve("system.v");
        buildDesign().saveProject(project);
        String saved = Files.readString(project);

        // Act
        DesignSession reopened = newSession();
        LoadResult result = reopened.loadProject(project);
        reopened.saveProject(project);

        // Assert
        assertTrue(result.restored());
        assertEquals(2, result.moduleCount());
        assertEquals(2, result.instanceCount());
        assertTrue(result.staleModules().isEmpty());
        assertEquals(saved, Files.readString(project));
        assertEquals(List.of("u_cnt", "u_add"), reopened.instances().stream().map(i -> i.name()).toList());
    }

    @Test
    void loadProject_ShouldRestoreStaleModulesWhenSourcesAreGone() throws IOException {
        Path project = tempDir.resolve("system.v");
        DesignSession original = buildDesign();
        original.saveProject(project);
        Files.delete(adderFile);

        DesignSession reopened = newSession();
        LoadResult result = reopened.loadProject(project);

        assertEquals(List.of("adder"), result.staleModules());
        VerilogModule adder = reopened.module("adder");
        assertTrue(adder.stale());
        assertEquals(List.of("a", "b", "sum"), adder.portNames());
        assertFalse(reopened.module("counter").stale());
        assertEquals(original.generateText(), reopened.generateText());
    }

    @Test
    void loadProject_ShouldReparseReadableSourcesWhenConfigured() throws IOException {
        Path project = tempDir.resolve("system.v");
        buildDesign().saveProject(project);
        Files.writeString(adderFile, "module adder(input [15:0] a, input [15:0] b, output [16:0] sum); endmodule\n");
        properties.setReparseSourcesOnLoad(true);

        DesignSession reopened = newSession();
        reopened.loadProject(project);

        assertEquals(WidthSpec.literal(16), reopened.module("adder").findPort("a").orElseThrow().width());
        assertEquals(PortDirection.OUTPUT, reopened.module("adder").findPort("sum").orElseThrow().direction());
        assertTrue(reopened.instance("u_add").connection("a").isSet());
    }

    @Test
    void loadProject_ShouldMarkModuleStaleWhenReparseFails() throws IOException {
        Path project = tempDir.resolve("system.v");
        buildDesign().saveProject(project);
        Files.writeString(adderFile, "module adder(input [7:0 a); endmodule\n");
        properties.setReparseSourcesOnLoad(true);

        DesignSession reopened = newSession();
        LoadResult result = reopened.loadProject(project);

        assertEquals(List.of("adder"), result.staleModules());
        assertTrue(reopened.module("adder").stale());
    }

    @Test
    void loadProject_ShouldKeepSessionWhenFileHasNoProjectData() throws IOException {
        Path plain = tempDir.resolve("plain.v");
        Files.writeString(plain, "module plain; endmodule\n");
        DesignSession session = buildDesign();

        LoadResult result = session.loadProject(plain);

        assertFalse(result.restored());
        assertEquals(2, session.instances().size());
    }

    @Test
    void loadProject_ShouldKeepSessionWhenProjectDataIsCorrupt() throws IOException {
        Path corrupt = tempDir.resolve("corrupt.v");
        Files.writeString(corrupt, "module top();\nendmodule\n\n" + ProjectSnapshot.MARKER + " @@not-data@@\n");
        DesignSession session = buildDesign();

        assertThrows(SnapshotDecodeException.class, () -> session.loadProject(corrupt));
        assertEquals(2, session.modules().size());
    }

    @Test
    void deleteModule_ShouldSucceedOnceInstancesAreGone() {
        DesignSession session = buildDesign();

        session.deleteInstance("u_add");
        VerilogModule removed = session.deleteModule("adder");

        assertEquals("adder", removed.name());
        assertEquals(List.of("counter"), session.modules().stream().map(VerilogModule::name).toList());
        assertFalse(session.generateText().contains("u_add"));
    }
}
