package com.vidnyan.vbuilder.domain.codegen;

import com.vidnyan.vbuilder.domain.error.ConflictingSignalKindException;
import com.vidnyan.vbuilder.domain.graph.DesignGraph;
import com.vidnyan.vbuilder.domain.model.ConnectionKind;
import com.vidnyan.vbuilder.domain.model.Parameter;
import com.vidnyan.vbuilder.domain.model.Port;
import com.vidnyan.vbuilder.domain.model.PortDirection;
import com.vidnyan.vbuilder.domain.model.VerilogModule;
import com.vidnyan.vbuilder.domain.model.WidthSpec;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TopModuleGeneratorTest {

    private static VerilogModule simpleModule() {
        return VerilogModule.builder("m")
                .sourcePath("/src/m.v")
                .ports(List.of(
                        Port.of("a", PortDirection.INPUT, WidthSpec.literal(8)),
                        Port.of("b", PortDirection.OUTPUT, WidthSpec.absent())))
                .build();
    }

    @Test
    void generate_ShouldRenderSingleInstanceWithoutParameterBlock() {
        // Arrange
        DesignGraph graph = new DesignGraph("top");
        graph.addModule(simpleModule());
        graph.instantiate("m", "u1");
        graph.setConnection("u1", "a", ConnectionKind.INPUT, "data_in");
        graph.setConnection("u1", "b", ConnectionKind.OUTPUT, "data_out");

        // Act
        String text = TopModuleGenerator.generate(graph);

        // Assert
        String expected = String.join("\n",
                "// Auto-generated top module: top",
                "module top (",
                "  input wire [7:0] data_in,",
                "  output wire data_out",
                ");",
                "",
                "  // Source: /src/m.v",
                "  m u1 (",
                "    .a(data_in),",
                "    .b(data_out)",
                "  );",
                "",
                "endmodule",
                "");
        assertEquals(expected, text);
    }

    @Test
    void generate_ShouldRenderWiresAndParameterOverrides() {
        // Arrange
        DesignGraph graph = new DesignGraph("top");
        graph.addModule(VerilogModule.builder("producer")
                .sourcePath("/src/producer.v")
                .ports(List.of(Port.of("out", PortDirection.OUTPUT, WidthSpec.literal(8))))
                .build());
        graph.addModule(VerilogModule.builder("consumer")
                .sourcePath("/src/consumer.v")
                .ports(List.of(
                        Port.of("in", PortDirection.INPUT, WidthSpec.literal(8)),
                        Port.of("clk", PortDirection.INPUT, WidthSpec.absent())))
                .parameters(List.of(
                        Parameter.of("DEPTH", "4"),
                        Parameter.of("MODE", "\"fast\""),
                        new Parameter("AW", null, "$clog2(DEPTH)", List.of(), true)))
                .build());
        graph.instantiate("producer", "p1");
        graph.instantiate("consumer", "c1");
        graph.setConnection("p1", "out", ConnectionKind.WIRE, "link");
        graph.setConnection("c1", "in", ConnectionKind.WIRE, "link");
        graph.setConnection("c1", "clk", ConnectionKind.INPUT, "clk");
        graph.setParameterOverride("c1", "DEPTH", "16");

        // Act
        String text = TopModuleGenerator.generate(graph);

        // Assert
        String expected = String.join("\n",
                "// Auto-generated top module: top",
                "module top (",
                "  input wire clk",
                ");",
                "",
                "  wire [7:0] link;",
                "",
                "  // Source: /src/producer.v",
                "  producer p1 (",
                "    .out(link)",
                "  );",
                "",
                "  // Source: /src/consumer.v",
                "  consumer #(",
                "    .DEPTH(16),",
                "    .MODE(\"fast\")",
                "  ) c1 (",
                "    .in(link),",
                "    .clk(clk)",
                "  );",
                "",
                "endmodule",
                "");
        assertEquals(expected, text);
    }

    @Test
    void generate_ShouldOmitUnsetPorts() {
        DesignGraph graph = new DesignGraph("top");
        graph.addModule(simpleModule());
        graph.instantiate("m", "u1");
        graph.instantiate("m", "u2");
        graph.setConnection("u1", "b", ConnectionKind.OUTPUT, "done");

        String text = TopModuleGenerator.generate(graph);

        assertTrue(text.contains("  m u1 (\n    .b(done)\n  );"));
        assertTrue(text.contains("  m u2 ();"));
        assertFalse(text.contains(".a("));
    }

    @Test
    void generate_ShouldRenderEmptyDesign() {
        String text = TopModuleGenerator.generate(new DesignGraph("chip"));

        assertEquals("// Auto-generated top module: chip\nmodule chip (\n);\n\nendmodule\n", text);
    }

    @Test
    void generate_ShouldDeduplicateSharedSignalsInDiscoveryOrder() {
        DesignGraph graph = new DesignGraph("top");
        graph.addModule(simpleModule());
        graph.instantiate("m", "u1");
        graph.instantiate("m", "u2");
        graph.setConnection("u1", "a", ConnectionKind.INPUT, "shared");
        graph.setConnection("u2", "a", ConnectionKind.INPUT, "shared");
        graph.setConnection("u2", "b", ConnectionKind.OUTPUT, "y");

        String text = TopModuleGenerator.generate(graph);

        assertEquals(1, text.split("input wire \\[7:0\\] shared", -1).length - 1);
        assertTrue(text.indexOf("shared,") < text.indexOf("output wire y"));
    }

    @Test
    void generate_ShouldRejectSignalUsedWithTwoKinds() {
        DesignGraph graph = new DesignGraph("top");
        graph.addModule(simpleModule());
        graph.instantiate("m", "u1");
        graph.instantiate("m", "u2");
        graph.setConnection("u1", "b", ConnectionKind.OUTPUT, "sig");
        graph.setConnection("u2", "a", ConnectionKind.WIRE, "sig");

        ConflictingSignalKindException e = assertThrows(ConflictingSignalKindException.class,
                () -> TopModuleGenerator.generate(graph));

        assertEquals("sig", e.signal());
        assertTrue(e.getMessage().contains("u1.b"));
        assertTrue(e.getMessage().contains("u2.a"));
    }

    @Test
    void generate_ShouldBeIdempotent() {
        DesignGraph graph = new DesignGraph("top");
        graph.addModule(simpleModule());
        graph.instantiate("m", "u1");
        graph.setConnection("u1", "a", ConnectionKind.WIRE, "w");

        assertEquals(TopModuleGenerator.generate(graph), TopModuleGenerator.generate(graph));
    }

    @Test
    void generate_ShouldNotMentionDeletedInstance() {
        DesignGraph graph = new DesignGraph("top");
        graph.addModule(simpleModule());
        graph.instantiate("m", "u1");
        graph.instantiate("m", "keep");
        graph.setConnection("u1", "a", ConnectionKind.INPUT, "only_u1");
        graph.setConnection("keep", "b", ConnectionKind.OUTPUT, "z");

        graph.removeInstance("u1");
        String text = TopModuleGenerator.generate(graph);

        assertFalse(text.contains("u1"));
        assertFalse(text.contains("only_u1"));
        assertTrue(text.contains("keep"));
    }

    @Test
    void generate_ShouldShapeSignalLikeFirstPortUsingIt() {
        DesignGraph graph = new DesignGraph("top");
        graph.addModule(VerilogModule.builder("mem")
                .sourcePath("/src/mem.v")
                .ports(List.of(new Port("rows", PortDirection.OUTPUT, "logic", WidthSpec.expression("W"),
                        List.of(), List.of(WidthSpec.literal(4)))))
                .build());
        graph.instantiate("mem", "m0");
        graph.setConnection("m0", "rows", ConnectionKind.OUTPUT, "rows_out");

        String text = TopModuleGenerator.generate(graph);

        assertTrue(text.contains("  output wire [W-1:0] rows_out [3:0]\n"));
    }
}
