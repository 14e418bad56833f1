package org.hdlforge.compiler.backend.emit;

import org.hdlforge.compiler.config.UdpLoweringOptions;
import org.hdlforge.compiler.diagnostics.DiagnosticsEngine;
import org.hdlforge.compiler.frontend.ast.AlwaysKeyword;
import org.hdlforge.compiler.frontend.ast.NetlistNode;
import org.hdlforge.compiler.frontend.lowering.udp.UdpTableLowering;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hdlforge.test.utils.DesignTrees.examplePrimitive;
import static org.hdlforge.test.utils.DesignTrees.netlist;

@Tag("unit")
class VerilogEmitterTest {

    private final VerilogEmitter emitter = new VerilogEmitter();

    @Test
    void rendersTableBeforeLowering() {
        String text = emitter.emit(netlist(examplePrimitive()));

        assertThat(text).isEqualTo(String.join("\n",
                "primitive ex;",
                "    output q;",
                "    input a;",
                "    input b;",
                "    table",
                "        0 1 : 1;",
                "        1 0 : 1;",
                "        ? ? : 0;",
                "    endtable",
                "endprimitive",
                ""));
    }

    @Test
    void rendersLoweredPrimitiveAsElseIfChain() {
        NetlistNode lowered = new UdpTableLowering(new DiagnosticsEngine(),
                new UdpLoweringOptions("f", AlwaysKeyword.ALWAYS_LATCH, false, true))
                .resolve(netlist(examplePrimitive()));

        String text = emitter.emit(lowered);

        assertThat(text).isEqualTo(String.join("\n",
                "primitive ex;",
                "    output q;",
                "    input a;",
                "    input b;",
                "    wire [1:0] f;",
                "    assign f = {b, a};",
                "    always_latch begin",
                "        if ((2'b11 & f) == 2'b10) begin",
                "            q = 1'b1;",
                "        end else if ((2'b11 & f) == 2'b01) begin",
                "            q = 1'b1;",
                "        end else if ((2'b00 & f) == 2'b00) begin",
                "            q = 1'b0;",
                "        end",
                "    end",
                "endprimitive",
                ""));
    }
}
