package org.hdlforge.compiler.frontend.lowering.udp;

import org.hdlforge.compiler.api.SourceInfo;
import org.hdlforge.compiler.diagnostics.DiagnosticsEngine;
import org.hdlforge.compiler.frontend.ast.Access;
import org.hdlforge.compiler.frontend.ast.AndNode;
import org.hdlforge.compiler.frontend.ast.AssignNode;
import org.hdlforge.compiler.frontend.ast.AstNode;
import org.hdlforge.compiler.frontend.ast.ConstNode;
import org.hdlforge.compiler.frontend.ast.EqNode;
import org.hdlforge.compiler.frontend.ast.IfNode;
import org.hdlforge.compiler.frontend.ast.UdpTableLineNode;
import org.hdlforge.compiler.frontend.ast.UdpTableLineValNode;
import org.hdlforge.compiler.frontend.ast.VarRefNode;
import org.hdlforge.compiler.model.Bit;
import org.hdlforge.compiler.model.BitVector;
import org.hdlforge.compiler.model.UdpSymbol;

import java.util.List;

/**
 * Compiles one table line into {@code if ((mask & field) == compare) out = value;}.
 * <p>
 * A line with the wrong number of entries is reported and still compiled from the
 * entries it has, see {@link RowPattern#of}.
 */
public class TableRowCompiler {

    private final DiagnosticsEngine diagnostics;

    /**
     * @param diagnostics Sink for line arity errors.
     */
    public TableRowCompiler(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * @param line The table line.
     * @param context The primitive being lowered.
     * @return The conditional for the line, without else branch.
     */
    public IfNode compile(UdpTableLineNode line, PrimitiveLoweringContext context) {
        SourceInfo at = line.source();
        List<UdpTableLineValNode> inputs = line.inputValues();
        List<UdpTableLineValNode> outputs = line.outputValues();
        int width = context.fieldWidth();

        if (inputs.size() != width) {
            diagnostics.reportError(width + " input val required, while there are " + inputs.size()
                    + " input for the table line!", at.fileName(), at.lineNumber());
        }
        if (outputs.size() != 1) {
            diagnostics.reportError("1 output val required, while there are " + outputs.size()
                    + " output for the table line!", at.fileName(), at.lineNumber());
        }

        RowPattern pattern = RowPattern.of(symbols(inputs), width);
        AstNode condition = new EqNode(
                new AndNode(new ConstNode(pattern.mask(), at),
                        new VarRefNode(context.fieldVariable().name(), Access.READ, at), at),
                new ConstNode(pattern.compare(), at),
                at);

        List<AstNode> thenStatements = context.output()
                .<List<AstNode>>map(out -> List.of(new AssignNode(
                        new VarRefNode(out.name(), Access.WRITE, at),
                        new ConstNode(outputValue(outputs), at),
                        at)))
                .orElse(List.of());
        return new IfNode(condition, thenStatements, List.of(), at);
    }

    /**
     * Resolves the driven value from the first output entry; unknown if there is none.
     */
    static BitVector outputValue(List<UdpTableLineValNode> outputs) {
        Bit bit = outputs.isEmpty() ? Bit.X : outputs.get(0).symbol().toOutputBit();
        BitVector value = new BitVector(1);
        value.setBit(0, bit);
        return value;
    }

    static List<UdpSymbol> symbols(List<UdpTableLineValNode> values) {
        return values.stream().map(UdpTableLineValNode::symbol).toList();
    }
}
