package org.hdlforge.compiler.backend.emit;

import org.hdlforge.compiler.frontend.ast.AlwaysNode;
import org.hdlforge.compiler.frontend.ast.AndNode;
import org.hdlforge.compiler.frontend.ast.AssignNode;
import org.hdlforge.compiler.frontend.ast.AssignWNode;
import org.hdlforge.compiler.frontend.ast.AstNode;
import org.hdlforge.compiler.frontend.ast.ConcatNode;
import org.hdlforge.compiler.frontend.ast.ConstNode;
import org.hdlforge.compiler.frontend.ast.EqNode;
import org.hdlforge.compiler.frontend.ast.IfNode;
import org.hdlforge.compiler.frontend.ast.ModuleNode;
import org.hdlforge.compiler.frontend.ast.NetlistNode;
import org.hdlforge.compiler.frontend.ast.PrimitiveNode;
import org.hdlforge.compiler.frontend.ast.UdpTableLineNode;
import org.hdlforge.compiler.frontend.ast.UdpTableLineValNode;
import org.hdlforge.compiler.frontend.ast.UdpTableNode;
import org.hdlforge.compiler.frontend.ast.VarNode;
import org.hdlforge.compiler.frontend.ast.VarRefNode;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a design tree as Verilog text, for tree dumps and tests.
 * The output is meant for reading, not for feeding back into a tool.
 */
public class VerilogEmitter {

    private static final String INDENT = "    ";

    /**
     * @param node Any node of the tree.
     * @return The rendered text.
     */
    public String emit(AstNode node) {
        StringBuilder out = new StringBuilder();
        emitItem(node, 0, out);
        return out.toString();
    }

    /**
     * @param expression An expression node.
     * @return The rendered expression on one line.
     */
    public String expression(AstNode expression) {
        if (expression instanceof VarRefNode ref) {
            return ref.name();
        } else if (expression instanceof ConstNode c) {
            return c.value().toVerilogLiteral();
        } else if (expression instanceof ConcatNode concat) {
            return "{" + expression(concat.high()) + ", " + expression(concat.low()) + "}";
        } else if (expression instanceof AndNode and) {
            return "(" + expression(and.lhs()) + " & " + expression(and.rhs()) + ")";
        } else if (expression instanceof EqNode eq) {
            return "(" + expression(eq.lhs()) + " == " + expression(eq.rhs()) + ")";
        }
        throw new IllegalArgumentException("Not an expression: " + expression.getClass().getSimpleName());
    }

    private void emitItem(AstNode node, int depth, StringBuilder out) {
        String pad = INDENT.repeat(depth);
        if (node instanceof NetlistNode netlist) {
            netlist.units().forEach(u -> emitItem(u, depth, out));
        } else if (node instanceof ModuleNode module) {
            emitUnit("module", "endmodule", module.name(), module.items(), depth, out);
        } else if (node instanceof PrimitiveNode primitive) {
            emitUnit("primitive", "endprimitive", primitive.name(), primitive.items(), depth, out);
        } else if (node instanceof VarNode var) {
            out.append(pad).append(declaration(var)).append(";\n");
        } else if (node instanceof AssignWNode assign) {
            out.append(pad).append("assign ").append(expression(assign.lhs()))
                    .append(" = ").append(expression(assign.rhs())).append(";\n");
        } else if (node instanceof AlwaysNode always) {
            out.append(pad).append(always.keyword().keyword()).append(" begin\n");
            always.statements().forEach(s -> emitItem(s, depth + 1, out));
            out.append(pad).append("end\n");
        } else if (node instanceof IfNode ifNode) {
            emitIf(ifNode, depth, out, pad);
        } else if (node instanceof AssignNode assign) {
            out.append(pad).append(expression(assign.lhs()))
                    .append(" = ").append(expression(assign.rhs())).append(";\n");
        } else if (node instanceof UdpTableNode table) {
            out.append(pad).append("table\n");
            table.lines().forEach(l -> out.append(pad).append(INDENT).append(tableLine(l)).append("\n"));
            out.append(pad).append("endtable\n");
        } else {
            out.append(pad).append(expression(node)).append(";\n");
        }
    }

    private void emitIf(IfNode ifNode, int depth, StringBuilder out, String pad) {
        out.append(pad).append("if ").append(expression(ifNode.condition())).append(" begin\n");
        ifNode.thenStatements().forEach(s -> emitItem(s, depth + 1, out));
        out.append(pad).append("end");
        List<AstNode> elses = ifNode.elseStatements();
        if (elses.size() == 1 && elses.get(0) instanceof IfNode elseIf) {
            out.append(" else ");
            StringBuilder nested = new StringBuilder();
            emitIf(elseIf, depth, nested, pad);
            out.append(nested.substring(pad.length()));
            return;
        }
        if (!elses.isEmpty()) {
            out.append(" else begin\n");
            elses.forEach(s -> emitItem(s, depth + 1, out));
            out.append(pad).append("end");
        }
        out.append("\n");
    }

    private void emitUnit(String keyword, String endKeyword, String name, List<AstNode> items,
                          int depth, StringBuilder out) {
        String pad = INDENT.repeat(depth);
        out.append(pad).append(keyword).append(' ').append(name).append(";\n");
        items.forEach(i -> emitItem(i, depth + 1, out));
        out.append(pad).append(endKeyword).append("\n");
    }

    private static String declaration(VarNode var) {
        String range = var.width() > 1 ? "[" + (var.width() - 1) + ":0] " : "";
        String kind = var.dataType().isLogic() ? "reg " : "";
        String prefix = switch (var.direction()) {
            case INPUT -> "input ";
            case OUTPUT -> "output ";
            case INOUT -> "inout ";
            case NONE -> var.dataType().isLogic() ? "" : "wire ";
        };
        return prefix + kind + range + var.name();
    }

    private static String tableLine(UdpTableLineNode line) {
        String inputs = line.inputValues().stream().map(UdpTableLineValNode::text).collect(Collectors.joining(" "));
        String outputs = line.outputValues().stream().map(UdpTableLineValNode::text).collect(Collectors.joining(" "));
        return inputs + " : " + outputs + ";";
    }
}
