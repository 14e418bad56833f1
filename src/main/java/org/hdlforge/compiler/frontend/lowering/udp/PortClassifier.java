package org.hdlforge.compiler.frontend.lowering.udp;

import org.hdlforge.compiler.frontend.ast.AstNode;
import org.hdlforge.compiler.frontend.ast.PrimitiveNode;
import org.hdlforge.compiler.frontend.ast.VarNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the ports of a primitive into inputs and outputs. Variables that are not
 * ports are skipped; anything that is a port but not an input counts as an output.
 */
public final class PortClassifier {

    private PortClassifier() {
    }

    /**
     * @param primitive The primitive to inspect.
     * @return The classified ports.
     */
    public static PortClassification classify(PrimitiveNode primitive) {
        List<VarNode> inputs = new ArrayList<>();
        List<VarNode> outputs = new ArrayList<>();
        boolean firstPortIsOutput = false;
        for (AstNode item : primitive.items()) {
            if (!(item instanceof VarNode var) || !var.isIO()) {
                continue;
            }
            if (var.isInput()) {
                inputs.add(var);
            } else {
                outputs.add(var);
            }
            if (inputs.isEmpty() && outputs.size() == 1) {
                firstPortIsOutput = true;
            }
        }
        return new PortClassification(inputs, outputs, firstPortIsOutput);
    }
}
