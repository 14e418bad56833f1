package org.hdlforge.compiler.frontend.lowering.udp;

import org.hdlforge.compiler.frontend.ast.VarNode;

import java.util.List;

/**
 * The I/O ports of a primitive split by direction.
 *
 * @param inputs Input ports in declaration order.
 * @param outputs Output ports in declaration order.
 * @param firstPortIsOutput Whether the first declared I/O port is an output.
 */
public record PortClassification(List<VarNode> inputs, List<VarNode> outputs, boolean firstPortIsOutput) {

    public PortClassification {
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
    }

    public int inputCount() {
        return inputs.size();
    }

    public int outputCount() {
        return outputs.size();
    }
}
