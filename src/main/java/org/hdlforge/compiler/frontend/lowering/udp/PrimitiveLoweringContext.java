package org.hdlforge.compiler.frontend.lowering.udp;

import org.hdlforge.compiler.frontend.ast.PrimitiveNode;
import org.hdlforge.compiler.frontend.ast.VarNode;

import java.util.Optional;

/**
 * State of lowering one primitive. A new context is created for every primitive,
 * so nothing carries over from one primitive to the next.
 *
 * @param primitive The primitive being lowered.
 * @param ports Its classified ports.
 * @param output The output the table drives; empty for primitives without outputs.
 * @param fieldVariable The synthesized input field temporary.
 */
public record PrimitiveLoweringContext(
        PrimitiveNode primitive,
        PortClassification ports,
        Optional<VarNode> output,
        VarNode fieldVariable
) {

    /**
     * @return The width of the input field, one bit per input port.
     */
    public int fieldWidth() {
        return ports.inputCount();
    }
}
