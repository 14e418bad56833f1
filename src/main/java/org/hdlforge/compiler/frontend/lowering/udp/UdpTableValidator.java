package org.hdlforge.compiler.frontend.lowering.udp;

import org.hdlforge.compiler.api.SourceInfo;
import org.hdlforge.compiler.diagnostics.DiagnosticsEngine;
import org.hdlforge.compiler.frontend.ast.UdpTableNode;
import org.hdlforge.compiler.frontend.ast.VarNode;

import java.util.Optional;

/**
 * Checks the port structure of a primitive before its table is lowered.
 * <p>
 * Problems are reported as errors but never stop lowering: the caller continues with
 * the output returned by {@link #validate}, which is the first declared output if any.
 */
public class UdpTableValidator {

    private final DiagnosticsEngine diagnostics;

    /**
     * @param diagnostics Sink for the reported errors.
     */
    public UdpTableValidator(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Validates the ports against the table and resolves the output driven by it.
     *
     * @param ports The classified ports of the primitive.
     * @param table The table being lowered.
     * @return The output port the table drives, empty if the primitive has none.
     */
    public Optional<VarNode> validate(PortClassification ports, UdpTableNode table) {
        int outputCount = ports.outputCount();
        if (outputCount != 1) {
            SourceInfo at = outputCount > 0 ? ports.outputs().get(outputCount - 1).source() : table.source();
            report(outputCount + " output ports for udp table, there must be one output port!", at);
        }
        if (!ports.firstPortIsOutput() && outputCount > 0) {
            // Attached to the first input, not to the misplaced output.
            SourceInfo at = ports.inputs().isEmpty() ? table.source() : ports.inputs().get(0).source();
            report("The first port must be the output port!", at);
        }
        if (ports.inputs().isEmpty()) {
            report("udp table requires at least one input port", table.source());
        }
        if (outputCount == 0) {
            return Optional.empty();
        }
        VarNode output = ports.outputs().get(0);
        if (output.dataType().isLogic()) {
            report("sequential UDP is not supported currently!", output.source());
        }
        return Optional.of(output);
    }

    private void report(String message, SourceInfo at) {
        diagnostics.reportError(message, at.fileName(), at.lineNumber());
    }
}
