package org.hdlforge.compiler;

import org.hdlforge.compiler.api.CompilationException;
import org.hdlforge.compiler.config.UdpLoweringOptions;
import org.hdlforge.compiler.diagnostics.DiagnosticsEngine;
import org.hdlforge.compiler.frontend.ast.NetlistNode;
import org.hdlforge.compiler.frontend.lowering.udp.UdpTableLowering;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs UDP table lowering and gates the result: if any error was reported while lowering,
 * the tree is not handed to later stages. Each {@link #lower} call starts with empty diagnostics.
 */
public class UdpCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(UdpCompiler.class);

    private final UdpLoweringOptions options;
    private DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    public UdpCompiler() {
        this(UdpLoweringOptions.defaults());
    }

    /**
     * @param options Settings for the lowering pass.
     */
    public UdpCompiler(UdpLoweringOptions options) {
        this.options = options;
    }

    /**
     * Lowers all primitive tables of the design.
     *
     * @param root The parsed design.
     * @return The lowered design.
     * @throws CompilationException if errors were reported; it carries all diagnostics.
     */
    public NetlistNode lower(NetlistNode root) throws CompilationException {
        diagnostics = new DiagnosticsEngine();
        NetlistNode lowered = new UdpTableLowering(diagnostics, options).resolve(root);
        if (diagnostics.hasErrors()) {
            throw new CompilationException("UDP lowering failed with " + diagnostics.errorCount()
                    + " error(s):\n" + diagnostics.summary(), diagnostics.getDiagnostics());
        }
        LOG.info("Lowered UDP tables of {} top-level unit(s)", lowered.units().size());
        return lowered;
    }

    /**
     * @return The diagnostics of the most recent {@link #lower} call.
     */
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }
}
