package org.hdlforge.compiler.frontend.lowering.udp;

import org.hdlforge.compiler.backend.emit.VerilogEmitter;
import org.hdlforge.compiler.check.TreeConsistencyChecker;
import org.hdlforge.compiler.config.UdpLoweringOptions;
import org.hdlforge.compiler.diagnostics.DiagnosticsEngine;
import org.hdlforge.compiler.frontend.ast.AstNode;
import org.hdlforge.compiler.frontend.ast.NetlistNode;
import org.hdlforge.compiler.frontend.ast.PrimitiveNode;
import org.hdlforge.compiler.frontend.ast.UdpTableLineNode;
import org.hdlforge.compiler.frontend.ast.UdpTableNode;
import org.hdlforge.compiler.frontend.ast.VarNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Lowers the truth tables of user-defined primitives into procedural logic.
 * <p>
 * For a table such as
 * <pre>
 * table
 *    x 0 1  :   1;
 *    0 ? 1  :   1;
 *    0 1 0  :   0;
 * endtable
 * </pre>
 * the inputs are concatenated into one temporary ({@code field}) and each line becomes a
 * test {@code (mask & field) == compare}; for {@code x 0 1} the mask is {@code 110} and the
 * compare value {@code 100} (first input in the least significant bit). The tests form an
 * if / else-if chain in line order inside a process with no final else, so the first matching
 * line wins and the output keeps its value when no line matches.
 * <p>
 * Structural problems are reported to the {@link DiagnosticsEngine} and lowering continues
 * with whatever the primitive provides. Must run before inlining and tri-state resolution.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe; use one instance per traversal.
 */
public class UdpTableLowering {

    private static final Logger LOG = LoggerFactory.getLogger(UdpTableLowering.class);

    private final DiagnosticsEngine diagnostics;
    private final UdpLoweringOptions options;
    private final UdpTableValidator validator;
    private final InputFieldSynthesizer fieldSynthesizer;
    private final TableRowCompiler rowCompiler;

    /**
     * @param diagnostics Sink for structural errors.
     * @param options Pass settings.
     */
    public UdpTableLowering(DiagnosticsEngine diagnostics, UdpLoweringOptions options) {
        this.diagnostics = diagnostics;
        this.options = options;
        this.validator = new UdpTableValidator(diagnostics);
        this.fieldSynthesizer = new InputFieldSynthesizer(options.fieldVariableName(), options.processKeyword());
        this.rowCompiler = new TableRowCompiler(diagnostics);
    }

    /**
     * Lowers all tables with the default options.
     *
     * @param root The compilation unit.
     * @param diagnostics Sink for structural errors.
     * @return The rewritten compilation unit.
     */
    public static NetlistNode udpResolve(NetlistNode root, DiagnosticsEngine diagnostics) {
        return new UdpTableLowering(diagnostics, UdpLoweringOptions.defaults()).resolve(root);
    }

    /**
     * Lowers all tables in the compilation unit, then optionally dumps and checks the result.
     *
     * @param root The compilation unit.
     * @return The rewritten compilation unit.
     * @throws IllegalStateException if the consistency check is enabled and fails.
     */
    public NetlistNode resolve(NetlistNode root) {
        LOG.debug("udpResolve: lowering {} top-level unit(s)", root.units().size());
        NetlistNode result = (NetlistNode) process(root);
        if (options.dumpTree() && LOG.isDebugEnabled()) {
            LOG.debug("Tree after udpResolve:\n{}", new VerilogEmitter().emit(result));
        }
        if (options.checkTree()) {
            new TreeConsistencyChecker().check(result);
        }
        return result;
    }

    private AstNode process(AstNode node) {
        if (node instanceof PrimitiveNode primitive) {
            return lowerPrimitive(primitive);
        }
        List<AstNode> children = node.getChildren();
        if (children.isEmpty()) {
            return node;
        }
        List<AstNode> newChildren = new ArrayList<>(children.size());
        boolean changed = false;
        for (AstNode child : children) {
            AstNode processed = process(child);
            changed |= processed != child;
            newChildren.add(processed);
        }
        return changed ? node.reconstructWithChildren(newChildren) : node;
    }

    private AstNode lowerPrimitive(PrimitiveNode primitive) {
        if (primitive.items().stream().noneMatch(UdpTableNode.class::isInstance)) {
            return primitive;
        }
        int errorsBefore = diagnostics.errorCount();
        PortClassification ports = PortClassifier.classify(primitive);
        VarNode lastInput = ports.inputs().isEmpty() ? null : ports.inputs().get(ports.inputCount() - 1);

        Set<String> declared = new HashSet<>();
        for (AstNode item : primitive.items()) {
            if (item instanceof VarNode var) {
                declared.add(var.name());
            }
        }

        List<AstNode> items = new ArrayList<>();
        List<VarNode> fieldVariables = new ArrayList<>();
        for (AstNode item : primitive.items()) {
            if (item instanceof UdpTableNode table) {
                lowerTable(primitive, ports, table, declared, items, fieldVariables);
            } else {
                items.add(item);
            }
        }
        if (lastInput != null) {
            items.addAll(items.indexOf(lastInput) + 1, fieldVariables);
        }

        int errors = diagnostics.errorCount() - errorsBefore;
        if (errors > 0) {
            LOG.warn("Primitive '{}' lowered best-effort despite {} error(s)", primitive.name(), errors);
        }
        return primitive.reconstructWithChildren(items);
    }

    private void lowerTable(PrimitiveNode primitive, PortClassification ports, UdpTableNode table,
                            Set<String> declared, List<AstNode> items, List<VarNode> fieldVariables) {
        Optional<VarNode> output = validator.validate(ports, table);
        if (ports.inputs().isEmpty()) {
            LOG.debug("Dropping table of primitive '{}': no input ports", primitive.name());
            return;
        }
        LOG.debug("Lowering table of primitive '{}': {} input(s), {} line(s)",
                primitive.name(), ports.inputCount(), table.lines().size());

        VarNode fieldVariable = fieldSynthesizer.createFieldVariable(ports.inputs(), declared, table.source());
        declared.add(fieldVariable.name());
        PrimitiveLoweringContext context = new PrimitiveLoweringContext(primitive, ports, output, fieldVariable);

        ConditionChainBuilder chain = new ConditionChainBuilder();
        for (UdpTableLineNode line : table.lines()) {
            chain.append(rowCompiler.compile(line, context));
        }

        fieldVariables.add(fieldVariable);
        items.add(fieldSynthesizer.createFieldAssignment(fieldVariable, ports.inputs(), table.source()));
        items.add(fieldSynthesizer.createProcess(chain.build(), table.source()));
    }
}
