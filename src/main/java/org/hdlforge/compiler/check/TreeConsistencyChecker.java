package org.hdlforge.compiler.check;

import org.hdlforge.compiler.frontend.ast.Access;
import org.hdlforge.compiler.frontend.ast.AssignNode;
import org.hdlforge.compiler.frontend.ast.AssignWNode;
import org.hdlforge.compiler.frontend.ast.AstNode;
import org.hdlforge.compiler.frontend.ast.ModuleNode;
import org.hdlforge.compiler.frontend.ast.NetlistNode;
import org.hdlforge.compiler.frontend.ast.PrimitiveNode;
import org.hdlforge.compiler.frontend.ast.UdpTableLineNode;
import org.hdlforge.compiler.frontend.ast.UdpTableNode;
import org.hdlforge.compiler.frontend.ast.VarNode;
import org.hdlforge.compiler.frontend.ast.VarRefNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Verifies the structural invariants that hold after table lowering.
 * <p>
 * A violation is a compiler bug, not a user error, so it is raised as an
 * {@link IllegalStateException} instead of a diagnostic.
 */
public class TreeConsistencyChecker {

    /**
     * @param root The tree to check.
     * @throws IllegalStateException listing every violation found.
     */
    public void check(NetlistNode root) {
        List<String> problems = findProblems(root);
        if (!problems.isEmpty()) {
            throw new IllegalStateException("Broken tree after udpResolve:\n  " + String.join("\n  ", problems));
        }
    }

    /**
     * @param root The tree to check.
     * @return Descriptions of all violations, empty for a consistent tree.
     */
    public List<String> findProblems(NetlistNode root) {
        List<String> problems = new ArrayList<>();
        for (AstNode unit : root.units()) {
            if (unit instanceof PrimitiveNode primitive) {
                checkUnit(primitive.name(), primitive.items(), problems);
            } else if (unit instanceof ModuleNode module) {
                checkUnit(module.name(), module.items(), problems);
            } else {
                problems.add("Unexpected top-level node " + unit.getClass().getSimpleName());
            }
        }
        return problems;
    }

    private void checkUnit(String unitName, List<AstNode> items, List<String> problems) {
        Set<String> declared = new HashSet<>();
        for (AstNode item : items) {
            if (item instanceof VarNode var && !declared.add(var.name())) {
                problems.add(unitName + ": variable '" + var.name() + "' declared twice");
            }
        }
        for (AstNode item : items) {
            walk(unitName, item, declared, problems);
        }
    }

    private void walk(String unitName, AstNode node, Set<String> declared, List<String> problems) {
        if (node instanceof UdpTableNode || node instanceof UdpTableLineNode) {
            problems.add(unitName + ": " + node.getClass().getSimpleName() + " left after lowering");
            return;
        }
        if (node instanceof VarRefNode ref && !declared.contains(ref.name())) {
            problems.add(unitName + ": reference to undeclared variable '" + ref.name() + "'");
        }
        if (node instanceof AssignWNode assign && assign.lhs().access() != Access.WRITE) {
            problems.add(unitName + ": continuous assignment target '" + assign.lhs().name() + "' is not a write reference");
        }
        if (node instanceof AssignNode assign && assign.lhs().access() != Access.WRITE) {
            problems.add(unitName + ": assignment target '" + assign.lhs().name() + "' is not a write reference");
        }
        for (AstNode child : node.getChildren()) {
            walk(unitName, child, declared, problems);
        }
    }
}
