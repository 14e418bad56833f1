package org.hdlforge.compiler.frontend.ast;

import org.hdlforge.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * One line of a UDP table, e.g. {@code 0 ? 1 : 1;}.
 * <p>
 * The field lists may contain nodes other than {@link UdpTableLineValNode}
 * (for instance separators kept by the parser); only value nodes are significant.
 *
 * @param inputFields The entries left of the colon, in port order.
 * @param outputFields The entries right of the colon.
 * @param source The position of the line.
 */
public record UdpTableLineNode(
        List<AstNode> inputFields,
        List<AstNode> outputFields,
        SourceInfo source
) implements AstNode, SourceLocatable {

    public UdpTableLineNode {
        inputFields = List.copyOf(inputFields);
        outputFields = List.copyOf(outputFields);
    }

    /**
     * @return The input entries that are table values.
     */
    public List<UdpTableLineValNode> inputValues() {
        return values(inputFields);
    }

    /**
     * @return The output entries that are table values.
     */
    public List<UdpTableLineValNode> outputValues() {
        return values(outputFields);
    }

    private static List<UdpTableLineValNode> values(List<AstNode> fields) {
        List<UdpTableLineValNode> values = new ArrayList<>();
        for (AstNode field : fields) {
            if (field instanceof UdpTableLineValNode val) {
                values.add(val);
            }
        }
        return values;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(inputFields);
        children.addAll(outputFields);
        return children;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        int split = inputFields.size();
        return new UdpTableLineNode(newChildren.subList(0, split), newChildren.subList(split, newChildren.size()), source);
    }
}
