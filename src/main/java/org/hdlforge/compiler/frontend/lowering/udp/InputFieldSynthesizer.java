package org.hdlforge.compiler.frontend.lowering.udp;

import org.hdlforge.compiler.api.SourceInfo;
import org.hdlforge.compiler.frontend.ast.Access;
import org.hdlforge.compiler.frontend.ast.AlwaysKeyword;
import org.hdlforge.compiler.frontend.ast.AlwaysNode;
import org.hdlforge.compiler.frontend.ast.AssignWNode;
import org.hdlforge.compiler.frontend.ast.AstNode;
import org.hdlforge.compiler.frontend.ast.BasicDataType;
import org.hdlforge.compiler.frontend.ast.ConcatNode;
import org.hdlforge.compiler.frontend.ast.VarDirection;
import org.hdlforge.compiler.frontend.ast.VarNode;
import org.hdlforge.compiler.frontend.ast.VarRefNode;
import org.hdlforge.compiler.frontend.ast.VarType;

import java.util.List;
import java.util.Set;

/**
 * Builds the input field of a table: a temporary holding all inputs side by side,
 * the continuous assignment that drives it and the process that hosts the row logic.
 * All synthesized nodes take the position of the table they replace.
 */
public class InputFieldSynthesizer {

    private final String fieldVariableName;
    private final AlwaysKeyword processKeyword;

    /**
     * @param fieldVariableName Name of the synthesized temporary.
     * @param processKeyword Flavor of the synthesized process.
     */
    public InputFieldSynthesizer(String fieldVariableName, AlwaysKeyword processKeyword) {
        this.fieldVariableName = fieldVariableName;
        this.processKeyword = processKeyword;
    }

    /**
     * Creates the unsigned temporary with one bit per input.
     *
     * @param inputs The input ports, at least one.
     * @param at The position of the table.
     * @return The declaration.
     */
    public VarNode createFieldVariable(List<VarNode> inputs, SourceInfo at) {
        return createFieldVariable(inputs, Set.of(), at);
    }

    /**
     * Creates the temporary under a name not in {@code taken}: the configured name, or that
     * name with the first free {@code _1}, {@code _2}, ... suffix.
     *
     * @param inputs The input ports, at least one.
     * @param taken Names already declared in the primitive.
     * @param at The position of the table.
     * @return The declaration.
     */
    public VarNode createFieldVariable(List<VarNode> inputs, Set<String> taken, SourceInfo at) {
        String name = fieldVariableName;
        for (int suffix = 1; taken.contains(name); suffix++) {
            name = fieldVariableName + "_" + suffix;
        }
        return new VarNode(name, VarDirection.NONE, VarType.MODULETEMP, BasicDataType.bits(inputs.size()), at);
    }

    /**
     * Creates {@code assign field = {in[n-1], ..., in[1], in[0]};}. The first declared
     * input ends up in the least significant bit.
     *
     * @param fieldVariable The temporary created by {@link #createFieldVariable}.
     * @param inputs The input ports, at least one.
     * @param at The position of the table.
     * @return The continuous assignment.
     */
    public AssignWNode createFieldAssignment(VarNode fieldVariable, List<VarNode> inputs, SourceInfo at) {
        AstNode concat = new VarRefNode(inputs.get(0).name(), Access.READ, at);
        for (int i = 1; i < inputs.size(); i++) {
            concat = new ConcatNode(new VarRefNode(inputs.get(i).name(), Access.READ, at), concat, at);
        }
        return new AssignWNode(new VarRefNode(fieldVariable.name(), Access.WRITE, at), concat, at);
    }

    /**
     * Creates the process hosting the row chain. It has no sensitivity list and no
     * default branch: an evaluation that matches no row leaves the output as it was.
     *
     * @param body The row chain, empty for a table without lines.
     * @param at The position of the table.
     * @return The process.
     */
    public AlwaysNode createProcess(List<AstNode> body, SourceInfo at) {
        return new AlwaysNode(processKeyword, body, at);
    }
}
