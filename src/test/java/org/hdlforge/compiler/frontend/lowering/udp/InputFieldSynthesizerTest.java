package org.hdlforge.compiler.frontend.lowering.udp;

import org.hdlforge.compiler.frontend.ast.Access;
import org.hdlforge.compiler.frontend.ast.AlwaysKeyword;
import org.hdlforge.compiler.frontend.ast.AlwaysNode;
import org.hdlforge.compiler.frontend.ast.AssignWNode;
import org.hdlforge.compiler.frontend.ast.AstNode;
import org.hdlforge.compiler.frontend.ast.BasicKind;
import org.hdlforge.compiler.frontend.ast.ConcatNode;
import org.hdlforge.compiler.frontend.ast.VarDirection;
import org.hdlforge.compiler.frontend.ast.VarNode;
import org.hdlforge.compiler.frontend.ast.VarRefNode;
import org.hdlforge.compiler.frontend.ast.VarType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hdlforge.test.utils.DesignTrees.at;
import static org.hdlforge.test.utils.DesignTrees.input;

@Tag("unit")
class InputFieldSynthesizerTest {

    private final InputFieldSynthesizer synthesizer = new InputFieldSynthesizer("ifield", AlwaysKeyword.ALWAYS_LATCH);

    @Test
    void fieldVariableIsUnsignedTemporaryWithOneBitPerInput() {
        VarNode field = synthesizer.createFieldVariable(List.of(input("a", 2), input("b", 3), input("c", 4)), at(6));

        assertThat(field.name()).isEqualTo("ifield");
        assertThat(field.width()).isEqualTo(3);
        assertThat(field.dataType().signed()).isFalse();
        assertThat(field.dataType().kind()).isEqualTo(BasicKind.BIT);
        assertThat(field.varType()).isEqualTo(VarType.MODULETEMP);
        assertThat(field.direction()).isEqualTo(VarDirection.NONE);
        assertThat(field.source()).isEqualTo(at(6));
    }

    @Test
    void fieldVariableAvoidsNamesAlreadyDeclared() {
        List<VarNode> inputs = List.of(input("a", 2));

        assertThat(synthesizer.createFieldVariable(inputs, Set.of("a", "q"), at(6)).name()).isEqualTo("ifield");
        assertThat(synthesizer.createFieldVariable(inputs, Set.of("ifield", "ifield_1"), at(6)).name())
                .isEqualTo("ifield_2");
    }

    @Test
    void concatenationPutsFirstInputInLeastSignificantBit() {
        List<VarNode> inputs = List.of(input("a", 2), input("b", 3), input("c", 4));
        VarNode field = synthesizer.createFieldVariable(inputs, at(6));

        AssignWNode assign = synthesizer.createFieldAssignment(field, inputs, at(6));

        assertThat(assign.lhs().name()).isEqualTo("ifield");
        assertThat(assign.lhs().access()).isEqualTo(Access.WRITE);
        // {c, {b, a}}
        assertThat(lsbFirst(assign.rhs())).containsExactly("a", "b", "c");
    }

    @Test
    void singleInputIsAssignedDirectly() {
        List<VarNode> inputs = List.of(input("a", 2));
        AssignWNode assign = synthesizer.createFieldAssignment(
                synthesizer.createFieldVariable(inputs, at(3)), inputs, at(3));

        assertThat(assign.rhs()).isInstanceOf(VarRefNode.class);
        assertThat(((VarRefNode) assign.rhs()).access()).isEqualTo(Access.READ);
    }

    @Test
    void processHasConfiguredKeyword() {
        AlwaysNode process = synthesizer.createProcess(List.of(), at(6));

        assertThat(process.keyword()).isEqualTo(AlwaysKeyword.ALWAYS_LATCH);
        assertThat(process.statements()).isEmpty();
    }

    /**
     * Flattens a concatenation into operand names, least significant first.
     */
    private static List<String> lsbFirst(AstNode expression) {
        List<String> names = new ArrayList<>();
        AstNode current = expression;
        List<String> highParts = new ArrayList<>();
        while (current instanceof ConcatNode concat) {
            highParts.add(0, ((VarRefNode) concat.high()).name());
            current = concat.low();
        }
        names.add(((VarRefNode) current).name());
        names.addAll(highParts);
        return names;
    }
}
