package org.hdlforge.compiler.frontend.lowering.udp;

import org.hdlforge.compiler.frontend.ast.AstNode;
import org.hdlforge.compiler.frontend.ast.IfNode;
import org.hdlforge.compiler.frontend.ast.VarRefNode;
import org.hdlforge.compiler.frontend.ast.Access;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hdlforge.test.utils.DesignTrees.at;

@Tag("unit")
class ConditionChainBuilderTest {

    @Test
    void emptyChainBuildsEmptyBody() {
        assertThat(new ConditionChainBuilder().build()).isEmpty();
    }

    @Test
    void singleLinkIsTheWholeBody() {
        ConditionChainBuilder chain = new ConditionChainBuilder();
        IfNode only = link("c0");
        chain.append(only);

        assertThat(chain.build()).containsExactly(only);
    }

    @Test
    void linksNestAsElseBranchesInAppendOrder() {
        ConditionChainBuilder chain = new ConditionChainBuilder();
        chain.append(link("c0"));
        chain.append(link("c1"));
        chain.append(link("c2"));

        List<AstNode> body = chain.build();

        assertThat(body).hasSize(1);
        IfNode first = (IfNode) body.get(0);
        assertThat(conditionName(first)).isEqualTo("c0");
        IfNode second = (IfNode) first.elseStatements().get(0);
        assertThat(conditionName(second)).isEqualTo("c1");
        IfNode third = (IfNode) second.elseStatements().get(0);
        assertThat(conditionName(third)).isEqualTo("c2");
        assertThat(third.elseStatements()).as("no trailing default branch").isEmpty();
        assertThat(chain.size()).isEqualTo(3);
    }

    @Test
    void rejectsLinkThatAlreadyHasElse() {
        IfNode withElse = link("c0").withElse(List.of(link("c1")));

        assertThatThrownBy(() -> new ConditionChainBuilder().append(withElse))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static IfNode link(String condition) {
        return new IfNode(new VarRefNode(condition, Access.READ, at(1)), List.of(), List.of(), at(1));
    }

    private static String conditionName(IfNode ifNode) {
        return ((VarRefNode) ifNode.condition()).name();
    }
}
