package org.hdlforge.compiler.frontend.lowering.udp;

import org.hdlforge.compiler.diagnostics.Diagnostic;
import org.hdlforge.compiler.diagnostics.DiagnosticsEngine;
import org.hdlforge.compiler.frontend.ast.PrimitiveNode;
import org.hdlforge.compiler.frontend.ast.UdpTableNode;
import org.hdlforge.compiler.frontend.ast.VarNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hdlforge.test.utils.DesignTrees.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Tests for {@link UdpTableValidator}: port count, port placement and sequential outputs.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
class UdpTableValidatorTest {

    @Spy
    private DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    private UdpTableValidator validator;

    @BeforeEach
    void setUp() {
        validator = new UdpTableValidator(diagnostics);
    }

    @Test
    void wellFormedPrimitivePassesAndResolvesOutput() {
        PrimitiveNode primitive = examplePrimitive();

        Optional<VarNode> output = validate(primitive);

        assertThat(output).map(VarNode::name).contains("q");
        verify(diagnostics, never()).reportError(anyString(), anyString(), anyInt());
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    @Test
    void twoOutputsAreReportedAtTheLastOutput() {
        PrimitiveNode primitive = primitive("p", output("q", 2), output("r", 3), input("a", 4), table(5, "0 : 1"));

        Optional<VarNode> output = validate(primitive);

        verify(diagnostics).reportError(
                eq("2 output ports for udp table, there must be one output port!"), eq(FILE), eq(3));
        assertThat(output).map(VarNode::name).contains("q");
    }

    @Test
    void noOutputIsReportedAtTheTableAndResolvesNothing() {
        PrimitiveNode primitive = primitive("p", input("a", 2), table(3, "0 : 1"));

        Optional<VarNode> output = validate(primitive);

        assertThat(output).isEmpty();
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::message)
                .containsExactly("0 output ports for udp table, there must be one output port!");
        assertThat(diagnostics.getDiagnostics().get(0).lineNumber()).isEqualTo(3);
    }

    @Test
    void outputNotFirstIsReportedAtTheFirstInput() {
        PrimitiveNode primitive = primitive("p", input("a", 2), input("b", 3), output("q", 4), table(5, "0 0 : 1"));

        validate(primitive);

        verify(diagnostics).reportError(eq("The first port must be the output port!"), eq(FILE), eq(2));
        assertThat(diagnostics.errorCount()).isEqualTo(1);
    }

    @Test
    void registeredOutputIsRejectedAsSequential() {
        PrimitiveNode primitive = primitive("p", outputReg("q", 2), input("a", 3), table(4, "0 : 1"));

        Optional<VarNode> output = validate(primitive);

        verify(diagnostics).reportError(contains("sequential UDP is not supported"), eq(FILE), eq(2));
        assertThat(output).isPresent();
    }

    @Test
    void tableWithoutInputsIsReported() {
        PrimitiveNode primitive = primitive("p", output("q", 2), table(3));

        validate(primitive);

        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::message)
                .containsExactly("udp table requires at least one input port");
    }

    private Optional<VarNode> validate(PrimitiveNode primitive) {
        UdpTableNode table = (UdpTableNode) primitive.items().get(primitive.items().size() - 1);
        return validator.validate(PortClassifier.classify(primitive), table);
    }
}
