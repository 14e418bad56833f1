package org.hdlforge.runtime;

import org.hdlforge.compiler.frontend.ast.AlwaysNode;
import org.hdlforge.compiler.frontend.ast.AndNode;
import org.hdlforge.compiler.frontend.ast.AssignNode;
import org.hdlforge.compiler.frontend.ast.AssignWNode;
import org.hdlforge.compiler.frontend.ast.AstNode;
import org.hdlforge.compiler.frontend.ast.ConcatNode;
import org.hdlforge.compiler.frontend.ast.ConstNode;
import org.hdlforge.compiler.frontend.ast.EqNode;
import org.hdlforge.compiler.frontend.ast.IfNode;
import org.hdlforge.compiler.frontend.ast.PrimitiveNode;
import org.hdlforge.compiler.frontend.ast.UdpTableNode;
import org.hdlforge.compiler.frontend.ast.VarNode;
import org.hdlforge.compiler.frontend.ast.VarRefNode;
import org.hdlforge.compiler.model.Bit;
import org.hdlforge.compiler.model.BitVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes a lowered primitive once with four-state semantics.
 * <p>
 * Continuous assignments run first in declaration order, then every process body.
 * A condition that evaluates to 0 or {@code x} takes the else branch. Variables a run
 * does not assign keep the value passed in as previous state, which is how a process
 * without a final else holds its outputs.
 * <p>
 * <strong>Thread Safety:</strong> Immutable after construction; {@link #evaluate} may be
 * called concurrently.
 */
public class PrimitiveEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(PrimitiveEvaluator.class);

    private final PrimitiveNode primitive;
    private final Map<String, VarNode> variables = new LinkedHashMap<>();

    /**
     * @param primitive A primitive whose table has been lowered.
     * @throws IllegalArgumentException if the primitive still contains a table.
     */
    public PrimitiveEvaluator(PrimitiveNode primitive) {
        this.primitive = primitive;
        for (AstNode item : primitive.items()) {
            if (item instanceof UdpTableNode) {
                throw new IllegalArgumentException("Primitive '" + primitive.name() + "' has not been lowered");
            }
            if (item instanceof VarNode var) {
                variables.put(var.name(), var);
            }
        }
    }

    /**
     * Runs the primitive.
     *
     * @param inputs Values of the input ports; missing inputs are {@code x}.
     * @param previous Values of all other variables before this run; missing ones are {@code x}.
     * @return The values of all variables after the run.
     */
    public Map<String, BitVector> evaluate(Map<String, BitVector> inputs, Map<String, BitVector> previous) {
        Map<String, BitVector> values = new HashMap<>();
        for (VarNode var : variables.values()) {
            BitVector initial = var.isInput() ? inputs.get(var.name()) : previous.get(var.name());
            values.put(var.name(), initial != null ? initial.copy() : BitVector.allX(var.width()));
        }
        for (AstNode item : primitive.items()) {
            if (item instanceof AssignWNode assign) {
                assign(assign.lhs(), evaluateExpression(assign.rhs(), values), values);
            }
        }
        for (AstNode item : primitive.items()) {
            if (item instanceof AlwaysNode always) {
                execute(always.statements(), values);
            }
        }
        LOG.trace("Evaluated primitive '{}': {}", primitive.name(), values);
        return values;
    }

    /**
     * Convenience for single-bit ports.
     *
     * @param output The output port to read.
     * @param inputs Values of the input ports.
     * @param previousOutput Value of the output before this run.
     * @return Value of the output after this run.
     */
    public Bit evaluateOutput(String output, Map<String, Bit> inputs, Bit previousOutput) {
        Map<String, BitVector> inputVectors = new HashMap<>();
        inputs.forEach((name, bit) -> inputVectors.put(name, single(bit)));
        Map<String, BitVector> result = evaluate(inputVectors, Map.of(output, single(previousOutput)));
        return result.get(output).getBit(0);
    }

    private void execute(List<AstNode> statements, Map<String, BitVector> values) {
        for (AstNode statement : statements) {
            if (statement instanceof IfNode ifNode) {
                Bit condition = evaluateExpression(ifNode.condition(), values).getBit(0);
                execute(condition == Bit.ONE ? ifNode.thenStatements() : ifNode.elseStatements(), values);
            } else if (statement instanceof AssignNode assign) {
                assign(assign.lhs(), evaluateExpression(assign.rhs(), values), values);
            } else {
                throw new IllegalStateException("Unsupported statement " + statement.getClass().getSimpleName());
            }
        }
    }

    private void assign(VarRefNode target, BitVector value, Map<String, BitVector> values) {
        VarNode var = variables.get(target.name());
        if (var == null) {
            throw new IllegalStateException("Assignment to undeclared variable '" + target.name() + "'");
        }
        if (value.width() != var.width()) {
            throw new IllegalStateException("Width mismatch assigning " + value.width() + " bit(s) to '"
                    + target.name() + "' of width " + var.width());
        }
        values.put(target.name(), value.copy());
    }

    private BitVector evaluateExpression(AstNode expression, Map<String, BitVector> values) {
        if (expression instanceof VarRefNode ref) {
            BitVector value = values.get(ref.name());
            if (value == null) {
                throw new IllegalStateException("Read of undeclared variable '" + ref.name() + "'");
            }
            return value;
        } else if (expression instanceof ConstNode c) {
            return c.value();
        } else if (expression instanceof ConcatNode concat) {
            return BitVector.concat(evaluateExpression(concat.high(), values), evaluateExpression(concat.low(), values));
        } else if (expression instanceof AndNode and) {
            return evaluateExpression(and.lhs(), values).and(evaluateExpression(and.rhs(), values));
        } else if (expression instanceof EqNode eq) {
            Bit result = evaluateExpression(eq.lhs(), values).logicalEquals(evaluateExpression(eq.rhs(), values));
            return single(result);
        }
        throw new IllegalStateException("Unsupported expression " + expression.getClass().getSimpleName());
    }

    private static BitVector single(Bit bit) {
        BitVector vector = new BitVector(1);
        vector.setBit(0, bit);
        return vector;
    }
}
