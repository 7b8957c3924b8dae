package nineflat.common;

import nineflat.core.dynamics.ComponentProperties;
import nineflat.core.dynamics.Dynamics;
import nineflat.core.dynamics.Transition;
import nineflat.core.expressions.BinaryOperation;
import nineflat.core.expressions.Constant;
import nineflat.core.expressions.Expression;
import nineflat.core.expressions.FunctionCall;
import nineflat.core.expressions.Symbol;
import nineflat.core.expressions.UnaryOperation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Set;

/**
 * Decides whether a merged synapse can be shared by every connection onto a
 * cell. That holds when its dynamics are linear: one regime, derivatives and
 * state assignments affine in the state variables, and no threshold on a
 * state variable. Sums of such synapses behave like a single one.
 */
public class LinearityClassifier {

    private static final Logger logger = LoggerFactory.getLogger(LinearityClassifier.class);

    /**
     * Degree of anything that is not a polynomial in the state variables.
     */
    static final int NONLINEAR = Integer.MAX_VALUE;

    public SynapseClassification classify(ComponentProperties synapse) {
        var dynamics = synapse.componentClass();
        var classification = classify(dynamics);
        if (classification instanceof SynapseClassification.Unflattenable unflattenable) {
            logger.debug("'{}' is not linear: {}", synapse.name(), unflattenable.reason());
        }
        return classification;
    }

    public SynapseClassification classify(Dynamics dynamics) {
        if (dynamics.regimes().size() > 1) {
            return new SynapseClassification.Unflattenable(
                    "'%s' has %d regimes".formatted(dynamics.name(), dynamics.regimes().size()));
        }
        var graph = new DependencyGraph(dynamics);
        var states = dynamics.stateVariables();
        for (var regime : dynamics.regimes()) {
            for (var derivative : regime.timeDerivatives().entrySet()) {
                if (degree(graph.inline(derivative.getValue()), states) > 1) {
                    return new SynapseClassification.Unflattenable("d%s/dt is not linear in the state variables"
                            .formatted(derivative.getKey()));
                }
            }
        }
        for (var onCondition : dynamics.allOnConditions()) {
            var trigger = graph.inline(onCondition.trigger());
            if (trigger.symbols().stream().anyMatch(states::contains)) {
                return new SynapseClassification.Unflattenable(
                        "trigger '%s' depends on a state variable".formatted(onCondition.trigger()));
            }
        }
        var transitions = new ArrayList<Transition>(dynamics.allOnEvents());
        transitions.addAll(dynamics.allOnConditions());
        for (var transition : transitions) {
            for (var assignment : transition.stateAssignments().entrySet()) {
                if (degree(graph.inline(assignment.getValue()), states) > 1) {
                    return new SynapseClassification.Unflattenable("assignment to '%s' is not linear"
                            .formatted(assignment.getKey()));
                }
            }
        }
        return new SynapseClassification.Embeddable(dynamics);
    }

    /**
     * The polynomial degree of {@code expression} in {@code states}, or
     * {@link #NONLINEAR}.
     */
    static int degree(Expression expression, Set<String> states) {
        if (expression instanceof Constant) {
            return 0;
        }
        if (expression instanceof Symbol symbol) {
            return states.contains(symbol.name()) ? 1 : 0;
        }
        if (expression instanceof UnaryOperation unary) {
            var operand = degree(unary.operand(), states);
            return unary.operator() == UnaryOperation.Operator.NEGATE || operand == 0 ? operand : NONLINEAR;
        }
        if (expression instanceof FunctionCall call) {
            return call.arguments().stream().allMatch(a -> degree(a, states) == 0) ? 0 : NONLINEAR;
        }
        if (expression instanceof BinaryOperation binary) {
            var left = degree(binary.left(), states);
            var right = degree(binary.right(), states);
            return switch (binary.operator()) {
                case ADD, SUBTRACT -> Math.max(left, right);
                case MULTIPLY -> left == NONLINEAR || right == NONLINEAR ? NONLINEAR : left + right;
                case DIVIDE -> right == 0 ? left : NONLINEAR;
                case POWER -> power(binary, left, right);
                default -> left == 0 && right == 0 ? 0 : NONLINEAR;
            };
        }
        throw new IllegalStateException("Unknown expression " + expression);
    }

    private static int power(BinaryOperation binary, int base, int exponent) {
        if (base == 0 && exponent == 0) {
            return 0;
        }
        if (binary.right() instanceof Constant constant && base != NONLINEAR) {
            var value = constant.value();
            if (value >= 0 && value == Math.rint(value) && value * base <= 1) {
                return (int) value * base;
            }
        }
        return NONLINEAR;
    }
}
