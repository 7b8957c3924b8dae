package nineflat.core.expressions;

import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

public record BinaryOperation(Operator operator, Expression left, Expression right) implements Expression {

    public enum Operator {
        OR("||", 1),
        AND("&&", 2),
        EQUAL("==", 3),
        NOT_EQUAL("!=", 3),
        LESS("<", 3),
        LESS_EQUAL("<=", 3),
        GREATER(">", 3),
        GREATER_EQUAL(">=", 3),
        ADD("+", 4),
        SUBTRACT("-", 4),
        MULTIPLY("*", 5),
        DIVIDE("/", 5),
        POWER("^", 7);

        public final String token;
        public final int precedence;

        Operator(String token, int precedence) {
            this.token = token;
            this.precedence = precedence;
        }
    }

    @Override
    public void collectSymbols(Set<String> collected) {
        left.collectSymbols(collected);
        right.collectSymbols(collected);
    }

    @Override
    public Expression rename(UnaryOperator<String> renaming) {
        return new BinaryOperation(operator, left.rename(renaming), right.rename(renaming));
    }

    @Override
    public Expression substitute(Map<String, Expression> substitutions) {
        return new BinaryOperation(operator, left.substitute(substitutions), right.substitute(substitutions));
    }

    @Override
    public int precedence() {
        return operator.precedence;
    }

    @Override
    public String toString() {
        // power is right associative, everything else is left associative
        var leftText = left.toString();
        var rightText = right.toString();
        if (operator == Operator.POWER) {
            if (left.precedence() <= precedence()) {
                leftText = "(" + leftText + ")";
            }
            if (right.precedence() < precedence()) {
                rightText = "(" + rightText + ")";
            }
        } else {
            if (left.precedence() < precedence()) {
                leftText = "(" + leftText + ")";
            }
            if (right.precedence() <= precedence()) {
                rightText = "(" + rightText + ")";
            }
        }
        return leftText + " " + operator.token + " " + rightText;
    }
}
