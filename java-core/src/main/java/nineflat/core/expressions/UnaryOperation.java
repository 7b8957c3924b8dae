package nineflat.core.expressions;

import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

public record UnaryOperation(Operator operator, Expression operand) implements Expression {

    public enum Operator {
        NEGATE("-"),
        NOT("!");

        public final String token;

        Operator(String token) {
            this.token = token;
        }
    }

    @Override
    public void collectSymbols(Set<String> collected) {
        operand.collectSymbols(collected);
    }

    @Override
    public Expression rename(UnaryOperator<String> renaming) {
        return new UnaryOperation(operator, operand.rename(renaming));
    }

    @Override
    public Expression substitute(Map<String, Expression> substitutions) {
        return new UnaryOperation(operator, operand.substitute(substitutions));
    }

    @Override
    public int precedence() {
        return 6;
    }

    @Override
    public String toString() {
        var inner = operand.toString();
        if (operand.precedence() < precedence()) {
            inner = "(" + inner + ")";
        }
        return operator.token + inner;
    }
}
