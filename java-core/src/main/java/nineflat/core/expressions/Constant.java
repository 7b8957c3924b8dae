package nineflat.core.expressions;

import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

public record Constant(double value) implements Expression {

    @Override
    public void collectSymbols(Set<String> collected) {
    }

    @Override
    public Expression rename(UnaryOperator<String> renaming) {
        return this;
    }

    @Override
    public Expression substitute(Map<String, Expression> substitutions) {
        return this;
    }

    @Override
    public int precedence() {
        return value < 0 ? 6 : Integer.MAX_VALUE;
    }

    @Override
    public String toString() {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
