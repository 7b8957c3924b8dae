package nineflat.core.expressions;

import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

public record Symbol(String name) implements Expression {

    @Override
    public void collectSymbols(Set<String> collected) {
        collected.add(name);
    }

    @Override
    public Expression rename(UnaryOperator<String> renaming) {
        return new Symbol(renaming.apply(name));
    }

    @Override
    public Expression substitute(Map<String, Expression> substitutions) {
        return substitutions.getOrDefault(name, this);
    }

    @Override
    public int precedence() {
        return Integer.MAX_VALUE;
    }

    @Override
    public String toString() {
        return name;
    }
}
