package nineflat.core.expressions;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

public record FunctionCall(String function, List<Expression> arguments) implements Expression {

    public FunctionCall {
        arguments = List.copyOf(arguments);
    }

    @Override
    public void collectSymbols(Set<String> collected) {
        arguments.forEach(a -> a.collectSymbols(collected));
    }

    @Override
    public Expression rename(UnaryOperator<String> renaming) {
        return new FunctionCall(function, arguments.stream().map(a -> a.rename(renaming)).collect(Collectors.toList()));
    }

    @Override
    public Expression substitute(Map<String, Expression> substitutions) {
        return new FunctionCall(function,
                arguments.stream().map(a -> a.substitute(substitutions)).collect(Collectors.toList()));
    }

    @Override
    public int precedence() {
        return Integer.MAX_VALUE;
    }

    @Override
    public String toString() {
        return function + "(" + arguments.stream().map(Expression::toString).collect(Collectors.joining(", ")) + ")";
    }
}
