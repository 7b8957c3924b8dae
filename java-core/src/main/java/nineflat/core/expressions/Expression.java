package nineflat.core.expressions;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import nineflat.core.expressions.parse.ExpressionParser;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.UnaryOperator;

/**
 * A math expression as it appears on the right hand side of time derivatives,
 * aliases, state assignments and triggers.
 *
 * Expressions are immutable trees. They are exchanged as plain text (see
 * {@link ExpressionParser}) and rendered back with the minimum amount of
 * parentheses, so that {@code parse(e.toString())} is structurally equal to
 * {@code e}.
 */
@JsonSerialize(using = ExpressionJson.Serializer.class)
@JsonDeserialize(using = ExpressionJson.Deserializer.class)
public sealed interface Expression permits Constant, Symbol, UnaryOperation, BinaryOperation, FunctionCall {

    /**
     * The symbol that stands for simulation time. It is never namespaced.
     */
    String TIME = "t";

    /**
     * @return the names of all free symbols, in lexicographic order.
     */
    default Set<String> symbols() {
        var collected = new TreeSet<String>();
        collectSymbols(collected);
        return collected;
    }

    void collectSymbols(Set<String> collected);

    /**
     * Renames every symbol. Function names are left alone.
     */
    Expression rename(UnaryOperator<String> renaming);

    /**
     * Replaces symbols by whole expressions. Symbols absent from the map are
     * kept.
     */
    Expression substitute(Map<String, Expression> substitutions);

    /**
     * Binding strength used when rendering, higher binds tighter.
     */
    int precedence();

    static Expression parse(String text) {
        return ExpressionParser.parse(text);
    }

    static Expression symbol(String name) {
        return new Symbol(name);
    }

    static Expression constant(double value) {
        return new Constant(value);
    }

    static Expression sum(Expression left, Expression right) {
        return new BinaryOperation(BinaryOperation.Operator.ADD, left, right);
    }
}
