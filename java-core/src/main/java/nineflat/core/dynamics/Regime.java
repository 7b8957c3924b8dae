package nineflat.core.dynamics;

import com.fasterxml.jackson.annotation.JsonProperty;

import nineflat.core.expressions.Expression;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.UnaryOperator;

public record Regime(
        String name,
        @JsonProperty("time_derivatives") Map<String, Expression> timeDerivatives,
        @JsonProperty("on_events") List<OnEvent> onEvents,
        @JsonProperty("on_conditions") List<OnCondition> onConditions) {

    public Regime {
        timeDerivatives = timeDerivatives == null ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(timeDerivatives));
        onEvents = onEvents == null ? List.of() : List.copyOf(onEvents);
        onConditions = onConditions == null ? List.of() : List.copyOf(onConditions);
    }

    public Regime rename(UnaryOperator<String> renaming, UnaryOperator<String> regimeRenaming) {
        var derivatives = new TreeMap<String, Expression>();
        timeDerivatives.forEach((k, v) -> derivatives.put(renaming.apply(k), v.rename(renaming)));
        return new Regime(
                regimeRenaming.apply(name),
                derivatives,
                onEvents.stream().map(e -> e.rename(renaming, regimeRenaming)).toList(),
                onConditions.stream().map(c -> c.rename(renaming, regimeRenaming)).toList());
    }

    public Regime substitute(Map<String, Expression> substitutions) {
        var derivatives = new TreeMap<String, Expression>();
        timeDerivatives.forEach((k, v) -> derivatives.put(k, v.substitute(substitutions)));
        return new Regime(
                name,
                derivatives,
                onEvents.stream().map(e -> e.substitute(substitutions)).toList(),
                onConditions.stream().map(c -> c.substitute(substitutions)).toList());
    }
}
