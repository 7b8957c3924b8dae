package nineflat.core.dynamics;

import com.fasterxml.jackson.annotation.JsonProperty;

import nineflat.core.NamespaceCollisionException;
import nineflat.core.expressions.Expression;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The class of a component: its parameters, state variables, aliases, ports
 * and the regimes its state evolves in.
 *
 * Parameters, state variables and aliases share one namespace. Ports may carry
 * the name of the state variable or alias they publish, receive ports are
 * referenced in expressions by their own name.
 */
public record Dynamics(
        String name,
        Set<String> parameters,
        @JsonProperty("state_variables") Set<String> stateVariables,
        Map<String, Expression> aliases,
        List<Port> ports,
        List<Regime> regimes) {

    public Dynamics {
        parameters = parameters == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(parameters));
        stateVariables = stateVariables == null ? Set.of()
                : Collections.unmodifiableSet(new TreeSet<>(stateVariables));
        aliases = aliases == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(aliases));
        ports = ports == null ? List.of() : ports.stream().sorted().toList();
        regimes = regimes == null ? List.of() : List.copyOf(regimes);
        var owners = new HashMap<String, String>();
        for (var p : parameters) {
            claim(name, owners, p, "parameter");
        }
        for (var s : stateVariables) {
            claim(name, owners, s, "state variable");
        }
        for (var a : aliases.keySet()) {
            claim(name, owners, a, "alias");
        }
        var portNames = new TreeSet<String>();
        for (var p : ports) {
            if (!portNames.add(p.name())) {
                throw new NamespaceCollisionException(
                        "Port '%s' is declared twice in dynamics '%s'".formatted(p.name(), name));
            }
        }
    }

    private static void claim(String dynamicsName, Map<String, String> owners, String symbol, String kind) {
        var previous = owners.putIfAbsent(symbol, kind);
        if (previous != null) {
            throw new NamespaceCollisionException("'%s' is declared both as %s and %s in dynamics '%s'"
                    .formatted(symbol, previous, kind, dynamicsName));
        }
    }

    public Optional<Port> port(String portName) {
        return ports.stream().filter(p -> p.name().equals(portName)).findAny();
    }

    public List<Port> receivePorts() {
        return ports.stream().filter(p -> !p.mode().isSend()).toList();
    }

    public List<Expression> allTimeDerivatives() {
        return regimes.stream().flatMap(r -> r.timeDerivatives().values().stream()).toList();
    }

    public List<OnEvent> allOnEvents() {
        return regimes.stream().flatMap(r -> r.onEvents().stream()).toList();
    }

    public List<OnCondition> allOnConditions() {
        return regimes.stream().flatMap(r -> r.onConditions().stream()).toList();
    }

    /**
     * @return every expression a transition evaluates, trigger included
     */
    public static List<Expression> expressionsOf(Collection<? extends Transition> transitions) {
        return transitions.stream().flatMap(t -> {
            var assigned = t.stateAssignments().values().stream();
            if (t instanceof OnCondition c) {
                return Stream.concat(Stream.of(c.trigger()), assigned);
            }
            return assigned;
        }).toList();
    }

    /**
     * @return the names that may appear free in this dynamics' expressions
     */
    public Set<String> declaredSymbols() {
        var declared = new TreeSet<String>();
        declared.addAll(parameters);
        declared.addAll(stateVariables);
        declared.addAll(aliases.keySet());
        declared.addAll(receivePorts().stream().map(Port::name).collect(Collectors.toSet()));
        return declared;
    }

    /**
     * Renames every symbol and port. Regime names are kept.
     */
    public Dynamics rename(String newName, UnaryOperator<String> renaming) {
        var renamedAliases = new TreeMap<String, Expression>();
        aliases.forEach((k, v) -> renamedAliases.put(renaming.apply(k), v.rename(renaming)));
        return new Dynamics(
                newName,
                parameters.stream().map(renaming).collect(Collectors.toSet()),
                stateVariables.stream().map(renaming).collect(Collectors.toSet()),
                renamedAliases,
                ports.stream().map(p -> p.rename(renaming.apply(p.name()))).toList(),
                regimes.stream().map(r -> r.rename(renaming, UnaryOperator.identity())).toList());
    }
}
