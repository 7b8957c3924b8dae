package nineflat.core.multi;

import com.fasterxml.jackson.annotation.JsonProperty;

import nineflat.core.InvalidExposureException;
import nineflat.core.NamespaceCollisionException;
import nineflat.core.StructuralException;
import nineflat.core.dynamics.Communication;
import nineflat.core.dynamics.ComponentProperties;
import nineflat.core.dynamics.Dynamics;
import nineflat.core.dynamics.OnCondition;
import nineflat.core.dynamics.OnEvent;
import nineflat.core.dynamics.Port;
import nineflat.core.dynamics.PortMode;
import nineflat.core.dynamics.Regime;
import nineflat.core.expressions.Expression;
import nineflat.core.values.Quantity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.UnaryOperator;

/**
 * An aggregate of named sub-components, the port connections wiring them
 * together and the ports it exposes to the outside.
 *
 * <p>
 * The aggregate behaves as a single component: {@link #componentClass()}
 * flattens it into one {@link Dynamics} where every symbol of sub-component
 * {@code c} is renamed {@code symbol__c}, analog inputs fed internally are
 * replaced by the expression they receive, on-events fed internally listen on
 * the sender's event port, and regimes are combined as the product of the
 * sub-components' regimes.
 * </p>
 */
public record MultiComponent(
        String name,
        @JsonProperty("sub_components") Map<String, ComponentProperties> subComponents,
        @JsonProperty("port_connections") List<SubComponentConnection> portConnections,
        @JsonProperty("port_exposures") Set<PortExposure> portExposures) implements ComponentProperties {

    /**
     * Joins the regime names of the sub-components into a product regime name.
     */
    public static final String REGIME_SEPARATOR = "___";

    public MultiComponent {
        subComponents = Collections.unmodifiableMap(new TreeMap<>(subComponents));
        portConnections = portConnections == null ? List.of() : List.copyOf(new TreeSet<>(portConnections));
        portExposures = portExposures == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(portExposures));
        var classes = new TreeMap<String, Dynamics>();
        for (var entry : subComponents.entrySet()) {
            if (entry.getKey().contains(RoleNamespacer.SEPARATOR)) {
                throw new NamespaceCollisionException("Sub-component '%s' of '%s' contains the namespace separator"
                        .formatted(entry.getKey(), name));
            }
            classes.put(entry.getKey(), entry.getValue().componentClass());
        }
        for (var c : portConnections) {
            var sendPort = portOf(name, classes, c.sender(), c.sendPort());
            var receivePort = portOf(name, classes, c.receiver(), c.receivePort());
            if (!sendPort.mode().isSend() || receivePort.mode().isSend()) {
                throw new StructuralException("Connection %s.%s -> %s.%s in '%s' does not go from a send to a receive port"
                        .formatted(c.sender(), c.sendPort(), c.receiver(), c.receivePort(), name));
            }
            if (sendPort.mode().communication() != receivePort.mode().communication()) {
                throw new StructuralException("Connection %s.%s -> %s.%s in '%s' mixes event and analog ports"
                        .formatted(c.sender(), c.sendPort(), c.receiver(), c.receivePort(), name));
            }
        }
        for (var e : portExposures) {
            if (!classes.containsKey(e.component())) {
                throw new InvalidExposureException("'%s' exposes port '%s' of unknown sub-component '%s'"
                        .formatted(name, e.port(), e.component()));
            }
            if (classes.get(e.component()).port(e.port()).isEmpty()) {
                throw new InvalidExposureException("'%s' exposes unknown port '%s' of sub-component '%s'"
                        .formatted(name, e.port(), e.component()));
            }
        }
    }

    private static Port portOf(String name, Map<String, Dynamics> classes, String component, String port) {
        var dynamics = classes.get(component);
        if (dynamics == null) {
            throw new StructuralException(
                    "'%s' connects unknown sub-component '%s'".formatted(name, component));
        }
        return dynamics.port(port).orElseThrow(() -> new StructuralException(
                "'%s' connects unknown port '%s' of sub-component '%s'".formatted(name, port, component)));
    }

    public static String namespaced(String symbol, String component) {
        return Expression.TIME.equals(symbol) ? symbol : RoleNamespacer.append(symbol, component);
    }

    @Override
    public Map<String, Quantity> properties() {
        var merged = new TreeMap<String, Quantity>();
        subComponents.forEach((subName, sub) -> sub.properties()
                .forEach((p, q) -> merged.put(RoleNamespacer.append(p, subName), q)));
        return Collections.unmodifiableMap(merged);
    }

    @Override
    public Map<String, Quantity> initialValues() {
        var merged = new TreeMap<String, Quantity>();
        subComponents.forEach((subName, sub) -> sub.initialValues()
                .forEach((s, q) -> merged.put(RoleNamespacer.append(s, subName), q)));
        return Collections.unmodifiableMap(merged);
    }

    @Override
    public Dynamics componentClass() {
        var renamed = new TreeMap<String, Dynamics>();
        subComponents.forEach((subName, sub) -> renamed.put(subName,
                sub.componentClass().rename(subName, s -> namespaced(s, subName))));

        var analogInputs = new TreeMap<String, List<Expression>>();
        var eventInputs = new TreeMap<String, List<String>>();
        for (var c : portConnections) {
            var sendSymbol = namespaced(c.sendPort(), c.sender());
            var receiveSymbol = namespaced(c.receivePort(), c.receiver());
            var mode = renamed.get(c.sender()).port(sendSymbol).map(Port::mode).orElseThrow();
            if (mode.communication() == Communication.ANALOG) {
                analogInputs.computeIfAbsent(receiveSymbol, k -> new ArrayList<>()).add(Expression.symbol(sendSymbol));
            } else {
                eventInputs.computeIfAbsent(receiveSymbol, k -> new ArrayList<>()).add(sendSymbol);
            }
        }
        var exposed = new TreeMap<String, Port>();
        for (var e : portExposures) {
            var port = renamed.get(e.component()).port(namespaced(e.port(), e.component())).orElseThrow();
            exposed.put(e.exposedName(), port.rename(e.exposedName()));
        }

        var substitutions = new TreeMap<String, Expression>();
        analogInputs.forEach((receiveSymbol, senders) -> {
            var receiver = findPort(renamed, receiveSymbol);
            var terms = new ArrayList<>(senders);
            if (receiver.mode() == PortMode.ANALOG_REDUCE) {
                if (exposed.containsKey(receiveSymbol)) {
                    terms.add(Expression.symbol(receiveSymbol));
                }
            } else if (terms.size() > 1) {
                throw new StructuralException("Analog receive port '%s' of '%s' is connected %d times"
                        .formatted(receiveSymbol, name, terms.size()));
            }
            substitutions.put(receiveSymbol, terms.stream().reduce(Expression::sum).orElseThrow());
        });
        // unfed, hidden reduce ports sum over nothing
        renamed.values().stream()
                .flatMap(d -> d.ports().stream())
                .filter(p -> p.mode() == PortMode.ANALOG_REDUCE)
                .filter(p -> !substitutions.containsKey(p.name()) && !exposed.containsKey(p.name()))
                .forEach(p -> substitutions.put(p.name(), Expression.constant(0.0)));

        var parameters = new TreeSet<String>();
        var stateVariables = new TreeSet<String>();
        var aliases = new TreeMap<String, Expression>();
        for (var d : renamed.values()) {
            parameters.addAll(claimAll(parameters, d.parameters()));
            stateVariables.addAll(claimAll(stateVariables, d.stateVariables()));
            d.aliases().forEach((alias, expression) -> {
                if (aliases.putIfAbsent(alias, expression.substitute(substitutions)) != null) {
                    throw new NamespaceCollisionException(
                            "Alias '%s' is defined twice when flattening '%s'".formatted(alias, name));
                }
            });
        }
        return new Dynamics(
                name,
                parameters,
                stateVariables,
                aliases,
                new ArrayList<>(exposed.values()),
                productRegimes(renamed, eventInputs, substitutions));
    }

    private Set<String> claimAll(Set<String> claimed, Set<String> symbols) {
        for (var s : symbols) {
            if (claimed.contains(s)) {
                throw new NamespaceCollisionException(
                        "Symbol '%s' is declared twice when flattening '%s'".formatted(s, name));
            }
        }
        return symbols;
    }

    private static Port findPort(Map<String, Dynamics> renamed, String symbol) {
        return renamed.values().stream()
                .flatMap(d -> d.port(symbol).stream())
                .findAny()
                .orElseThrow();
    }

    private List<Regime> productRegimes(Map<String, Dynamics> renamed, Map<String, List<String>> eventInputs,
            Map<String, Expression> substitutions) {
        var slots = renamed.values().stream().map(Dynamics::regimes).filter(r -> !r.isEmpty()).toList();
        if (slots.isEmpty()) {
            return List.of();
        }
        var combinations = new ArrayList<List<Regime>>();
        combinations.add(List.of());
        for (var slot : slots) {
            var extended = new ArrayList<List<Regime>>();
            for (var prefix : combinations) {
                for (var regime : slot) {
                    var combination = new ArrayList<>(prefix);
                    combination.add(regime);
                    extended.add(combination);
                }
            }
            combinations = extended;
        }
        var regimes = new ArrayList<Regime>();
        for (var combination : combinations) {
            var names = combination.stream().map(Regime::name).toList();
            var derivatives = new TreeMap<String, Expression>();
            var onEvents = new ArrayList<OnEvent>();
            var onConditions = new ArrayList<OnCondition>();
            for (int i = 0; i < combination.size(); i++) {
                var regime = combination.get(i);
                UnaryOperator<String> target = targetIn(names, i);
                derivatives.putAll(regime.timeDerivatives());
                for (var onEvent : regime.onEvents()) {
                    var retargeted = onEvent.rename(UnaryOperator.identity(), target);
                    var senders = eventInputs.get(onEvent.srcPort());
                    if (senders == null) {
                        onEvents.add(retargeted);
                    } else {
                        senders.forEach(sender -> onEvents.add(retargeted.withSrcPort(sender)));
                    }
                }
                for (var onCondition : regime.onConditions()) {
                    onConditions.add(onCondition.rename(UnaryOperator.identity(), target));
                }
            }
            regimes.add(new Regime(String.join(REGIME_SEPARATOR, names), derivatives, onEvents, onConditions)
                    .substitute(substitutions));
        }
        return regimes;
    }

    private static UnaryOperator<String> targetIn(List<String> names, int slot) {
        return regime -> {
            var target = new ArrayList<>(names);
            target.set(slot, regime);
            return String.join(REGIME_SEPARATOR, target);
        };
    }
}
