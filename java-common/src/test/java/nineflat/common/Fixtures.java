package nineflat.common;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import nineflat.core.dynamics.Communication;
import nineflat.core.dynamics.Dynamics;
import nineflat.core.dynamics.DynamicsProperties;
import nineflat.core.dynamics.OnCondition;
import nineflat.core.dynamics.OnEvent;
import nineflat.core.dynamics.Port;
import nineflat.core.dynamics.PortMode;
import nineflat.core.dynamics.Regime;
import nineflat.core.expressions.Expression;
import nineflat.core.network.ConnectivityRule;
import nineflat.core.network.Network;
import nineflat.core.network.Population;
import nineflat.core.network.PortConnection;
import nineflat.core.network.Projection;
import nineflat.core.network.Role;
import nineflat.core.values.ArrayValue;
import nineflat.core.values.Quantity;

/**
 * Small networks shared by the flattening tests.
 */
final class Fixtures {

    static final ConnectivityRule ALL_TO_ALL = ConnectivityRule.of("AllToAll");

    private Fixtures() {
    }

    static DynamicsProperties leakyCell(String name) {
        var dynamics = new Dynamics("Leaky", Set.of("tau", "R"), Set.of("v"), Map.of(),
                List.of(new Port("spike", PortMode.EVENT_SEND), new Port("i_syn", PortMode.ANALOG_REDUCE)),
                List.of(new Regime("subthreshold",
                        Map.of("v", Expression.parse("(-v + R * i_syn) / tau")),
                        List.of(),
                        List.of(new OnCondition(Expression.parse("v > 1"), Map.of("v", Expression.parse("0")),
                                List.of("spike"), null)))));
        return new DynamicsProperties(name, dynamics,
                Map.of("tau", Quantity.of(10, "ms"), "R", Quantity.of(1, "Mohm")),
                Map.of("v", Quantity.of(0, "mV")));
    }

    /**
     * An exponentially decaying conductance bumped by {@code w} on each spike,
     * with {@code derivative} as the time derivative of {@code g}.
     */
    static DynamicsProperties response(String derivative, Quantity w) {
        var dynamics = new Dynamics("Exp", Set.of("tau_syn", "w"), Set.of("g"), Map.of("i", Expression.parse("g")),
                List.of(new Port("spike", PortMode.EVENT_RECEIVE), new Port("i", PortMode.ANALOG_SEND),
                        new Port("g", PortMode.ANALOG_SEND)),
                List.of(new Regime("default",
                        Map.of("g", Expression.parse(derivative)),
                        List.of(new OnEvent("spike", Map.of("g", Expression.parse("g + w")))),
                        List.of())));
        return new DynamicsProperties("ExpProps", dynamics,
                Map.of("tau_syn", Quantity.of(5, "ms"), "w", w),
                Map.of("g", Quantity.of(0, "nS")));
    }

    static DynamicsProperties linearResponse() {
        return response("-g / tau_syn", Quantity.of(0.1, "nS"));
    }

    static Quantity varyingWeight() {
        return new Quantity(new ArrayValue(List.of(0.1, 0.2, 0.3)), "nS");
    }

    /**
     * Scales the weight of {@code w} by a state {@code a} that relaxes
     * towards zero and jumps on each spike.
     */
    static DynamicsProperties plasticity() {
        var dynamics = new Dynamics("Trace", Set.of("tau_a"), Set.of("a"), Map.of("scale", Expression.parse("1 + a")),
                List.of(new Port("spike", PortMode.EVENT_RECEIVE), new Port("scale", PortMode.ANALOG_SEND)),
                List.of(new Regime("default",
                        Map.of("a", Expression.parse("-a / tau_a")),
                        List.of(new OnEvent("spike", Map.of("a", Expression.parse("a + 1")))),
                        List.of())));
        return new DynamicsProperties("TraceProps", dynamics, Map.of("tau_a", Quantity.of(20, "ms")),
                Map.of("a", Quantity.of(0, "")));
    }

    /**
     * A response whose bump is scaled by an analog input.
     */
    static DynamicsProperties scaledResponse() {
        var dynamics = new Dynamics("ScaledExp", Set.of("tau_syn", "w"), Set.of("g"), Map.of("i", Expression.parse("g")),
                List.of(new Port("spike", PortMode.EVENT_RECEIVE), new Port("i", PortMode.ANALOG_SEND),
                        new Port("scale", PortMode.ANALOG_RECEIVE)),
                List.of(new Regime("default",
                        Map.of("g", Expression.parse("-g / tau_syn")),
                        List.of(new OnEvent("spike", Map.of("g", Expression.parse("g + w * scale")))),
                        List.of())));
        return new DynamicsProperties("ScaledExpProps", dynamics,
                Map.of("tau_syn", Quantity.of(5, "ms"), "w", Quantity.of(0.1, "nS")),
                Map.of("g", Quantity.of(0, "nS")));
    }

    static Projection plastic(String name, String pre, String post) {
        return new Projection(name, pre, post, ALL_TO_ALL, Quantity.of(1, "ms"), scaledResponse(), plasticity(),
                List.of(spikeIn(),
                        new PortConnection(Role.PRE, Role.PLASTICITY, "spike", "spike", Communication.EVENT),
                        new PortConnection(Role.PLASTICITY, Role.RESPONSE, "scale", "scale", Communication.ANALOG),
                        currentOut()));
    }

    static PortConnection spikeIn() {
        return new PortConnection(Role.PRE, Role.RESPONSE, "spike", "spike", Communication.EVENT);
    }

    static PortConnection currentOut() {
        return new PortConnection(Role.RESPONSE, Role.POST, "i", "i_syn", Communication.ANALOG);
    }

    static PortConnection feedback() {
        return new PortConnection(Role.RESPONSE, Role.PRE, "g", "i_syn", Communication.ANALOG);
    }

    static Projection projection(String name, String pre, String post, DynamicsProperties response,
            PortConnection... connections) {
        return new Projection(name, pre, post, ALL_TO_ALL, Quantity.of(2, "ms"), response, null,
                List.of(connections));
    }

    /**
     * A (size 10) projects onto B (size 5) through P.
     */
    static Network feedforward(DynamicsProperties response, PortConnection... connections) {
        var pcs = connections.length == 0 ? new PortConnection[] { spikeIn(), currentOut() } : connections;
        return new Network("feedforward",
                List.of(new Population("A", 10, leakyCell("LeakyA")), new Population("B", 5, leakyCell("LeakyB"))),
                List.of(),
                List.of(projection("P", "A", "B", response, pcs)));
    }

    static Network network(List<Population> populations, Projection... projections) {
        return new Network("net", populations, List.of(), new ArrayList<>(List.of(projections)));
    }
}
