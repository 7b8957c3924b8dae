package nineflat.common;

import nineflat.core.StructuralException;
import nineflat.core.dynamics.Communication;
import nineflat.core.dynamics.DynamicsProperties;
import nineflat.core.dynamics.Port;
import nineflat.core.dynamics.PortMode;
import nineflat.core.network.Network;
import nineflat.core.network.Population;
import nineflat.core.network.PortConnection;
import nineflat.core.network.Projection;
import nineflat.core.network.Role;

import java.util.EnumSet;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Checks the port connections of a projection against the ports they join
 * and fills in whether each carries events or analog values.
 *
 * <p>
 * Both endpoints must exist, the sender must be a send port and the receiver a
 * receive port, and all of them must communicate the same way. A connection
 * that declares its kind must declare the one its ports imply. Endpoints whose
 * role names no component are left untouched for {@link SynapseFlattener} to
 * reject.
 * </p>
 */
public class PortConnectionResolver {

    public Projection resolve(Network network, Projection projection) {
        var resolved = projection.portConnections().stream()
                .map(pc -> resolve(network, projection, pc))
                .toList();
        return new Projection(projection.name(), projection.pre(), projection.post(), projection.connectivity(),
                projection.delay(), projection.response(), projection.plasticity(), resolved);
    }

    public PortConnection resolve(Network network, Projection projection, PortConnection pc) {
        var sendModes = modes(network, projection, pc, pc.senderRole(), pc.sendPort());
        var receiveModes = modes(network, projection, pc, pc.receiverRole(), pc.receivePort());
        if (sendModes.isEmpty() || receiveModes.isEmpty()) {
            return pc;
        }
        if (sendModes.stream().anyMatch(m -> !m.isSend())) {
            throw new StructuralException("Port connection %s of projection '%s' does not start at a send port"
                    .formatted(pc.label(), projection.name()));
        }
        if (receiveModes.stream().anyMatch(PortMode::isSend)) {
            throw new StructuralException("Port connection %s of projection '%s' does not end at a receive port"
                    .formatted(pc.label(), projection.name()));
        }
        var kinds = Stream.concat(sendModes.stream(), receiveModes.stream())
                .map(PortMode::communication)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(Communication.class)));
        if (kinds.size() > 1) {
            throw new StructuralException("Port connection %s of projection '%s' joins event and analog ports"
                    .formatted(pc.label(), projection.name()));
        }
        var kind = kinds.iterator().next();
        if (pc.communicates() != null && pc.communicates() != kind) {
            throw new StructuralException("Port connection %s of projection '%s' is declared %s but joins %s ports"
                    .formatted(pc.label(), projection.name(), pc.communicates(), kind));
        }
        return pc.withCommunication(kind);
    }

    private static List<PortMode> modes(Network network, Projection projection, PortConnection pc, Role role,
            String port) {
        List<DynamicsProperties> owners = switch (role) {
            case PRE -> cells(network, projection.pre());
            case POST -> cells(network, projection.post());
            case RESPONSE -> List.of(projection.response());
            case PLASTICITY -> projection.plasticity() == null ? List.of() : List.of(projection.plasticity());
            case SYNAPSE -> List.of();
        };
        return owners.stream()
                .map(owner -> owner.componentClass().port(port).map(Port::mode)
                        .orElseThrow(() -> new StructuralException(
                                "Port connection %s of projection '%s' uses unknown %s port '%s'"
                                        .formatted(pc.label(), projection.name(), role, port))))
                .toList();
    }

    private static List<DynamicsProperties> cells(Network network, String referenceName) {
        return network.reference(referenceName).populationNames().stream()
                .map(n -> network.population(n).orElseThrow(() -> new StructuralException(
                        "Selection '%s' refers to unknown population '%s'".formatted(referenceName, n))))
                .map(Population::cell)
                .toList();
    }
}
