package nineflat.common;

import nineflat.core.InvalidRoleException;
import nineflat.core.dynamics.ComponentProperties;
import nineflat.core.multi.MultiComponent;
import nineflat.core.multi.PortExposure;
import nineflat.core.multi.RoleNamespacer;
import nineflat.core.multi.SubComponentConnection;
import nineflat.core.network.PortConnection;
import nineflat.core.network.Projection;
import nineflat.core.network.Role;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Merges the response and plasticity of a projection into a single synapse
 * aggregate named {@code <projection>_syn}, with the response under
 * {@value #RESPONSE_NAME} and the plasticity under {@value #PLASTICITY_NAME}.
 */
public class SynapseFlattener {

    public static final String RESPONSE_NAME = "psr";
    public static final String PLASTICITY_NAME = "pls";
    public static final String SYNAPSE_SUFFIX = "_syn";

    public FlattenedSynapse flatten(Projection projection) {
        var table = new EnumMap<Role, String>(Role.class);
        var subComponents = new TreeMap<String, ComponentProperties>();
        table.put(Role.RESPONSE, RESPONSE_NAME);
        subComponents.put(RESPONSE_NAME, projection.response());
        projection.plasticityIfPresent().ifPresent(plasticity -> {
            table.put(Role.PLASTICITY, PLASTICITY_NAME);
            subComponents.put(PLASTICITY_NAME, plasticity);
        });
        var namespacer = new RoleNamespacer(table);

        var internal = new ArrayList<SubComponentConnection>();
        var exposures = new TreeSet<PortExposure>();
        var rewritten = new ArrayList<PortConnection>();
        for (var pc : projection.portConnections()) {
            checkRole(projection, pc, pc.senderRole(), namespacer);
            checkRole(projection, pc, pc.receiverRole(), namespacer);
            var fromSynapse = Role.SYNAPTIC.contains(pc.senderRole());
            var toSynapse = Role.SYNAPTIC.contains(pc.receiverRole());
            if (fromSynapse && toSynapse) {
                internal.add(namespacer.connect(pc));
            } else if (toSynapse) {
                exposures.addAll(namespacer.exposures(pc));
                rewritten.add(pc.withReceiver(Role.SYNAPSE, namespacer.namespace(pc.receivePort(), pc.receiverRole())));
            } else if (fromSynapse) {
                exposures.addAll(namespacer.exposures(pc));
                rewritten.add(pc.withSender(Role.SYNAPSE, namespacer.namespace(pc.sendPort(), pc.senderRole())));
            } else {
                rewritten.add(pc);
            }
        }
        var synapse = new MultiComponent(projection.name() + SYNAPSE_SUFFIX, subComponents, internal, exposures);
        return new FlattenedSynapse(projection.name(), synapse, rewritten);
    }

    private static void checkRole(Projection projection, PortConnection pc, Role role, RoleNamespacer namespacer) {
        if (Role.CELLS.contains(role)) {
            return;
        }
        if (!Role.SYNAPTIC.contains(role)) {
            throw new InvalidRoleException("Port connection %s of projection '%s' uses role '%s' before synapse merging"
                    .formatted(pc.label(), projection.name(), role));
        }
        if (!namespacer.resolves(role)) {
            throw new InvalidRoleException("Port connection %s of projection '%s' refers to a missing %s component"
                    .formatted(pc.label(), projection.name(), role));
        }
    }
}
