package nineflat.common;

import nineflat.core.ComponentArray;
import nineflat.core.ConnectionGroup;
import nineflat.core.ConnectionPropertySet;
import nineflat.core.Connectivity;
import nineflat.core.FlattenedNetwork;
import nineflat.core.NameCollisionException;
import nineflat.core.ReservedNameException;
import nineflat.core.StructuralException;
import nineflat.core.SynapseDefinition;
import nineflat.core.dynamics.ComponentProperties;
import nineflat.core.multi.MultiComponent;
import nineflat.core.multi.PortExposure;
import nineflat.core.multi.RoleNamespacer;
import nineflat.core.multi.SubComponentConnection;
import nineflat.core.network.Network;
import nineflat.core.network.Population;
import nineflat.core.network.PortConnection;
import nineflat.core.network.Projection;
import nineflat.core.network.Role;
import nineflat.core.values.Quantity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Lowers a {@link Network} into a {@link FlattenedNetwork}: one
 * {@link ComponentArray} per population, holding the cell and every synapse
 * that can be shared, and one {@link ConnectionGroup} per direction of each
 * port connection that crosses from the source population to the target.
 *
 * <p>
 * Inside a component array the cell lives under the configured cell name and
 * each embedded synapse under its projection's name. Ports reachable from
 * outside are exposed as {@code port__subcomponent}; synapses that could not
 * be embedded are addressed by their own, un-namespaced ports.
 * </p>
 */
public class NetworkFlattener {

    private static final Logger logger = LoggerFactory.getLogger(NetworkFlattener.class);

    private final FlatteningConfiguration configuration;
    private final PortConnectionResolver connectionResolver = new PortConnectionResolver();
    private final SynapseFlattener synapseFlattener = new SynapseFlattener();
    private final LinearityClassifier linearityClassifier = new LinearityClassifier();
    private final ConnectionPropertyExtractor propertyExtractor = new ConnectionPropertyExtractor();

    public NetworkFlattener() {
        this(new FlatteningConfiguration());
    }

    public NetworkFlattener(FlatteningConfiguration configuration) {
        this.configuration = configuration;
    }

    public FlatteningConfiguration configuration() {
        return configuration;
    }

    public FlattenedNetwork flatten(Network network) {
        checkNames(network);
        var synapses = new TreeMap<String, FlattenedSynapse>();
        for (var projection : network.projections()) {
            synapses.put(projection.name(),
                    synapseFlattener.flatten(connectionResolver.resolve(network, projection)));
        }
        logger.debug("Merged the synapses of {} projections in '{}'", synapses.size(), network.name());

        var builder = new FlattenedNetworkBuilder(network.name());
        var populations = configuration.parallel
                ? network.populations().parallelStream()
                : network.populations().stream();
        populations.forEach(population -> {
            try {
                flattenPopulation(network, population, synapses, builder);
            } catch (StructuralException e) {
                logger.error("Could not flatten population '{}': {}", population.name(), e.getMessage());
                throw e;
            }
        });
        var flattened = builder.build();
        logger.info("Flattened '{}' into {} component arrays and {} connection groups", network.name(),
                flattened.componentArrays().size(), flattened.connectionGroups().size());
        return flattened;
    }

    private void checkNames(Network network) {
        var cellName = configuration.cellName;
        var projectionNames = new TreeSet<String>();
        for (var projection : network.projections()) {
            if (projection.name().equals(cellName)) {
                throw new ReservedNameException(
                        "Projection '%s' uses the name reserved for cells".formatted(projection.name()));
            }
            if (!projectionNames.add(projection.name())) {
                throw new NameCollisionException(projection.name(),
                        "Projection '%s' is defined twice".formatted(projection.name()));
            }
        }
        for (var population : network.populations()) {
            if (population.name().equals(cellName)) {
                throw new ReservedNameException(
                        "Population '%s' uses the name reserved for cells".formatted(population.name()));
            }
            if (projectionNames.contains(population.name())) {
                throw new NameCollisionException(population.name(),
                        "Population '%s' shares its name with a projection".formatted(population.name()));
            }
        }
    }

    private void flattenPopulation(Network network, Population population, Map<String, FlattenedSynapse> synapses,
            FlattenedNetworkBuilder builder) {
        var cellName = configuration.cellName;
        var byName = Comparator.comparing(Projection::name);
        var receiving = network.projections().stream()
                .filter(p -> network.targets(p, population))
                .sorted(byName)
                .toList();
        var sending = network.projections().stream()
                .filter(p -> network.sources(p, population))
                .sorted(byName)
                .toList();

        var subComponents = new TreeMap<String, ComponentProperties>();
        subComponents.put(cellName, population.cell());
        var internal = new ArrayList<SubComponentConnection>();
        var exposures = new TreeSet<PortExposure>();
        var externalized = new ArrayList<SynapseDefinition>();
        var propertySets = new ArrayList<ConnectionPropertySet>();
        var sourceSide = RoleNamespacer.of(Role.PRE, cellName);

        for (var projection : receiving) {
            var synapse = synapses.get(projection.name());
            var classification = linearityClassifier.classify(synapse.synapse());
            if (classification instanceof SynapseClassification.Embeddable embeddable) {
                classification = propertyExtractor.extract(synapse.synapse(), embeddable.dynamics(), projection.name());
            }
            var table = new EnumMap<Role, String>(Role.class);
            table.put(Role.POST, cellName);
            if (classification.isEmbeddable()) {
                table.put(Role.SYNAPSE, projection.name());
            }
            var targetSide = new RoleNamespacer(table);
            if (classification instanceof SynapseClassification.Embeddable embeddable) {
                subComponents.put(projection.name(), synapse.synapse());
                propertySets.addAll(embeddable.connectionPropertySets());
                synapse.postConnections().forEach(pc -> internal.add(targetSide.connect(pc)));
            } else if (classification instanceof SynapseClassification.Unflattenable unflattenable) {
                logger.info("Synapse of '{}' stays per connection: {}", projection.name(), unflattenable.reason());
                externalized.add(new SynapseDefinition(projection.name(), synapse.synapse(),
                        synapse.postConnections()));
                synapse.postConnections().forEach(pc -> exposures.addAll(targetSide.exposures(pc)));
            }
            for (var pc : synapse.preConnections()) {
                exposures.addAll(targetSide.exposures(pc));
                builder.addConnectionGroup(connectionGroup(network, projection, population, pc, sourceSide,
                        targetSide));
            }
        }
        for (var projection : sending) {
            synapses.get(projection.name()).preConnections()
                    .forEach(pc -> exposures.addAll(sourceSide.exposures(pc)));
        }

        propertySets.sort(Comparator.comparing(ConnectionPropertySet::port));
        var dynamics = new MultiComponent(population.name(), subComponents, internal, exposures);
        builder.addComponentArray(
                new ComponentArray(population.name(), population.size(), dynamics, externalized, propertySets));
        logger.debug("Population '{}': {} embedded synapses, {} per connection, {} connection property sets",
                population.name(), subComponents.size() - 1, externalized.size(), propertySets.size());
    }

    /**
     * The group carrying {@code pc} between the source side and
     * {@code population}. Connections sent from the source side run forward;
     * the rest run backward, inverted and without delay.
     */
    private ConnectionGroup connectionGroup(Network network, Projection projection, Population population,
            PortConnection pc, RoleNamespacer sourceSide, RoleNamespacer targetSide) {
        var name = String.join(RoleNamespacer.SEPARATOR, projection.name(), pc.label());
        if (network.reference(projection.post()).isSelection()) {
            name = RoleNamespacer.append(name, population.name());
        }
        var sendPort = side(pc.senderRole(), sourceSide, targetSide).qualify(pc.sendPort(), pc.senderRole());
        var receivePort = side(pc.receiverRole(), sourceSide, targetSide).qualify(pc.receivePort(),
                pc.receiverRole());
        var delay = Objects.requireNonNullElse(projection.delay(), Quantity.zero(""));
        var forward = Connectivity.of(projection.connectivity(), network.sizeOf(projection.pre()),
                population.size());
        if (pc.senderRole() == Role.PRE) {
            return new ConnectionGroup(name, projection.pre(), population.name(), sendPort, receivePort, forward,
                    delay, pc.communicates());
        }
        return new ConnectionGroup(name, population.name(), projection.pre(), sendPort, receivePort,
                forward.inverse(), Quantity.zero(delay.units()), pc.communicates());
    }

    private static RoleNamespacer side(Role role, RoleNamespacer sourceSide, RoleNamespacer targetSide) {
        return role == Role.PRE ? sourceSide : targetSide;
    }
}
