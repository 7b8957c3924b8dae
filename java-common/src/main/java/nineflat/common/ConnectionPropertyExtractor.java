package nineflat.common;

import nineflat.core.ConnectionPropertySet;
import nineflat.core.dynamics.ComponentProperties;
import nineflat.core.dynamics.Dynamics;
import nineflat.core.multi.RoleNamespacer;
import nineflat.core.values.Property;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds the properties of an embeddable synapse whose values differ per
 * connection and groups them by the event port that uses them.
 *
 * <p>
 * A property that differs per connection can only be carried by the events
 * arriving on a port, so it may only be read by on-event state assignments.
 * If the continuous dynamics read it, the synapse has to stay per connection.
 * </p>
 */
public class ConnectionPropertyExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionPropertyExtractor.class);

    /**
     * @param synapse   the merged synapse, holding the property values
     * @param dynamics  its flattened dynamics
     * @param namespace the name the synapse is embedded under, appended to the
     *                  port and property names
     */
    public SynapseClassification extract(ComponentProperties synapse, Dynamics dynamics, String namespace) {
        var properties = synapse.properties();
        var varying = properties.entrySet().stream()
                .filter(e -> !e.getValue().isSingle())
                .map(Map.Entry::getKey)
                .filter(dynamics.parameters()::contains)
                .collect(Collectors.toCollection(TreeSet::new));
        if (varying.isEmpty()) {
            return new SynapseClassification.Embeddable(dynamics);
        }

        var graph = new DependencyGraph(dynamics);
        var continuous = Stream.concat(
                dynamics.allTimeDerivatives().stream(),
                Dynamics.expressionsOf(dynamics.allOnConditions()).stream()).toList();
        var inDynamics = new TreeSet<>(graph.requiredFor(continuous).parameters());
        inDynamics.retainAll(varying);
        if (!inDynamics.isEmpty()) {
            return new SynapseClassification.Unflattenable(
                    "%s vary per connection but are read by the continuous dynamics of '%s'"
                            .formatted(inDynamics, dynamics.name()));
        }

        var byPort = new TreeMap<String, Set<String>>();
        for (var onEvent : dynamics.allOnEvents()) {
            var used = new TreeSet<>(graph.requiredFor(onEvent.stateAssignments().values()).parameters());
            used.retainAll(varying);
            if (!used.isEmpty()) {
                byPort.computeIfAbsent(onEvent.srcPort(), k -> new TreeSet<>()).addAll(used);
            }
        }
        var sets = new ArrayList<ConnectionPropertySet>();
        byPort.forEach((port, names) -> sets.add(new ConnectionPropertySet(
                RoleNamespacer.append(port, namespace),
                names.stream()
                        .map(p -> new Property(RoleNamespacer.append(p, namespace), properties.get(p)))
                        .toList())));
        logger.debug("'{}' carries {} connection property sets", namespace, sets.size());
        return new SynapseClassification.Embeddable(dynamics, sets);
    }
}
