package nineflat.common;

import nineflat.core.ConnectionPropertySet;
import nineflat.core.dynamics.Dynamics;

import java.util.List;

/**
 * Where a merged synapse can live: once per target cell, embedded in the
 * cell's aggregate, or once per connection.
 */
public sealed interface SynapseClassification {

    /**
     * The synapse can be shared by all connections onto a cell. Values that
     * still differ per connection travel in the property sets.
     */
    record Embeddable(Dynamics dynamics, List<ConnectionPropertySet> connectionPropertySets)
            implements SynapseClassification {

        public Embeddable {
            connectionPropertySets = List.copyOf(connectionPropertySets);
        }

        public Embeddable(Dynamics dynamics) {
            this(dynamics, List.of());
        }
    }

    record Unflattenable(String reason) implements SynapseClassification {
    }

    default boolean isEmbeddable() {
        return this instanceof Embeddable;
    }
}
