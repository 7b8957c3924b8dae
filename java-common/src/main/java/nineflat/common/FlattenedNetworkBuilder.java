package nineflat.common;

import nineflat.core.ComponentArray;
import nineflat.core.ConnectionGroup;
import nineflat.core.FlattenedNetwork;
import nineflat.core.NameCollisionException;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Collects component arrays and connection groups, possibly from several
 * threads, and refuses a second element with a name already taken.
 */
public class FlattenedNetworkBuilder {

    private final String name;
    private final ConcurrentMap<String, ComponentArray> componentArrays = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ConnectionGroup> connectionGroups = new ConcurrentHashMap<>();

    public FlattenedNetworkBuilder(String name) {
        this.name = name;
    }

    public FlattenedNetworkBuilder addComponentArray(ComponentArray componentArray) {
        if (componentArrays.putIfAbsent(componentArray.name(), componentArray) != null) {
            throw new NameCollisionException(componentArray.name(),
                    "Component array '%s' is produced twice".formatted(componentArray.name()));
        }
        return this;
    }

    public FlattenedNetworkBuilder addConnectionGroup(ConnectionGroup connectionGroup) {
        if (connectionGroups.putIfAbsent(connectionGroup.name(), connectionGroup) != null) {
            throw new NameCollisionException(connectionGroup.name(),
                    "Connection group '%s' is produced twice".formatted(connectionGroup.name()));
        }
        return this;
    }

    public FlattenedNetwork build() {
        return new FlattenedNetwork(name, componentArrays, connectionGroups);
    }
}
