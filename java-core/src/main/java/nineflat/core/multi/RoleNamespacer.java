package nineflat.core.multi;

import nineflat.core.InvalidRoleException;
import nineflat.core.NamespaceCollisionException;
import nineflat.core.network.PortConnection;
import nineflat.core.network.Role;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Translates role-tagged ports into sub-component qualified names for one
 * container. Each role present in the table names the sub-component that plays
 * it; a port {@code p} of that sub-component is known outside as
 * {@code p__name}.
 */
public final class RoleNamespacer {

    public static final String SEPARATOR = "__";

    private final Map<Role, String> names;
    private final Map<String, Role> roles;

    public RoleNamespacer(Map<Role, String> table) {
        this.names = table.isEmpty() ? new EnumMap<>(Role.class) : new EnumMap<>(table);
        this.roles = new HashMap<>();
        for (var entry : names.entrySet()) {
            var name = entry.getValue();
            if (name == null || name.isEmpty() || name.contains(SEPARATOR)) {
                throw new NamespaceCollisionException(
                        "Sub-component name '%s' for role '%s' cannot be used as a namespace"
                                .formatted(name, entry.getKey()));
            }
            var previous = roles.putIfAbsent(name, entry.getKey());
            if (previous != null) {
                throw new NamespaceCollisionException("Roles '%s' and '%s' both map to sub-component '%s'"
                        .formatted(previous, entry.getKey(), name));
            }
        }
    }

    public static RoleNamespacer of(Role role, String name) {
        return new RoleNamespacer(Map.of(role, name));
    }

    public static String append(String name, String namespace) {
        return name + SEPARATOR + namespace;
    }

    /**
     * Splits at the last separator: {@code a__b__c} is port {@code a__b} of
     * {@code c}.
     */
    public static Optional<NamespacedName> splitNamespace(String name) {
        var index = name.lastIndexOf(SEPARATOR);
        if (index <= 0 || index + SEPARATOR.length() >= name.length()) {
            return Optional.empty();
        }
        return Optional.of(new NamespacedName(name.substring(0, index), name.substring(index + SEPARATOR.length())));
    }

    public record NamespacedName(String name, String namespace) {
    }

    public record RolePort(Role role, String port) {
    }

    public boolean resolves(Role role) {
        return names.containsKey(role);
    }

    public String nameOf(Role role) {
        var name = names.get(role);
        if (name == null) {
            throw new InvalidRoleException("Role '%s' is not played by any sub-component of %s".formatted(role, names));
        }
        return name;
    }

    public String namespace(String port, Role role) {
        return append(port, nameOf(role));
    }

    /**
     * Namespaces the port when the role is in the table, otherwise leaves it
     * as is.
     */
    public String qualify(String port, Role role) {
        return resolves(role) ? namespace(port, role) : port;
    }

    public RolePort split(String name) {
        var split = splitNamespace(name)
                .orElseThrow(() -> new InvalidRoleException("'%s' carries no namespace".formatted(name)));
        var role = roles.get(split.namespace());
        if (role == null) {
            throw new InvalidRoleException(
                    "Namespace '%s' of '%s' is not a sub-component in %s".formatted(split.namespace(), name, names));
        }
        return new RolePort(role, split.name());
    }

    public PortConnection assignPortNamespaces(PortConnection connection) {
        return new PortConnection(
                connection.senderRole(),
                connection.receiverRole(),
                qualify(connection.sendPort(), connection.senderRole()),
                qualify(connection.receivePort(), connection.receiverRole()),
                connection.communicates());
    }

    /**
     * Turns a role-tagged connection into a connection between named
     * sub-components. Both roles have to be in the table.
     */
    public SubComponentConnection connect(PortConnection connection) {
        return new SubComponentConnection(
                nameOf(connection.senderRole()),
                connection.sendPort(),
                nameOf(connection.receiverRole()),
                connection.receivePort());
    }

    /**
     * The exposures needed for the endpoints of {@code connection} that lie
     * inside this container.
     */
    public List<PortExposure> exposures(PortConnection connection) {
        var exposures = new ArrayList<PortExposure>(2);
        if (resolves(connection.senderRole())) {
            exposures.add(new PortExposure(nameOf(connection.senderRole()), connection.sendPort()));
        }
        if (resolves(connection.receiverRole())) {
            exposures.add(new PortExposure(nameOf(connection.receiverRole()), connection.receivePort()));
        }
        return exposures;
    }
}
