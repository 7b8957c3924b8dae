package nineflat.core.multi;

import java.util.Comparator;

/**
 * Makes {@code port} of sub-component {@code component} visible outside of
 * the aggregate, under the name {@code port__component}.
 */
public record PortExposure(String component, String port) implements Comparable<PortExposure> {

    private static final Comparator<PortExposure> ORDER = Comparator
            .comparing(PortExposure::component)
            .thenComparing(PortExposure::port);

    public String exposedName() {
        return RoleNamespacer.append(port, component);
    }

    @Override
    public int compareTo(PortExposure o) {
        return ORDER.compare(this, o);
    }
}
