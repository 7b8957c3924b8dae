package nineflat.core.dynamics;

public record Port(String name, PortMode mode) implements Comparable<Port> {

    public Port rename(String newName) {
        return new Port(newName, mode);
    }

    @Override
    public int compareTo(Port o) {
        return name.compareTo(o.name);
    }
}
