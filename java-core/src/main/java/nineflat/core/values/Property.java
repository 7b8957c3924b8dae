package nineflat.core.values;

public record Property(String name, Quantity quantity) implements Comparable<Property> {

    @Override
    public int compareTo(Property o) {
        return name.compareTo(o.name);
    }
}
