package nineflat.core.values;

import java.util.List;

public record ArrayValue(List<Double> values) implements PropertyValue {

    public ArrayValue {
        values = List.copyOf(values);
    }
}
