package nineflat.core.values;

import java.util.Map;
import java.util.TreeMap;

/**
 * A value drawn per instance from a named distribution. Sampling belongs to the
 * backend, this only carries the description.
 */
public record RandomDistributionValue(String distribution, Map<String, Double> parameters) implements PropertyValue {

    public RandomDistributionValue {
        parameters = parameters == null ? Map.of() : new TreeMap<>(parameters);
    }
}
