package nineflat.core.values;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A value together with its units. Units are carried verbatim, conversion
 * happens upstream.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Quantity(PropertyValue value, String units) {

    public Quantity {
        if (units == null) {
            units = "";
        }
    }

    public static Quantity of(double value, String units) {
        return new Quantity(new SingleValue(value), units);
    }

    public static Quantity zero(String units) {
        return of(0.0, units);
    }

    @JsonIgnore
    public boolean isSingle() {
        return value.isSingle();
    }
}
