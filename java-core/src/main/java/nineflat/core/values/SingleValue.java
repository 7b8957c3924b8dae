package nineflat.core.values;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record SingleValue(double value) implements PropertyValue {

    @Override
    @JsonIgnore
    public boolean isSingle() {
        return true;
    }
}
