package nineflat.core.values;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * The value given to a parameter, initial state or delay. Only
 * {@link SingleValue} is the same for every instance; the other variants are
 * resolved per instance by the backend.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = SingleValue.class, name = "single"),
        @JsonSubTypes.Type(value = ArrayValue.class, name = "array"),
        @JsonSubTypes.Type(value = RandomDistributionValue.class, name = "random")
})
public sealed interface PropertyValue permits SingleValue, ArrayValue, RandomDistributionValue {

    @JsonIgnore
    default boolean isSingle() {
        return false;
    }
}
