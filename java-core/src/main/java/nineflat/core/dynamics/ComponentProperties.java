package nineflat.core.dynamics;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import nineflat.core.multi.MultiComponent;
import nineflat.core.values.Quantity;

import java.util.Map;

/**
 * Something that can stand as a sub-component: a single dynamics with its
 * property values, or an aggregate of sub-components.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = DynamicsProperties.class, name = "dynamics"),
        @JsonSubTypes.Type(value = MultiComponent.class, name = "multi")
})
public interface ComponentProperties {

    String name();

    /**
     * @return the (flattened, for aggregates) dynamics this component follows
     */
    Dynamics componentClass();

    Map<String, Quantity> properties();

    Map<String, Quantity> initialValues();
}
