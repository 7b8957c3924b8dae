package nineflat.core.network;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import nineflat.core.InvalidRoleException;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * The position an endpoint of a port connection occupies inside a projection.
 */
public enum Role {
    PRE("pre"),
    POST("post"),
    RESPONSE("response"),
    PLASTICITY("plasticity"),
    SYNAPSE("synapse");

    /**
     * The cells at either end of a projection.
     */
    public static final Set<Role> CELLS = EnumSet.of(PRE, POST);
    /**
     * The two halves of an unmerged synapse.
     */
    public static final Set<Role> SYNAPTIC = EnumSet.of(RESPONSE, PLASTICITY);

    private final String label;

    Role(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static Role of(String label) {
        return Arrays.stream(values())
                .filter(r -> r.label.equals(label))
                .findAny()
                .orElseThrow(() -> new InvalidRoleException("Unknown role '%s'".formatted(label)));
    }

    @Override
    public String toString() {
        return label;
    }
}
