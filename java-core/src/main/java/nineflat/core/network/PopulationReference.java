package nineflat.core.network;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

public interface PopulationReference {

    String name();

    List<String> populationNames();

    @JsonIgnore
    default boolean isSelection() {
        return this instanceof Selection;
    }
}
