package nineflat.common;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;

import nineflat.core.LoweredModel;

import java.util.Optional;

/**
 * Options of a flattening run, readable from JSON.
 */
public class FlatteningConfiguration {

    /**
     * Sub-component name of the cell inside each component array.
     */
    @JsonProperty("cell_name")
    public String cellName = "cell";

    /**
     * Flatten populations concurrently.
     */
    public boolean parallel = false;

    public static Optional<FlatteningConfiguration> fromJsonString(String s) {
        try {
            return Optional.of(LoweredModel.objectMapper.readValue(s, FlatteningConfiguration.class));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return "FlatteningConfiguration{cellName='%s', parallel=%s}".formatted(cellName, parallel);
    }
}
