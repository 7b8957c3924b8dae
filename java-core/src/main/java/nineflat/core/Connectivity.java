package nineflat.core;

import com.fasterxml.jackson.annotation.JsonProperty;

import nineflat.core.network.ConnectivityRule;

/**
 * A connectivity rule bound to the sizes of the sets it connects. An inverted
 * connectivity connects the destination set back to the source set, so the
 * sizes swap and the flag flips; inverting twice gives back the original.
 */
public record Connectivity(
        ConnectivityRule rule,
        @JsonProperty("source_size") int sourceSize,
        @JsonProperty("destination_size") int destinationSize,
        boolean inverted) {

    public static Connectivity of(ConnectivityRule rule, int sourceSize, int destinationSize) {
        return new Connectivity(rule, sourceSize, destinationSize, false);
    }

    public Connectivity inverse() {
        return new Connectivity(rule, destinationSize, sourceSize, !inverted);
    }
}
