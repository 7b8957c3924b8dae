package nineflat.core.network;

import nineflat.core.dynamics.DynamicsProperties;

import java.util.List;

/**
 * A homogeneous set of {@code size} cells following {@code cell}. The cell's
 * initial values are the population's initial state.
 */
public record Population(String name, int size, DynamicsProperties cell) implements PopulationReference {

    @Override
    public List<String> populationNames() {
        return List.of(name);
    }
}
