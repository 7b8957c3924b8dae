package nineflat.core.network;

import java.util.List;

/**
 * A named union of populations, usable wherever a projection expects a
 * population.
 */
public record Selection(String name, List<String> populations) implements PopulationReference {

    public Selection {
        populations = List.copyOf(populations);
    }

    @Override
    public List<String> populationNames() {
        return populations;
    }
}
