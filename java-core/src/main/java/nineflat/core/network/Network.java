package nineflat.core.network;

import nineflat.core.NetworkModel;
import nineflat.core.StructuralException;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * The hierarchical description that gets lowered: populations, selections
 * over them, and projections between either.
 */
public record Network(
        String name,
        List<Population> populations,
        List<Selection> selections,
        List<Projection> projections) implements NetworkModel {

    public Network {
        populations = populations == null ? List.of() : List.copyOf(populations);
        selections = selections == null ? List.of() : List.copyOf(selections);
        projections = projections == null ? List.of() : List.copyOf(projections);
    }

    public Optional<Population> population(String populationName) {
        return populations.stream().filter(p -> p.name().equals(populationName)).findAny();
    }

    public Optional<Projection> projection(String projectionName) {
        return projections.stream().filter(p -> p.name().equals(projectionName)).findAny();
    }

    /**
     * Resolves a population or selection name.
     */
    public PopulationReference reference(String referenceName) {
        return Stream.concat(populations.stream(), selections.stream())
                .filter(r -> r.name().equals(referenceName))
                .findAny()
                .orElseThrow(() -> new StructuralException(
                        "Network '%s' has no population or selection named '%s'".formatted(name, referenceName)));
    }

    /**
     * @return the total number of cells a reference denotes
     */
    public int sizeOf(String referenceName) {
        return reference(referenceName).populationNames().stream()
                .map(n -> population(n).orElseThrow(() -> new StructuralException(
                        "Selection '%s' refers to unknown population '%s'".formatted(referenceName, n))))
                .mapToInt(Population::size)
                .sum();
    }

    public boolean targets(Projection projection, Population population) {
        return reference(projection.post()).populationNames().contains(population.name());
    }

    public boolean sources(Projection projection, Population population) {
        return reference(projection.pre()).populationNames().contains(population.name());
    }

    @Override
    public Set<String> elements() {
        var elements = new TreeSet<String>();
        populations.forEach(p -> elements.add(p.name()));
        selections.forEach(s -> elements.add(s.name()));
        projections.forEach(p -> elements.add(p.name()));
        return elements;
    }

    @Override
    public String format() {
        return "json";
    }
}
