package nineflat.common;

import nineflat.core.StructuralException;
import nineflat.core.dynamics.Dynamics;
import nineflat.core.dynamics.Port;
import nineflat.core.expressions.Expression;

import org.jgrapht.Graph;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.traverse.BreadthFirstIterator;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Which symbols of a dynamics depend on which. Aliases point to the symbols
 * their expression reads; everything else is a leaf.
 */
public class DependencyGraph {

    private final Dynamics dynamics;
    private final Graph<String, DefaultEdge> graph = new DefaultDirectedGraph<>(DefaultEdge.class);
    private final Map<String, Expression> inlined = new HashMap<>();

    public DependencyGraph(Dynamics dynamics) {
        this.dynamics = dynamics;
        dynamics.declaredSymbols().forEach(graph::addVertex);
        dynamics.aliases().forEach((alias, expression) -> {
            for (var s : expression.symbols()) {
                graph.addVertex(s);
                graph.addEdge(alias, s);
            }
        });
        var cycles = new CycleDetector<>(graph);
        if (cycles.detectCycles()) {
            throw new StructuralException("Aliases %s of '%s' depend on themselves"
                    .formatted(new TreeSet<>(cycles.findCycles()), dynamics.name()));
        }
    }

    /**
     * The symbols a set of expressions reads, directly or through aliases.
     */
    public record Requirements(
            Set<String> parameters,
            Set<String> stateVariables,
            Set<String> aliases,
            Set<String> ports) {
    }

    public Requirements requiredFor(Collection<Expression> expressions) {
        var roots = new TreeSet<String>();
        expressions.forEach(e -> roots.addAll(e.symbols()));
        var reached = new TreeSet<String>();
        if (!roots.isEmpty()) {
            roots.forEach(graph::addVertex);
            new BreadthFirstIterator<>(graph, roots).forEachRemaining(reached::add);
        }
        var receivePorts = dynamics.receivePorts().stream().map(Port::name).collect(Collectors.toSet());
        return new Requirements(
                filter(reached, dynamics.parameters()),
                filter(reached, dynamics.stateVariables()),
                filter(reached, dynamics.aliases().keySet()),
                filter(reached, receivePorts));
    }

    private static Set<String> filter(Set<String> reached, Set<String> kind) {
        return reached.stream().filter(kind::contains).collect(Collectors.toCollection(TreeSet::new));
    }

    /**
     * @return {@code expression} with every alias replaced by its definition,
     *         recursively
     */
    public Expression inline(Expression expression) {
        var substitutions = new HashMap<String, Expression>();
        for (var s : expression.symbols()) {
            if (dynamics.aliases().containsKey(s)) {
                substitutions.put(s, inlinedAlias(s));
            }
        }
        return substitutions.isEmpty() ? expression : expression.substitute(substitutions);
    }

    private Expression inlinedAlias(String alias) {
        var known = inlined.get(alias);
        if (known == null) {
            known = inline(dynamics.aliases().get(alias));
            inlined.put(alias, known);
        }
        return known;
    }
}
