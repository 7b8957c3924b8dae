package nineflat.core.dynamics;

import com.fasterxml.jackson.annotation.JsonProperty;

import nineflat.core.expressions.Expression;

import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * A transition fired when an event arrives on {@code srcPort}.
 *
 * @param targetRegime the regime to switch to, or null to stay.
 */
public record OnEvent(
        @JsonProperty("src_port") String srcPort,
        @JsonProperty("state_assignments") Map<String, Expression> stateAssignments,
        @JsonProperty("output_events") List<String> outputEvents,
        @JsonProperty("target_regime") String targetRegime) implements Transition {

    public OnEvent {
        stateAssignments = Transition.ordered(stateAssignments);
        outputEvents = outputEvents == null ? List.of() : List.copyOf(outputEvents);
    }

    public OnEvent(String srcPort, Map<String, Expression> stateAssignments) {
        this(srcPort, stateAssignments, List.of(), null);
    }

    public OnEvent withSrcPort(String port) {
        return new OnEvent(port, stateAssignments, outputEvents, targetRegime);
    }

    @Override
    public OnEvent withTargetRegime(String regime) {
        return new OnEvent(srcPort, stateAssignments, outputEvents, regime);
    }

    @Override
    public OnEvent rename(UnaryOperator<String> renaming, UnaryOperator<String> regimeRenaming) {
        return new OnEvent(
                renaming.apply(srcPort),
                Transition.renameAssignments(stateAssignments, renaming),
                outputEvents.stream().map(renaming).toList(),
                targetRegime == null ? null : regimeRenaming.apply(targetRegime));
    }

    @Override
    public OnEvent substitute(Map<String, Expression> substitutions) {
        return new OnEvent(srcPort, Transition.substituteAssignments(stateAssignments, substitutions),
                outputEvents, targetRegime);
    }
}
