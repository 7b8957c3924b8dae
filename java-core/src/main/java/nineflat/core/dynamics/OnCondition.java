package nineflat.core.dynamics;

import com.fasterxml.jackson.annotation.JsonProperty;

import nineflat.core.expressions.Expression;

import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * A transition fired when {@code trigger} becomes true.
 */
public record OnCondition(
        Expression trigger,
        @JsonProperty("state_assignments") Map<String, Expression> stateAssignments,
        @JsonProperty("output_events") List<String> outputEvents,
        @JsonProperty("target_regime") String targetRegime) implements Transition {

    public OnCondition {
        stateAssignments = Transition.ordered(stateAssignments);
        outputEvents = outputEvents == null ? List.of() : List.copyOf(outputEvents);
    }

    @Override
    public OnCondition withTargetRegime(String regime) {
        return new OnCondition(trigger, stateAssignments, outputEvents, regime);
    }

    @Override
    public OnCondition rename(UnaryOperator<String> renaming, UnaryOperator<String> regimeRenaming) {
        return new OnCondition(
                trigger.rename(renaming),
                Transition.renameAssignments(stateAssignments, renaming),
                outputEvents.stream().map(renaming).toList(),
                targetRegime == null ? null : regimeRenaming.apply(targetRegime));
    }

    @Override
    public OnCondition substitute(Map<String, Expression> substitutions) {
        return new OnCondition(trigger.substitute(substitutions),
                Transition.substituteAssignments(stateAssignments, substitutions), outputEvents, targetRegime);
    }
}
