package nineflat.core.dynamics;

import nineflat.core.expressions.Expression;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.UnaryOperator;

/**
 * Common shape of {@link OnEvent} and {@link OnCondition}.
 */
public interface Transition {

    Map<String, Expression> stateAssignments();

    List<String> outputEvents();

    String targetRegime();

    Transition withTargetRegime(String regime);

    /**
     * @param renaming       applied to symbols, assigned variables and ports
     * @param regimeRenaming applied to the target regime
     */
    Transition rename(UnaryOperator<String> renaming, UnaryOperator<String> regimeRenaming);

    Transition substitute(Map<String, Expression> substitutions);

    static Map<String, Expression> ordered(Map<String, Expression> assignments) {
        return assignments == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(assignments));
    }

    static Map<String, Expression> renameAssignments(Map<String, Expression> assignments,
            UnaryOperator<String> renaming) {
        var renamed = new TreeMap<String, Expression>();
        assignments.forEach((k, v) -> renamed.put(renaming.apply(k), v.rename(renaming)));
        return renamed;
    }

    static Map<String, Expression> substituteAssignments(Map<String, Expression> assignments,
            Map<String, Expression> substitutions) {
        var substituted = new TreeMap<String, Expression>();
        assignments.forEach((k, v) -> substituted.put(k, v.substitute(substitutions)));
        return substituted;
    }
}
