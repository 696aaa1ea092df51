package dev.cuadrada.agent.orchestrator;

import dev.cuadrada.domain.enums.Decision;
import dev.cuadrada.domain.enums.Outcome;

import java.util.Collection;

/**
 * Folds a set of reviewer decisions into one submission outcome.
 *
 * <p>Precedence: ERROR &gt; REJECTED &gt; REVISION &gt; ACCEPTED. An empty set is PENDING.
 * The result depends only on which decisions are present, never on their order.
 */
public final class OutcomeAggregator {

    private OutcomeAggregator() {
    }

    public static Outcome aggregate(Collection<Decision> decisions) {
        if (decisions == null || decisions.isEmpty()) return Outcome.PENDING;
        if (decisions.contains(Decision.ERROR)) return Outcome.ERROR;
        if (decisions.contains(Decision.REJECTED)) return Outcome.REJECTED;
        if (decisions.contains(Decision.REVISION)) return Outcome.REVISION;
        return Outcome.ACCEPTED;
    }

    public static boolean allAccepted(Outcome outcome) {
        return outcome == Outcome.ACCEPTED;
    }
}
