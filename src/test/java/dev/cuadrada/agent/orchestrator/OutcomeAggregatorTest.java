package dev.cuadrada.agent.orchestrator;

import dev.cuadrada.domain.enums.Decision;
import dev.cuadrada.domain.enums.Outcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static dev.cuadrada.domain.enums.Decision.ACCEPTED;
import static dev.cuadrada.domain.enums.Decision.ERROR;
import static dev.cuadrada.domain.enums.Decision.REJECTED;
import static dev.cuadrada.domain.enums.Decision.REVISION;
import static org.assertj.core.api.Assertions.assertThat;

class OutcomeAggregatorTest {

    @Nested
    @DisplayName("precedence")
    class Precedence {

        @Test
        @DisplayName("no decisions is PENDING")
        void emptyIsPending() {
            assertThat(OutcomeAggregator.aggregate(List.of())).isEqualTo(Outcome.PENDING);
            assertThat(OutcomeAggregator.aggregate(null)).isEqualTo(Outcome.PENDING);
        }

        @Test
        @DisplayName("all accepted is ACCEPTED")
        void allAccepted() {
            assertThat(OutcomeAggregator.aggregate(List.of(ACCEPTED, ACCEPTED, ACCEPTED)))
                    .isEqualTo(Outcome.ACCEPTED);
        }

        @Test
        @DisplayName("one REVISION among acceptances is REVISION")
        void revisionBeatsAccepted() {
            assertThat(OutcomeAggregator.aggregate(List.of(ACCEPTED, REVISION, ACCEPTED)))
                    .isEqualTo(Outcome.REVISION);
        }

        @Test
        @DisplayName("REJECTED beats REVISION and ACCEPTED")
        void rejectedBeatsRevision() {
            assertThat(OutcomeAggregator.aggregate(List.of(REJECTED, ACCEPTED, REVISION)))
                    .isEqualTo(Outcome.REJECTED);
        }

        @Test
        @DisplayName("ERROR beats everything")
        void errorBeatsAll() {
            assertThat(OutcomeAggregator.aggregate(List.of(ACCEPTED, ERROR, REJECTED)))
                    .isEqualTo(Outcome.ERROR);
        }

        @ParameterizedTest
        @EnumSource(Decision.class)
        @DisplayName("a single decision maps to the outcome of the same name")
        void singleDecision(Decision decision) {
            assertThat(OutcomeAggregator.aggregate(List.of(decision)).name()).isEqualTo(decision.name());
        }
    }

    @Test
    @DisplayName("result does not depend on decision order")
    void permutationInvariant() {
        Random random = new Random(42);
        Decision[] values = Decision.values();
        for (int round = 0; round < 200; round++) {
            List<Decision> decisions = new ArrayList<>();
            int size = 1 + random.nextInt(6);
            for (int i = 0; i < size; i++) decisions.add(values[random.nextInt(values.length)]);
            Outcome expected = OutcomeAggregator.aggregate(decisions);
            for (int shuffle = 0; shuffle < 5; shuffle++) {
                Collections.shuffle(decisions, random);
                assertThat(OutcomeAggregator.aggregate(decisions)).isEqualTo(expected);
            }
        }
    }

    @Test
    @DisplayName("all_accepted holds only for ACCEPTED")
    void allAcceptedOnlyForAccepted() {
        assertThat(OutcomeAggregator.allAccepted(Outcome.ACCEPTED)).isTrue();
        assertThat(OutcomeAggregator.allAccepted(Outcome.REVISION)).isFalse();
        assertThat(OutcomeAggregator.allAccepted(Outcome.PENDING)).isFalse();
        assertThat(OutcomeAggregator.allAccepted(Outcome.ERROR)).isFalse();
    }
}
