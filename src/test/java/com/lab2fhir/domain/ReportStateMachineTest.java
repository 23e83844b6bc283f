package com.lab2fhir.domain;

import com.lab2fhir.service.StateTransitionException;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.lab2fhir.domain.ReportStatus.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReportStateMachineTest {

    private static final Map<ReportStatus, Set<ReportStatus>> EXPECTED = new EnumMap<>(ReportStatus.class);

    static {
        EXPECTED.put(UPLOADED, EnumSet.of(PARSING, FAILED, DUPLICATE));
        EXPECTED.put(PARSING, EnumSet.of(REVIEW_PENDING, FAILED));
        EXPECTED.put(REVIEW_PENDING, EnumSet.of(EDITING, GENERATING_BUNDLE, FAILED));
        EXPECTED.put(EDITING, EnumSet.of(REVIEW_PENDING, GENERATING_BUNDLE, FAILED));
        EXPECTED.put(GENERATING_BUNDLE, EnumSet.of(COMPLETED, FAILED));
        EXPECTED.put(REGENERATING_BUNDLE, EnumSet.of(COMPLETED, FAILED));
        EXPECTED.put(COMPLETED, EnumSet.of(REGENERATING_BUNDLE, EDITING));
        EXPECTED.put(FAILED, EnumSet.of(PARSING, GENERATING_BUNDLE));
        EXPECTED.put(DUPLICATE, EnumSet.noneOf(ReportStatus.class));
    }

    @Test
    void allowsExactlyTheListedPairs() {
        for (ReportStatus from : ReportStatus.values()) {
            for (ReportStatus to : ReportStatus.values()) {
                assertThat(ReportStateMachine.canTransition(from, to))
                        .as("%s -> %s", from, to)
                        .isEqualTo(EXPECTED.get(from).contains(to));
            }
            assertThat(ReportStateMachine.allowedTransitions(from)).isEqualTo(EXPECTED.get(from));
        }
    }

    @Test
    void onlyDuplicateIsTerminal() {
        for (ReportStatus status : ReportStatus.values()) {
            assertThat(ReportStateMachine.isTerminal(status)).isEqualTo(status == DUPLICATE);
        }
    }

    @Test
    void rejectedTransitionNamesBothStates() {
        assertThatThrownBy(() -> ReportStateMachine.validateTransition(PARSING, COMPLETED))
                .isInstanceOf(StateTransitionException.class)
                .hasMessageContaining("parsing")
                .hasMessageContaining("completed")
                .satisfies(e -> {
                    StateTransitionException ste = (StateTransitionException) e;
                    assertThat(ste.getFrom()).isEqualTo(PARSING);
                    assertThat(ste.getTo()).isEqualTo(COMPLETED);
                    assertThat(ste.getDetails()).containsEntry("from_status", "parsing")
                            .containsEntry("to_status", "completed");
                });
    }

    @Test
    void validTransitionDoesNothing() {
        ReportStateMachine.validateTransition(FAILED, GENERATING_BUNDLE);
        ReportStateMachine.validateTransition(COMPLETED, REGENERATING_BUNDLE);
    }

    @Test
    void nullStatesNeverTransition() {
        assertThat(ReportStateMachine.canTransition(null, PARSING)).isFalse();
        assertThat(ReportStateMachine.canTransition(UPLOADED, null)).isFalse();
    }

    @Test
    void statusMetadataGroupsStates() {
        assertThat(ReportStateMachine.isProcessing(PARSING)).isTrue();
        assertThat(ReportStateMachine.isProcessing(REGENERATING_BUNDLE)).isTrue();
        assertThat(ReportStateMachine.isProcessing(REVIEW_PENDING)).isFalse();
        assertThat(ReportStateMachine.isUserActionable(FAILED)).isTrue();
        assertThat(ReportStateMachine.isUserActionable(COMPLETED)).isFalse();
        assertThat(ReportStateMachine.isSuccess(COMPLETED)).isTrue();
        assertThat(ReportStateMachine.isError(FAILED)).isTrue();
    }
}
