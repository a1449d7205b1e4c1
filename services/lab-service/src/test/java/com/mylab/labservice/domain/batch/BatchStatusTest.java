package com.mylab.labservice.domain.batch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.mylab.labservice.domain.common.InvalidDataException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

@DisplayName("BatchStatus")
class BatchStatusTest {

    @Nested
    @DisplayName("transitions")
    class Transitions {

        @Test
        @DisplayName("moves forward in the fixed order, skipping steps allowed")
        void movesForward() {
            assertThat(BatchStatus.CREATED.canTransitionTo(BatchStatus.IN_PROGRESS)).isTrue();
            assertThat(BatchStatus.CREATED.canTransitionTo(BatchStatus.READY)).isTrue();
            assertThat(BatchStatus.READY.canTransitionTo(BatchStatus.SENT)).isTrue();
            assertThat(BatchStatus.SENT.canTransitionTo(BatchStatus.COMPLETED)).isTrue();
        }

        @Test
        @DisplayName("never moves backward")
        void neverMovesBackward() {
            assertThat(BatchStatus.SENT.canTransitionTo(BatchStatus.READY)).isFalse();
            assertThat(BatchStatus.IN_PROGRESS.canTransitionTo(BatchStatus.CREATED)).isFalse();
        }

        @Test
        @DisplayName("rejects a transition to the same state")
        void rejectsSelfTransition() {
            assertThat(BatchStatus.READY.canTransitionTo(BatchStatus.READY)).isFalse();
        }

        @ParameterizedTest
        @EnumSource(value = BatchStatus.class, names = {"CREATED", "IN_PROGRESS", "READY", "SENT"})
        @DisplayName("fails from any non-terminal state")
        void failsFromNonTerminal(BatchStatus status) {
            assertThat(status.canTransitionTo(BatchStatus.FAILED)).isTrue();
        }

        @ParameterizedTest
        @EnumSource(value = BatchStatus.class, names = {"COMPLETED", "FAILED"})
        @DisplayName("nothing leaves a terminal state")
        void terminalStatesAreFinal(BatchStatus status) {
            for (BatchStatus target : BatchStatus.values()) {
                assertThat(status.canTransitionTo(target)).isFalse();
            }
        }
    }

    @Test
    @DisplayName("accepts analyses until sent and samples until ready")
    void acceptanceWindows() {
        assertThat(BatchStatus.READY.acceptsAnalyses()).isTrue();
        assertThat(BatchStatus.SENT.acceptsAnalyses()).isFalse();
        assertThat(BatchStatus.IN_PROGRESS.acceptsSamples()).isTrue();
        assertThat(BatchStatus.READY.acceptsSamples()).isFalse();
    }

    @Test
    @DisplayName("parses wire values case-insensitively and rejects unknown ones")
    void parsesWireValues() {
        assertThat(BatchStatus.fromValue("IN_PROGRESS")).isEqualTo(BatchStatus.IN_PROGRESS);
        assertThat(BatchStatus.fromValue("sent")).isEqualTo(BatchStatus.SENT);
        assertThatThrownBy(() -> BatchStatus.fromValue("shipped"))
                .isInstanceOf(InvalidDataException.class)
                .hasMessageContaining("shipped")
                .hasMessageContaining("in_progress");
    }
}
