package com.driftsentinel.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExecutionStatusTest {

    @Test
    @DisplayName("Allowed transitions follow the check lifecycle")
    void transitions() {
        assertThat(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.RUNNING)).isTrue();
        assertThat(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.SKIPPED)).isTrue();
        assertThat(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.COMPLETED)).isFalse();
        assertThat(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.COMPLETED)).isTrue();
        assertThat(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.FAILED)).isTrue();
        assertThat(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.SKIPPED)).isFalse();
    }

    @Test
    @DisplayName("Terminal states have no outgoing transitions")
    void terminalStates() {
        for (ExecutionStatus from : ExecutionStatus.values()) {
            if (!from.isTerminal()) {
                continue;
            }
            for (ExecutionStatus to : ExecutionStatus.values()) {
                assertThat(from.canTransitionTo(to)).as("%s -> %s", from, to).isFalse();
            }
        }
        assertThat(ExecutionStatus.PENDING.isTerminal()).isFalse();
        assertThat(ExecutionStatus.RUNNING.isTerminal()).isFalse();
    }

    @Test
    @DisplayName("Results can only be built in a terminal state")
    void resultsAreTerminal() {
        assertThatThrownBy(() -> DriftCheckResult.builder()
                .modelId("m")
                .timestamp(Instant.EPOCH)
                .status(ExecutionStatus.RUNNING)
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("terminal");
    }
}
