package org.javai.converge;

import org.javai.converge.resource.ResourceLocator;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.*;

class PollOutcomeTest {

    @Test
    void done_isTerminalSingleton() {
        assertThat(PollOutcome.done()).isSameAs(PollOutcome.done());
        assertThat(PollOutcome.done().isTerminal()).isTrue();
    }

    @Test
    void retry_isNeverTerminal() {
        PollOutcome outcome = PollOutcome.retry(ErrorKind.CONDITION_MISMATCH, "not yet");

        assertThat(outcome.isTerminal()).isFalse();
        assertThat(outcome).isInstanceOfSatisfying(PollOutcome.Retryable.class, r -> assertThat(r.cause()).isNull());
    }

    @Test
    void retry_withNonRetryableKind_isRejected() {
        assertThatThrownBy(() -> PollOutcome.retry(ErrorKind.WRITE_FAILURE, "rejected"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("WRITE_FAILURE");
        assertThatThrownBy(() -> PollOutcome.retry(ErrorKind.DEADLINE_EXCEEDED, "late"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fatal_isTerminalAndCarriesTheError() {
        ConvergenceException error = new ConvergenceException(ErrorKind.WRITE_FAILURE, "rejected");

        PollOutcome outcome = PollOutcome.fatal(error);

        assertThat(outcome.isTerminal()).isTrue();
        assertThat(outcome).isInstanceOfSatisfying(PollOutcome.Fatal.class, f -> assertThat(f.error()).isSameAs(error));
    }

    @Test
    void deadlineExceeded_messageNamesOperationAttemptsAndLastReason() {
        IOException cause = new IOException("timeout");
        PollOutcome.Retryable last = new PollOutcome.Retryable(ErrorKind.READ_FAILURE, "unable to retrieve", cause);
        ResourceLocator locator = ResourceLocator.deployment("garden", "gardener-scheduler");

        DeadlineExceededException error = new DeadlineExceededException(
                ErrorKind.DEADLINE_EXCEEDED, "ScaleAndConverge", 1, last, locator);

        assertThat(error.getMessage())
                .isEqualTo("ScaleAndConverge did not complete before the deadline after 1 attempt: unable to retrieve");
        assertThat(error.getCause()).isSameAs(cause);
        assertThat(error.locator()).contains(locator);
    }

    @Test
    void deadlineExceeded_cancelledWithoutRetryableAttempt() {
        DeadlineExceededException error = new DeadlineExceededException(ErrorKind.CANCELLED, "poll", 0, null, null);

        assertThat(error.getMessage()).isEqualTo("poll was cancelled after 0 attempts");
        assertThat(error.lastReason()).isEmpty();
        assertThat(error.lastRetryableKind()).isEmpty();
        assertThat(error.getCause()).isNull();
    }

    @Test
    void deadlineExceeded_rejectsOtherKinds() {
        assertThatThrownBy(() -> new DeadlineExceededException(ErrorKind.READ_FAILURE, "poll", 1, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void errorKinds_retryability() {
        assertThat(ErrorKind.values())
                .filteredOn(ErrorKind::isRetryable)
                .containsExactly(ErrorKind.READ_FAILURE, ErrorKind.DECODE_FAILURE,
                        ErrorKind.CONDITION_MISMATCH, ErrorKind.REPLICA_MISMATCH);
    }
}
