package org.javai.converge.ops;

import org.javai.converge.ErrorKind;
import org.javai.converge.PollOutcome;
import org.javai.converge.poll.PollAttempt;
import org.javai.converge.resource.Condition;
import org.javai.converge.resource.ResourceLocator;
import org.javai.converge.scale.ScaleState;
import org.javai.converge.testing.RecordingPollReporter;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CompositePollReporterTest {

	private static final ResourceLocator SCHEDULER = ResourceLocator.deployment("garden", "gardener-scheduler");

	@Test
	void reportRetry_fansOutToEveryReporter() {
		RecordingPollReporter first = new RecordingPollReporter();
		RecordingPollReporter second = new RecordingPollReporter();

		PollReporter.composite(first, second).reportRetry(attempt());

		assertThat(first.retries).hasSize(1);
		assertThat(second.retries).hasSize(1);
	}

	@Test
	void failingReporter_doesNotStopTheOthers() {
		PollReporter broken = new PollReporter() {
			@Override
			public void reportRetry(PollAttempt attempt) {
				throw new IllegalStateException("sink unavailable");
			}

			@Override
			public void reportScaleTransition(ResourceLocator target, ScaleState from, ScaleState to) {
				throw new IllegalStateException("sink unavailable");
			}
		};
		RecordingPollReporter recording = new RecordingPollReporter();
		PollReporter composite = CompositePollReporter.of(broken, recording);

		composite.reportRetry(attempt());
		composite.reportScaleTransition(SCHEDULER, ScaleState.IDLE, ScaleState.READ);

		assertThat(recording.retries).hasSize(1);
		assertThat(recording.transitions).hasSize(1);
	}

	@Test
	void defaultMethods_reachReportersThatOverrideThem() {
		RecordingPollReporter recording = new RecordingPollReporter();
		PollReporter composite = CompositePollReporter.of(List.of(PollReporter.noOp(), recording));

		composite.reportDone("WaitForCondition", SCHEDULER, 2, Duration.ofSeconds(2));
		composite.reportConditionObserved(SCHEDULER, Condition.of("Available", "True", ""));

		assertThat(recording.done).hasSize(1);
		assertThat(recording.observed).hasSize(1);
	}

	@Test
	void size_countsReporters() {
		assertThat(CompositePollReporter.of(PollReporter.noOp(), PollReporter.noOp()).size()).isEqualTo(2);
		assertThat(CompositePollReporter.of(List.of()).size()).isZero();
	}

	private static PollAttempt attempt() {
		return new PollAttempt("ScaleAndConverge", SCHEDULER, 1,
				new PollOutcome.Retryable(ErrorKind.REPLICA_MISMATCH, "still 2", null), Duration.ZERO);
	}
}
