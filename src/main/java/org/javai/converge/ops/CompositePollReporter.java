package org.javai.converge.ops;

import org.javai.converge.ConvergenceException;
import org.javai.converge.DeadlineExceededException;
import org.javai.converge.poll.PollAttempt;
import org.javai.converge.resource.Condition;
import org.javai.converge.resource.ResourceLocator;
import org.javai.converge.scale.ScaleState;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

/**
 * A {@link PollReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. If a reporter throws an exception,
 * it is caught and logged to stderr, allowing remaining reporters to execute.
 *
 * <p>Example usage:
 * <pre>{@code
 * PollReporter reporter = CompositePollReporter.of(
 *     new Log4jPollReporter(),
 *     new MetricsPollReporter("provisioning")
 * );
 * }</pre>
 */
public final class CompositePollReporter implements PollReporter {

	private final List<PollReporter> reporters;

	private CompositePollReporter(List<PollReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	/**
	 * Creates a composite reporter from the given reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositePollReporter of(PollReporter... reporters) {
		return new CompositePollReporter(Arrays.asList(reporters));
	}

	/**
	 * Creates a composite reporter from a collection of reporters.
	 */
	public static CompositePollReporter of(Collection<? extends PollReporter> reporters) {
		return new CompositePollReporter(new ArrayList<>(reporters));
	}

	@Override
	public void reportRetry(PollAttempt attempt) {
		fanOut("reportRetry", r -> r.reportRetry(attempt));
	}

	@Override
	public void reportDone(String operation, ResourceLocator subject, int attempts, Duration elapsed) {
		fanOut("reportDone", r -> r.reportDone(operation, subject, attempts, elapsed));
	}

	@Override
	public void reportFatal(String operation, ResourceLocator subject, int attempt, ConvergenceException error) {
		fanOut("reportFatal", r -> r.reportFatal(operation, subject, attempt, error));
	}

	@Override
	public void reportDeadlineExceeded(String operation, DeadlineExceededException error, Duration elapsed) {
		fanOut("reportDeadlineExceeded", r -> r.reportDeadlineExceeded(operation, error, elapsed));
	}

	@Override
	public void reportConditionObserved(ResourceLocator locator, Condition condition) {
		fanOut("reportConditionObserved", r -> r.reportConditionObserved(locator, condition));
	}

	@Override
	public void reportScaleTransition(ResourceLocator target, ScaleState from, ScaleState to) {
		fanOut("reportScaleTransition", r -> r.reportScaleTransition(target, from, to));
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	private void fanOut(String method, Consumer<PollReporter> call) {
		for (PollReporter reporter : reporters) {
			try {
				call.accept(reporter);
			} catch (Exception e) {
				logReporterError(method, reporter, e);
			}
		}
	}

	private static void logReporterError(String method, PollReporter reporter, Exception e) {
		System.err.println("PollReporter." + method + " failed for " +
			reporter.getClass().getName() + ": " + e.getMessage());
	}
}
