package org.javai.converge.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing defaults for condition waits and scale-and-converge calls.
 *
 * <p>Configuration is provided via system properties with environment variable fallbacks:
 * <ul>
 *   <li>{@code converge.poll.interval} / {@code CONVERGE_POLL_INTERVAL} - wait between attempts (default 2s)</li>
 *   <li>{@code converge.condition.timeout} / {@code CONVERGE_CONDITION_TIMEOUT} - bound on a condition wait (default 10m)</li>
 *   <li>{@code converge.setup.timeout} / {@code CONVERGE_SETUP_TIMEOUT} - bound on each scale segment (default 2m)</li>
 * </ul>
 * Values are ISO-8601 durations ({@code PT30S}) or plain milliseconds.
 *
 * @param pollInterval wait between poll attempts
 * @param conditionTimeout bound on a condition wait started without a caller context
 * @param setupTimeout bound on each read, write and verify segment of a scale call
 */
public record ConvergeSettings(Duration pollInterval, Duration conditionTimeout, Duration setupTimeout) {

	public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(2);
	public static final Duration DEFAULT_CONDITION_TIMEOUT = Duration.ofMinutes(10);
	public static final Duration DEFAULT_SETUP_TIMEOUT = Duration.ofMinutes(2);

	public ConvergeSettings {
		requirePositive(pollInterval, "pollInterval");
		requirePositive(conditionTimeout, "conditionTimeout");
		requirePositive(setupTimeout, "setupTimeout");
	}

	public static ConvergeSettings defaults() {
		return new ConvergeSettings(DEFAULT_POLL_INTERVAL, DEFAULT_CONDITION_TIMEOUT, DEFAULT_SETUP_TIMEOUT);
	}

	/**
	 * Resolves settings from system properties and environment variables, falling back to defaults.
	 *
	 * @throws IllegalStateException if a value is set but malformed
	 */
	public static ConvergeSettings resolve() {
		return resolve(ConfigResolver.system());
	}

	static ConvergeSettings resolve(ConfigResolver resolver) {
		return new ConvergeSettings(
			resolver.resolveDuration("converge.poll.interval", "CONVERGE_POLL_INTERVAL", DEFAULT_POLL_INTERVAL),
			resolver.resolveDuration("converge.condition.timeout", "CONVERGE_CONDITION_TIMEOUT", DEFAULT_CONDITION_TIMEOUT),
			resolver.resolveDuration("converge.setup.timeout", "CONVERGE_SETUP_TIMEOUT", DEFAULT_SETUP_TIMEOUT)
		);
	}

	public ConvergeSettings withPollInterval(Duration interval) {
		return new ConvergeSettings(interval, conditionTimeout, setupTimeout);
	}

	private static void requirePositive(Duration value, String name) {
		Objects.requireNonNull(value, name + " must not be null");
		if (value.isZero() || value.isNegative()) {
			throw new IllegalArgumentException(name + " must be positive, was: " + value);
		}
	}
}
