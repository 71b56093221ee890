package org.javai.converge.config;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Resolves settings from system properties with environment variable fallbacks.
 */
final class ConfigResolver {

	private final Function<String, String> systemProperties;
	private final Function<String, String> environment;

	ConfigResolver(Function<String, String> systemProperties, Function<String, String> environment) {
		this.systemProperties = Objects.requireNonNull(systemProperties, "systemProperties must not be null");
		this.environment = Objects.requireNonNull(environment, "environment must not be null");
	}

	static ConfigResolver system() {
		return new ConfigResolver(System::getProperty, System::getenv);
	}

	/**
	 * Resolves a value from system property or environment variable.
	 *
	 * @return the value, or empty if neither is set
	 */
	Optional<String> resolve(String sysProp, String envVar) {
		String value = systemProperties.apply(sysProp);
		if (value == null || value.isBlank()) {
			value = environment.apply(envVar);
		}
		if (value == null || value.isBlank()) {
			return Optional.empty();
		}
		return Optional.of(value.trim());
	}

	/**
	 * Resolves a positive duration, given as ISO-8601 ({@code PT2S}) or as plain milliseconds.
	 *
	 * @throws IllegalStateException if the value is set but malformed or not positive
	 */
	Duration resolveDuration(String sysProp, String envVar, Duration defaultValue) {
		Optional<String> raw = resolve(sysProp, envVar);
		if (raw.isEmpty()) {
			return defaultValue;
		}
		Duration parsed = parseDuration(sysProp, raw.get());
		if (parsed.isZero() || parsed.isNegative()) {
			throw new IllegalStateException(
				"Invalid configuration '" + sysProp + "': duration must be positive, was " + raw.get());
		}
		return parsed;
	}

	private static Duration parseDuration(String key, String value) {
		try {
			if (value.chars().allMatch(Character::isDigit)) {
				return Duration.ofMillis(Long.parseLong(value));
			}
			return Duration.parse(value);
		} catch (DateTimeParseException | NumberFormatException e) {
			throw new IllegalStateException(
				"Invalid configuration '" + key + "': expected ISO-8601 duration or milliseconds, was " + value, e);
		}
	}
}
