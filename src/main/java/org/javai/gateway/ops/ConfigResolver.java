package org.javai.gateway.ops;

import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Function;

/**
 * Resolves configuration values from system properties, then environment variables, then a set
 * of defaults. The environment variable for {@code gateway.retry.max-retries} is
 * {@code GATEWAY_RETRY_MAX_RETRIES}.
 */
public final class ConfigResolver {

	private final Properties defaults;
	private final Function<String, String> systemProperties;
	private final Function<String, String> environment;

	public ConfigResolver(Properties defaults) {
		this(defaults, System::getProperty, System::getenv);
	}

	/**
	 * Package-private for testing.
	 */
	ConfigResolver(Properties defaults, Function<String, String> systemProperties, Function<String, String> environment) {
		this.defaults = Objects.requireNonNull(defaults, "defaults must not be null");
		this.systemProperties = Objects.requireNonNull(systemProperties, "systemProperties must not be null");
		this.environment = Objects.requireNonNull(environment, "environment must not be null");
	}

	/**
	 * Resolves a key, returning null if no source defines it.
	 */
	public String resolve(String key) {
		String value = systemProperties.apply(key);
		if (value == null || value.isBlank()) {
			value = environment.apply(envVarFor(key));
		}
		if (value == null || value.isBlank()) {
			value = defaults.getProperty(key);
		}
		return value == null || value.isBlank() ? null : value.trim();
	}

	/**
	 * Resolves a key that must be defined somewhere.
	 *
	 * @throws IllegalStateException if neither source defines the key
	 */
	public String require(String key) {
		String value = resolve(key);
		if (value == null) {
			throw new IllegalStateException(
				"Missing required configuration: set system property '" + key +
				"' or environment variable '" + envVarFor(key) + "'"
			);
		}
		return value;
	}

	public int requireInt(String key) {
		return parse(key, Integer::parseInt);
	}

	public long requireLong(String key) {
		return parse(key, Long::parseLong);
	}

	public double requireDouble(String key) {
		return parse(key, Double::parseDouble);
	}

	public boolean requireBoolean(String key) {
		String value = require(key);
		if (!value.equalsIgnoreCase("true") && !value.equalsIgnoreCase("false")) {
			throw new IllegalStateException("Configuration '" + key + "' must be true or false, was: " + value);
		}
		return Boolean.parseBoolean(value);
	}

	private <T> T parse(String key, Function<String, T> parser) {
		String value = require(key);
		try {
			return parser.apply(value);
		} catch (NumberFormatException e) {
			throw new IllegalStateException("Configuration '" + key + "' is not a number: " + value, e);
		}
	}

	static String envVarFor(String key) {
		return key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
	}
}
