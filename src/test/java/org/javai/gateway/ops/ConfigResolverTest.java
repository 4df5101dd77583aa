package org.javai.gateway.ops;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

class ConfigResolverTest {

	@Test
	void resolve_prefersSystemPropertyThenEnvironmentThenDefaults() {
		Properties defaults = new Properties();
		defaults.setProperty("gateway.retry.max-retries", "3");
		defaults.setProperty("gateway.target-name", "prediction-service");
		defaults.setProperty("gateway.cache.enabled", "true");
		Map<String, String> sysProps = Map.of("gateway.retry.max-retries", "7");
		Map<String, String> env = Map.of(
			"GATEWAY_RETRY_MAX_RETRIES", "5",
			"GATEWAY_TARGET_NAME", "ml-staging");

		ConfigResolver resolver = new ConfigResolver(defaults, sysProps::get, env::get);

		assertThat(resolver.requireInt("gateway.retry.max-retries")).isEqualTo(7);
		assertThat(resolver.require("gateway.target-name")).isEqualTo("ml-staging");
		assertThat(resolver.requireBoolean("gateway.cache.enabled")).isTrue();
		assertThat(resolver.resolve("gateway.unknown")).isNull();
	}

	@Test
	void resolve_blankValuesFallThrough() {
		Properties defaults = new Properties();
		defaults.setProperty("gateway.target-name", "prediction-service");

		ConfigResolver resolver = new ConfigResolver(defaults,
			key -> "  ", key -> "");

		assertThat(resolver.require("gateway.target-name")).isEqualTo("prediction-service");
	}

	@Test
	void require_missingKey_namesBothSources() {
		ConfigResolver resolver = new ConfigResolver(new Properties(), key -> null, key -> null);

		assertThatThrownBy(() -> resolver.require("gateway.retry.base-delay-ms"))
			.isInstanceOf(IllegalStateException.class)
			.hasMessageContaining("gateway.retry.base-delay-ms")
			.hasMessageContaining("GATEWAY_RETRY_BASE_DELAY_MS");
	}

	@Test
	void requireNumber_rejectsMalformedValues() {
		Properties defaults = new Properties();
		defaults.setProperty("gateway.batch.concurrency", "five");
		defaults.setProperty("gateway.cache.enabled", "yes");
		ConfigResolver resolver = new ConfigResolver(defaults, key -> null, key -> null);

		assertThatThrownBy(() -> resolver.requireInt("gateway.batch.concurrency"))
			.isInstanceOf(IllegalStateException.class)
			.hasMessageContaining("not a number");
		assertThatThrownBy(() -> resolver.requireBoolean("gateway.cache.enabled"))
			.isInstanceOf(IllegalStateException.class)
			.hasMessageContaining("true or false");
	}

	@Test
	void envVarFor_upperCasesAndReplacesSeparators() {
		assertThat(ConfigResolver.envVarFor("gateway.breaker.open-duration-ms"))
			.isEqualTo("GATEWAY_BREAKER_OPEN_DURATION_MS");
	}
}
