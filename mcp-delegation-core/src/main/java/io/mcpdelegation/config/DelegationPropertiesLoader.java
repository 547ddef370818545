/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.nimbusds.jose.JWSAlgorithm;

import io.mcpdelegation.exchange.ExchangeGrant;
import io.mcpdelegation.gate.DelegationMode;
import io.mcpdelegation.policy.ValidationMode;
import io.mcpdelegation.util.Utils;

/**
 * Loads {@link DelegationProperties} from a classpath properties file overlaid with
 * environment variables.
 * <p>
 * Keys in the file use the {@code delegation.} prefix and kebab-case names, e.g.
 * {@code delegation.expected-audience}. An environment variable
 * {@code DELEGATION_EXPECTED_AUDIENCE} overrides that key. The variables
 * {@code AZURE_TENANT_ID}, {@code AZURE_CLIENT_ID}, {@code AZURE_CLIENT_SECRET},
 * {@code BASE_URL}, {@code SERVER_HOST} and {@code SERVER_PORT} are recognised as
 * well.
 */
public class DelegationPropertiesLoader {

	private static final Logger logger = LoggerFactory.getLogger(DelegationPropertiesLoader.class);

	public static final String DEFAULT_RESOURCE = "delegation.properties";

	public static final String PREFIX = "delegation.";

	public static final String SERVER_PREFIX = "server.";

	public static final String DEFAULT_SERVER_HOST = "0.0.0.0";

	public static final int DEFAULT_SERVER_PORT = 8000;

	private static final String ENV_PREFIX = "DELEGATION_";

	private static final Map<String, String> ENV_ALIASES = Map.of( // @formatter:off
			"AZURE_TENANT_ID", "delegation.tenant-id",
			"AZURE_CLIENT_ID", "delegation.client-id",
			"AZURE_CLIENT_SECRET", "delegation.client-secret",
			"BASE_URL", "delegation.base-url",
			"SERVER_HOST", "server.host",
			"SERVER_PORT", "server.port"); // @formatter:on

	private final Map<String, String> environment;

	public DelegationPropertiesLoader() {
		this(System.getenv());
	}

	public DelegationPropertiesLoader(Map<String, String> environment) {
		this.environment = environment;
	}

	/**
	 * Load and validate {@value #DEFAULT_RESOURCE}.
	 * @return the properties
	 * @throws IllegalArgumentException if the configuration is incomplete or invalid
	 */
	public DelegationProperties load() {
		return load(DEFAULT_RESOURCE);
	}

	public DelegationProperties load(String resource) {
		return toDelegationProperties(loadRaw(resource));
	}

	/**
	 * Read the classpath resource, if present, and apply the environment overlay.
	 * @param resource the classpath resource name
	 * @return the merged key/value pairs
	 */
	public Properties loadRaw(String resource) {
		Properties properties = new Properties();
		ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
		if (classLoader == null) {
			classLoader = DelegationPropertiesLoader.class.getClassLoader();
		}
		try (InputStream in = classLoader.getResourceAsStream(resource)) {
			if (in != null) {
				properties.load(in);
				logger.debug("Loaded delegation configuration from classpath:{}", resource);
			}
			else {
				logger.info("No classpath:{} found, using environment configuration only", resource);
			}
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read classpath:" + resource, e);
		}

		ENV_ALIASES.forEach((variable, key) -> {
			String value = environment.get(variable);
			if (Utils.hasText(value)) {
				properties.setProperty(key, value);
			}
		});
		environment.forEach((variable, value) -> {
			if (variable.startsWith(ENV_PREFIX) && Utils.hasText(value)) {
				String key = PREFIX + variable.substring(ENV_PREFIX.length()).toLowerCase(Locale.ROOT).replace('_', '-');
				properties.setProperty(key, value);
			}
		});
		return properties;
	}

	/**
	 * Bind {@code delegation.*} keys onto a {@link DelegationProperties} builder.
	 * @param properties the raw key/value pairs
	 * @return the validated properties
	 */
	public static DelegationProperties toDelegationProperties(Properties properties) {
		DelegationProperties.Builder builder = DelegationProperties.builder();
		PropertyReader reader = new PropertyReader(properties, PREFIX);

		reader.text("tenant-id", builder::tenantId);
		reader.text("client-id", builder::clientId);
		reader.text("client-secret", builder::clientSecret);
		reader.text("base-url", builder::baseUrl);
		reader.text("validation-mode", value -> builder.validationMode(enumValue(ValidationMode.class, value)));
		reader.text("expected-audience", builder::expectedAudience);
		reader.text("issuer", builder::issuer);
		reader.text("required-scopes", value -> builder.requiredScopes(list(value)));
		reader.text("scope-prefix", builder::scopePrefix);
		reader.text("allowed-algorithms", value -> builder.allowedAlgorithms(algorithms(value)));
		reader.text("jwks-uri", builder::jwksUri);
		reader.text("discovery-uri", builder::discoveryUri);
		reader.seconds("key-refresh-interval-seconds", builder::keyRefreshInterval);
		reader.seconds("key-min-refresh-interval-seconds", builder::keyMinRefreshInterval);
		reader.text("mode", value -> builder.mode(enumValue(DelegationMode.class, value)));
		reader.text("exchange-grant", value -> builder.exchangeGrant(enumValue(ExchangeGrant.class, value)));
		reader.text("token-endpoint", builder::tokenEndpoint);
		reader.text("target-scope", builder::targetScope);
		reader.seconds("cache-safety-margin-seconds", builder::cacheSafetyMargin);
		reader.seconds("connect-timeout-seconds", builder::connectTimeout);
		reader.seconds("request-timeout-seconds", builder::requestTimeout);
		reader.text("resource", builder::resource);
		reader.text("authorization-servers", value -> builder.authorizationServers(list(value)));
		reader.text("scopes-supported", value -> builder.scopesSupported(list(value)));
		reader.text("resource-name", builder::resourceName);

		return builder.build();
	}

	/**
	 * Bind the {@code server.host} and {@code server.port} keys.
	 * @param properties the raw key/value pairs
	 * @return the listen address, defaulting to {@value #DEFAULT_SERVER_HOST}:{@value #DEFAULT_SERVER_PORT}
	 * @throws IllegalArgumentException if {@code server.port} is not a valid port number
	 */
	public static ServerAddress toServerAddress(Properties properties) {
		PropertyReader reader = new PropertyReader(properties, SERVER_PREFIX);
		String[] host = { DEFAULT_SERVER_HOST };
		int[] port = { DEFAULT_SERVER_PORT };
		reader.text("host", value -> host[0] = value);
		reader.port("port", value -> port[0] = value);
		return new ServerAddress(host[0], port[0]);
	}

	static List<String> list(String value) {
		List<String> values = new ArrayList<>();
		for (String item : value.split("[,\\s]+")) {
			if (!item.isEmpty()) {
				values.add(item);
			}
		}
		return values;
	}

	private static Set<JWSAlgorithm> algorithms(String value) {
		Set<JWSAlgorithm> algorithms = new LinkedHashSet<>();
		for (String name : list(value)) {
			algorithms.add(JWSAlgorithm.parse(name));
		}
		return algorithms;
	}

	static <E extends Enum<E>> E enumValue(Class<E> type, String value) {
		String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
		try {
			return Enum.valueOf(type, normalized);
		}
		catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Invalid " + type.getSimpleName() + " '" + value + "'", e);
		}
	}

	private static final class PropertyReader {

		private final Properties properties;

		private final String prefix;

		PropertyReader(Properties properties, String prefix) {
			this.properties = properties;
			this.prefix = prefix;
		}

		void text(String name, Consumer<String> target) {
			String value = properties.getProperty(prefix + name);
			if (Utils.hasText(value)) {
				target.accept(value.trim());
			}
		}

		void seconds(String name, Consumer<Duration> target) {
			text(name, value -> {
				try {
					target.accept(Duration.ofSeconds(Long.parseLong(value)));
				}
				catch (NumberFormatException e) {
					throw new IllegalArgumentException("Invalid number of seconds for " + prefix + name + ": " + value,
							e);
				}
			});
		}

		void port(String name, IntConsumer target) {
			text(name, value -> {
				int port;
				try {
					port = Integer.parseInt(value);
				}
				catch (NumberFormatException e) {
					throw new IllegalArgumentException("Invalid port for " + prefix + name + ": " + value, e);
				}
				if (port < 0 || port > 65535) {
					throw new IllegalArgumentException("Invalid port for " + prefix + name + ": " + value);
				}
				target.accept(port);
			});
		}

	}

}
