/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.config;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.nimbusds.jose.JWSAlgorithm;

import io.mcpdelegation.exchange.ExchangeGrant;
import io.mcpdelegation.gate.DelegationMode;
import io.mcpdelegation.policy.ValidationMode;
import io.mcpdelegation.util.Assert;
import io.mcpdelegation.util.Utils;
import reactor.util.annotation.Nullable;

/**
 * Immutable deployment configuration of the delegation engine.
 * <p>
 * String values may contain the placeholders {@code {tenant}}, {@code {client_id}} and
 * {@code {base_url}}; they are expanded when the properties are built, so that for
 * example the issuer can be configured as
 * {@code https://login.microsoftonline.com/{tenant}/v2.0}.
 */
public final class DelegationProperties {

	private final String tenantId;

	private final String clientId;

	private final String clientSecret;

	private final String baseUrl;

	private final ValidationMode validationMode;

	private final String expectedAudience;

	private final String issuer;

	private final Set<String> requiredScopes;

	private final String scopePrefix;

	private final Set<JWSAlgorithm> allowedAlgorithms;

	private final URI jwksUri;

	private final URI discoveryUri;

	private final Duration keyRefreshInterval;

	private final Duration keyMinRefreshInterval;

	private final DelegationMode mode;

	private final ExchangeGrant exchangeGrant;

	private final URI tokenEndpoint;

	private final String targetScope;

	private final Duration cacheSafetyMargin;

	private final Duration connectTimeout;

	private final Duration requestTimeout;

	private final String resource;

	private final List<String> authorizationServers;

	private final List<String> scopesSupported;

	private final String resourceName;

	private DelegationProperties(Builder builder, Map<String, String> placeholders) {
		this.tenantId = builder.tenantId;
		this.clientId = builder.clientId;
		this.clientSecret = builder.clientSecret;
		this.baseUrl = builder.baseUrl;
		this.validationMode = builder.validationMode;
		this.expectedAudience = Utils.expand(builder.expectedAudience, placeholders);
		this.issuer = Utils.expand(builder.issuer, placeholders);
		this.requiredScopes = Set.copyOf(expandAll(builder.requiredScopes, placeholders));
		this.scopePrefix = Utils.expand(builder.scopePrefix, placeholders);
		this.allowedAlgorithms = Set.copyOf(builder.allowedAlgorithms);
		this.jwksUri = toUri(Utils.expand(builder.jwksUri, placeholders));
		this.discoveryUri = toUri(Utils.expand(builder.discoveryUri, placeholders));
		this.keyRefreshInterval = builder.keyRefreshInterval;
		this.keyMinRefreshInterval = builder.keyMinRefreshInterval;
		this.mode = builder.mode;
		this.exchangeGrant = builder.exchangeGrant;
		this.tokenEndpoint = toUri(Utils.expand(builder.tokenEndpoint, placeholders));
		this.targetScope = Utils.expand(builder.targetScope, placeholders);
		this.cacheSafetyMargin = builder.cacheSafetyMargin;
		this.connectTimeout = builder.connectTimeout;
		this.requestTimeout = builder.requestTimeout;
		this.resource = Utils.expand(builder.resource, placeholders);
		this.authorizationServers = List.copyOf(expandAll(builder.authorizationServers, placeholders));
		List<String> supported = Utils.isEmpty(builder.scopesSupported) ? new ArrayList<>(builder.requiredScopes)
				: builder.scopesSupported;
		this.scopesSupported = List.copyOf(expandAll(supported, placeholders));
		this.resourceName = builder.resourceName;
	}

	@Nullable
	public String getTenantId() {
		return tenantId;
	}

	@Nullable
	public String getClientId() {
		return clientId;
	}

	@Nullable
	public String getClientSecret() {
		return clientSecret;
	}

	public String getBaseUrl() {
		return baseUrl;
	}

	public ValidationMode getValidationMode() {
		return validationMode;
	}

	public String getExpectedAudience() {
		return expectedAudience;
	}

	public String getIssuer() {
		return issuer;
	}

	public Set<String> getRequiredScopes() {
		return requiredScopes;
	}

	@Nullable
	public String getScopePrefix() {
		return scopePrefix;
	}

	public Set<JWSAlgorithm> getAllowedAlgorithms() {
		return allowedAlgorithms;
	}

	@Nullable
	public URI getJwksUri() {
		return jwksUri;
	}

	@Nullable
	public URI getDiscoveryUri() {
		return discoveryUri;
	}

	public Duration getKeyRefreshInterval() {
		return keyRefreshInterval;
	}

	public Duration getKeyMinRefreshInterval() {
		return keyMinRefreshInterval;
	}

	public DelegationMode getMode() {
		return mode;
	}

	public ExchangeGrant getExchangeGrant() {
		return exchangeGrant;
	}

	@Nullable
	public URI getTokenEndpoint() {
		return tokenEndpoint;
	}

	@Nullable
	public String getTargetScope() {
		return targetScope;
	}

	public Duration getCacheSafetyMargin() {
		return cacheSafetyMargin;
	}

	public Duration getConnectTimeout() {
		return connectTimeout;
	}

	public Duration getRequestTimeout() {
		return requestTimeout;
	}

	public String getResource() {
		return resource;
	}

	public List<String> getAuthorizationServers() {
		return authorizationServers;
	}

	public List<String> getScopesSupported() {
		return scopesSupported;
	}

	@Nullable
	public String getResourceName() {
		return resourceName;
	}

	@Override
	public String toString() {
		return "DelegationProperties[validationMode=" + validationMode + ", mode=" + mode + ", expectedAudience="
				+ expectedAudience + ", issuer=" + issuer + ", requiredScopes=" + requiredScopes + ", resource="
				+ resource + ", clientSecret=" + (clientSecret != null ? "****" : null) + "]";
	}

	private static List<String> expandAll(List<String> values, Map<String, String> placeholders) {
		List<String> expanded = new ArrayList<>(values.size());
		for (String value : values) {
			expanded.add(Utils.expand(value, placeholders));
		}
		return expanded;
	}

	@Nullable
	private static URI toUri(@Nullable String value) {
		if (!Utils.hasText(value)) {
			return null;
		}
		try {
			return URI.create(value.trim());
		}
		catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Invalid URI in delegation configuration: " + value, e);
		}
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {

		private String tenantId;

		private String clientId;

		private String clientSecret;

		private String baseUrl = "http://localhost:8000";

		private ValidationMode validationMode = ValidationMode.SIGNATURE_VERIFIED;

		private String expectedAudience;

		private String issuer;

		private List<String> requiredScopes = new ArrayList<>();

		private String scopePrefix;

		private Set<JWSAlgorithm> allowedAlgorithms = Set.of(JWSAlgorithm.RS256);

		private String jwksUri;

		private String discoveryUri;

		private Duration keyRefreshInterval = Duration.ofHours(1);

		private Duration keyMinRefreshInterval = Duration.ofMinutes(5);

		private DelegationMode mode = DelegationMode.PASS_THROUGH;

		private ExchangeGrant exchangeGrant = ExchangeGrant.JWT_BEARER;

		private String tokenEndpoint;

		private String targetScope;

		private Duration cacheSafetyMargin = Duration.ofMinutes(5);

		private Duration connectTimeout = Duration.ofSeconds(10);

		private Duration requestTimeout = Duration.ofSeconds(30);

		private String resource;

		private List<String> authorizationServers = new ArrayList<>();

		private List<String> scopesSupported = new ArrayList<>();

		private String resourceName;

		public Builder tenantId(String tenantId) {
			this.tenantId = tenantId;
			return this;
		}

		public Builder clientId(String clientId) {
			this.clientId = clientId;
			return this;
		}

		public Builder clientSecret(String clientSecret) {
			this.clientSecret = clientSecret;
			return this;
		}

		public Builder baseUrl(String baseUrl) {
			this.baseUrl = baseUrl;
			return this;
		}

		public Builder validationMode(ValidationMode validationMode) {
			this.validationMode = validationMode;
			return this;
		}

		public Builder expectedAudience(String expectedAudience) {
			this.expectedAudience = expectedAudience;
			return this;
		}

		/**
		 * Expected issuer, optionally containing {@code {tenant}}.
		 * @param issuer the issuer template
		 * @return this builder
		 */
		public Builder issuer(String issuer) {
			this.issuer = issuer;
			return this;
		}

		public Builder requiredScopes(List<String> requiredScopes) {
			this.requiredScopes = new ArrayList<>(requiredScopes);
			return this;
		}

		public Builder requiredScope(String requiredScope) {
			this.requiredScopes.add(requiredScope);
			return this;
		}

		public Builder scopePrefix(String scopePrefix) {
			this.scopePrefix = scopePrefix;
			return this;
		}

		public Builder allowedAlgorithms(Set<JWSAlgorithm> allowedAlgorithms) {
			this.allowedAlgorithms = allowedAlgorithms;
			return this;
		}

		public Builder jwksUri(String jwksUri) {
			this.jwksUri = jwksUri;
			return this;
		}

		public Builder discoveryUri(String discoveryUri) {
			this.discoveryUri = discoveryUri;
			return this;
		}

		public Builder keyRefreshInterval(Duration keyRefreshInterval) {
			this.keyRefreshInterval = keyRefreshInterval;
			return this;
		}

		public Builder keyMinRefreshInterval(Duration keyMinRefreshInterval) {
			this.keyMinRefreshInterval = keyMinRefreshInterval;
			return this;
		}

		public Builder mode(DelegationMode mode) {
			this.mode = mode;
			return this;
		}

		public Builder exchangeGrant(ExchangeGrant exchangeGrant) {
			this.exchangeGrant = exchangeGrant;
			return this;
		}

		public Builder tokenEndpoint(String tokenEndpoint) {
			this.tokenEndpoint = tokenEndpoint;
			return this;
		}

		public Builder targetScope(String targetScope) {
			this.targetScope = targetScope;
			return this;
		}

		public Builder cacheSafetyMargin(Duration cacheSafetyMargin) {
			this.cacheSafetyMargin = cacheSafetyMargin;
			return this;
		}

		public Builder connectTimeout(Duration connectTimeout) {
			this.connectTimeout = connectTimeout;
			return this;
		}

		public Builder requestTimeout(Duration requestTimeout) {
			this.requestTimeout = requestTimeout;
			return this;
		}

		public Builder resource(String resource) {
			this.resource = resource;
			return this;
		}

		public Builder authorizationServers(List<String> authorizationServers) {
			this.authorizationServers = new ArrayList<>(authorizationServers);
			return this;
		}

		public Builder authorizationServer(String authorizationServer) {
			this.authorizationServers.add(authorizationServer);
			return this;
		}

		public Builder scopesSupported(List<String> scopesSupported) {
			this.scopesSupported = new ArrayList<>(scopesSupported);
			return this;
		}

		public Builder resourceName(String resourceName) {
			this.resourceName = resourceName;
			return this;
		}

		/**
		 * Validate and expand the configuration.
		 * @return the immutable properties
		 * @throws IllegalArgumentException if a setting required by the selected modes is
		 * missing or invalid
		 */
		public DelegationProperties build() {
			Assert.notNull(validationMode, "validation mode must be set");
			Assert.notNull(mode, "delegation mode must be set");
			Assert.hasText(expectedAudience, "expected audience must be set");
			Assert.hasText(issuer, "issuer must be set");
			Assert.notNull(requiredScopes, "required scopes must not be null");
			Assert.notEmpty(allowedAlgorithms, "at least one signature algorithm must be allowed");
			Assert.hasText(resource, "resource must be set");
			Assert.notEmpty(authorizationServers, "at least one authorization server must be set");
			assertPositive(keyRefreshInterval, "key refresh interval");
			assertPositive(connectTimeout, "connect timeout");
			assertPositive(requestTimeout, "request timeout");
			Assert.isTrue(keyMinRefreshInterval != null && !keyMinRefreshInterval.isNegative(),
					"key minimum refresh interval must not be negative");
			Assert.isTrue(cacheSafetyMargin != null && !cacheSafetyMargin.isNegative(),
					"cache safety margin must not be negative");

			Map<String, String> placeholders = new LinkedHashMap<>();
			placeholders.put("tenant", tenantId);
			placeholders.put("client_id", clientId);
			placeholders.put("base_url", baseUrl);

			if (containsPlaceholder(issuer, "tenant")) {
				Assert.hasText(tenantId, "tenant id must be set to expand the issuer " + issuer);
			}
			if (validationMode == ValidationMode.SIGNATURE_VERIFIED) {
				Assert.isTrue(Utils.hasText(jwksUri) || Utils.hasText(discoveryUri),
						"jwks uri or discovery uri must be set for signature verification");
			}
			if (mode == DelegationMode.ON_BEHALF_OF) {
				Assert.notNull(exchangeGrant, "exchange grant must be set for on-behalf-of delegation");
				Assert.hasText(tokenEndpoint, "token endpoint must be set for on-behalf-of delegation");
				Assert.hasText(clientId, "client id must be set for on-behalf-of delegation");
				Assert.hasText(clientSecret, "client secret must be set for on-behalf-of delegation");
				Assert.hasText(targetScope, "target scope must be set for on-behalf-of delegation");
			}

			Set<String> distinct = new LinkedHashSet<>(requiredScopes);
			this.requiredScopes = new ArrayList<>(distinct);
			return new DelegationProperties(this, placeholders);
		}

		private static boolean containsPlaceholder(String value, String name) {
			return value != null && value.contains("{" + name + "}");
		}

		private static void assertPositive(Duration duration, String name) {
			Assert.isTrue(duration != null && !duration.isNegative() && !duration.isZero(), name + " must be positive");
		}

	}

}
