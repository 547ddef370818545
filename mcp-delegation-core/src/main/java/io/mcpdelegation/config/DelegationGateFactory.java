/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.config;

import java.net.http.HttpClient;
import java.util.function.LongSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.mcpdelegation.exchange.ExchangeCache;
import io.mcpdelegation.exchange.OnBehalfOfExchangeClient;
import io.mcpdelegation.gate.DelegationGate;
import io.mcpdelegation.gate.DelegationMode;
import io.mcpdelegation.metadata.ProtectedResourceMetadata;
import io.mcpdelegation.metadata.ProtectedResourceMetadataPublisher;
import io.mcpdelegation.policy.CachingSigningKeySource;
import io.mcpdelegation.policy.ClaimsOnlyValidationPolicy;
import io.mcpdelegation.policy.ClaimsValidator;
import io.mcpdelegation.policy.SignatureVerifiedValidationPolicy;
import io.mcpdelegation.policy.ValidationPolicy;
import io.mcpdelegation.util.Assert;

/**
 * Wires the delegation engine from {@link DelegationProperties}. The validation policy
 * and delegation mode are chosen here, once, for the lifetime of the gate.
 */
public class DelegationGateFactory {

	private static final Logger logger = LoggerFactory.getLogger(DelegationGateFactory.class);

	private final DelegationProperties properties;

	private final HttpClient httpClient;

	private final ObjectMapper objectMapper;

	private final LongSupplier currentTimeMillisSupplier;

	public DelegationGateFactory(DelegationProperties properties) {
		this(properties, HttpClient.newBuilder().connectTimeout(properties.getConnectTimeout()).build(),
				new ObjectMapper(), System::currentTimeMillis);
	}

	public DelegationGateFactory(DelegationProperties properties, HttpClient httpClient, ObjectMapper objectMapper,
			LongSupplier currentTimeMillisSupplier) {
		Assert.notNull(properties, "properties must not be null");
		Assert.notNull(httpClient, "httpClient must not be null");
		Assert.notNull(objectMapper, "objectMapper must not be null");
		Assert.notNull(currentTimeMillisSupplier, "currentTimeMillisSupplier must not be null");
		this.properties = properties;
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
		this.currentTimeMillisSupplier = currentTimeMillisSupplier;
	}

	public DelegationGate createGate() {
		DelegationGate.Builder builder = DelegationGate.builder()
			.policy(createPolicy())
			.mode(properties.getMode())
			.currentTimeMillisSupplier(currentTimeMillisSupplier);

		if (properties.getMode() == DelegationMode.ON_BEHALF_OF) {
			builder.exchange(createExchangeClient(), properties.getTargetScope());
		}

		logger.info("Delegation gate configured: validation={}, delegation={}", properties.getValidationMode(),
				properties.getMode());
		return builder.build();
	}

	public ValidationPolicy createPolicy() {
		ClaimsValidator claimsValidator = new ClaimsValidator(properties.getExpectedAudience(),
				properties.getIssuer(), properties.getRequiredScopes(), properties.getScopePrefix(),
				currentTimeMillisSupplier);

		return switch (properties.getValidationMode()) {
			case CLAIMS_ONLY -> new ClaimsOnlyValidationPolicy(claimsValidator);
			case SIGNATURE_VERIFIED -> new SignatureVerifiedValidationPolicy(createSigningKeySource(),
					claimsValidator, properties.getAllowedAlgorithms());
		};
	}

	CachingSigningKeySource createSigningKeySource() {
		return CachingSigningKeySource.builder()
			.httpClient(httpClient)
			.objectMapper(objectMapper)
			.jwksUri(properties.getJwksUri())
			.discoveryUri(properties.getDiscoveryUri())
			.refreshInterval(properties.getKeyRefreshInterval())
			.minRefreshInterval(properties.getKeyMinRefreshInterval())
			.requestTimeout(properties.getRequestTimeout())
			.currentTimeMillisSupplier(currentTimeMillisSupplier)
			.build();
	}

	OnBehalfOfExchangeClient createExchangeClient() {
		return OnBehalfOfExchangeClient.builder()
			.httpClient(httpClient)
			.objectMapper(objectMapper)
			.tokenEndpoint(properties.getTokenEndpoint())
			.clientId(properties.getClientId())
			.clientSecret(properties.getClientSecret())
			.grant(properties.getExchangeGrant())
			.requestTimeout(properties.getRequestTimeout())
			.cache(new ExchangeCache(properties.getCacheSafetyMargin(), currentTimeMillisSupplier))
			.currentTimeMillisSupplier(currentTimeMillisSupplier)
			.build();
	}

	public ProtectedResourceMetadataPublisher createMetadataPublisher() {
		return new ProtectedResourceMetadataPublisher(new ProtectedResourceMetadata(properties.getResource(),
				properties.getAuthorizationServers(), properties.getScopesSupported(), null,
				properties.getResourceName()));
	}

}
