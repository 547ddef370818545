/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.metadata;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.mcpdelegation.util.Assert;

/**
 * RFC 9728 OAuth 2.0 Protected Resource Metadata. See
 * https://datatracker.ietf.org/doc/html/rfc9728#section-2
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProtectedResourceMetadata( // @formatter:off
	@JsonProperty("resource") String resource,
	@JsonProperty("authorization_servers") List<String> authorizationServers,
	@JsonProperty("scopes_supported") List<String> scopesSupported,
	@JsonProperty("bearer_methods_supported") List<String> bearerMethodsSupported,
	@JsonProperty("resource_name") String resourceName) { // @formatter:on

	public ProtectedResourceMetadata {
		Assert.hasText(resource, "resource must not be empty");
		Assert.notEmpty(authorizationServers, "authorizationServers must not be empty");
		authorizationServers = List.copyOf(authorizationServers);
		scopesSupported = scopesSupported != null ? List.copyOf(scopesSupported) : List.of();
		bearerMethodsSupported = bearerMethodsSupported != null ? List.copyOf(bearerMethodsSupported)
				: List.of("header");
	}

	public ProtectedResourceMetadata(String resource, List<String> authorizationServers,
			List<String> scopesSupported) {
		this(resource, authorizationServers, scopesSupported, null, null);
	}

}
