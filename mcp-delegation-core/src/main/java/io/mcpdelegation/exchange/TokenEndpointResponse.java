/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.exchange;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Successful token endpoint response as defined in RFC 6749 section 5.1 and RFC 8693
 * section 2.2.1.
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenEndpointResponse( // @formatter:off
	@JsonProperty("access_token") String accessToken,
	@JsonProperty("token_type") String tokenType,
	@JsonProperty("expires_in") Long expiresIn,
	@JsonProperty("scope") String scope,
	@JsonProperty("refresh_token") String refreshToken,
	@JsonProperty("issued_token_type") String issuedTokenType) { // @formatter:on
}
