/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.credential;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import io.mcpdelegation.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * Claims extracted from a bearer credential. A claim set says nothing about trust: it is
 * produced before any validation and consumed read-only by the validation policies and
 * the exchange client.
 *
 * @param subject opaque subject identifier ({@code sub})
 * @param audiences audience identifiers ({@code aud}), never empty
 * @param issuer issuer identifier ({@code iss})
 * @param expiresAt expiry instant ({@code exp})
 * @param scopes granted scopes from {@code scp} or {@code scope}, possibly empty
 * @param clientId the client the credential was issued to ({@code appid} or
 * {@code azp}), if present
 * @param keyId the signing key identifier from the header ({@code kid}), if present
 * @param algorithm the signature algorithm from the header ({@code alg})
 * @param claims every payload claim as decoded
 */
public record ClaimSet(String subject, List<String> audiences, String issuer, Instant expiresAt,
		List<String> scopes, @Nullable String clientId, @Nullable String keyId, String algorithm,
		Map<String, Object> claims) {

	public ClaimSet {
		Assert.hasText(subject, "subject must not be empty");
		Assert.notEmpty(audiences, "audiences must not be empty");
		Assert.hasText(issuer, "issuer must not be empty");
		Assert.notNull(expiresAt, "expiresAt must not be null");
		Assert.hasText(algorithm, "algorithm must not be empty");
		audiences = List.copyOf(audiences);
		scopes = scopes != null ? List.copyOf(scopes) : List.of();
		claims = claims != null ? claims : Map.of();
	}

	/**
	 * Whether one of the audiences is exactly the given identifier.
	 * @param audience the expected audience
	 * @return true on an exact, case-sensitive match
	 */
	public boolean hasAudience(String audience) {
		return audiences.contains(audience);
	}

}
