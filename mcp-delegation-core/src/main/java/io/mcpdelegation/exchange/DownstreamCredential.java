/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.exchange;

import java.time.Duration;
import java.time.Instant;

import io.mcpdelegation.credential.ClaimSet;
import io.mcpdelegation.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * The credential a tool body presents to the downstream API. Either the product of an
 * on-behalf-of exchange or, in pass-through deployments, the validated inbound credential
 * itself.
 *
 * @param token the credential value; never logged
 * @param tokenType the token type, normally {@code Bearer}
 * @param scope the scope granted by the provider, if reported
 * @param issuedAt when the credential was obtained
 * @param expiresAt when the credential expires, if known
 */
public record DownstreamCredential(String token, String tokenType, @Nullable String scope, Instant issuedAt,
		@Nullable Instant expiresAt) {

	public DownstreamCredential {
		Assert.hasText(token, "token must not be empty");
		Assert.hasText(tokenType, "tokenType must not be empty");
		Assert.notNull(issuedAt, "issuedAt must not be null");
	}

	/**
	 * Wrap a validated inbound credential for use as-is downstream.
	 * @param rawCredential the inbound credential, unchanged
	 * @param claimSet its validated claims
	 * @param now the current instant
	 * @return the pass-through credential
	 */
	public static DownstreamCredential passThrough(String rawCredential, ClaimSet claimSet, Instant now) {
		return new DownstreamCredential(rawCredential, "Bearer", String.join(" ", claimSet.scopes()), now,
				claimSet.expiresAt());
	}

	/**
	 * Whether the credential may still be handed out: it has a known expiry and
	 * {@code now} is before the expiry minus the safety margin.
	 * @param now the current instant
	 * @param safetyMargin how long before expiry the credential stops being live
	 * @return true if the credential is live
	 */
	public boolean isLive(Instant now, Duration safetyMargin) {
		return expiresAt != null && now.isBefore(expiresAt.minus(safetyMargin));
	}

	/**
	 * The value of an {@code Authorization} header carrying this credential.
	 * @return {@code Bearer <token>}
	 */
	public String authorizationHeaderValue() {
		return "Bearer " + token;
	}

	@Override
	public String toString() {
		return "DownstreamCredential[token=****, tokenType=" + tokenType + ", scope=" + scope + ", issuedAt="
				+ issuedAt + ", expiresAt=" + expiresAt + "]";
	}

}
