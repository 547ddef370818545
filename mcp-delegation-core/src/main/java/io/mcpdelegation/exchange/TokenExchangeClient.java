/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.exchange;

import java.util.concurrent.CompletableFuture;

import io.mcpdelegation.credential.ClaimSet;

/**
 * Obtains a downstream credential on behalf of the subject of a validated inbound
 * credential.
 */
public interface TokenExchangeClient {

	/**
	 * Exchange the inbound credential for one scoped to {@code targetScope}.
	 * @param claimSet the validated claims of the inbound credential
	 * @param rawCredential the inbound credential
	 * @param targetScope the downstream scope to request
	 * @return a future resolving to the downstream credential, or completing
	 * exceptionally with a {@link TokenExchangeException}. Cancelling it releases only
	 * the caller's wait.
	 */
	CompletableFuture<DownstreamCredential> exchange(ClaimSet claimSet, String rawCredential, String targetScope);

}
