/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.policy;

import java.util.concurrent.CompletableFuture;

import com.nimbusds.jose.jwk.JWK;

/**
 * Resolves the issuer's public signing keys.
 */
public interface SigningKeySource {

	/**
	 * Look up the key with the given identifier.
	 * @param keyId the {@code kid} from the credential header
	 * @return a future that resolves to the key, or completes exceptionally with a
	 * {@link SigningKeyException} when the key set cannot be fetched or holds no such key
	 */
	CompletableFuture<JWK> getKey(String keyId);

}
