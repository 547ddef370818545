/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.policy;

/**
 * Selects the {@link ValidationPolicy} of a deployment.
 */
public enum ValidationMode {

	/**
	 * Verify the signature against the issuer's published key set, then check claims.
	 */
	SIGNATURE_VERIFIED,

	/**
	 * Check claims only. For issuers whose tokens cannot be verified by third parties,
	 * such as Microsoft Graph access tokens with a proof-of-possession {@code nonce}
	 * header. Must be chosen explicitly.
	 */
	CLAIMS_ONLY

}
