/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.policy;

import java.util.concurrent.CompletableFuture;

import io.mcpdelegation.credential.ClaimSet;

/**
 * Decides whether a decoded credential is acceptable. Exactly one policy is configured
 * per deployment, see {@link ValidationMode}.
 * <p>
 * Implementations must fail closed: every error path completes the returned future
 * with a {@link ValidationOutcome.Rejected} rather than exceptionally or with an
 * acceptance.
 */
public interface ValidationPolicy {

	/**
	 * Evaluate the credential.
	 * @param claimSet the claims decoded from {@code rawCredential}
	 * @param rawCredential the credential as presented, needed for signature checks
	 * @return a future that resolves to the outcome
	 */
	CompletableFuture<ValidationOutcome> evaluate(ClaimSet claimSet, String rawCredential);

}
