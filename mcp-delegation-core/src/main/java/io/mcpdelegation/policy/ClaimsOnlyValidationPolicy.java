/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.policy;

import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mcpdelegation.credential.ClaimSet;
import io.mcpdelegation.util.Assert;

/**
 * Validates claims without verifying the signature.
 * <p>
 * Microsoft Graph access tokens include a {@code nonce} in the JWT header for
 * proof-of-possession, which prevents signature verification by any party other than
 * Graph itself. Deployments that accept such tokens select this policy with
 * {@link ValidationMode#CLAIMS_ONLY}. It is never used as a fallback when
 * {@link SignatureVerifiedValidationPolicy} fails.
 */
public class ClaimsOnlyValidationPolicy implements ValidationPolicy {

	private static final Logger logger = LoggerFactory.getLogger(ClaimsOnlyValidationPolicy.class);

	private final ClaimsValidator claimsValidator;

	public ClaimsOnlyValidationPolicy(ClaimsValidator claimsValidator) {
		Assert.notNull(claimsValidator, "claimsValidator must not be null");
		this.claimsValidator = claimsValidator;
		logger.warn("Credential signatures are NOT verified: claims-only validation is configured");
	}

	@Override
	public CompletableFuture<ValidationOutcome> evaluate(ClaimSet claimSet, String rawCredential) {
		return CompletableFuture.completedFuture(claimsValidator.validate(claimSet));
	}

}
