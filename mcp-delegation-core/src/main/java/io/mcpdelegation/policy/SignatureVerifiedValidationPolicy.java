/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.policy;

import java.text.ParseException;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.ECDSAVerifier;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jwt.SignedJWT;

import io.mcpdelegation.credential.ClaimSet;
import io.mcpdelegation.util.Assert;
import io.mcpdelegation.util.Utils;

/**
 * Verifies the credential signature against the issuer's published keys, then runs the
 * claim checks.
 * <p>
 * Any failure on the signature path, including an unknown key id, a disallowed algorithm
 * or a key set that could not be fetched, is reported as
 * {@link RejectionReason#SIGNATURE_INVALID}. Claim checks are never reached in that
 * case.
 */
public class SignatureVerifiedValidationPolicy implements ValidationPolicy {

	private static final Logger logger = LoggerFactory.getLogger(SignatureVerifiedValidationPolicy.class);

	public static final Set<JWSAlgorithm> DEFAULT_ALLOWED_ALGORITHMS = Set.of(JWSAlgorithm.RS256);

	private final SigningKeySource keySource;

	private final ClaimsValidator claimsValidator;

	private final Set<JWSAlgorithm> allowedAlgorithms;

	public SignatureVerifiedValidationPolicy(SigningKeySource keySource, ClaimsValidator claimsValidator) {
		this(keySource, claimsValidator, DEFAULT_ALLOWED_ALGORITHMS);
	}

	public SignatureVerifiedValidationPolicy(SigningKeySource keySource, ClaimsValidator claimsValidator,
			Set<JWSAlgorithm> allowedAlgorithms) {
		Assert.notNull(keySource, "keySource must not be null");
		Assert.notNull(claimsValidator, "claimsValidator must not be null");
		Assert.notEmpty(allowedAlgorithms, "allowedAlgorithms must not be empty");
		this.keySource = keySource;
		this.claimsValidator = claimsValidator;
		this.allowedAlgorithms = Set.copyOf(allowedAlgorithms);
	}

	@Override
	public CompletableFuture<ValidationOutcome> evaluate(ClaimSet claimSet, String rawCredential) {
		JWSAlgorithm algorithm = JWSAlgorithm.parse(claimSet.algorithm());
		if (!allowedAlgorithms.contains(algorithm)) {
			return CompletableFuture.completedFuture(signatureInvalid("Algorithm " + algorithm + " is not allowed", null));
		}

		SignedJWT jwt;
		try {
			jwt = SignedJWT.parse(rawCredential.trim());
		}
		catch (ParseException e) {
			return CompletableFuture.completedFuture(
					ValidationOutcome.rejected(RejectionReason.MALFORMED, "Credential is not a signed JWT", e));
		}

		return keySource.getKey(claimSet.keyId()).handle((key, ex) -> {
			if (ex != null) {
				Throwable cause = Utils.unwrap(ex);
				return signatureInvalid("Signing key unavailable: " + cause.getMessage(), cause);
			}
			try {
				if (!jwt.verify(verifierFor(key))) {
					return signatureInvalid("Signature does not match key '" + key.getKeyID() + "'", null);
				}
			}
			catch (JOSEException | IllegalStateException e) {
				return signatureInvalid("Signature could not be verified", e);
			}
			return claimsValidator.validate(claimSet);
		});
	}

	private static JWSVerifier verifierFor(JWK key) throws JOSEException {
		if (key instanceof RSAKey rsaKey) {
			return new RSASSAVerifier(rsaKey);
		}
		if (key instanceof ECKey ecKey) {
			return new ECDSAVerifier(ecKey);
		}
		throw new JOSEException("Unsupported signing key type " + key.getKeyType());
	}

	private static ValidationOutcome signatureInvalid(String detail, Throwable cause) {
		logger.debug("Signature check failed: {}", detail);
		return ValidationOutcome.rejected(RejectionReason.SIGNATURE_INVALID, detail, cause);
	}

}
