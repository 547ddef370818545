/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.policy;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.LongSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mcpdelegation.credential.ClaimSet;
import io.mcpdelegation.util.Assert;
import io.mcpdelegation.util.Utils;
import reactor.util.annotation.Nullable;

/**
 * Claim checks shared by every {@link ValidationPolicy}. Checks run in a fixed order
 * and stop at the first failure: expiry, audience, issuer, scope.
 * <p>
 * When a scope prefix is configured, token scopes without a {@code /} are qualified as
 * {@code <prefix>/<scope>} before comparison. Entra ID advertises
 * {@code api://<client-id>/access_as_user} but places only {@code access_as_user} in the
 * {@code scp} claim.
 */
public class ClaimsValidator {

	private static final Logger logger = LoggerFactory.getLogger(ClaimsValidator.class);

	private final String expectedAudience;

	private final String expectedIssuer;

	private final Set<String> requiredScopes;

	@Nullable
	private final String scopePrefix;

	private final LongSupplier currentTimeMillisSupplier;

	public ClaimsValidator(String expectedAudience, String expectedIssuer, Set<String> requiredScopes,
			@Nullable String scopePrefix) {
		this(expectedAudience, expectedIssuer, requiredScopes, scopePrefix, System::currentTimeMillis);
	}

	public ClaimsValidator(String expectedAudience, String expectedIssuer, Set<String> requiredScopes,
			@Nullable String scopePrefix, LongSupplier currentTimeMillisSupplier) {
		Assert.hasText(expectedAudience, "expectedAudience must not be empty");
		Assert.hasText(expectedIssuer, "expectedIssuer must not be empty");
		Assert.notNull(requiredScopes, "requiredScopes must not be null");
		Assert.notNull(currentTimeMillisSupplier, "currentTimeMillisSupplier must not be null");
		this.expectedAudience = expectedAudience;
		this.expectedIssuer = expectedIssuer;
		this.requiredScopes = Set.copyOf(requiredScopes);
		this.scopePrefix = Utils.hasText(scopePrefix) ? stripTrailingSlash(scopePrefix) : null;
		this.currentTimeMillisSupplier = currentTimeMillisSupplier;
	}

	/**
	 * Run the claim checks.
	 * @param claimSet the decoded claims
	 * @return {@link ValidationOutcome.Accepted} or the first
	 * {@link ValidationOutcome.Rejected}
	 */
	public ValidationOutcome validate(ClaimSet claimSet) {
		Instant now = Instant.ofEpochMilli(currentTimeMillisSupplier.getAsLong());
		if (!now.isBefore(claimSet.expiresAt())) {
			return reject(RejectionReason.EXPIRED, "Credential expired at " + claimSet.expiresAt());
		}

		if (!claimSet.hasAudience(expectedAudience)) {
			return reject(RejectionReason.WRONG_AUDIENCE,
					"Credential audience " + claimSet.audiences() + " does not match " + expectedAudience);
		}

		if (!expectedIssuer.equals(claimSet.issuer())) {
			return reject(RejectionReason.WRONG_ISSUER,
					"Credential issuer " + claimSet.issuer() + " does not match " + expectedIssuer);
		}

		Set<String> grantedScopes = qualifiedScopes(claimSet);
		if (!grantedScopes.containsAll(requiredScopes)) {
			Set<String> missing = new LinkedHashSet<>(requiredScopes);
			missing.removeAll(grantedScopes);
			return reject(RejectionReason.MISSING_SCOPE, "Credential is missing required scopes " + missing);
		}

		return ValidationOutcome.accepted(claimSet);
	}

	private Set<String> qualifiedScopes(ClaimSet claimSet) {
		Set<String> scopes = new LinkedHashSet<>();
		for (String scope : claimSet.scopes()) {
			if (scopePrefix != null && !scope.contains("/")) {
				scopes.add(scopePrefix + "/" + scope);
			}
			else {
				scopes.add(scope);
			}
		}
		return scopes;
	}

	private static ValidationOutcome reject(RejectionReason reason, String detail) {
		logger.debug("Claim check failed ({}): {}", reason.code(), detail);
		return ValidationOutcome.rejected(reason, detail);
	}

	private static String stripTrailingSlash(String value) {
		return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
	}

}
