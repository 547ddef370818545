/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.policy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.Test;

import io.mcpdelegation.credential.ClaimSet;

/**
 * Tests for {@link ClaimsValidator}.
 */
class ClaimsValidatorTest {

	private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

	private final AtomicLong clock = new AtomicLong(NOW.toEpochMilli());

	private ClaimsValidator validator(Set<String> requiredScopes) {
		return new ClaimsValidator("X", "https://issuer/T", requiredScopes, null, clock::get);
	}

	private static ClaimSet claimSet(List<String> audiences, String issuer, Instant expiresAt, List<String> scopes) {
		return new ClaimSet("user-1", audiences, issuer, expiresAt, scopes, null, "kid", "RS256", Map.of());
	}

	@Test
	void acceptsWhenEveryCheckPasses() {
		ClaimSet claimSet = claimSet(List.of("X"), "https://issuer/T", NOW.plusSeconds(60), List.of("A", "B"));

		ValidationOutcome outcome = validator(Set.of("A")).validate(claimSet);

		assertThat(outcome).isEqualTo(ValidationOutcome.accepted(claimSet));
	}

	@Test
	void expiryIsCheckedFirst() {
		ClaimSet claimSet = claimSet(List.of("wrong"), "https://other", NOW.minusSeconds(1), List.of());

		ValidationOutcome outcome = validator(Set.of("A")).validate(claimSet);

		assertThat(outcome).isInstanceOf(ValidationOutcome.Rejected.class);
		assertThat(((ValidationOutcome.Rejected) outcome).reason()).isEqualTo(RejectionReason.EXPIRED);
	}

	@Test
	void expiryEqualToNowIsRejected() {
		ClaimSet claimSet = claimSet(List.of("X"), "https://issuer/T", NOW, List.of("A"));

		assertThat(reasonOf(validator(Set.of("A")).validate(claimSet))).isEqualTo(RejectionReason.EXPIRED);
	}

	@Test
	void audienceMustMatchExactly() {
		ClaimSet claimSet = claimSet(List.of("x", "X-other"), "https://issuer/T", NOW.plusSeconds(60),
				List.of("A"));

		assertThat(reasonOf(validator(Set.of("A")).validate(claimSet))).isEqualTo(RejectionReason.WRONG_AUDIENCE);
	}

	@Test
	void audienceArrayPassesWhenOneElementMatches() {
		ClaimSet claimSet = claimSet(List.of("other", "X"), "https://issuer/T", NOW.plusSeconds(60), List.of("A"));

		assertThat(validator(Set.of("A")).validate(claimSet)).isInstanceOf(ValidationOutcome.Accepted.class);
	}

	@Test
	void issuerMustMatchExactly() {
		ClaimSet claimSet = claimSet(List.of("X"), "https://issuer/T/", NOW.plusSeconds(60), List.of("A"));

		assertThat(reasonOf(validator(Set.of("A")).validate(claimSet))).isEqualTo(RejectionReason.WRONG_ISSUER);
	}

	@Test
	void everyRequiredScopeMustBePresent() {
		ClaimSet claimSet = claimSet(List.of("X"), "https://issuer/T", NOW.plusSeconds(60), List.of("A", "B"));

		ValidationOutcome outcome = validator(Set.of("A", "C")).validate(claimSet);

		assertThat(reasonOf(outcome)).isEqualTo(RejectionReason.MISSING_SCOPE);
		assertThat(((ValidationOutcome.Rejected) outcome).detail()).contains("C");
	}

	@Test
	void noRequiredScopesAcceptsCredentialWithoutScopes() {
		ClaimSet claimSet = claimSet(List.of("X"), "https://issuer/T", NOW.plusSeconds(60), List.of());

		assertThat(validator(Set.of()).validate(claimSet)).isInstanceOf(ValidationOutcome.Accepted.class);
	}

	@Test
	void shortScopesAreQualifiedWithPrefix() {
		ClaimsValidator validator = new ClaimsValidator("X", "https://issuer/T",
				Set.of("api://client-id/access_as_user"), "api://client-id/", clock::get);
		ClaimSet claimSet = claimSet(List.of("X"), "https://issuer/T", NOW.plusSeconds(60),
				List.of("access_as_user"));

		assertThat(validator.validate(claimSet)).isInstanceOf(ValidationOutcome.Accepted.class);
	}

	@Test
	void qualifiedScopesAreNotPrefixedTwice() {
		ClaimsValidator validator = new ClaimsValidator("X", "https://issuer/T",
				Set.of("api://client-id/access_as_user"), "api://client-id", clock::get);
		ClaimSet claimSet = claimSet(List.of("X"), "https://issuer/T", NOW.plusSeconds(60),
				List.of("api://client-id/access_as_user"));

		assertThat(validator.validate(claimSet)).isInstanceOf(ValidationOutcome.Accepted.class);
	}

	@Test
	void usesInjectedClock() {
		ClaimSet claimSet = claimSet(List.of("X"), "https://issuer/T", NOW.plusSeconds(60), List.of("A"));
		ClaimsValidator validator = validator(Set.of("A"));

		assertThat(validator.validate(claimSet)).isInstanceOf(ValidationOutcome.Accepted.class);

		clock.addAndGet(60_000);

		assertThat(reasonOf(validator.validate(claimSet))).isEqualTo(RejectionReason.EXPIRED);
	}

	@Test
	void rejectsBlankConfiguration() {
		assertThatThrownBy(() -> new ClaimsValidator(" ", "https://issuer/T", Set.of(), null))
			.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new ClaimsValidator("X", null, Set.of(), null))
			.isInstanceOf(IllegalArgumentException.class);
	}

	private static RejectionReason reasonOf(ValidationOutcome outcome) {
		assertThat(outcome).isInstanceOf(ValidationOutcome.Rejected.class);
		return ((ValidationOutcome.Rejected) outcome).reason();
	}

}
