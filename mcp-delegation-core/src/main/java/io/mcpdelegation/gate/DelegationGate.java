/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.gate;

import java.time.Instant;
import java.util.function.LongSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mcpdelegation.credential.ClaimSet;
import io.mcpdelegation.credential.JwtCredentialParser;
import io.mcpdelegation.credential.MalformedCredentialException;
import io.mcpdelegation.exchange.DownstreamCredential;
import io.mcpdelegation.exchange.TokenExchangeClient;
import io.mcpdelegation.policy.ValidationOutcome;
import io.mcpdelegation.policy.ValidationPolicy;
import io.mcpdelegation.util.Assert;
import io.mcpdelegation.util.Utils;
import reactor.core.publisher.Mono;

/**
 * Single entry point run before any tool body. Parses the bearer credential, evaluates
 * it against the configured {@link ValidationPolicy} and, in
 * {@link DelegationMode#ON_BEHALF_OF} deployments, exchanges it for a downstream
 * credential.
 * <p>
 * Every failure ends in {@link AuthorizationResult.Denied}; the returned {@link Mono}
 * never signals an error. Cancelling it releases the caller's network waits without
 * aborting an exchange other callers share.
 */
public class DelegationGate {

	private static final Logger logger = LoggerFactory.getLogger(DelegationGate.class);

	private final JwtCredentialParser parser;

	private final ValidationPolicy policy;

	private final DelegationMode mode;

	private final TokenExchangeClient exchangeClient;

	private final String targetScope;

	private final LongSupplier currentTimeMillisSupplier;

	private DelegationGate(Builder builder) {
		this.parser = builder.parser;
		this.policy = builder.policy;
		this.mode = builder.mode;
		this.exchangeClient = builder.exchangeClient;
		this.targetScope = builder.targetScope;
		this.currentTimeMillisSupplier = builder.currentTimeMillisSupplier;
	}

	public DelegationMode getMode() {
		return mode;
	}

	/**
	 * Decide whether a tool may run with the given credential.
	 * @param rawCredential the bearer credential as presented
	 * @return a {@link Mono} of {@link AuthorizationResult.Ready} or
	 * {@link AuthorizationResult.Denied}
	 */
	public Mono<AuthorizationResult> authorize(String rawCredential) {
		return Mono.defer(() -> {
			ClaimSet claimSet;
			try {
				claimSet = parser.parse(rawCredential);
			}
			catch (MalformedCredentialException e) {
				return Mono.just(deny(DenialReason.MALFORMED, e));
			}

			return Mono.fromFuture(() -> policy.evaluate(claimSet, rawCredential))
				.flatMap(outcome -> onValidated(outcome, rawCredential));
		}).onErrorResume(ex -> Mono.just(deny(DenialReason.MALFORMED, Utils.unwrap(ex))));
	}

	private Mono<AuthorizationResult> onValidated(ValidationOutcome outcome, String rawCredential) {
		if (outcome instanceof ValidationOutcome.Rejected rejected) {
			return Mono.just(deny(DenialReason.of(rejected.reason()), rejected.cause()));
		}

		ClaimSet claimSet = ((ValidationOutcome.Accepted) outcome).claimSet();
		if (mode == DelegationMode.PASS_THROUGH) {
			Instant now = Instant.ofEpochMilli(currentTimeMillisSupplier.getAsLong());
			return Mono.just(new AuthorizationResult.Ready(
					DownstreamCredential.passThrough(rawCredential, claimSet, now), claimSet));
		}

		return Mono.fromFuture(() -> exchangeClient.exchange(claimSet, rawCredential, targetScope))
			.<AuthorizationResult>map(credential -> new AuthorizationResult.Ready(credential, claimSet))
			.onErrorResume(ex -> Mono.just(deny(DenialReason.EXCHANGE_FAILED, Utils.unwrap(ex))));
	}

	private static AuthorizationResult deny(DenialReason reason, Throwable cause) {
		logger.warn("Authorization denied: {}", reason.code());
		if (cause != null) {
			logger.debug("Denial cause", cause);
		}
		return new AuthorizationResult.Denied(reason, cause);
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {

		private JwtCredentialParser parser = new JwtCredentialParser();

		private ValidationPolicy policy;

		private DelegationMode mode = DelegationMode.PASS_THROUGH;

		private TokenExchangeClient exchangeClient;

		private String targetScope;

		private LongSupplier currentTimeMillisSupplier = System::currentTimeMillis;

		public Builder parser(JwtCredentialParser parser) {
			this.parser = parser;
			return this;
		}

		public Builder policy(ValidationPolicy policy) {
			this.policy = policy;
			return this;
		}

		public Builder mode(DelegationMode mode) {
			this.mode = mode;
			return this;
		}

		/**
		 * Exchange client and downstream scope used in
		 * {@link DelegationMode#ON_BEHALF_OF} mode.
		 * @param exchangeClient the exchange client
		 * @param targetScope the downstream scope to request
		 * @return this builder
		 */
		public Builder exchange(TokenExchangeClient exchangeClient, String targetScope) {
			this.exchangeClient = exchangeClient;
			this.targetScope = targetScope;
			return this;
		}

		public Builder currentTimeMillisSupplier(LongSupplier currentTimeMillisSupplier) {
			this.currentTimeMillisSupplier = currentTimeMillisSupplier;
			return this;
		}

		public DelegationGate build() {
			Assert.notNull(parser, "parser must not be null");
			Assert.notNull(policy, "policy must not be null");
			Assert.notNull(mode, "mode must not be null");
			Assert.notNull(currentTimeMillisSupplier, "currentTimeMillisSupplier must not be null");
			if (mode == DelegationMode.ON_BEHALF_OF) {
				Assert.notNull(exchangeClient, "exchangeClient must not be null in ON_BEHALF_OF mode");
				Assert.hasText(targetScope, "targetScope must not be empty in ON_BEHALF_OF mode");
			}
			return new DelegationGate(this);
		}

	}

}
