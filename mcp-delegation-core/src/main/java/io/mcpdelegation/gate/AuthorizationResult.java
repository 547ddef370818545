/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.gate;

import io.mcpdelegation.credential.ClaimSet;
import io.mcpdelegation.exchange.DownstreamCredential;
import io.mcpdelegation.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * Terminal state of {@link DelegationGate#authorize(String)}.
 */
public sealed interface AuthorizationResult permits AuthorizationResult.Ready, AuthorizationResult.Denied {

	/**
	 * The tool may run with the given downstream credential.
	 *
	 * @param downstreamCredential the credential to present to the downstream API
	 * @param claimSet the validated claims of the inbound credential
	 */
	record Ready(DownstreamCredential downstreamCredential, ClaimSet claimSet) implements AuthorizationResult {

		public Ready {
			Assert.notNull(downstreamCredential, "downstreamCredential must not be null");
			Assert.notNull(claimSet, "claimSet must not be null");
		}

	}

	/**
	 * The tool must not run.
	 *
	 * @param reason the caller-visible reason
	 * @param cause the internal cause, for logs only
	 */
	record Denied(DenialReason reason, @Nullable Throwable cause) implements AuthorizationResult {

		public Denied {
			Assert.notNull(reason, "reason must not be null");
		}

		@Override
		public String toString() {
			return "Denied[reason=" + reason.code() + "]";
		}

	}

}
