/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.policy;

import io.mcpdelegation.credential.ClaimSet;
import io.mcpdelegation.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * Result of evaluating a credential against a {@link ValidationPolicy}.
 */
public sealed interface ValidationOutcome permits ValidationOutcome.Accepted, ValidationOutcome.Rejected {

	static ValidationOutcome accepted(ClaimSet claimSet) {
		return new Accepted(claimSet);
	}

	static ValidationOutcome rejected(RejectionReason reason, String detail) {
		return new Rejected(reason, detail, null);
	}

	static ValidationOutcome rejected(RejectionReason reason, String detail, @Nullable Throwable cause) {
		return new Rejected(reason, detail, cause);
	}

	/**
	 * The credential passed every check.
	 *
	 * @param claimSet the validated claims
	 */
	record Accepted(ClaimSet claimSet) implements ValidationOutcome {

		public Accepted {
			Assert.notNull(claimSet, "claimSet must not be null");
		}

	}

	/**
	 * The credential failed a check.
	 *
	 * @param reason the first failing check
	 * @param detail a diagnostic message, for logs only
	 * @param cause the underlying failure, if any, for logs only
	 */
	record Rejected(RejectionReason reason, String detail, @Nullable Throwable cause) implements ValidationOutcome {

		public Rejected {
			Assert.notNull(reason, "reason must not be null");
		}

	}

}
