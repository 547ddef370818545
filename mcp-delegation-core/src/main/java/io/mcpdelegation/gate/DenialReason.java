/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.gate;

import io.mcpdelegation.policy.RejectionReason;

/**
 * The reason code returned to callers with a denial. These codes are the only failure
 * detail that leaves the gate.
 */
public enum DenialReason {

	MALFORMED("malformed"),

	EXPIRED("expired"),

	WRONG_AUDIENCE("wrong-audience"),

	WRONG_ISSUER("wrong-issuer"),

	MISSING_SCOPE("missing-scope"),

	SIGNATURE_INVALID("signature-invalid"),

	EXCHANGE_FAILED("exchange-failed");

	private final String code;

	DenialReason(String code) {
		this.code = code;
	}

	public String code() {
		return this.code;
	}

	/**
	 * Map a validation rejection onto the denial it propagates as.
	 * @param reason the rejection reason
	 * @return the denial reason with the same code
	 */
	public static DenialReason of(RejectionReason reason) {
		return switch (reason) {
			case MALFORMED -> MALFORMED;
			case EXPIRED -> EXPIRED;
			case WRONG_AUDIENCE -> WRONG_AUDIENCE;
			case WRONG_ISSUER -> WRONG_ISSUER;
			case MISSING_SCOPE -> MISSING_SCOPE;
			case SIGNATURE_INVALID -> SIGNATURE_INVALID;
		};
	}

}
