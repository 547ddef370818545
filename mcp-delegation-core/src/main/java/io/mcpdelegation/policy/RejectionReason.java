/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.policy;

/**
 * Why a credential was not accepted. Evaluation stops at the first failing check, so a
 * rejection always carries exactly one reason.
 */
public enum RejectionReason {

	MALFORMED("malformed"),

	EXPIRED("expired"),

	WRONG_AUDIENCE("wrong-audience"),

	WRONG_ISSUER("wrong-issuer"),

	MISSING_SCOPE("missing-scope"),

	SIGNATURE_INVALID("signature-invalid");

	private final String code;

	RejectionReason(String code) {
		this.code = code;
	}

	/**
	 * @return the stable, caller-visible reason code
	 */
	public String code() {
		return this.code;
	}

}
