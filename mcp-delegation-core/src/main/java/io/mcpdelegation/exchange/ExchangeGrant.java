/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.exchange;

import java.util.Map;

/**
 * How the inbound credential is presented to the token endpoint.
 */
public enum ExchangeGrant {

	/**
	 * Microsoft Entra ID on-behalf-of flow: the inbound credential is the
	 * {@code assertion} of a JWT bearer grant.
	 */
	JWT_BEARER("urn:ietf:params:oauth:grant-type:jwt-bearer") {
		@Override
		void addSubjectToken(Map<String, String> form, String subjectToken) {
			form.put("assertion", subjectToken);
			form.put("requested_token_use", "on_behalf_of");
		}
	},

	/**
	 * RFC 8693 token exchange.
	 */
	TOKEN_EXCHANGE("urn:ietf:params:oauth:grant-type:token-exchange") {
		@Override
		void addSubjectToken(Map<String, String> form, String subjectToken) {
			form.put("subject_token", subjectToken);
			form.put("subject_token_type", ACCESS_TOKEN_TYPE);
		}
	};

	static final String ACCESS_TOKEN_TYPE = "urn:ietf:params:oauth:token-type:access_token";

	private final String grantType;

	ExchangeGrant(String grantType) {
		this.grantType = grantType;
	}

	public String grantType() {
		return grantType;
	}

	abstract void addSubjectToken(Map<String, String> form, String subjectToken);

}
