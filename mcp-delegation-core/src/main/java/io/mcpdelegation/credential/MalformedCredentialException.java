/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.credential;

/**
 * Thrown when a bearer credential cannot be decoded into a {@link ClaimSet}: it is not a
 * signed JWT, a segment is not valid Base64URL JSON, or a required claim is absent or
 * has the wrong type.
 */
public class MalformedCredentialException extends Exception {

	private static final long serialVersionUID = 1L;

	public MalformedCredentialException(String message) {
		super(message);
	}

	public MalformedCredentialException(String message, Throwable cause) {
		super(message, cause);
	}

}
