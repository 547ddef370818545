/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.policy;

/**
 * Thrown when a signing key cannot be resolved: the discovery document or key set could
 * not be fetched in time, could not be parsed, or holds no key with the requested id.
 */
public class SigningKeyException extends Exception {

	private static final long serialVersionUID = 1L;

	public SigningKeyException(String message) {
		super(message);
	}

	public SigningKeyException(String message, Throwable cause) {
		super(message, cause);
	}

}
