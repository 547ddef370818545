/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.exchange;

import reactor.util.annotation.Nullable;

/**
 * Thrown when the provider refuses an exchange, the exchange request fails or times out,
 * or the response cannot be understood. Exchanges are never retried.
 */
public class TokenExchangeException extends Exception {

	private static final long serialVersionUID = 1L;

	/** Status code used when no HTTP response was received. */
	public static final int NO_RESPONSE = -1;

	private final int statusCode;

	@Nullable
	private final String error;

	@Nullable
	private final String errorDescription;

	public TokenExchangeException(String message, Throwable cause) {
		this(message, NO_RESPONSE, null, null, cause);
	}

	public TokenExchangeException(String message, int statusCode, @Nullable String error,
			@Nullable String errorDescription, @Nullable Throwable cause) {
		super(message, cause);
		this.statusCode = statusCode;
		this.error = error;
		this.errorDescription = errorDescription;
	}

	/**
	 * @return the HTTP status of the token endpoint response, or {@link #NO_RESPONSE}
	 */
	public int getStatusCode() {
		return statusCode;
	}

	/**
	 * @return the provider's {@code error} code, if any
	 */
	@Nullable
	public String getError() {
		return error;
	}

	@Nullable
	public String getErrorDescription() {
		return errorDescription;
	}

}
