/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.examples.graph;

/**
 * A Microsoft Graph call failed or returned a non-success status.
 */
public class GraphApiException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final int statusCode;

	public GraphApiException(String message, int statusCode) {
		super(message);
		this.statusCode = statusCode;
	}

	public GraphApiException(String message, Throwable cause) {
		super(message, cause);
		this.statusCode = -1;
	}

	/**
	 * @return the HTTP status, or {@code -1} when no response was received
	 */
	public int getStatusCode() {
		return statusCode;
	}

}
