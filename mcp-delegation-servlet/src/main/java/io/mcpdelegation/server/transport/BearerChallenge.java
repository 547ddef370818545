/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.server.transport;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds RFC 6750 {@code WWW-Authenticate} challenges carrying the RFC 9728
 * {@code resource_metadata} parameter.
 */
final class BearerChallenge {

	static final String INVALID_TOKEN = "invalid_token";

	static final String INSUFFICIENT_SCOPE = "insufficient_scope";

	private final Map<String, String> parameters = new LinkedHashMap<>();

	private BearerChallenge(String resourceMetadataUrl) {
		parameters.put("resource_metadata", resourceMetadataUrl);
	}

	static BearerChallenge forResource(String resourceMetadataUrl) {
		return new BearerChallenge(resourceMetadataUrl);
	}

	BearerChallenge error(String error, String description) {
		parameters.put("error", error);
		parameters.put("error_description", description);
		return this;
	}

	BearerChallenge scope(String scope) {
		if (scope != null && !scope.isBlank()) {
			parameters.put("scope", scope);
		}
		return this;
	}

	String toHeaderValue() {
		StringBuilder header = new StringBuilder("Bearer ");
		boolean first = true;
		for (Map.Entry<String, String> parameter : parameters.entrySet()) {
			if (!first) {
				header.append(", ");
			}
			first = false;
			header.append(parameter.getKey())
				.append("=\"")
				.append(parameter.getValue().replace("\\", "\\\\").replace("\"", "\\\""))
				.append('"');
		}
		return header.toString();
	}

}
