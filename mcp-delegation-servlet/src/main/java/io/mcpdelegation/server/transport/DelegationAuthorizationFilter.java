/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.server.transport;

import java.io.IOException;
import java.time.Duration;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.mcpdelegation.gate.AuthorizationResult;
import io.mcpdelegation.gate.DelegationGate;
import io.mcpdelegation.gate.DenialReason;
import io.mcpdelegation.metadata.ProtectedResourceMetadataPublisher;
import io.mcpdelegation.util.Assert;

/**
 * Servlet filter that runs the {@link DelegationGate} before any tool endpoint.
 * <p>
 * Requests without a bearer credential receive {@code 401} with a
 * {@code WWW-Authenticate} challenge pointing at the protected resource metadata.
 * Denied requests receive {@code 403 insufficient_scope} when a required scope is
 * missing and {@code 401 invalid_token} otherwise. The {@code insufficient_scope}
 * challenge names the published {@code scopes_supported}. Every denial has the same JSON
 * shape and only the reason code varies. Authorized requests continue down the chain with a
 * {@link DelegatedAuthContext} bound to the request and the current thread.
 */
public class DelegationAuthorizationFilter implements Filter {

	private static final Logger logger = LoggerFactory.getLogger(DelegationAuthorizationFilter.class);

	private static final String BEARER_PREFIX = "Bearer ";

	private final DelegationGate gate;

	private final ProtectedResourceMetadataPublisher metadataPublisher;

	private final ObjectMapper objectMapper;

	private final Duration authorizationTimeout;

	public DelegationAuthorizationFilter(DelegationGate gate, ProtectedResourceMetadataPublisher metadataPublisher,
			ObjectMapper objectMapper) {
		this(gate, metadataPublisher, objectMapper, Duration.ofSeconds(90));
	}

	/**
	 * @param gate the delegation gate
	 * @param metadataPublisher source of the metadata URL advertised in challenges
	 * @param objectMapper used to render error bodies
	 * @param authorizationTimeout upper bound on waiting for the gate; should exceed the
	 * sum of the key fetch and exchange timeouts
	 */
	public DelegationAuthorizationFilter(DelegationGate gate, ProtectedResourceMetadataPublisher metadataPublisher,
			ObjectMapper objectMapper, Duration authorizationTimeout) {
		Assert.notNull(gate, "gate must not be null");
		Assert.notNull(metadataPublisher, "metadataPublisher must not be null");
		Assert.notNull(objectMapper, "objectMapper must not be null");
		Assert.notNull(authorizationTimeout, "authorizationTimeout must not be null");
		this.gate = gate;
		this.metadataPublisher = metadataPublisher;
		this.objectMapper = objectMapper;
		this.authorizationTimeout = authorizationTimeout;
	}

	@Override
	public void doFilter(ServletRequest servletRequest, ServletResponse servletResponse, FilterChain chain)
			throws IOException, ServletException {
		if (!(servletRequest instanceof HttpServletRequest request)
				|| !(servletResponse instanceof HttpServletResponse response)) {
			throw new ServletException("DelegationAuthorizationFilter requires an HTTP request");
		}

		String credential = extractBearerCredential(request.getHeader("Authorization"));
		if (credential == null) {
			logger.debug("Rejecting {} {}: no bearer credential", request.getMethod(), request.getRequestURI());
			response.setHeader("WWW-Authenticate",
					BearerChallenge.forResource(metadataPublisher.metadataUrl()).toHeaderValue());
			sendError(response, HttpServletResponse.SC_UNAUTHORIZED, "invalid_request",
					"Bearer credential required");
			return;
		}

		AuthorizationResult result;
		try {
			result = gate.authorize(credential).block(authorizationTimeout);
		}
		catch (IllegalStateException e) {
			logger.warn("Authorization did not complete within {}", authorizationTimeout);
			sendError(response, HttpServletResponse.SC_SERVICE_UNAVAILABLE, "temporarily_unavailable",
					"Authorization timed out");
			return;
		}

		if (result instanceof AuthorizationResult.Ready ready) {
			DelegatedAuthContext authContext = new DelegatedAuthContext(ready);
			request.setAttribute(DelegatedAuthContext.REQUEST_ATTRIBUTE, authContext);
			DelegatedAuthContext.setCurrent(authContext);
			try {
				chain.doFilter(request, response);
			}
			finally {
				DelegatedAuthContext.clearCurrent();
			}
			return;
		}

		DenialReason reason = result instanceof AuthorizationResult.Denied denied ? denied.reason()
				: DenialReason.MALFORMED;
		sendDenial(response, reason);
	}

	private void sendDenial(HttpServletResponse response, DenialReason reason) throws IOException {
		boolean insufficientScope = reason == DenialReason.MISSING_SCOPE;
		String error = insufficientScope ? BearerChallenge.INSUFFICIENT_SCOPE : BearerChallenge.INVALID_TOKEN;
		BearerChallenge challenge = BearerChallenge.forResource(metadataPublisher.metadataUrl())
			.error(error, reason.code());
		if (insufficientScope) {
			challenge.scope(String.join(" ", metadataPublisher.getMetadata().scopesSupported()));
		}
		response.setHeader("WWW-Authenticate", challenge.toHeaderValue());
		sendError(response,
				insufficientScope ? HttpServletResponse.SC_FORBIDDEN : HttpServletResponse.SC_UNAUTHORIZED, error,
				reason.code());
	}

	private void sendError(HttpServletResponse response, int status, String error, String description)
			throws IOException {
		response.setStatus(status);
		response.setContentType("application/json");
		response.setCharacterEncoding("UTF-8");
		response.setHeader("Cache-Control", "no-store");
		objectMapper.writeValue(response.getWriter(), new ErrorBody(error, description));
	}

	static String extractBearerCredential(String authorizationHeader) {
		if (authorizationHeader == null
				|| !authorizationHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
			return null;
		}
		String credential = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
		return credential.isEmpty() ? null : credential;
	}

	record ErrorBody(@JsonProperty("error") String error,
			@JsonProperty("error_description") String errorDescription) {
	}

}
