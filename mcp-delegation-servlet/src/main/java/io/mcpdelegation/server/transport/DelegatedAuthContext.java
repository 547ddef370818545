/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.server.transport;

import jakarta.servlet.ServletRequest;

import io.mcpdelegation.credential.ClaimSet;
import io.mcpdelegation.exchange.DownstreamCredential;
import io.mcpdelegation.gate.AuthorizationResult;
import io.mcpdelegation.util.Assert;

/**
 * Holds the outcome of a successful authorization for the duration of one request.
 * Tool code reads the downstream credential from here, either through the request
 * attribute or the thread-local set by {@link DelegationAuthorizationFilter}.
 */
public class DelegatedAuthContext {

	/**
	 * Request attribute under which the context is stored.
	 */
	public static final String REQUEST_ATTRIBUTE = DelegatedAuthContext.class.getName();

	private static final ThreadLocal<DelegatedAuthContext> CURRENT = new ThreadLocal<>();

	private final DownstreamCredential downstreamCredential;

	private final ClaimSet claimSet;

	public DelegatedAuthContext(AuthorizationResult.Ready ready) {
		Assert.notNull(ready, "ready must not be null");
		this.downstreamCredential = ready.downstreamCredential();
		this.claimSet = ready.claimSet();
	}

	/**
	 * Gets the credential to present to the downstream API.
	 * @return The downstream credential.
	 */
	public DownstreamCredential getDownstreamCredential() {
		return downstreamCredential;
	}

	/**
	 * Gets the validated claims of the inbound credential.
	 * @return The claim set.
	 */
	public ClaimSet getClaimSet() {
		return claimSet;
	}

	public String getSubject() {
		return claimSet.subject();
	}

	/**
	 * Gets the client the inbound credential was issued to.
	 * @return The client ID, or {@code null} if the credential does not name one.
	 */
	public String getClientId() {
		return claimSet.clientId();
	}

	/**
	 * Checks if the inbound credential carries the specified scope.
	 * @param scope The scope to check.
	 * @return True if the scope was granted, false otherwise.
	 */
	public boolean hasScope(String scope) {
		return claimSet.scopes().contains(scope);
	}

	public static DelegatedAuthContext getCurrent() {
		return CURRENT.get();
	}

	static void setCurrent(DelegatedAuthContext context) {
		CURRENT.set(context);
	}

	static void clearCurrent() {
		CURRENT.remove();
	}

	/**
	 * Look up the context stored on a request.
	 * @param request the servlet request
	 * @return the context, or {@code null} if the request was not authorized
	 */
	public static DelegatedAuthContext from(ServletRequest request) {
		Object attribute = request.getAttribute(REQUEST_ATTRIBUTE);
		return attribute instanceof DelegatedAuthContext context ? context : null;
	}

}
