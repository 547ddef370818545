/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.metadata;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

import io.mcpdelegation.util.Assert;

/**
 * Publishes the protected resource metadata document. The document is fixed for the
 * lifetime of the deployment.
 */
public class ProtectedResourceMetadataPublisher {

	public static final String WELL_KNOWN_PREFIX = "/.well-known/oauth-protected-resource";

	private final ProtectedResourceMetadata metadata;

	private final String wellKnownPath;

	private final String metadataUrl;

	public ProtectedResourceMetadataPublisher(ProtectedResourceMetadata metadata) {
		Assert.notNull(metadata, "metadata must not be null");
		URI resource = URI.create(metadata.resource());
		Assert.isTrue(resource.getScheme() != null && resource.getRawAuthority() != null,
				"resource must be an absolute URI");
		this.metadata = metadata;
		this.wellKnownPath = WELL_KNOWN_PREFIX + resourcePath(resource);
		this.metadataUrl = resource.getScheme() + "://" + resource.getRawAuthority() + this.wellKnownPath;
	}

	/**
	 * Handle a metadata request.
	 * @return A CompletableFuture that resolves to the metadata document
	 */
	public CompletableFuture<ProtectedResourceMetadata> handle() {
		return CompletableFuture.completedFuture(metadata);
	}

	public ProtectedResourceMetadata getMetadata() {
		return metadata;
	}

	/**
	 * @return the path the document is served at, e.g.
	 * {@code /.well-known/oauth-protected-resource/mcp} for resource
	 * {@code https://host/mcp}
	 */
	public String wellKnownPath() {
		return wellKnownPath;
	}

	/**
	 * @return the absolute document URL, as advertised in {@code WWW-Authenticate}
	 * challenges
	 */
	public String metadataUrl() {
		return metadataUrl;
	}

	private static String resourcePath(URI resource) {
		String path = resource.getRawPath();
		if (path == null || path.isEmpty() || "/".equals(path)) {
			return "";
		}
		return path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
	}

}
