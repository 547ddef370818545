/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.policy;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.text.ParseException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.LongSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;

import io.mcpdelegation.util.Assert;
import io.mcpdelegation.util.Utils;

/**
 * {@link SigningKeySource} backed by the issuer's JWK set, fetched over HTTP and cached
 * for the whole process.
 * <p>
 * The key set location is either configured directly or read from the {@code jwks_uri}
 * of an OpenID discovery document. The cached set is refreshed once it is older than
 * the refresh interval. A lookup for an unknown key id refreshes the set early, at most
 * once per minimum refresh interval, so that key rotation is picked up without letting
 * arbitrary key ids drive traffic to the issuer.
 * <p>
 * Concurrent refreshes are coalesced into a single request. Every request carries a
 * timeout; a failed or timed out fetch completes the lookup exceptionally and is not
 * retried.
 */
public class CachingSigningKeySource implements SigningKeySource {

	private static final Logger logger = LoggerFactory.getLogger(CachingSigningKeySource.class);

	private final HttpClient httpClient;

	private final ObjectMapper objectMapper;

	private final URI discoveryUri;

	private final Duration refreshInterval;

	private final Duration minRefreshInterval;

	private final Duration requestTimeout;

	private final LongSupplier currentTimeMillisSupplier;

	private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

	private final AtomicReference<CompletableFuture<JWKSet>> inFlightRefresh = new AtomicReference<>();

	private volatile URI jwksUri;

	// guarded by lock
	private JWKSet keySet;

	// guarded by lock
	private long fetchedAtMillis;

	private CachingSigningKeySource(Builder builder) {
		this.httpClient = builder.httpClient;
		this.objectMapper = builder.objectMapper;
		this.jwksUri = builder.jwksUri;
		this.discoveryUri = builder.discoveryUri;
		this.refreshInterval = builder.refreshInterval;
		this.minRefreshInterval = builder.minRefreshInterval;
		this.requestTimeout = builder.requestTimeout;
		this.currentTimeMillisSupplier = builder.currentTimeMillisSupplier;
	}

	@Override
	public CompletableFuture<JWK> getKey(String keyId) {
		if (!Utils.hasText(keyId)) {
			return CompletableFuture.failedFuture(new SigningKeyException("Credential header has no 'kid'"));
		}

		JWKSet cached;
		long fetchedAt;
		lock.readLock().lock();
		try {
			cached = this.keySet;
			fetchedAt = this.fetchedAtMillis;
		}
		finally {
			lock.readLock().unlock();
		}

		long age = currentTimeMillisSupplier.getAsLong() - fetchedAt;
		if (cached != null && age < refreshInterval.toMillis()) {
			JWK key = cached.getKeyByKeyId(keyId);
			if (key != null) {
				return CompletableFuture.completedFuture(key);
			}
			if (age < minRefreshInterval.toMillis()) {
				return CompletableFuture
					.failedFuture(new SigningKeyException("No signing key with id '" + keyId + "'"));
			}
			logger.debug("Signing key '{}' is not in the cached key set, refreshing", keyId);
		}

		return refresh().thenApply(keys -> {
			JWK key = keys.getKeyByKeyId(keyId);
			if (key == null) {
				throw new CompletionException(new SigningKeyException("No signing key with id '" + keyId + "'"));
			}
			return key;
		});
	}

	/**
	 * Fetch the key set, joining a fetch that is already in flight.
	 * @return a future private to the caller; cancelling it does not abort the fetch
	 */
	CompletableFuture<JWKSet> refresh() {
		CompletableFuture<JWKSet> created = new CompletableFuture<>();
		CompletableFuture<JWKSet> existing = inFlightRefresh.compareAndExchange(null, created);
		if (existing != null) {
			return existing.copy();
		}

		try {
			resolveJwksUri().thenCompose(this::fetchKeySet).whenComplete((keys, ex) -> {
				if (ex == null) {
					store(keys);
				}
				inFlightRefresh.compareAndSet(created, null);
				if (ex != null) {
					SigningKeyException failure = toSigningKeyException(ex);
					logger.warn("Signing key set refresh failed: {}", failure.getMessage());
					created.completeExceptionally(failure);
				}
				else {
					created.complete(keys);
				}
			});
		}
		catch (RuntimeException e) {
			inFlightRefresh.compareAndSet(created, null);
			created.completeExceptionally(toSigningKeyException(e));
		}
		return created.copy();
	}

	private void store(JWKSet keys) {
		lock.writeLock().lock();
		try {
			this.keySet = keys;
			this.fetchedAtMillis = currentTimeMillisSupplier.getAsLong();
		}
		finally {
			lock.writeLock().unlock();
		}
		logger.info("Loaded {} signing key(s) from {}", keys.getKeys().size(), jwksUri);
	}

	private CompletableFuture<URI> resolveJwksUri() {
		URI known = this.jwksUri;
		if (known != null) {
			return CompletableFuture.completedFuture(known);
		}

		HttpRequest request = HttpRequest.newBuilder(discoveryUri)
			.header("Accept", "application/json")
			.timeout(requestTimeout)
			.GET()
			.build();

		return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString()).thenApply(response -> {
			if (response.statusCode() != 200) {
				throw new CompletionException(new SigningKeyException(
						"Failed to fetch discovery document: HTTP " + response.statusCode()));
			}
			try {
				JsonNode document = objectMapper.readTree(response.body());
				JsonNode jwksUriNode = document != null ? document.get("jwks_uri") : null;
				if (jwksUriNode == null || !jwksUriNode.isTextual()) {
					throw new CompletionException(
							new SigningKeyException("Discovery document has no 'jwks_uri' at " + discoveryUri));
				}
				URI resolved = URI.create(jwksUriNode.asText());
				this.jwksUri = resolved;
				return resolved;
			}
			catch (IOException | IllegalArgumentException e) {
				throw new CompletionException(new SigningKeyException("Failed to parse discovery document", e));
			}
		});
	}

	private CompletableFuture<JWKSet> fetchKeySet(URI uri) {
		HttpRequest request = HttpRequest.newBuilder(uri)
			.header("Accept", "application/json")
			.timeout(requestTimeout)
			.GET()
			.build();

		return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString()).thenApply(response -> {
			if (response.statusCode() != 200) {
				throw new CompletionException(
						new SigningKeyException("Failed to fetch signing key set: HTTP " + response.statusCode()));
			}
			try {
				return JWKSet.parse(response.body());
			}
			catch (ParseException e) {
				throw new CompletionException(new SigningKeyException("Failed to parse signing key set", e));
			}
		});
	}

	private static SigningKeyException toSigningKeyException(Throwable throwable) {
		Throwable cause = Utils.unwrap(throwable);
		if (cause instanceof SigningKeyException signingKeyException) {
			return signingKeyException;
		}
		if (cause instanceof HttpTimeoutException) {
			return new SigningKeyException("Timed out fetching signing keys", cause);
		}
		return new SigningKeyException("Failed to fetch signing keys", cause);
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {

		private HttpClient httpClient;

		private ObjectMapper objectMapper;

		private URI jwksUri;

		private URI discoveryUri;

		private Duration refreshInterval = Duration.ofHours(1);

		private Duration minRefreshInterval = Duration.ofMinutes(5);

		private Duration requestTimeout = Duration.ofSeconds(30);

		private LongSupplier currentTimeMillisSupplier = System::currentTimeMillis;

		public Builder httpClient(HttpClient httpClient) {
			this.httpClient = httpClient;
			return this;
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			this.objectMapper = objectMapper;
			return this;
		}

		/**
		 * Location of the JWK set. Takes precedence over the discovery document.
		 * @param jwksUri the key set URI
		 * @return this builder
		 */
		public Builder jwksUri(URI jwksUri) {
			this.jwksUri = jwksUri;
			return this;
		}

		/**
		 * Location of the OpenID discovery document holding {@code jwks_uri}.
		 * @param discoveryUri the discovery document URI
		 * @return this builder
		 */
		public Builder discoveryUri(URI discoveryUri) {
			this.discoveryUri = discoveryUri;
			return this;
		}

		public Builder refreshInterval(Duration refreshInterval) {
			this.refreshInterval = refreshInterval;
			return this;
		}

		public Builder minRefreshInterval(Duration minRefreshInterval) {
			this.minRefreshInterval = minRefreshInterval;
			return this;
		}

		public Builder requestTimeout(Duration requestTimeout) {
			this.requestTimeout = requestTimeout;
			return this;
		}

		public Builder currentTimeMillisSupplier(LongSupplier currentTimeMillisSupplier) {
			this.currentTimeMillisSupplier = currentTimeMillisSupplier;
			return this;
		}

		public CachingSigningKeySource build() {
			Assert.notNull(httpClient, "httpClient must not be null");
			Assert.notNull(objectMapper, "objectMapper must not be null");
			Assert.isTrue(jwksUri != null || discoveryUri != null, "Either jwksUri or discoveryUri must be set");
			Assert.notNull(refreshInterval, "refreshInterval must not be null");
			Assert.notNull(minRefreshInterval, "minRefreshInterval must not be null");
			Assert.isTrue(!requestTimeout.isNegative() && !requestTimeout.isZero(), "requestTimeout must be positive");
			Assert.notNull(currentTimeMillisSupplier, "currentTimeMillisSupplier must not be null");
			return new CachingSigningKeySource(this);
		}

	}

}
