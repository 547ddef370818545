/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.exchange;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.mcpdelegation.credential.ClaimSet;
import io.mcpdelegation.util.Assert;
import io.mcpdelegation.util.Utils;

/**
 * {@link TokenExchangeClient} that performs an OAuth 2.0 on-behalf-of exchange against
 * the identity provider's token endpoint.
 * <p>
 * The service authenticates with its client id and secret in the form body and presents
 * the inbound credential as the subject token, following the configured
 * {@link ExchangeGrant}. Results are cached per subject and target scope in an
 * {@link ExchangeCache}; concurrent requests for the same key share one exchange.
 * <p>
 * A rejected, failed or timed out exchange completes the returned future with a
 * {@link TokenExchangeException} and is not retried.
 */
public class OnBehalfOfExchangeClient implements TokenExchangeClient {

	private static final Logger logger = LoggerFactory.getLogger(OnBehalfOfExchangeClient.class);

	private final HttpClient httpClient;

	private final ObjectMapper objectMapper;

	private final URI tokenEndpoint;

	private final String clientId;

	private final String clientSecret;

	private final ExchangeGrant grant;

	private final Duration requestTimeout;

	private final ExchangeCache cache;

	private final LongSupplier currentTimeMillisSupplier;

	private final AtomicLong exchangeCount = new AtomicLong();

	private OnBehalfOfExchangeClient(Builder builder) {
		this.httpClient = builder.httpClient;
		this.objectMapper = builder.objectMapper;
		this.tokenEndpoint = builder.tokenEndpoint;
		this.clientId = builder.clientId;
		this.clientSecret = builder.clientSecret;
		this.grant = builder.grant;
		this.requestTimeout = builder.requestTimeout;
		this.cache = builder.cache;
		this.currentTimeMillisSupplier = builder.currentTimeMillisSupplier;
	}

	@Override
	public CompletableFuture<DownstreamCredential> exchange(ClaimSet claimSet, String rawCredential,
			String targetScope) {
		Assert.notNull(claimSet, "claimSet must not be null");
		Assert.hasText(rawCredential, "rawCredential must not be empty");
		ExchangeKey key = new ExchangeKey(claimSet.subject(), targetScope);
		return cache.getOrLoad(key, () -> requestExchange(key, rawCredential));
	}

	/**
	 * @return the number of exchange requests sent to the token endpoint
	 */
	public long getExchangeCount() {
		return exchangeCount.get();
	}

	private CompletableFuture<DownstreamCredential> requestExchange(ExchangeKey key, String rawCredential) {
		Instant issuedAt = Instant.ofEpochMilli(currentTimeMillisSupplier.getAsLong());

		Map<String, String> formData = new LinkedHashMap<>();
		formData.put("grant_type", grant.grantType());
		formData.put("client_id", clientId);
		formData.put("client_secret", clientSecret);
		grant.addSubjectToken(formData, rawCredential);
		formData.put("scope", key.targetScope());

		HttpRequest request = HttpRequest.newBuilder(tokenEndpoint)
			.header("Content-Type", "application/x-www-form-urlencoded")
			.header("Accept", "application/json")
			.timeout(requestTimeout)
			.POST(HttpRequest.BodyPublishers.ofString(Utils.formEncode(formData)))
			.build();

		exchangeCount.incrementAndGet();
		logger.debug("Requesting {} exchange for scope {}", grant, key.targetScope());

		return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString()).handle((response, ex) -> {
			try {
				if (ex != null) {
					throw toExchangeException(ex);
				}
				DownstreamCredential credential = toCredential(response, issuedAt);
				logger.info("Exchanged credential for scope {} (expires {})", key.targetScope(),
						credential.expiresAt());
				return credential;
			}
			catch (TokenExchangeException e) {
				logger.warn("Token exchange for scope {} failed: {}", key.targetScope(), e.getMessage());
				throw new CompletionException(e);
			}
		});
	}

	private DownstreamCredential toCredential(HttpResponse<String> response, Instant issuedAt)
			throws TokenExchangeException {
		if (response.statusCode() != 200) {
			TokenErrorResponse error = readError(response.body());
			String description = error.errorDescription() != null ? error.errorDescription() : error.error();
			throw new TokenExchangeException(
					"Token exchange rejected: " + (description != null ? description : "Unknown error") + " (HTTP "
							+ response.statusCode() + ")",
					response.statusCode(), error.error(), error.errorDescription(), null);
		}

		TokenEndpointResponse tokenResponse;
		try {
			tokenResponse = objectMapper.readValue(response.body(), TokenEndpointResponse.class);
		}
		catch (IOException e) {
			throw new TokenExchangeException("Token exchange response is not valid JSON", 200, null, null, e);
		}

		if (tokenResponse == null || !Utils.hasText(tokenResponse.accessToken())) {
			throw new TokenExchangeException("Token exchange response has no access_token", 200, null, null, null);
		}
		if (tokenResponse.expiresIn() != null && tokenResponse.expiresIn() < 0) {
			throw new TokenExchangeException("Token exchange response has a negative expires_in", 200, null, null,
					null);
		}

		Instant expiresAt = tokenResponse.expiresIn() != null ? issuedAt.plusSeconds(tokenResponse.expiresIn())
				: null;
		String tokenType = Utils.hasText(tokenResponse.tokenType()) ? tokenResponse.tokenType() : "Bearer";
		return new DownstreamCredential(tokenResponse.accessToken(), tokenType, tokenResponse.scope(), issuedAt,
				expiresAt);
	}

	private TokenErrorResponse readError(String body) {
		if (!Utils.hasText(body)) {
			return new TokenErrorResponse(null, null);
		}
		try {
			TokenErrorResponse error = objectMapper.readValue(body, TokenErrorResponse.class);
			return error != null ? error : new TokenErrorResponse(null, null);
		}
		catch (IOException e) {
			logger.debug("Token endpoint error body is not JSON", e);
			return new TokenErrorResponse(null, null);
		}
	}

	private static TokenExchangeException toExchangeException(Throwable throwable) {
		Throwable cause = Utils.unwrap(throwable);
		if (cause instanceof TokenExchangeException exchangeException) {
			return exchangeException;
		}
		if (cause instanceof HttpTimeoutException) {
			return new TokenExchangeException("Token exchange timed out", cause);
		}
		return new TokenExchangeException("Token exchange request failed: " + cause.getMessage(), cause);
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {

		private HttpClient httpClient;

		private ObjectMapper objectMapper;

		private URI tokenEndpoint;

		private String clientId;

		private String clientSecret;

		private ExchangeGrant grant = ExchangeGrant.JWT_BEARER;

		private Duration requestTimeout = Duration.ofSeconds(30);

		private ExchangeCache cache;

		private LongSupplier currentTimeMillisSupplier = System::currentTimeMillis;

		public Builder httpClient(HttpClient httpClient) {
			this.httpClient = httpClient;
			return this;
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			this.objectMapper = objectMapper;
			return this;
		}

		public Builder tokenEndpoint(URI tokenEndpoint) {
			this.tokenEndpoint = tokenEndpoint;
			return this;
		}

		public Builder clientId(String clientId) {
			this.clientId = clientId;
			return this;
		}

		public Builder clientSecret(String clientSecret) {
			this.clientSecret = clientSecret;
			return this;
		}

		public Builder grant(ExchangeGrant grant) {
			this.grant = grant;
			return this;
		}

		public Builder requestTimeout(Duration requestTimeout) {
			this.requestTimeout = requestTimeout;
			return this;
		}

		/**
		 * The cache to store exchanged credentials in. The cache and the client should
		 * share the same clock.
		 * @param cache the exchange cache
		 * @return this builder
		 */
		public Builder cache(ExchangeCache cache) {
			this.cache = cache;
			return this;
		}

		public Builder currentTimeMillisSupplier(LongSupplier currentTimeMillisSupplier) {
			this.currentTimeMillisSupplier = currentTimeMillisSupplier;
			return this;
		}

		public OnBehalfOfExchangeClient build() {
			Assert.notNull(httpClient, "httpClient must not be null");
			Assert.notNull(objectMapper, "objectMapper must not be null");
			Assert.notNull(tokenEndpoint, "tokenEndpoint must not be null");
			Assert.hasText(clientId, "clientId must not be empty");
			Assert.hasText(clientSecret, "clientSecret must not be empty");
			Assert.notNull(grant, "grant must not be null");
			Assert.isTrue(requestTimeout != null && !requestTimeout.isNegative() && !requestTimeout.isZero(),
					"requestTimeout must be positive");
			Assert.notNull(currentTimeMillisSupplier, "currentTimeMillisSupplier must not be null");
			if (cache == null) {
				cache = new ExchangeCache(Duration.ofMinutes(5), currentTimeMillisSupplier);
			}
			return new OnBehalfOfExchangeClient(this);
		}

	}

}
