/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.examples.graph;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.mcpdelegation.exchange.DownstreamCredential;
import io.mcpdelegation.util.Assert;

/**
 * Authenticated GET requests against Microsoft Graph using the downstream credential
 * produced by the delegation gate.
 */
public class GraphApiClient {

	private static final Logger logger = LoggerFactory.getLogger(GraphApiClient.class);

	public static final URI DEFAULT_BASE_URI = URI.create("https://graph.microsoft.com/v1.0");

	private final HttpClient httpClient;

	private final ObjectMapper objectMapper;

	private final String baseUri;

	private final Duration requestTimeout;

	public GraphApiClient(HttpClient httpClient, ObjectMapper objectMapper) {
		this(httpClient, objectMapper, DEFAULT_BASE_URI, Duration.ofSeconds(30));
	}

	public GraphApiClient(HttpClient httpClient, ObjectMapper objectMapper, URI baseUri, Duration requestTimeout) {
		Assert.notNull(httpClient, "httpClient must not be null");
		Assert.notNull(objectMapper, "objectMapper must not be null");
		Assert.notNull(baseUri, "baseUri must not be null");
		Assert.notNull(requestTimeout, "requestTimeout must not be null");
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
		String base = baseUri.toString();
		this.baseUri = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
		this.requestTimeout = requestTimeout;
	}

	/**
	 * GET a Graph resource.
	 * @param path path and query relative to the API root, starting with {@code /}
	 * @param credential the credential to present
	 * @return the parsed JSON body
	 * @throws GraphApiException if the request fails, times out or returns a non-2xx
	 * status
	 */
	public JsonNode get(String path, DownstreamCredential credential) {
		Assert.hasText(path, "path must not be empty");
		Assert.notNull(credential, "credential must not be null");

		HttpRequest request = HttpRequest.newBuilder(URI.create(baseUri + path))
			.header("Authorization", credential.authorizationHeaderValue())
			.header("Accept", "application/json")
			.timeout(requestTimeout)
			.GET()
			.build();

		HttpResponse<String> response;
		try {
			response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
		}
		catch (HttpTimeoutException e) {
			throw new GraphApiException("Graph request timed out: GET " + path, e);
		}
		catch (IOException e) {
			throw new GraphApiException("Graph request failed: GET " + path, e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GraphApiException("Interrupted while calling Graph: GET " + path, e);
		}

		if (response.statusCode() / 100 != 2) {
			logger.warn("Graph returned HTTP {} for GET {}", response.statusCode(), path);
			throw new GraphApiException("Graph returned HTTP " + response.statusCode() + " for GET " + path,
					response.statusCode());
		}

		try {
			return objectMapper.readTree(response.body());
		}
		catch (IOException e) {
			throw new GraphApiException("Graph returned an unreadable body for GET " + path, e);
		}
	}

}
