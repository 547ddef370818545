/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.server.transport;

import java.io.IOException;
import java.util.concurrent.CompletionException;

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.mcpdelegation.metadata.ProtectedResourceMetadata;
import io.mcpdelegation.metadata.ProtectedResourceMetadataPublisher;
import io.mcpdelegation.util.Assert;

/**
 * Serves the protected resource metadata document. Map it to
 * {@link ProtectedResourceMetadataPublisher#wellKnownPath()}, outside the authorization
 * filter.
 */
public class ProtectedResourceMetadataServlet extends HttpServlet {

	private static final long serialVersionUID = 1L;

	private static final Logger logger = LoggerFactory.getLogger(ProtectedResourceMetadataServlet.class);

	private final transient ProtectedResourceMetadataPublisher publisher;

	private final transient ObjectMapper objectMapper;

	public ProtectedResourceMetadataServlet(ProtectedResourceMetadataPublisher publisher, ObjectMapper objectMapper) {
		Assert.notNull(publisher, "publisher must not be null");
		Assert.notNull(objectMapper, "objectMapper must not be null");
		this.publisher = publisher;
		this.objectMapper = objectMapper;
	}

	@Override
	protected void doGet(HttpServletRequest request, HttpServletResponse response) throws IOException {
		try {
			ProtectedResourceMetadata metadata = publisher.handle().join();
			response.setContentType("application/json");
			response.setCharacterEncoding("UTF-8");
			response.setStatus(HttpServletResponse.SC_OK);
			objectMapper.writeValue(response.getOutputStream(), metadata);
		}
		catch (CompletionException ex) {
			logger.error("Failed to produce protected resource metadata", ex);
			response.setStatus(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
		}
	}

}
