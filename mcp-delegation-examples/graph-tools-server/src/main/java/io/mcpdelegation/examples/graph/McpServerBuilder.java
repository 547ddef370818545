/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.examples.graph;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.mcpdelegation.server.transport.DelegatedAuthContext;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpStatelessServerFeatures.SyncToolSpecification;
import io.modelcontextprotocol.server.McpStatelessSyncServer;
import io.modelcontextprotocol.server.transport.HttpServletStatelessServerTransport;
import io.modelcontextprotocol.spec.McpSchema.ServerCapabilities;
import io.modelcontextprotocol.spec.McpStatelessServerTransport;

/**
 * Builds the stateless MCP server and its servlet transport.
 * <p>
 * The transport copies the {@link DelegatedAuthContext} that the authorization filter
 * bound to the servlet request into the MCP transport context under
 * {@link #AUTH_CONTEXT_KEY}. Tool handlers read it from there because sync handlers do
 * not run on the servlet thread.
 */
public interface McpServerBuilder {

	String MCP_ENDPOINT = "/mcp";

	String AUTH_CONTEXT_KEY = McpServerBuilder.class.getName() + ".authContext";

	static HttpServletStatelessServerTransport buildTransport(ObjectMapper objectMapper) {
		return HttpServletStatelessServerTransport.builder()
			.messageEndpoint(MCP_ENDPOINT)
			.objectMapper(objectMapper)
			.contextExtractor((request, transportContext) -> {
				DelegatedAuthContext authContext = DelegatedAuthContext.from(request);
				if (authContext != null) {
					transportContext.put(AUTH_CONTEXT_KEY, authContext);
				}
				return transportContext;
			})
			.build();
	}

	static McpStatelessSyncServer buildServer(McpStatelessServerTransport transport, ObjectMapper objectMapper,
			String serverName, String serverVersion, SyncToolSpecification... tools) {
		return McpServer.sync(transport)
			.objectMapper(objectMapper)
			.capabilities(ServerCapabilities.builder().tools(false).build())
			.serverInfo(serverName, serverVersion)
			.tools(tools)
			.build();
	}

}
