/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.examples.graph;

import java.util.function.BiFunction;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mcpdelegation.exchange.DownstreamCredential;
import io.mcpdelegation.server.transport.DelegatedAuthContext;
import io.modelcontextprotocol.server.McpStatelessServerFeatures.SyncToolSpecification;
import io.modelcontextprotocol.server.McpTransportContext;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpSchema.CallToolResult;

/**
 * MCP tool specifications for {@link GraphTools}. Handlers take the caller's downstream
 * credential from the transport context populated by
 * {@link McpServerBuilder#buildTransport}.
 */
public final class GraphToolSpecifications {

	private static final Logger logger = LoggerFactory.getLogger(GraphToolSpecifications.class);

	static final String NO_ARGUMENTS_SCHEMA = """
			{
				"type": "object",
				"properties": {}
			}
			""";

	private GraphToolSpecifications() {
	}

	public static SyncToolSpecification[] all(GraphTools tools) {
		return new SyncToolSpecification[] { hello(tools), listJunkEmails(tools) };
	}

	public static SyncToolSpecification hello(GraphTools tools) {
		return specification(GraphTools.HELLO, "Say hello using your Microsoft profile name.", tools::hello);
	}

	public static SyncToolSpecification listJunkEmails(GraphTools tools) {
		return specification(GraphTools.LIST_JUNK_EMAILS, "List your 5 most recent junk emails.",
				tools::listJunkEmails);
	}

	private static SyncToolSpecification specification(String name, String description,
			Function<DownstreamCredential, String> body) {
		McpSchema.Tool tool = McpSchema.Tool.builder()
			.name(name)
			.description(description)
			.inputSchema(NO_ARGUMENTS_SCHEMA)
			.build();
		return SyncToolSpecification.builder().tool(tool).callHandler(handler(name, body)).build();
	}

	static BiFunction<McpTransportContext, McpSchema.CallToolRequest, CallToolResult> handler(String name,
			Function<DownstreamCredential, String> body) {
		return (transportContext, callToolRequest) -> {
			Object authContext = transportContext.get(McpServerBuilder.AUTH_CONTEXT_KEY);
			if (!(authContext instanceof DelegatedAuthContext delegated)) {
				return error("No access token available");
			}
			try {
				return CallToolResult.builder().addTextContent(body.apply(delegated.getDownstreamCredential())).build();
			}
			catch (GraphApiException e) {
				logger.warn("Tool {} failed for subject {}: {}", name, delegated.getSubject(), e.getMessage());
				return error(e.getMessage());
			}
		};
	}

	private static CallToolResult error(String message) {
		return CallToolResult.builder().addTextContent(message).isError(true).build();
	}

}
