/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.examples.graph;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import io.mcpdelegation.credential.ClaimSet;
import io.mcpdelegation.exchange.DownstreamCredential;
import io.mcpdelegation.gate.AuthorizationResult;
import io.mcpdelegation.server.transport.DelegatedAuthContext;
import io.modelcontextprotocol.server.McpStatelessServerFeatures.SyncToolSpecification;
import io.modelcontextprotocol.server.McpTransportContext;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpSchema.CallToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class GraphToolSpecificationsTest {

	private final DownstreamCredential credential = new DownstreamCredential("graph-token", "Bearer", null,
			Instant.now(), Instant.now().plusSeconds(3600));

	private final GraphTools tools = mock(GraphTools.class);

	private final McpTransportContext transportContext = mock(McpTransportContext.class);

	@BeforeEach
	void bindAuthContext() {
		ClaimSet claimSet = new ClaimSet("user-9", List.of("00000003-0000-0000-c000-000000000000"),
				"https://sts.windows.net/tenant-1/", Instant.now().plusSeconds(3600), List.of("User.Read"), null,
				null, "RS256", Map.of());
		when(transportContext.get(McpServerBuilder.AUTH_CONTEXT_KEY))
			.thenReturn(new DelegatedAuthContext(new AuthorizationResult.Ready(credential, claimSet)));
	}

	@Test
	void toolsAreDeclaredWithoutArguments() {
		SyncToolSpecification[] specifications = GraphToolSpecifications.all(tools);

		assertThat(specifications).extracting(specification -> specification.tool().name())
			.containsExactly(GraphTools.HELLO, GraphTools.LIST_JUNK_EMAILS);
		assertThat(specifications[0].tool().description()).isEqualTo("Say hello using your Microsoft profile name.");
		assertThat(specifications[1].tool().inputSchema().type()).isEqualTo("object");
		assertThat(specifications[1].tool().inputSchema().properties()).isEmpty();
	}

	@Test
	void helloUsesDownstreamCredentialFromTransportContext() {
		when(tools.hello(credential)).thenReturn("Hello, Grace!");

		CallToolResult result = call(GraphToolSpecifications.hello(tools), GraphTools.HELLO);

		assertThat(result.isError()).isNotEqualTo(Boolean.TRUE);
		assertThat(text(result)).isEqualTo("Hello, Grace!");
		verify(tools).hello(credential);
	}

	@Test
	void graphFailureBecomesToolError() {
		when(tools.listJunkEmails(any())).thenThrow(new GraphApiException("Graph returned HTTP 403 for GET /me", 403));

		CallToolResult result = call(GraphToolSpecifications.listJunkEmails(tools), GraphTools.LIST_JUNK_EMAILS);

		assertThat(result.isError()).isTrue();
		assertThat(text(result)).isEqualTo("Graph returned HTTP 403 for GET /me");
	}

	@Test
	void missingAuthContextIsToolErrorWithoutGraphCall() {
		when(transportContext.get(McpServerBuilder.AUTH_CONTEXT_KEY)).thenReturn(null);

		CallToolResult result = call(GraphToolSpecifications.hello(tools), GraphTools.HELLO);

		assertThat(result.isError()).isTrue();
		assertThat(text(result)).isEqualTo("No access token available");
		verifyNoInteractions(tools);
	}

	private CallToolResult call(SyncToolSpecification specification, String name) {
		return specification.callHandler().apply(transportContext, new McpSchema.CallToolRequest(name, Map.of()));
	}

	private static String text(CallToolResult result) {
		return ((McpSchema.TextContent) result.content().get(0)).text();
	}

}
