/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.examples.graph;

import java.net.http.HttpClient;
import java.time.Duration;
import java.time.Instant;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpdelegation.exchange.DownstreamCredential;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphToolsTest {

	private static final DownstreamCredential CREDENTIAL = new DownstreamCredential("graph-token", "Bearer", null,
			Instant.now(), Instant.now().plusSeconds(3600));

	private FakeGraphApi graphApi;

	private GraphTools tools;

	@BeforeEach
	void setUp() throws Exception {
		graphApi = new FakeGraphApi();
		tools = new GraphTools(new GraphApiClient(HttpClient.newHttpClient(), new ObjectMapper(),
				graphApi.baseUri(), Duration.ofSeconds(5)));
	}

	@AfterEach
	void tearDown() {
		graphApi.close();
	}

	@Test
	void helloGreetsByDisplayName() {
		graphApi.respond("/me", "{\"displayName\":\"Ada Lovelace\",\"id\":\"1\"}");

		assertThat(tools.hello(CREDENTIAL)).isEqualTo("Hello, Ada Lovelace!");
		assertThat(graphApi.authorizations()).containsExactly("Bearer graph-token");
	}

	@Test
	void junkEmailsAreListedOnePerLine() {
		graphApi.respond(GraphTools.JUNK_EMAILS_PATH, """
				{"value": [
					{"subject": "You won", "from": {"emailAddress": {"address": "prize@spam.example"}},
					 "receivedDateTime": "2026-10-01T08:00:00Z"},
					{"subject": "No sender", "receivedDateTime": "2026-10-02T09:30:00Z"}
				]}
				""");

		assertThat(tools.listJunkEmails(CREDENTIAL))
			.isEqualTo("- You won (from: prize@spam.example, 2026-10-01T08:00:00Z)\n"
					+ "- No sender (from: unknown, 2026-10-02T09:30:00Z)");
	}

	@Test
	void emptyJunkFolder() {
		graphApi.respond(GraphTools.JUNK_EMAILS_PATH, "{\"value\": []}");

		assertThat(tools.listJunkEmails(CREDENTIAL)).isEqualTo("No junk emails found.");
	}

	@Test
	void graphErrorStatusIsReported() {
		graphApi.respond("/me", "{\"error\":{\"code\":\"InvalidAuthenticationToken\"}}");
		graphApi.status(401);

		assertThatThrownBy(() -> tools.hello(CREDENTIAL)).isInstanceOf(GraphApiException.class)
			.hasMessageContaining("HTTP 401")
			.satisfies(e -> assertThat(((GraphApiException) e).getStatusCode()).isEqualTo(401));
	}

}
