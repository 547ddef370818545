/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.server.transport;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpdelegation.gate.DelegationGate;
import io.mcpdelegation.metadata.ProtectedResourceMetadata;
import io.mcpdelegation.metadata.ProtectedResourceMetadataPublisher;
import io.mcpdelegation.policy.ClaimsOnlyValidationPolicy;
import io.mcpdelegation.policy.ClaimsValidator;
import org.apache.catalina.LifecycleException;
import org.apache.catalina.LifecycleState;
import org.apache.catalina.startup.Tomcat;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DelegationAuthorizationFilterIntegrationTest {

	private static final int PORT = TomcatTestUtil.findAvailablePort();

	private final ObjectMapper objectMapper = new ObjectMapper();

	private final HttpClient httpClient = HttpClient.newHttpClient();

	private Tomcat tomcat;

	private ProtectedResourceMetadataPublisher publisher;

	@BeforeEach
	void startServer() throws LifecycleException {
		publisher = new ProtectedResourceMetadataPublisher(new ProtectedResourceMetadata(
				"http://localhost:" + PORT + "/tools", List.of(ServletTestCredentials.ISSUER),
				List.of("tools.read", "tools.write")));

		ClaimsValidator claimsValidator = new ClaimsValidator(ServletTestCredentials.AUDIENCE,
				ServletTestCredentials.ISSUER, Set.of("tools.read"), null);
		DelegationGate gate = DelegationGate.builder()
			.policy(new ClaimsOnlyValidationPolicy(claimsValidator))
			.build();

		tomcat = TomcatTestUtil.createTomcatServer("", PORT);
		TomcatTestUtil.addFilter(tomcat, "delegation",
				new DelegationAuthorizationFilter(gate, publisher, objectMapper), "/tools/*");
		TomcatTestUtil.addServlet(tomcat, "metadata", new ProtectedResourceMetadataServlet(publisher, objectMapper),
				publisher.wellKnownPath());
		TomcatTestUtil.addServlet(tomcat, "whoami", new WhoAmIServlet(), "/tools/*");
		tomcat.start();
		assertThat(tomcat.getServer().getState()).isEqualTo(LifecycleState.STARTED);
	}

	@AfterEach
	void stopServer() throws LifecycleException {
		if (tomcat != null) {
			tomcat.stop();
			tomcat.destroy();
		}
	}

	@Test
	void missingCredentialIsChallenged() throws Exception {
		HttpResponse<String> response = get("/tools/whoami", null);

		assertThat(response.statusCode()).isEqualTo(401);
		assertThat(response.headers().firstValue("WWW-Authenticate")).hasValue(
				"Bearer resource_metadata=\"http://localhost:" + PORT + "/.well-known/oauth-protected-resource/tools\"");
		assertThat(json(response).get("error").asText()).isEqualTo("invalid_request");
	}

	@Test
	void validCredentialReachesTool() throws Exception {
		String token = ServletTestCredentials.validToken();

		HttpResponse<String> response = get("/tools/whoami", token);

		assertThat(response.statusCode()).isEqualTo(200);
		assertThat(response.body()).isEqualTo(ServletTestCredentials.SUBJECT + "|client-7|" + token);
	}

	@Test
	void expiredCredentialIsInvalidToken() throws Exception {
		String token = ServletTestCredentials
			.sign(ServletTestCredentials.claims(Instant.now().minusSeconds(60)).build());

		HttpResponse<String> response = get("/tools/whoami", token);

		assertThat(response.statusCode()).isEqualTo(401);
		assertThat(response.headers().firstValue("WWW-Authenticate").orElseThrow())
			.contains("error=\"invalid_token\"")
			.contains("error_description=\"expired\"");
		JsonNode body = json(response);
		assertThat(body.get("error").asText()).isEqualTo("invalid_token");
		assertThat(body.get("error_description").asText()).isEqualTo("expired");
	}

	@Test
	void missingScopeIsForbidden() throws Exception {
		String token = ServletTestCredentials
			.sign(ServletTestCredentials.claims(Instant.now().plusSeconds(3600)).claim("scp", "other").build());

		HttpResponse<String> response = get("/tools/whoami", token);

		assertThat(response.statusCode()).isEqualTo(403);
		assertThat(response.headers().firstValue("WWW-Authenticate").orElseThrow())
			.contains("error=\"insufficient_scope\"")
			.contains("scope=\"tools.read tools.write\"");
		assertThat(json(response).get("error_description").asText()).isEqualTo("missing-scope");
	}

	@Test
	void garbageCredentialIsMalformed() throws Exception {
		HttpResponse<String> response = get("/tools/whoami", "not-a-jwt");

		assertThat(response.statusCode()).isEqualTo(401);
		assertThat(json(response).get("error_description").asText()).isEqualTo("malformed");
	}

	@Test
	void metadataIsPublicAndDescribesResource() throws Exception {
		HttpResponse<String> response = get(publisher.wellKnownPath(), null);

		assertThat(response.statusCode()).isEqualTo(200);
		assertThat(response.headers().firstValue("Content-Type").orElseThrow()).startsWith("application/json");
		JsonNode body = json(response);
		assertThat(body.get("resource").asText()).isEqualTo("http://localhost:" + PORT + "/tools");
		assertThat(body.get("authorization_servers").get(0).asText()).isEqualTo(ServletTestCredentials.ISSUER);
		assertThat(body.get("scopes_supported")).hasSize(2);
		assertThat(body.get("bearer_methods_supported").get(0).asText()).isEqualTo("header");
	}

	private HttpResponse<String> get(String path, String token) throws IOException, InterruptedException {
		HttpRequest.Builder request = HttpRequest.newBuilder(URI.create("http://localhost:" + PORT + path)).GET();
		if (token != null) {
			request.header("Authorization", "Bearer " + token);
		}
		return httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
	}

	private JsonNode json(HttpResponse<String> response) throws IOException {
		return objectMapper.readTree(response.body());
	}

	static class WhoAmIServlet extends HttpServlet {

		private static final long serialVersionUID = 1L;

		@Override
		protected void doGet(HttpServletRequest request, HttpServletResponse response) throws IOException {
			DelegatedAuthContext context = DelegatedAuthContext.getCurrent();
			response.setContentType("text/plain");
			response.getWriter()
				.write(context.getSubject() + "|" + context.getClientId() + "|"
						+ context.getDownstreamCredential().token());
		}

	}

}
