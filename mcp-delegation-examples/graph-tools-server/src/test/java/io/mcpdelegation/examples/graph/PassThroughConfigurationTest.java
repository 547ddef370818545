/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.examples.graph;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;
import java.util.Map;

import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import io.mcpdelegation.config.DelegationGateFactory;
import io.mcpdelegation.config.DelegationProperties;
import io.mcpdelegation.config.DelegationPropertiesLoader;
import io.mcpdelegation.gate.AuthorizationResult;
import io.mcpdelegation.gate.DelegationGate;
import io.mcpdelegation.gate.DelegationMode;
import io.mcpdelegation.gate.DenialReason;
import io.mcpdelegation.policy.ValidationMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Binds the shipped {@code delegation-pass-through.properties} and checks that it accepts
 * Graph credentials only when they carry every scope the tools need.
 */
class PassThroughConfigurationTest {

	private static final String GRAPH_AUDIENCE = "00000003-0000-0000-c000-000000000000";

	private DelegationProperties properties;

	private DelegationGate gate;

	@BeforeEach
	void load() {
		properties = new DelegationPropertiesLoader(Map.of("AZURE_TENANT_ID", "tenant-1"))
			.load("delegation-pass-through.properties");
		gate = new DelegationGateFactory(properties).createGate();
	}

	@Test
	void bindsGraphAudienceAndBothScopes() {
		assertThat(properties.getValidationMode()).isEqualTo(ValidationMode.CLAIMS_ONLY);
		assertThat(properties.getMode()).isEqualTo(DelegationMode.PASS_THROUGH);
		assertThat(properties.getExpectedAudience()).isEqualTo(GRAPH_AUDIENCE);
		assertThat(properties.getIssuer()).isEqualTo("https://sts.windows.net/tenant-1/");
		assertThat(properties.getRequiredScopes()).containsExactlyInAnyOrder("User.Read", "Mail.Read");
		assertThat(properties.getResource()).isEqualTo("http://localhost:8000/mcp");
	}

	@Test
	void userReadAloneIsMissingScope() throws Exception {
		StepVerifier.create(gate.authorize(graphToken("User.Read")))
			.assertNext(result -> assertThat(result).isInstanceOfSatisfying(AuthorizationResult.Denied.class,
					denied -> assertThat(denied.reason()).isEqualTo(DenialReason.MISSING_SCOPE)))
			.verifyComplete();
	}

	@Test
	void userReadAndMailReadPassThroughUnchanged() throws Exception {
		String token = graphToken("User.Read Mail.Read");

		StepVerifier.create(gate.authorize(token))
			.assertNext(result -> assertThat(result).isInstanceOfSatisfying(AuthorizationResult.Ready.class,
					ready -> assertThat(ready.downstreamCredential().token()).isEqualTo(token)))
			.verifyComplete();
	}

	private static String graphToken(String scopes) throws Exception {
		JWTClaimsSet claims = new JWTClaimsSet.Builder().subject("user-9")
			.audience(GRAPH_AUDIENCE)
			.issuer("https://sts.windows.net/tenant-1/")
			.expirationTime(Date.from(Instant.now().plusSeconds(3600)))
			.claim("scp", scopes)
			.build();
		SignedJWT jwt = new SignedJWT(new JWSHeader.Builder(JWSAlgorithm.HS256).build(), claims);
		jwt.sign(new MACSigner("graph-tokens-cannot-be-verified-locally".getBytes(StandardCharsets.UTF_8)));
		return jwt.serialize();
	}

}
