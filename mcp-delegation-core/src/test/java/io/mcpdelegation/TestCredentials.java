/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation;

import java.time.Instant;
import java.util.Date;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.jwk.gen.RSAKeyGenerator;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;

/**
 * Mints signed JWTs for tests.
 */
public final class TestCredentials {

	public static final String AUDIENCE = "X";

	public static final String ISSUER = "https://issuer/T";

	public static final String SUBJECT = "user-1";

	private static RSAKey signingKey;

	private TestCredentials() {
	}

	/**
	 * @return an RSA key shared by all tests, generated on first use
	 */
	public static synchronized RSAKey signingKey() {
		if (signingKey == null) {
			signingKey = generateKey("test-key-1");
		}
		return signingKey;
	}

	public static RSAKey generateKey(String keyId) {
		try {
			return new RSAKeyGenerator(2048).keyID(keyId).generate();
		}
		catch (JOSEException e) {
			throw new IllegalStateException(e);
		}
	}

	/**
	 * Claims matching {@link #AUDIENCE} and {@link #ISSUER} with scopes {@code A B}.
	 * @param expiresAt the expiry
	 * @return a claims builder to refine
	 */
	public static JWTClaimsSet.Builder claims(Instant expiresAt) {
		return new JWTClaimsSet.Builder().subject(SUBJECT)
			.audience(AUDIENCE)
			.issuer(ISSUER)
			.issueTime(Date.from(expiresAt.minusSeconds(3600)))
			.expirationTime(Date.from(expiresAt))
			.claim("scp", "A B");
	}

	public static String validToken() {
		return sign(claims(Instant.now().plusSeconds(3600)).build());
	}

	public static String sign(JWTClaimsSet claims) {
		return sign(claims, signingKey());
	}

	public static String sign(JWTClaimsSet claims, RSAKey key) {
		return sign(new JWSHeader.Builder(JWSAlgorithm.RS256).keyID(key.getKeyID()).build(), claims, key);
	}

	public static String sign(JWSHeader header, JWTClaimsSet claims, RSAKey key) {
		SignedJWT jwt = new SignedJWT(header, claims);
		try {
			jwt.sign(new RSASSASigner(key));
		}
		catch (JOSEException e) {
			throw new IllegalStateException(e);
		}
		return jwt.serialize();
	}

}
