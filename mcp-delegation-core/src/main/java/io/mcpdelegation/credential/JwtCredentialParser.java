/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.credential;

import java.text.ParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jwt.JWT;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.JWTParser;
import com.nimbusds.jwt.SignedJWT;

import io.mcpdelegation.util.Utils;

/**
 * Decodes a compact JWS bearer credential into a {@link ClaimSet}.
 * <p>
 * Decoding is structural only: the signature segment must be present but is not
 * verified here. Credentials whose signature cannot be verified by a third party, such
 * as Microsoft Graph access tokens that carry a {@code nonce} header for
 * proof-of-possession, decode like any other credential.
 * <p>
 * Instances are stateless and thread-safe.
 */
public class JwtCredentialParser {

	static final String SCP_CLAIM = "scp";

	static final String SCOPE_CLAIM = "scope";

	/**
	 * Decode the given credential.
	 * @param rawCredential the bearer credential exactly as presented
	 * @return the decoded claims
	 * @throws MalformedCredentialException if the credential is not a signed JWT or a
	 * required claim ({@code sub}, {@code aud}, {@code iss}, {@code exp}) is missing or
	 * mistyped
	 */
	public ClaimSet parse(String rawCredential) throws MalformedCredentialException {
		if (!Utils.hasText(rawCredential)) {
			throw new MalformedCredentialException("Credential is empty");
		}

		JWT jwt;
		try {
			jwt = JWTParser.parse(rawCredential.trim());
		}
		catch (ParseException e) {
			throw new MalformedCredentialException("Credential is not a well-formed JWT", e);
		}

		if (!(jwt instanceof SignedJWT signedJwt)) {
			throw new MalformedCredentialException("Credential must be a signed JWT");
		}

		JWTClaimsSet claims;
		try {
			claims = signedJwt.getJWTClaimsSet();
		}
		catch (ParseException e) {
			throw new MalformedCredentialException("Credential payload is not a JSON object", e);
		}

		JWSHeader header = signedJwt.getHeader();

		String subject = requireText(claims.getSubject(), "sub");
		String issuer = requireText(claims.getIssuer(), "iss");
		List<String> audiences = claims.getAudience();
		if (audiences == null || audiences.isEmpty() || audiences.stream().anyMatch(a -> !Utils.hasText(a))) {
			throw new MalformedCredentialException("Credential has no usable 'aud' claim");
		}
		Date expiration = claims.getExpirationTime();
		if (expiration == null) {
			throw new MalformedCredentialException("Credential has no usable 'exp' claim");
		}

		return new ClaimSet(subject, audiences, issuer, expiration.toInstant(), extractScopes(claims),
				firstStringClaim(claims, "appid", "azp"), header.getKeyID(), header.getAlgorithm().getName(),
				Collections.unmodifiableMap(new LinkedHashMap<>(claims.getClaims())));
	}

	private static String requireText(String value, String claimName) throws MalformedCredentialException {
		if (!Utils.hasText(value)) {
			throw new MalformedCredentialException("Credential has no usable '" + claimName + "' claim");
		}
		return value;
	}

	private static List<String> extractScopes(JWTClaimsSet claims) throws MalformedCredentialException {
		Object scopeClaim = claims.getClaim(SCP_CLAIM);
		String claimName = SCP_CLAIM;
		if (scopeClaim == null) {
			scopeClaim = claims.getClaim(SCOPE_CLAIM);
			claimName = SCOPE_CLAIM;
		}

		if (scopeClaim == null) {
			return List.of();
		}
		if (scopeClaim instanceof String scopeString) {
			return splitScopes(scopeString);
		}
		if (scopeClaim instanceof List<?> scopeList) {
			List<String> scopes = new ArrayList<>(scopeList.size());
			for (Object scope : scopeList) {
				if (!(scope instanceof String s)) {
					throw new MalformedCredentialException("Credential '" + claimName + "' claim must hold strings");
				}
				scopes.addAll(splitScopes(s));
			}
			return scopes;
		}
		throw new MalformedCredentialException("Credential '" + claimName + "' claim has an unsupported type");
	}

	private static List<String> splitScopes(String scopes) {
		if (scopes.isBlank()) {
			return List.of();
		}
		return Arrays.asList(scopes.trim().split("\\s+"));
	}

	private static String firstStringClaim(JWTClaimsSet claims, String... names) {
		for (String name : names) {
			if (claims.getClaim(name) instanceof String value && Utils.hasText(value)) {
				return value;
			}
		}
		return null;
	}

}
