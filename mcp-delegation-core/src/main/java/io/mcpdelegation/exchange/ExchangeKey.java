/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.exchange;

import io.mcpdelegation.util.Assert;

/**
 * Identifies an exchanged credential: one per subject and downstream scope.
 *
 * @param subject the subject identifier of the inbound credential
 * @param targetScope the downstream scope requested from the provider
 */
public record ExchangeKey(String subject, String targetScope) {

	public ExchangeKey {
		Assert.hasText(subject, "subject must not be empty");
		Assert.hasText(targetScope, "targetScope must not be empty");
	}

}
