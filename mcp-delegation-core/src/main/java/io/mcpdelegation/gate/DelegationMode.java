/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.gate;

/**
 * Where the downstream credential comes from once the inbound credential is accepted.
 */
public enum DelegationMode {

	/** The validated inbound credential is used downstream unchanged. */
	PASS_THROUGH,

	/** The inbound credential is exchanged on behalf of its subject. */
	ON_BEHALF_OF

}
