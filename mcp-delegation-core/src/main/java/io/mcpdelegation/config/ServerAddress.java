/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.config;

/**
 * Host and port the HTTP server listens on.
 *
 * @param host the bind host
 * @param port the bind port, {@code 0} for an ephemeral port
 */
public record ServerAddress(String host, int port) {
}
