/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.exchange;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import com.sun.net.httpserver.HttpServer;

/**
 * Token endpoint that answers every exchange with a configurable response and records
 * the last form it received.
 */
public class FakeTokenEndpoint implements AutoCloseable {

	public final AtomicInteger requests = new AtomicInteger();

	public final AtomicReference<Map<String, String>> lastForm = new AtomicReference<>();

	public final AtomicReference<String> lastContentType = new AtomicReference<>();

	public final AtomicInteger status = new AtomicInteger(200);

	public final AtomicReference<String> body = new AtomicReference<>(
			"{\"token_type\":\"Bearer\",\"access_token\":\"downstream-1\",\"expires_in\":3600,\"scope\":\"https://graph.microsoft.com/.default\"}");

	public final AtomicLong delayMillis = new AtomicLong();

	private final ExecutorService executor = Executors.newCachedThreadPool();

	private final HttpServer server;

	public FakeTokenEndpoint() throws IOException {
		server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
		server.setExecutor(executor);
		server.createContext("/token", exchange -> {
			int count = requests.incrementAndGet();
			lastContentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
			lastForm.set(parseForm(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8)));
			long delay = delayMillis.get();
			if (delay > 0) {
				try {
					Thread.sleep(delay);
				}
				catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
			}
			byte[] bytes = body.get().replace("{n}", String.valueOf(count)).getBytes(StandardCharsets.UTF_8);
			exchange.getResponseHeaders().set("Content-Type", "application/json");
			exchange.sendResponseHeaders(status.get(), bytes.length);
			try (OutputStream out = exchange.getResponseBody()) {
				out.write(bytes);
			}
		});
		server.start();
	}

	public URI uri() {
		return URI.create("http://localhost:" + server.getAddress().getPort() + "/token");
	}

	private static Map<String, String> parseForm(String form) {
		Map<String, String> params = new LinkedHashMap<>();
		for (String pair : form.split("&")) {
			int eq = pair.indexOf('=');
			if (eq > 0) {
				params.put(URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8),
						URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
			}
		}
		return params;
	}

	@Override
	public void close() {
		server.stop(0);
		executor.shutdownNow();
	}

}
