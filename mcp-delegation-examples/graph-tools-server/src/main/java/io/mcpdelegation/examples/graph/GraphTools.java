/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.examples.graph;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

import io.mcpdelegation.exchange.DownstreamCredential;
import io.mcpdelegation.util.Assert;

/**
 * The tools exposed by the example server. Each tool reads the signed-in user's data from
 * Microsoft Graph with the caller's downstream credential.
 */
public class GraphTools {

	public static final String HELLO = "hello";

	public static final String LIST_JUNK_EMAILS = "list_junk_emails";

	static final String JUNK_EMAILS_PATH = "/me/mailFolders/junkemail/messages?$top=5&$select=subject,from,receivedDateTime";

	private final GraphApiClient graph;

	public GraphTools(GraphApiClient graph) {
		Assert.notNull(graph, "graph must not be null");
		this.graph = graph;
	}

	/**
	 * Say hello using the caller's Microsoft profile name.
	 */
	public String hello(DownstreamCredential credential) {
		JsonNode me = graph.get("/me", credential);
		return "Hello, " + me.path("displayName").asText() + "!";
	}

	/**
	 * List the caller's five most recent junk emails.
	 */
	public String listJunkEmails(DownstreamCredential credential) {
		JsonNode messages = graph.get(JUNK_EMAILS_PATH, credential).path("value");
		if (!messages.isArray() || messages.isEmpty()) {
			return "No junk emails found.";
		}

		List<String> lines = new ArrayList<>(messages.size());
		for (JsonNode message : messages) {
			String sender = message.path("from").path("emailAddress").path("address").asText("unknown");
			lines.add("- " + message.path("subject").asText() + " (from: " + sender + ", "
					+ message.path("receivedDateTime").asText() + ")");
		}
		return String.join("\n", lines);
	}

}
