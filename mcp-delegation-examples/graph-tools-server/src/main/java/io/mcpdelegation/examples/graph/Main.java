/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.examples.graph;

import java.net.http.HttpClient;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.mcpdelegation.config.DelegationGateFactory;
import io.mcpdelegation.config.DelegationProperties;
import io.mcpdelegation.config.DelegationPropertiesLoader;
import io.mcpdelegation.config.ServerAddress;
import io.mcpdelegation.gate.DelegationGate;
import io.mcpdelegation.metadata.ProtectedResourceMetadataPublisher;
import io.mcpdelegation.server.transport.DelegationAuthorizationFilter;
import io.mcpdelegation.server.transport.ProtectedResourceMetadataServlet;
import io.mcpdelegation.util.Utils;
import io.modelcontextprotocol.server.McpStatelessSyncServer;
import io.modelcontextprotocol.server.transport.HttpServletStatelessServerTransport;

public class Main {

	private static final Logger logger = LoggerFactory.getLogger(Main.class);

	private static final String SERVER_NAME = "graph-tools-server";

	private static final String SERVER_VERSION = "0.1.0";

	public static void main(String[] args) {
		String resource = args.length > 0 ? args[0] : DelegationPropertiesLoader.DEFAULT_RESOURCE;
		Properties raw = new DelegationPropertiesLoader().loadRaw(resource);
		DelegationProperties properties = DelegationPropertiesLoader.toDelegationProperties(raw);
		ServerAddress address = DelegationPropertiesLoader.toServerAddress(raw);

		ObjectMapper objectMapper = new ObjectMapper();
		HttpClient httpClient = HttpClient.newBuilder().connectTimeout(properties.getConnectTimeout()).build();

		DelegationGateFactory factory = new DelegationGateFactory(properties, httpClient, objectMapper,
				System::currentTimeMillis);
		DelegationGate gate = factory.createGate();
		ProtectedResourceMetadataPublisher publisher = factory.createMetadataPublisher();

		GraphTools tools = new GraphTools(new GraphApiClient(httpClient, objectMapper,
				GraphApiClient.DEFAULT_BASE_URI, properties.getRequestTimeout()));

		HttpServletStatelessServerTransport transport = McpServerBuilder.buildTransport(objectMapper);
		String serverName = Utils.hasText(properties.getResourceName()) ? properties.getResourceName() : SERVER_NAME;
		McpStatelessSyncServer mcpServer = McpServerBuilder.buildServer(transport, objectMapper, serverName,
				SERVER_VERSION, GraphToolSpecifications.all(tools));

		try (var server = new JettyServer(address.host(), address.port(),
				new DelegationAuthorizationFilter(gate, publisher, objectMapper),
				new ProtectedResourceMetadataServlet(publisher, objectMapper), publisher.wellKnownPath(), transport)) {
			logger.info("Serving MCP on http://{}:{}{} ({} mode), metadata at {}", address.host(), server.getPort(),
					McpServerBuilder.MCP_ENDPOINT, gate.getMode(), publisher.metadataUrl());
			Thread.currentThread().join();
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.info("Shutting down");
		}
		catch (Exception e) {
			logger.error("Server failed", e);
			System.exit(1);
		}
		finally {
			mcpServer.close();
		}
	}

}
