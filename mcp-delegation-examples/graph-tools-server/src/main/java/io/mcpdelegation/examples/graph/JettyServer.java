/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.examples.graph;

import java.net.InetSocketAddress;
import java.util.EnumSet;

import jakarta.servlet.DispatcherType;
import jakarta.servlet.Filter;
import jakarta.servlet.http.HttpServlet;

import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.FilterHolder;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;

public class JettyServer implements AutoCloseable {

	private final Server server;

	public JettyServer(String host, int port, Filter authorizationFilter, HttpServlet metadataServlet,
			String metadataPath, HttpServlet mcpServlet) {
		server = new Server(new InetSocketAddress(host, port));

		ServletContextHandler context = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
		context.setContextPath("/");
		server.setHandler(context);

		context.addServlet(new ServletHolder(metadataServlet), metadataPath);
		context.addServlet(new ServletHolder(mcpServlet), McpServerBuilder.MCP_ENDPOINT);
		context.addFilter(new FilterHolder(authorizationFilter), McpServerBuilder.MCP_ENDPOINT,
				EnumSet.of(DispatcherType.REQUEST));

		try {
			server.start();
		}
		catch (Exception e) {
			throw new IllegalStateException("Failed to start Jetty on " + host + ":" + port, e);
		}
	}

	public int getPort() {
		return ((ServerConnector) server.getConnectors()[0]).getLocalPort();
	}

	@Override
	public void close() throws Exception {
		server.stop();
	}

}
