/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.examples.server;

import ch.qos.logback.classic.Level;
import io.mcpengine.json.McpJsonDefaults;
import io.mcpengine.json.McpJsonMapper;
import io.mcpengine.server.McpServer;
import io.mcpengine.server.transport.StdioServerTransportProvider;
import io.mcpengine.server.transport.TcpServerTransportProvider;
import io.mcpengine.spec.McpSchema.Implementation;
import io.mcpengine.spec.McpServerTransportProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the example server until the client disconnects (stdio) or the process is
 * stopped (TCP). Standard output carries protocol messages only; logs go to standard
 * error.
 */
public class Main {

	private static final Logger logger = LoggerFactory.getLogger(Main.class);

	static final Implementation SERVER_INFO = new Implementation("mcp-tool-server", "1.0.0");

	public static void main(String[] args) {
		ServerOptions options;
		try {
			options = ServerOptions.load(System.getenv(), args);
		}
		catch (IllegalArgumentException e) {
			System.err.println(e.getMessage());
			System.err.print(ServerOptions.usage());
			System.exit(2);
			return;
		}
		if (options.isHelp()) {
			System.err.print(ServerOptions.usage());
			return;
		}
		if (options.isDebug()) {
			enableDebugLogging();
		}
		logger.info("Starting {} {} with {}", SERVER_INFO.name(), SERVER_INFO.version(), options);

		McpServer server = buildServer(options, createTransportProvider(options));
		Runtime.getRuntime().addShutdownHook(new Thread(server::close, "mcp-shutdown"));
		server.onClose().block();
		server.close();
		logger.info("{} stopped", SERVER_INFO.name());
	}

	static McpServerTransportProvider createTransportProvider(ServerOptions options) {
		McpJsonMapper jsonMapper = McpJsonDefaults.getMapper();
		if (options.transport() == ServerOptions.Transport.TCP) {
			return new TcpServerTransportProvider(jsonMapper, options.createFramer(), options.host(), options.port());
		}
		return new StdioServerTransportProvider(jsonMapper, options.createFramer());
	}

	static McpServer buildServer(ServerOptions options, McpServerTransportProvider transportProvider) {
		return McpServer.builder(transportProvider)
			.serverInfo(SERVER_INFO)
			.instructions("Example server with arithmetic, echo and a cancellable long-running task")
			.tools(Tools.all())
			.resources(Resources.info(SERVER_INFO), Resources.config(options))
			.prompts(Prompts.all())
			.notificationMode(options.notificationMode())
			.notificationPollInterval(options.notificationPollInterval())
			.build();
	}

	private static void enableDebugLogging() {
		if (LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME) instanceof ch.qos.logback.classic.Logger root) {
			root.setLevel(Level.DEBUG);
		}
	}

}
