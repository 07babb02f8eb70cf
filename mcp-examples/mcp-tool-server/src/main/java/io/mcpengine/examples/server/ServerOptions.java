/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.examples.server;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

import io.mcpengine.server.NotificationDeliveryService;
import io.mcpengine.server.NotificationMode;
import io.mcpengine.spec.FramingMode;
import io.mcpengine.spec.MessageFramer;
import io.mcpengine.util.Utils;

/**
 * Settings of the example server. Values are resolved from the built-in defaults, then
 * the {@code MCP_*} environment variables, then the command line, the last one winning.
 */
public final class ServerOptions {

	public enum Transport {

		STDIO, TCP

	}

	public static final String DEFAULT_HOST = "127.0.0.1";

	public static final int DEFAULT_PORT = 8080;

	public static final int DEFAULT_MAX_MESSAGE_SIZE = MessageFramer.DEFAULT_MAX_MESSAGE_SIZE;

	private Transport transport = Transport.STDIO;

	private String host = DEFAULT_HOST;

	private int port = DEFAULT_PORT;

	private FramingMode framing;

	private int maxMessageSize = DEFAULT_MAX_MESSAGE_SIZE;

	private NotificationMode notificationMode = NotificationMode.ASYNC;

	private Duration notificationPollInterval = NotificationDeliveryService.DEFAULT_POLL_INTERVAL;

	private boolean debug;

	private boolean help;

	private ServerOptions() {
	}

	/**
	 * Resolves the options.
	 * @param env environment variables, usually {@link System#getenv()}
	 * @param args command line arguments
	 * @return the validated options
	 * @throws IllegalArgumentException for unknown options, malformed values or values
	 * out of range
	 */
	public static ServerOptions load(Map<String, String> env, String... args) {
		ServerOptions options = new ServerOptions();
		options.applyEnvironment(env);
		options.applyArguments(args);
		options.validate();
		return options;
	}

	private void applyEnvironment(Map<String, String> env) {
		String value = env.get("MCP_TRANSPORT");
		if (Utils.hasText(value)) {
			this.transport = parseTransport(value);
		}
		value = env.get("MCP_HOST");
		if (value != null) {
			this.host = value.trim();
		}
		value = env.get("MCP_PORT");
		if (Utils.hasText(value)) {
			this.port = parseInt("MCP_PORT", value);
		}
		value = env.get("MCP_FRAMING");
		if (Utils.hasText(value)) {
			this.framing = FramingMode.parse(value);
		}
		value = env.get("MCP_MAX_MESSAGE_SIZE");
		if (Utils.hasText(value)) {
			this.maxMessageSize = parseInt("MCP_MAX_MESSAGE_SIZE", value);
		}
		value = env.get("MCP_NOTIFICATIONS");
		if (Utils.hasText(value)) {
			this.notificationMode = parseNotificationMode(value);
		}
		value = env.get("MCP_DEBUG");
		if (Utils.hasText(value)) {
			this.debug = parseBoolean(value);
		}
	}

	private void applyArguments(String[] args) {
		for (int i = 0; i < args.length; i++) {
			String arg = args[i];
			String name = arg;
			String value = null;
			int eq = arg.indexOf('=');
			if (arg.startsWith("--") && eq > 0) {
				name = arg.substring(0, eq);
				value = arg.substring(eq + 1);
			}
			switch (name) {
				case "--stdio" -> this.transport = Transport.STDIO;
				case "--tcp" -> this.transport = Transport.TCP;
				case "--debug" -> this.debug = true;
				case "--help", "-h" -> this.help = true;
				case "--host", "--port", "--framing", "--max-message-size", "--notifications" -> {
					if (value == null) {
						if (i + 1 >= args.length) {
							throw new IllegalArgumentException("Missing value for " + name);
						}
						value = args[++i];
					}
					applyValue(name, value);
				}
				default -> throw new IllegalArgumentException("Unknown option: " + arg);
			}
		}
	}

	private void applyValue(String name, String value) {
		switch (name) {
			case "--host" -> this.host = value.trim();
			case "--port" -> this.port = parseInt(name, value);
			case "--framing" -> this.framing = FramingMode.parse(value);
			case "--max-message-size" -> this.maxMessageSize = parseInt(name, value);
			case "--notifications" -> this.notificationMode = parseNotificationMode(value);
			default -> throw new IllegalArgumentException("Unknown option: " + name);
		}
	}

	private void validate() {
		if (!Utils.hasText(this.host)) {
			throw new IllegalArgumentException("Host must not be blank");
		}
		if (this.port < 1 || this.port > 65535) {
			throw new IllegalArgumentException("Port must be between 1 and 65535: " + this.port);
		}
		if (this.maxMessageSize <= 0) {
			throw new IllegalArgumentException("Max message size must be positive: " + this.maxMessageSize);
		}
	}

	private static Transport parseTransport(String value) {
		try {
			return Transport.valueOf(value.trim().toUpperCase(Locale.ROOT));
		}
		catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Unknown transport: " + value, e);
		}
	}

	private static NotificationMode parseNotificationMode(String value) {
		try {
			return NotificationMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
		}
		catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Unknown notification mode: " + value, e);
		}
	}

	private static int parseInt(String name, String value) {
		try {
			return Integer.parseInt(value.trim());
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException(name + " must be an integer: " + value, e);
		}
	}

	private static boolean parseBoolean(String value) {
		String normalized = value.trim().toLowerCase(Locale.ROOT);
		return normalized.equals("true") || normalized.equals("1") || normalized.equals("yes");
	}

	public static String usage() {
		return """
				Usage: mcp-tool-server [options]
				  --stdio                   serve a single client over stdin/stdout (default)
				  --tcp                     listen for TCP clients
				  --host <host>             TCP bind address (default 127.0.0.1)
				  --port <port>             TCP port (default 8080)
				  --framing <mode>          content-length or delimiter
				                            (default: delimiter for stdio, content-length for TCP)
				  --max-message-size <n>    largest accepted message in bytes
				  --notifications <mode>    sync or async (default async)
				  --debug                   log at DEBUG level on stderr
				  --help                    print this help

				Environment: MCP_TRANSPORT, MCP_HOST, MCP_PORT, MCP_FRAMING, MCP_MAX_MESSAGE_SIZE,
				MCP_NOTIFICATIONS, MCP_DEBUG. Command line options take precedence.
				""";
	}

	public Transport transport() {
		return this.transport;
	}

	public String host() {
		return this.host;
	}

	public int port() {
		return this.port;
	}

	/**
	 * @return the configured framing, otherwise the usual one for the transport
	 */
	public FramingMode framing() {
		if (this.framing != null) {
			return this.framing;
		}
		return this.transport == Transport.TCP ? FramingMode.CONTENT_LENGTH : FramingMode.DELIMITER;
	}

	public MessageFramer createFramer() {
		return framing().createFramer(this.maxMessageSize);
	}

	public int maxMessageSize() {
		return this.maxMessageSize;
	}

	public NotificationMode notificationMode() {
		return this.notificationMode;
	}

	public Duration notificationPollInterval() {
		return this.notificationPollInterval;
	}

	public boolean isDebug() {
		return this.debug;
	}

	public boolean isHelp() {
		return this.help;
	}

	/**
	 * @return the options as a JSON-friendly map, published by the {@code config://server}
	 * resource
	 */
	public Map<String, Object> toMap() {
		return Map.of("transport", this.transport.name().toLowerCase(Locale.ROOT), "host", this.host, "port",
				this.port, "framing", framing().name().toLowerCase(Locale.ROOT).replace('_', '-'), "maxMessageSize",
				this.maxMessageSize, "notificationMode", this.notificationMode.name().toLowerCase(Locale.ROOT),
				"debug", this.debug);
	}

	@Override
	public String toString() {
		return "ServerOptions" + toMap();
	}

}
