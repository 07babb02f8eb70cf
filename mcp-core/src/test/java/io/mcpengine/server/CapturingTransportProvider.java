/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.server;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import io.mcpengine.json.McpJsonDefaults;
import io.mcpengine.spec.McpSchema;
import io.mcpengine.spec.McpServerTransport;
import io.mcpengine.spec.McpServerTransportProvider;
import io.mcpengine.spec.McpTransportException;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Transport provider for tests: sessions are opened on demand and every outbound message
 * is captured as a generic JSON map.
 */
class CapturingTransportProvider implements McpServerTransportProvider {

	private final Sinks.Empty<Void> closeSink = Sinks.empty();

	private McpServerSession.Factory sessionFactory;

	@Override
	public void setSessionFactory(McpServerSession.Factory sessionFactory) {
		this.sessionFactory = sessionFactory;
	}

	Connection connect() {
		Connection connection = new Connection();
		connection.session = this.sessionFactory.create(connection);
		return connection;
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(this.closeSink::tryEmitEmpty);
	}

	@Override
	public Mono<Void> onClose() {
		return this.closeSink.asMono();
	}

	static class Connection implements McpServerTransport {

		final List<Map<String, Object>> sent = new CopyOnWriteArrayList<>();

		final AtomicBoolean closed = new AtomicBoolean();

		McpServerSession session;

		@Override
		public void send(byte[] payload) {
			if (this.closed.get()) {
				throw new McpTransportException("closed");
			}
			try {
				this.sent.add(McpJsonDefaults.getMapper()
					.readValue(new String(payload, StandardCharsets.UTF_8), McpSchema.MAP_TYPE_REF));
			}
			catch (IOException e) {
				throw new McpTransportException("Unreadable payload", e);
			}
		}

		@Override
		public void close() {
			this.closed.set(true);
		}

		Map<String, Object> lastMessage() {
			return this.sent.get(this.sent.size() - 1);
		}

		List<Map<String, Object>> messagesWithMethod(String method) {
			return this.sent.stream().filter(m -> method.equals(m.get("method"))).toList();
		}

		McpServerSession session() {
			return this.session;
		}

	}

}
