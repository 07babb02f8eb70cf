/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.spec;

import io.mcpengine.server.McpServerSession;
import reactor.core.publisher.Mono;

/**
 * Accepts client connections and creates a session for each of them.
 */
public interface McpServerTransportProvider {

	/**
	 * Installs the session factory and starts serving. Called once by the server after
	 * its method registry is frozen.
	 * @param sessionFactory creates the session of each new connection
	 * @throws McpTransportException if the provider cannot start, for example when the
	 * port is taken
	 */
	void setSessionFactory(McpServerSession.Factory sessionFactory);

	/**
	 * Stops accepting connections and closes the open ones.
	 * @return a {@link Mono} completing once everything is closed
	 */
	Mono<Void> closeGracefully();

	/**
	 * @return a {@link Mono} completing when the provider stops serving, either after
	 * {@link #closeGracefully()} or because its only connection ended
	 */
	Mono<Void> onClose();

	default void close() {
		this.closeGracefully().block();
	}

}
