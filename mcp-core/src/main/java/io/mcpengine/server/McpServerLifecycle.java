/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.server;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import io.mcpengine.spec.McpError;
import io.mcpengine.spec.McpSchema;
import io.mcpengine.spec.McpSchema.ErrorCodes;
import io.mcpengine.spec.McpSchema.InitializeRequest;
import io.mcpengine.util.Assert;
import io.mcpengine.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.util.annotation.Nullable;

/**
 * Lifecycle of a single session, see {@link ServerState} for the transitions. Until the
 * session is {@link ServerState#READY} only the handshake methods may be dispatched.
 */
public class McpServerLifecycle {

	private static final Logger logger = LoggerFactory.getLogger(McpServerLifecycle.class);

	/**
	 * Methods accepted before the handshake completes.
	 */
	public static final Set<String> HANDSHAKE_METHODS = Set.of(McpSchema.METHOD_INITIALIZE, McpSchema.METHOD_PING,
			McpSchema.METHOD_NOTIFICATION_INITIALIZED, McpSchema.METHOD_NOTIFICATION_CANCELLED);

	private final AtomicReference<ServerState> state = new AtomicReference<>(ServerState.CREATED);

	private final String protocolVersion;

	private volatile InitializeRequest clientInitialization;

	public McpServerLifecycle(String protocolVersion) {
		Assert.hasText(protocolVersion, "protocolVersion must not be empty");
		this.protocolVersion = protocolVersion;
	}

	public ServerState state() {
		return this.state.get();
	}

	public boolean isReady() {
		return this.state.get() == ServerState.READY;
	}

	public boolean isTerminated() {
		return this.state.get() == ServerState.SHUTDOWN;
	}

	public String protocolVersion() {
		return this.protocolVersion;
	}

	/**
	 * @return the {@code initialize} params of the client, {@code null} before the
	 * handshake succeeded
	 */
	@Nullable
	public InitializeRequest clientInitialization() {
		return this.clientInitialization;
	}

	/**
	 * Rejects methods the current state does not allow.
	 * @param method the method about to be dispatched
	 * @throws McpError {@code -32099} before the handshake completes, {@code -32600}
	 * after shutdown
	 */
	public void checkPermitted(String method) {
		ServerState current = this.state.get();
		if (current == ServerState.READY) {
			return;
		}
		if (current == ServerState.SHUTDOWN) {
			throw McpError.builder(ErrorCodes.INVALID_REQUEST).message("Server is shut down").build();
		}
		if (HANDSHAKE_METHODS.contains(method)) {
			return;
		}
		throw McpError.notInitialized(method);
	}

	/**
	 * Enters {@link ServerState#INITIALIZING}. A second {@code initialize} while still
	 * initializing is accepted.
	 * @throws McpError {@code -32600} once the handshake succeeded or failed
	 */
	public void beginInitialize() {
		ServerState previous = this.state.getAndUpdate(
				current -> current == ServerState.CREATED ? ServerState.INITIALIZING : current);
		switch (previous) {
			case CREATED:
			case INITIALIZING:
				return;
			case READY:
				throw McpError.builder(ErrorCodes.INVALID_REQUEST).message("Server already initialized").build();
			case ERROR:
				throw McpError.builder(ErrorCodes.INVALID_REQUEST)
					.message("Initialization failed; open a new connection to retry")
					.build();
			default:
				throw McpError.builder(ErrorCodes.INVALID_REQUEST).message("Server is shut down").build();
		}
	}

	/**
	 * Completes the handshake. The requested version must equal the server's version.
	 * @param request the client's {@code initialize} params
	 * @throws McpError {@code -32602} without a protocol version, {@code -32098} on a
	 * version mismatch, which also moves the session to {@link ServerState#ERROR}
	 */
	public void completeInitialize(InitializeRequest request) {
		Assert.notNull(request, "request must not be null");
		String requested = request.protocolVersion();
		if (!Utils.hasText(requested)) {
			throw McpError.invalidParams("Missing protocolVersion");
		}
		if (!this.protocolVersion.equals(requested)) {
			this.state.compareAndSet(ServerState.INITIALIZING, ServerState.ERROR);
			logger.warn("Client requested protocol version {}, server supports {}", requested, this.protocolVersion);
			throw McpError.builder(ErrorCodes.UNKNOWN_PROTOCOL_VERSION)
				.message("Unsupported protocol version")
				.data(Map.of("supported", List.of(this.protocolVersion), "requested", requested))
				.build();
		}
		this.clientInitialization = request;
		if (!this.state.compareAndSet(ServerState.INITIALIZING, ServerState.READY)) {
			throw McpError.builder(ErrorCodes.INVALID_REQUEST)
				.message("Cannot complete initialization from state " + this.state.get())
				.build();
		}
	}

	/**
	 * Handles an explicit {@code shutdown}.
	 * @throws McpError {@code -32600} unless the session is ready
	 */
	public void shutdown() {
		if (!this.state.compareAndSet(ServerState.READY, ServerState.SHUTDOWN)) {
			throw McpError.builder(ErrorCodes.INVALID_REQUEST)
				.message("Cannot shut down from state " + this.state.get())
				.build();
		}
	}

	/**
	 * Forces {@link ServerState#SHUTDOWN}, used when the transport closes.
	 * @return the state before the call
	 */
	public ServerState terminate() {
		return this.state.getAndSet(ServerState.SHUTDOWN);
	}

}
