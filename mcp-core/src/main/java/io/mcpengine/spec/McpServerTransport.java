/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.spec;

/**
 * The outbound half of one client connection. Implementations frame each payload and
 * serialize concurrent writers, so a response and a notification never interleave on the
 * wire.
 */
public interface McpServerTransport {

	/**
	 * Writes one serialized JSON-RPC message as a single frame.
	 * @param payload the message bytes
	 * @throws McpTransportException if the connection is closed or the write fails
	 */
	void send(byte[] payload);

	/**
	 * Closes the connection. Calling it more than once has no effect.
	 */
	void close();

}
