/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.spec;

/**
 * A message could not be written to, or the connection could not be used on, the
 * underlying transport.
 */
public class McpTransportException extends RuntimeException {

	public McpTransportException(String message) {
		super(message);
	}

	public McpTransportException(String message, Throwable cause) {
		super(message, cause);
	}

}
