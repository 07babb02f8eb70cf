/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.server;

/**
 * How server-initiated notifications reach the transport.
 */
public enum NotificationMode {

	/**
	 * Written on the calling thread before the call returns.
	 */
	SYNC,

	/**
	 * Queued and written by the session's {@link NotificationDeliveryService}.
	 */
	ASYNC

}
