/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.server;

/**
 * Phase of one client session.
 *
 * <pre>
 * CREATED --initialize--> INITIALIZING --ok--> READY --shutdown--> SHUTDOWN
 *                              |
 *                              +--version mismatch--> ERROR
 * </pre>
 *
 * Any state moves to {@link #SHUTDOWN} when the transport closes.
 */
public enum ServerState {

	CREATED,

	INITIALIZING,

	READY,

	ERROR,

	SHUTDOWN

}
