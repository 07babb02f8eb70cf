/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.server;

import io.mcpengine.spec.McpError;
import io.mcpengine.spec.McpSchema.JSONRPCResponse.JSONRPCError;
import io.mcpengine.util.Assert;

/**
 * Outcome of {@link MethodRegistry#dispatch}. The registry does not serialize anything;
 * the session turns the outcome into a response, or into nothing.
 */
public sealed interface DispatchResult {

	/**
	 * No response for a notification. A request still receives a {@code null} result.
	 */
	DispatchResult NONE = new None();

	/**
	 * No response is sent and the connection stops reading.
	 */
	DispatchResult END_STREAM = new EndStream();

	static DispatchResult success(Object result) {
		return new Success(result);
	}

	static DispatchResult failure(JSONRPCError error) {
		Assert.notNull(error, "error must not be null");
		return new Failure(error);
	}

	static DispatchResult failure(Throwable error) {
		return new Failure(McpError.toJsonRpcError(error));
	}

	record Success(Object result) implements DispatchResult {
	}

	record Failure(JSONRPCError error) implements DispatchResult {
	}

	record None() implements DispatchResult {
	}

	record EndStream() implements DispatchResult {
	}

}
