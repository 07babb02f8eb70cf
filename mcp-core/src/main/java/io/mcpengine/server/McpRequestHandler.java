/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.server;

import reactor.util.annotation.Nullable;

/**
 * Handles one method of the {@link MethodRegistry}.
 * <p>
 * The return value becomes the {@code result} of the response; returning a
 * {@link DispatchResult} controls the outcome directly. Throw
 * {@link io.mcpengine.spec.McpError} to answer with a specific error code.
 */
@FunctionalInterface
public interface McpRequestHandler {

	/**
	 * @param context the request context
	 * @param params the raw {@code params} value, {@code null} when absent
	 * @return the result value
	 */
	Object handle(McpRequestContext context, @Nullable Object params);

}
