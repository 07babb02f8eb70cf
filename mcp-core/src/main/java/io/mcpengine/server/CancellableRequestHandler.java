/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.server;

import reactor.util.annotation.Nullable;

/**
 * A handler that supports cooperative cancellation. Requests routed to it get a token
 * registered in the {@link CancellationTracker} for the duration of the call.
 */
@FunctionalInterface
public interface CancellableRequestHandler extends McpRequestHandler {

	Object handle(McpRequestContext context, @Nullable Object params, CancellationToken token);

	@Override
	default Object handle(McpRequestContext context, @Nullable Object params) {
		return handle(context, params, context.cancellationToken());
	}

}
