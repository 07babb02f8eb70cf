/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.server;

import java.util.Optional;

import io.mcpengine.server.McpServerFeatures.ToolSpecification;
import io.mcpengine.spec.McpSchema.ListToolsResult;
import reactor.util.annotation.Nullable;

/**
 * Source of the tools a server exposes. Implementations may filter by session and must
 * be safe for concurrent use, since tools can be added while connections are served.
 */
public interface ToolsRepository {

	/**
	 * @param context context of the {@code tools/list} request
	 * @param cursor opaque pagination cursor, {@code null} for the first page
	 * @return the tools visible to the caller
	 */
	ListToolsResult listTools(McpRequestContext context, @Nullable String cursor);

	/**
	 * Finds the tool to run for a {@code tools/call}. A tool the caller may not run
	 * should resolve to empty, exactly like an unknown one.
	 * @param name tool name
	 * @param context context of the call
	 * @return the specification, if callable
	 */
	Optional<ToolSpecification> resolveToolForCall(String name, McpRequestContext context);

	void addTool(ToolSpecification tool);

	/**
	 * @param name tool name
	 * @return {@code true} if a tool was removed
	 */
	boolean removeTool(String name);

}
