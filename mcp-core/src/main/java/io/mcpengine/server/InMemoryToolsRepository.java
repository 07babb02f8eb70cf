/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.server;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.mcpengine.server.McpServerFeatures.ToolSpecification;
import io.mcpengine.spec.McpSchema;
import io.mcpengine.spec.McpSchema.ListToolsResult;
import io.mcpengine.util.Assert;

/**
 * Keeps tools in memory and shows all of them to every session, sorted by name. The
 * cursor is ignored and every listing is a single page.
 */
public class InMemoryToolsRepository implements ToolsRepository {

	private final Map<String, ToolSpecification> tools = new ConcurrentHashMap<>();

	public InMemoryToolsRepository() {
	}

	public InMemoryToolsRepository(List<ToolSpecification> initialTools) {
		if (initialTools != null) {
			initialTools.forEach(this::addTool);
		}
	}

	@Override
	public ListToolsResult listTools(McpRequestContext context, String cursor) {
		List<McpSchema.Tool> toolList = this.tools.values()
			.stream()
			.map(ToolSpecification::tool)
			.sorted(Comparator.comparing(McpSchema.Tool::name))
			.toList();
		return new ListToolsResult(toolList, null);
	}

	@Override
	public Optional<ToolSpecification> resolveToolForCall(String name, McpRequestContext context) {
		return Optional.ofNullable(this.tools.get(name));
	}

	@Override
	public void addTool(ToolSpecification tool) {
		Assert.notNull(tool, "tool must not be null");
		this.tools.put(tool.tool().name(), tool);
	}

	@Override
	public boolean removeTool(String name) {
		return this.tools.remove(name) != null;
	}

}
