/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.server;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.mcpengine.server.McpServerFeatures.PromptSpecification;
import io.mcpengine.spec.McpSchema;
import io.mcpengine.spec.McpSchema.ListPromptsResult;
import io.mcpengine.util.Assert;

public class InMemoryPromptsRepository implements PromptsRepository {

	private final Map<String, PromptSpecification> prompts = new ConcurrentHashMap<>();

	@Override
	public ListPromptsResult listPrompts(McpRequestContext context, String cursor) {
		List<McpSchema.Prompt> list = this.prompts.values()
			.stream()
			.map(PromptSpecification::prompt)
			.sorted(Comparator.comparing(McpSchema.Prompt::name))
			.toList();
		return new ListPromptsResult(list, null);
	}

	@Override
	public Optional<PromptSpecification> resolvePrompt(String name, McpRequestContext context) {
		return Optional.ofNullable(this.prompts.get(name));
	}

	@Override
	public void addPrompt(PromptSpecification prompt) {
		Assert.notNull(prompt, "prompt must not be null");
		this.prompts.put(prompt.prompt().name(), prompt);
	}

	@Override
	public boolean removePrompt(String name) {
		return this.prompts.remove(name) != null;
	}

}
