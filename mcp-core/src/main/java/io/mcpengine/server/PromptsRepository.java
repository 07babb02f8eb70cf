/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.server;

import java.util.Optional;

import io.mcpengine.server.McpServerFeatures.PromptSpecification;
import io.mcpengine.spec.McpSchema.ListPromptsResult;
import reactor.util.annotation.Nullable;

/**
 * Source of the prompt templates a server exposes, looked up by name.
 */
public interface PromptsRepository {

	ListPromptsResult listPrompts(McpRequestContext context, @Nullable String cursor);

	Optional<PromptSpecification> resolvePrompt(String name, McpRequestContext context);

	void addPrompt(PromptSpecification prompt);

	boolean removePrompt(String name);

}
