/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.examples.server;

import java.util.List;

import io.mcpengine.server.McpServerFeatures.PromptSpecification;
import io.mcpengine.spec.McpSchema;
import io.mcpengine.spec.McpSchema.GetPromptResult;
import io.mcpengine.spec.McpSchema.Prompt;
import io.mcpengine.spec.McpSchema.PromptMessage;
import io.mcpengine.spec.McpSchema.TextContent;

import static io.mcpengine.spec.McpSchema.Role.USER;

/**
 * Prompts published by the example server.
 */
public interface Prompts {

	PromptSpecification greeting = new PromptSpecification(
			new Prompt("greeting", "Greeting Prompt",
					List.of(new McpSchema.PromptArgument("name", "Name of the person to greet", true))),
			(context, request) -> {
				String name = String.valueOf(request.arguments().get("name"));
				return new GetPromptResult("greeting",
						List.of(new PromptMessage(USER, new TextContent("Hello " + name + "!"))));
			});

	PromptSpecification codeReview = new PromptSpecification(
			new Prompt("code_review", "Asks for a review of a piece of code",
					List.of(new McpSchema.PromptArgument("code", "The code to review", true),
							new McpSchema.PromptArgument("language", "Programming language of the code", false))),
			(context, request) -> {
				Object language = request.arguments().get("language");
				String code = String.valueOf(request.arguments().get("code"));
				String text = "Please review the following " + (language != null ? language + " " : "")
						+ "code. Point out bugs, unclear naming and missing error handling.\n\n" + code;
				return new GetPromptResult("code review", List.of(new PromptMessage(USER, new TextContent(text))));
			});

	static List<PromptSpecification> all() {
		return List.of(greeting, codeReview);
	}

}
