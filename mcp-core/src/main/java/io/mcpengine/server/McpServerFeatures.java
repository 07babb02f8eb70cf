/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.server;

import io.mcpengine.spec.McpSchema.CallToolRequest;
import io.mcpengine.spec.McpSchema.CallToolResult;
import io.mcpengine.spec.McpSchema.GetPromptRequest;
import io.mcpengine.spec.McpSchema.GetPromptResult;
import io.mcpengine.spec.McpSchema.Prompt;
import io.mcpengine.spec.McpSchema.ReadResourceRequest;
import io.mcpengine.spec.McpSchema.ReadResourceResult;
import io.mcpengine.spec.McpSchema.Resource;
import io.mcpengine.spec.McpSchema.Tool;
import io.mcpengine.util.Assert;

/**
 * Tools, resources and prompts a server exposes, each paired with the code that serves
 * it.
 */
public final class McpServerFeatures {

	private McpServerFeatures() {
	}

	/**
	 * Runs a tool. Poll {@code context.cancellationToken()} in long loops; a thrown
	 * exception is reported as {@code Tool execution failed}.
	 */
	@FunctionalInterface
	public interface ToolCallHandler {

		CallToolResult call(McpRequestContext context, CallToolRequest request);

	}

	@FunctionalInterface
	public interface ResourceReadHandler {

		ReadResourceResult read(McpRequestContext context, ReadResourceRequest request);

	}

	@FunctionalInterface
	public interface PromptHandler {

		GetPromptResult get(McpRequestContext context, GetPromptRequest request);

	}

	/**
	 * A tool with its handler.
	 *
	 * <pre>{@code
	 * ToolSpecification.builder()
	 *     .tool(Tool.builder().name("echo").description("Echoes the input").build())
	 *     .callHandler((context, request) -> new CallToolResult("hi", false))
	 *     .build();
	 * }</pre>
	 *
	 * @param tool tool definition advertised by {@code tools/list}
	 * @param callHandler handler invoked by {@code tools/call}
	 */
	public record ToolSpecification(Tool tool, ToolCallHandler callHandler) {

		public ToolSpecification {
			Assert.notNull(tool, "tool must not be null");
			Assert.notNull(callHandler, "callHandler must not be null");
		}

		public static Builder builder() {
			return new Builder();
		}

		public static class Builder {

			private Tool tool;

			private ToolCallHandler callHandler;

			public Builder tool(Tool tool) {
				this.tool = tool;
				return this;
			}

			public Builder callHandler(ToolCallHandler callHandler) {
				this.callHandler = callHandler;
				return this;
			}

			public ToolSpecification build() {
				return new ToolSpecification(this.tool, this.callHandler);
			}

		}
	}

	/**
	 * @param resource resource definition advertised by {@code resources/list}
	 * @param readHandler handler invoked by {@code resources/read}
	 */
	public record ResourceSpecification(Resource resource, ResourceReadHandler readHandler) {

		public ResourceSpecification {
			Assert.notNull(resource, "resource must not be null");
			Assert.notNull(readHandler, "readHandler must not be null");
		}
	}

	/**
	 * @param prompt prompt template advertised by {@code prompts/list}
	 * @param promptHandler handler invoked by {@code prompts/get}
	 */
	public record PromptSpecification(Prompt prompt, PromptHandler promptHandler) {

		public PromptSpecification {
			Assert.notNull(prompt, "prompt must not be null");
			Assert.notNull(promptHandler, "promptHandler must not be null");
		}
	}

}
