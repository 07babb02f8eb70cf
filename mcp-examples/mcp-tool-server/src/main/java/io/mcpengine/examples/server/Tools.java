/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.examples.server;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import io.mcpengine.json.McpJsonDefaults;
import io.mcpengine.server.CancellationToken;
import io.mcpengine.server.McpServerFeatures.ToolSpecification;
import io.mcpengine.server.ProgressTracker;
import io.mcpengine.spec.McpError;
import io.mcpengine.spec.McpSchema.CallToolResult;
import io.mcpengine.spec.McpSchema.Tool;
import io.mcpengine.util.Utils;

/**
 * Tools published by the example server.
 */
public interface Tools {

	String addSchemaJson = """
			{
				"type": "object",
				"properties": {
					"a": {"type": "integer"},
					"b": {"type": "integer"}
				},
				"required": ["a", "b"]
			}
			""";

	String calculatorSchemaJson = """
			{
				"type": "object",
				"properties": {
					"operation": {
						"type": "string",
						"enum": ["add", "subtract", "multiply", "divide"],
						"description": "The arithmetic operation to perform"
					},
					"a": {"type": "number", "description": "The first number"},
					"b": {"type": "number", "description": "The second number"}
				},
				"required": ["operation", "a", "b"]
			}
			""";

	String echoSchemaJson = """
			{
				"type": "object",
				"properties": {
					"text": {"type": "string"}
				},
				"required": ["text"]
			}
			""";

	String longRunningSchemaJson = """
			{
				"type": "object",
				"properties": {
					"steps": {"type": "integer", "description": "Number of steps, default 5"},
					"delay_ms": {"type": "integer", "description": "Time per step in milliseconds, default 100"}
				}
			}
			""";

	ToolSpecification add = ToolSpecification.builder()
		.tool(Tool.builder()
			.name("add")
			.description("Adds two integers")
			.inputSchema(McpJsonDefaults.getMapper(), addSchemaJson)
			.build())
		.callHandler((context, request) -> {
			long a = integerArgument(request.arguments(), "a");
			long b = integerArgument(request.arguments(), "b");
			return new CallToolResult(String.valueOf(Math.addExact(a, b)), false);
		})
		.build();

	ToolSpecification calculator = ToolSpecification.builder()
		.tool(Tool.builder()
			.name("calculator")
			.description("Performs basic arithmetic")
			.inputSchema(McpJsonDefaults.getMapper(), calculatorSchemaJson)
			.build())
		.callHandler((context, request) -> {
			Map<String, Object> arguments = request.arguments();
			Object operation = arguments.get("operation");
			if (!(operation instanceof String)) {
				throw McpError.invalidParams("Missing required argument: operation");
			}
			double a = numberArgument(arguments, "a");
			double b = numberArgument(arguments, "b");
			double result;
			switch (((String) operation).toLowerCase(Locale.ROOT)) {
				case "add":
					result = a + b;
					break;
				case "subtract":
					result = a - b;
					break;
				case "multiply":
					result = a * b;
					break;
				case "divide":
					if (b == 0) {
						return new CallToolResult("Division by zero", true);
					}
					result = a / b;
					break;
				default:
					throw McpError.invalidParams("Unknown operation: " + operation);
			}
			return new CallToolResult(formatNumber(result), false);
		})
		.build();

	ToolSpecification echo = ToolSpecification.builder()
		.tool(Tool.builder()
			.name("echo")
			.description("Returns its text argument")
			.inputSchema(McpJsonDefaults.getMapper(), echoSchemaJson)
			.build())
		.callHandler((context, request) -> {
			Object text = request.arguments().get("text");
			if (text == null) {
				throw McpError.invalidParams("Missing required argument: text");
			}
			return new CallToolResult(String.valueOf(text), false);
		})
		.build();

	ToolSpecification longRunningTask = ToolSpecification.builder()
		.tool(Tool.builder()
			.name("long_running_task")
			.description("Works through a number of steps, reporting progress; can be cancelled")
			.inputSchema(McpJsonDefaults.getMapper(), longRunningSchemaJson)
			.build())
		.callHandler((context, request) -> {
			Map<String, Object> arguments = request.arguments();
			long steps = arguments.containsKey("steps") ? integerArgument(arguments, "steps") : 5;
			long delayMillis = arguments.containsKey("delay_ms") ? integerArgument(arguments, "delay_ms") : 100;
			if (steps < 1 || delayMillis < 0) {
				throw McpError.invalidParams("steps must be positive and delay_ms not negative");
			}
			CancellationToken token = context.cancellationToken();
			ProgressTracker progress = context.progressTracker(request.progressToken(), (double) steps);
			for (long step = 1; step <= steps; step++) {
				if (!pause(delayMillis, token)) {
					break;
				}
				progress.update(step, "Step " + step + " of " + steps);
			}
			if (token.isCancelled()) {
				String reason = token.reason() != null ? token.reason() : "No reason provided";
				return new CallToolResult("Operation cancelled: " + reason, true);
			}
			progress.complete("Done");
			return new CallToolResult("Completed " + steps + " steps", false);
		})
		.build();

	static List<ToolSpecification> all() {
		return List.of(add, calculator, echo, longRunningTask);
	}

	private static long integerArgument(Map<String, Object> arguments, String name) {
		try {
			return Utils.requireLong(arguments, name);
		}
		catch (IllegalArgumentException e) {
			throw McpError.invalidParams(e.getMessage());
		}
	}

	private static double numberArgument(Map<String, Object> arguments, String name) {
		try {
			return Utils.requireDouble(arguments, name);
		}
		catch (IllegalArgumentException e) {
			throw McpError.invalidParams(e.getMessage());
		}
	}

	private static String formatNumber(double value) {
		if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
			return String.valueOf((long) value);
		}
		return String.valueOf(value);
	}

	/**
	 * Sleeps in short slices so a cancellation is noticed quickly.
	 * @return {@code false} if the request was cancelled
	 */
	private static boolean pause(long millis, CancellationToken token) {
		long deadline = System.currentTimeMillis() + millis;
		while (!token.isCancelled()) {
			long remaining = deadline - System.currentTimeMillis();
			if (remaining <= 0) {
				return true;
			}
			try {
				Thread.sleep(Math.min(remaining, 10));
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				return false;
			}
		}
		return false;
	}

}
