/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.examples.server;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import io.mcpengine.json.McpJsonDefaults;
import io.mcpengine.server.CancellationToken;
import io.mcpengine.server.CancellationTracker;
import io.mcpengine.server.McpRequestContext;
import io.mcpengine.server.McpServerSession;
import io.mcpengine.server.MethodRegistry;
import io.mcpengine.server.NotificationMode;
import io.mcpengine.server.RequestScope;
import io.mcpengine.server.McpServerFeatures.ToolSpecification;
import io.mcpengine.spec.JsonRpcCodec;
import io.mcpengine.spec.McpError;
import io.mcpengine.spec.McpSchema;
import io.mcpengine.spec.McpSchema.CallToolRequest;
import io.mcpengine.spec.McpSchema.CallToolResult;
import io.mcpengine.spec.McpSchema.ErrorCodes;
import io.mcpengine.spec.McpSchema.TextContent;
import io.mcpengine.spec.McpServerTransport;
import io.mcpengine.spec.RequestId;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Tests for the example {@link Tools}.
 */
class ToolsTests {

	private final List<String> sent = new CopyOnWriteArrayList<>();

	private final CancellationTracker tracker = new CancellationTracker();

	private final McpServerSession session = new McpServerSession(new McpServerTransport() {

		@Override
		public void send(byte[] payload) {
			ToolsTests.this.sent.add(new String(payload, StandardCharsets.UTF_8));
		}

		@Override
		public void close() {
		}

	}, new JsonRpcCodec(McpJsonDefaults.getMapper()), new MethodRegistry(), this.tracker,
			McpSchema.LATEST_PROTOCOL_VERSION, NotificationMode.SYNC, null);

	private McpRequestContext context(CancellationToken token) {
		return new McpRequestContext(this.session, McpSchema.METHOD_TOOLS_CALL, RequestId.of(1), null, new RequestScope(), token);
	}

	private CallToolResult call(ToolSpecification tool, Map<String, Object> arguments) {
		return tool.callHandler().call(context(null), new CallToolRequest(tool.tool().name(), arguments));
	}

	private static String text(CallToolResult result) {
		return ((TextContent) result.content().get(0)).text();
	}

	@Test
	void addIntegers() {
		assertThat(text(call(Tools.add, Map.of("a", 2, "b", 40)))).isEqualTo("42");
		assertThat(text(call(Tools.add, Map.of("a", "7", "b", -3)))).isEqualTo("4");
		assertThatThrownBy(() -> call(Tools.add, Map.of("a", 1))).isInstanceOfSatisfying(McpError.class,
				e -> assertThat(e.getCode()).isEqualTo(ErrorCodes.INVALID_PARAMS));
	}

	@Test
	void calculatorOperations() {
		assertThat(text(call(Tools.calculator, Map.of("operation", "add", "a", 1.5, "b", 2)))).isEqualTo("3.5");
		assertThat(text(call(Tools.calculator, Map.of("operation", "subtract", "a", 10, "b", 4)))).isEqualTo("6");
		assertThat(text(call(Tools.calculator, Map.of("operation", "multiply", "a", 3, "b", 4)))).isEqualTo("12");
		assertThat(text(call(Tools.calculator, Map.of("operation", "divide", "a", 1, "b", 4)))).isEqualTo("0.25");
	}

	@Test
	void calculatorDivisionByZeroIsToolError() {
		CallToolResult result = call(Tools.calculator, Map.of("operation", "divide", "a", 1, "b", 0));

		assertThat(result.isError()).isTrue();
		assertThat(text(result)).isEqualTo("Division by zero");
	}

	@Test
	void calculatorRejectsUnknownOperation() {
		assertThatThrownBy(() -> call(Tools.calculator, Map.of("operation", "modulo", "a", 1, "b", 2)))
			.isInstanceOf(McpError.class)
			.hasMessageContaining("Unknown operation");
	}

	@Test
	void echoReturnsText() {
		assertThat(text(call(Tools.echo, Map.of("text", "héllo")))).isEqualTo("héllo");
	}

	@Test
	void longRunningTaskReportsProgress() {
		CallToolRequest request = CallToolRequest.builder()
			.name("long_running_task")
			.arguments(Map.of("steps", 3, "delay_ms", 1))
			.progressToken("p-1")
			.build();

		CallToolResult result = Tools.longRunningTask.callHandler().call(context(null), request);

		assertThat(text(result)).isEqualTo("Completed 3 steps");
		assertThat(this.sent).hasSize(4).allMatch(message -> message.contains("notifications/progress"));
		assertThat(this.sent.get(3)).contains("\"progress\":3.0").contains("\"message\":\"Done\"");
	}

	@Test
	void longRunningTaskStopsWhenCancelled() throws Exception {
		CancellationToken token = this.tracker.register(this.session.getId(), RequestId.of(1));
		CallToolRequest request = new CallToolRequest("long_running_task", Map.of("steps", 1000, "delay_ms", 50));

		CompletableFuture<CallToolResult> running = CompletableFuture
			.supplyAsync(() -> Tools.longRunningTask.callHandler().call(context(token), request));
		await().pollDelay(Duration.ofMillis(20)).atMost(Duration.ofSeconds(1)).until(() -> !running.isDone());
		this.tracker.cancel(this.session.getId(), RequestId.of(1), "user abort");

		CallToolResult result = running.get(5, TimeUnit.SECONDS);
		assertThat(result.isError()).isTrue();
		assertThat(text(result)).isEqualTo("Operation cancelled: user abort");
	}

	@Test
	void toolNamesAreUnique() {
		assertThat(Tools.all()).extracting(tool -> tool.tool().name())
			.containsExactly("add", "calculator", "echo", "long_running_task");
	}

}
