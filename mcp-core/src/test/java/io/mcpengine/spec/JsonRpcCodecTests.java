/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.spec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import io.mcpengine.json.McpJsonDefaults;
import io.mcpengine.spec.McpEnvelopeException.Reason;
import io.mcpengine.spec.McpSchema.ErrorCodes;
import io.mcpengine.spec.McpSchema.JSONRPCMessage;
import io.mcpengine.spec.McpSchema.JSONRPCNotification;
import io.mcpengine.spec.McpSchema.JSONRPCRequest;
import io.mcpengine.spec.McpSchema.JSONRPCResponse;
import io.mcpengine.spec.McpSchema.JSONRPCResponse.JSONRPCError;
import org.junit.jupiter.api.Test;

import static net.javacrumbs.jsonunit.assertj.JsonAssertions.assertThatJson;
import static net.javacrumbs.jsonunit.assertj.JsonAssertions.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link JsonRpcCodec}.
 */
class JsonRpcCodecTests {

	private final JsonRpcCodec codec = new JsonRpcCodec(McpJsonDefaults.getMapper());

	private JSONRPCMessage decode(String json) {
		return this.codec.decode(json.getBytes(StandardCharsets.UTF_8));
	}

	private String encode(JSONRPCMessage message) throws IOException {
		return new String(this.codec.encode(message), StandardCharsets.UTF_8);
	}

	@Test
	void decodesRequestWithIntegerId() {
		JSONRPCMessage message = decode("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"ping\"}");

		assertThat(message).isInstanceOfSatisfying(JSONRPCRequest.class, request -> {
			assertThat(request.id()).isEqualTo(RequestId.of(1));
			assertThat(request.method()).isEqualTo("ping");
			assertThat(request.params()).isNull();
		});
	}

	@Test
	void decodesRequestWithStringIdAndParams() {
		JSONRPCMessage message = decode(
				"{\"jsonrpc\":\"2.0\",\"id\":\"abc\",\"method\":\"tools/call\",\"params\":{\"name\":\"echo\"}}");

		assertThat(message).isInstanceOfSatisfying(JSONRPCRequest.class, request -> {
			assertThat(request.id()).isEqualTo(RequestId.of("abc"));
			assertThat(request.params()).isEqualTo(Map.of("name", "echo"));
		});
	}

	@Test
	void absentOrNullIdIsNotification() {
		assertThat(decode("{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}"))
			.isInstanceOf(JSONRPCNotification.class);
		assertThat(decode("{\"jsonrpc\":\"2.0\",\"id\":null,\"method\":\"notifications/initialized\"}"))
			.isInstanceOf(JSONRPCNotification.class);
	}

	@Test
	void decodesClientResponse() {
		assertThat(decode("{\"jsonrpc\":\"2.0\",\"id\":7,\"result\":{}}"))
			.isInstanceOfSatisfying(JSONRPCResponse.class, response -> {
				assertThat(response.id()).isEqualTo(RequestId.of(7));
				assertThat(response.hasError()).isFalse();
			});
		assertThat(decode("{\"jsonrpc\":\"2.0\",\"id\":7,\"error\":{\"code\":-32601,\"message\":\"nope\"}}"))
			.isInstanceOfSatisfying(JSONRPCResponse.class, response -> {
				assertThat(response.hasError()).isTrue();
				assertThat(response.error().code()).isEqualTo(-32601);
			});
	}

	@Test
	void invalidJsonIsParseError() {
		assertThatThrownBy(() -> decode("{\"jsonrpc\":\"2.0\",")).isInstanceOfSatisfying(McpEnvelopeException.class,
				e -> {
					assertThat(e.getReason()).isEqualTo(Reason.INVALID_JSON);
					assertThat(e.getCode()).isEqualTo(ErrorCodes.PARSE_ERROR);
					assertThat(e.getRequestId()).isNull();
				});
	}

	@Test
	void nonObjectIsInvalidRequest() {
		assertThatThrownBy(() -> decode("[1,2,3]")).isInstanceOfSatisfying(McpEnvelopeException.class,
				e -> assertThat(e.getReason()).isEqualTo(Reason.NOT_AN_OBJECT));
	}

	@Test
	void missingVersionKeepsId() {
		assertThatThrownBy(() -> decode("{\"id\":3,\"method\":\"ping\"}"))
			.isInstanceOfSatisfying(McpEnvelopeException.class, e -> {
				assertThat(e.getReason()).isEqualTo(Reason.MISSING_VERSION);
				assertThat(e.getCode()).isEqualTo(ErrorCodes.INVALID_REQUEST);
				assertThat(e.getRequestId()).isEqualTo(RequestId.of(3));
			});
	}

	@Test
	void wrongVersion() {
		assertThatThrownBy(() -> decode("{\"jsonrpc\":\"1.0\",\"id\":3,\"method\":\"ping\"}"))
			.isInstanceOfSatisfying(McpEnvelopeException.class, e -> {
				assertThat(e.getReason()).isEqualTo(Reason.INVALID_VERSION);
				assertThat(e.getJsonRpcError().data()).isEqualTo(Map.of("jsonrpc", "1.0"));
			});
	}

	@Test
	void missingMethod() {
		assertThatThrownBy(() -> decode("{\"jsonrpc\":\"2.0\",\"id\":4}"))
			.isInstanceOfSatisfying(McpEnvelopeException.class,
					e -> assertThat(e.getReason()).isEqualTo(Reason.MISSING_METHOD));
	}

	@Test
	void emptyMethod() {
		assertThatThrownBy(() -> decode("{\"jsonrpc\":\"2.0\",\"id\":5,\"method\":\"\"}"))
			.isInstanceOfSatisfying(McpEnvelopeException.class, e -> {
				assertThat(e.getReason()).isEqualTo(Reason.EMPTY_METHOD);
				assertThat(e.getMessage()).isEqualTo("Method cannot be empty");
				assertThat(e.getRequestId()).isEqualTo(RequestId.of(5));
			});
	}

	@Test
	void nonStringMethod() {
		assertThatThrownBy(() -> decode("{\"jsonrpc\":\"2.0\",\"id\":5,\"method\":42}"))
			.isInstanceOfSatisfying(McpEnvelopeException.class,
					e -> assertThat(e.getReason()).isEqualTo(Reason.INVALID_METHOD));
	}

	@Test
	void fractionalOrStructuredIdIsRejected() {
		assertThatThrownBy(() -> decode("{\"jsonrpc\":\"2.0\",\"id\":1.5,\"method\":\"ping\"}"))
			.isInstanceOfSatisfying(McpEnvelopeException.class, e -> {
				assertThat(e.getReason()).isEqualTo(Reason.INVALID_ID);
				assertThat(e.getRequestId()).isNull();
			});
		assertThatThrownBy(() -> decode("{\"jsonrpc\":\"2.0\",\"id\":{\"x\":1},\"method\":\"ping\"}"))
			.isInstanceOfSatisfying(McpEnvelopeException.class,
					e -> assertThat(e.getReason()).isEqualTo(Reason.INVALID_ID));
	}

	@Test
	void encodesSuccessResponse() throws IOException {
		String json = encode(JSONRPCResponse.success(RequestId.of(1), Map.of("tools", List.of())));

		assertThatJson(json).isEqualTo(json("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{\"tools\":[]}}"));
	}

	@Test
	void encodesNullResultExplicitly() throws IOException {
		String json = encode(JSONRPCResponse.success(RequestId.of("s-1"), null));

		assertThatJson(json).isEqualTo(json("{\"jsonrpc\":\"2.0\",\"id\":\"s-1\",\"result\":null}"));
	}

	@Test
	void encodesErrorWithNullId() throws IOException {
		String json = encode(
				JSONRPCResponse.failure(null, new JSONRPCError(ErrorCodes.PARSE_ERROR, "Parse error", null)));

		assertThatJson(json)
			.isEqualTo(json("{\"jsonrpc\":\"2.0\",\"id\":null,\"error\":{\"code\":-32700,\"message\":\"Parse error\"}}"));
	}

	@Test
	void encodesErrorData() throws IOException {
		String json = encode(JSONRPCResponse.failure(RequestId.of(2), McpError.methodNotFound("foo").getJsonRpcError()));

		assertThatJson(json).node("error.code").isEqualTo(-32601);
		assertThatJson(json).node("error.message").isEqualTo("Method not found: foo");
		assertThatJson(json).node("error.data.method").isEqualTo("foo");
	}

	@Test
	void encodesNotificationWithRecordParams() throws IOException {
		String json = encode(new JSONRPCNotification(McpSchema.METHOD_NOTIFICATION_PROGRESS,
				new McpSchema.ProgressNotification(ProgressToken.of("op-1"), 2, 5.0, "working")));

		assertThatJson(json).isEqualTo(json("""
				{"jsonrpc":"2.0","method":"notifications/progress",
				 "params":{"progressToken":"op-1","progress":2.0,"total":5.0,"message":"working"}}
				"""));
	}

	@Test
	void decodesWhatItEncodes() throws IOException {
		JSONRPCRequest request = new JSONRPCRequest("tools/call", RequestId.of(9),
				Map.of("name", "add", "arguments", Map.of("a", 1)));

		JSONRPCMessage decoded = this.codec.decode(this.codec.encode(request));

		assertThat(decoded).isEqualTo(request);
	}

}
