/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.spec;

import io.mcpengine.spec.McpSchema.ErrorCodes;
import io.mcpengine.spec.McpSchema.JSONRPCResponse.JSONRPCError;
import reactor.util.annotation.Nullable;

/**
 * A frame that is not a valid JSON-RPC envelope. Carries the request id when it could be
 * recovered, so the error response can still be correlated.
 */
public class McpEnvelopeException extends McpError {

	public enum Reason {

		INVALID_JSON(ErrorCodes.PARSE_ERROR, "Parse error"),

		NOT_AN_OBJECT(ErrorCodes.INVALID_REQUEST, "Message must be a JSON object"),

		MISSING_VERSION(ErrorCodes.INVALID_REQUEST, "Missing jsonrpc version"),

		INVALID_VERSION(ErrorCodes.INVALID_REQUEST, "Unsupported jsonrpc version"),

		MISSING_METHOD(ErrorCodes.INVALID_REQUEST, "Missing method"),

		EMPTY_METHOD(ErrorCodes.INVALID_REQUEST, "Method cannot be empty"),

		INVALID_METHOD(ErrorCodes.INVALID_REQUEST, "Method must be a string"),

		INVALID_ID(ErrorCodes.INVALID_REQUEST, "Id must be a string, an integer or null"),

		INVALID_RESPONSE(ErrorCodes.INVALID_REQUEST, "Malformed response");

		private final int code;

		private final String message;

		Reason(int code, String message) {
			this.code = code;
			this.message = message;
		}

		public int code() {
			return this.code;
		}

		public String message() {
			return this.message;
		}

	}

	private final Reason reason;

	@Nullable
	private final RequestId requestId;

	public McpEnvelopeException(Reason reason, @Nullable RequestId requestId, @Nullable Object data) {
		super(new JSONRPCError(reason.code(), reason.message(), data));
		this.reason = reason;
		this.requestId = requestId;
	}

	public McpEnvelopeException(Reason reason, Throwable cause) {
		super(new JSONRPCError(reason.code(), reason.message(), null), cause);
		this.reason = reason;
		this.requestId = null;
	}

	public Reason getReason() {
		return this.reason;
	}

	/**
	 * @return the id of the offending message, {@code null} if absent or unusable
	 */
	@Nullable
	public RequestId getRequestId() {
		return this.requestId;
	}

}
