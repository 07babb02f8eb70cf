/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.spec;

import java.util.Locale;

/**
 * Framing selectable per deployment.
 */
public enum FramingMode {

	/**
	 * {@code Content-Length} header block followed by the body.
	 */
	CONTENT_LENGTH,

	/**
	 * One message per line.
	 */
	DELIMITER;

	public MessageFramer createFramer(int maxMessageSize) {
		if (this == CONTENT_LENGTH) {
			return new ContentLengthFramer(maxMessageSize);
		}
		return new DelimiterFramer(DelimiterFramer.DEFAULT_DELIMITER, maxMessageSize, true);
	}

	/**
	 * Parses {@code content-length}, {@code delimiter}, {@code newline} or {@code ndjson},
	 * case-insensitively.
	 * @param value the configured value
	 * @return the mode
	 * @throws IllegalArgumentException for unknown values
	 */
	public static FramingMode parse(String value) {
		String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
		switch (normalized) {
			case "content-length":
				return CONTENT_LENGTH;
			case "delimiter":
			case "newline":
			case "ndjson":
				return DELIMITER;
			default:
				throw new IllegalArgumentException("Unknown framing mode: " + value);
		}
	}

}
