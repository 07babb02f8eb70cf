/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.spec;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Splits an ordered byte stream into messages and writes messages back in the same
 * framing. Implementations keep no per-stream state between calls, so one framer can
 * serve many connections; callers serialize access to a given stream.
 */
public interface MessageFramer {

	/** Default upper bound for a single message, 16 MiB. */
	int DEFAULT_MAX_MESSAGE_SIZE = 16 * 1024 * 1024;

	/**
	 * Blocks until one complete message has been read.
	 * @param in the source stream, read incrementally
	 * @return the message payload
	 * @throws McpFramingException with {@link McpFramingException.Kind#END_OF_STREAM}
	 * when the stream closes, or another kind for malformed framing
	 * @throws IOException when the underlying read fails
	 */
	byte[] readFrame(InputStream in) throws IOException;

	/**
	 * Writes one message and flushes the stream.
	 * @param out the target stream
	 * @param payload the message payload
	 * @throws IOException when the write fails
	 */
	void writeFrame(OutputStream out, byte[] payload) throws IOException;

}
