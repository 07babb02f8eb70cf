/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.server.transport;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

import io.mcpengine.json.McpJsonMapper;
import io.mcpengine.server.McpServerSession;
import io.mcpengine.spec.DelimiterFramer;
import io.mcpengine.spec.JsonRpcCodec;
import io.mcpengine.spec.McpServerTransportProvider;
import io.mcpengine.spec.MessageFramer;
import io.mcpengine.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Serves a single session over standard input and output. Messages are newline
 * delimited unless another {@link MessageFramer} is given. Nothing but framed messages
 * may be written to the output stream, so logging must go to standard error.
 */
public class StdioServerTransportProvider implements McpServerTransportProvider {

	private static final Logger logger = LoggerFactory.getLogger(StdioServerTransportProvider.class);

	private final JsonRpcCodec codec;

	private final MessageFramer framer;

	private final InputStream inputStream;

	private final OutputStream outputStream;

	private final AtomicBoolean started = new AtomicBoolean();

	private final Sinks.Empty<Void> closeSink = Sinks.empty();

	private volatile StreamConnection connection;

	private volatile Scheduler readerScheduler;

	public StdioServerTransportProvider(McpJsonMapper jsonMapper) {
		this(jsonMapper, new DelimiterFramer(), System.in, System.out);
	}

	public StdioServerTransportProvider(McpJsonMapper jsonMapper, MessageFramer framer) {
		this(jsonMapper, framer, System.in, System.out);
	}

	/**
	 * @param jsonMapper mapper used by the envelope codec
	 * @param framer framing of the streams
	 * @param inputStream stream the client writes to
	 * @param outputStream stream the client reads from
	 */
	public StdioServerTransportProvider(McpJsonMapper jsonMapper, MessageFramer framer, InputStream inputStream,
			OutputStream outputStream) {
		Assert.notNull(jsonMapper, "The JsonMapper can not be null");
		Assert.notNull(framer, "The framer can not be null");
		Assert.notNull(inputStream, "The InputStream can not be null");
		Assert.notNull(outputStream, "The OutputStream can not be null");
		this.codec = new JsonRpcCodec(jsonMapper);
		this.framer = framer;
		this.inputStream = inputStream;
		this.outputStream = outputStream;
	}

	@Override
	public void setSessionFactory(McpServerSession.Factory sessionFactory) {
		Assert.notNull(sessionFactory, "sessionFactory must not be null");
		if (!this.started.compareAndSet(false, true)) {
			throw new IllegalStateException("Stdio transport is already serving");
		}
		StreamConnection stdio = new StreamConnection("stdio", this.inputStream, this.outputStream, this.framer,
				this.codec, this.inputStream);
		stdio.setCloseListener(this.closeSink::tryEmitEmpty);
		this.connection = stdio;
		this.readerScheduler = Schedulers.fromExecutorService(Executors.newSingleThreadExecutor(r -> {
			Thread t = new Thread(r, "mcp-stdio-reader");
			t.setDaemon(true);
			return t;
		}), "mcp-stdio-reader");

		Mono.fromRunnable(() -> stdio.serve(sessionFactory))
			.subscribeOn(this.readerScheduler)
			.doFinally(signal -> {
				this.closeSink.tryEmitEmpty();
				logger.debug("Stdio reader finished ({})", signal);
			})
			.subscribe(null, error -> logger.error("Stdio connection failed", error));
		logger.info("Serving MCP over stdio");
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(() -> {
			StreamConnection current = this.connection;
			if (current != null) {
				current.close();
			}
			Scheduler scheduler = this.readerScheduler;
			if (scheduler != null) {
				scheduler.dispose();
			}
			this.closeSink.tryEmitEmpty();
		});
	}

	@Override
	public Mono<Void> onClose() {
		return this.closeSink.asMono();
	}

}
