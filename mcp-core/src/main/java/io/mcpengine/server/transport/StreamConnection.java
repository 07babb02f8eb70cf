/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.server.transport;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.SocketException;
import java.nio.channels.ClosedChannelException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import io.mcpengine.server.McpServerSession;
import io.mcpengine.spec.JsonRpcCodec;
import io.mcpengine.spec.McpEnvelopeException;
import io.mcpengine.spec.McpFramingException;
import io.mcpengine.spec.McpSchema;
import io.mcpengine.spec.McpSchema.JSONRPCMessage;
import io.mcpengine.spec.McpSchema.JSONRPCNotification;
import io.mcpengine.spec.McpSchema.JSONRPCResponse;
import io.mcpengine.spec.McpServerTransport;
import io.mcpengine.spec.McpTransportException;
import io.mcpengine.spec.MessageFramer;
import io.mcpengine.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.util.annotation.Nullable;

/**
 * One framed byte-stream connection, shared by the stdio and TCP providers.
 * <p>
 * The thread calling {@link #serve} reads frames and decodes them. Requests and
 * notifications are handed to a single dispatch worker in arrival order, so at most one
 * request is in flight per connection. {@code notifications/cancelled} is applied
 * directly on the reading thread, which lets it reach the request the worker is running.
 * <p>
 * A malformed message is answered with an error and reading continues. A framing error
 * or the end of the stream stops the connection; requests already queued still get their
 * responses before the session is closed.
 */
public class StreamConnection implements McpServerTransport {

	private static final Logger logger = LoggerFactory.getLogger(StreamConnection.class);

	private static final List<String> DISCONNECT_MESSAGES = List.of("Connection reset", "Broken pipe",
			"Socket closed", "Stream closed", "Socket is closed");

	static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(5);

	private final String name;

	private final InputStream input;

	private final OutputStream output;

	private final MessageFramer framer;

	private final JsonRpcCodec codec;

	private final Closeable resource;

	private final Duration drainTimeout;

	private final ExecutorService dispatchExecutor;

	private final Object writeLock = new Object();

	private final AtomicBoolean closed = new AtomicBoolean();

	private final AtomicBoolean released = new AtomicBoolean();

	private volatile McpServerSession session;

	private volatile Runnable closeListener;

	/**
	 * @param name connection name used in logs and thread names
	 * @param input inbound stream
	 * @param output outbound stream
	 * @param framer framing of both directions
	 * @param codec envelope codec
	 * @param resource closed with the connection, for example the socket
	 */
	public StreamConnection(String name, InputStream input, OutputStream output, MessageFramer framer,
			JsonRpcCodec codec, @Nullable Closeable resource) {
		this(name, input, output, framer, codec, resource, DEFAULT_DRAIN_TIMEOUT);
	}

	StreamConnection(String name, InputStream input, OutputStream output, MessageFramer framer, JsonRpcCodec codec,
			@Nullable Closeable resource, Duration drainTimeout) {
		Assert.hasText(name, "name must not be empty");
		Assert.notNull(input, "input must not be null");
		Assert.notNull(output, "output must not be null");
		Assert.notNull(framer, "framer must not be null");
		Assert.notNull(codec, "codec must not be null");
		this.name = name;
		this.input = new BufferedInputStream(input);
		this.output = new BufferedOutputStream(output);
		this.framer = framer;
		this.codec = codec;
		this.resource = resource;
		this.drainTimeout = drainTimeout;
		this.dispatchExecutor = Executors.newSingleThreadExecutor(r -> {
			Thread t = new Thread(r, "mcp-dispatch-" + name);
			t.setDaemon(true);
			return t;
		});
	}

	public String getName() {
		return this.name;
	}

	@Nullable
	public McpServerSession getSession() {
		return this.session;
	}

	public boolean isClosed() {
		return this.closed.get();
	}

	void setCloseListener(Runnable closeListener) {
		this.closeListener = closeListener;
	}

	/**
	 * Creates the session and reads until the stream ends or the connection is closed.
	 * Blocks the calling thread.
	 * @param sessionFactory creates the session of this connection
	 */
	public void serve(McpServerSession.Factory sessionFactory) {
		Assert.notNull(sessionFactory, "sessionFactory must not be null");
		this.session = sessionFactory.create(this);
		logger.debug("{}: serving session {}", this.name, this.session.getId());
		try {
			readLoop();
		}
		finally {
			drainAndRelease();
		}
	}

	private void readLoop() {
		while (!this.closed.get()) {
			byte[] frame;
			try {
				frame = this.framer.readFrame(this.input);
			}
			catch (McpFramingException e) {
				if (e.isEndOfStream()) {
					logger.debug("{}: {}", this.name, e.getMessage());
				}
				else {
					logger.warn("{}: closing after framing error: {}", this.name, e.getMessage());
				}
				return;
			}
			catch (IOException e) {
				if (this.closed.get() || isDisconnect(e)) {
					logger.debug("{}: peer disconnected ({})", this.name, e.getMessage());
				}
				else {
					logger.warn("{}: read failed", this.name, e);
				}
				return;
			}

			JSONRPCMessage message;
			try {
				message = this.codec.decode(frame);
			}
			catch (McpEnvelopeException e) {
				logger.warn("{}: rejected malformed message: {}", this.name, e.getMessage());
				JSONRPCResponse error = JSONRPCResponse.failure(e.getRequestId(), e.getJsonRpcError());
				submit(() -> sendQuietly(error));
				continue;
			}

			if (isCancellation(message)) {
				this.session.handle(message);
			}
			else {
				submit(() -> dispatch(message));
			}
		}
	}

	private void dispatch(JSONRPCMessage message) {
		McpServerSession current = this.session;
		if (current.isTerminated()) {
			logger.debug("{}: session terminated, dropping {}", this.name, message);
			return;
		}
		try {
			current.handle(message);
		}
		catch (RuntimeException e) {
			logger.error("{}: unexpected failure while handling {}", this.name, message, e);
		}
		if (current.isTerminated()) {
			logger.debug("{}: session ended, closing connection", this.name);
			close();
		}
	}

	private void submit(Runnable task) {
		try {
			this.dispatchExecutor.execute(task);
		}
		catch (RejectedExecutionException e) {
			logger.debug("{}: connection closing, message dropped", this.name);
		}
	}

	private void sendQuietly(JSONRPCResponse response) {
		try {
			send(this.codec.encode(response));
		}
		catch (IOException | McpTransportException e) {
			logger.warn("{}: could not send error response: {}", this.name, e.getMessage());
		}
	}

	private static boolean isCancellation(JSONRPCMessage message) {
		return message instanceof JSONRPCNotification notification
				&& McpSchema.METHOD_NOTIFICATION_CANCELLED.equals(notification.method());
	}

	static boolean isDisconnect(IOException e) {
		if (e instanceof EOFException || e instanceof ClosedChannelException) {
			return true;
		}
		if (e instanceof SocketException && e.getMessage() != null) {
			String message = e.getMessage();
			return DISCONNECT_MESSAGES.stream().anyMatch(message::contains);
		}
		return false;
	}

	@Override
	public void send(byte[] payload) {
		synchronized (this.writeLock) {
			if (this.released.get()) {
				throw new McpTransportException("Connection " + this.name + " is closed");
			}
			try {
				this.framer.writeFrame(this.output, payload);
			}
			catch (IOException e) {
				throw new McpTransportException("Failed to write to " + this.name, e);
			}
		}
	}

	/**
	 * Stops reading. Safe to call from any thread, including the dispatch worker.
	 */
	@Override
	public void close() {
		if (!this.closed.compareAndSet(false, true)) {
			return;
		}
		logger.debug("{}: closing", this.name);
		closeResource();
		McpServerSession current = this.session;
		if (current != null) {
			current.close();
		}
		this.dispatchExecutor.shutdown();
		Runnable listener = this.closeListener;
		if (listener != null) {
			listener.run();
		}
	}

	/**
	 * Runs on the reading thread once the loop ends: lets queued requests finish, then
	 * cancels whatever is still running and releases the connection.
	 */
	private void drainAndRelease() {
		this.dispatchExecutor.shutdown();
		try {
			if (!this.dispatchExecutor.awaitTermination(this.drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
				logger.debug("{}: queued requests did not finish in {} ms", this.name, this.drainTimeout.toMillis());
				McpServerSession current = this.session;
				if (current != null) {
					current.close();
				}
				this.dispatchExecutor.shutdownNow();
			}
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			this.dispatchExecutor.shutdownNow();
		}
		close();
		synchronized (this.writeLock) {
			this.released.set(true);
			try {
				this.output.flush();
			}
			catch (IOException e) {
				logger.debug("{}: final flush failed: {}", this.name, e.getMessage());
			}
		}
		logger.debug("{}: connection released", this.name);
	}

	private void closeResource() {
		if (this.resource == null) {
			return;
		}
		try {
			this.resource.close();
		}
		catch (IOException e) {
			logger.debug("{}: error while closing: {}", this.name, e.getMessage());
		}
	}

	@Override
	public String toString() {
		return "StreamConnection[" + this.name + "]";
	}

}
