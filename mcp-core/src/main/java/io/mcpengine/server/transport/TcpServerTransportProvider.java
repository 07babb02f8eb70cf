/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.server.transport;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.ArrayList;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import io.mcpengine.json.McpJsonMapper;
import io.mcpengine.server.McpServerSession;
import io.mcpengine.spec.ContentLengthFramer;
import io.mcpengine.spec.JsonRpcCodec;
import io.mcpengine.spec.McpServerTransportProvider;
import io.mcpengine.spec.McpTransportException;
import io.mcpengine.spec.MessageFramer;
import io.mcpengine.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Listens on a TCP port and serves every accepted connection on its own thread, each
 * with its own session. Content-Length framing is used unless another
 * {@link MessageFramer} is given. A connection that fails or disconnects never affects
 * the others.
 */
public class TcpServerTransportProvider implements McpServerTransportProvider {

	private static final Logger logger = LoggerFactory.getLogger(TcpServerTransportProvider.class);

	private static final int DEFAULT_BACKLOG = 50;

	private final JsonRpcCodec codec;

	private final MessageFramer framer;

	private final String host;

	private final int port;

	private final AtomicInteger connectionCounter = new AtomicInteger();

	private final ExecutorService connectionExecutor = Executors.newCachedThreadPool(r -> {
		Thread t = new Thread(r, "mcp-tcp-connection");
		t.setDaemon(true);
		return t;
	});

	private final Set<StreamConnection> connections = ConcurrentHashMap.newKeySet();

	private final Sinks.Empty<Void> closeSink = Sinks.empty();

	private volatile ServerSocket serverSocket;

	private volatile Scheduler acceptScheduler;

	private volatile boolean running;

	public TcpServerTransportProvider(McpJsonMapper jsonMapper, String host, int port) {
		this(jsonMapper, new ContentLengthFramer(), host, port);
	}

	/**
	 * @param jsonMapper mapper used by the envelope codec
	 * @param framer framing of every connection
	 * @param host address to bind
	 * @param port port to bind, {@code 0} for an ephemeral port
	 */
	public TcpServerTransportProvider(McpJsonMapper jsonMapper, MessageFramer framer, String host, int port) {
		Assert.notNull(jsonMapper, "jsonMapper must not be null");
		Assert.notNull(framer, "framer must not be null");
		Assert.hasText(host, "host must not be empty");
		Assert.isTrue(port >= 0 && port <= 65535, "port must be between 0 and 65535");
		this.codec = new JsonRpcCodec(jsonMapper);
		this.framer = framer;
		this.host = host;
		this.port = port;
	}

	@Override
	public void setSessionFactory(McpServerSession.Factory sessionFactory) {
		Assert.notNull(sessionFactory, "sessionFactory must not be null");
		if (this.running) {
			throw new IllegalStateException("TCP transport is already serving");
		}
		ServerSocket socket;
		try {
			socket = new ServerSocket();
			socket.setReuseAddress(true);
			socket.bind(new InetSocketAddress(this.host, this.port), DEFAULT_BACKLOG);
		}
		catch (IOException e) {
			throw new McpTransportException("Failed to listen on " + this.host + ":" + this.port, e);
		}
		this.serverSocket = socket;
		this.running = true;
		this.acceptScheduler = Schedulers.newSingle("mcp-tcp-accept", true);
		Mono.fromRunnable(() -> acceptLoop(sessionFactory))
			.subscribeOn(this.acceptScheduler)
			.subscribe(null, error -> logger.error("TCP accept loop failed", error));
		logger.info("Serving MCP over TCP on {}:{}", this.host, getLocalPort());
	}

	private void acceptLoop(McpServerSession.Factory sessionFactory) {
		while (this.running) {
			Socket socket;
			try {
				socket = this.serverSocket.accept();
			}
			catch (IOException e) {
				if (this.running) {
					logger.error("Error accepting connection", e);
					continue;
				}
				break;
			}
			serve(socket, sessionFactory);
		}
		logger.debug("TCP accept loop stopped");
	}

	private void serve(Socket socket, McpServerSession.Factory sessionFactory) {
		String name = "tcp-" + this.connectionCounter.incrementAndGet() + "-" + socket.getRemoteSocketAddress();
		StreamConnection connection;
		try {
			socket.setTcpNoDelay(true);
			connection = new StreamConnection(name, socket.getInputStream(), socket.getOutputStream(), this.framer,
					this.codec, socket);
		}
		catch (IOException e) {
			logger.warn("Dropping connection {}: {}", name, e.getMessage());
			closeSocket(socket);
			return;
		}
		this.connections.add(connection);
		try {
			this.connectionExecutor.execute(() -> {
				try {
					connection.serve(sessionFactory);
				}
				catch (RuntimeException e) {
					logger.error("Connection {} failed", name, e);
					connection.close();
				}
				finally {
					this.connections.remove(connection);
					logger.info("Connection {} closed", name);
				}
			});
			logger.info("Accepted connection {}", name);
		}
		catch (RejectedExecutionException e) {
			logger.warn("Connection executor rejected {}", name);
			this.connections.remove(connection);
			closeSocket(socket);
		}
	}

	private static void closeSocket(Socket socket) {
		try {
			socket.close();
		}
		catch (IOException e) {
			logger.debug("Error closing socket: {}", e.getMessage());
		}
	}

	/**
	 * @return the bound port, useful after binding port {@code 0}
	 * @throws IllegalStateException before the provider started
	 */
	public int getLocalPort() {
		ServerSocket socket = this.serverSocket;
		if (socket == null) {
			throw new IllegalStateException("TCP transport is not listening");
		}
		return socket.getLocalPort();
	}

	public int getConnectionCount() {
		return this.connections.size();
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.<Void>fromRunnable(this::stop).subscribeOn(Schedulers.boundedElastic());
	}

	private void stop() {
		if (!this.running) {
			this.closeSink.tryEmitEmpty();
			return;
		}
		this.running = false;
		ServerSocket socket = this.serverSocket;
		if (socket != null) {
			try {
				socket.close();
			}
			catch (IOException e) {
				logger.warn("Error closing server socket", e);
			}
		}
		for (StreamConnection connection : new ArrayList<>(this.connections)) {
			connection.close();
		}
		this.connectionExecutor.shutdown();
		try {
			if (!this.connectionExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
				this.connectionExecutor.shutdownNow();
			}
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			this.connectionExecutor.shutdownNow();
		}
		Scheduler scheduler = this.acceptScheduler;
		if (scheduler != null) {
			scheduler.dispose();
		}
		this.closeSink.tryEmitEmpty();
		logger.info("TCP transport stopped");
	}

	@Override
	public Mono<Void> onClose() {
		return this.closeSink.asMono();
	}

}
