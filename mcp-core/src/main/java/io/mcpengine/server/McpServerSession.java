/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.server;

import java.io.IOException;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import io.mcpengine.spec.JsonRpcCodec;
import io.mcpengine.spec.McpError;
import io.mcpengine.spec.McpSchema;
import io.mcpengine.spec.McpSchema.ErrorCodes;
import io.mcpengine.spec.McpSchema.JSONRPCMessage;
import io.mcpengine.spec.McpSchema.JSONRPCNotification;
import io.mcpengine.spec.McpSchema.JSONRPCRequest;
import io.mcpengine.spec.McpSchema.JSONRPCResponse;
import io.mcpengine.spec.McpSchema.JSONRPCResponse.JSONRPCError;
import io.mcpengine.spec.McpServerTransport;
import io.mcpengine.spec.McpTransportException;
import io.mcpengine.spec.ProgressToken;
import io.mcpengine.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.util.annotation.Nullable;

/**
 * Server side of one client connection. The transport hands every decoded message to
 * {@link #handle(JSONRPCMessage)}; the session applies the lifecycle rules, dispatches
 * through the shared {@link MethodRegistry} and writes the response.
 * <p>
 * Each request runs inside its own {@link RequestScope}, closed before the response is
 * written. Requests routed to a {@link CancellableRequestHandler} are tracked in the
 * {@link CancellationTracker} until they complete.
 */
public class McpServerSession {

	private static final Logger logger = LoggerFactory.getLogger(McpServerSession.class);

	/**
	 * Creates the session of a new connection.
	 */
	@FunctionalInterface
	public interface Factory {

		McpServerSession create(McpServerTransport transport);

	}

	private final String id = UUID.randomUUID().toString();

	private final McpServerTransport transport;

	private final JsonRpcCodec codec;

	private final MethodRegistry registry;

	private final CancellationTracker cancellationTracker;

	private final McpServerLifecycle lifecycle;

	private final NotificationMode notificationMode;

	private final NotificationDeliveryService deliveryService;

	private final Set<String> subscriptions = ConcurrentHashMap.newKeySet();

	private final List<Runnable> closeListeners = new CopyOnWriteArrayList<>();

	private final AtomicBoolean closed = new AtomicBoolean();

	/**
	 * @param transport outbound side of the connection
	 * @param codec codec used for every outbound message
	 * @param registry frozen registry shared by all sessions
	 * @param cancellationTracker tracker shared by all sessions
	 * @param protocolVersion protocol version the server speaks
	 * @param notificationMode how {@link #notifyClient} delivers
	 * @param deliveryService worker for {@link NotificationMode#ASYNC}, started here
	 * @throws IllegalArgumentException in asynchronous mode without a delivery service
	 */
	public McpServerSession(McpServerTransport transport, JsonRpcCodec codec, MethodRegistry registry,
			CancellationTracker cancellationTracker, String protocolVersion, NotificationMode notificationMode,
			@Nullable NotificationDeliveryService deliveryService) {
		Assert.notNull(transport, "transport must not be null");
		Assert.notNull(codec, "codec must not be null");
		Assert.notNull(registry, "registry must not be null");
		Assert.notNull(cancellationTracker, "cancellationTracker must not be null");
		Assert.notNull(notificationMode, "notificationMode must not be null");
		Assert.isTrue(notificationMode == NotificationMode.SYNC || deliveryService != null,
				"Asynchronous notifications require a delivery service");
		this.transport = transport;
		this.codec = codec;
		this.registry = registry;
		this.cancellationTracker = cancellationTracker;
		this.lifecycle = new McpServerLifecycle(protocolVersion);
		this.notificationMode = notificationMode;
		this.deliveryService = deliveryService;
		if (deliveryService != null) {
			deliveryService.start();
		}
	}

	public String getId() {
		return this.id;
	}

	public McpServerLifecycle lifecycle() {
		return this.lifecycle;
	}

	public boolean isTerminated() {
		return this.lifecycle.isTerminated();
	}

	/**
	 * Processes one inbound message on the calling thread. Responses from the client are
	 * logged and dropped; the server never issues requests.
	 * @param message decoded message
	 */
	public void handle(JSONRPCMessage message) {
		if (message instanceof JSONRPCRequest request) {
			handleRequest(request);
		}
		else if (message instanceof JSONRPCNotification notification) {
			handleNotification(notification);
		}
		else if (message instanceof JSONRPCResponse response) {
			logger.debug("Session {} ignoring response for id {}", this.id, response.id());
		}
	}

	private void handleRequest(JSONRPCRequest request) {
		if (isTerminated()) {
			logger.debug("Session {} dropping '{}' received after shutdown", this.id, request.method());
			return;
		}
		CancellationToken token = this.registry.isCancellable(request.method())
				? this.cancellationTracker.register(this.id, request.id()) : null;
		RequestScope scope = new RequestScope();
		DispatchResult result;
		try {
			result = dispatch(new McpRequestContext(this, request.method(), request.id(), request.params(), scope,
					token));
		}
		finally {
			if (token != null) {
				this.cancellationTracker.complete(this.id, request.id(), token);
			}
			closeScope(scope, request.method());
		}

		if (result instanceof DispatchResult.Success success) {
			sendResponse(JSONRPCResponse.success(request.id(), success.result()));
		}
		else if (result instanceof DispatchResult.Failure failure) {
			sendResponse(JSONRPCResponse.failure(request.id(), failure.error()));
		}
		else if (result instanceof DispatchResult.EndStream) {
			endStream(request.method());
		}
		else {
			logger.debug("Session {} answers '{}' ({}) with a null result, handler produced none", this.id,
					request.method(), request.id());
			sendResponse(JSONRPCResponse.success(request.id(), null));
		}
	}

	private void handleNotification(JSONRPCNotification notification) {
		if (isTerminated()) {
			return;
		}
		RequestScope scope = new RequestScope();
		DispatchResult result;
		try {
			result = dispatch(new McpRequestContext(this, notification.method(), null, notification.params(), scope,
					null));
		}
		finally {
			closeScope(scope, notification.method());
		}
		if (result instanceof DispatchResult.Failure failure) {
			if (Integer.valueOf(ErrorCodes.METHOD_NOT_FOUND).equals(failure.error().code())) {
				logger.debug("Session {} ignoring notification '{}' without handler", this.id,
						notification.method());
			}
			else {
				logger.warn("Session {} failed to process notification '{}': {}", this.id, notification.method(),
						failure.error().message());
			}
		}
		else if (result instanceof DispatchResult.EndStream) {
			endStream(notification.method());
		}
	}

	private DispatchResult dispatch(McpRequestContext context) {
		// unregistered methods fall through to the registry so they answer -32601
		if (this.registry.contains(context.method())) {
			try {
				this.lifecycle.checkPermitted(context.method());
			}
			catch (McpError e) {
				logger.debug("Session {} rejected '{}' in state {}", this.id, context.method(), this.lifecycle.state());
				return DispatchResult.failure(e.getJsonRpcError());
			}
		}
		return this.registry.dispatch(context);
	}

	private void closeScope(RequestScope scope, String method) {
		try {
			scope.close();
		}
		catch (IllegalStateException e) {
			logger.warn("Session {} failed to release resources of '{}'", this.id, method, e);
		}
	}

	private void endStream(String method) {
		logger.debug("Session {} ending stream after '{}'", this.id, method);
		this.lifecycle.terminate();
	}

	private void sendResponse(JSONRPCResponse response) {
		byte[] payload;
		try {
			payload = this.codec.encode(response);
		}
		catch (IOException e) {
			logger.error("Session {} failed to serialize the response to {}", this.id, response.id(), e);
			try {
				payload = this.codec.encode(JSONRPCResponse.failure(response.id(),
						new JSONRPCError(ErrorCodes.INTERNAL_ERROR, "Failed to serialize result", null)));
			}
			catch (IOException unexpected) {
				throw new McpTransportException("Failed to serialize error response", unexpected);
			}
		}
		try {
			this.transport.send(payload);
		}
		catch (McpTransportException e) {
			logger.warn("Session {} could not deliver the response to {}: {}", this.id, response.id(),
					e.getMessage());
		}
	}

	/**
	 * Serializes and writes a message on the calling thread.
	 * @param message the message
	 * @throws McpTransportException if serialization or the write fails
	 */
	public void sendMessage(JSONRPCMessage message) {
		try {
			this.transport.send(this.codec.encode(message));
		}
		catch (IOException e) {
			throw new McpTransportException("Failed to serialize " + message, e);
		}
	}

	/**
	 * Sends a notification synchronously, whatever the notification mode.
	 * @param method notification method
	 * @param params notification params, may be {@code null}
	 */
	public void sendNotification(String method, @Nullable Object params) {
		sendMessage(new JSONRPCNotification(method, params));
	}

	/**
	 * Sends a server-initiated notification with the configured {@link NotificationMode}.
	 * Sessions that have not completed the handshake are skipped.
	 * @param method notification method
	 * @param params notification params, may be {@code null}
	 * @return {@code true} if the notification was written or queued
	 */
	public boolean notifyClient(String method, @Nullable Object params) {
		if (!this.lifecycle.isReady()) {
			logger.debug("Session {} not ready, skipping '{}'", this.id, method);
			return false;
		}
		JSONRPCNotification notification = new JSONRPCNotification(method, params);
		try {
			if (this.notificationMode == NotificationMode.SYNC) {
				sendMessage(notification);
				return true;
			}
			return this.deliveryService.enqueue(this.codec.encode(notification));
		}
		catch (IOException | McpTransportException e) {
			logger.warn("Session {} failed to send '{}': {}", this.id, method, e.getMessage());
			return false;
		}
	}

	public ProgressTracker createProgressTracker(@Nullable ProgressToken progressToken, @Nullable Double total) {
		return new ProgressTracker(progressToken, total, this.notificationMode, this::sendMessage,
				this.deliveryService, this.codec);
	}

	public NotificationMode notificationMode() {
		return this.notificationMode;
	}

	public void subscribe(String uri) {
		Assert.hasText(uri, "uri must not be empty");
		this.subscriptions.add(uri);
	}

	public boolean unsubscribe(String uri) {
		return this.subscriptions.remove(uri);
	}

	public boolean isSubscribed(String uri) {
		return this.subscriptions.contains(uri);
	}

	/**
	 * Sends {@code notifications/resources/updated} when this session subscribed to the
	 * uri.
	 * @param uri the updated resource
	 * @return {@code true} if the session was notified
	 */
	public boolean notifyResourceUpdated(String uri) {
		if (!isSubscribed(uri)) {
			return false;
		}
		return notifyClient(McpSchema.METHOD_NOTIFICATION_RESOURCES_UPDATED,
				new McpSchema.ResourcesUpdatedNotification(uri));
	}

	public void addCloseListener(Runnable listener) {
		Assert.notNull(listener, "listener must not be null");
		this.closeListeners.add(listener);
	}

	/**
	 * Releases the session after its connection ended: in-flight requests are cancelled,
	 * undelivered notifications are discarded and the lifecycle moves to
	 * {@link ServerState#SHUTDOWN}.
	 */
	public void close() {
		if (!this.closed.compareAndSet(false, true)) {
			return;
		}
		this.lifecycle.terminate();
		int cancelled = this.cancellationTracker.cancelAll(this.id, "Connection closed");
		if (this.deliveryService != null) {
			this.deliveryService.close();
		}
		this.subscriptions.clear();
		logger.debug("Session {} closed, {} in-flight requests cancelled", this.id, cancelled);
		for (Runnable listener : this.closeListeners) {
			try {
				listener.run();
			}
			catch (RuntimeException e) {
				logger.warn("Session {} close listener failed", this.id, e);
			}
		}
	}

	@Override
	public String toString() {
		return "McpServerSession[" + this.id + ", " + this.lifecycle.state() + "]";
	}

}
