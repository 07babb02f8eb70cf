/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.server;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Consumer;

import io.mcpengine.spec.JsonRpcCodec;
import io.mcpengine.spec.McpSchema;
import io.mcpengine.spec.McpSchema.JSONRPCNotification;
import io.mcpengine.spec.McpSchema.ProgressNotification;
import io.mcpengine.spec.McpTransportException;
import io.mcpengine.spec.ProgressToken;
import io.mcpengine.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.util.annotation.Nullable;

/**
 * Reports the progress of one long-running request as {@code notifications/progress}.
 * <p>
 * Without a progress token from the client the tracker still keeps count but sends
 * nothing. In {@link NotificationMode#ASYNC} updates are serialized and queued on the
 * session's {@link NotificationDeliveryService}, so {@link #update} never blocks on the
 * transport.
 */
public class ProgressTracker {

	private static final Logger logger = LoggerFactory.getLogger(ProgressTracker.class);

	private final ProgressToken progressToken;

	private final Double total;

	private final NotificationMode mode;

	private final Consumer<JSONRPCNotification> syncSender;

	private final NotificationDeliveryService deliveryService;

	private final JsonRpcCodec codec;

	private final long startNanos = System.nanoTime();

	private volatile double progress;

	private volatile boolean completed;

	public ProgressTracker(@Nullable ProgressToken progressToken, @Nullable Double total, NotificationMode mode,
			Consumer<JSONRPCNotification> syncSender, @Nullable NotificationDeliveryService deliveryService,
			JsonRpcCodec codec) {
		Assert.notNull(mode, "mode must not be null");
		Assert.notNull(syncSender, "syncSender must not be null");
		Assert.notNull(codec, "codec must not be null");
		this.progressToken = progressToken;
		this.total = total;
		this.mode = mode;
		this.syncSender = syncSender;
		this.deliveryService = deliveryService;
		this.codec = codec;
	}

	/**
	 * Records progress and notifies the client.
	 * @param progress progress so far
	 * @param message optional human readable message
	 * @throws IllegalStateException in asynchronous mode without a delivery service
	 */
	public void update(double progress, @Nullable String message) {
		if (progress < this.progress) {
			logger.debug("Progress for {} went backwards: {} -> {}", this.progressToken, this.progress, progress);
		}
		this.progress = progress;
		send(progress, message);
	}

	public void update(double progress) {
		update(progress, null);
	}

	/**
	 * Sends the final update, {@code total} when known.
	 * @param message optional closing message
	 */
	public void complete(@Nullable String message) {
		double last = this.total != null ? this.total : this.progress;
		this.progress = last;
		this.completed = true;
		send(last, message);
	}

	private void send(double value, @Nullable String message) {
		if (this.progressToken == null) {
			return;
		}
		JSONRPCNotification notification = new JSONRPCNotification(McpSchema.METHOD_NOTIFICATION_PROGRESS,
				new ProgressNotification(this.progressToken, value, this.total, message));
		if (this.mode == NotificationMode.SYNC) {
			this.syncSender.accept(notification);
			return;
		}
		if (this.deliveryService == null) {
			throw new IllegalStateException("Asynchronous progress requires a notification delivery service");
		}
		try {
			this.deliveryService.enqueue(this.codec.encode(notification));
		}
		catch (IOException e) {
			throw new McpTransportException("Failed to serialize progress notification", e);
		}
	}

	@Nullable
	public ProgressToken progressToken() {
		return this.progressToken;
	}

	public double progress() {
		return this.progress;
	}

	@Nullable
	public Double total() {
		return this.total;
	}

	public boolean isCompleted() {
		return this.completed;
	}

	/**
	 * @return progress as a percentage of the total, empty when the total is unknown
	 */
	public OptionalDouble percentage() {
		if (this.total == null || this.total <= 0) {
			return OptionalDouble.empty();
		}
		return OptionalDouble.of(Math.min(100.0, this.progress * 100.0 / this.total));
	}

	/**
	 * Linear estimate of the time left, based on the rate observed so far.
	 * @return the estimate, empty without a total or before any progress
	 */
	public Optional<Duration> estimatedRemaining() {
		double current = this.progress;
		if (this.total == null || current <= 0) {
			return Optional.empty();
		}
		if (current >= this.total) {
			return Optional.of(Duration.ZERO);
		}
		long elapsed = System.nanoTime() - this.startNanos;
		return Optional.of(Duration.ofNanos((long) (elapsed * (this.total - current) / current)));
	}

}
