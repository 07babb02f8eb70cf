/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.server;

import java.time.Duration;
import java.util.Arrays;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import io.mcpengine.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.annotation.Nullable;

/**
 * Delivers serialized notifications in enqueue order from a background worker.
 * <p>
 * Producers call {@link #enqueue(byte[])} from any thread; the worker wakes up every poll
 * interval and hands each queued message to the delivery callback. One callback failure
 * is logged and the worker moves on to the next message.
 */
public class NotificationDeliveryService implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(NotificationDeliveryService.class);

	public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(10);

	private final Queue<byte[]> queue = new ConcurrentLinkedQueue<>();

	private final Object deliveryLock = new Object();

	private final AtomicBoolean running = new AtomicBoolean();

	private final Consumer<byte[]> callback;

	private final Duration pollInterval;

	private final Scheduler scheduler;

	private final boolean ownsScheduler;

	private volatile Disposable worker;

	private volatile boolean closed;

	public NotificationDeliveryService(Consumer<byte[]> callback) {
		this(callback, DEFAULT_POLL_INTERVAL, null);
	}

	/**
	 * @param callback receives each message, usually the transport write
	 * @param pollInterval how often the worker checks the queue
	 * @param scheduler scheduler running the worker; when {@code null} a dedicated
	 * single-thread scheduler is created and disposed on {@link #close()}
	 */
	public NotificationDeliveryService(Consumer<byte[]> callback, Duration pollInterval,
			@Nullable Scheduler scheduler) {
		Assert.notNull(callback, "callback must not be null");
		Assert.notNull(pollInterval, "pollInterval must not be null");
		Assert.isTrue(!pollInterval.isNegative() && !pollInterval.isZero(), "pollInterval must be positive");
		this.callback = callback;
		this.pollInterval = pollInterval;
		this.ownsScheduler = scheduler == null;
		this.scheduler = scheduler != null ? scheduler : Schedulers.newSingle("mcp-notification-delivery", true);
	}

	/**
	 * Starts the worker. Calling it on a running service does nothing.
	 * @throws IllegalStateException after {@link #close()}
	 */
	public void start() {
		if (this.closed) {
			throw new IllegalStateException("Notification delivery service is closed");
		}
		if (this.running.compareAndSet(false, true)) {
			this.worker = Flux.interval(this.pollInterval, this.scheduler)
				.subscribe(tick -> drain(), error -> logger.error("Notification worker terminated", error));
			logger.debug("Notification worker started, polling every {} ms", this.pollInterval.toMillis());
		}
	}

	/**
	 * Stops the worker after the message being delivered, if any. Queued messages stay
	 * queued and are delivered after a restart.
	 */
	public void stop() {
		if (this.running.compareAndSet(true, false)) {
			Disposable current = this.worker;
			if (current != null) {
				current.dispose();
			}
			logger.debug("Notification worker stopped with {} pending", this.queue.size());
		}
	}

	public boolean isRunning() {
		return this.running.get();
	}

	/**
	 * Queues a copy of the message.
	 * @param message serialized notification
	 * @return {@code false} if the service is closed and the message was dropped
	 */
	public boolean enqueue(byte[] message) {
		Assert.notNull(message, "message must not be null");
		if (this.closed) {
			logger.debug("Dropping notification, delivery service is closed");
			return false;
		}
		this.queue.add(Arrays.copyOf(message, message.length));
		return true;
	}

	public int pendingCount() {
		return this.queue.size();
	}

	private void drain() {
		synchronized (this.deliveryLock) {
			byte[] message;
			while (this.running.get() && (message = this.queue.poll()) != null) {
				try {
					this.callback.accept(message);
				}
				catch (RuntimeException e) {
					logger.warn("Failed to deliver notification", e);
				}
			}
		}
	}

	/**
	 * Stops the worker, waits for a delivery in progress and discards whatever is still
	 * queued.
	 */
	@Override
	public void close() {
		if (this.closed) {
			return;
		}
		this.closed = true;
		stop();
		synchronized (this.deliveryLock) {
			int discarded = this.queue.size();
			this.queue.clear();
			if (discarded > 0) {
				logger.debug("Discarded {} undelivered notifications", discarded);
			}
		}
		if (this.ownsScheduler) {
			this.scheduler.dispose();
		}
	}

}
