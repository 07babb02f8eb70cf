/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.server;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

import io.mcpengine.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * Resources and attributes bound to one request-response cycle. The session opens a
 * scope before dispatch and closes it when the cycle ends, successfully or not;
 * registered resources are closed in reverse registration order. A scope is confined to
 * the thread that dispatches its request.
 */
public final class RequestScope implements AutoCloseable {

	private final Deque<AutoCloseable> resources = new ArrayDeque<>();

	private final Map<String, Object> attributes = new HashMap<>();

	private boolean closed;

	/**
	 * Ties a resource to this scope.
	 * @param resource the resource to close with the scope
	 * @return the resource
	 * @param <T> resource type
	 * @throws IllegalStateException if the scope is already closed
	 */
	public <T extends AutoCloseable> T register(T resource) {
		Assert.notNull(resource, "resource must not be null");
		checkOpen();
		this.resources.push(resource);
		return resource;
	}

	public void onClose(Runnable action) {
		Assert.notNull(action, "action must not be null");
		register(action::run);
	}

	public void put(String key, Object value) {
		checkOpen();
		this.attributes.put(key, value);
	}

	@Nullable
	@SuppressWarnings("unchecked")
	public <T> T get(String key) {
		return (T) this.attributes.get(key);
	}

	public boolean isClosed() {
		return this.closed;
	}

	/**
	 * Releases everything bound to the scope. Every resource is closed even when an
	 * earlier one fails.
	 * @throws IllegalStateException carrying the first failure, later ones suppressed
	 */
	@Override
	public void close() {
		if (this.closed) {
			return;
		}
		this.closed = true;
		this.attributes.clear();
		Exception failure = null;
		while (!this.resources.isEmpty()) {
			AutoCloseable resource = this.resources.pop();
			try {
				resource.close();
			}
			catch (Exception e) {
				if (failure == null) {
					failure = e;
				}
				else {
					failure.addSuppressed(e);
				}
			}
		}
		if (failure != null) {
			throw new IllegalStateException("Failed to release request resources", failure);
		}
	}

	private void checkOpen() {
		if (this.closed) {
			throw new IllegalStateException("Request scope is closed");
		}
	}

}
