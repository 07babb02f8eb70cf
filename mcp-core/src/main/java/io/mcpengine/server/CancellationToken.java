/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.server;

import java.util.concurrent.atomic.AtomicBoolean;

import reactor.util.annotation.Nullable;

/**
 * Cooperative cancellation flag of one in-flight request. Long-running handlers poll
 * {@link #isCancelled()} and return early; the engine never interrupts them.
 * <p>
 * The reason is stored before the flag is raised, so a reader that observes
 * {@code isCancelled() == true} also observes the reason.
 */
public final class CancellationToken {

	private final AtomicBoolean cancelled = new AtomicBoolean();

	private volatile String reason;

	public boolean isCancelled() {
		return this.cancelled.get();
	}

	/**
	 * @return the reason given by the canceller, {@code null} if not cancelled or no
	 * reason was given
	 */
	@Nullable
	public String reason() {
		return this.cancelled.get() ? this.reason : null;
	}

	/**
	 * Raises the flag. Only the first call has an effect.
	 * @param reason optional reason
	 * @return {@code true} if this call cancelled the token
	 */
	synchronized boolean cancel(@Nullable String reason) {
		if (this.cancelled.get()) {
			return false;
		}
		this.reason = reason;
		this.cancelled.set(true);
		return true;
	}

	@Override
	public String toString() {
		return "CancellationToken[cancelled=" + isCancelled() + ", reason=" + reason() + "]";
	}

}
