/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.server;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import io.mcpengine.spec.RequestId;
import io.mcpengine.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.util.annotation.Nullable;

/**
 * Tokens of the cancellable requests currently in flight, shared by all sessions of a
 * server. Entries are keyed by session and {@link RequestId}, so equal ids on different
 * connections never collide, and are removed when the request completes whatever its
 * outcome.
 */
public class CancellationTracker {

	private static final Logger logger = LoggerFactory.getLogger(CancellationTracker.class);

	private record Key(String sessionId, RequestId requestId) {
	}

	private final Map<Key, CancellationToken> tokens = new ConcurrentHashMap<>();

	/**
	 * Creates the token for a dispatched request. An id that is still in flight on the
	 * same session is replaced; the previous request keeps its own token object.
	 * @param sessionId owning session
	 * @param requestId id of the dispatched request
	 * @return the new token
	 */
	public CancellationToken register(String sessionId, RequestId requestId) {
		Assert.notNull(sessionId, "sessionId must not be null");
		Assert.notNull(requestId, "requestId must not be null");
		CancellationToken token = new CancellationToken();
		CancellationToken previous = this.tokens.put(new Key(sessionId, requestId), token);
		if (previous != null) {
			logger.warn("Request id {} reused on session {} while still in flight", requestId, sessionId);
		}
		return token;
	}

	/**
	 * Signals cancellation to an in-flight request.
	 * @param sessionId session the request arrived on
	 * @param requestId id of the request
	 * @param reason optional reason made visible to the handler
	 * @return {@code true} if a matching in-flight request was found
	 */
	public boolean cancel(String sessionId, RequestId requestId, @Nullable String reason) {
		CancellationToken token = this.tokens.get(new Key(sessionId, requestId));
		if (token == null) {
			logger.debug("No in-flight request {} on session {} to cancel", requestId, sessionId);
			return false;
		}
		token.cancel(reason);
		logger.debug("Cancelled request {} on session {}: {}", requestId, sessionId, reason);
		return true;
	}

	/**
	 * Removes the token of a finished request. A newer token registered under the same
	 * id is left alone.
	 * @param sessionId owning session
	 * @param requestId id of the finished request
	 * @param token the token handed out by {@link #register}
	 */
	public void complete(String sessionId, RequestId requestId, CancellationToken token) {
		this.tokens.remove(new Key(sessionId, requestId), token);
	}

	/**
	 * Cancels every in-flight request of a session, used when its transport closes.
	 * @param sessionId the session
	 * @param reason reason made visible to the handlers
	 * @return number of requests cancelled
	 */
	public int cancelAll(String sessionId, String reason) {
		int count = 0;
		for (Map.Entry<Key, CancellationToken> entry : this.tokens.entrySet()) {
			if (entry.getKey().sessionId().equals(sessionId) && entry.getValue().cancel(reason)) {
				count++;
			}
		}
		return count;
	}

	public boolean isInFlight(String sessionId, RequestId requestId) {
		return this.tokens.containsKey(new Key(sessionId, requestId));
	}

	public int size() {
		return this.tokens.size();
	}

}
