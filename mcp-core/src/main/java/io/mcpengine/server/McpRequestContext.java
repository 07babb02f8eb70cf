/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.server;

import io.mcpengine.spec.ProgressToken;
import io.mcpengine.spec.RequestId;
import io.mcpengine.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * Everything a handler can see about the message it is processing: the method, the id
 * (absent for notifications), the raw params, the per-request {@link RequestScope}, the
 * cancellation token and the session the message arrived on.
 */
public final class McpRequestContext {

	private final McpServerSession session;

	private final String method;

	private final RequestId requestId;

	private final Object params;

	private final RequestScope scope;

	private final CancellationToken cancellationToken;

	/**
	 * @param session owning session, {@code null} when dispatching outside a connection
	 * @param method method name
	 * @param requestId request id, {@code null} for notifications
	 * @param params raw params
	 * @param scope the request scope
	 * @param cancellationToken the token; a fresh untracked token when {@code null}
	 */
	public McpRequestContext(@Nullable McpServerSession session, String method, @Nullable RequestId requestId,
			@Nullable Object params, RequestScope scope, @Nullable CancellationToken cancellationToken) {
		Assert.hasText(method, "method must not be empty");
		Assert.notNull(scope, "scope must not be null");
		this.session = session;
		this.method = method;
		this.requestId = requestId;
		this.params = params;
		this.scope = scope;
		this.cancellationToken = cancellationToken != null ? cancellationToken : new CancellationToken();
	}

	public String method() {
		return this.method;
	}

	@Nullable
	public RequestId requestId() {
		return this.requestId;
	}

	public boolean isNotification() {
		return this.requestId == null;
	}

	@Nullable
	public Object params() {
		return this.params;
	}

	public RequestScope scope() {
		return this.scope;
	}

	public CancellationToken cancellationToken() {
		return this.cancellationToken;
	}

	public McpServerSession session() {
		if (this.session == null) {
			throw new IllegalStateException("No session bound to the dispatch of '" + this.method + "'");
		}
		return this.session;
	}

	@Nullable
	public String sessionId() {
		return this.session != null ? this.session.getId() : null;
	}

	/**
	 * Creates a progress reporter for this request. Updates are sent with the session's
	 * notification mode; a {@code null} token yields a reporter that sends nothing.
	 * @param progressToken token supplied by the client in {@code _meta}
	 * @param total expected total, {@code null} when unknown
	 * @return the tracker
	 */
	public ProgressTracker progressTracker(@Nullable ProgressToken progressToken, @Nullable Double total) {
		return session().createProgressTracker(progressToken, total);
	}

	@Override
	public String toString() {
		return "McpRequestContext[method=" + this.method + ", id=" + this.requestId + ", session=" + sessionId()
				+ "]";
	}

}
