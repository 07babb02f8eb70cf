/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.server;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import io.mcpengine.spec.McpError;
import io.mcpengine.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.util.annotation.Nullable;

/**
 * Maps method names to handlers and runs them between optional hooks.
 * <p>
 * Handlers and hooks are registered during server construction; {@link #freeze()} makes
 * the registry read-only before the first connection is served, after which it is safe to
 * dispatch from any thread.
 *
 * <pre>
 * before -> handler (or fallback) -> [error] -> after
 * </pre>
 *
 * The after hook runs exactly once per dispatch, whatever the outcome.
 */
public class MethodRegistry {

	private static final Logger logger = LoggerFactory.getLogger(MethodRegistry.class);

	@FunctionalInterface
	public interface BeforeHook {

		void beforeDispatch(McpRequestContext context);

	}

	@FunctionalInterface
	public interface AfterHook {

		void afterDispatch(McpRequestContext context, DispatchResult result);

	}

	/**
	 * Turns a handler failure into an outcome. Returning {@code null} falls back to the
	 * default error mapping.
	 */
	@FunctionalInterface
	public interface ErrorHook {

		@Nullable
		DispatchResult onError(McpRequestContext context, Exception error);

	}

	@FunctionalInterface
	public interface FallbackHook {

		DispatchResult onUnknownMethod(McpRequestContext context);

	}

	private final Map<String, McpRequestHandler> handlers = new ConcurrentHashMap<>();

	private volatile BeforeHook beforeHook;

	private volatile AfterHook afterHook;

	private volatile ErrorHook errorHook;

	private volatile FallbackHook fallbackHook;

	private volatile boolean frozen;

	/**
	 * Registers a handler. Registering the same method twice keeps the last handler.
	 * @param method method name
	 * @param handler the handler
	 * @return this registry
	 */
	public MethodRegistry add(String method, McpRequestHandler handler) {
		Assert.hasText(method, "method must not be empty");
		Assert.notNull(handler, "handler must not be null");
		checkNotFrozen();
		if (this.handlers.put(method, handler) != null) {
			logger.warn("Replaced handler for method '{}'", method);
		}
		return this;
	}

	public MethodRegistry setOnBefore(@Nullable BeforeHook hook) {
		checkNotFrozen();
		this.beforeHook = hook;
		return this;
	}

	public MethodRegistry setOnAfter(@Nullable AfterHook hook) {
		checkNotFrozen();
		this.afterHook = hook;
		return this;
	}

	public MethodRegistry setOnError(@Nullable ErrorHook hook) {
		checkNotFrozen();
		this.errorHook = hook;
		return this;
	}

	public MethodRegistry setOnFallback(@Nullable FallbackHook hook) {
		checkNotFrozen();
		this.fallbackHook = hook;
		return this;
	}

	public void freeze() {
		this.frozen = true;
	}

	public boolean isFrozen() {
		return this.frozen;
	}

	public boolean contains(String method) {
		return this.handlers.containsKey(method);
	}

	@Nullable
	public McpRequestHandler handler(String method) {
		return this.handlers.get(method);
	}

	public boolean isCancellable(String method) {
		return this.handlers.get(method) instanceof CancellableRequestHandler;
	}

	public Set<String> methods() {
		return new TreeSet<>(this.handlers.keySet());
	}

	/**
	 * Runs the handler registered for {@code context.method()}.
	 * <ul>
	 * <li>no handler and no fallback: {@code -32601 Method not found}</li>
	 * <li>handler or fallback throws: the error hook decides; without one the exception
	 * maps to a {@link DispatchResult.Failure}</li>
	 * <li>handler returns a {@link DispatchResult}: used as is</li>
	 * <li>any other value: {@link DispatchResult.Success}</li>
	 * </ul>
	 * @param context the request context
	 * @return the outcome, never {@code null}
	 */
	public DispatchResult dispatch(McpRequestContext context) {
		Assert.notNull(context, "context must not be null");
		DispatchResult result;
		try {
			BeforeHook before = this.beforeHook;
			if (before != null) {
				before.beforeDispatch(context);
			}
			McpRequestHandler handler = this.handlers.get(context.method());
			if (handler != null) {
				result = toResult(handler.handle(context, context.params()));
			}
			else {
				result = unknownMethod(context);
			}
		}
		catch (Exception e) {
			result = handleError(context, e);
		}

		AfterHook after = this.afterHook;
		if (after != null) {
			try {
				after.afterDispatch(context, result);
			}
			catch (RuntimeException e) {
				logger.warn("After-dispatch hook failed for '{}'", context.method(), e);
			}
		}
		return result;
	}

	private DispatchResult unknownMethod(McpRequestContext context) {
		FallbackHook fallback = this.fallbackHook;
		if (fallback != null) {
			DispatchResult result = fallback.onUnknownMethod(context);
			return result != null ? result : DispatchResult.NONE;
		}
		logger.debug("No handler for method '{}'", context.method());
		return DispatchResult.failure(McpError.methodNotFound(context.method()).getJsonRpcError());
	}

	private DispatchResult handleError(McpRequestContext context, Exception error) {
		ErrorHook hook = this.errorHook;
		if (hook != null) {
			try {
				DispatchResult result = hook.onError(context, error);
				if (result != null) {
					return result;
				}
			}
			catch (RuntimeException hookFailure) {
				logger.warn("Error hook failed for '{}'", context.method(), hookFailure);
				error.addSuppressed(hookFailure);
			}
		}
		if (error instanceof McpError) {
			logger.debug("Handler for '{}' answered with {}", context.method(), error.toString());
		}
		else {
			logger.error("Handler for '{}' failed", context.method(), error);
		}
		return DispatchResult.failure(error);
	}

	private static DispatchResult toResult(@Nullable Object value) {
		if (value instanceof DispatchResult result) {
			return result;
		}
		return DispatchResult.success(value);
	}

	private void checkNotFrozen() {
		if (this.frozen) {
			throw new IllegalStateException("Method registry is frozen");
		}
	}

}
