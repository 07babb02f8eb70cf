/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.util;

import java.util.Collection;

import reactor.util.annotation.Nullable;

/**
 * Argument assertions. Every failure is an {@link IllegalArgumentException}.
 */
public final class Assert {

	private Assert() {
	}

	public static void notNull(@Nullable Object object, String message) {
		if (object == null) {
			throw new IllegalArgumentException(message);
		}
	}

	public static void hasText(@Nullable String text, String message) {
		if (!Utils.hasText(text)) {
			throw new IllegalArgumentException(message);
		}
	}

	public static void notEmpty(@Nullable Collection<?> collection, String message) {
		if (Utils.isEmpty(collection)) {
			throw new IllegalArgumentException(message);
		}
	}

	public static void isTrue(boolean expression, String message) {
		if (!expression) {
			throw new IllegalArgumentException(message);
		}
	}

}
