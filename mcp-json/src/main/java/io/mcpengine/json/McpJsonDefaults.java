/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.json;

/**
 * Lazily resolved, shared default {@link McpJsonMapper}.
 */
public final class McpJsonDefaults {

	private static volatile McpJsonMapper mapper;

	private McpJsonDefaults() {
	}

	/**
	 * Returns the shared mapper, resolving it through {@link McpJsonMapper#createDefault()}
	 * on first use.
	 * @return the default mapper
	 * @throws IllegalStateException if no implementation is available
	 */
	public static McpJsonMapper getMapper() {
		McpJsonMapper result = mapper;
		if (result == null) {
			synchronized (McpJsonDefaults.class) {
				result = mapper;
				if (result == null) {
					result = McpJsonMapper.createDefault();
					mapper = result;
				}
			}
		}
		return result;
	}

}
