/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.json;

import java.util.function.Supplier;

/**
 * Service provider interface for {@link McpJsonMapper} implementations. Register an
 * implementation in {@code META-INF/services/io.mcpengine.json.McpJsonMapperSupplier}.
 */
public interface McpJsonMapperSupplier extends Supplier<McpJsonMapper> {

}
