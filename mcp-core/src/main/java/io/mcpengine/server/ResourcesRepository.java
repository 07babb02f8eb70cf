/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.server;

import java.util.Optional;

import io.mcpengine.server.McpServerFeatures.ResourceSpecification;
import io.mcpengine.spec.McpSchema.ListResourcesResult;
import reactor.util.annotation.Nullable;

/**
 * Source of the resources a server exposes, looked up by uri.
 */
public interface ResourcesRepository {

	ListResourcesResult listResources(McpRequestContext context, @Nullable String cursor);

	Optional<ResourceSpecification> resolveResource(String uri, McpRequestContext context);

	void addResource(ResourceSpecification resource);

	boolean removeResource(String uri);

}
