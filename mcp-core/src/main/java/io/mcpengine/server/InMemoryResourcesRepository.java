/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.server;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.mcpengine.server.McpServerFeatures.ResourceSpecification;
import io.mcpengine.spec.McpSchema;
import io.mcpengine.spec.McpSchema.ListResourcesResult;
import io.mcpengine.util.Assert;

/**
 * In-memory resources, listed by uri.
 */
public class InMemoryResourcesRepository implements ResourcesRepository {

	private final Map<String, ResourceSpecification> resources = new ConcurrentHashMap<>();

	@Override
	public ListResourcesResult listResources(McpRequestContext context, String cursor) {
		List<McpSchema.Resource> list = this.resources.values()
			.stream()
			.map(ResourceSpecification::resource)
			.sorted(Comparator.comparing(McpSchema.Resource::uri))
			.toList();
		return new ListResourcesResult(list, null);
	}

	@Override
	public Optional<ResourceSpecification> resolveResource(String uri, McpRequestContext context) {
		return Optional.ofNullable(this.resources.get(uri));
	}

	@Override
	public void addResource(ResourceSpecification resource) {
		Assert.notNull(resource, "resource must not be null");
		this.resources.put(resource.resource().uri(), resource);
	}

	@Override
	public boolean removeResource(String uri) {
		return this.resources.remove(uri) != null;
	}

}
