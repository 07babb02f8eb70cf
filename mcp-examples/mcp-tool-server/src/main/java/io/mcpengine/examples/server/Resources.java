/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.examples.server;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import io.mcpengine.json.McpJsonDefaults;
import io.mcpengine.server.McpServerFeatures.ResourceSpecification;
import io.mcpengine.spec.McpError;
import io.mcpengine.spec.McpSchema;
import io.mcpengine.spec.McpSchema.ErrorCodes;
import io.mcpengine.spec.McpSchema.Implementation;
import io.mcpengine.spec.McpSchema.ReadResourceResult;
import io.mcpengine.spec.McpSchema.Resource;
import io.mcpengine.spec.McpSchema.TextResourceContents;

/**
 * Resources published by the example server.
 */
public final class Resources {

	public static final String INFO_URI = "info://server";

	public static final String CONFIG_URI = "config://server";

	private Resources() {
	}

	public static ResourceSpecification info(Implementation serverInfo) {
		String text = serverInfo.name() + " " + serverInfo.version() + "\nProtocol: "
				+ McpSchema.LATEST_PROTOCOL_VERSION + "\nTools: "
				+ Tools.all().stream().map(tool -> tool.tool().name()).toList();
		return new ResourceSpecification(
				Resource.builder()
					.uri(INFO_URI)
					.name("server-info")
					.description("Name, version and protocol of this server")
					.mimeType("text/plain")
					.build(),
				(context, request) -> new ReadResourceResult(
						List.of(new TextResourceContents(INFO_URI, "text/plain", text))));
	}

	public static ResourceSpecification config(ServerOptions options) {
		return new ResourceSpecification(
				Resource.builder()
					.uri(CONFIG_URI)
					.name("server-config")
					.description("Effective configuration of this server")
					.mimeType("application/json")
					.build(),
				(context, request) -> new ReadResourceResult(
						List.of(new TextResourceContents(CONFIG_URI, "application/json", toJson(options.toMap())))));
	}

	private static String toJson(Map<String, Object> value) {
		try {
			return McpJsonDefaults.getMapper().writeValueAsString(value);
		}
		catch (IOException e) {
			throw McpError.builder(ErrorCodes.INTERNAL_ERROR)
				.message("Failed to render configuration")
				.cause(e)
				.build();
		}
	}

}
