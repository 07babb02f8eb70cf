/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.json.jackson2;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

import io.mcpengine.json.McpJsonMapper;
import io.mcpengine.json.McpJsonMapperSupplier;

/**
 * Supplies the Jackson 2 backed {@link McpJsonMapper}. Registered as a
 * {@link java.util.ServiceLoader} provider of {@link McpJsonMapperSupplier}.
 */
public class JacksonMcpJsonMapperSupplier implements McpJsonMapperSupplier {

	@Override
	public McpJsonMapper get() {
		return new JacksonMcpJsonMapper(createMapper());
	}

	/**
	 * Creates the engine's {@link ObjectMapper}:
	 * <ul>
	 * <li>no {@code setAccessible()} calls, so schema records bind without
	 * {@code --add-opens}</li>
	 * <li>constructor parameter names from the {@code -parameters} compiler flag</li>
	 * <li>unknown members of inbound params are ignored</li>
	 * <li>a trailing token after the root value is a parse error, so one frame always
	 * carries exactly one message</li>
	 * </ul>
	 * @return the configured mapper
	 */
	static ObjectMapper createMapper() {
		return JsonMapper.builder()
			.disable(MapperFeature.CAN_OVERRIDE_ACCESS_MODIFIERS)
			.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
			.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
			.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
			.addModule(new ParameterNamesModule())
			.build();
	}

}
