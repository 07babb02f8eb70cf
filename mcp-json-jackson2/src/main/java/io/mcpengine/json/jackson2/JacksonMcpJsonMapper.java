/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.json.jackson2;

import java.io.IOException;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.mcpengine.json.McpJsonMapper;
import io.mcpengine.json.TypeRef;

/**
 * {@link McpJsonMapper} backed by a Jackson 2 {@link ObjectMapper}.
 */
public final class JacksonMcpJsonMapper implements McpJsonMapper {

	private final ObjectMapper objectMapper;

	/**
	 * @param objectMapper the configured Jackson mapper to delegate to
	 */
	public JacksonMcpJsonMapper(ObjectMapper objectMapper) {
		if (objectMapper == null) {
			throw new IllegalArgumentException("ObjectMapper must not be null");
		}
		this.objectMapper = objectMapper;
	}

	public ObjectMapper getObjectMapper() {
		return this.objectMapper;
	}

	@Override
	public <T> T readValue(byte[] content, Class<T> type) throws IOException {
		return this.objectMapper.readValue(content, type);
	}

	@Override
	public <T> T readValue(String content, Class<T> type) throws IOException {
		return this.objectMapper.readValue(content, type);
	}

	@Override
	public <T> T readValue(String content, TypeRef<T> type) throws IOException {
		return this.objectMapper.readValue(content, javaType(type));
	}

	@Override
	public <T> T convertValue(Object fromValue, Class<T> type) {
		return this.objectMapper.convertValue(fromValue, type);
	}

	@Override
	public <T> T convertValue(Object fromValue, TypeRef<T> type) {
		return this.objectMapper.convertValue(fromValue, javaType(type));
	}

	@Override
	public String writeValueAsString(Object value) throws IOException {
		return this.objectMapper.writeValueAsString(value);
	}

	@Override
	public byte[] writeValueAsBytes(Object value) throws IOException {
		return this.objectMapper.writeValueAsBytes(value);
	}

	private JavaType javaType(TypeRef<?> type) {
		return this.objectMapper.getTypeFactory().constructType(type.getType());
	}

}
