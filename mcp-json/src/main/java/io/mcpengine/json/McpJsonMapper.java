/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.json;

import java.io.IOException;
import java.util.ServiceLoader;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * JSON binding used by the engine at its wire boundary. The codec reads inbound frames
 * into generic values ({@code Map}, {@code List}, strings, numbers, booleans and
 * {@code null}) and converts {@code params} into typed schema records with
 * {@link #convertValue(Object, Class)}. The default implementation is discovered with
 * {@link ServiceLoader} through {@link McpJsonMapperSupplier}.
 */
public interface McpJsonMapper {

	/**
	 * Read a JSON document into the given type.
	 * @param content UTF-8 encoded JSON
	 * @param type target class, {@code Object.class} for a generic value
	 * @return the bound value, {@code null} for a JSON {@code null} document
	 * @param <T> target type
	 * @throws IOException when the content is not well-formed JSON or cannot be bound
	 */
	<T> T readValue(byte[] content, Class<T> type) throws IOException;

	/**
	 * Read a JSON document into the given type.
	 * @param content JSON text
	 * @param type target class
	 * @return the bound value
	 * @param <T> target type
	 * @throws IOException when the content is not well-formed JSON or cannot be bound
	 */
	<T> T readValue(String content, Class<T> type) throws IOException;

	/**
	 * Read a JSON document into a parameterized type.
	 * @param content JSON text
	 * @param type parameterized type reference
	 * @return the bound value
	 * @param <T> target type
	 * @throws IOException when the content is not well-formed JSON or cannot be bound
	 */
	<T> T readValue(String content, TypeRef<T> type) throws IOException;

	/**
	 * Convert an already parsed value, for example the {@code params} member of a
	 * request, into the given type.
	 * @param fromValue source value
	 * @param type target class
	 * @return converted value
	 * @param <T> target type
	 * @throws IllegalArgumentException when the value does not fit the target type
	 */
	<T> T convertValue(Object fromValue, Class<T> type);

	/**
	 * Convert an already parsed value into a parameterized type.
	 * @param fromValue source value
	 * @param type target type reference
	 * @return converted value
	 * @param <T> target type
	 * @throws IllegalArgumentException when the value does not fit the target type
	 */
	<T> T convertValue(Object fromValue, TypeRef<T> type);

	/**
	 * Write a value as JSON text.
	 * @param value value to write
	 * @return JSON text
	 * @throws IOException on serialization errors
	 */
	String writeValueAsString(Object value) throws IOException;

	/**
	 * Write a value as UTF-8 encoded JSON.
	 * @param value value to write
	 * @return JSON bytes
	 * @throws IOException on serialization errors
	 */
	byte[] writeValueAsBytes(Object value) throws IOException;

	/**
	 * Resolves the default {@link McpJsonMapper} from the first
	 * {@link McpJsonMapperSupplier} found on the class path.
	 * @return the default mapper
	 * @throws IllegalStateException if no supplier is available or every supplier fails
	 */
	static McpJsonMapper createDefault() {
		AtomicReference<IllegalStateException> failure = new AtomicReference<>();
		return ServiceLoader.load(McpJsonMapperSupplier.class).stream().flatMap(provider -> {
			try {
				return Stream.ofNullable(provider.get());
			}
			catch (Exception e) {
				recordFailure(failure, e);
				return Stream.empty();
			}
		}).flatMap(supplier -> {
			try {
				return Stream.of(supplier.get());
			}
			catch (Exception e) {
				recordFailure(failure, e);
				return Stream.empty();
			}
		}).findFirst().orElseThrow(() -> {
			if (failure.get() != null) {
				return failure.get();
			}
			else {
				return new IllegalStateException("No McpJsonMapperSupplier registered on the class path");
			}
		});
	}

	private static void recordFailure(AtomicReference<IllegalStateException> ref, Exception cause) {
		ref.updateAndGet(existing -> {
			if (existing == null) {
				return new IllegalStateException("Failed to create the default McpJsonMapper", cause);
			}
			else {
				existing.addSuppressed(cause);
				return existing;
			}
		});
	}

}
