/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.util;

import java.util.Collection;
import java.util.Map;

import reactor.util.annotation.Nullable;

/**
 * Miscellaneous utility methods.
 */
public final class Utils {

	private Utils() {
	}

	/**
	 * Check whether the given {@code String} is not {@code null} and contains at least
	 * one non-whitespace character.
	 * @param str the {@code String} to check
	 * @return {@code true} if the string has text
	 */
	public static boolean hasText(@Nullable String str) {
		return (str != null && !str.isBlank());
	}

	public static boolean isEmpty(@Nullable Collection<?> collection) {
		return (collection == null || collection.isEmpty());
	}

	public static boolean isEmpty(@Nullable Map<?, ?> map) {
		return (map == null || map.isEmpty());
	}

	/**
	 * Reads an integral argument that may arrive as a JSON number or a numeric string.
	 * @param arguments argument map, may be {@code null}
	 * @param name argument name
	 * @return the value
	 * @throws IllegalArgumentException when missing, fractional or not numeric
	 */
	public static long requireLong(@Nullable Map<String, Object> arguments, String name) {
		Object value = (arguments != null) ? arguments.get(name) : null;
		if (value == null) {
			throw new IllegalArgumentException("Missing required argument: " + name);
		}
		if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
			return ((Number) value).longValue();
		}
		try {
			return Long.parseLong(String.valueOf(value).trim());
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Argument '" + name + "' must be an integer: " + value, e);
		}
	}

	/**
	 * Reads a numeric argument that may arrive as a JSON number or a numeric string.
	 * @param arguments argument map, may be {@code null}
	 * @param name argument name
	 * @return the value
	 * @throws IllegalArgumentException when missing or not numeric
	 */
	public static double requireDouble(@Nullable Map<String, Object> arguments, String name) {
		Object value = (arguments != null) ? arguments.get(name) : null;
		if (value == null) {
			throw new IllegalArgumentException("Missing required argument: " + name);
		}
		if (value instanceof Number) {
			return ((Number) value).doubleValue();
		}
		try {
			return Double.parseDouble(String.valueOf(value).trim());
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Argument '" + name + "' must be a number: " + value, e);
		}
	}

}
