/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.spec;

import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import reactor.util.annotation.Nullable;

/**
 * Caller supplied correlation key for progress notifications, a string or an integer.
 * The engine never interprets it.
 */
public final class ProgressToken {

	private final Object value;

	private ProgressToken(Object value) {
		this.value = value;
	}

	public static ProgressToken of(String value) {
		return new ProgressToken(Objects.requireNonNull(value, "value"));
	}

	public static ProgressToken of(long value) {
		return new ProgressToken(value);
	}

	@JsonCreator(mode = JsonCreator.Mode.DELEGATING)
	public static ProgressToken from(Object raw) {
		if (raw instanceof String) {
			return of((String) raw);
		}
		if (raw instanceof Integer || raw instanceof Long) {
			return of(((Number) raw).longValue());
		}
		throw new IllegalArgumentException("Progress token must be a string or an integer, got: " + raw);
	}

	/**
	 * Extracts {@code progressToken} from a request's {@code _meta} member.
	 * @param meta the {@code _meta} map, may be {@code null}
	 * @return the token or {@code null} if the caller supplied none
	 */
	@Nullable
	public static ProgressToken fromMeta(@Nullable Map<String, Object> meta) {
		if (meta == null || meta.get("progressToken") == null) {
			return null;
		}
		return from(meta.get("progressToken"));
	}

	@JsonValue
	public Object value() {
		return this.value;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		return (o instanceof ProgressToken) && this.value.equals(((ProgressToken) o).value);
	}

	@Override
	public int hashCode() {
		return this.value.hashCode();
	}

	@Override
	public String toString() {
		return String.valueOf(this.value);
	}

}
