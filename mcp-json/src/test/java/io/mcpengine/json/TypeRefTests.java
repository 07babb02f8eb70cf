/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.json;

import java.lang.reflect.ParameterizedType;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TypeRefTests {

	@Test
	void capturesParameterizedType() {
		TypeRef<Map<String, List<Integer>>> ref = new TypeRef<>() {
		};

		assertThat(ref.getType()).isInstanceOf(ParameterizedType.class);
		ParameterizedType type = (ParameterizedType) ref.getType();
		assertThat(type.getRawType()).isEqualTo(Map.class);
		assertThat(type.getActualTypeArguments()[0]).isEqualTo(String.class);
	}

	@Test
	void capturesPlainClass() {
		TypeRef<String> ref = new TypeRef<>() {
		};

		assertThat(ref.getType()).isEqualTo(String.class);
	}

	@Test
	@SuppressWarnings("rawtypes")
	void rejectsRawSubclass() {
		assertThatThrownBy(() -> new TypeRef() {
		}).isInstanceOf(IllegalStateException.class);
	}

	@Test
	void createDefaultFailsWithoutImplementation() {
		// this module carries no implementation on its test class path
		assertThatThrownBy(McpJsonMapper::createDefault).isInstanceOf(IllegalStateException.class)
			.hasMessageContaining("McpJsonMapperSupplier");
	}

}
