/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.json.jackson2;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import io.mcpengine.json.McpJsonDefaults;
import io.mcpengine.json.McpJsonMapper;
import io.mcpengine.json.TypeRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link JacksonMcpJsonMapper}.
 */
public class JacksonMcpJsonMapperTests {

	private McpJsonMapper jsonMapper;

	// records must be public for the mapper to bind them without setAccessible()
	public record Arguments(String name, Map<String, Object> values) {
	}

	public record Nested(String id, Arguments arguments) {
	}

	@BeforeEach
	void setUp() {
		jsonMapper = new JacksonMcpJsonMapperSupplier().get();
	}

	@Test
	@DisplayName("Generic read keeps JSON value kinds")
	void readsGenericTree() throws IOException {
		byte[] json = """
				{"s":"x","i":7,"big":12345678901,"huge":123456789012345678901234,"d":1.5,"b":true,"n":null,"a":[1,"two"]}
				""".getBytes(StandardCharsets.UTF_8);

		Object value = jsonMapper.readValue(json, Object.class);

		assertThat(value).isInstanceOf(Map.class);
		Map<?, ?> map = (Map<?, ?>) value;
		assertThat(map.get("s")).isEqualTo("x");
		assertThat(map.get("i")).isEqualTo(7);
		assertThat(map.get("big")).isEqualTo(12345678901L);
		assertThat(map.get("huge")).isInstanceOf(BigInteger.class);
		assertThat(map.get("d")).isEqualTo(1.5d);
		assertThat(map.get("b")).isEqualTo(Boolean.TRUE);
		assertThat(map.containsKey("n")).isTrue();
		assertThat(map.get("n")).isNull();
		assertThat(map.get("a")).isEqualTo(List.of(1, "two"));
	}

	@Test
	@DisplayName("Malformed and trailing content fail as IOException")
	void rejectsMalformedContent() {
		assertThatThrownBy(() -> jsonMapper.readValue("{\"a\":".getBytes(StandardCharsets.UTF_8), Object.class))
			.isInstanceOf(IOException.class);
		assertThatThrownBy(() -> jsonMapper.readValue("{} {}".getBytes(StandardCharsets.UTF_8), Object.class))
			.isInstanceOf(IOException.class);
		assertThatThrownBy(() -> jsonMapper.readValue(new byte[0], Object.class)).isInstanceOf(IOException.class);
	}

	@Test
	@DisplayName("Converts parsed params into records and ignores unknown members")
	void convertsParamsToRecords() {
		Map<String, Object> params = Map.of("id", "r-1", "arguments",
				Map.of("name", "add", "values", Map.of("a", 10), "extra", true));

		Nested nested = jsonMapper.convertValue(params, Nested.class);

		assertThat(nested.id()).isEqualTo("r-1");
		assertThat(nested.arguments().name()).isEqualTo("add");
		assertThat(nested.arguments().values()).containsEntry("a", 10);
	}

	@Test
	void readsParameterizedTypes() throws IOException {
		Map<String, List<Integer>> value = jsonMapper.readValue("{\"xs\":[1,2,3]}", new TypeRef<>() {
		});

		assertThat(value).containsEntry("xs", List.of(1, 2, 3));
	}

	@Test
	void writesRecords() throws IOException {
		assertThat(jsonMapper.writeValueAsString(new Arguments("echo", Map.of())))
			.isEqualTo("{\"name\":\"echo\",\"values\":{}}");
		assertThat(new String(jsonMapper.writeValueAsBytes(List.of("a", 1)), StandardCharsets.UTF_8))
			.isEqualTo("[\"a\",1]");
	}

	@Test
	void defaultMapperIsDiscoveredThroughServiceLoader() {
		assertThat(McpJsonMapper.createDefault()).isInstanceOf(JacksonMcpJsonMapper.class);
		assertThat(McpJsonDefaults.getMapper()).isSameAs(McpJsonDefaults.getMapper());
	}

}
