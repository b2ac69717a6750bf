package com.qfree.rabbitclient.format;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;

@DisplayName("JSON format")
class JsonFormatterTest {

	private final JsonFormatter formatter = new JsonFormatter();

	@Test
	@DisplayName("Should encode maps and lists as JSON")
	void encode() {
		Map<String, Object> value = new LinkedHashMap<>();
		value.put("plate", "AB12345");
		value.put("lanes", Arrays.asList(1, 2));

		String json = new String(formatter.encode(value), StandardCharsets.UTF_8);

		assertThat(json).isEqualTo("{\"plate\":\"AB12345\",\"lanes\":[1,2]}");
	}

	@Test
	@DisplayName("Should decode to plain Java values")
	void decode() {
		Object decoded = formatter.decode("{\"a\":[1,\"x\",true,null]}".getBytes(StandardCharsets.UTF_8));

		assertThat(decoded).isInstanceOf(Map.class);
		List<Object> a = new ArrayList<Object>((List<?>) ((Map<?, ?>) decoded).get("a"));
		assertThat(a).containsExactly(1, "x", true, null);
	}

	@Test
	@DisplayName("Should decode a bare null body to a null node")
	void nullBody() {
		Object decoded = formatter.decode("null".getBytes(StandardCharsets.UTF_8));

		assertThat(decoded).isSameAs(NullNode.getInstance());
		assertThat(new String(formatter.encode(decoded), StandardCharsets.UTF_8)).isEqualTo("null");
	}

	@Test
	@DisplayName("Should report invalid JSON as a format error")
	void invalid() {
		assertThatThrownBy(() -> formatter.decode("{not json".getBytes(StandardCharsets.UTF_8)))
				.isInstanceOf(FormatException.class)
				.hasMessageStartingWith("Invalid JSON body");
	}

	@Test
	@DisplayName("Should decode with the settings of the given ObjectMapper")
	void customMapper() {
		JsonFormatter decimals = new JsonFormatter(
				new ObjectMapper().enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS));

		Object decoded = decimals.decode("1.10".getBytes(StandardCharsets.UTF_8));

		assertThat(decoded).isInstanceOf(BigDecimal.class);
		assertThat((BigDecimal) decoded).isEqualByComparingTo("1.10");
	}

}
