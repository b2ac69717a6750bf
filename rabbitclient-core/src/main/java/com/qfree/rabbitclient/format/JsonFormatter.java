package com.qfree.rabbitclient.format;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * Bodies as JSON, using Jackson. Decoding produces plain Java values: maps,
 * lists, strings, numbers, booleans and null. A body that is just
 * {@code null} decodes to {@link NullNode}, so that it is not mistaken for a
 * missing message.
 * <p>
 * The {@link ObjectMapper} passed in decides the details (number handling,
 * unknown properties, date formats and so on).
 */
public class JsonFormatter implements Formatter {

	private final ObjectMapper objectMapper;

	public JsonFormatter() {
		this(new ObjectMapper());
	}

	public JsonFormatter(ObjectMapper objectMapper) {
		if (objectMapper == null) {
			throw new IllegalArgumentException("objectMapper must not be null");
		}
		this.objectMapper = objectMapper;
	}

	public ObjectMapper getObjectMapper() {
		return objectMapper;
	}

	@Override
	public byte[] encode(Object value) {
		try {
			return objectMapper.writeValueAsBytes(value);
		} catch (JsonProcessingException e) {
			throw new FormatException("Unable to encode value as JSON: " + e.getOriginalMessage(), e);
		}
	}

	@Override
	public Object decode(byte[] data) {
		try {
			Object value = objectMapper.readValue(data, Object.class);
			return value != null ? value : NullNode.getInstance();
		} catch (IOException e) {
			throw new FormatException("Invalid JSON body: " + e.getMessage(), e);
		}
	}

}
