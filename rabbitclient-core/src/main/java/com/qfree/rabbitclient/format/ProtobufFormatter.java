package com.qfree.rabbitclient.format;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.MessageLite;
import com.google.protobuf.Parser;

/**
 * Bodies as serialized protobuf messages of one type.
 * <p>
 * The formatter is bound to the parser of that type, for example
 * {@code new ProtobufFormatter<>(PassageProtos.Passage.parser())}, and is
 * usually registered with {@link Formatters#register(String, Formatter)}
 * under a name describing the message type.
 */
public class ProtobufFormatter<T extends MessageLite> implements Formatter {

	private final Parser<T> parser;

	public ProtobufFormatter(Parser<T> parser) {
		if (parser == null) {
			throw new IllegalArgumentException("parser must not be null");
		}
		this.parser = parser;
	}

	@Override
	public byte[] encode(Object value) {
		if (!(value instanceof MessageLite)) {
			throw new FormatException("Protobuf format can only encode protobuf messages, got: "
					+ (value == null ? "null" : value.getClass().getName()));
		}
		return ((MessageLite) value).toByteArray();
	}

	@Override
	public T decode(byte[] data) {
		try {
			return parser.parseFrom(data);
		} catch (InvalidProtocolBufferException e) {
			throw new FormatException("Invalid protobuf body: " + e.getMessage(), e);
		}
	}

}
