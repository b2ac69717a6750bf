package com.qfree.rabbitclient.format;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.google.protobuf.StringValue;

@DisplayName("Protobuf format")
class ProtobufFormatterTest {

	private final ProtobufFormatter<StringValue> formatter = new ProtobufFormatter<>(StringValue.parser());

	@Test
	@DisplayName("Should decode what it encoded")
	void encodeThenDecode() {
		StringValue value = StringValue.of("passage 42");

		StringValue decoded = formatter.decode(formatter.encode(value));

		assertThat(decoded.getValue()).isEqualTo("passage 42");
	}

	@Test
	@DisplayName("Should refuse values that are not protobuf messages")
	void notAMessage() {
		assertThatThrownBy(() -> formatter.encode("plain string")).isInstanceOf(FormatException.class);
	}

	@Test
	@DisplayName("Should report a corrupt body as a format error")
	void corrupt() {
		assertThatThrownBy(() -> formatter.decode(new byte[] { (byte) 0x0A, (byte) 0x10, 0x41 }))
				.isInstanceOf(FormatException.class)
				.hasMessageStartingWith("Invalid protobuf body");
	}

}
