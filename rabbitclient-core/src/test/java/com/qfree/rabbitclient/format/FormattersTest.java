package com.qfree.rabbitclient.format;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Formatter registry and body handling")
class FormattersTest {

	@Test
	@DisplayName("Should provide json and text out of the box")
	void builtIns() {
		assertThat(Formatters.lookup("json")).isInstanceOf(JsonFormatter.class);
		assertThat(Formatters.lookup("text")).isInstanceOf(TextFormatter.class);
		assertThat(Formatters.names()).contains("json", "text");
	}

	@Test
	@DisplayName("Should look names up case-insensitively")
	void caseInsensitive() {
		assertThat(Formatters.lookup("JSON")).isSameAs(Formatters.lookup("json"));
		assertThat(Formatters.isRegistered(" Text ")).isTrue();
	}

	@Test
	@DisplayName("Should fail for an unknown name")
	void unknownName() {
		assertThatThrownBy(() -> Formatters.lookup("yaml"))
				.isInstanceOfSatisfying(UnknownFormatterException.class,
						e -> assertThat(e.getName()).isEqualTo("yaml"))
				.hasMessage("Unknown format: yaml");
	}

	@Test
	@DisplayName("Should register a custom formatter")
	void register() {
		Formatter reversed = new Formatter() {
			@Override
			public byte[] encode(Object value) {
				return new StringBuilder(value.toString()).reverse().toString().getBytes(StandardCharsets.UTF_8);
			}

			@Override
			public Object decode(byte[] data) {
				return new StringBuilder(new String(data, StandardCharsets.UTF_8)).reverse().toString();
			}
		};

		Formatters.register("reversed-test", reversed);

		assertThat(Formatters.lookup("Reversed-Test")).isSameAs(reversed);
		assertThat(MessageBodies.encode("abc", Formatters.lookup("reversed-test")))
				.isEqualTo("cba".getBytes(StandardCharsets.UTF_8));
	}

	@Test
	@DisplayName("Should refuse an empty name")
	void emptyName() {
		assertThatThrownBy(() -> Formatters.register(" ", new TextFormatter()))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("Should report a formatter that decodes to null")
	void nullDecode() {
		Formatter nulls = new Formatter() {
			@Override
			public byte[] encode(Object value) {
				return new byte[0];
			}

			@Override
			public Object decode(byte[] data) {
				return null;
			}
		};

		assertThatThrownBy(() -> MessageBodies.decode(new byte[] { 1 }, nulls))
				.isInstanceOf(FormatException.class)
				.hasMessageContaining("null");
	}

	@Nested
	@DisplayName("Without a formatter")
	class RawBodies {

		@Test
		@DisplayName("Should pass bytes through")
		void bytes() {
			byte[] body = { 1, 2, 3 };

			assertThat(MessageBodies.encode(body, null)).isSameAs(body);
			assertThat(MessageBodies.decode(body, null)).isSameAs(body);
		}

		@Test
		@DisplayName("Should send strings as UTF-8")
		void strings() {
			assertThat(MessageBodies.encode("hé", null)).isEqualTo("hé".getBytes(StandardCharsets.UTF_8));
		}

		@Test
		@DisplayName("Should refuse other values")
		void otherValues() {
			assertThatThrownBy(() -> MessageBodies.encode(42, null)).isInstanceOf(FormatException.class);
		}
	}

	@Nested
	@DisplayName("Text format")
	class Text {

		private final TextFormatter formatter = new TextFormatter();

		@Test
		@DisplayName("Should reject bytes that are not UTF-8")
		void malformed() {
			assertThatThrownBy(() -> formatter.decode(new byte[] { (byte) 0xC3, (byte) 0x28 }))
					.isInstanceOf(FormatException.class)
					.hasMessageContaining("UTF-8");
		}

		@Test
		@DisplayName("Should refuse values that are not text")
		void notText() {
			assertThatThrownBy(() -> formatter.encode(new Object())).isInstanceOf(FormatException.class);
		}
	}

}
