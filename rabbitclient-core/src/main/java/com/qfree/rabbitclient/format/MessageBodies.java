package com.qfree.rabbitclient.format;

import java.nio.charset.StandardCharsets;

/**
 * Applies an optional formatter around the raw transport payload.
 */
public final class MessageBodies {

	private MessageBodies() {
	}

	/**
	 * With a formatter the value is encoded by it. Without one, byte arrays
	 * are sent as they are and character sequences as UTF-8.
	 *
	 * @throws FormatException if the value cannot be turned into bytes
	 */
	public static byte[] encode(Object value, Formatter formatter) {
		if (formatter != null) {
			return formatter.encode(value);
		}
		if (value instanceof byte[]) {
			return (byte[]) value;
		}
		if (value instanceof CharSequence) {
			return value.toString().getBytes(StandardCharsets.UTF_8);
		}
		throw new FormatException("No format given for a body of type "
				+ (value == null ? "null" : value.getClass().getName()));
	}

	/**
	 * Without a formatter the bytes are returned unchanged.
	 *
	 * @throws FormatException if the formatter rejects the bytes
	 */
	public static Object decode(byte[] data, Formatter formatter) {
		if (formatter == null) {
			return data;
		}
		Object value = formatter.decode(data);
		if (value == null) {
			throw new FormatException("Formatter " + formatter.getClass().getName() + " decoded a body to null");
		}
		return value;
	}

}
