package com.qfree.rabbitclient.format;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Bodies as UTF-8 text. Decoding rejects malformed input instead of
 * substituting replacement characters.
 */
public class TextFormatter implements Formatter {

	@Override
	public byte[] encode(Object value) {
		if (!(value instanceof CharSequence)) {
			throw new FormatException("Text format can only encode character sequences, got: "
					+ (value == null ? "null" : value.getClass().getName()));
		}
		return value.toString().getBytes(StandardCharsets.UTF_8);
	}

	@Override
	public Object decode(byte[] data) {
		CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
				.onMalformedInput(CodingErrorAction.REPORT)
				.onUnmappableCharacter(CodingErrorAction.REPORT);
		try {
			return decoder.decode(ByteBuffer.wrap(data)).toString();
		} catch (CharacterCodingException e) {
			throw new FormatException("Body is not valid UTF-8", e);
		}
	}

}
