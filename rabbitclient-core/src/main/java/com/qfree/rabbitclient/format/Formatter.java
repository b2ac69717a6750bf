package com.qfree.rabbitclient.format;

/**
 * Encodes message bodies before they are published and decodes them after
 * they are received.
 * <p>
 * Implementations must be thread-safe: one instance is normally shared by
 * every producer and consumer configured with its name.
 */
public interface Formatter {

	/**
	 * @throws FormatException if the value cannot be encoded by this formatter
	 */
	public byte[] encode(Object value);

	/**
	 * @return the decoded value, never null
	 * @throws FormatException if the bytes are not valid for this formatter;
	 *         the exception message gives the reason
	 */
	public Object decode(byte[] data);

}
