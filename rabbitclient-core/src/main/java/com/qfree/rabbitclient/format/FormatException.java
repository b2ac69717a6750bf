package com.qfree.rabbitclient.format;

/**
 * A message body could not be encoded or decoded.
 */
public class FormatException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public FormatException(String message) {
		super(message);
	}

	public FormatException(String message, Throwable cause) {
		super(message, cause);
	}

}
