package com.qfree.rabbitclient.connection;

import java.io.IOException;

/**
 * Thrown when a connection to the broker, or the channel on it, cannot be
 * established. Callers decide whether to try again; nothing in this library
 * retries.
 */
public class ConnectionFailedException extends IOException {

	private static final long serialVersionUID = 1L;

	public ConnectionFailedException(String message, Throwable cause) {
		super(message, cause);
	}

}
