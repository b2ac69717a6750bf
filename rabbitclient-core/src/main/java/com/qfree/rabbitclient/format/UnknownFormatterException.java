package com.qfree.rabbitclient.format;

/**
 * No formatter is registered under the requested name.
 */
public class UnknownFormatterException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	private final String name;

	public UnknownFormatterException(String name) {
		super("Unknown format: " + name);
		this.name = name;
	}

	public String getName() {
		return name;
	}

}
