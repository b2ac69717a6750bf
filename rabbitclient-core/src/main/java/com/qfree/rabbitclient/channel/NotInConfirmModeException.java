package com.qfree.rabbitclient.channel;

/**
 * Thrown when a caller waits for publisher confirms on a channel that was
 * never switched to {@link ChannelMode#CONFIRM}. A message published just
 * before this was thrown may or may not have reached the broker.
 */
public class NotInConfirmModeException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	public NotInConfirmModeException(String message, Throwable cause) {
		super(message, cause);
	}

}
