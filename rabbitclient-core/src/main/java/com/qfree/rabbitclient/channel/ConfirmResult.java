package com.qfree.rabbitclient.channel;

/**
 * Outcome of waiting for publisher confirms.
 * <p>
 * Using a channel that is not in confirm mode is not an outcome; it is
 * reported with {@link NotInConfirmModeException}.
 */
public enum ConfirmResult {

	/** Every outstanding publish was acknowledged (or no wait was requested). */
	OK,

	/** At least one outstanding publish was negatively acknowledged by the broker. */
	NACKED,

	/** The wait ran out before all outstanding publishes were confirmed. */
	TIMEOUT;

	public boolean isOk() {
		return this == OK;
	}

}
