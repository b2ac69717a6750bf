package com.qfree.rabbitclient.channel;

/**
 * Publishing modes a channel can be switched into. The two are mutually
 * exclusive on the broker side.
 */
public enum ChannelMode {

	/** Publisher confirms: the broker acknowledges each publish. */
	CONFIRM,

	/** Transactional: publishes take effect only on commit. */
	TX

}
