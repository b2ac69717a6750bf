package com.qfree.rabbitclient.consume;

/**
 * Settings for {@link RabbitMQConsumer#get(GetOptions)}.
 */
public final class GetOptions {

	private static final GetOptions NO_ACK = new GetOptions(true);
	private static final GetOptions ACK = new GetOptions(false);

	private final boolean noAck;

	private GetOptions(boolean noAck) {
		this.noAck = noAck;
	}

	/**
	 * The fetched message is considered delivered as soon as it is fetched.
	 */
	public static GetOptions defaults() {
		return NO_ACK;
	}

	/**
	 * @param noAck if false, the fetched message must be acked or nacked
	 */
	public static GetOptions noAck(boolean noAck) {
		return noAck ? NO_ACK : ACK;
	}

	public boolean isNoAck() {
		return noAck;
	}

	@Override
	public String toString() {
		return "GetOptions [noAck=" + noAck + "]";
	}

}
