package com.qfree.rabbitclient.consume;

import java.util.concurrent.Executor;

/**
 * Settings for {@link RabbitMQConsumer#subscribe(SubscriptionHandler, SubscribeOptions)}.
 */
public final class SubscribeOptions {

	private static final SubscribeOptions DEFAULTS = new Builder().build();

	private final boolean noAck;
	private final boolean simple;
	private final int prefetchCount;
	private final Executor executor;

	private SubscribeOptions(Builder builder) {
		this.noAck = builder.noAck;
		this.simple = builder.simple;
		this.prefetchCount = builder.prefetchCount;
		this.executor = builder.executor;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * No acks, simple mode, no prefetch limit, a dedicated dispatcher thread.
	 */
	public static SubscribeOptions defaults() {
		return DEFAULTS;
	}

	public boolean isNoAck() {
		return noAck;
	}

	public boolean isSimple() {
		return simple;
	}

	/**
	 * @return the basic.qos prefetch count, 0 for no limit
	 */
	public int getPrefetchCount() {
		return prefetchCount;
	}

	/**
	 * @return where the handler runs, or null for a dedicated thread
	 */
	public Executor getExecutor() {
		return executor;
	}

	@Override
	public String toString() {
		return "SubscribeOptions [noAck=" + noAck + ", simple=" + simple + ", prefetchCount=" + prefetchCount
				+ ", executor=" + executor + "]";
	}

	public static final class Builder {

		private boolean noAck = true;
		private boolean simple = true;
		private int prefetchCount = 0;
		private Executor executor;

		private Builder() {
		}

		/**
		 * If false, every delivery must be acked or nacked.
		 */
		public Builder noAck(boolean noAck) {
			this.noAck = noAck;
			return this;
		}

		/**
		 * If true, handlers get an acknowledgement handle and the decoded body;
		 * otherwise the raw message.
		 */
		public Builder simple(boolean simple) {
			this.simple = simple;
			return this;
		}

		public Builder prefetchCount(int prefetchCount) {
			if (prefetchCount < 0 || prefetchCount > 65535) {
				throw new IllegalArgumentException("prefetchCount must be between 0 and 65535: " + prefetchCount);
			}
			this.prefetchCount = prefetchCount;
			return this;
		}

		/**
		 * The dispatcher task occupies one executor thread for as long as the
		 * subscription lasts.
		 */
		public Builder executor(Executor executor) {
			this.executor = executor;
			return this;
		}

		public SubscribeOptions build() {
			return new SubscribeOptions(this);
		}

	}

}
