package com.qfree.rabbitclient.topology;

/**
 * The outcome of {@link Topology#resolve}: actual names on the broker and the
 * routing key publishes use when none is given.
 */
public final class ResolvedTopology {

	private final String exchange;
	private final String queue;
	private final String routingKey;

	public ResolvedTopology(String exchange, String queue, String routingKey) {
		this.exchange = exchange;
		this.queue = queue;
		this.routingKey = routingKey;
	}

	public String getExchange() {
		return exchange;
	}

	/**
	 * @return the queue name (as assigned by the broker for server-named
	 *         queues), or null if the endpoint has no queue
	 */
	public String getQueue() {
		return queue;
	}

	public String getRoutingKey() {
		return routingKey;
	}

	@Override
	public String toString() {
		return "ResolvedTopology [exchange=" + exchange + ", queue=" + queue + ", routingKey=" + routingKey + "]";
	}

}
