package com.qfree.rabbitclient.produce;

import com.qfree.rabbitclient.RabbitMQMessage;

/**
 * A publish the broker could not route (mandatory) or deliver (immediate),
 * sent back with the reason.
 */
public final class ReturnedMessage {

	private final int replyCode;
	private final String replyText;
	private final String exchange;
	private final String routingKey;
	private final RabbitMQMessage message;

	public ReturnedMessage(int replyCode, String replyText, String exchange, String routingKey,
			RabbitMQMessage message) {
		this.replyCode = replyCode;
		this.replyText = replyText;
		this.exchange = exchange;
		this.routingKey = routingKey;
		this.message = message;
	}

	/**
	 * @return the AMQP reply code, for example 312 (NO_ROUTE)
	 */
	public int getReplyCode() {
		return replyCode;
	}

	public String getReplyText() {
		return replyText;
	}

	public String getExchange() {
		return exchange;
	}

	public String getRoutingKey() {
		return routingKey;
	}

	/**
	 * @return the returned message with its raw body
	 */
	public RabbitMQMessage getMessage() {
		return message;
	}

	@Override
	public String toString() {
		return "ReturnedMessage [replyCode=" + replyCode + ", replyText=" + replyText + ", exchange=" + exchange
				+ ", routingKey=" + routingKey + ", message=" + message + "]";
	}

}
