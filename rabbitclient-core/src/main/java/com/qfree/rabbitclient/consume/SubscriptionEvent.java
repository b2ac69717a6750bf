package com.qfree.rabbitclient.consume;

import com.qfree.rabbitclient.RabbitMQMessage;
import com.qfree.rabbitclient.RabbitMQMsgAck;

/**
 * One event of a subscription, in the order the broker produced it:
 * {@link Type#BEGIN} once, then any number of {@link Type#MESSAGE}, then
 * {@link Type#END} once.
 * <p>
 * In simple mode a message event carries the acknowledgement handle and the
 * decoded body. Otherwise it carries the raw {@link RabbitMQMessage}.
 */
public final class SubscriptionEvent {

	public enum Type {
		BEGIN, MESSAGE, END
	}

	private final Type type;
	private final String consumerTag;
	private final RabbitMQMsgAck msgAck;
	private final Object body;
	private final RabbitMQMessage message;

	private SubscriptionEvent(Type type, String consumerTag, RabbitMQMsgAck msgAck, Object body,
			RabbitMQMessage message) {
		this.type = type;
		this.consumerTag = consumerTag;
		this.msgAck = msgAck;
		this.body = body;
		this.message = message;
	}

	public static SubscriptionEvent begin(String consumerTag) {
		return new SubscriptionEvent(Type.BEGIN, consumerTag, null, null, null);
	}

	public static SubscriptionEvent simpleMessage(String consumerTag, RabbitMQMsgAck msgAck, Object body) {
		return new SubscriptionEvent(Type.MESSAGE, consumerTag, msgAck, body, null);
	}

	public static SubscriptionEvent fullMessage(String consumerTag, RabbitMQMessage message) {
		return new SubscriptionEvent(Type.MESSAGE, consumerTag, null, message.getBody(), message);
	}

	public static SubscriptionEvent end(String consumerTag) {
		return new SubscriptionEvent(Type.END, consumerTag, null, null, null);
	}

	public Type getType() {
		return type;
	}

	public String getConsumerTag() {
		return consumerTag;
	}

	/**
	 * @return the acknowledgement handle of a simple-mode message, else null
	 */
	public RabbitMQMsgAck getMsgAck() {
		return msgAck;
	}

	/**
	 * @return the message body (decoded in simple mode, raw bytes otherwise),
	 *         or null for BEGIN and END
	 */
	public Object getBody() {
		return body;
	}

	/**
	 * @return the raw message in full mode, else null
	 */
	public RabbitMQMessage getMessage() {
		return message;
	}

	@Override
	public String toString() {
		return "SubscriptionEvent [type=" + type + ", consumerTag=" + consumerTag + ", msgAck=" + msgAck
				+ ", message=" + message + "]";
	}

}
