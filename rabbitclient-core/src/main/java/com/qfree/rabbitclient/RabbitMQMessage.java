package com.qfree.rabbitclient;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;

import com.qfree.rabbitclient.format.Formatter;
import com.qfree.rabbitclient.format.MessageBodies;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.GetResponse;

/**
 * A message as received from the broker, or a pre-built envelope to publish.
 * <p>
 * The body is either the raw payload ({@code byte[]}) or a value produced by
 * a formatter. When publishing an envelope, its properties are sent as they
 * are and its body is encoded with the formatter in effect; exchange and
 * routing key come from the producer and publish options.
 * <p>
 * Instances are immutable. The delivery tag identifies the delivery on its
 * channel for acknowledgement and is 0 for envelopes that were never
 * delivered.
 */
public final class RabbitMQMessage {

	private static final AMQP.BasicProperties EMPTY_PROPERTIES = new AMQP.BasicProperties();

	private final String exchange;
	private final String routingKey;
	private final Object body;
	private final AMQP.BasicProperties properties;
	private final long deliveryTag;
	private final boolean redelivered;
	private final String consumerTag;
	private final int messageCount;

	private RabbitMQMessage(String exchange, String routingKey, Object body, AMQP.BasicProperties properties,
			long deliveryTag, boolean redelivered, String consumerTag, int messageCount) {
		this.exchange = exchange;
		this.routingKey = routingKey;
		this.body = body;
		this.properties = properties != null ? properties : EMPTY_PROPERTIES;
		this.deliveryTag = deliveryTag;
		this.redelivered = redelivered;
		this.consumerTag = consumerTag;
		this.messageCount = messageCount;
	}

	/**
	 * An envelope with no properties.
	 */
	public static RabbitMQMessage of(Object body) {
		return of(body, null);
	}

	/**
	 * An envelope carrying the given properties (headers, content type,
	 * delivery mode and so on).
	 */
	public static RabbitMQMessage of(Object body, AMQP.BasicProperties properties) {
		return new RabbitMQMessage(null, null, body, properties, 0L, false, null, -1);
	}

	public static RabbitMQMessage fromDelivery(String consumerTag, Envelope envelope,
			AMQP.BasicProperties properties, byte[] body) {
		return new RabbitMQMessage(envelope.getExchange(), envelope.getRoutingKey(), body, properties,
				envelope.getDeliveryTag(), envelope.isRedeliver(), consumerTag, -1);
	}

	public static RabbitMQMessage fromGetResponse(GetResponse response) {
		Envelope envelope = response.getEnvelope();
		return new RabbitMQMessage(envelope.getExchange(), envelope.getRoutingKey(), response.getBody(),
				response.getProps(), envelope.getDeliveryTag(), envelope.isRedeliver(), null,
				response.getMessageCount());
	}

	/**
	 * @return a copy of this message with another body
	 */
	public RabbitMQMessage withBody(Object newBody) {
		return new RabbitMQMessage(exchange, routingKey, newBody, properties, deliveryTag, redelivered,
				consumerTag, messageCount);
	}

	/**
	 * Decodes the raw body with the given formatter. Without a formatter the
	 * message is returned unchanged.
	 *
	 * @throws IllegalStateException if the body was already decoded
	 * @throws com.qfree.rabbitclient.format.FormatException if the body cannot be decoded
	 */
	public RabbitMQMessage decode(Formatter formatter) {
		if (formatter == null) {
			return this;
		}
		return withBody(MessageBodies.decode(getBodyBytes(), formatter));
	}

	public String getExchange() {
		return exchange;
	}

	public String getRoutingKey() {
		return routingKey;
	}

	public Object getBody() {
		return body;
	}

	/**
	 * @throws IllegalStateException if the body is not raw bytes
	 */
	public byte[] getBodyBytes() {
		if (!(body instanceof byte[])) {
			throw new IllegalStateException("Body is not raw bytes: "
					+ (body == null ? "null" : body.getClass().getName()));
		}
		return (byte[]) body;
	}

	public AMQP.BasicProperties getProperties() {
		return properties;
	}

	public Map<String, Object> getHeaders() {
		Map<String, Object> headers = properties.getHeaders();
		return headers != null ? Collections.unmodifiableMap(headers) : Collections.<String, Object> emptyMap();
	}

	public long getDeliveryTag() {
		return deliveryTag;
	}

	public boolean isRedelivered() {
		return redelivered;
	}

	/**
	 * @return the tag of the subscription that delivered this message, or null
	 *         for envelopes and messages fetched with a get
	 */
	public String getConsumerTag() {
		return consumerTag;
	}

	/**
	 * @return the number of messages left in the queue after a get, or -1 if unknown
	 */
	public int getMessageCount() {
		return messageCount;
	}

	@Override
	public String toString() {
		String bodyText = body instanceof byte[] ? ((byte[]) body).length + " bytes" : String.valueOf(body);
		return "RabbitMQMessage [exchange=" + exchange + ", routingKey=" + routingKey
				+ ", deliveryTag=" + deliveryTag + ", redelivered=" + redelivered
				+ ", consumerTag=" + consumerTag + ", body=" + bodyText + "]";
	}

	// Byte bodies are compared by content.
	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof RabbitMQMessage)) {
			return false;
		}
		RabbitMQMessage other = (RabbitMQMessage) obj;
		return deliveryTag == other.deliveryTag
				&& redelivered == other.redelivered
				&& Objects.equals(exchange, other.exchange)
				&& Objects.equals(routingKey, other.routingKey)
				&& Objects.equals(consumerTag, other.consumerTag)
				&& bodyEquals(body, other.body);
	}

	@Override
	public int hashCode() {
		int bodyHash = body instanceof byte[] ? Arrays.hashCode((byte[]) body) : Objects.hashCode(body);
		return Objects.hash(exchange, routingKey, deliveryTag, redelivered, consumerTag) * 31 + bodyHash;
	}

	private static boolean bodyEquals(Object a, Object b) {
		if (a instanceof byte[] && b instanceof byte[]) {
			return Arrays.equals((byte[]) a, (byte[]) b);
		}
		return Objects.equals(a, b);
	}

}
