package com.qfree.rabbitclient.consume;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.qfree.rabbitclient.RabbitMQMessage;
import com.qfree.rabbitclient.RabbitMQMsgAck;
import com.qfree.rabbitclient.channel.RabbitMQChannel;
import com.qfree.rabbitclient.format.FormatException;
import com.qfree.rabbitclient.format.Formatter;
import com.qfree.rabbitclient.format.MessageBodies;
import com.rabbitmq.client.AMQP.BasicProperties;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * Turns the RabbitMQ client's consumer callbacks into {@link SubscriptionEvent}s
 * on a queue read by the {@link SubscriptionDispatcher}. The callbacks run on
 * the client's consumer work pool and only enqueue; handlers never run here.
 */
class SubscriptionConsumer extends DefaultConsumer {

	private static final Logger logger = LoggerFactory.getLogger(SubscriptionConsumer.class);

	private final RabbitMQChannel channel;
	private final Formatter formatter;
	private final boolean noAck;
	private final boolean simple;
	private final BlockingQueue<SubscriptionEvent> events;
	private final Map<Long, RabbitMQMsgAck> pendingAcknowledgements;

	private final AtomicBoolean ended = new AtomicBoolean(false);

	SubscriptionConsumer(RabbitMQChannel channel, Formatter formatter, SubscribeOptions options,
			BlockingQueue<SubscriptionEvent> events, Map<Long, RabbitMQMsgAck> pendingAcknowledgements) {
		super(channel.getChannel());
		this.channel = channel;
		this.formatter = formatter;
		this.noAck = options.isNoAck();
		this.simple = options.isSimple();
		this.events = events;
		this.pendingAcknowledgements = pendingAcknowledgements;
	}

	boolean isEnded() {
		return ended.get();
	}

	@Override
	public void handleConsumeOk(String consumerTag) {
		super.handleConsumeOk(consumerTag);
		logger.debug("Subscription {} confirmed by the broker", consumerTag);
		events.add(SubscriptionEvent.begin(consumerTag));
	}

	@Override
	public void handleDelivery(String consumerTag, Envelope envelope, BasicProperties properties, byte[] body)
			throws IOException {

		long deliveryTag = envelope.getDeliveryTag();
		logger.debug("Delivery tag {} on {}: {} bytes", deliveryTag, consumerTag, body.length);

		if (!simple) {
			if (!noAck) {
				// Registers itself as pending.
				new RabbitMQMsgAck(channel, consumerTag, deliveryTag, true, pendingAcknowledgements);
			}
			events.add(SubscriptionEvent.fullMessage(consumerTag,
					RabbitMQMessage.fromDelivery(consumerTag, envelope, properties, body)));
			return;
		}

		RabbitMQMsgAck msgAck = new RabbitMQMsgAck(channel, consumerTag, deliveryTag, !noAck,
				pendingAcknowledgements);
		Object decoded;
		try {
			decoded = MessageBodies.decode(body, formatter);
		} catch (FormatException e) {
			logger.error("Unable to decode delivery tag {} on {}: {}", deliveryTag, consumerTag, e.getMessage());
			if (!noAck) {
				msgAck.nack(false);
			}
			return;
		}
		events.add(SubscriptionEvent.simpleMessage(consumerTag, msgAck, decoded));
	}

	@Override
	public void handleCancelOk(String consumerTag) {
		logger.debug("Subscription {} cancelled", consumerTag);
		end(consumerTag);
	}

	@Override
	public void handleCancel(String consumerTag) throws IOException {
		logger.warn("Subscription {} was cancelled by the broker", consumerTag);
		end(consumerTag);
	}

	@Override
	public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
		if (sig.isInitiatedByApplication()) {
			logger.debug("Channel closed under subscription {}", consumerTag);
		} else {
			logger.warn("Channel closed under subscription {}: {}", consumerTag, sig.getMessage());
		}
		end(consumerTag);
	}

	private void end(String consumerTag) {
		if (ended.compareAndSet(false, true)) {
			events.add(SubscriptionEvent.end(consumerTag));
		}
	}

}
