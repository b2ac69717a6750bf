package com.qfree.rabbitclient;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.qfree.rabbitclient.channel.RabbitMQChannel;

/**
 * Acknowledgement handle for one delivery: the consumer tag of the
 * subscription (null for a get), the delivery tag, and the channel the
 * message was consumed on. A delivery must be acknowledged on that channel.
 * <p>
 * A handle settles its delivery at most once, either with {@link #ack()} or
 * with {@link #nack(boolean)}.
 */
public class RabbitMQMsgAck {

	private static final Logger logger = LoggerFactory.getLogger(RabbitMQMsgAck.class);

	private final RabbitMQChannel channel;
	private final String consumerTag;
	private final long deliveryTag;
	/*
	 * False when the delivery was made with no-ack: the broker considers it
	 * settled already and an ack/nack would be a protocol error.
	 */
	private final boolean ackRequired;
	/*
	 * The pending acknowledgements of the consumer that received this
	 * delivery. The entry for this handle is removed once it is settled.
	 */
	private final Map<Long, RabbitMQMsgAck> pendingAcknowledgements;

	private final AtomicBoolean settled = new AtomicBoolean(false);
	/**
	 * If false, the message was acked.
	 * If true, the message was nacked.
	 */
	private volatile boolean rejected = false;
	/**
	 * If true, the rejected message was requeued.
	 *
	 * If false, message will be dead-lettered if a dead-letter exchanged has
	 * been configured; otherwise it will be discarded.
	 *
	 * Used only if rejected=true.
	 */
	private volatile boolean requeueRejectedMsg = true;

	public RabbitMQMsgAck(RabbitMQChannel channel, String consumerTag, long deliveryTag, boolean ackRequired,
			Map<Long, RabbitMQMsgAck> pendingAcknowledgements) {
		this.channel = channel;
		this.consumerTag = consumerTag;
		this.deliveryTag = deliveryTag;
		this.ackRequired = ackRequired;
		this.pendingAcknowledgements = pendingAcknowledgements;
		if (ackRequired && pendingAcknowledgements != null) {
			pendingAcknowledgements.put(deliveryTag, this);
		}
	}

	public String getConsumerTag() {
		return consumerTag;
	}

	public long getDeliveryTag() {
		return deliveryTag;
	}

	public boolean isAckRequired() {
		return ackRequired;
	}

	public boolean isSettled() {
		return settled.get();
	}

	public boolean isRejected() {
		return rejected;
	}

	public boolean isRequeueRejectedMsg() {
		return requeueRejectedMsg;
	}

	/**
	 * Acknowledges the delivery.
	 *
	 * @throws IllegalStateException if the delivery was made without acks or is already settled
	 */
	public void ack() throws IOException {
		settle();
		this.rejected = false;
		channel.ack(deliveryTag);
	}

	/**
	 * Rejects the delivery and asks the broker to requeue it.
	 */
	public void nack() throws IOException {
		nack(true);
	}

	/**
	 * Rejects the delivery.
	 *
	 * @param requeue if false the message is dead-lettered or discarded
	 * @throws IllegalStateException if the delivery was made without acks or is already settled
	 */
	public void nack(boolean requeue) throws IOException {
		settle();
		this.rejected = true;
		this.requeueRejectedMsg = requeue;
		if (requeue) {
			logger.debug("Nacking delivery tag = {}, message will be requeued", deliveryTag);
		} else {
			logger.warn("Nacking delivery tag = {}, message will be dead-lettered or discarded", deliveryTag);
		}
		channel.nack(deliveryTag, requeue);
	}

	/**
	 * Used by consumers after a recover, when the broker redelivers the
	 * message under a new delivery tag. The handle can no longer be used and
	 * is not removed from the pending acknowledgements here.
	 */
	public void forget() {
		settled.set(true);
	}

	private void settle() {
		if (!ackRequired) {
			throw new IllegalStateException("Delivery tag " + deliveryTag
					+ " was delivered with no-ack and cannot be acknowledged");
		}
		if (!settled.compareAndSet(false, true)) {
			throw new IllegalStateException("Delivery tag " + deliveryTag + " has already been settled");
		}
		if (pendingAcknowledgements != null) {
			pendingAcknowledgements.remove(deliveryTag);
		}
	}

	@Override
	public String toString() {
		return "RabbitMQMsgAck [consumerTag=" + consumerTag + ", deliveryTag=" + deliveryTag
				+ ", settled=" + settled.get() + ", rejected=" + rejected
				+ ", requeueRejectedMsg=" + requeueRejectedMsg + "]";
	}

}
