package com.qfree.rabbitclient.channel;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ConfirmListener;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.GetResponse;
import com.rabbitmq.client.ReturnListener;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * The operations this library performs on a single RabbitMQ {@link Channel}.
 * <p>
 * Every call is forwarded as is; failures the broker reports (the channel or
 * connection being closed under us) are turned into {@link BrokerException}.
 * No locking is added: a channel must not be used from several threads at
 * once without the caller serializing access.
 */
public class RabbitMQChannel {

	private static final Logger logger = LoggerFactory.getLogger(RabbitMQChannel.class);

	private final Channel channel;

	/*
	 * Only the mode set through this object is known here. The broker enforces
	 * that confirm and tx mode are exclusive, so a conflicting setMode() is
	 * simply forwarded and the broker's refusal is reported.
	 */
	private volatile ChannelMode mode = null;

	public RabbitMQChannel(Channel channel) {
		if (channel == null) {
			throw new IllegalArgumentException("channel must not be null");
		}
		this.channel = channel;
	}

	public Channel getChannel() {
		return channel;
	}

	public int getChannelNumber() {
		return channel.getChannelNumber();
	}

	/**
	 * @return the mode set with {@link #setMode(ChannelMode)}, or null if none was
	 */
	public ChannelMode getMode() {
		return mode;
	}

	public boolean isOpen() {
		return channel.isOpen();
	}

	public void setMode(ChannelMode mode) throws IOException {
		if (mode == null) {
			throw new IllegalArgumentException("mode must not be null");
		}
		try {
			switch (mode) {
			case CONFIRM:
				channel.confirmSelect();
				break;
			case TX:
				channel.txSelect();
				break;
			}
		} catch (IOException e) {
			throw BrokerException.translate("Switching to " + mode + " mode", e);
		} catch (ShutdownSignalException e) {
			throw BrokerException.from("Switching to " + mode + " mode", e, e);
		}
		this.mode = mode;
		logger.debug("Channel {} switched to {} mode", channel.getChannelNumber(), mode);
	}

	/**
	 * Blocks until every publish made on this channel since the last call has
	 * been acknowledged or negatively acknowledged by the broker.
	 *
	 * @throws NotInConfirmModeException if the channel is not in confirm mode
	 */
	public ConfirmResult awaitConfirms() throws IOException, InterruptedException {
		try {
			return channel.waitForConfirms() ? ConfirmResult.OK : ConfirmResult.NACKED;
		} catch (IllegalStateException e) {
			throw notInConfirmMode(e);
		} catch (ShutdownSignalException e) {
			throw BrokerException.from("Waiting for confirms", e, e);
		}
	}

	/**
	 * Same as {@link #awaitConfirms()}, but gives up after {@code timeoutMs}
	 * milliseconds and reports {@link ConfirmResult#TIMEOUT}.
	 *
	 * @throws IllegalArgumentException if the timeout is not positive; the
	 *         RabbitMQ client takes 0 to mean no timeout at all
	 */
	public ConfirmResult awaitConfirms(long timeoutMs) throws IOException, InterruptedException {
		if (timeoutMs <= 0) {
			throw new IllegalArgumentException("timeout must be positive: " + timeoutMs);
		}
		try {
			return channel.waitForConfirms(timeoutMs) ? ConfirmResult.OK : ConfirmResult.NACKED;
		} catch (TimeoutException e) {
			logger.debug("No confirmation within {} ms on channel {}", timeoutMs, channel.getChannelNumber());
			return ConfirmResult.TIMEOUT;
		} catch (IllegalStateException e) {
			throw notInConfirmMode(e);
		} catch (ShutdownSignalException e) {
			throw BrokerException.from("Waiting for confirms", e, e);
		}
	}

	public void commit() throws IOException {
		try {
			channel.txCommit();
		} catch (IOException e) {
			throw BrokerException.translate("Commit", e);
		} catch (ShutdownSignalException e) {
			throw BrokerException.from("Commit", e, e);
		}
	}

	public void rollback() throws IOException {
		try {
			channel.txRollback();
		} catch (IOException e) {
			throw BrokerException.translate("Rollback", e);
		} catch (ShutdownSignalException e) {
			throw BrokerException.from("Rollback", e, e);
		}
	}

	public void publish(String exchange, String routingKey, boolean mandatory, boolean immediate,
			AMQP.BasicProperties properties, byte[] body) throws IOException {
		try {
			channel.basicPublish(exchange, routingKey, mandatory, immediate, properties, body);
		} catch (IOException e) {
			throw BrokerException.translate("Publish", e);
		} catch (ShutdownSignalException e) {
			throw BrokerException.from("Publish", e, e);
		}
	}

	public long getNextPublishSeqNo() {
		return channel.getNextPublishSeqNo();
	}

	/**
	 * @return the next message on the queue, or null if the queue is empty
	 */
	public GetResponse get(String queue, boolean noAck) throws IOException {
		try {
			return channel.basicGet(queue, noAck);
		} catch (IOException e) {
			throw BrokerException.translate("Get from " + queue, e);
		} catch (ShutdownSignalException e) {
			throw BrokerException.from("Get from " + queue, e, e);
		}
	}

	/**
	 * @return the consumer tag assigned by the broker
	 */
	public String consume(String queue, boolean noAck, Consumer consumer) throws IOException {
		try {
			return channel.basicConsume(queue, noAck, consumer);
		} catch (IOException e) {
			throw BrokerException.translate("Consume from " + queue, e);
		} catch (ShutdownSignalException e) {
			throw BrokerException.from("Consume from " + queue, e, e);
		}
	}

	public void cancel(String consumerTag) throws IOException {
		try {
			channel.basicCancel(consumerTag);
		} catch (IOException e) {
			throw BrokerException.translate("Cancel " + consumerTag, e);
		} catch (ShutdownSignalException e) {
			throw BrokerException.from("Cancel " + consumerTag, e, e);
		}
	}

	public void qos(int prefetchCount) throws IOException {
		try {
			channel.basicQos(prefetchCount);
		} catch (IOException e) {
			throw BrokerException.translate("Qos", e);
		} catch (ShutdownSignalException e) {
			throw BrokerException.from("Qos", e, e);
		}
	}

	/**
	 * Acknowledges this delivery, and only this delivery.
	 */
	public void ack(long deliveryTag) throws IOException {
		logger.debug("Acking delivery tag = {}", deliveryTag);
		try {
			channel.basicAck(deliveryTag, false);
		} catch (IOException e) {
			throw BrokerException.translate("Ack " + deliveryTag, e);
		} catch (ShutdownSignalException e) {
			throw BrokerException.from("Ack " + deliveryTag, e, e);
		}
	}

	/**
	 * Rejects this delivery. With {@code requeue} false the message is
	 * dead-lettered if a dead-letter exchange is configured, otherwise dropped.
	 */
	public void nack(long deliveryTag, boolean requeue) throws IOException {
		logger.debug("Nacking delivery tag = {}, requeue = {}", deliveryTag, requeue);
		try {
			channel.basicNack(deliveryTag, false, requeue);
		} catch (IOException e) {
			throw BrokerException.translate("Nack " + deliveryTag, e);
		} catch (ShutdownSignalException e) {
			throw BrokerException.from("Nack " + deliveryTag, e, e);
		}
	}

	/**
	 * Asks the broker to redeliver every unacknowledged message on this channel.
	 */
	public void recover(boolean requeue) throws IOException {
		try {
			channel.basicRecover(requeue);
		} catch (IOException e) {
			throw BrokerException.translate("Recover", e);
		} catch (ShutdownSignalException e) {
			throw BrokerException.from("Recover", e, e);
		}
	}

	public void exchangeDeclare(String exchange, String type, boolean durable, boolean autoDelete,
			boolean internal, Map<String, Object> arguments) throws IOException {
		try {
			channel.exchangeDeclare(exchange, type, durable, autoDelete, internal, arguments);
		} catch (IOException e) {
			throw BrokerException.translate("Declaring exchange " + exchange, e);
		} catch (ShutdownSignalException e) {
			throw BrokerException.from("Declaring exchange " + exchange, e, e);
		}
	}

	/**
	 * @return the queue name, as assigned by the broker when {@code queue} is empty
	 */
	public String queueDeclare(String queue, boolean durable, boolean exclusive, boolean autoDelete,
			Map<String, Object> arguments) throws IOException {
		try {
			return channel.queueDeclare(queue, durable, exclusive, autoDelete, arguments).getQueue();
		} catch (IOException e) {
			throw BrokerException.translate("Declaring queue " + queue, e);
		} catch (ShutdownSignalException e) {
			throw BrokerException.from("Declaring queue " + queue, e, e);
		}
	}

	public void queueBind(String queue, String exchange, String bindingKey) throws IOException {
		try {
			channel.queueBind(queue, exchange, bindingKey);
		} catch (IOException e) {
			throw BrokerException.translate("Binding queue " + queue + " to " + exchange, e);
		} catch (ShutdownSignalException e) {
			throw BrokerException.from("Binding queue " + queue + " to " + exchange, e, e);
		}
	}

	/**
	 * @return the number of messages that were in the queue
	 */
	public int queuePurge(String queue) throws IOException {
		try {
			return channel.queuePurge(queue).getMessageCount();
		} catch (IOException e) {
			throw BrokerException.translate("Purging queue " + queue, e);
		} catch (ShutdownSignalException e) {
			throw BrokerException.from("Purging queue " + queue, e, e);
		}
	}

	/**
	 * Deletes a queue. With {@code ifUnused} or {@code ifEmpty} set and the
	 * condition not met, the broker closes the channel with
	 * {@code PRECONDITION_FAILED}, reported as a {@link BrokerException}.
	 *
	 * @return the number of messages deleted with the queue
	 */
	public int queueDelete(String queue, boolean ifUnused, boolean ifEmpty) throws IOException {
		try {
			return channel.queueDelete(queue, ifUnused, ifEmpty).getMessageCount();
		} catch (IOException e) {
			throw BrokerException.translate("Deleting queue " + queue, e);
		} catch (ShutdownSignalException e) {
			throw BrokerException.from("Deleting queue " + queue, e, e);
		}
	}

	public void addConfirmListener(ConfirmListener listener) {
		channel.addConfirmListener(listener);
	}

	public void addReturnListener(ReturnListener listener) {
		channel.addReturnListener(listener);
	}

	public boolean removeConfirmListener(ConfirmListener listener) {
		return channel.removeConfirmListener(listener);
	}

	public boolean removeReturnListener(ReturnListener listener) {
		return channel.removeReturnListener(listener);
	}

	/**
	 * Closes the channel. Closing an already closed channel does nothing.
	 */
	public void close() throws IOException {
		if (!channel.isOpen()) {
			return;
		}
		try {
			channel.close();
		} catch (AlreadyClosedException e) {
			logger.debug("Channel {} was already closed", channel.getChannelNumber());
		} catch (TimeoutException e) {
			throw new IOException("Timed out closing channel " + channel.getChannelNumber(), e);
		}
	}

	private NotInConfirmModeException notInConfirmMode(IllegalStateException e) {
		return new NotInConfirmModeException("Channel " + channel.getChannelNumber()
				+ " is not in confirm mode", e);
	}

	@Override
	public String toString() {
		return "RabbitMQChannel [channelNumber=" + channel.getChannelNumber() + ", mode=" + mode + "]";
	}

}
