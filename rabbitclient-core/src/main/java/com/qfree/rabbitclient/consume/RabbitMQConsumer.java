package com.qfree.rabbitclient.consume;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.qfree.rabbitclient.RabbitMQMessage;
import com.qfree.rabbitclient.RabbitMQMsgAck;
import com.qfree.rabbitclient.channel.RabbitMQChannel;
import com.qfree.rabbitclient.connection.RabbitMQConnection;
import com.qfree.rabbitclient.format.FormatException;
import com.qfree.rabbitclient.format.Formatter;
import com.qfree.rabbitclient.format.MessageBodies;
import com.qfree.rabbitclient.thread.DefaultUncaughtExceptionHandler;
import com.qfree.rabbitclient.topology.EndpointOptions;
import com.qfree.rabbitclient.topology.ResolvedTopology;
import com.qfree.rabbitclient.topology.Topology;
import com.rabbitmq.client.GetResponse;

/**
 * Receives messages from one queue, either through a subscription whose
 * events are handed to a {@link SubscriptionHandler}, or by polling with
 * {@link #get()}.
 * <p>
 * Deliveries that need an acknowledgement are tracked until they are acked
 * or nacked, so that each delivery tag is settled at most once.
 */
public class RabbitMQConsumer implements Closeable {

	private static final Logger logger = LoggerFactory.getLogger(RabbitMQConsumer.class);

	public static final long DEFAULT_UNSUBSCRIBE_TIMEOUT_MS = 10000;

	private final RabbitMQConnection connection;
	/*
	 * True if the connection was opened for this consumer, in which case
	 * shutdown() closes it.
	 */
	private final boolean ownsConnection;
	private final RabbitMQChannel channel;
	private final String queue;
	private final Formatter formatter;

	/*
	 * Delivery tag -> handle, for every delivery on this consumer's channel
	 * that still has to be acked or nacked.
	 */
	private final Map<Long, RabbitMQMsgAck> pendingAcknowledgements = new ConcurrentHashMap<>();

	private Subscription subscription = null;

	private final AtomicBoolean shutdown = new AtomicBoolean(false);

	RabbitMQConsumer(RabbitMQConnection connection, boolean ownsConnection, ResolvedTopology topology,
			Formatter formatter) {
		this.connection = connection;
		this.ownsConnection = ownsConnection;
		this.channel = connection.getChannel();
		this.queue = topology.getQueue();
		this.formatter = formatter;
	}

	/**
	 * Opens a connection (or uses the shared one), declares and binds what
	 * the options ask for and returns an unsubscribed consumer.
	 *
	 * @throws IllegalArgumentException if the options name no queue; nothing is opened then
	 */
	public static RabbitMQConsumer create(EndpointOptions options) throws IOException {
		if (options.getQueue() == null) {
			throw new IllegalArgumentException("A consumer needs a queue: give either queue or newQueue");
		}
		Formatter formatter = options.resolveFormatter();

		boolean ownsConnection = !options.hasSharedConnection();
		RabbitMQConnection connection = ownsConnection
				? RabbitMQConnection.open(options.getConnectionOptions())
				: options.getConnection();
		try {
			ResolvedTopology topology = Topology.resolve(connection.getChannel(), options);
			logger.info("Consumer created for queue \"{}\"", topology.getQueue());
			return new RabbitMQConsumer(connection, ownsConnection, topology, formatter);
		} catch (IOException | RuntimeException e) {
			if (ownsConnection) {
				try {
					connection.close();
				} catch (IOException closeException) {
					logger.warn("Exception caught closing RabbitMQ connection", closeException);
				}
			}
			throw e;
		}
	}

	public RabbitMQConnection getConnection() {
		return connection;
	}

	public RabbitMQChannel getChannel() {
		return channel;
	}

	/**
	 * @return the queue name, as assigned by the broker for a server-named queue
	 */
	public String getQueue() {
		return queue;
	}

	public Formatter getFormatter() {
		return formatter;
	}

	public synchronized Subscription getSubscription() {
		return subscription;
	}

	/**
	 * @return the tag of the current subscription, or null if not subscribed
	 */
	public synchronized String getConsumerTag() {
		return subscription != null ? subscription.getConsumerTag() : null;
	}

	public synchronized boolean isSubscribed() {
		return subscription != null && subscription.isActive();
	}

	/**
	 * Subscribes with {@link SubscribeOptions#defaults()}.
	 */
	public RabbitMQConsumer subscribe(SubscriptionHandler handler) throws IOException {
		return subscribe(handler, SubscribeOptions.defaults());
	}

	/**
	 * Starts consuming from the queue. The handler receives BEGIN, then one
	 * MESSAGE event per delivery, then END, in that order and one at a time.
	 *
	 * @throws IllegalStateException if already subscribed
	 */
	public synchronized RabbitMQConsumer subscribe(SubscriptionHandler handler, SubscribeOptions options)
			throws IOException {
		checkNotShutdown();
		if (handler == null) {
			throw new IllegalArgumentException("handler must not be null");
		}
		if (options == null) {
			options = SubscribeOptions.defaults();
		}
		if (subscription != null && subscription.isActive()) {
			throw new IllegalStateException("Consumer is already subscribed to queue \"" + queue + "\" as "
					+ subscription.getConsumerTag());
		}

		if (options.getPrefetchCount() > 0) {
			channel.qos(options.getPrefetchCount());
		}

		BlockingQueue<SubscriptionEvent> events = new LinkedBlockingQueue<>();
		SubscriptionConsumer consumer = new SubscriptionConsumer(channel, formatter, options, events,
				pendingAcknowledgements);
		Subscription newSubscription = new Subscription(consumer);

		String consumerTag = channel.consume(queue, options.isNoAck(), consumer);
		newSubscription.setConsumerTag(consumerTag);
		logger.info("Subscribed to queue \"{}\" as {} (noAck = {}, simple = {})", queue, consumerTag,
				options.isNoAck(), options.isSimple());

		SubscriptionDispatcher dispatcher = new SubscriptionDispatcher(events, handler, newSubscription);
		Executor executor = options.getExecutor();
		if (executor != null) {
			executor.execute(dispatcher);
		} else {
			Thread thread = new Thread(dispatcher, "rabbitclient-subscriber-" + consumerTag);
			thread.setDaemon(true);
			thread.setUncaughtExceptionHandler(new DefaultUncaughtExceptionHandler());
			thread.start();
		}

		this.subscription = newSubscription;
		return this;
	}

	/**
	 * Same as {@link #unsubscribe(long)} with {@value #DEFAULT_UNSUBSCRIBE_TIMEOUT_MS} ms.
	 */
	public boolean unsubscribe() throws IOException, InterruptedException {
		return unsubscribe(DEFAULT_UNSUBSCRIBE_TIMEOUT_MS);
	}

	/**
	 * Cancels the subscription and waits for the handler to receive the END
	 * event. No events follow END. When called from the handler itself there
	 * is no wait: END is handled after the handler returns.
	 *
	 * @return true if the dispatcher stopped within the timeout
	 * @throws IllegalStateException if not subscribed
	 */
	public boolean unsubscribe(long timeoutMs) throws IOException, InterruptedException {
		Subscription current;
		synchronized (this) {
			current = subscription;
			if (current == null) {
				throw new IllegalStateException("Consumer is not subscribed to queue \"" + queue + "\"");
			}
		}

		/*
		 * The subscription stays registered until the cancel has been sent, so
		 * that a failed cancel can be retried, by shutdown() for one.
		 */
		String consumerTag = current.getConsumerTag();
		if (!current.isEnded()) {
			logger.info("Unsubscribing {} from queue \"{}\"", consumerTag, queue);
			channel.cancel(consumerTag);
		}
		synchronized (this) {
			if (subscription == current) {
				subscription = null;
			}
		}

		if (current.isDispatcherThread(Thread.currentThread())) {
			logger.debug("Unsubscribed from within the handler of {}; not waiting for END", consumerTag);
			return false;
		}

		boolean terminated = current.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS);
		if (!terminated) {
			logger.warn("Dispatcher for {} did not terminate within {} ms", consumerTag, timeoutMs);
		}
		return terminated;
	}

	/**
	 * Fetches one message without acknowledgement.
	 *
	 * @see #get(GetOptions)
	 */
	public Optional<RabbitMQMessage> get() throws IOException {
		return get(GetOptions.defaults());
	}

	/**
	 * Fetches the next message from the queue with {@code basic.get}. Never
	 * waits for a message to arrive. The body is returned raw.
	 *
	 * @return the message, or empty if the queue is empty
	 */
	public Optional<RabbitMQMessage> get(GetOptions options) throws IOException {
		checkNotShutdown();
		if (options == null) {
			options = GetOptions.defaults();
		}
		GetResponse response = channel.get(queue, options.isNoAck());
		if (response == null) {
			return Optional.empty();
		}
		RabbitMQMessage message = RabbitMQMessage.fromGetResponse(response);
		logger.debug("Got delivery tag {} from queue \"{}\", {} messages left", message.getDeliveryTag(), queue,
				message.getMessageCount());
		if (!options.isNoAck()) {
			// Registers itself as pending.
			new RabbitMQMsgAck(channel, null, message.getDeliveryTag(), true, pendingAcknowledgements);
		}
		return Optional.of(message);
	}

	public Optional<Object> getBody() throws IOException {
		return getBody(GetOptions.defaults());
	}

	/**
	 * Like {@link #get(GetOptions)}, but returns only the body decoded with
	 * the consumer's formatter (raw bytes if it has none). A message that
	 * cannot be decoded is rejected without requeue when it needed an ack.
	 *
	 * @return the decoded body, or empty only if the queue is empty
	 * @throws FormatException if the body cannot be decoded, or decodes to null
	 */
	public Optional<Object> getBody(GetOptions options) throws IOException {
		Optional<RabbitMQMessage> message = get(options);
		if (!message.isPresent()) {
			return Optional.empty();
		}
		RabbitMQMessage received = message.get();
		try {
			return Optional.of(MessageBodies.decode(received.getBodyBytes(), formatter));
		} catch (FormatException e) {
			RabbitMQMsgAck msgAck = pendingAcknowledgements.get(received.getDeliveryTag());
			if (msgAck != null) {
				msgAck.nack(false);
			}
			throw e;
		}
	}

	public void ack(RabbitMQMessage message) throws IOException {
		ack(message.getDeliveryTag());
	}

	/**
	 * @throws IllegalStateException if the tag is not awaiting an acknowledgement
	 */
	public void ack(long deliveryTag) throws IOException {
		pending(deliveryTag).ack();
	}

	public void nack(RabbitMQMessage message) throws IOException {
		nack(message.getDeliveryTag(), true);
	}

	public void nack(RabbitMQMessage message, boolean requeue) throws IOException {
		nack(message.getDeliveryTag(), requeue);
	}

	public void nack(long deliveryTag) throws IOException {
		nack(deliveryTag, true);
	}

	/**
	 * @param requeue if false the message is dead-lettered or discarded
	 * @throws IllegalStateException if the tag is not awaiting an acknowledgement
	 */
	public void nack(long deliveryTag, boolean requeue) throws IOException {
		pending(deliveryTag).nack(requeue);
	}

	/**
	 * Asks the broker to redeliver every unacknowledged message on the
	 * channel. Their old delivery tags can no longer be acked.
	 */
	public void recover(boolean requeue) throws IOException {
		channel.recover(requeue);
		List<RabbitMQMsgAck> forgotten = new ArrayList<>(pendingAcknowledgements.values());
		for (RabbitMQMsgAck msgAck : forgotten) {
			msgAck.forget();
			pendingAcknowledgements.remove(msgAck.getDeliveryTag());
		}
		logger.debug("Recovered {} unacknowledged deliveries on queue \"{}\"", forgotten.size(), queue);
	}

	/**
	 * @return the number of deliveries that still have to be acked or nacked
	 */
	public int getPendingAckCount() {
		return pendingAcknowledgements.size();
	}

	public boolean isShutdown() {
		return shutdown.get();
	}

	/**
	 * Ends the subscription, if any, and closes the connection if this
	 * consumer opened it. Calling this more than once does nothing.
	 */
	public void shutdown() throws IOException {
		if (!shutdown.compareAndSet(false, true)) {
			return;
		}
		if (isSubscribed()) {
			try {
				unsubscribe();
			} catch (InterruptedException e) {
				logger.warn("Interrupted while waiting for the subscription to end");
				Thread.currentThread().interrupt();
			} catch (IOException | IllegalStateException e) {
				logger.warn("Exception caught ending the subscription", e);
			}
		}
		if (ownsConnection) {
			connection.close();
		}
		logger.info("Consumer for queue \"{}\" shut down", queue);
	}

	@Override
	public void close() throws IOException {
		shutdown();
	}

	private RabbitMQMsgAck pending(long deliveryTag) {
		RabbitMQMsgAck msgAck = pendingAcknowledgements.get(deliveryTag);
		if (msgAck == null) {
			throw new IllegalStateException("Delivery tag " + deliveryTag + " is not awaiting an acknowledgement");
		}
		return msgAck;
	}

	private void checkNotShutdown() {
		if (shutdown.get()) {
			throw new IllegalStateException("Consumer has been shut down");
		}
	}

	@Override
	public String toString() {
		return "RabbitMQConsumer [queue=" + queue + ", formatter=" + formatter + ", ownsConnection="
				+ ownsConnection + ", subscription=" + subscription + "]";
	}

}
