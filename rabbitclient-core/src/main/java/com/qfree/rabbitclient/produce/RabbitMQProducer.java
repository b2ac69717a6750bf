package com.qfree.rabbitclient.produce;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.stream.Collector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.qfree.rabbitclient.RabbitMQMessage;
import com.qfree.rabbitclient.channel.ChannelMode;
import com.qfree.rabbitclient.channel.ConfirmResult;
import com.qfree.rabbitclient.channel.RabbitMQChannel;
import com.qfree.rabbitclient.connection.RabbitMQConnection;
import com.qfree.rabbitclient.format.Formatter;
import com.qfree.rabbitclient.format.MessageBodies;
import com.qfree.rabbitclient.topology.EndpointOptions;
import com.qfree.rabbitclient.topology.ResolvedTopology;
import com.qfree.rabbitclient.topology.Topology;
import com.rabbitmq.client.AMQP;

/**
 * Publishes messages to one exchange, with a default routing key worked out
 * from the endpoint's binding key or queue.
 * <p>
 * A producer is not thread-safe: its channel must not be used by several
 * threads at once.
 */
public class RabbitMQProducer implements Closeable {

	private static final Logger logger = LoggerFactory.getLogger(RabbitMQProducer.class);

	private final RabbitMQConnection connection;
	/*
	 * True if the connection was opened for this producer, in which case
	 * shutdown() closes it.
	 */
	private final boolean ownsConnection;
	private final RabbitMQChannel channel;
	private final String exchange;
	private final String routingKey;
	private final Formatter formatter;

	/*
	 * Publish sequence number -> short description of the publish, for every
	 * publish made in confirm mode that the broker has not yet acked or
	 * nacked. Entries are removed by the PublisherConfirmListener.
	 */
	private final SortedMap<Long, String> pendingPublisherConfirms = Collections
			.synchronizedSortedMap(new TreeMap<Long, String>());
	private final PublisherConfirmListener confirmListener;
	private final PublisherReturnListener returnListener;

	private final AtomicBoolean shutdown = new AtomicBoolean(false);

	RabbitMQProducer(RabbitMQConnection connection, boolean ownsConnection, ResolvedTopology topology,
			Formatter formatter) {
		this.connection = connection;
		this.ownsConnection = ownsConnection;
		this.channel = connection.getChannel();
		this.exchange = topology.getExchange();
		this.routingKey = topology.getRoutingKey();
		this.formatter = formatter;

		/*
		 * The confirm listener is harmless until the channel is put in confirm
		 * mode, which may also be done directly on the channel.
		 */
		this.confirmListener = new PublisherConfirmListener(pendingPublisherConfirms);
		this.returnListener = new PublisherReturnListener();
		channel.addConfirmListener(confirmListener);
		channel.addReturnListener(returnListener);
	}

	/**
	 * Opens a connection (or uses the shared one), declares and binds what
	 * the options ask for and returns a producer for it.
	 *
	 * @throws IllegalArgumentException if the options are invalid; nothing is opened then
	 */
	public static RabbitMQProducer create(EndpointOptions options) throws IOException {
		Formatter formatter = options.resolveFormatter();

		boolean ownsConnection = !options.hasSharedConnection();
		RabbitMQConnection connection = ownsConnection
				? RabbitMQConnection.open(options.getConnectionOptions())
				: options.getConnection();
		try {
			ResolvedTopology topology = Topology.resolve(connection.getChannel(), options);
			logger.info("Producer created for exchange \"{}\", routing key \"{}\"", topology.getExchange(),
					topology.getRoutingKey());
			return new RabbitMQProducer(connection, ownsConnection, topology, formatter);
		} catch (IOException | RuntimeException e) {
			if (ownsConnection) {
				closeQuietly(connection);
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

	public String getExchange() {
		return exchange;
	}

	public String getRoutingKey() {
		return routingKey;
	}

	public Formatter getFormatter() {
		return formatter;
	}

	/**
	 * Publishes with the producer's defaults.
	 *
	 * @see #publish(Object, PublishOptions)
	 */
	public ConfirmResult publish(Object message) throws IOException, InterruptedException {
		return publish(message, PublishOptions.defaults());
	}

	/**
	 * Publishes a raw payload or a {@link RabbitMQMessage} envelope.
	 * <p>
	 * The body is encoded with the formatter from the options, else the
	 * producer's. For a raw payload the headers from the options are sent
	 * with it. For an envelope the envelope's own properties are sent and
	 * the headers from the options are not used; its exchange and routing
	 * key are not used either.
	 *
	 * @return {@link ConfirmResult#OK} unless the options ask to wait for a
	 *         confirmation, in which case the outcome of that wait
	 * @throws com.qfree.rabbitclient.channel.NotInConfirmModeException if
	 *         waiting for a confirmation outside confirm mode
	 * @throws com.qfree.rabbitclient.format.FormatException if the body cannot be encoded
	 */
	public ConfirmResult publish(Object message, PublishOptions options) throws IOException, InterruptedException {
		checkNotShutdown();
		if (options == null) {
			options = PublishOptions.defaults();
		}

		String targetExchange = options.getExchange() != null ? options.getExchange() : exchange;
		String targetRoutingKey = options.getRoutingKey() != null ? options.getRoutingKey() : routingKey;
		Formatter bodyFormatter = options.resolveFormatter(formatter);

		byte[] body;
		AMQP.BasicProperties properties;
		if (message instanceof RabbitMQMessage) {
			RabbitMQMessage envelope = (RabbitMQMessage) message;
			body = MessageBodies.encode(envelope.getBody(), bodyFormatter);
			properties = envelope.getProperties();
			if (options.getHeaders() != null) {
				logger.debug("Publish option headers not used for a message envelope: {}", options.getHeaders());
			}
		} else {
			body = MessageBodies.encode(message, bodyFormatter);
			if (options.getHeaders() != null) {
				properties = new AMQP.BasicProperties.Builder()
						.headers(new LinkedHashMap<>(options.getHeaders()))
						.build();
			} else {
				properties = new AMQP.BasicProperties();
			}
		}

		/*
		 * Outside confirm mode the RabbitMQ client reports 0 as the next
		 * sequence number.
		 */
		long nextPublishSeqNo = channel.getNextPublishSeqNo();
		if (nextPublishSeqNo > 0) {
			pendingPublisherConfirms.put(nextPublishSeqNo, targetExchange + "/" + targetRoutingKey);
		}
		logger.debug("nextPublishSeqNo = {}. Publishing {} bytes to exchange \"{}\" with routing key \"{}\"",
				nextPublishSeqNo, body.length, targetExchange, targetRoutingKey);

		try {
			channel.publish(targetExchange, targetRoutingKey, options.isMandatory(), options.isImmediate(),
					properties, body);
		} catch (IOException e) {
			if (nextPublishSeqNo > 0) {
				pendingPublisherConfirms.remove(nextPublishSeqNo);
			}
			throw e;
		}

		if (!options.isAwaitConfirm()) {
			return ConfirmResult.OK;
		}
		Long timeoutMs = options.getTimeoutMs();
		return timeoutMs != null ? channel.awaitConfirms(timeoutMs) : channel.awaitConfirms();
	}

	/**
	 * Publishes each element with the producer's defaults, stopping at the
	 * first failure.
	 *
	 * @return the number of messages published
	 */
	public int publishAll(Iterable<?> messages) throws IOException, InterruptedException {
		int count = 0;
		for (Object message : messages) {
			publish(message);
			count++;
		}
		return count;
	}

	/**
	 * A collector that publishes every element of a stream through this
	 * producer and finishes with the producer itself. Only sequential streams
	 * are supported: the producer cannot be split into several containers.
	 */
	public Collector<Object, ?, RabbitMQProducer> collector() {
		return Collector.of(new ProducerSupplier(this), RabbitMQProducer::publishUnchecked,
				(left, right) -> {
					throw new UnsupportedOperationException("A producer cannot be combined with another");
				});
	}

	private void publishUnchecked(Object message) {
		try {
			publish(message);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while publishing", e);
		}
	}

	public void setMode(ChannelMode mode) throws IOException {
		channel.setMode(mode);
	}

	public ConfirmResult awaitConfirms() throws IOException, InterruptedException {
		return channel.awaitConfirms();
	}

	public ConfirmResult awaitConfirms(long timeoutMs) throws IOException, InterruptedException {
		return channel.awaitConfirms(timeoutMs);
	}

	public void commit() throws IOException {
		channel.commit();
	}

	public void rollback() throws IOException {
		channel.rollback();
	}

	/**
	 * Sets the handler for messages returned by the broker, or null for none.
	 * Returns are logged whether or not a handler is set.
	 */
	public void setReturnHandler(ReturnedMessageHandler handler) {
		returnListener.setHandler(handler);
	}

	/**
	 * @return the number of publishes made in confirm mode that the broker has
	 *         not yet acked or nacked
	 */
	public int getUnconfirmedCount() {
		return pendingPublisherConfirms.size();
	}

	public long getNackedCount() {
		return confirmListener.getNackCount();
	}

	public boolean isShutdown() {
		return shutdown.get();
	}

	/**
	 * Closes the connection if this producer opened it. A shared connection
	 * is left open. Calling this more than once does nothing.
	 */
	public void shutdown() throws IOException {
		if (!shutdown.compareAndSet(false, true)) {
			return;
		}
		channel.removeConfirmListener(confirmListener);
		channel.removeReturnListener(returnListener);
		if (!pendingPublisherConfirms.isEmpty()) {
			logger.warn("{} publishes not yet confirmed at shutdown", pendingPublisherConfirms.size());
		}
		if (ownsConnection) {
			connection.close();
		}
		logger.info("Producer for exchange \"{}\" shut down", exchange);
	}

	@Override
	public void close() throws IOException {
		shutdown();
	}

	private void checkNotShutdown() {
		if (shutdown.get()) {
			throw new IllegalStateException("Producer has been shut down");
		}
	}

	private static void closeQuietly(RabbitMQConnection connection) {
		try {
			connection.close();
		} catch (IOException e) {
			logger.warn("Exception caught closing RabbitMQ connection", e);
		}
	}

	@Override
	public String toString() {
		return "RabbitMQProducer [exchange=" + exchange + ", routingKey=" + routingKey + ", formatter=" + formatter
				+ ", ownsConnection=" + ownsConnection + ", shutdown=" + shutdown.get() + "]";
	}

	/*
	 * Hands out the producer as the collector's container exactly once.
	 */
	private static final class ProducerSupplier implements Supplier<RabbitMQProducer> {

		private final RabbitMQProducer producer;
		private final AtomicBoolean suppliedOnce = new AtomicBoolean(false);

		ProducerSupplier(RabbitMQProducer producer) {
			this.producer = producer;
		}

		@Override
		public RabbitMQProducer get() {
			if (!suppliedOnce.compareAndSet(false, true)) {
				throw new UnsupportedOperationException("no empty producer");
			}
			return producer;
		}

	}

}
