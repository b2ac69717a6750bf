package com.qfree.rabbitclient.connection;

import java.io.Closeable;
import java.io.IOException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.qfree.rabbitclient.channel.RabbitMQChannel;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;

/**
 * A broker connection together with the one channel opened on it.
 * <p>
 * The connection belongs to whoever opened it. Producers and consumers that
 * are handed an existing {@code RabbitMQConnection} share its channel and
 * leave closing it to the owner.
 */
public class RabbitMQConnection implements Closeable {

	private static final Logger logger = LoggerFactory.getLogger(RabbitMQConnection.class);

	/*
	 * Null when this object only wraps a channel that was opened elsewhere.
	 */
	private final Connection connection;
	private final RabbitMQChannel channel;

	private final AtomicBoolean closed = new AtomicBoolean(false);

	RabbitMQConnection(Connection connection, RabbitMQChannel channel) {
		this.connection = connection;
		this.channel = channel;
	}

	/**
	 * Opens a connection using {@link ConnectionOptions#load()}.
	 */
	public static RabbitMQConnection open() throws IOException {
		return open(ConnectionOptions.load());
	}

	public static RabbitMQConnection open(ConnectionOptions options) throws IOException {
		return open(options, new ConnectionFactory());
	}

	/**
	 * Opens a connection with the given factory, after applying the options to
	 * it. If the channel cannot be opened the connection is closed again.
	 *
	 * @throws ConnectionFailedException if the connection or channel cannot be opened
	 */
	public static RabbitMQConnection open(ConnectionOptions options, ConnectionFactory factory) throws IOException {
		options.applyTo(factory);

		logger.info("Opening RabbitMQ connection to {}...", options.describe());
		Connection connection;
		try {
			connection = factory.newConnection(options.getConnectionName());
		} catch (IOException | TimeoutException e) {
			/*
			 * The details written out here depend on how the broker was
			 * specified: either as a single AMQP URI or as host, port, etc.
			 */
			throw new ConnectionFailedException(
					"Unable to open a connection to the RabbitMQ broker at " + options.describe(), e);
		}

		try {
			Channel channel = connection.createChannel();
			if (channel == null) {
				throw new IOException("No channel number available on the connection");
			}
			logger.debug("Opened channel {}", channel.getChannelNumber());
			return new RabbitMQConnection(connection, new RabbitMQChannel(channel));
		} catch (IOException e) {
			logger.error("Exception thrown opening a channel. The connection will be closed.", e);
			closeQuietly(connection);
			throw new ConnectionFailedException("Unable to open a channel on " + options.describe(), e);
		}
	}

	/**
	 * Wraps a channel opened elsewhere. Closing the result closes only the
	 * channel; its connection stays with whoever opened it.
	 */
	public static RabbitMQConnection wrap(Channel channel) {
		return new RabbitMQConnection(null, new RabbitMQChannel(channel));
	}

	public Connection getConnection() {
		return connection;
	}

	public RabbitMQChannel getChannel() {
		return channel;
	}

	public boolean isOpen() {
		return !closed.get() && channel.isOpen();
	}

	/**
	 * Closes the channel and then the connection. Calling this more than once,
	 * or after the broker already closed either of them, is harmless.
	 */
	@Override
	public void close() throws IOException {
		if (!closed.compareAndSet(false, true)) {
			return;
		}

		/*
		 * The broker closes any open channels when the connection is closed,
		 * so closing the channel first is not strictly necessary, but it lets
		 * a failure on the channel be reported separately.
		 */
		logger.info("Closing RabbitMQ channel...");
		try {
			channel.close();
		} catch (IOException e) {
			logger.warn("Exception caught closing RabbitMQ channel", e);
		}

		if (connection != null && connection.isOpen()) {
			logger.info("Closing RabbitMQ connection...");
			try {
				connection.close();
			} catch (AlreadyClosedException e) {
				logger.debug("RabbitMQ connection was already closed");
			}
		}
	}

	private static void closeQuietly(Connection connection) {
		try {
			connection.close();
		} catch (IOException | AlreadyClosedException e) {
			logger.warn("Exception caught closing RabbitMQ connection", e);
		}
	}

}
