package com.qfree.rabbitclient.topology;

import com.qfree.rabbitclient.connection.ConnectionOptions;
import com.qfree.rabbitclient.connection.RabbitMQConnection;
import com.qfree.rabbitclient.format.Formatter;
import com.qfree.rabbitclient.format.Formatters;

/**
 * Where a producer or consumer is attached: the connection to use (a shared
 * one, or one to open), the exchange, the queue, the binding key and the
 * body format.
 * <p>
 * Pairs that exclude each other ({@code connection}/{@code connectionOptions},
 * {@code queue}/{@code newQueue}, {@code format}/{@code formatter}) are
 * rejected by {@link Builder#build()}.
 */
public final class EndpointOptions {

	private final RabbitMQConnection connection;
	private final ConnectionOptions connectionOptions;
	private final ExchangeDeclaration exchange;
	private final QueueDeclaration queue;
	private final String bindingKey;
	private final String format;
	private final Formatter formatter;

	private EndpointOptions(Builder builder) {
		this.connection = builder.connection;
		this.connectionOptions = builder.connectionOptions;
		this.exchange = builder.exchange;
		this.queue = builder.queue != null ? builder.queue : builder.newQueue;
		this.bindingKey = builder.bindingKey;
		this.format = builder.format;
		this.formatter = builder.formatter;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * @return the shared connection, or null if a connection is to be opened
	 */
	public RabbitMQConnection getConnection() {
		return connection;
	}

	/**
	 * @return the settings for a new connection; {@link ConnectionOptions#load()}
	 *         when neither a connection nor options were given
	 */
	public ConnectionOptions getConnectionOptions() {
		return connectionOptions != null ? connectionOptions : ConnectionOptions.load();
	}

	public boolean hasSharedConnection() {
		return connection != null;
	}

	public ExchangeDeclaration getExchange() {
		return exchange;
	}

	/**
	 * @return the queue, or null if the endpoint has none
	 */
	public QueueDeclaration getQueue() {
		return queue;
	}

	public String getBindingKey() {
		return bindingKey;
	}

	public String getFormat() {
		return format;
	}

	/**
	 * @return the formatter given directly or looked up by name, or null if
	 *         bodies are raw bytes
	 * @throws com.qfree.rabbitclient.format.UnknownFormatterException if the
	 *         format name is not registered
	 */
	public Formatter resolveFormatter() {
		if (formatter != null) {
			return formatter;
		}
		if (format != null) {
			return Formatters.lookup(format);
		}
		return null;
	}

	@Override
	public String toString() {
		return "EndpointOptions [sharedConnection=" + (connection != null) + ", exchange=" + exchange
				+ ", queue=" + queue + ", bindingKey=" + bindingKey + ", format=" + format
				+ ", formatter=" + formatter + "]";
	}

	public static final class Builder {

		private RabbitMQConnection connection;
		private ConnectionOptions connectionOptions;
		private ExchangeDeclaration exchange = ExchangeDeclaration.defaultExchange();
		private QueueDeclaration queue;
		private QueueDeclaration newQueue;
		private String bindingKey;
		private String format;
		private Formatter formatter;

		private Builder() {
		}

		/**
		 * Use an already open connection. It is not closed on shutdown.
		 */
		public Builder connection(RabbitMQConnection connection) {
			this.connection = connection;
			return this;
		}

		/**
		 * Open a new connection with these settings. It is closed on shutdown.
		 */
		public Builder connectionOptions(ConnectionOptions connectionOptions) {
			this.connectionOptions = connectionOptions;
			return this;
		}

		public Builder exchange(ExchangeDeclaration exchange) {
			this.exchange = exchange;
			return this;
		}

		/**
		 * Shorthand for {@code exchange(ExchangeDeclaration.existing(name))}.
		 */
		public Builder exchange(String name) {
			return exchange(ExchangeDeclaration.existing(name));
		}

		public Builder queue(QueueDeclaration queue) {
			this.queue = queue;
			return this;
		}

		/**
		 * Shorthand for {@code queue(QueueDeclaration.existing(name))}.
		 */
		public Builder queue(String name) {
			return queue(QueueDeclaration.existing(name));
		}

		/**
		 * Declare a new exclusive queue; {@code ""} lets the broker name it.
		 */
		public Builder newQueue(String name) {
			this.newQueue = QueueDeclaration.newExclusive(name);
			return this;
		}

		public Builder bindingKey(String bindingKey) {
			this.bindingKey = bindingKey;
			return this;
		}

		/**
		 * Name of a formatter registered with {@link Formatters}.
		 */
		public Builder format(String format) {
			this.format = format;
			return this;
		}

		public Builder formatter(Formatter formatter) {
			this.formatter = formatter;
			return this;
		}

		/**
		 * @throws IllegalArgumentException if exclusive options were combined
		 * @throws com.qfree.rabbitclient.format.UnknownFormatterException if the
		 *         format name is not registered
		 */
		public EndpointOptions build() {
			if (connection != null && connectionOptions != null) {
				throw new IllegalArgumentException("Give either a connection or connection options, not both");
			}
			if (queue != null && newQueue != null) {
				throw new IllegalArgumentException("Give either queue or newQueue, not both");
			}
			if (format != null && formatter != null) {
				throw new IllegalArgumentException("Give either a format name or a formatter, not both");
			}
			if (exchange == null) {
				throw new IllegalArgumentException("exchange must not be null");
			}
			if (format != null) {
				Formatters.lookup(format);
			}
			return new EndpointOptions(this);
		}

	}

}
