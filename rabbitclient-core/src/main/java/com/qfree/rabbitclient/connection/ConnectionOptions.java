package com.qfree.rabbitclient.connection;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.security.GeneralSecurityException;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.ConnectionFactory;

/**
 * Settings used to open a broker connection.
 * <p>
 * Either an AMQP URI is given, or the individual host, port, credentials and
 * virtual host. Anything left unset keeps the RabbitMQ client default
 * ({@code localhost:5672}, {@code guest/guest}, virtual host {@code "/"}).
 * <p>
 * Instances are immutable; use {@link #builder()}, {@link #fromProperties(Properties)}
 * or {@link #load()}.
 */
public final class ConnectionOptions {

	private static final Logger logger = LoggerFactory.getLogger(ConnectionOptions.class);

	/** Classpath resource read by {@link #load()}, if present. */
	public static final String RESOURCE_NAME = "rabbitclient.properties";

	public static final String URI = "rabbitmq.uri";
	public static final String HOST = "rabbitmq.host";
	public static final String PORT = "rabbitmq.port";
	public static final String USERNAME = "rabbitmq.username";
	public static final String PASSWORD = "rabbitmq.password";
	public static final String VIRTUAL_HOST = "rabbitmq.virtual-host";
	public static final String CONNECTION_TIMEOUT_MS = "rabbitmq.connection-timeout-ms";
	public static final String REQUESTED_HEARTBEAT = "rabbitmq.requested-heartbeat";
	public static final String CONNECTION_NAME = "rabbitmq.connection-name";

	private static final String[] KEYS = { URI, HOST, PORT, USERNAME, PASSWORD, VIRTUAL_HOST,
			CONNECTION_TIMEOUT_MS, REQUESTED_HEARTBEAT, CONNECTION_NAME };

	private final String uri;
	private final String host;
	private final Integer port;
	private final String username;
	private final String password;
	private final String virtualHost;
	private final Integer connectionTimeoutMs;
	private final Integer requestedHeartbeat;
	private final String connectionName;

	private ConnectionOptions(Builder builder) {
		this.uri = builder.uri;
		this.host = builder.host;
		this.port = builder.port;
		this.username = builder.username;
		this.password = builder.password;
		this.virtualHost = builder.virtualHost;
		this.connectionTimeoutMs = builder.connectionTimeoutMs;
		this.requestedHeartbeat = builder.requestedHeartbeat;
		this.connectionName = builder.connectionName;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Options with every value left at the RabbitMQ client default.
	 */
	public static ConnectionOptions defaults() {
		return new Builder().build();
	}

	/**
	 * Reads the {@code rabbitmq.*} keys from the given properties. Unknown keys
	 * are ignored.
	 *
	 * @throws IllegalArgumentException if a numeric value cannot be parsed
	 */
	public static ConnectionOptions fromProperties(Properties properties) {
		Builder builder = new Builder();
		builder.uri(trimToNull(properties.getProperty(URI)));
		builder.host(trimToNull(properties.getProperty(HOST)));
		builder.port(parseInteger(properties, PORT));
		builder.username(trimToNull(properties.getProperty(USERNAME)));
		builder.password(properties.getProperty(PASSWORD));
		builder.virtualHost(trimToNull(properties.getProperty(VIRTUAL_HOST)));
		builder.connectionTimeoutMs(parseInteger(properties, CONNECTION_TIMEOUT_MS));
		builder.requestedHeartbeat(parseInteger(properties, REQUESTED_HEARTBEAT));
		builder.connectionName(trimToNull(properties.getProperty(CONNECTION_NAME)));
		return builder.build();
	}

	/**
	 * Reads {@value #RESOURCE_NAME} from the classpath (when it exists) and then
	 * lets JVM system properties with the same keys override it.
	 */
	public static ConnectionOptions load() {
		Properties properties = new Properties();
		ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
		if (classLoader == null) {
			classLoader = ConnectionOptions.class.getClassLoader();
		}
		try (InputStream in = classLoader.getResourceAsStream(RESOURCE_NAME)) {
			if (in != null) {
				properties.load(in);
				logger.debug("Loaded connection settings from classpath resource {}", RESOURCE_NAME);
			}
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to read " + RESOURCE_NAME, e);
		}
		for (String key : KEYS) {
			String value = System.getProperty(key);
			if (value != null) {
				properties.setProperty(key, value);
			}
		}
		return fromProperties(properties);
	}

	/**
	 * Copies these settings onto a RabbitMQ {@link ConnectionFactory}.
	 * Automatic connection recovery is always switched off: a lost connection
	 * is reported to the caller, never silently re-established.
	 */
	public void applyTo(ConnectionFactory factory) {
		if (uri != null) {
			try {
				factory.setUri(uri);
			} catch (URISyntaxException | GeneralSecurityException e) {
				throw new IllegalArgumentException("Invalid AMQP URI: " + uri, e);
			}
		}
		if (host != null) {
			factory.setHost(host);
		}
		if (port != null) {
			factory.setPort(port);
		}
		if (username != null) {
			factory.setUsername(username);
		}
		if (password != null) {
			factory.setPassword(password);
		}
		if (virtualHost != null) {
			factory.setVirtualHost(virtualHost);
		}
		if (connectionTimeoutMs != null) {
			factory.setConnectionTimeout(connectionTimeoutMs);
		}
		if (requestedHeartbeat != null) {
			factory.setRequestedHeartbeat(requestedHeartbeat);
		}
		factory.setAutomaticRecoveryEnabled(false);
		factory.setTopologyRecoveryEnabled(false);
	}

	public String getUri() {
		return uri;
	}

	public String getHost() {
		return host;
	}

	public Integer getPort() {
		return port;
	}

	public String getUsername() {
		return username;
	}

	public String getPassword() {
		return password;
	}

	public String getVirtualHost() {
		return virtualHost;
	}

	public Integer getConnectionTimeoutMs() {
		return connectionTimeoutMs;
	}

	public Integer getRequestedHeartbeat() {
		return requestedHeartbeat;
	}

	public String getConnectionName() {
		return connectionName;
	}

	/*
	 * Used when logging connection attempts, so the password never appears.
	 */
	String describe() {
		if (uri != null) {
			return uri.replaceAll("//([^:/@]+):[^@]*@", "//$1:****@");
		}
		return (host != null ? host : ConnectionFactory.DEFAULT_HOST) + ":"
				+ (port != null ? port : ConnectionFactory.DEFAULT_AMQP_PORT)
				+ (virtualHost != null ? virtualHost : "/");
	}

	@Override
	public String toString() {
		return "ConnectionOptions [" + describe() + ", username=" + username
				+ ", connectionTimeoutMs=" + connectionTimeoutMs
				+ ", requestedHeartbeat=" + requestedHeartbeat
				+ ", connectionName=" + connectionName + "]";
	}

	private static String trimToNull(String value) {
		if (value == null) {
			return null;
		}
		String trimmed = value.trim();
		return trimmed.isEmpty() ? null : trimmed;
	}

	private static Integer parseInteger(Properties properties, String key) {
		String value = trimToNull(properties.getProperty(key));
		if (value == null) {
			return null;
		}
		try {
			return Integer.valueOf(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Property " + key + " must be an integer, got: " + value, e);
		}
	}

	public static final class Builder {

		private String uri;
		private String host;
		private Integer port;
		private String username;
		private String password;
		private String virtualHost;
		private Integer connectionTimeoutMs;
		private Integer requestedHeartbeat;
		private String connectionName;

		private Builder() {
		}

		// Do *not* end the URI with "/" unless the default virtual host is meant.
		public Builder uri(String uri) {
			this.uri = uri;
			return this;
		}

		public Builder host(String host) {
			this.host = host;
			return this;
		}

		public Builder port(Integer port) {
			this.port = port;
			return this;
		}

		public Builder username(String username) {
			this.username = username;
			return this;
		}

		public Builder password(String password) {
			this.password = password;
			return this;
		}

		public Builder virtualHost(String virtualHost) {
			this.virtualHost = virtualHost;
			return this;
		}

		public Builder connectionTimeoutMs(Integer connectionTimeoutMs) {
			this.connectionTimeoutMs = connectionTimeoutMs;
			return this;
		}

		public Builder requestedHeartbeat(Integer requestedHeartbeat) {
			this.requestedHeartbeat = requestedHeartbeat;
			return this;
		}

		public Builder connectionName(String connectionName) {
			this.connectionName = connectionName;
			return this;
		}

		public ConnectionOptions build() {
			if (port != null && (port < 1 || port > 65535)) {
				throw new IllegalArgumentException("Port out of range: " + port);
			}
			if (connectionTimeoutMs != null && connectionTimeoutMs < 0) {
				throw new IllegalArgumentException("Connection timeout must not be negative: " + connectionTimeoutMs);
			}
			if (requestedHeartbeat != null && requestedHeartbeat < 0) {
				throw new IllegalArgumentException("Requested heartbeat must not be negative: " + requestedHeartbeat);
			}
			return new ConnectionOptions(this);
		}
	}

}
