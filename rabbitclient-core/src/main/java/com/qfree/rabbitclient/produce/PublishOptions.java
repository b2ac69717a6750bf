package com.qfree.rabbitclient.produce;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.qfree.rabbitclient.format.Formatter;
import com.qfree.rabbitclient.format.Formatters;

/**
 * Per-call settings for {@link RabbitMQProducer#publish(Object, PublishOptions)}.
 * Anything left unset falls back to the producer's defaults.
 */
public final class PublishOptions {

	public static final String EXCHANGE = "exchange";
	public static final String ROUTING_KEY = "routing_key";
	public static final String HEADERS = "headers";
	public static final String MANDATORY = "mandatory";
	public static final String IMMEDIATE = "immediate";
	public static final String AWAIT_CONFIRM = "await_confirm";
	public static final String TIMEOUT = "timeout";
	public static final String FORMAT = "format";

	private static final List<String> VALID_KEYS = Collections.unmodifiableList(Arrays.asList(EXCHANGE,
			ROUTING_KEY, HEADERS, MANDATORY, IMMEDIATE, AWAIT_CONFIRM, TIMEOUT, FORMAT));

	private static final PublishOptions DEFAULTS = new Builder().build();

	private final String exchange;
	private final String routingKey;
	private final Map<String, Object> headers;
	private final boolean mandatory;
	private final boolean immediate;
	private final boolean awaitConfirm;
	private final Long timeoutMs;
	private final String format;
	private final Formatter formatter;

	private PublishOptions(Builder builder) {
		this.exchange = builder.exchange;
		this.routingKey = builder.routingKey;
		this.headers = builder.headers;
		this.mandatory = builder.mandatory;
		this.immediate = builder.immediate;
		this.awaitConfirm = builder.awaitConfirm;
		this.timeoutMs = builder.timeoutMs;
		this.format = builder.format;
		this.formatter = builder.formatter;
	}

	public static Builder builder() {
		return new Builder();
	}

	public static PublishOptions defaults() {
		return DEFAULTS;
	}

	/**
	 * Builds options from a map keyed by {@code exchange}, {@code routing_key},
	 * {@code headers}, {@code mandatory}, {@code immediate},
	 * {@code await_confirm}, {@code timeout} (milliseconds) and {@code format}
	 * (a registered name or a {@link Formatter}).
	 *
	 * @throws IllegalArgumentException if the map has other keys, or a value
	 *         of the wrong type
	 */
	public static PublishOptions fromMap(Map<String, ?> options) {
		if (options == null || options.isEmpty()) {
			return DEFAULTS;
		}

		List<Object> bad = new ArrayList<>();
		for (Map.Entry<String, ?> option : options.entrySet()) {
			if (!VALID_KEYS.contains(option.getKey())) {
				bad.add(option.getKey() + "=" + option.getValue());
			}
		}
		if (!bad.isEmpty()) {
			throw new IllegalArgumentException("Bad options to publish(): " + bad);
		}

		Builder builder = new Builder();
		builder.exchange(value(options, EXCHANGE, String.class));
		builder.routingKey(value(options, ROUTING_KEY, String.class));
		Map<?, ?> headers = value(options, HEADERS, Map.class);
		if (headers != null) {
			Map<String, Object> copy = new LinkedHashMap<>();
			for (Map.Entry<?, ?> header : headers.entrySet()) {
				if (!(header.getKey() instanceof String)) {
					throw new IllegalArgumentException("Bad header name for publish option " + HEADERS + ": "
							+ header.getKey() + " (expected String)");
				}
				copy.put((String) header.getKey(), header.getValue());
			}
			builder.headers(copy);
		}
		Boolean mandatory = value(options, MANDATORY, Boolean.class);
		if (mandatory != null) {
			builder.mandatory(mandatory);
		}
		Boolean immediate = value(options, IMMEDIATE, Boolean.class);
		if (immediate != null) {
			builder.immediate(immediate);
		}
		Boolean awaitConfirm = value(options, AWAIT_CONFIRM, Boolean.class);
		if (awaitConfirm != null) {
			builder.awaitConfirm(awaitConfirm);
		}
		Number timeout = value(options, TIMEOUT, Number.class);
		if (timeout != null) {
			builder.timeoutMs(timeout.longValue());
		}
		Object format = options.get(FORMAT);
		if (format instanceof Formatter) {
			builder.formatter((Formatter) format);
		} else if (format != null) {
			builder.format(value(options, FORMAT, String.class));
		}
		return builder.build();
	}

	private static <T> T value(Map<String, ?> options, String key, Class<T> type) {
		Object value = options.get(key);
		if (value == null) {
			return null;
		}
		if (!type.isInstance(value)) {
			throw new IllegalArgumentException("Bad value for publish option " + key + ": " + value
					+ " (expected " + type.getSimpleName() + ")");
		}
		return type.cast(value);
	}

	/**
	 * @return the exchange, or null to use the producer's
	 */
	public String getExchange() {
		return exchange;
	}

	/**
	 * @return the routing key, or null to use the producer's
	 */
	public String getRoutingKey() {
		return routingKey;
	}

	/**
	 * @return the headers for a raw payload, or null if none were given
	 */
	public Map<String, Object> getHeaders() {
		return headers;
	}

	public boolean isMandatory() {
		return mandatory;
	}

	public boolean isImmediate() {
		return immediate;
	}

	public boolean isAwaitConfirm() {
		return awaitConfirm;
	}

	/**
	 * @return how long to wait for the confirmation, or null to wait indefinitely
	 */
	public Long getTimeoutMs() {
		return timeoutMs;
	}

	public String getFormat() {
		return format;
	}

	/**
	 * @return the formatter given directly or by name, or the fallback if neither was
	 */
	public Formatter resolveFormatter(Formatter fallback) {
		if (formatter != null) {
			return formatter;
		}
		if (format != null) {
			return Formatters.lookup(format);
		}
		return fallback;
	}

	@Override
	public String toString() {
		return "PublishOptions [exchange=" + exchange + ", routingKey=" + routingKey + ", headers=" + headers
				+ ", mandatory=" + mandatory + ", immediate=" + immediate + ", awaitConfirm=" + awaitConfirm
				+ ", timeoutMs=" + timeoutMs + ", format=" + format + ", formatter=" + formatter + "]";
	}

	public static final class Builder {

		private String exchange;
		private String routingKey;
		private Map<String, Object> headers;
		private boolean mandatory = false;
		private boolean immediate = false;
		private boolean awaitConfirm = false;
		private Long timeoutMs;
		private String format;
		private Formatter formatter;

		private Builder() {
		}

		public Builder exchange(String exchange) {
			this.exchange = exchange;
			return this;
		}

		public Builder routingKey(String routingKey) {
			this.routingKey = routingKey;
			return this;
		}

		public Builder headers(Map<String, Object> headers) {
			this.headers = headers == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
			return this;
		}

		public Builder header(String name, Object value) {
			Map<String, Object> copy = headers == null ? new LinkedHashMap<String, Object>()
					: new LinkedHashMap<>(headers);
			copy.put(name, value);
			this.headers = Collections.unmodifiableMap(copy);
			return this;
		}

		public Builder mandatory(boolean mandatory) {
			this.mandatory = mandatory;
			return this;
		}

		/**
		 * RabbitMQ 3.0 and later do not support this flag and close the channel.
		 */
		public Builder immediate(boolean immediate) {
			this.immediate = immediate;
			return this;
		}

		public Builder awaitConfirm(boolean awaitConfirm) {
			this.awaitConfirm = awaitConfirm;
			return this;
		}

		/**
		 * How long to wait for the confirmation, in milliseconds. Without a
		 * timeout the wait is unbounded.
		 *
		 * @throws IllegalArgumentException if not positive
		 */
		public Builder timeoutMs(long timeoutMs) {
			if (timeoutMs <= 0) {
				throw new IllegalArgumentException("timeout must be positive: " + timeoutMs);
			}
			this.timeoutMs = timeoutMs;
			return this;
		}

		public Builder format(String format) {
			this.format = format;
			return this;
		}

		public Builder formatter(Formatter formatter) {
			this.formatter = formatter;
			return this;
		}

		/**
		 * @throws IllegalArgumentException if both a format name and a formatter were given
		 * @throws com.qfree.rabbitclient.format.UnknownFormatterException if the
		 *         format name is not registered
		 */
		public PublishOptions build() {
			if (format != null && formatter != null) {
				throw new IllegalArgumentException("Give either a format name or a formatter, not both");
			}
			if (format != null) {
				Formatters.lookup(format);
			}
			return new PublishOptions(this);
		}

	}

}
