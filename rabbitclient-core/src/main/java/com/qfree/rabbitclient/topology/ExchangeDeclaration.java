package com.qfree.rabbitclient.topology;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import com.rabbitmq.client.BuiltinExchangeType;

/**
 * Which exchange an endpoint talks to, and whether it has to be declared
 * first. {@code ""} is the broker's default (direct) exchange, which always
 * exists and is never declared.
 * <p>
 * Instances are immutable; the attribute setters return copies.
 */
public final class ExchangeDeclaration {

	public static final String DEFAULT_EXCHANGE = "";

	private static final ExchangeDeclaration DEFAULT = new ExchangeDeclaration(DEFAULT_EXCHANGE, null, false,
			false, false, Collections.<String, Object> emptyMap());

	private final String name;
	/*
	 * Null for an exchange that already exists and is used as it is.
	 */
	private final String type;
	private final boolean durable;
	private final boolean autoDelete;
	private final boolean internal;
	private final Map<String, Object> arguments;

	private ExchangeDeclaration(String name, String type, boolean durable, boolean autoDelete, boolean internal,
			Map<String, Object> arguments) {
		this.name = name;
		this.type = type;
		this.durable = durable;
		this.autoDelete = autoDelete;
		this.internal = internal;
		this.arguments = arguments;
	}

	/**
	 * The default exchange.
	 */
	public static ExchangeDeclaration defaultExchange() {
		return DEFAULT;
	}

	/**
	 * An exchange that is expected to exist already.
	 */
	public static ExchangeDeclaration existing(String name) {
		if (name == null) {
			throw new IllegalArgumentException("Exchange name must not be null");
		}
		if (name.isEmpty()) {
			return DEFAULT;
		}
		return new ExchangeDeclaration(name, null, false, false, false, Collections.<String, Object> emptyMap());
	}

	/**
	 * An exchange to declare, for example {@code declare("logs", "fanout")}.
	 * Declaring is idempotent on the broker as long as the attributes match.
	 */
	public static ExchangeDeclaration declare(String name, String type) {
		if (name == null || name.isEmpty()) {
			throw new IllegalArgumentException("The default exchange cannot be declared");
		}
		if (type == null || type.trim().isEmpty()) {
			throw new IllegalArgumentException("Exchange type must not be empty");
		}
		return new ExchangeDeclaration(name, type.trim(), false, false, false,
				Collections.<String, Object> emptyMap());
	}

	public static ExchangeDeclaration declare(String name, BuiltinExchangeType type) {
		return declare(name, type.getType());
	}

	public ExchangeDeclaration durable(boolean durable) {
		checkDeclared("durable");
		return new ExchangeDeclaration(name, type, durable, autoDelete, internal, arguments);
	}

	public ExchangeDeclaration autoDelete(boolean autoDelete) {
		checkDeclared("autoDelete");
		return new ExchangeDeclaration(name, type, durable, autoDelete, internal, arguments);
	}

	public ExchangeDeclaration internal(boolean internal) {
		checkDeclared("internal");
		return new ExchangeDeclaration(name, type, durable, autoDelete, internal, arguments);
	}

	public ExchangeDeclaration arguments(Map<String, Object> arguments) {
		checkDeclared("arguments");
		Map<String, Object> copy = arguments == null ? Collections.<String, Object> emptyMap()
				: Collections.unmodifiableMap(new HashMap<>(arguments));
		return new ExchangeDeclaration(name, type, durable, autoDelete, internal, copy);
	}

	public String getName() {
		return name;
	}

	/**
	 * @return the exchange type, or null if the exchange is not declared
	 */
	public String getType() {
		return type;
	}

	public boolean isDeclared() {
		return type != null;
	}

	public boolean isDefault() {
		return name.isEmpty();
	}

	public boolean isDurable() {
		return durable;
	}

	public boolean isAutoDelete() {
		return autoDelete;
	}

	public boolean isInternal() {
		return internal;
	}

	public Map<String, Object> getArguments() {
		return arguments;
	}

	private void checkDeclared(String attribute) {
		if (!isDeclared()) {
			throw new IllegalArgumentException("Cannot set " + attribute + " on exchange \"" + name
					+ "\", which is not declared");
		}
	}

	@Override
	public String toString() {
		return "ExchangeDeclaration [name=" + name + ", type=" + type + ", durable=" + durable
				+ ", autoDelete=" + autoDelete + ", internal=" + internal + ", arguments=" + arguments + "]";
	}

}
