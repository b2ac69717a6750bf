package com.qfree.rabbitclient.topology;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Which queue an endpoint uses, and whether it has to be declared first.
 * A declared queue with the name {@code ""} is named by the broker.
 * <p>
 * Instances are immutable; the attribute setters return copies.
 */
public final class QueueDeclaration {

	private final String name;
	private final boolean declared;
	private final boolean durable;
	private final boolean exclusive;
	private final boolean autoDelete;
	private final Map<String, Object> arguments;

	private QueueDeclaration(String name, boolean declared, boolean durable, boolean exclusive,
			boolean autoDelete, Map<String, Object> arguments) {
		this.name = name;
		this.declared = declared;
		this.durable = durable;
		this.exclusive = exclusive;
		this.autoDelete = autoDelete;
		this.arguments = arguments;
	}

	/**
	 * A queue that is expected to exist already.
	 */
	public static QueueDeclaration existing(String name) {
		if (name == null || name.isEmpty()) {
			throw new IllegalArgumentException("An existing queue needs a name");
		}
		return new QueueDeclaration(name, false, false, false, false, Collections.<String, Object> emptyMap());
	}

	/**
	 * A non-exclusive, non-durable queue to declare. Use {@code ""} to let the
	 * broker pick the name.
	 */
	public static QueueDeclaration declare(String name) {
		if (name == null) {
			throw new IllegalArgumentException("Queue name must not be null");
		}
		return new QueueDeclaration(name, true, false, false, false, Collections.<String, Object> emptyMap());
	}

	/**
	 * An exclusive queue owned by the declaring connection and deleted with it.
	 * Use {@code ""} to let the broker pick the name.
	 */
	public static QueueDeclaration newExclusive(String name) {
		return declare(name).exclusive(true);
	}

	public QueueDeclaration durable(boolean durable) {
		checkDeclared("durable");
		return new QueueDeclaration(name, declared, durable, exclusive, autoDelete, arguments);
	}

	public QueueDeclaration exclusive(boolean exclusive) {
		checkDeclared("exclusive");
		return new QueueDeclaration(name, declared, durable, exclusive, autoDelete, arguments);
	}

	public QueueDeclaration autoDelete(boolean autoDelete) {
		checkDeclared("autoDelete");
		return new QueueDeclaration(name, declared, durable, exclusive, autoDelete, arguments);
	}

	public QueueDeclaration arguments(Map<String, Object> arguments) {
		checkDeclared("arguments");
		Map<String, Object> copy = arguments == null ? Collections.<String, Object> emptyMap()
				: Collections.unmodifiableMap(new HashMap<>(arguments));
		return new QueueDeclaration(name, declared, durable, exclusive, autoDelete, copy);
	}

	public String getName() {
		return name;
	}

	public boolean isDeclared() {
		return declared;
	}

	public boolean isServerNamed() {
		return declared && name.isEmpty();
	}

	public boolean isDurable() {
		return durable;
	}

	public boolean isExclusive() {
		return exclusive;
	}

	public boolean isAutoDelete() {
		return autoDelete;
	}

	public Map<String, Object> getArguments() {
		return arguments;
	}

	private void checkDeclared(String attribute) {
		if (!declared) {
			throw new IllegalArgumentException("Cannot set " + attribute + " on queue \"" + name
					+ "\", which is not declared");
		}
	}

	@Override
	public String toString() {
		return "QueueDeclaration [name=" + name + ", declared=" + declared + ", durable=" + durable
				+ ", exclusive=" + exclusive + ", autoDelete=" + autoDelete + ", arguments=" + arguments + "]";
	}

}
