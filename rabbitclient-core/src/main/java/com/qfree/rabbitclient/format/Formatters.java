package com.qfree.rabbitclient.format;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of formatters by name. Names are case-insensitive.
 * <p>
 * {@code "json"} and {@code "text"} are always available. Other formatters,
 * protobuf ones in particular, are registered by the application at start-up.
 */
public final class Formatters {

	private static final Logger logger = LoggerFactory.getLogger(Formatters.class);

	public static final String JSON = "json";
	public static final String TEXT = "text";

	private static final Map<String, Formatter> registry = new ConcurrentHashMap<>();

	static {
		registry.put(JSON, new JsonFormatter());
		registry.put(TEXT, new TextFormatter());
	}

	private Formatters() {
	}

	/**
	 * @throws UnknownFormatterException if nothing is registered under the name
	 */
	public static Formatter lookup(String name) {
		if (name == null) {
			throw new UnknownFormatterException(null);
		}
		Formatter formatter = registry.get(normalize(name));
		if (formatter == null) {
			throw new UnknownFormatterException(name);
		}
		return formatter;
	}

	/**
	 * Registers a formatter, replacing any previously registered under the same name.
	 */
	public static void register(String name, Formatter formatter) {
		if (name == null || name.trim().isEmpty()) {
			throw new IllegalArgumentException("Formatter name must not be empty");
		}
		if (formatter == null) {
			throw new IllegalArgumentException("formatter must not be null");
		}
		Formatter previous = registry.put(normalize(name), formatter);
		if (previous != null && previous != formatter) {
			logger.info("Formatter \"{}\" replaced: {} -> {}", name, previous.getClass().getName(),
					formatter.getClass().getName());
		}
	}

	public static boolean isRegistered(String name) {
		return name != null && registry.containsKey(normalize(name));
	}

	public static Set<String> names() {
		return new TreeSet<>(registry.keySet());
	}

	private static String normalize(String name) {
		return name.trim().toLowerCase(Locale.ROOT);
	}

}
