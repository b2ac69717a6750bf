package com.qfree.rabbitclient.thread;

import java.lang.Thread.UncaughtExceptionHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/*
 * Installed on every subscription dispatcher thread that this library creates
 * itself. Anything that escapes the dispatcher loop ends up here so that it is
 * at least logged before the thread dies.
 */
public class DefaultUncaughtExceptionHandler implements UncaughtExceptionHandler {

	private static final Logger logger = LoggerFactory.getLogger(DefaultUncaughtExceptionHandler.class);

	@Override
	public void uncaughtException(Thread t, Throwable e) {
		logger.error("An uncaught exception was thrown for thread {}:", t.getName());
		logger.error("The uncaught exception was:", e);
	}

}
