package com.qfree.rabbitclient.consume;

import java.util.concurrent.BlockingQueue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands the events of one subscription to its handler, one at a time, until
 * the END event has been handled.
 */
class SubscriptionDispatcher implements Runnable {

	private static final Logger logger = LoggerFactory.getLogger(SubscriptionDispatcher.class);

	private final BlockingQueue<SubscriptionEvent> events;
	private final SubscriptionHandler handler;
	private final Subscription subscription;

	SubscriptionDispatcher(BlockingQueue<SubscriptionEvent> events, SubscriptionHandler handler,
			Subscription subscription) {
		this.events = events;
		this.handler = handler;
		this.subscription = subscription;
	}

	@Override
	public void run() {

		subscription.dispatcherStarted(Thread.currentThread());
		logger.info("Starting subscription dispatcher");

		try {
			while (true) {

				SubscriptionEvent event;
				try {
					event = events.take();
				} catch (InterruptedException e) {
					logger.warn("Interrupted before the subscription ended. This dispatcher will terminate.");
					Thread.currentThread().interrupt();
					break;
				}

				try {
					handler.handleEvent(event);
				} catch (Throwable e) {
					/*
					 * Log the exception, but do not let it stop the dispatcher:
					 * the remaining events, END in particular, must still be
					 * delivered.
					 */
					logger.error("Exception thrown by subscription handler for event {}", event, e);
				}

				if (event.getType() == SubscriptionEvent.Type.END) {
					break;
				}
			}
		} finally {
			subscription.dispatcherTerminated();
			logger.info("Subscription dispatcher for {} exiting", subscription.getConsumerTag());
		}

	}

}
