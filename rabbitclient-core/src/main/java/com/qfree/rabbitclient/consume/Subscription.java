package com.qfree.rabbitclient.consume;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * A live {@code basic.consume} on one queue and the dispatcher that feeds its
 * events to the handler.
 */
public class Subscription {

	private final SubscriptionConsumer consumer;
	private final CountDownLatch terminated = new CountDownLatch(1);

	private volatile String consumerTag;
	private volatile Thread dispatcherThread;

	Subscription(SubscriptionConsumer consumer) {
		this.consumer = consumer;
	}

	/**
	 * @return the tag the broker assigned to this subscription
	 */
	public String getConsumerTag() {
		return consumerTag;
	}

	void setConsumerTag(String consumerTag) {
		this.consumerTag = consumerTag;
	}

	/**
	 * @return false once the END event has been handled and the dispatcher
	 *         has stopped
	 */
	public boolean isActive() {
		return terminated.getCount() > 0;
	}

	/**
	 * Waits for the dispatcher to handle the END event and stop.
	 *
	 * @return true if it stopped, false if the timeout elapsed first
	 */
	public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
		return terminated.await(timeout, unit);
	}

	/*
	 * True once the broker has cancelled the subscription (on request or on
	 * its own) or the channel has gone away.
	 */
	boolean isEnded() {
		return consumer.isEnded();
	}

	boolean isDispatcherThread(Thread thread) {
		return thread == dispatcherThread;
	}

	void dispatcherStarted(Thread thread) {
		this.dispatcherThread = thread;
	}

	void dispatcherTerminated() {
		this.dispatcherThread = null;
		terminated.countDown();
	}

	@Override
	public String toString() {
		return "Subscription [consumerTag=" + consumerTag + ", active=" + isActive() + "]";
	}

}
