package com.qfree.rabbitclient.produce;

import java.io.IOException;
import java.util.SortedMap;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.ConfirmListener;

/**
 * Removes publishes from the producer's "pending publisher confirms" map as
 * the broker acks or nacks them. The keys of that map are the publish
 * sequence numbers, which come back from the broker as delivery tags.
 */
public class PublisherConfirmListener implements ConfirmListener {

	private static final Logger logger = LoggerFactory.getLogger(PublisherConfirmListener.class);

	private final SortedMap<Long, String> pendingPublisherConfirms;

	private final AtomicLong ackCount = new AtomicLong();
	private final AtomicLong nackCount = new AtomicLong();

	public PublisherConfirmListener(SortedMap<Long, String> pendingPublisherConfirms) {
		this.pendingPublisherConfirms = pendingPublisherConfirms;
	}

	@Override
	public void handleAck(long deliveryTag, boolean multiple) throws IOException {
		logger.debug("deliveryTag = {}, multiple = {}", deliveryTag, multiple);
		int confirmed = settle(deliveryTag, multiple);
		ackCount.addAndGet(confirmed);
	}

	@Override
	public void handleNack(long deliveryTag, boolean multiple) throws IOException {
		logger.warn("deliveryTag = {}, multiple = {}", deliveryTag, multiple);
		int rejected = settle(deliveryTag, multiple);
		nackCount.addAndGet(rejected);
	}

	/**
	 * @return the number of publishes confirmed by the broker so far
	 */
	public long getAckCount() {
		return ackCount.get();
	}

	/**
	 * @return the number of publishes the broker has nacked so far
	 */
	public long getNackCount() {
		return nackCount.get();
	}

	private int settle(long deliveryTag, boolean multiple) {
		/*
		 * Iterating over, or clearing, a headMap view must be synchronized on
		 * the underlying map, not on the view, or a
		 * ConcurrentModificationException is thrown when the producer
		 * publishes at the same time.
		 */
		synchronized (pendingPublisherConfirms) {
			if (multiple) {
				SortedMap<Long, String> confirmedMessages = pendingPublisherConfirms.headMap(deliveryTag + 1);
				int count = confirmedMessages.size();
				logger.debug("Settling {} publishes up to sequence number {}", count, deliveryTag);
				confirmedMessages.clear();
				return count;
			} else {
				String publish = pendingPublisherConfirms.remove(deliveryTag);
				if (publish == null) {
					logger.debug("No pending publish for sequence number {}", deliveryTag);
					return 0;
				}
				logger.debug("Settled publish {}: {}", deliveryTag, publish);
				return 1;
			}
		}
	}

}
