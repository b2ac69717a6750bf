package com.qfree.rabbitclient.consume;

/**
 * Receives the events of one subscription, one at a time and in order.
 * Anything thrown is logged and the subscription carries on.
 */
@FunctionalInterface
public interface SubscriptionHandler {

	void handleEvent(SubscriptionEvent event) throws Exception;

}
