package com.qfree.rabbitclient.produce;

/**
 * Receives messages returned by the broker. Called on the RabbitMQ client's
 * connection thread, so implementations must not block or use the channel
 * synchronously.
 */
@FunctionalInterface
public interface ReturnedMessageHandler {

	void handleReturn(ReturnedMessage returnedMessage);

}
