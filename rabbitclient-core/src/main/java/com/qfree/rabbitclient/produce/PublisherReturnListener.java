package com.qfree.rabbitclient.produce;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.qfree.rabbitclient.RabbitMQMessage;
import com.rabbitmq.client.AMQP.BasicProperties;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ReturnListener;

/**
 * Triggered by the broker for failed deliveries when either the "immediate"
 * or "mandatory" flag was set but could not be honoured. Every return is
 * logged; it is then passed on to the producer's handler, if one is set.
 */
public class PublisherReturnListener implements ReturnListener {

	private static final Logger logger = LoggerFactory.getLogger(PublisherReturnListener.class);

	private volatile ReturnedMessageHandler handler;

	public PublisherReturnListener() {
	}

	public ReturnedMessageHandler getHandler() {
		return handler;
	}

	public void setHandler(ReturnedMessageHandler handler) {
		this.handler = handler;
	}

	@Override
	public void handleReturn(int replyCode, String replyText, String exchange, String routingKey,
			BasicProperties properties, byte[] body) throws IOException {

		logger.warn("A message has been returned by the broker because either the \"immediate\" flag"
				+ " or the \"mandatory\" flag was set and the broker could not satisfy this constraint:"
				+ "\nreplyCode = {}"
				+ "\nreplyText = {}"
				+ "\nexchange = {}"
				+ "\nroutingKey = {}"
				+ "\nmessage = {} bytes",
				replyCode, replyText, exchange, routingKey, body.length);

		ReturnedMessageHandler currentHandler = handler;
		if (currentHandler == null) {
			return;
		}

		/*
		 * A returned message was never delivered, so it has no delivery tag.
		 */
		RabbitMQMessage message = RabbitMQMessage.fromDelivery(null,
				new Envelope(0L, false, exchange, routingKey), properties, body);
		try {
			currentHandler.handleReturn(new ReturnedMessage(replyCode, replyText, exchange, routingKey, message));
		} catch (Throwable e) {
			/*
			 * Anything thrown here would end up in the RabbitMQ client's
			 * exception handler, which closes the channel.
			 */
			logger.error("Exception thrown by the returned message handler", e);
		}
	}

}
