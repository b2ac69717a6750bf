package com.qfree.rabbitclient.topology;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.qfree.rabbitclient.channel.RabbitMQChannel;

/**
 * Declares what an endpoint asks for and works out its default routing key.
 */
public final class Topology {

	private static final Logger logger = LoggerFactory.getLogger(Topology.class);

	private Topology() {
	}

	/**
	 * Declares the exchange and queue when asked to, binds the queue to the
	 * exchange when there are both and the exchange is not the default one,
	 * and picks the default routing key: the binding key, else the queue
	 * name, else {@code ""}.
	 * <p>
	 * The queue is bound with the binding key, or with its own name when there
	 * is none, so that the default routing key reaches it.
	 */
	public static ResolvedTopology resolve(RabbitMQChannel channel, EndpointOptions options) throws IOException {

		ExchangeDeclaration exchange = options.getExchange();
		if (exchange.isDeclared()) {
			logger.debug("Declaring exchange \"{}\" of type {}", exchange.getName(), exchange.getType());
			channel.exchangeDeclare(exchange.getName(), exchange.getType(), exchange.isDurable(),
					exchange.isAutoDelete(), exchange.isInternal(), exchange.getArguments());
		}

		String queueName = null;
		QueueDeclaration queue = options.getQueue();
		if (queue != null) {
			if (queue.isDeclared()) {
				queueName = channel.queueDeclare(queue.getName(), queue.isDurable(), queue.isExclusive(),
						queue.isAutoDelete(), queue.getArguments());
				logger.debug("Declared queue \"{}\"", queueName);
			} else {
				queueName = queue.getName();
			}
		}

		String bindingKey = options.getBindingKey();

		if (queueName != null && !exchange.isDefault()) {
			String key = bindingKey != null ? bindingKey : queueName;
			logger.debug("Binding queue \"{}\" to exchange \"{}\" with key \"{}\"", queueName, exchange.getName(),
					key);
			channel.queueBind(queueName, exchange.getName(), key);
		}

		String routingKey;
		if (bindingKey != null) {
			routingKey = bindingKey;
		} else if (queueName != null) {
			routingKey = queueName;
		} else {
			routingKey = "";
		}

		return new ResolvedTopology(exchange.getName(), queueName, routingKey);
	}

}
