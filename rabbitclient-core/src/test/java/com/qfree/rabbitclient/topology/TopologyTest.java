package com.qfree.rabbitclient.topology;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.Collections;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.qfree.rabbitclient.channel.RabbitMQChannel;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;

@ExtendWith(MockitoExtension.class)
@DisplayName("Topology resolution")
class TopologyTest {

	@Mock
	private Channel channel;

	private RabbitMQChannel rabbitMQChannel;

	@BeforeEach
	void setUp() {
		rabbitMQChannel = new RabbitMQChannel(channel);
	}

	private void brokerNamesQueue(String requested, String assigned) throws Exception {
		AMQP.Queue.DeclareOk declareOk = mock(AMQP.Queue.DeclareOk.class);
		when(declareOk.getQueue()).thenReturn(assigned);
		when(channel.queueDeclare(requested, false, true, false, Collections.<String, Object> emptyMap()))
				.thenReturn(declareOk);
	}

	@Test
	@DisplayName("Should use the queue name as routing key on the default exchange")
	void existingQueueOnDefaultExchange() throws Exception {
		ResolvedTopology topology = Topology.resolve(rabbitMQChannel,
				EndpointOptions.builder().queue("orders").build());

		assertThat(topology.getExchange()).isEmpty();
		assertThat(topology.getQueue()).isEqualTo("orders");
		assertThat(topology.getRoutingKey()).isEqualTo("orders");
		verifyNoInteractions(channel);
	}

	@Test
	@DisplayName("Should use an empty routing key with neither queue nor binding key")
	void exchangeOnly() throws Exception {
		ResolvedTopology topology = Topology.resolve(rabbitMQChannel,
				EndpointOptions.builder().exchange("amq.fanout").build());

		assertThat(topology.getQueue()).isNull();
		assertThat(topology.getRoutingKey()).isEmpty();
	}

	@Test
	@DisplayName("Should declare the exchange and bind a broker-named queue with the binding key")
	void declareAndBind() throws Exception {
		brokerNamesQueue("", "amq.gen-123");

		ResolvedTopology topology = Topology.resolve(rabbitMQChannel, EndpointOptions.builder()
				.exchange(ExchangeDeclaration.declare("colors", "direct"))
				.newQueue("")
				.bindingKey("black")
				.build());

		verify(channel).exchangeDeclare("colors", "direct", false, false, false,
				Collections.<String, Object> emptyMap());
		verify(channel).queueBind("amq.gen-123", "colors", "black");
		assertThat(topology.getQueue()).isEqualTo("amq.gen-123");
		assertThat(topology.getRoutingKey()).isEqualTo("black");
	}

	@Test
	@DisplayName("Should bind with the queue name when there is no binding key")
	void bindWithQueueName() throws Exception {
		brokerNamesQueue("logs-1", "logs-1");

		ResolvedTopology topology = Topology.resolve(rabbitMQChannel, EndpointOptions.builder()
				.exchange(ExchangeDeclaration.declare("logs", "fanout").durable(true))
				.newQueue("logs-1")
				.build());

		verify(channel).exchangeDeclare("logs", "fanout", true, false, false,
				Collections.<String, Object> emptyMap());
		verify(channel).queueBind("logs-1", "logs", "logs-1");
		assertThat(topology.getRoutingKey()).isEqualTo("logs-1");
	}

	@Test
	@DisplayName("Should never bind to the default exchange")
	void noBindingToDefaultExchange() throws Exception {
		brokerNamesQueue("", "amq.gen-9");

		Topology.resolve(rabbitMQChannel, EndpointOptions.builder().newQueue("").bindingKey("k").build());

		verify(channel, never()).queueBind(anyString(), anyString(), anyString());
	}

}
