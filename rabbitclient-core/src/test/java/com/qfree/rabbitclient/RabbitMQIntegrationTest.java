package com.qfree.rabbitclient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.RabbitMQContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import com.qfree.rabbitclient.channel.BrokerException;
import com.qfree.rabbitclient.channel.ChannelMode;
import com.qfree.rabbitclient.channel.ConfirmResult;
import com.qfree.rabbitclient.channel.NotInConfirmModeException;
import com.qfree.rabbitclient.connection.ConnectionOptions;
import com.qfree.rabbitclient.consume.GetOptions;
import com.qfree.rabbitclient.consume.RabbitMQConsumer;
import com.qfree.rabbitclient.consume.SubscribeOptions;
import com.qfree.rabbitclient.consume.SubscriptionEvent;
import com.qfree.rabbitclient.produce.PublishOptions;
import com.qfree.rabbitclient.produce.RabbitMQProducer;
import com.qfree.rabbitclient.produce.ReturnedMessage;
import com.qfree.rabbitclient.topology.EndpointOptions;
import com.qfree.rabbitclient.topology.ExchangeDeclaration;
import com.qfree.rabbitclient.topology.QueueDeclaration;

/**
 * Runs producers and consumers against a real broker. Skipped when Docker is
 * not available.
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("Against a RabbitMQ broker")
class RabbitMQIntegrationTest {

	private static final long WAIT_SECONDS = 5;

	@Container
	private static final RabbitMQContainer rabbit = new RabbitMQContainer(
			DockerImageName.parse("rabbitmq:3.13-management"));

	private final List<RabbitMQProducer> producers = new ArrayList<>();
	private final List<RabbitMQConsumer> consumers = new ArrayList<>();

	@AfterEach
	void shutdown() throws Exception {
		for (RabbitMQConsumer consumer : consumers) {
			consumer.shutdown();
		}
		for (RabbitMQProducer producer : producers) {
			producer.shutdown();
		}
	}

	private static EndpointOptions.Builder endpoint() {
		return EndpointOptions.builder().connectionOptions(ConnectionOptions.builder()
				.uri(rabbit.getAmqpUrl())
				.username(rabbit.getAdminUsername())
				.password(rabbit.getAdminPassword())
				.connectionName("rabbitclient-it")
				.build());
	}

	private RabbitMQProducer producer(EndpointOptions options) throws Exception {
		RabbitMQProducer producer = RabbitMQProducer.create(options);
		producers.add(producer);
		return producer;
	}

	private RabbitMQConsumer consumer(EndpointOptions options) throws Exception {
		RabbitMQConsumer consumer = RabbitMQConsumer.create(options);
		consumers.add(consumer);
		return consumer;
	}

	private static QueueDeclaration temporaryQueue(String name) {
		return QueueDeclaration.declare(name).autoDelete(true);
	}

	private static String text(Object body) {
		return new String((byte[]) body, StandardCharsets.UTF_8);
	}

	@Test
	@DisplayName("Should deliver messages to a subscriber in publish order")
	void basicSendReceive() throws Exception {
		BlockingQueue<String> received = new LinkedBlockingQueue<>();
		RabbitMQConsumer consumer = consumer(endpoint().queue(temporaryQueue("basic_test")).build());
		consumer.subscribe(event -> {
			if (event.getType() == SubscriptionEvent.Type.MESSAGE) {
				received.add(text(event.getBody()));
			}
		});

		RabbitMQProducer producer = producer(endpoint().queue("basic_test").build());
		producer.publish("hello");
		producer.publish("world");

		assertThat(received.poll(WAIT_SECONDS, TimeUnit.SECONDS)).isEqualTo("hello");
		assertThat(received.poll(WAIT_SECONDS, TimeUnit.SECONDS)).isEqualTo("world");
		assertThat(consumer.unsubscribe()).isTrue();
	}

	@Test
	@DisplayName("Should copy a fanout message to every bound queue")
	void fanout() throws Exception {
		ExchangeDeclaration exchange = ExchangeDeclaration.declare("fanout_test", "fanout").autoDelete(true);
		BlockingQueue<String> first = new LinkedBlockingQueue<>();
		BlockingQueue<String> second = new LinkedBlockingQueue<>();
		consumer(endpoint().exchange(exchange).newQueue("").build()).subscribe(event -> {
			if (event.getType() == SubscriptionEvent.Type.MESSAGE) {
				first.add(text(event.getBody()));
			}
		});
		consumer(endpoint().exchange(exchange).newQueue("").build()).subscribe(event -> {
			if (event.getType() == SubscriptionEvent.Type.MESSAGE) {
				second.add(text(event.getBody()));
			}
		});

		producer(endpoint().exchange("fanout_test").build()).publish("hi");

		assertThat(first.poll(WAIT_SECONDS, TimeUnit.SECONDS)).isEqualTo("hi");
		assertThat(second.poll(WAIT_SECONDS, TimeUnit.SECONDS)).isEqualTo("hi");
		assertThat(first.poll(200, TimeUnit.MILLISECONDS)).isNull();
		assertThat(second.poll(200, TimeUnit.MILLISECONDS)).isNull();
	}

	@Test
	@DisplayName("Should route by binding key on a direct exchange")
	void directRouting() throws Exception {
		ExchangeDeclaration exchange = ExchangeDeclaration.declare("direct_test", "direct").autoDelete(true);
		RabbitMQConsumer black = consumer(endpoint().exchange(exchange).newQueue("").bindingKey("black")
				.format("text").build());
		RabbitMQConsumer red = consumer(endpoint().exchange(exchange).newQueue("").bindingKey("red")
				.format("text").build());

		RabbitMQProducer producer = producer(endpoint().exchange("direct_test").build());
		producer.publish("night", PublishOptions.builder().routingKey("black").build());
		producer.publish("sun", PublishOptions.builder().routingKey("red").build());
		producer.publish("ash", PublishOptions.builder().routingKey("black").build());
		producer.publish("x", PublishOptions.builder().routingKey("green").build());

		Thread.sleep(200);
		assertThat(black.getBody()).contains("night");
		assertThat(black.getBody()).contains("ash");
		assertThat(black.getBody()).isEmpty();
		assertThat(red.getBody()).contains("sun");
		assertThat(red.getBody()).isEmpty();
	}

	@Test
	@DisplayName("Should return a, b, c and then nothing")
	void getBodyInOrder() throws Exception {
		RabbitMQConsumer consumer = consumer(endpoint().queue(temporaryQueue("abc_test")).format("text").build());
		RabbitMQProducer producer = producer(endpoint().queue("abc_test").build());

		producer.publishAll(Arrays.asList("a", "b", "c"));
		Thread.sleep(200);

		assertThat(consumer.getBody()).contains("a");
		assertThat(consumer.getBody()).contains("b");
		assertThat(consumer.getBody()).contains("c");
		assertThat(consumer.getBody()).isEmpty();
	}

	@Test
	@DisplayName("Should redeliver nacked messages and not acked ones")
	void subscribeWithAck() throws Exception {
		RabbitMQConsumer consumer = consumer(endpoint().queue(temporaryQueue("ack_test")).format("text").build());
		BlockingQueue<SubscriptionEvent> received = new LinkedBlockingQueue<>();
		consumer.subscribe(event -> {
			if (event.getType() == SubscriptionEvent.Type.MESSAGE) {
				received.add(event);
			}
		}, SubscribeOptions.builder().noAck(false).build());

		RabbitMQProducer producer = producer(endpoint().queue("ack_test").build());
		producer.publish("keep");
		SubscriptionEvent first = received.poll(WAIT_SECONDS, TimeUnit.SECONDS);
		assertThat(first.getBody()).isEqualTo("keep");
		first.getMsgAck().nack();

		SubscriptionEvent redelivered = received.poll(WAIT_SECONDS, TimeUnit.SECONDS);
		assertThat(redelivered.getBody()).isEqualTo("keep");
		redelivered.getMsgAck().ack();

		assertThat(received.poll(500, TimeUnit.MILLISECONDS)).isNull();
		assertThat(consumer.getPendingAckCount()).isZero();
	}

	@Test
	@DisplayName("Should not redeliver a fetched message once acked")
	void getWithAck() throws Exception {
		RabbitMQConsumer consumer = consumer(endpoint().queue(temporaryQueue("get_ack_test")).build());
		producer(endpoint().queue("get_ack_test").build()).publish("hi");
		Thread.sleep(200);

		RabbitMQMessage message = consumer.get(GetOptions.noAck(false)).get();
		consumer.nack(message);
		message = consumer.get(GetOptions.noAck(false)).get();
		assertThat(message.isRedelivered()).isTrue();
		consumer.ack(message);

		assertThat(consumer.get()).isEmpty();
	}

	@Test
	@DisplayName("Should confirm publishes only in confirm mode")
	void publishWithConfirm() throws Exception {
		RabbitMQConsumer consumer = consumer(endpoint().queue(temporaryQueue("confirm_test")).format("text")
				.build());
		RabbitMQProducer producer = producer(endpoint().queue("confirm_test").build());
		PublishOptions awaitConfirm = PublishOptions.builder().awaitConfirm(true).timeoutMs(1000).build();

		assertThatThrownBy(() -> producer.publish("hi", awaitConfirm))
				.isInstanceOf(NotInConfirmModeException.class);
		assertThat(producer.getChannel().queuePurge("confirm_test")).isBetween(0, 1);

		producer.setMode(ChannelMode.CONFIRM);
		assertThat(producer.publish("hi", awaitConfirm)).isEqualTo(ConfirmResult.OK);
		producer.publish("1");
		producer.publish("2");
		producer.publish("3");
		assertThat(producer.awaitConfirms(1000)).isEqualTo(ConfirmResult.OK);
		assertThat(producer.getUnconfirmedCount()).isZero();

		assertThat(consumer.getBody()).contains("hi");
		assertThat(consumer.getBody()).contains("1");
		assertThat(consumer.getBody()).contains("2");
		assertThat(consumer.getBody()).contains("3");
	}

	@Test
	@DisplayName("Should report PRECONDITION_FAILED when deleting a queue that is not empty")
	void deleteQueueInUse() throws Exception {
		RabbitMQProducer producer = producer(endpoint().queue(temporaryQueue("delete_queue_test")).build());
		producer.publish("hello");
		Thread.sleep(200);
		RabbitMQConsumer consumer = consumer(endpoint().queue("delete_queue_test").build());

		assertThatThrownBy(() -> consumer.getChannel().queueDelete("delete_queue_test", false, true))
				.isInstanceOfSatisfying(BrokerException.class, e -> {
					assertThat(e.getReplyCode()).isEqualTo(406);
					assertThat(e.getReplyText()).startsWith("PRECONDITION_FAILED");
				});
		assertThat(consumer.getChannel().isOpen()).isFalse();
	}

	@Test
	@DisplayName("Should publish on commit and discard on rollback")
	void transaction() throws Exception {
		RabbitMQConsumer consumer = consumer(endpoint().queue(temporaryQueue("tx_test")).format("text").build());
		RabbitMQProducer producer = producer(endpoint().queue("tx_test").build());

		producer.setMode(ChannelMode.TX);
		producer.publish("hi");
		producer.publish("1");
		assertThat(consumer.getBody()).isEmpty();
		producer.commit();
		Thread.sleep(200);

		producer.publish("donut");
		producer.rollback();

		assertThat(consumer.getBody()).contains("hi");
		assertThat(consumer.getBody()).contains("1");
		assertThat(consumer.getBody()).isEmpty();
	}

	@Test
	@DisplayName("Should return an unroutable mandatory message")
	void returnedMessage() throws Exception {
		BlockingQueue<ReturnedMessage> returned = new LinkedBlockingQueue<>();
		RabbitMQProducer producer = producer(endpoint().exchange("amq.direct").build());
		producer.setReturnHandler(returned::add);

		assertThat(producer.publish("hi", PublishOptions.builder()
				.routingKey("unroutable")
				.mandatory(true)
				.build())).isEqualTo(ConfirmResult.OK);

		ReturnedMessage message = returned.poll(WAIT_SECONDS, TimeUnit.SECONDS);
		assertThat(message.getReplyText()).isEqualTo("NO_ROUTE");
		assertThat(message.getRoutingKey()).isEqualTo("unroutable");
		assertThat(text(message.getMessage().getBody())).isEqualTo("hi");
	}

	@Test
	@DisplayName("Should requeue unacknowledged messages on recover")
	void recover() throws Exception {
		RabbitMQConsumer consumer = consumer(endpoint().queue(temporaryQueue("recover_test")).format("text")
				.build());
		producer(endpoint().queue("recover_test").build()).publish("again");
		Thread.sleep(200);

		assertThat(consumer.getBody(GetOptions.noAck(false))).contains("again");
		consumer.recover(true);
		Thread.sleep(200);

		assertThat(consumer.getBody()).contains("again");
		assertThat(consumer.getBody()).isEmpty();
	}

}
