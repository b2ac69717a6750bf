package com.qfree.rabbitclient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.qfree.rabbitclient.channel.RabbitMQChannel;
import com.rabbitmq.client.Channel;

@ExtendWith(MockitoExtension.class)
@DisplayName("Acknowledgement handle")
class RabbitMQMsgAckTest {

	@Mock
	private Channel channel;

	private RabbitMQChannel rabbitMQChannel;

	private final Map<Long, RabbitMQMsgAck> pending = new ConcurrentHashMap<>();

	@BeforeEach
	void setUp() {
		rabbitMQChannel = new RabbitMQChannel(channel);
	}

	@Test
	@DisplayName("Should register itself as pending until settled")
	void pendingUntilSettled() throws Exception {
		RabbitMQMsgAck msgAck = new RabbitMQMsgAck(rabbitMQChannel, "ctag", 11, true, pending);
		assertThat(pending).containsKey(11L);

		msgAck.ack();

		assertThat(pending).isEmpty();
		assertThat(msgAck.isSettled()).isTrue();
		assertThat(msgAck.isRejected()).isFalse();
		verify(channel).basicAck(11, false);
	}

	@Test
	@DisplayName("Should settle at most once")
	void settleOnce() throws Exception {
		RabbitMQMsgAck msgAck = new RabbitMQMsgAck(rabbitMQChannel, "ctag", 12, true, pending);
		msgAck.nack(false);

		assertThatThrownBy(msgAck::ack).isInstanceOf(IllegalStateException.class);
		assertThatThrownBy(msgAck::nack).isInstanceOf(IllegalStateException.class);
		assertThat(msgAck.isRejected()).isTrue();
		assertThat(msgAck.isRequeueRejectedMsg()).isFalse();
		verify(channel).basicNack(12, false, false);
	}

	@Test
	@DisplayName("Should refuse to settle a delivery made without acks")
	void noAckDelivery() throws Exception {
		RabbitMQMsgAck msgAck = new RabbitMQMsgAck(rabbitMQChannel, "ctag", 13, false, pending);

		assertThat(pending).isEmpty();
		assertThatThrownBy(msgAck::ack).isInstanceOf(IllegalStateException.class);
		verify(channel, never()).basicAck(anyLong(), anyBoolean());
	}

	@Test
	@DisplayName("Should no longer settle a forgotten delivery")
	void forgotten() throws Exception {
		RabbitMQMsgAck msgAck = new RabbitMQMsgAck(rabbitMQChannel, "ctag", 15, true, pending);

		msgAck.forget();

		assertThat(msgAck.isSettled()).isTrue();
		assertThatThrownBy(msgAck::ack).isInstanceOf(IllegalStateException.class);
		assertThatThrownBy(() -> msgAck.nack(false)).isInstanceOf(IllegalStateException.class);
		verify(channel, never()).basicAck(anyLong(), anyBoolean());
		verify(channel, never()).basicNack(anyLong(), anyBoolean(), anyBoolean());
	}

	@Test
	@DisplayName("Should requeue by default when nacked")
	void nackRequeues() throws Exception {
		RabbitMQMsgAck msgAck = new RabbitMQMsgAck(rabbitMQChannel, null, 14, true, pending);

		msgAck.nack();

		verify(channel).basicNack(14, false, true);
		assertThat(msgAck.isRequeueRejectedMsg()).isTrue();
	}

}
