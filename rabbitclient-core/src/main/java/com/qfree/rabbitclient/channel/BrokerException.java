package com.qfree.rabbitclient.channel;

import java.io.IOException;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Method;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * A failure reported by the broker, typically a channel or connection close
 * such as {@code 406 PRECONDITION_FAILED} or {@code 404 NOT_FOUND}. The channel
 * that raised it is no longer usable.
 */
public class BrokerException extends IOException {

	private static final long serialVersionUID = 1L;

	private final int replyCode;
	private final String replyText;
	private final boolean hardError;

	public BrokerException(String message, int replyCode, String replyText, boolean hardError, Throwable cause) {
		super(message, cause);
		this.replyCode = replyCode;
		this.replyText = replyText;
		this.hardError = hardError;
	}

	/**
	 * Builds an exception from the shutdown signal the RabbitMQ client raised.
	 * The reply code is 0 when the signal did not carry a close method, for
	 * example when the socket simply went away.
	 */
	public static BrokerException from(String operation, ShutdownSignalException signal, Throwable cause) {
		int code = 0;
		String text = signal.getMessage();
		Method reason = signal.getReason();
		if (reason instanceof AMQP.Channel.Close) {
			AMQP.Channel.Close close = (AMQP.Channel.Close) reason;
			code = close.getReplyCode();
			text = close.getReplyText();
		} else if (reason instanceof AMQP.Connection.Close) {
			AMQP.Connection.Close close = (AMQP.Connection.Close) reason;
			code = close.getReplyCode();
			text = close.getReplyText();
		}
		return new BrokerException(operation + " failed: " + text, code, text, signal.isHardError(), cause);
	}

	/**
	 * Translates an {@link IOException} thrown by the RabbitMQ client. If a
	 * shutdown signal is found in its cause chain a {@link BrokerException} is
	 * returned, otherwise the original exception.
	 */
	public static IOException translate(String operation, IOException e) {
		if (e instanceof BrokerException) {
			return e;
		}
		Throwable cause = e.getCause();
		while (cause != null) {
			if (cause instanceof ShutdownSignalException) {
				return from(operation, (ShutdownSignalException) cause, e);
			}
			cause = cause.getCause();
		}
		return e;
	}

	public int getReplyCode() {
		return replyCode;
	}

	public String getReplyText() {
		return replyText;
	}

	/**
	 * @return true if the whole connection was closed, false if only the channel was
	 */
	public boolean isHardError() {
		return hardError;
	}

}
