package com.example.sqsqueue;

import java.util.Map;
import java.util.Objects;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

/**
 * A message as handed out by a receive call. The receipt handle is only valid
 * while the message is in flight, i.e. until its visibility timeout elapses.
 */
public final class QueueMessage {

	private final String body;
	private final String receiptHandle;
	private final String messageId;
	private final Map<String, String> attributes;

	public QueueMessage(String body, String receiptHandle, String messageId) {
		this(body, receiptHandle, messageId, ImmutableMap.<String, String>of());
	}

	public QueueMessage(String body, String receiptHandle, String messageId, Map<String, String> attributes) {
		this.body = body;
		this.receiptHandle = receiptHandle;
		this.messageId = messageId;
		this.attributes = attributes == null ? ImmutableMap.<String, String>of() : ImmutableMap.copyOf(attributes);
	}

	public String getBody() {
		return body;
	}

	public String getReceiptHandle() {
		return receiptHandle;
	}

	public String getMessageId() {
		return messageId;
	}

	public Map<String, String> getAttributes() {
		return attributes;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof QueueMessage))
			return false;
		QueueMessage other = (QueueMessage) o;
		return Objects.equals(body, other.body)
				&& Objects.equals(receiptHandle, other.receiptHandle)
				&& Objects.equals(messageId, other.messageId)
				&& attributes.equals(other.attributes);
	}

	@Override
	public int hashCode() {
		return Objects.hash(body, receiptHandle, messageId, attributes);
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this)
				.add("messageId", messageId)
				.add("receiptHandle", receiptHandle)
				.add("body", body)
				.toString();
	}
}
