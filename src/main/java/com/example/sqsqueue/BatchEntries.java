package com.example.sqsqueue;

import java.util.List;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
 * Builds the entries of batch requests.
 */
final class BatchEntries {

	private BatchEntries() {/*static helpers only*/}

	/**
	 * Pairs every body with a freshly generated id, keeping input order.
	 */
	static List<SendBatchEntry> forSend(List<String> bodies, IdGenerator ids) {
		ImmutableList.Builder<SendBatchEntry> entries = ImmutableList.builder();
		for (String body : bodies) {
			entries.add(new SendBatchEntry(ids.nextId(), body));
		}
		return entries.build();
	}

	/**
	 * Pairs every receipt handle with the id the backend gave the message.
	 * A generated id is used only for messages that came without one.
	 */
	static List<DeleteBatchEntry> forDelete(List<QueueMessage> messages, IdGenerator ids) {
		ImmutableList.Builder<DeleteBatchEntry> entries = ImmutableList.builder();
		for (QueueMessage message : messages) {
			String id = Strings.isNullOrEmpty(message.getMessageId()) ? ids.nextId() : message.getMessageId();
			entries.add(new DeleteBatchEntry(id, message.getReceiptHandle()));
		}
		return entries.build();
	}
}
