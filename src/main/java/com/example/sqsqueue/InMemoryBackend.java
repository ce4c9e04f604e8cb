package com.example.sqsqueue;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * Process-local {@link QueueBackend} for tests and development. One instance
 * is one queue; the queue url passed to each call is ignored.
 * <p>
 * Unlike SQS, received messages are never hidden: a message stays at the head
 * and is returned again by every receive until it is deleted. Deletes remove
 * from the head regardless of the receipt handle given, so the double is only
 * faithful when messages are deleted in the order they were received. Sizes
 * are exact and purges take effect immediately.
 */
public class InMemoryBackend implements QueueBackend {

	/*head of the list is the oldest message*/
	private final LinkedList<Entry> messages = new LinkedList<Entry>();

	private final ReadWriteLock readWriteLock = new ReentrantReadWriteLock();
	private final Lock read = readWriteLock.readLock();
	private final Lock write = readWriteLock.writeLock();

	@Override
	public void sendMessage(String queueUrl, String messageBody) {
		Preconditions.checkNotNull(messageBody, "messageBody");

		write.lock();
		try {
			messages.addLast(new Entry(messageBody));
		} finally {
			write.unlock();
		}
	}

	@Override
	public BatchResult sendMessageBatch(String queueUrl, List<SendBatchEntry> entries) {
		List<String> ids = new ArrayList<String>(entries.size());
		write.lock();
		try {
			for (SendBatchEntry entry : entries) {
				messages.addLast(new Entry(entry.getBody()));
				ids.add(entry.getId());
			}
		} finally {
			write.unlock();
		}
		return BatchResult.allSucceeded(ids);
	}

	@Override
	public void deleteMessage(String queueUrl, String receiptHandle) {
		write.lock();
		try {
			messages.pollFirst();
		} finally {
			write.unlock();
		}
	}

	@Override
	public BatchResult deleteMessageBatch(String queueUrl, List<DeleteBatchEntry> entries) {
		List<String> ids = new ArrayList<String>(entries.size());
		write.lock();
		try {
			for (DeleteBatchEntry entry : entries) {
				messages.pollFirst();
				ids.add(entry.getId());
			}
		} finally {
			write.unlock();
		}
		return BatchResult.allSucceeded(ids);
	}

	@Override
	public List<QueueMessage> receiveMessages(String queueUrl, int maxMessages, int visibilityTimeoutSeconds) {
		List<QueueMessage> received = new ArrayList<QueueMessage>();
		read.lock();
		try {
			for (Entry entry : messages) {
				if (received.size() >= maxMessages)
					break;
				// every receive hands out a new receipt handle, as SQS does
				received.add(new QueueMessage(entry.body, UUID.randomUUID().toString(), entry.messageId,
						ImmutableMap.of(SqsBackend.SENT_TIMESTAMP, Long.toString(entry.sentTimestamp))));
			}
		} finally {
			read.unlock();
		}
		return received;
	}

	@Override
	public int approximateNumberOfMessages(String queueUrl) {
		read.lock();
		try {
			return messages.size();
		} finally {
			read.unlock();
		}
	}

	@Override
	public void purgeQueue(String queueUrl) {
		write.lock();
		try {
			messages.clear();
		} finally {
			write.unlock();
		}
	}

	private static final class Entry {
		private final String messageId = UUID.randomUUID().toString();
		private final long sentTimestamp = System.currentTimeMillis();
		private final String body;

		Entry(String body) {
			this.body = body;
		}
	}
}
