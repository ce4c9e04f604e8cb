package com.example.sqsqueue;

import java.util.List;

/**
 * The message-flow operations a {@link QueueClient} needs from a queue
 * service. Implemented by {@link SqsBackend} for the real service and by
 * {@link InMemoryBackend} for tests.
 */
public interface QueueBackend {

	/** Largest number of entries a batch call or a receive may carry. */
	int MAX_BATCH_SIZE = 10;

	/**
	 * pushes a message onto a queue.
	 */
	void sendMessage(String queueUrl, String messageBody);

	/**
	 * pushes up to {@link #MAX_BATCH_SIZE} messages onto a queue in one call.
	 */
	BatchResult sendMessageBatch(String queueUrl, List<SendBatchEntry> entries);

	/**
	 * deletes a message that was returned by {@link #receiveMessages}.
	 */
	void deleteMessage(String queueUrl, String receiptHandle);

	BatchResult deleteMessageBatch(String queueUrl, List<DeleteBatchEntry> entries);

	/**
	 * retrieves up to {@code maxMessages} messages without deleting them.
	 * Returns an empty list when nothing is available.
	 */
	List<QueueMessage> receiveMessages(String queueUrl, int maxMessages, int visibilityTimeoutSeconds);

	/**
	 * @return the backend's count of visible messages, which may lag the true size
	 */
	int approximateNumberOfMessages(String queueUrl);

	/**
	 * discards the whole content of a queue. Completion may be asynchronous.
	 */
	void purgeQueue(String queueUrl);
}
