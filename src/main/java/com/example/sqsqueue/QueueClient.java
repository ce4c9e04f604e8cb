package com.example.sqsqueue;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazonaws.services.sqs.AmazonSQS;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
 * An unordered, at-least-once queue on top of a {@link QueueBackend}.
 * <p>
 * Received messages are not removed: they stay hidden for the configured
 * visibility timeout and have to be deleted within it, otherwise they become
 * visible and may be received again, by this or any other client.
 * <p>
 * Not thread-safe. All calls block, none are retried.
 */
public class QueueClient {

	private static final Logger logger = LoggerFactory.getLogger(QueueClient.class);

	private final QueueConfig config;
	private final String queueUrl;
	private final QueueBackend backend;
	private final IdGenerator idGenerator;
	private final PurgeCompletionPoller purgePoller;
	/* set when this client built the SDK client itself, see connect() */
	private AmazonSQS ownedSqsClient;

	public QueueClient(QueueConfig config, String queueUrl, QueueBackend backend) {
		this(config, queueUrl, backend, new RandomIdGenerator(), new PurgeCompletionPoller());
	}

	public QueueClient(QueueConfig config, String queueUrl, QueueBackend backend, IdGenerator idGenerator,
			PurgeCompletionPoller purgePoller) {
		Preconditions.checkNotNull(config, "config");
		if (Strings.isNullOrEmpty(queueUrl))
			throw new IllegalArgumentException("Queue url must not be empty");
		this.config = config;
		this.queueUrl = queueUrl;
		this.backend = Preconditions.checkNotNull(backend, "backend");
		this.idGenerator = Preconditions.checkNotNull(idGenerator, "idGenerator");
		this.purgePoller = Preconditions.checkNotNull(purgePoller, "purgePoller");
	}

	/**
	 * Binds a client to an existing SQS queue in the configured region. The
	 * returned client owns its SDK client; call {@link #shutdown()} when done.
	 *
	 * @throws QueueResolutionException if the queue does not exist or the region is unusable
	 */
	public static QueueClient connect(QueueConfig config) {
		AmazonSQS sqsClient;
		try {
			sqsClient = SqsClientFactory.create(config.getRegion());
		} catch (IllegalArgumentException e) {
			// the SDK rejects unknown regions while building the client
			throw new QueueResolutionException(config.getName(), e);
		}
		return bind(config, sqsClient);
	}

	@VisibleForTesting
	static QueueClient bind(QueueConfig config, AmazonSQS sqsClient) {
		QueueClient client;
		try {
			client = create(config, new SqsQueueManagement(sqsClient), new SqsBackend(sqsClient));
		} catch (RuntimeException e) {
			sqsClient.shutdown();
			throw e;
		}
		client.ownedSqsClient = sqsClient;
		return client;
	}

	/**
	 * Resolves the queue url once through {@code management}; the client keeps
	 * it for its lifetime.
	 */
	public static QueueClient create(QueueConfig config, QueueManagement management, QueueBackend backend) {
		String queueUrl = management.resolveQueueUrl(config.getName());
		logger.debug("Resolved queue {} to {}", config.getName(), queueUrl);
		return new QueueClient(config, queueUrl, backend);
	}

	/**
	 * Like {@link #create(QueueConfig, QueueManagement, QueueBackend)}, creating
	 * the queue first when it is missing.
	 */
	public static QueueClient createIfMissing(QueueConfig config, QueueManagement management,
			QueueBackend backend) {
		String queueUrl = management.createQueue(config.getName());
		return new QueueClient(config, queueUrl, backend);
	}

	/**
	 * Inserts a string into the queue.
	 */
	public void insert(String body) {
		Preconditions.checkNotNull(body, "body");
		backend.sendMessage(queueUrl, body);
	}

	/**
	 * Inserts up to 10 strings in one call. Entries may fail individually; the
	 * returned result says which ones, by the ids generated for this call.
	 */
	public BatchResult insertBatch(List<String> bodies) {
		checkBatchSize(bodies);
		return backend.sendMessageBatch(queueUrl, BatchEntries.forSend(bodies, idGenerator));
	}

	/**
	 * Returns a message without deleting it, or empty if none is available.
	 * The visibility timeout starts now.
	 */
	public Optional<QueueMessage> peek() {
		List<QueueMessage> messages = receive(1);
		return messages.isEmpty() ? Optional.<QueueMessage>empty() : Optional.of(messages.get(0));
	}

	/**
	 * Returns up to 10 messages without deleting them. May return fewer than
	 * are enqueued.
	 */
	public List<QueueMessage> peekBatch() {
		return receive(QueueBackend.MAX_BATCH_SIZE);
	}

	/**
	 * Receives a message and deletes it. If the delete fails the exception is
	 * thrown and the message is received again once its timeout elapses.
	 */
	public Optional<QueueMessage> pop() {
		Optional<QueueMessage> message = peek();
		if (message.isPresent()) {
			delete(message.get());
		}
		return message;
	}

	/**
	 * Receives up to 10 messages and deletes them.
	 *
	 * @throws PartialBatchFailureException if some or all of them could not be
	 *         deleted; the exception still carries every received message
	 */
	public List<QueueMessage> popBatch() {
		List<QueueMessage> messages = peekBatch();
		if (messages.isEmpty())
			return messages;

		BatchResult result;
		try {
			result = deleteBatch(messages);
		} catch (QueueBackendException e) {
			// none of them were deleted, all reappear after the visibility timeout
			throw new PartialBatchFailureException(messages, e);
		}
		if (!result.isFullySuccessful())
			throw new PartialBatchFailureException(messages, result);
		return messages;
	}

	/**
	 * Deletes a message returned by one of the receiving calls. Has to happen
	 * within the visibility timeout.
	 */
	public void delete(QueueMessage message) {
		Preconditions.checkNotNull(message, "message");
		backend.deleteMessage(queueUrl, message.getReceiptHandle());
	}

	public BatchResult deleteBatch(List<QueueMessage> messages) {
		checkBatchSize(messages);
		return backend.deleteMessageBatch(queueUrl, BatchEntries.forDelete(messages, idGenerator));
	}

	/**
	 * Purges the queue and blocks until its length reads zero. SQS allows one
	 * purge per queue every 60 seconds; a second call fails.
	 */
	public void clear() {
		backend.purgeQueue(queueUrl);
		purgePoller.awaitEmpty(backend, queueUrl);
	}

	/**
	 * @throws PurgeTimeoutException if the length does not read zero within {@code timeout}
	 */
	public void clear(Duration timeout) {
		backend.purgeQueue(queueUrl);
		purgePoller.awaitEmpty(backend, queueUrl, timeout);
	}

	/**
	 * Approximate number of visible messages. On SQS this can lag the real
	 * size by up to 30 seconds.
	 */
	public int approximateLength() {
		return backend.approximateNumberOfMessages(queueUrl);
	}

	/**
	 * Releases the SDK client created by {@link #connect(QueueConfig)}. A no-op
	 * for clients built around a caller-supplied backend, whose lifecycle stays
	 * with the caller.
	 */
	public void shutdown() {
		if (ownedSqsClient != null) {
			ownedSqsClient.shutdown();
			ownedSqsClient = null;
		}
	}

	public QueueConfig getConfig() {
		return config;
	}

	public String getQueueUrl() {
		return queueUrl;
	}

	private List<QueueMessage> receive(int maxMessages) {
		List<QueueMessage> messages = backend.receiveMessages(queueUrl, maxMessages,
				config.getVisibilityTimeoutSeconds());
		return messages == null ? ImmutableList.<QueueMessage>of() : messages;
	}

	private static void checkBatchSize(List<?> entries) {
		Preconditions.checkNotNull(entries, "entries");
		Preconditions.checkArgument(!entries.isEmpty() && entries.size() <= QueueBackend.MAX_BATCH_SIZE,
				"A batch holds 1 to %s entries, got %s", QueueBackend.MAX_BATCH_SIZE, entries.size());
	}
}
