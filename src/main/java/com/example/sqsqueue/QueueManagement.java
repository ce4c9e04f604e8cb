package com.example.sqsqueue;

/**
 * Queue lifecycle operations. Used when a {@link QueueClient} is built and by
 * tooling that provisions queues; never on the message path.
 */
public interface QueueManagement {

	/**
	 * creates the queue if needed.
	 * @return url of the queue
	 */
	String createQueue(String queueName);

	void deleteQueue(String queueName);

	/**
	 * @throws QueueResolutionException if no queue with that name exists
	 */
	String resolveQueueUrl(String queueName);

	boolean queueExists(String queueName);
}
