package com.example.sqsqueue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazonaws.AmazonClientException;
import com.amazonaws.services.sqs.AmazonSQS;
import com.amazonaws.services.sqs.model.CreateQueueRequest;
import com.amazonaws.services.sqs.model.DeleteQueueRequest;
import com.amazonaws.services.sqs.model.GetQueueUrlRequest;
import com.amazonaws.services.sqs.model.ListQueuesRequest;
import com.google.common.base.Strings;

public class SqsQueueManagement implements QueueManagement {

	private static final Logger logger = LoggerFactory.getLogger(SqsQueueManagement.class);

	private final AmazonSQS sqsClient;

	public SqsQueueManagement(AmazonSQS sqsClient) {
		this.sqsClient = sqsClient;
	}

	/**
	 * The returned instance owns its SDK client; release it with {@link #shutdown()}.
	 */
	public static SqsQueueManagement forRegion(String region) {
		return new SqsQueueManagement(SqsClientFactory.create(region));
	}

	@Override
	public String createQueue(String queueName) {
		checkName(queueName);
		try {
			String queueUrl = sqsClient.createQueue(new CreateQueueRequest(queueName)).getQueueUrl();
			logger.debug("Created queue {} at {}", queueName, queueUrl);
			return queueUrl;
		} catch (AmazonClientException e) {
			throw new QueueBackendException("CreateQueue '" + queueName + "' failed: " + e.getMessage(), e);
		}
	}

	@Override
	public void deleteQueue(String queueName) {
		String queueUrl = resolveQueueUrl(queueName);
		try {
			sqsClient.deleteQueue(new DeleteQueueRequest(queueUrl));
			logger.debug("Deleted queue {}", queueUrl);
		} catch (AmazonClientException e) {
			throw new QueueBackendException("DeleteQueue '" + queueName + "' failed: " + e.getMessage(), e);
		}
	}

	@Override
	public String resolveQueueUrl(String queueName) {
		checkName(queueName);
		try {
			return sqsClient.getQueueUrl(new GetQueueUrlRequest(queueName)).getQueueUrl();
		} catch (AmazonClientException e) {
			throw new QueueResolutionException(queueName, e);
		}
	}

	@Override
	public boolean queueExists(String queueName) {
		checkName(queueName);
		try {
			for (String queueUrl : sqsClient.listQueues(new ListQueuesRequest(queueName)).getQueueUrls()) {
				// the listing is by prefix, so 'orders' also returns 'orders-dlq'
				if (queueUrl.endsWith("/" + queueName))
					return true;
			}
			return false;
		} catch (AmazonClientException e) {
			throw new QueueBackendException("ListQueues '" + queueName + "' failed: " + e.getMessage(), e);
		}
	}

	/**
	 * Shuts down the underlying SDK client, including for callers that passed
	 * their own one in.
	 */
	public void shutdown() {
		sqsClient.shutdown();
	}

	private static void checkName(String queueName) {
		if (Strings.isNullOrEmpty(queueName))
			throw new IllegalArgumentException("Queue name must not be empty");
	}
}
