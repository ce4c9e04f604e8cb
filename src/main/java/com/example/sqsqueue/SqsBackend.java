package com.example.sqsqueue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazonaws.AmazonClientException;
import com.amazonaws.services.sqs.AmazonSQS;
import com.amazonaws.services.sqs.model.BatchResultErrorEntry;
import com.amazonaws.services.sqs.model.DeleteMessageBatchRequest;
import com.amazonaws.services.sqs.model.DeleteMessageBatchRequestEntry;
import com.amazonaws.services.sqs.model.DeleteMessageBatchResult;
import com.amazonaws.services.sqs.model.DeleteMessageBatchResultEntry;
import com.amazonaws.services.sqs.model.DeleteMessageRequest;
import com.amazonaws.services.sqs.model.GetQueueAttributesRequest;
import com.amazonaws.services.sqs.model.Message;
import com.amazonaws.services.sqs.model.MessageAttributeValue;
import com.amazonaws.services.sqs.model.PurgeQueueRequest;
import com.amazonaws.services.sqs.model.QueueAttributeName;
import com.amazonaws.services.sqs.model.ReceiveMessageRequest;
import com.amazonaws.services.sqs.model.SendMessageBatchRequest;
import com.amazonaws.services.sqs.model.SendMessageBatchRequestEntry;
import com.amazonaws.services.sqs.model.SendMessageBatchResult;
import com.amazonaws.services.sqs.model.SendMessageBatchResultEntry;
import com.amazonaws.services.sqs.model.SendMessageRequest;
import com.google.common.annotations.VisibleForTesting;

/**
 * {@link QueueBackend} over Amazon SQS. Every method is one blocking request;
 * nothing is retried here.
 */
public class SqsBackend implements QueueBackend {

	private static final Logger logger = LoggerFactory.getLogger(SqsBackend.class);

	/* longest wait SQS allows for a long poll */
	@VisibleForTesting
	static final int RECEIVE_WAIT_TIME_SECONDS = 20;
	@VisibleForTesting
	static final String SENT_TIMESTAMP = "SentTimestamp";
	private static final String ALL_MESSAGE_ATTRIBUTES = "All";

	private final AmazonSQS sqsClient;

	public SqsBackend(AmazonSQS sqsClient) {
		this.sqsClient = sqsClient;
	}

	@Override
	public void sendMessage(String queueUrl, String messageBody) {
		try {
			sqsClient.sendMessage(new SendMessageRequest(queueUrl, messageBody));
		} catch (AmazonClientException e) {
			throw failure("SendMessage", queueUrl, e);
		}
	}

	@Override
	public BatchResult sendMessageBatch(String queueUrl, List<SendBatchEntry> entries) {
		List<SendMessageBatchRequestEntry> requestEntries = new ArrayList<SendMessageBatchRequestEntry>();
		for (SendBatchEntry entry : entries) {
			requestEntries.add(new SendMessageBatchRequestEntry(entry.getId(), entry.getBody()));
		}

		SendMessageBatchResult result;
		try {
			result = sqsClient.sendMessageBatch(new SendMessageBatchRequest(queueUrl, requestEntries));
		} catch (AmazonClientException e) {
			throw failure("SendMessageBatch", queueUrl, e);
		}

		List<String> successful = new ArrayList<String>();
		for (SendMessageBatchResultEntry entry : result.getSuccessful()) {
			successful.add(entry.getId());
		}
		return toBatchResult("SendMessageBatch", queueUrl, successful, result.getFailed());
	}

	@Override
	public void deleteMessage(String queueUrl, String receiptHandle) {
		try {
			sqsClient.deleteMessage(new DeleteMessageRequest(queueUrl, receiptHandle));
		} catch (AmazonClientException e) {
			throw failure("DeleteMessage", queueUrl, e);
		}
	}

	@Override
	public BatchResult deleteMessageBatch(String queueUrl, List<DeleteBatchEntry> entries) {
		List<DeleteMessageBatchRequestEntry> requestEntries = new ArrayList<DeleteMessageBatchRequestEntry>();
		for (DeleteBatchEntry entry : entries) {
			requestEntries.add(new DeleteMessageBatchRequestEntry(entry.getId(), entry.getReceiptHandle()));
		}

		DeleteMessageBatchResult result;
		try {
			result = sqsClient.deleteMessageBatch(new DeleteMessageBatchRequest(queueUrl, requestEntries));
		} catch (AmazonClientException e) {
			throw failure("DeleteMessageBatch", queueUrl, e);
		}

		List<String> successful = new ArrayList<String>();
		for (DeleteMessageBatchResultEntry entry : result.getSuccessful()) {
			successful.add(entry.getId());
		}
		return toBatchResult("DeleteMessageBatch", queueUrl, successful, result.getFailed());
	}

	@Override
	public List<QueueMessage> receiveMessages(String queueUrl, int maxMessages, int visibilityTimeoutSeconds) {
		ReceiveMessageRequest request = new ReceiveMessageRequest(queueUrl)
				.withAttributeNames(SENT_TIMESTAMP)
				.withMessageAttributeNames(ALL_MESSAGE_ATTRIBUTES)
				.withMaxNumberOfMessages(maxMessages)
				.withVisibilityTimeout(visibilityTimeoutSeconds)
				.withWaitTimeSeconds(RECEIVE_WAIT_TIME_SECONDS);

		List<Message> received;
		try {
			received = sqsClient.receiveMessage(request).getMessages();
		} catch (AmazonClientException e) {
			throw failure("ReceiveMessage", queueUrl, e);
		}

		List<QueueMessage> messages = new ArrayList<QueueMessage>(received.size());
		for (Message message : received) {
			messages.add(new QueueMessage(message.getBody(), message.getReceiptHandle(),
					message.getMessageId(), attributesOf(message)));
		}
		logger.debug("Received {} message(s) from {}", messages.size(), queueUrl);
		return messages;
	}

	@Override
	public int approximateNumberOfMessages(String queueUrl) {
		String attribute = QueueAttributeName.ApproximateNumberOfMessages.toString();
		GetQueueAttributesRequest request = new GetQueueAttributesRequest(queueUrl).withAttributeNames(attribute);

		Map<String, String> attributes;
		try {
			attributes = sqsClient.getQueueAttributes(request).getAttributes();
		} catch (AmazonClientException e) {
			throw failure("GetQueueAttributes", queueUrl, e);
		}

		String value = attributes == null ? null : attributes.get(attribute);
		if (value == null)
			throw new QueueBackendException("GetQueueAttributes on " + queueUrl + " returned no " + attribute);
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new QueueBackendException("Unexpected " + attribute + " value '" + value + "'", e);
		}
	}

	@Override
	public void purgeQueue(String queueUrl) {
		try {
			sqsClient.purgeQueue(new PurgeQueueRequest().withQueueUrl(queueUrl));
		} catch (AmazonClientException e) {
			// SQS answers a second purge within 60 seconds with PurgeQueueInProgress
			throw failure("PurgeQueue", queueUrl, e);
		}
	}

	/**
	 * Message attributes with a string value (types String and Number) plus the
	 * system attributes, which win on a name clash. Binary attributes are skipped.
	 */
	@VisibleForTesting
	static Map<String, String> attributesOf(Message message) {
		Map<String, String> attributes = new HashMap<String, String>();
		if (message.getMessageAttributes() != null) {
			for (Map.Entry<String, MessageAttributeValue> entry : message.getMessageAttributes().entrySet()) {
				if (entry.getValue() != null && entry.getValue().getStringValue() != null)
					attributes.put(entry.getKey(), entry.getValue().getStringValue());
			}
		}
		if (message.getAttributes() != null) {
			attributes.putAll(message.getAttributes());
		}
		return attributes;
	}

	private static BatchResult toBatchResult(String operation, String queueUrl, List<String> successful,
			List<BatchResultErrorEntry> errors) {
		List<BatchEntryFailure> failed = new ArrayList<BatchEntryFailure>();
		for (BatchResultErrorEntry error : errors) {
			failed.add(new BatchEntryFailure(error.getId(), error.getCode(), error.getMessage(),
					Boolean.TRUE.equals(error.getSenderFault())));
		}
		if (!failed.isEmpty()) {
			logger.debug("{} on {}: {} entries failed", operation, queueUrl, failed.size());
		}
		return new BatchResult(successful, failed);
	}

	private static QueueBackendException failure(String operation, String queueUrl, AmazonClientException e) {
		logger.debug("{} on {} failed", operation, queueUrl, e);
		return new QueueBackendException(operation + " on " + queueUrl + " failed: " + e.getMessage(), e);
	}
}
