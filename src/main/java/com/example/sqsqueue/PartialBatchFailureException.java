package com.example.sqsqueue;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Thrown by {@link QueueClient#popBatch()} when some or all of the received
 * messages could not be deleted. Those messages are still enqueued and become
 * visible again once their visibility timeout elapses.
 */
public class PartialBatchFailureException extends QueueException {

	private static final long serialVersionUID = 1L;

	static final String REQUEST_FAILED = "RequestFailed";

	private final List<QueueMessage> messages;
	private final BatchResult result;

	public PartialBatchFailureException(List<QueueMessage> messages, BatchResult result) {
		super(result.getFailed().size() + " of " + messages.size()
				+ " received message(s) could not be deleted: " + result.getFailed());
		this.messages = ImmutableList.copyOf(messages);
		this.result = result;
	}

	/**
	 * The whole delete call failed. Every message is reported as a failed entry
	 * with code {@value #REQUEST_FAILED}; {@code cause} is kept.
	 */
	public PartialBatchFailureException(List<QueueMessage> messages, QueueBackendException cause) {
		super("None of " + messages.size() + " received message(s) could be deleted: "
				+ cause.getMessage(), cause);
		this.messages = ImmutableList.copyOf(messages);
		this.result = allFailed(messages, cause);
	}

	/**
	 * @return every message that was received, deleted or not
	 */
	public List<QueueMessage> getMessages() {
		return messages;
	}

	public BatchResult getResult() {
		return result;
	}

	private static BatchResult allFailed(List<QueueMessage> messages, QueueBackendException cause) {
		List<BatchEntryFailure> failed = new ArrayList<BatchEntryFailure>();
		for (QueueMessage message : messages) {
			failed.add(new BatchEntryFailure(message.getMessageId(), REQUEST_FAILED, cause.getMessage(), false));
		}
		return new BatchResult(ImmutableList.<String>of(), failed);
	}
}
