package com.example.sqsqueue;

import java.time.Duration;

public class PurgeTimeoutException extends QueueException {

	private static final long serialVersionUID = 1L;

	private final int lastObservedLength;

	public PurgeTimeoutException(String queueUrl, Duration timeout, int lastObservedLength) {
		super("Queue '" + queueUrl + "' still reported " + lastObservedLength
				+ " message(s) " + timeout.toMillis() + "ms after purge");
		this.lastObservedLength = lastObservedLength;
	}

	public int getLastObservedLength() {
		return lastObservedLength;
	}
}
