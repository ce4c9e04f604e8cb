package com.example.sqsqueue;

public class QueueResolutionException extends QueueException {

	private static final long serialVersionUID = 1L;

	public QueueResolutionException(String queueName, Throwable cause) {
		super("Could not resolve url of queue '" + queueName + "': " + cause.getMessage(), cause);
	}
}
