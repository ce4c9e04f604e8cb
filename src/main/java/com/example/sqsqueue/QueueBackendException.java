package com.example.sqsqueue;

/**
 * A backend call failed. The underlying SDK exception, if any, is the cause.
 */
public class QueueBackendException extends QueueException {

	private static final long serialVersionUID = 1L;

	public QueueBackendException(String message) {
		super(message);
	}

	public QueueBackendException(String message, Throwable cause) {
		super(message, cause);
	}
}
