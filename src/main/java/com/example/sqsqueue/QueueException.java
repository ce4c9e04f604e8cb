package com.example.sqsqueue;

/**
 * Root of the failures raised by a {@link QueueClient} after construction.
 */
public class QueueException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public QueueException(String message) {
		super(message);
	}

	public QueueException(String message, Throwable cause) {
		super(message, cause);
	}
}
