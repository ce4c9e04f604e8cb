package com.example.sqsqueue;

/**
 * Raised while building a {@link QueueConfig} from invalid values.
 */
public class QueueConfigurationException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	public QueueConfigurationException(String message) {
		super(message);
	}

	public QueueConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
