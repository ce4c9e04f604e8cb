package com.example.sqsqueue;

/**
 * Blocks the calling thread between two polls. Replaced in tests so that
 * polling loops run without real sleeps.
 */
public class PollingCollaborator {

	public void pause(long millis) {
		try {
			Thread.sleep(millis);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new QueueException("Interrupted while polling", e);
		}
	}
}
