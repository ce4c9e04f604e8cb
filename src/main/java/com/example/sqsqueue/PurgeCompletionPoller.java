package com.example.sqsqueue;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;

/**
 * Turns a purge, which SQS completes asynchronously (up to 60 seconds), into a
 * blocking call: re-reads the approximate queue length until it is zero.
 */
public class PurgeCompletionPoller {

	private static final Logger logger = LoggerFactory.getLogger(PurgeCompletionPoller.class);

	static final long POLL_INTERVAL_MILLIS = 50L;

	private final Ticker ticker;
	private PollingCollaborator pollingCollaborator = new PollingCollaborator();

	public PurgeCompletionPoller() {
		this(Ticker.systemTicker());
	}

	public PurgeCompletionPoller(Ticker ticker) {
		this.ticker = Preconditions.checkNotNull(ticker, "ticker");
	}

	/**
	 * Waits without limit. Does not return while another producer keeps the
	 * queue non-empty.
	 */
	public void awaitEmpty(QueueBackend backend, String queueUrl) {
		await(backend, queueUrl, null);
	}

	/**
	 * @throws PurgeTimeoutException if the length is still above zero once {@code timeout} has elapsed
	 */
	public void awaitEmpty(QueueBackend backend, String queueUrl, Duration timeout) {
		Preconditions.checkNotNull(timeout, "timeout");
		Preconditions.checkArgument(!timeout.isNegative(), "timeout must not be negative: %s", timeout);
		await(backend, queueUrl, timeout);
	}

	private void await(QueueBackend backend, String queueUrl, Duration timeout) {
		Stopwatch stopwatch = Stopwatch.createStarted(ticker);
		int polls = 1;
		int length = backend.approximateNumberOfMessages(queueUrl);
		while (length > 0) {
			if (timeout != null && stopwatch.elapsed().compareTo(timeout) >= 0)
				throw new PurgeTimeoutException(queueUrl, timeout, length);

			pollingCollaborator.pause(POLL_INTERVAL_MILLIS);
			length = backend.approximateNumberOfMessages(queueUrl);
			polls++;
		}
		logger.debug("Queue {} reported empty after {} poll(s) in {}", queueUrl, polls, stopwatch);
	}

	public PollingCollaborator getPollingCollaborator() {
		return pollingCollaborator;
	}

	public void setPollingCollaborator(PollingCollaborator pollingCollaborator) {
		this.pollingCollaborator = pollingCollaborator;
	}
}
