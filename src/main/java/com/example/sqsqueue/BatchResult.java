package com.example.sqsqueue;

import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * Per-entry outcome of a batch send or delete, keyed by batch entry id.
 */
public final class BatchResult {

	private final List<String> successful;
	private final List<BatchEntryFailure> failed;

	public BatchResult(List<String> successful, List<BatchEntryFailure> failed) {
		this.successful = ImmutableList.copyOf(successful);
		this.failed = ImmutableList.copyOf(failed);
	}

	public static BatchResult allSucceeded(List<String> ids) {
		return new BatchResult(ids, ImmutableList.<BatchEntryFailure>of());
	}

	public List<String> getSuccessful() {
		return successful;
	}

	public List<BatchEntryFailure> getFailed() {
		return failed;
	}

	public boolean isFullySuccessful() {
		return failed.isEmpty();
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this)
				.add("successful", successful)
				.add("failed", failed)
				.toString();
	}
}
