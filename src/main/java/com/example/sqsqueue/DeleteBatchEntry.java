package com.example.sqsqueue;

import java.util.Objects;

public final class DeleteBatchEntry {

	private final String id;
	private final String receiptHandle;

	public DeleteBatchEntry(String id, String receiptHandle) {
		this.id = id;
		this.receiptHandle = receiptHandle;
	}

	public String getId() {
		return id;
	}

	public String getReceiptHandle() {
		return receiptHandle;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof DeleteBatchEntry))
			return false;
		DeleteBatchEntry other = (DeleteBatchEntry) o;
		return Objects.equals(id, other.id) && Objects.equals(receiptHandle, other.receiptHandle);
	}

	@Override
	public int hashCode() {
		return Objects.hash(id, receiptHandle);
	}

	@Override
	public String toString() {
		return id + "=" + receiptHandle;
	}
}
