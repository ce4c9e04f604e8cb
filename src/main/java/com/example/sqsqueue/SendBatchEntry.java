package com.example.sqsqueue;

import java.util.Objects;

/**
 * One body of a batch insert. The id only correlates entries with their
 * results inside a single call.
 */
public final class SendBatchEntry {

	private final String id;
	private final String body;

	public SendBatchEntry(String id, String body) {
		this.id = id;
		this.body = body;
	}

	public String getId() {
		return id;
	}

	public String getBody() {
		return body;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof SendBatchEntry))
			return false;
		SendBatchEntry other = (SendBatchEntry) o;
		return Objects.equals(id, other.id) && Objects.equals(body, other.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(id, body);
	}

	@Override
	public String toString() {
		return id + "=" + body;
	}
}
