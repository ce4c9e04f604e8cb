package com.example.sqsqueue;

import com.google.common.base.MoreObjects;

/**
 * A single entry the backend rejected inside an otherwise accepted batch call.
 */
public final class BatchEntryFailure {

	private final String id;
	private final String code;
	private final String message;
	private final boolean senderFault;

	public BatchEntryFailure(String id, String code, String message, boolean senderFault) {
		this.id = id;
		this.code = code;
		this.message = message;
		this.senderFault = senderFault;
	}

	public String getId() {
		return id;
	}

	public String getCode() {
		return code;
	}

	public String getMessage() {
		return message;
	}

	/**
	 * @return true when resending the same entry would fail again
	 */
	public boolean isSenderFault() {
		return senderFault;
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this)
				.add("id", id)
				.add("code", code)
				.add("message", message)
				.add("senderFault", senderFault)
				.toString();
	}
}
