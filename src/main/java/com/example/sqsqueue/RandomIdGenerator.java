package com.example.sqsqueue;

import java.util.Random;

import com.google.common.base.Preconditions;

/**
 * Fixed-length alphanumeric ids. Collisions are not checked; within a batch of
 * ten the random space makes them negligible.
 */
public class RandomIdGenerator implements IdGenerator {

	static final int DEFAULT_LENGTH = 15;
	private static final char[] ALPHABET =
			"abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789".toCharArray();

	private final Random random;
	private final int length;

	public RandomIdGenerator() {
		this(new Random(), DEFAULT_LENGTH);
	}

	public RandomIdGenerator(Random random) {
		this(random, DEFAULT_LENGTH);
	}

	public RandomIdGenerator(Random random, int length) {
		Preconditions.checkNotNull(random, "random");
		// SQS accepts batch entry ids of up to 80 characters
		Preconditions.checkArgument(length > 0 && length <= 80, "length must be in [1, 80]: %s", length);
		this.random = random;
		this.length = length;
	}

	@Override
	public String nextId() {
		char[] id = new char[length];
		for (int i = 0; i < length; i++) {
			id[i] = ALPHABET[random.nextInt(ALPHABET.length)];
		}
		return new String(id);
	}
}
