package com.example.sqsqueue;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import java.util.Random;

import org.junit.Test;

public class RandomIdGeneratorTest {

	@Test
	public void fixedLengthAlphanumeric() {
		RandomIdGenerator generator = new RandomIdGenerator();
		for (int i = 0; i < 100; i++) {
			String id = generator.nextId();
			assertEquals(RandomIdGenerator.DEFAULT_LENGTH, id.length());
			assertTrue(id, id.matches("[A-Za-z0-9]+"));
		}
	}

	@Test
	public void sameSeedSameIds() {
		RandomIdGenerator first = new RandomIdGenerator(new Random(42L));
		RandomIdGenerator second = new RandomIdGenerator(new Random(42L));
		assertEquals(first.nextId(), second.nextId());
		assertEquals(first.nextId(), second.nextId());
	}

	@Test
	public void consecutiveIdsDiffer() {
		RandomIdGenerator generator = new RandomIdGenerator(new Random(7L));
		assertNotEquals(generator.nextId(), generator.nextId());
	}

	@Test(expected = IllegalArgumentException.class)
	public void lengthAboveSqsLimit() {
		new RandomIdGenerator(new Random(), 81);
	}
}
