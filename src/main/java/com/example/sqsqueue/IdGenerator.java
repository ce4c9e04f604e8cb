package com.example.sqsqueue;

/**
 * Source of the ids attached to batch request entries.
 */
public interface IdGenerator {

	String nextId();
}
