package com.example.sqsqueue;

import com.amazonaws.services.sqs.AmazonSQS;
import com.amazonaws.services.sqs.AmazonSQSClientBuilder;
import com.google.common.base.Strings;

/**
 * Builds region-scoped SQS clients. Credentials come from the SDK's default
 * provider chain.
 */
public final class SqsClientFactory {

	private SqsClientFactory() {/*Exists only to defeat instantiation*/}

	public static AmazonSQS create(String region) {
		if (Strings.isNullOrEmpty(region))
			throw new IllegalArgumentException("Region must not be empty");

		return AmazonSQSClientBuilder.standard()
				.withRegion(region)
				.build();
	}
}
