package com.example.sqsqueue;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;

/**
 * Parameters needed to bind a {@link QueueClient} to a queue. Validated once,
 * at construction.
 */
public final class QueueConfig {

	public static final String REGION_KEY = "queue.region";
	public static final String NAME_KEY = "queue.name";
	public static final String VISIBILITY_TIMEOUT_KEY = "queue.visibilityTimeoutSeconds";

	/* AWS region the queue lives in, e.g. 'us-west-2' */
	private final String region;
	private final String name;
	/* time a received message stays hidden from other receivers */
	private final int visibilityTimeoutSeconds;

	public QueueConfig(String region, String name, int visibilityTimeoutSeconds) {
		if (Strings.isNullOrEmpty(region))
			throw new QueueConfigurationException("Region must not be empty");
		if (Strings.isNullOrEmpty(name))
			throw new QueueConfigurationException("Queue name must not be empty");
		// zero is legal for SQS, but every received message would reappear at once
		if (visibilityTimeoutSeconds <= 0)
			throw new QueueConfigurationException(
					"Visibility timeout must be greater than 0, was " + visibilityTimeoutSeconds);

		this.region = region;
		this.name = name;
		this.visibilityTimeoutSeconds = visibilityTimeoutSeconds;
	}

	public static QueueConfig fromProperties(Properties properties) {
		String timeout = properties.getProperty(VISIBILITY_TIMEOUT_KEY);
		if (Strings.isNullOrEmpty(timeout))
			throw new QueueConfigurationException("Missing property '" + VISIBILITY_TIMEOUT_KEY + "'");

		int visibilityTimeoutSeconds;
		try {
			visibilityTimeoutSeconds = Integer.parseInt(timeout.trim());
		} catch (NumberFormatException e) {
			throw new QueueConfigurationException(
					"Property '" + VISIBILITY_TIMEOUT_KEY + "' is not a number: " + timeout, e);
		}
		return new QueueConfig(properties.getProperty(REGION_KEY), properties.getProperty(NAME_KEY),
				visibilityTimeoutSeconds);
	}

	/**
	 * Reads the configuration from a properties file on the classpath.
	 */
	public static QueueConfig load(String resource) {
		Properties properties = new Properties();
		try (InputStream in = QueueConfig.class.getClassLoader().getResourceAsStream(resource)) {
			if (in == null)
				throw new QueueConfigurationException("Resource '" + resource + "' not found on classpath");
			properties.load(in);
		} catch (IOException e) {
			throw new QueueConfigurationException("Could not read '" + resource + "'", e);
		}
		return fromProperties(properties);
	}

	public String getRegion() {
		return region;
	}

	public String getName() {
		return name;
	}

	public int getVisibilityTimeoutSeconds() {
		return visibilityTimeoutSeconds;
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this)
				.add("region", region)
				.add("name", name)
				.add("visibilityTimeoutSeconds", visibilityTimeoutSeconds)
				.toString();
	}
}
