package com.example.sqsqueue;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Properties;

import org.junit.Test;

public class QueueConfigTest {

	@Test
	public void validConfig() {
		QueueConfig config = new QueueConfig("us-west-2", "orders", 30);
		assertEquals("us-west-2", config.getRegion());
		assertEquals("orders", config.getName());
		assertEquals(30, config.getVisibilityTimeoutSeconds());
	}

	@Test(expected = QueueConfigurationException.class)
	public void zeroVisibilityTimeout() {
		new QueueConfig("us-west-2", "orders", 0);
	}

	@Test(expected = QueueConfigurationException.class)
	public void negativeVisibilityTimeout() {
		new QueueConfig("us-west-2", "orders", -1);
	}

	@Test(expected = IllegalArgumentException.class)
	public void zeroVisibilityTimeoutIsAlsoAnIllegalArgument() {
		new QueueConfig("", "", 0);
	}

	@Test(expected = QueueConfigurationException.class)
	public void emptyRegion() {
		new QueueConfig("", "orders", 5);
	}

	@Test(expected = QueueConfigurationException.class)
	public void nullName() {
		new QueueConfig("us-west-2", null, 5);
	}

	@Test
	public void fromProperties() {
		Properties properties = new Properties();
		properties.setProperty(QueueConfig.REGION_KEY, "eu-west-1");
		properties.setProperty(QueueConfig.NAME_KEY, "jobs");
		properties.setProperty(QueueConfig.VISIBILITY_TIMEOUT_KEY, " 12 ");

		QueueConfig config = QueueConfig.fromProperties(properties);
		assertEquals("eu-west-1", config.getRegion());
		assertEquals("jobs", config.getName());
		assertEquals(12, config.getVisibilityTimeoutSeconds());
	}

	@Test(expected = QueueConfigurationException.class)
	public void fromPropertiesWithZeroTimeout() {
		Properties properties = new Properties();
		properties.setProperty(QueueConfig.REGION_KEY, "eu-west-1");
		properties.setProperty(QueueConfig.NAME_KEY, "jobs");
		properties.setProperty(QueueConfig.VISIBILITY_TIMEOUT_KEY, "0");
		QueueConfig.fromProperties(properties);
	}

	@Test
	public void fromPropertiesWithNonNumericTimeout() {
		Properties properties = new Properties();
		properties.setProperty(QueueConfig.REGION_KEY, "eu-west-1");
		properties.setProperty(QueueConfig.NAME_KEY, "jobs");
		properties.setProperty(QueueConfig.VISIBILITY_TIMEOUT_KEY, "soon");
		try {
			QueueConfig.fromProperties(properties);
		} catch (QueueConfigurationException e) {
			assertTrue(e.getCause() instanceof NumberFormatException);
			return;
		}
		throw new AssertionError("non-numeric timeout accepted");
	}

	@Test(expected = QueueConfigurationException.class)
	public void fromPropertiesWithoutTimeout() {
		QueueConfig.fromProperties(new Properties());
	}

	@Test
	public void loadFromClasspath() {
		QueueConfig config = QueueConfig.load("queue-test.properties");
		assertEquals("us-west-2", config.getRegion());
		assertEquals("TEST_QUEUE", config.getName());
		assertEquals(5, config.getVisibilityTimeoutSeconds());
	}

	@Test(expected = QueueConfigurationException.class)
	public void loadMissingResource() {
		QueueConfig.load("does-not-exist.properties");
	}
}
