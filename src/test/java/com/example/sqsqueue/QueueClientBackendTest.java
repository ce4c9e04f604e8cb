package com.example.sqsqueue;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.amazonaws.services.sqs.AmazonSQS;
import com.amazonaws.services.sqs.model.GetQueueUrlRequest;
import com.amazonaws.services.sqs.model.GetQueueUrlResult;
import com.amazonaws.services.sqs.model.QueueDoesNotExistException;

/**
 * Interaction between the client and its backend, including failure paths.
 */
public class QueueClientBackendTest {

	private static final String URL = "https://sqs.us-west-2.amazonaws.com/123456789012/TEST_QUEUE";

	@Mock
	QueueBackend mockBackend;

	@Mock
	QueueManagement mockManagement;

	@Mock
	PurgeCompletionPoller mockPoller;

	@Mock
	AmazonSQS mockSqs;

	@Captor
	ArgumentCaptor<List<SendBatchEntry>> sendEntries;

	private QueueClient queue;

	@Before
	public void setUp() {
		MockitoAnnotations.initMocks(this);
		queue = new QueueClient(new QueueConfig("us-west-2", "TEST_QUEUE", 5), URL, mockBackend,
				new BatchEntriesTest.SequenceIdGenerator(), mockPoller);
	}

	@Test
	public void createResolvesUrlOnce() {
		when(mockManagement.resolveQueueUrl("TEST_QUEUE")).thenReturn(URL);

		QueueClient client = QueueClient.create(new QueueConfig("us-west-2", "TEST_QUEUE", 5), mockManagement, mockBackend);
		client.insert("a");
		client.approximateLength();

		assertEquals(URL, client.getQueueUrl());
		verify(mockManagement).resolveQueueUrl("TEST_QUEUE");
		verify(mockBackend).sendMessage(URL, "a");
	}

	@Test(expected = QueueResolutionException.class)
	public void createFailsWhenQueueCannotBeResolved() {
		when(mockManagement.resolveQueueUrl("TEST_QUEUE"))
				.thenThrow(new QueueResolutionException("TEST_QUEUE", new RuntimeException("no such queue")));

		QueueClient.create(new QueueConfig("us-west-2", "TEST_QUEUE", 5), mockManagement, mockBackend);
	}

	@Test
	public void connectedClientShutsDownItsSqsClient() {
		when(mockSqs.getQueueUrl(any(GetQueueUrlRequest.class))).thenReturn(new GetQueueUrlResult().withQueueUrl(URL));

		QueueClient client = QueueClient.bind(new QueueConfig("us-west-2", "TEST_QUEUE", 5), mockSqs);
		assertEquals(URL, client.getQueueUrl());
		verify(mockSqs, never()).shutdown();

		client.shutdown();
		client.shutdown();
		verify(mockSqs, times(1)).shutdown();
	}

	@Test
	public void failedResolutionShutsDownSqsClient() {
		when(mockSqs.getQueueUrl(any(GetQueueUrlRequest.class)))
				.thenThrow(new QueueDoesNotExistException("The specified queue does not exist."));

		try {
			QueueClient.bind(new QueueConfig("us-west-2", "TEST_QUEUE", 5), mockSqs);
			fail("expected QueueResolutionException");
		} catch (QueueResolutionException e) {
			verify(mockSqs).shutdown();
		}
	}

	@Test
	public void shutdownLeavesSuppliedBackendAlone() {
		queue.shutdown();
		verifyNoInteractions(mockBackend);
	}

	@Test
	public void createIfMissingCreatesQueue() {
		when(mockManagement.createQueue("TEST_QUEUE")).thenReturn(URL);

		QueueClient client = QueueClient.createIfMissing(new QueueConfig("us-west-2", "TEST_QUEUE", 5),
				mockManagement, mockBackend);

		assertEquals(URL, client.getQueueUrl());
		verify(mockManagement, never()).resolveQueueUrl(anyString());
	}

	@Test
	public void receiveUsesConfiguredVisibilityTimeout() {
		when(mockBackend.receiveMessages(URL, 10, 5)).thenReturn(Collections.<QueueMessage>emptyList());

		queue.peekBatch();

		verify(mockBackend).receiveMessages(URL, 10, 5);
	}

	@Test
	public void insertBatchAttachesGeneratedIds() {
		when(mockBackend.sendMessageBatch(eq(URL), anyList()))
				.thenReturn(BatchResult.allSucceeded(Arrays.asList("id1", "id2")));

		queue.insertBatch(Arrays.asList("a", "b"));

		verify(mockBackend).sendMessageBatch(eq(URL), sendEntries.capture());
		assertEquals(Arrays.asList(new SendBatchEntry("id1", "a"), new SendBatchEntry("id2", "b")),
				sendEntries.getValue());
	}

	@Test
	public void oversizedBatchNeverReachesBackend() {
		try {
			queue.deleteBatch(Collections.nCopies(11, new QueueMessage("a", "h", "m")));
			fail("expected IllegalArgumentException");
		} catch (IllegalArgumentException e) {
			verifyNoInteractions(mockBackend);
		}
	}

	@Test
	public void popOnEmptyQueueDoesNotDelete() {
		when(mockBackend.receiveMessages(URL, 1, 5)).thenReturn(Collections.<QueueMessage>emptyList());

		assertFalse(queue.pop().isPresent());
		verify(mockBackend, never()).deleteMessage(anyString(), anyString());
	}

	@Test
	public void popBatchOnEmptyQueueDoesNotDelete() {
		when(mockBackend.receiveMessages(URL, 10, 5)).thenReturn(Collections.<QueueMessage>emptyList());

		assertEquals(0, queue.popBatch().size());
		verify(mockBackend, never()).deleteMessageBatch(anyString(), anyList());
	}

	@Test
	public void popPropagatesDeleteFailure() {
		QueueMessage message = new QueueMessage("x", "handle-x", "msg-x");
		QueueBackendException failure = new QueueBackendException("DeleteMessage failed");
		when(mockBackend.receiveMessages(URL, 1, 5)).thenReturn(Arrays.asList(message));
		doThrow(failure).when(mockBackend).deleteMessage(URL, "handle-x");

		try {
			queue.pop();
			fail("expected QueueBackendException");
		} catch (QueueBackendException e) {
			assertSame(failure, e);
		}
	}

	@Test
	public void popBatchReportsUndeletedMessages() {
		List<QueueMessage> messages = Arrays.asList(
				new QueueMessage("a", "handle-a", "msg-a"),
				new QueueMessage("b", "handle-b", "msg-b"));
		BatchResult partial = new BatchResult(Arrays.asList("msg-a"),
				Arrays.asList(new BatchEntryFailure("msg-b", "ReceiptHandleIsInvalid", "expired", true)));
		when(mockBackend.receiveMessages(URL, 10, 5)).thenReturn(messages);
		when(mockBackend.deleteMessageBatch(eq(URL), anyList())).thenReturn(partial);

		try {
			queue.popBatch();
			fail("expected PartialBatchFailureException");
		} catch (PartialBatchFailureException e) {
			assertEquals(messages, e.getMessages());
			assertEquals("msg-b", e.getResult().getFailed().get(0).getId());
		}
	}

	@Test
	public void popBatchKeepsMessagesWhenDeleteCallFails() {
		List<QueueMessage> messages = Arrays.asList(
				new QueueMessage("a", "handle-a", "msg-a"),
				new QueueMessage("b", "handle-b", "msg-b"));
		QueueBackendException failure = new QueueBackendException("DeleteMessageBatch failed");
		when(mockBackend.receiveMessages(URL, 10, 5)).thenReturn(messages);
		when(mockBackend.deleteMessageBatch(eq(URL), anyList())).thenThrow(failure);

		try {
			queue.popBatch();
			fail("expected PartialBatchFailureException");
		} catch (PartialBatchFailureException e) {
			assertEquals(messages, e.getMessages());
			assertSame(failure, e.getCause());
			assertEquals(0, e.getResult().getSuccessful().size());
			assertEquals(2, e.getResult().getFailed().size());
			assertEquals("msg-a", e.getResult().getFailed().get(0).getId());
		}
	}

	@Test
	public void receiveFailurePropagates() {
		when(mockBackend.receiveMessages(anyString(), anyInt(), anyInt()))
				.thenThrow(new QueueBackendException("ReceiveMessage failed"));

		try {
			queue.peek();
			fail("expected QueueBackendException");
		} catch (QueueBackendException e) {
			verify(mockBackend, never()).deleteMessage(anyString(), anyString());
		}
	}

	@Test
	public void clearPurgesThenWaits() {
		queue.clear();

		verify(mockBackend).purgeQueue(URL);
		verify(mockPoller).awaitEmpty(mockBackend, URL);
	}

	@Test
	public void failedPurgeDoesNotWait() {
		doThrow(new QueueBackendException("PurgeQueueInProgress")).when(mockBackend).purgeQueue(URL);

		try {
			queue.clear();
			fail("expected QueueBackendException");
		} catch (QueueBackendException e) {
			verify(mockPoller, never()).awaitEmpty(any(QueueBackend.class), anyString());
		}
	}
}
