package com.guicedee.rabbitbus.outbox;

import com.guicedee.rabbitbus.fixtures.MutableClock;
import com.rabbitmq.client.AMQP;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.rabbitmq.RabbitMQClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static com.guicedee.rabbitbus.outbox.InMemoryOutboxStoreTest.message;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OutboxPublisherTest
{
    @Mock
    private Vertx vertx;
    @Mock
    private RabbitMQClient client;

    private MutableClock clock;
    private InMemoryOutboxStore store;

    @BeforeEach
    void setUp()
    {
        clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
        store = new InMemoryOutboxStore();
    }

    private OutboxPublisher publisher(OutboxOptions options)
    {
        return new OutboxPublisher(vertx, client, store, options, clock);
    }

    private void brokerAccepts()
    {
        when(client.basicPublish(anyString(), anyString(), any(AMQP.BasicProperties.class), any(Buffer.class)))
                .thenReturn(Future.succeededFuture());
    }

    @Test
    void publishesDueMessages() throws Exception
    {
        brokerAccepts();
        store.add(message("a"));
        store.add(message("b"));

        int published = publisher(OutboxOptions.defaults()).publishPending().toCompletionStage().toCompletableFuture().get();

        assertEquals(2, published);
        assertEquals(2, store.count(OutboxStatus.Published));
        assertEquals(0, store.count(OutboxStatus.Pending));
    }

    @Test
    void batchSizeLimitsOneCycle()
    {
        brokerAccepts();
        for (int i = 0; i < 5; i++)
        {
            store.add(message("m" + i));
        }

        publisher(OutboxOptions.builder().batchSize(3).build()).publishPending();

        assertEquals(3, store.count(OutboxStatus.Published));
        assertEquals(2, store.count(OutboxStatus.Pending));
    }

    @Test
    void publishedPropertiesCarryTheMessageMetadata()
    {
        brokerAccepts();
        store.add(message("a")
                .setMessageType("com.acme.OrderCreated")
                .setCorrelationId("corr-1")
                .setCompressed(true)
                .setPriority(7));

        publisher(OutboxOptions.defaults()).publishPending();

        ArgumentCaptor<AMQP.BasicProperties> properties = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
        verify(client).basicPublish(eq("orders"), eq("orders.created"), properties.capture(), any(Buffer.class));
        assertEquals("a", properties.getValue().getMessageId());
        assertEquals("com.acme.OrderCreated", properties.getValue().getType());
        assertEquals("corr-1", properties.getValue().getCorrelationId());
        assertEquals("gzip", properties.getValue().getContentEncoding());
        assertEquals(7, properties.getValue().getPriority());
        assertEquals(2, properties.getValue().getDeliveryMode());
    }

    @Test
    void failedPublishIsRetriedWithBackoff()
    {
        when(client.basicPublish(anyString(), anyString(), any(AMQP.BasicProperties.class), any(Buffer.class)))
                .thenReturn(Future.failedFuture(new IOException("channel closed")));
        store.add(message("a"));
        OutboxPublisher publisher = publisher(OutboxOptions.builder().retryDelay(Duration.ofSeconds(5)).maxRetries(3).build());

        publisher.publishPending();

        assertTrue(store.fetchDue(10, clock.instant()).isEmpty());
        OutboxMessage retried = store.fetchDue(10, clock.instant().plusSeconds(5)).get(0);
        assertEquals(1, retried.getAttempts());
        assertEquals("channel closed", retried.getLastError());
    }

    @Test
    void messageFailsOnceRetriesAreExhausted()
    {
        when(client.basicPublish(anyString(), anyString(), any(AMQP.BasicProperties.class), any(Buffer.class)))
                .thenReturn(Future.failedFuture(new IOException("channel closed")));
        store.add(message("a"));
        OutboxPublisher publisher = publisher(OutboxOptions.builder().retryDelay(Duration.ofSeconds(1)).maxRetries(2).build());

        publisher.publishPending();
        clock.advance(Duration.ofSeconds(1));
        publisher.publishPending();

        assertEquals(1, store.count(OutboxStatus.Failed));
        assertEquals(0, store.count(OutboxStatus.Pending));
    }

    @Test
    void orderedCycleStopsAtTheFirstFailure()
    {
        when(client.basicPublish(anyString(), anyString(), any(AMQP.BasicProperties.class), any(Buffer.class)))
                .thenReturn(Future.succeededFuture(), Future.failedFuture(new IOException("nack")));
        store.add(message("first"));
        store.add(message("second"));
        store.add(message("third"));

        publisher(OutboxOptions.builder().enableOrdering(true).build()).publishPending();

        verify(client, times(2)).basicPublish(anyString(), anyString(), any(AMQP.BasicProperties.class), any(Buffer.class));
        assertEquals(1, store.count(OutboxStatus.Published));
        assertEquals("third", store.fetchDue(10, clock.instant()).get(0).getId());
    }

    @Test
    void orderedPublishingWaitsForTheOldestRetry() throws Exception
    {
        when(client.basicPublish(anyString(), anyString(), any(AMQP.BasicProperties.class), any(Buffer.class)))
                .thenReturn(Future.failedFuture(new IOException("nack")), Future.succeededFuture());
        store.add(message("first"));
        store.add(message("second"));
        store.add(message("third"));
        OutboxPublisher publisher = publisher(OutboxOptions.builder()
                .enableOrdering(true)
                .retryDelay(Duration.ofSeconds(10))
                .build());

        int firstCycle = publisher.publishPending().toCompletionStage().toCompletableFuture().get();
        clock.advance(Duration.ofSeconds(1));
        int heldCycle = publisher.publishPending().toCompletionStage().toCompletableFuture().get();
        assertEquals(0, firstCycle);
        assertEquals(0, heldCycle);
        assertEquals(3, store.count(OutboxStatus.Pending));

        clock.advance(Duration.ofSeconds(10));
        int retryCycle = publisher.publishPending().toCompletionStage().toCompletableFuture().get();
        assertEquals(3, retryCycle);

        ArgumentCaptor<AMQP.BasicProperties> properties = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
        verify(client, times(4)).basicPublish(anyString(), anyString(), properties.capture(), any(Buffer.class));
        assertEquals(List.of("first", "first", "second", "third"),
                properties.getAllValues().stream().map(AMQP.BasicProperties::getMessageId).collect(Collectors.toList()));
    }

    @Test
    void unorderedPublishingSkipsMessagesWaitingForRetry()
    {
        when(client.basicPublish(anyString(), anyString(), any(AMQP.BasicProperties.class), any(Buffer.class)))
                .thenReturn(Future.failedFuture(new IOException("nack")), Future.succeededFuture());
        store.add(message("first"));
        OutboxPublisher publisher = publisher(OutboxOptions.builder().retryDelay(Duration.ofSeconds(10)).build());

        publisher.publishPending();
        store.add(message("second"));
        clock.advance(Duration.ofSeconds(1));
        publisher.publishPending();

        assertEquals(1, store.count(OutboxStatus.Published));
        assertEquals("first", store.fetchPending(10).get(0).getId());
    }

    @Test
    void clientExceptionIsRecordedAsFailure()
    {
        when(client.basicPublish(anyString(), anyString(), any(AMQP.BasicProperties.class), any(Buffer.class)))
                .thenThrow(new IllegalStateException("not connected"));
        store.add(message("a"));

        publisher(OutboxOptions.defaults()).publishPending();

        assertEquals("not connected", store.fetchDue(10, clock.instant().plus(Duration.ofMinutes(10))).get(0).getLastError());
    }

    @Test
    void backoffDoublesUpToTheMaximum()
    {
        OutboxPublisher publisher = publisher(OutboxOptions.builder()
                .retryDelay(Duration.ofSeconds(5))
                .maxRetryDelay(Duration.ofMinutes(5))
                .build());

        assertEquals(Duration.ofSeconds(5), publisher.backoff(1));
        assertEquals(Duration.ofSeconds(10), publisher.backoff(2));
        assertEquals(Duration.ofSeconds(20), publisher.backoff(3));
        assertEquals(Duration.ofMinutes(5), publisher.backoff(10));

        OutboxPublisher linear = publisher(OutboxOptions.builder().useExponentialBackoff(false).build());
        assertEquals(Duration.ofSeconds(5), linear.backoff(4));
    }

    @Test
    void cleanupPurgesPastRetention()
    {
        store.add(message("a"));
        store.markPublished("a", clock.instant());
        OutboxPublisher publisher = publisher(OutboxOptions.defaults());

        assertEquals(0, publisher.cleanup());
        clock.advance(Duration.ofDays(8));
        assertEquals(1, publisher.cleanup());
    }

    @Test
    void startSchedulesTimersOnce()
    {
        when(vertx.setPeriodic(anyLong(), any())).thenReturn(11L, 12L);
        OutboxPublisher publisher = publisher(OutboxOptions.defaults());

        publisher.start();
        publisher.start();
        assertTrue(publisher.isRunning());
        verify(vertx).setPeriodic(eq(1000L), any());
        verify(vertx).setPeriodic(eq(Duration.ofHours(1).toMillis()), any());

        publisher.stop();
        assertFalse(publisher.isRunning());
        verify(vertx).cancelTimer(11L);
        verify(vertx).cancelTimer(12L);
    }

    @Test
    void invalidOptionsAreRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> publisher(OutboxOptions.builder().batchSize(0).build()));
    }
}
