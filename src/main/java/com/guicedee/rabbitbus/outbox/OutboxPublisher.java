package com.guicedee.rabbitbus.outbox;

import com.rabbitmq.client.AMQP;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.rabbitmq.RabbitMQClient;
import lombok.extern.log4j.Log4j2;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Polls the outbox on a Vert.x periodic timer and publishes what is due.
 * <p>
 * Each cycle publishes at most {@code batchSize} messages. With ordering enabled messages go out one at a time
 * in insertion order and the cycle stops at the first failure, or at the oldest pending message still waiting for its retry.
 */
@Log4j2
public class OutboxPublisher
{
    private final Vertx vertx;
    private final RabbitMQClient client;
    private final OutboxStore store;
    private final OutboxOptions options;
    private final Clock clock;
    private final AtomicBoolean cycleRunning = new AtomicBoolean();

    private long publishTimerId = -1;
    private long cleanupTimerId = -1;

    public OutboxPublisher(Vertx vertx, RabbitMQClient client, OutboxStore store, OutboxOptions options)
    {
        this(vertx, client, store, options, Clock.systemUTC());
    }

    public OutboxPublisher(Vertx vertx, RabbitMQClient client, OutboxStore store, OutboxOptions options, Clock clock)
    {
        this.vertx = Objects.requireNonNull(vertx, "vertx");
        this.client = Objects.requireNonNull(client, "client");
        this.store = Objects.requireNonNull(store, "store");
        this.options = Objects.requireNonNull(options, "options").validate();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public synchronized void start()
    {
        if (publishTimerId >= 0)
        {
            return;
        }
        publishTimerId = vertx.setPeriodic(options.getPublishInterval().toMillis(), id -> publishPending());
        cleanupTimerId = vertx.setPeriodic(options.getCleanupInterval().toMillis(), id -> cleanup());
        log.info("Outbox publisher started, polling every {}ms with batches of {}", options.getPublishInterval().toMillis(),
                options.getBatchSize());
    }

    public synchronized void stop()
    {
        if (publishTimerId >= 0)
        {
            vertx.cancelTimer(publishTimerId);
            vertx.cancelTimer(cleanupTimerId);
            publishTimerId = -1;
            cleanupTimerId = -1;
            log.info("Outbox publisher stopped");
        }
    }

    public synchronized boolean isRunning()
    {
        return publishTimerId >= 0;
    }

    /**
     * Runs one publishing cycle. A cycle that starts while the previous one is still running does nothing.
     *
     * @return the number of messages published
     */
    public Future<Integer> publishPending()
    {
        if (!cycleRunning.compareAndSet(false, true))
        {
            return Future.succeededFuture(0);
        }
        List<OutboxMessage> due;
        try
        {
            due = options.isEnableOrdering() ? dueInOrder(clock.instant()) : store.fetchDue(options.getBatchSize(), clock.instant());
        }
        catch (RuntimeException e)
        {
            cycleRunning.set(false);
            log.error("Could not read the outbox", e);
            return Future.failedFuture(e);
        }
        Future<Integer> cycle = options.isEnableOrdering() ? publishInOrder(due, 0, 0) : publishConcurrently(due);
        return cycle.onComplete(result -> cycleRunning.set(false));
    }

    /**
     * Removes published and failed messages past their retention
     *
     * @return the number removed
     */
    public int cleanup()
    {
        Instant now = clock.instant();
        int removed = store.purge(now.minus(options.getProcessedRetention()), now.minus(options.getFailedRetention()));
        if (removed > 0)
        {
            log.debug("Removed {} expired outbox messages", removed);
        }
        return removed;
    }

    /**
     * The wait after the given number of failed attempts
     */
    Duration backoff(int attempts)
    {
        Duration delay = options.getRetryDelay();
        if (options.isUseExponentialBackoff() && attempts > 1)
        {
            delay = delay.multipliedBy(1L << Math.min(attempts - 1, 30));
        }
        return delay.compareTo(options.getMaxRetryDelay()) > 0 ? options.getMaxRetryDelay() : delay;
    }

    /**
     * The leading run of due messages. A newer message never overtakes an older one that is waiting for a retry.
     */
    private List<OutboxMessage> dueInOrder(Instant now)
    {
        List<OutboxMessage> pending = store.fetchPending(options.getBatchSize());
        List<OutboxMessage> due = new ArrayList<>(pending.size());
        for (OutboxMessage message : pending)
        {
            if (message.getNextAttemptAt() != null && message.getNextAttemptAt().isAfter(now))
            {
                log.trace("Ordered outbox cycle held at '{}' until {}", message.getId(), message.getNextAttemptAt());
                break;
            }
            due.add(message);
        }
        return due;
    }

    private Future<Integer> publishInOrder(List<OutboxMessage> batch, int index, int published)
    {
        if (index >= batch.size())
        {
            return Future.succeededFuture(published);
        }
        return publish(batch.get(index))
                .compose(sent -> sent ? publishInOrder(batch, index + 1, published + 1) : Future.succeededFuture(published));
    }

    private Future<Integer> publishConcurrently(List<OutboxMessage> batch)
    {
        if (batch.isEmpty())
        {
            return Future.succeededFuture(0);
        }
        Promise<Integer> promise = Promise.promise();
        AtomicInteger remaining = new AtomicInteger(batch.size());
        AtomicInteger published = new AtomicInteger();
        for (OutboxMessage message : batch)
        {
            publish(message).onComplete(result -> {
                if (result.succeeded() && Boolean.TRUE.equals(result.result()))
                {
                    published.incrementAndGet();
                }
                if (remaining.decrementAndGet() == 0)
                {
                    promise.complete(published.get());
                }
            });
        }
        return promise.future();
    }

    /**
     * @return true when published, false when the failure was recorded for a later attempt
     */
    private Future<Boolean> publish(OutboxMessage message)
    {
        Future<Void> sent;
        try
        {
            sent = client.basicPublish(message.getExchange(), message.getRoutingKey(), properties(message), Buffer.buffer(message.getPayload()));
        }
        catch (RuntimeException e)
        {
            sent = Future.failedFuture(e);
        }
        return sent.map(v -> {
            store.markPublished(message.getId(), clock.instant());
            log.trace("Published outbox message '{}' to '{}' / '{}'", message.getId(), message.getExchange(), message.getRoutingKey());
            return true;
        }).recover(failure -> {
            recordFailure(message, failure);
            return Future.succeededFuture(false);
        });
    }

    private void recordFailure(OutboxMessage message, Throwable failure)
    {
        int attempts = message.getAttempts() + 1;
        String error = failure.getMessage() == null ? failure.getClass().getName() : failure.getMessage();
        if (attempts >= options.getMaxRetries())
        {
            store.markFailed(message.getId(), error);
            log.error("Outbox message '{}' failed after {} attempts", message.getId(), attempts, failure);
        }
        else
        {
            Instant next = clock.instant().plus(backoff(attempts));
            store.markRetry(message.getId(), error, next);
            log.warn("Outbox message '{}' failed attempt {}, retrying at {} - {}", message.getId(), attempts, next, error);
        }
    }

    private static AMQP.BasicProperties properties(OutboxMessage message)
    {
        AMQP.BasicProperties.Builder properties = new AMQP.BasicProperties.Builder()
                .messageId(message.getId())
                .type(message.getMessageType())
                .correlationId(message.getCorrelationId())
                .contentType(message.getContentType())
                .headers(message.getHeaders())
                .deliveryMode(2);
        if (message.isCompressed())
        {
            properties.contentEncoding("gzip");
        }
        if (message.getPriority() != null)
        {
            properties.priority(message.getPriority());
        }
        if (message.getCreatedAt() != null)
        {
            properties.timestamp(Date.from(message.getCreatedAt()));
        }
        return properties.build();
    }
}
