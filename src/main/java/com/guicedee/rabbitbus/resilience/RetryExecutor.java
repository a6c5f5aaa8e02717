package com.guicedee.rabbitbus.resilience;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import lombok.extern.log4j.Log4j2;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Runs an asynchronous action again on failure, waiting on Vert.x timers between attempts
 */
@Log4j2
public class RetryExecutor
{
    private final Vertx vertx;
    private final RetryPolicyConfiguration policy;

    public RetryExecutor(Vertx vertx, RetryPolicyConfiguration policy)
    {
        this.vertx = Objects.requireNonNull(vertx, "vertx");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * @return the first successful result, or the last failure once the policy stops retrying
     */
    public <T> Future<T> execute(Supplier<Future<T>> action)
    {
        Objects.requireNonNull(action, "action");
        Promise<T> promise = Promise.promise();
        attempt(action, 0, promise);
        return promise.future();
    }

    private <T> void attempt(Supplier<Future<T>> action, int retriesDone, Promise<T> promise)
    {
        Future<T> future;
        try
        {
            future = Objects.requireNonNull(action.get(), "action returned no future");
        }
        catch (RuntimeException e)
        {
            future = Future.failedFuture(e);
        }
        future.onComplete(result -> {
            if (result.succeeded())
            {
                promise.complete(result.result());
                return;
            }
            Throwable cause = result.cause();
            int retry = retriesDone + 1;
            if (retry > policy.getRetryCount() || !policy.shouldRetry(cause))
            {
                log.debug("Giving up after {} retries - {}", retriesDone, cause.getMessage());
                promise.fail(cause);
                return;
            }
            long delay = policy.getDelay(retry).toMillis();
            log.debug("Retry {} of {} in {}ms - {}", retry, policy.getRetryCount(), delay, cause.getMessage());
            if (delay < 1)
            {
                vertx.runOnContext(v -> attempt(action, retry, promise));
            }
            else
            {
                vertx.setTimer(delay, timerId -> attempt(action, retry, promise));
            }
        });
    }
}
