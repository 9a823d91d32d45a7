package io.gqlextract.shopify.graphql.interfaces;

import com.google.common.util.concurrent.Uninterruptibles;

import java.util.concurrent.TimeUnit;

/**
 * Blocking timed wait used by the two suspension points of an extraction:
 * cost backpressure and bulk status polling.
 */
public interface Sleeper {

    /** Sleeps the current thread; interrupts are deferred until the wait is over. */
    Sleeper UNINTERRUPTIBLE = seconds -> Uninterruptibles.sleepUninterruptibly(seconds, TimeUnit.SECONDS);

    void sleepSeconds(long seconds);

}
