package com.libragraph.cas.core.stream;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.tuples.Tuple2;

/**
 * Fan-out of one chunk stream to several independent consumers.
 *
 * <p>The shared stream connects to its source only once every expected consumer has
 * subscribed, and requests from the source only as fast as the slowest consumer
 * drains, so buffering stays bounded. A source failure reaches every consumer as the
 * same exception instance. When all consumers have cancelled, the source is cancelled too.
 *
 * <p>A split stream is single-use: create it inside the subscription that consumes it
 * (e.g. in {@code Uni.createFrom().deferred(...)}).
 */
public final class StreamTee {

    private StreamTee() {
    }

    /**
     * Shares {@code source} between exactly {@code consumers} subscribers.
     */
    public static <T> Multi<T> split(Multi<T> source, int consumers) {
        if (consumers < 1) {
            throw new IllegalArgumentException("consumers must be >= 1, got: " + consumers);
        }
        return source.broadcast()
                .withCancellationAfterLastSubscriberDeparture()
                .toAtLeast(consumers);
    }

    /**
     * Runs two consumers of the same split stream together. Subscribes {@code first}
     * before {@code second}. Completes when both have completed; the first failure
     * cancels the other consumer and is propagated unchanged.
     */
    public static <A, B> Uni<Tuple2<A, B>> both(Uni<A> first, Uni<B> second) {
        return Uni.combine().all().unis(first, second).asTuple();
    }
}
