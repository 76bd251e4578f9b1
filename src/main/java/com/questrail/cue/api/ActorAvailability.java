package com.questrail.cue.api;

/**
 * Liveness probe consulted before every action of a sequence.
 *
 * @param <A> the host's actor type
 */
@FunctionalInterface
public interface ActorAvailability<A>
{
    boolean isAvailable(A actor);

    static <A> ActorAvailability<A> always() {
        return actor -> true;
    }
}
