package com.questrail.cue.api;

/**
 * Answers whether an actor holds a permission node.
 *
 * @param <A> the host's actor type
 */
@FunctionalInterface
public interface PermissionLookup<A>
{
    boolean hasPermission(A actor, String node);
}
