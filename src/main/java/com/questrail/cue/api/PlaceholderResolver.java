package com.questrail.cue.api;

/**
 * Resolves a placeholder key (for example {@code %player_level%}) for an actor.
 *
 * <p>
 * Returning {@code null}, or returning the key itself, means the placeholder
 * is unknown to the host.
 * </p>
 *
 * @param <A> the host's actor type
 */
@FunctionalInterface
public interface PlaceholderResolver<A>
{
    String resolve(A actor, String key);
}
