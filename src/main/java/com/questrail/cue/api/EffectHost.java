package com.questrail.cue.api;

import java.time.Duration;

/**
 * EffectHost
 * =============================================================================
 * The host-platform side of every non-control action.
 *
 * <p>
 * The executor calls exactly one method per executed action and treats any
 * exception thrown here as a failure of that action only.
 * </p>
 *
 * <h2>Threading</h2>
 * Text, sound and title effects are called on the thread driving the sequence.
 * {@link #runAsActor} and {@link #runAsHost} are called on the configured
 * command executor, which is typically the host's main thread.
 *
 * @param <A> the host's actor type
 */
public interface EffectHost<A>
{
    void sendText(A actor, String text);

    void sendActionBar(A actor, String text);

    void playSound(A actor, String sound, float volume, float pitch);

    void showTitle(A actor, String title, String subtitle, Duration fadeIn, Duration stay, Duration fadeOut);

    void runAsActor(A actor, String command);

    void runAsHost(A actor, String command);
}
