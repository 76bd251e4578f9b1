package com.questrail.cue.config;

/**
 * Which scheduler implementation backs {@code delay} actions.
 */
public enum TimerBackend
{
    /** A {@link java.util.concurrent.ScheduledExecutorService}; millisecond precision. */
    EXECUTOR,

    /** A Netty hashed wheel timer ticking every 50 ms, one host tick. */
    WHEEL
}
