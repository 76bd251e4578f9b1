package com.questrail.cue.internal.time;

import java.time.Instant;

/**
 * Wall-clock source used strictly to timestamp observability events.
 * It MUST NOT be used for delay deadlines or execution durations.
 */
public interface WallClock
{
    Instant now();
}
