package com.questrail.statestore.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used to timestamp observability events.
 *
 * <p>It may jump (NTP, manual changes) and MUST NOT drive delays.</p>
 */
public interface WallClock
{
    Instant now();
}
