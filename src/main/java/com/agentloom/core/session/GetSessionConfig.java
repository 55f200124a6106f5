package com.agentloom.core.session;

import java.time.Instant;

/**
 * Optional filters applied to the event history returned by {@link SessionService#getSession}.
 *
 * @param numRecentEvents keep only the most recent N events (null for all)
 * @param afterTimestamp  keep only events strictly after this instant (null for all)
 */
public record GetSessionConfig(Integer numRecentEvents, Instant afterTimestamp) {

    private static final GetSessionConfig ALL = new GetSessionConfig(null, null);

    public static GetSessionConfig all() {
        return ALL;
    }

    public static GetSessionConfig recent(int numRecentEvents) {
        return new GetSessionConfig(numRecentEvents, null);
    }

    public static GetSessionConfig after(Instant afterTimestamp) {
        return new GetSessionConfig(null, afterTimestamp);
    }
}
