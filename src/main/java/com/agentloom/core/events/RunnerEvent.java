package com.agentloom.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A lifecycle notification published by the runner, for observers such as progress
 * displays or audit logs. Not to be confused with session events.
 *
 * @param eventType    e.g. "invocation.started", "event.committed", "invocation.failed"
 * @param sessionId    the session the invocation runs in
 * @param invocationId the invocation this notification belongs to
 * @param author       author of the committed event (nullable for invocation-level notifications)
 * @param payload      arbitrary key-value data associated with the notification
 * @param timestamp    when it occurred
 */
public record RunnerEvent(
    String eventType,
    String sessionId,
    String invocationId,
    String author,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String INVOCATION_STARTED = "invocation.started";
    public static final String EVENT_COMMITTED = "event.committed";
    public static final String INVOCATION_COMPLETED = "invocation.completed";
    public static final String INVOCATION_ENDED = "invocation.ended";
    public static final String INVOCATION_FAILED = "invocation.failed";

    /** True for the last notification an invocation publishes. */
    public boolean isTerminal() {
        return INVOCATION_COMPLETED.equals(eventType)
                || INVOCATION_ENDED.equals(eventType)
                || INVOCATION_FAILED.equals(eventType);
    }
}
