package com.agentloom.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * An immutable record of one occurrence in a session: a message, a tool call or result,
 * a requested state mutation or a control signal.
 * <p>
 * Events are produced by agents and callbacks, committed exactly once by the runner and
 * appended to the session history. Partial events are streaming fragments; they are
 * forwarded to the caller but never committed.
 *
 * @param id            unique event id
 * @param invocationId  the top-level invocation that produced the event
 * @param author        "user" or the name of the producing agent
 * @param content       message payload (nullable for pure state or control events)
 * @param actions       side effects to apply on commit, never null
 * @param partial       true for a streaming fragment
 * @param turnComplete  true when the model signalled the end of its turn
 * @param branch        dot-separated ancestry of the producing agent (nullable at top level)
 * @param errorCode     error code for failure events (nullable)
 * @param errorMessage  error detail for failure events (nullable)
 * @param timestamp     creation time
 */
public record Event(
    String id,
    String invocationId,
    String author,
    Content content,
    EventActions actions,
    boolean partial,
    boolean turnComplete,
    String branch,
    String errorCode,
    String errorMessage,
    Instant timestamp
) implements Serializable {

    public Event {
        if (actions == null) {
            actions = EventActions.empty();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .invocationId(invocationId)
                .author(author)
                .content(content)
                .actions(actions)
                .partial(partial)
                .turnComplete(turnComplete)
                .branch(branch)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .timestamp(timestamp);
    }

    public List<FunctionCall> functionCalls() {
        return content == null ? List.of() : content.functionCalls();
    }

    public List<FunctionResponse> functionResponses() {
        return content == null ? List.of() : content.functionResponses();
    }

    public String text() {
        return content == null ? "" : content.text();
    }

    public boolean isError() {
        return errorCode != null;
    }

    /**
     * True when this event is the final answer of its author for the current turn.
     */
    public boolean isFinalResponse() {
        if (actions.skipSummarization()) {
            return true;
        }
        return !partial && functionCalls().isEmpty() && functionResponses().isEmpty();
    }

    public static final class Builder {

        private String id;
        private String invocationId;
        private String author;
        private Content content;
        private EventActions actions;
        private boolean partial;
        private boolean turnComplete;
        private String branch;
        private String errorCode;
        private String errorMessage;
        private Instant timestamp;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder invocationId(String invocationId) {
            this.invocationId = invocationId;
            return this;
        }

        public Builder author(String author) {
            this.author = author;
            return this;
        }

        public Builder content(Content content) {
            this.content = content;
            return this;
        }

        public Builder actions(EventActions actions) {
            this.actions = actions;
            return this;
        }

        public Builder partial(boolean partial) {
            this.partial = partial;
            return this;
        }

        public Builder turnComplete(boolean turnComplete) {
            this.turnComplete = turnComplete;
            return this;
        }

        public Builder branch(String branch) {
            this.branch = branch;
            return this;
        }

        public Builder errorCode(String errorCode) {
            this.errorCode = errorCode;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Event build() {
            return new Event(
                    id != null ? id : UUID.randomUUID().toString(),
                    invocationId, author, content, actions, partial, turnComplete,
                    branch, errorCode, errorMessage,
                    timestamp != null ? timestamp : Instant.now());
        }
    }
}
