package com.agentloom.core.agents;

import com.agentloom.core.artifacts.ArtifactService;
import com.agentloom.core.model.Content;
import com.agentloom.core.model.EventActions;
import com.agentloom.core.model.Part;
import com.agentloom.core.session.State;

import java.util.List;
import java.util.Optional;

/**
 * What a callback sees: the invocation, a writable {@link State} view and the pending
 * {@link EventActions} of the step. Nothing written here is visible to other steps until
 * the event carrying these actions is committed.
 */
public class CallbackContext {

    protected final InvocationContext invocationContext;
    private final EventActions.Builder actions;
    private final State state;

    public CallbackContext(InvocationContext invocationContext) {
        this(invocationContext, EventActions.builder());
    }

    public CallbackContext(InvocationContext invocationContext, EventActions.Builder actions) {
        this.invocationContext = invocationContext;
        this.actions = actions;
        this.state = new State(invocationContext.session().state(), actions);
    }

    public InvocationContext invocationContext() {
        return invocationContext;
    }

    public String invocationId() {
        return invocationContext.invocationId();
    }

    public String agentName() {
        return invocationContext.agent() == null ? null : invocationContext.agent().name();
    }

    public String branch() {
        return invocationContext.branch();
    }

    public Content userContent() {
        return invocationContext.userContent();
    }

    public State state() {
        return state;
    }

    /** Pending actions of the current step. */
    public EventActions.Builder actions() {
        return actions;
    }

    /** Stops the invocation after the current event is committed. */
    public void endInvocation() {
        invocationContext.setEndInvocation();
    }

    /**
     * Saves a new artifact version and records it in the pending {@code artifactDelta}.
     */
    public int saveArtifact(String filename, Part artifact) {
        var session = invocationContext.session();
        int version = artifacts().saveArtifact(session.appName(), session.userId(), session.id(), filename, artifact);
        actions.putArtifact(filename, version);
        return version;
    }

    public Optional<Part> loadArtifact(String filename, Integer version) {
        var session = invocationContext.session();
        return artifacts().loadArtifact(session.appName(), session.userId(), session.id(), filename, version);
    }

    public Optional<Part> loadArtifact(String filename) {
        return loadArtifact(filename, null);
    }

    public List<String> listArtifacts() {
        var session = invocationContext.session();
        return artifacts().listArtifactKeys(session.appName(), session.userId(), session.id());
    }

    private ArtifactService artifacts() {
        ArtifactService service = invocationContext.artifactService();
        if (service == null) {
            throw new IllegalStateException("No artifact service configured for this invocation");
        }
        return service;
    }
}
