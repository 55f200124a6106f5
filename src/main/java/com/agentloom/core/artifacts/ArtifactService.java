package com.agentloom.core.artifacts;

import com.agentloom.core.model.Part;

import java.util.List;
import java.util.Optional;

/**
 * Versioned binary/text blobs attached to a session. Filenames starting with
 * {@code user:} are shared by all sessions of the user.
 */
public interface ArtifactService {

    String USER_NAMESPACE_PREFIX = "user:";

    /**
     * Stores a new version of the artifact.
     *
     * @return the version number, starting at 0 for the first save
     */
    int saveArtifact(String appName, String userId, String sessionId, String filename, Part artifact);

    /**
     * Loads the given version, or the latest when {@code version} is null.
     */
    Optional<Part> loadArtifact(String appName, String userId, String sessionId, String filename, Integer version);

    /** Sorted filenames visible from the session, including the user-scoped ones. */
    List<String> listArtifactKeys(String appName, String userId, String sessionId);

    void deleteArtifact(String appName, String userId, String sessionId, String filename);

    List<Integer> listVersions(String appName, String userId, String sessionId, String filename);
}
