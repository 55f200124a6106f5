package com.agentloom.core.artifacts;

import com.agentloom.core.model.Part;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.IntStream;

/**
 * Volatile {@link ArtifactService} keeping every version in memory.
 */
public class InMemoryArtifactService implements ArtifactService {

    private static final Logger log = LoggerFactory.getLogger(InMemoryArtifactService.class);

    private final ConcurrentHashMap<String, List<Part>> artifacts = new ConcurrentHashMap<>();

    @Override
    public int saveArtifact(String appName, String userId, String sessionId, String filename, Part artifact) {
        Objects.requireNonNull(artifact, "artifact must not be null");
        List<Part> versions = artifacts.computeIfAbsent(path(appName, userId, sessionId, filename),
                k -> new ArrayList<>());
        synchronized (versions) {
            versions.add(artifact);
            int version = versions.size() - 1;
            log.debug("Saved artifact '{}' version {} for session {}", filename, version, sessionId);
            return version;
        }
    }

    @Override
    public Optional<Part> loadArtifact(String appName, String userId, String sessionId, String filename,
                                       Integer version) {
        List<Part> versions = artifacts.get(path(appName, userId, sessionId, filename));
        if (versions == null) {
            return Optional.empty();
        }
        synchronized (versions) {
            if (versions.isEmpty()) {
                return Optional.empty();
            }
            int index = version == null ? versions.size() - 1 : version;
            if (index < 0 || index >= versions.size()) {
                return Optional.empty();
            }
            return Optional.of(versions.get(index));
        }
    }

    @Override
    public List<String> listArtifactKeys(String appName, String userId, String sessionId) {
        String sessionPrefix = appName + "/" + userId + "/" + sessionId + "/";
        String userPrefix = appName + "/" + userId + "/user/";
        var keys = new TreeSet<String>();
        for (String path : artifacts.keySet()) {
            if (path.startsWith(sessionPrefix)) {
                keys.add(path.substring(sessionPrefix.length()));
            } else if (path.startsWith(userPrefix)) {
                keys.add(path.substring(userPrefix.length()));
            }
        }
        return List.copyOf(keys);
    }

    @Override
    public void deleteArtifact(String appName, String userId, String sessionId, String filename) {
        artifacts.remove(path(appName, userId, sessionId, filename));
    }

    @Override
    public List<Integer> listVersions(String appName, String userId, String sessionId, String filename) {
        List<Part> versions = artifacts.get(path(appName, userId, sessionId, filename));
        if (versions == null) {
            return List.of();
        }
        synchronized (versions) {
            return IntStream.range(0, versions.size()).boxed().toList();
        }
    }

    private static String path(String appName, String userId, String sessionId, String filename) {
        if (filename.startsWith(USER_NAMESPACE_PREFIX)) {
            return appName + "/" + userId + "/user/" + filename;
        }
        return appName + "/" + userId + "/" + sessionId + "/" + filename;
    }
}
